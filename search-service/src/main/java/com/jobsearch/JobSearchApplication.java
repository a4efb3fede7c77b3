package com.jobsearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Точка входа в сервис поиска вакансий.
 *
 * Пул соединений (HikariCP) создаёт Spring при старте и закрывает при остановке,
 * в обработчики запросов он попадает через репозиторий.
 */
@SpringBootApplication
public class JobSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(JobSearchApplication.class, args);
    }
}
