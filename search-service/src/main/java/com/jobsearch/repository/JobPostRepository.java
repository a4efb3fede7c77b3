package com.jobsearch.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.jobsearch.entity.JobPost;

/**
 * Репозиторий для работы с таблицей job_posts.
 *
 * Стандартные методы JpaRepository плюс {@link JobPostSearchRepository#search}:
 * выполнение SQL, собранного компилятором запросов.
 */
@Repository
public interface JobPostRepository extends JpaRepository<JobPost, Long>, JobPostSearchRepository {
}
