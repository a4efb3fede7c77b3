package com.jobsearch.service;

/**
 * Ошибка выполнения поискового SQL. Подробности уже записаны в лог,
 * клиенту уходит только "Internal server error".
 */
public class SearchExecutionException extends RuntimeException {

    public SearchExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
