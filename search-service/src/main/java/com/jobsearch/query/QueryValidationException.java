package com.jobsearch.query;

/**
 * Некорректный поисковый запрос (неизвестный тип узла, поле, оператор,
 * неверное число потомков, лимит вне диапазона).
 *
 * Отдаётся клиенту как HTTP 400 с текстом причины.
 */
public class QueryValidationException extends RuntimeException {

    public QueryValidationException(String message) {
        super(message);
    }
}
