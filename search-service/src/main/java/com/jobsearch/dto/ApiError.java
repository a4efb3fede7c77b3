package com.jobsearch.dto;

import lombok.Value;

/**
 * Тело ответа с ошибкой: {"status": "error", "detail": "..."}.
 */
@Value
public class ApiError {

    String status;
    String detail;

    public static ApiError of(String detail) {
        return new ApiError("error", detail);
    }
}
