package com.jobsearch.query;

import java.util.Arrays;
import java.util.Optional;

/**
 * Поля, по которым можно искать вакансии.
 */
public enum FieldType {
    ORGANIZATION("organization"),
    TECHNOLOGY("technology"),
    JOB_FUNCTION("job_function");

    private final String value;

    FieldType(String value) {
        this.value = value;
    }

    public static Optional<FieldType> fromValue(String value) {
        return Arrays.stream(values())
            .filter(field -> field.value.equals(value))
            .findFirst();
    }
}
