package com.jobsearch.query;

import java.util.Arrays;
import java.util.Optional;

public enum LogicalOperator {
    AND,
    OR,
    NOT;

    public static Optional<LogicalOperator> fromValue(String value) {
        return Arrays.stream(values())
            .filter(operator -> operator.name().equals(value))
            .findFirst();
    }
}
