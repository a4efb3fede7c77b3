package com.jobsearch.query;

import lombok.Value;

/**
 * Листовой узел: поле {@code field} содержит {@code value} как подстроку
 * (без учёта регистра).
 */
@Value
public class Condition implements QueryNode {

    public static final String TYPE = "condition";

    FieldType field;
    String value;

    public static Condition of(FieldType field, String value) {
        return new Condition(field, value);
    }

    @Override
    public String type() {
        return TYPE;
    }
}
