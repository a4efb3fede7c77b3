package com.jobsearch.query;

import java.util.List;

import lombok.Value;

/**
 * Логический оператор над дочерними узлами.
 *
 * NOT должен иметь ровно одного потомка, AND / OR - одного или больше.
 * Арность проверяет {@code QueryCompiler}, конструктор только копирует список.
 */
@Value
public class Operator implements QueryNode {

    public static final String TYPE = "operator";

    LogicalOperator operator;
    List<QueryNode> children;

    public Operator(LogicalOperator operator, List<QueryNode> children) {
        this.operator = operator;
        this.children = children == null ? List.of() : List.copyOf(children);
    }

    public static Operator and(QueryNode... children) {
        return new Operator(LogicalOperator.AND, List.of(children));
    }

    public static Operator or(QueryNode... children) {
        return new Operator(LogicalOperator.OR, List.of(children));
    }

    public static Operator not(QueryNode child) {
        return new Operator(LogicalOperator.NOT, List.of(child));
    }

    @Override
    public String type() {
        return TYPE;
    }
}
