package com.jobsearch.query;

import java.util.List;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.jobsearch.dto.ConditionRequest;
import com.jobsearch.dto.QueryNodeRequest;

/**
 * Превращает JSON-представление запроса в неизменяемое дерево {@link QueryNode}.
 *
 * Здесь отсекается всё, что нельзя выразить в дереве: неизвестный тип узла,
 * поле или оператор, отсутствующие condition / children.
 * Число потомков у операторов проверяет уже {@code QueryCompiler}.
 */
@Component
public class QueryTreeParser {

    public QueryNode parse(QueryNodeRequest request) {
        if (request == null) {
            throw new QueryValidationException("Query node must not be null");
        }
        if (request.getType() == null) {
            throw new QueryValidationException("Query node is missing 'type'");
        }

        return switch (request.getType()) {
            case Condition.TYPE -> parseCondition(request.getCondition());
            case Operator.TYPE -> parseOperator(request);
            default -> throw new QueryValidationException("Unknown node type: " + request.getType());
        };
    }

    private Condition parseCondition(ConditionRequest condition) {
        if (condition == null) {
            throw new QueryValidationException("Condition node is missing 'condition'");
        }

        FieldType field = FieldType.fromValue(condition.getField())
            .orElseThrow(() -> new QueryValidationException("Unknown field: " + condition.getField()));
        if (condition.getValue() == null) {
            throw new QueryValidationException("Condition value must not be null");
        }

        return Condition.of(field, condition.getValue());
    }

    private Operator parseOperator(QueryNodeRequest request) {
        LogicalOperator operator = LogicalOperator.fromValue(request.getOperator())
            .orElseThrow(() -> new QueryValidationException("Unknown operator: " + request.getOperator()));
        if (request.getChildren() == null) {
            throw new QueryValidationException("Operator node is missing 'children'");
        }

        List<QueryNode> children = request.getChildren().stream()
            .map(this::parse)
            .collect(Collectors.toList());
        return new Operator(operator, children);
    }
}
