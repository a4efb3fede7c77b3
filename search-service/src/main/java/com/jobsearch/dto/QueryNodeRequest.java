package com.jobsearch.dto;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Узел дерева запроса в том виде, в каком он приходит в JSON.
 *
 * Пример:
 * {
 *   "type": "operator",
 *   "operator": "AND",
 *   "children": [
 *     {"type": "condition", "condition": {"field": "organization", "value": "apple"}},
 *     {"type": "condition", "condition": {"field": "technology", "value": ".net"}}
 *   ]
 * }
 *
 * Все поля строковые, значения проверяет {@link com.jobsearch.query.QueryTreeParser}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryNodeRequest {

    private String type;  // "condition" или "operator"

    private String operator;  // AND, OR, NOT

    private ConditionRequest condition;

    private List<QueryNodeRequest> children;
}
