package com.jobsearch.query;

/**
 * Узел дерева поискового запроса.
 *
 * Два варианта:
 * - {@link Condition} - условие "поле содержит подстроку"
 * - {@link Operator} - AND / OR / NOT над дочерними узлами
 *
 * Дерево строится заново на каждый запрос и не изменяется после создания.
 */
public interface QueryNode {

    /**
     * Тег узла в JSON: "condition" или "operator".
     */
    String type();
}
