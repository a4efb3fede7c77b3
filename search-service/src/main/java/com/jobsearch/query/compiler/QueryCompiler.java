package com.jobsearch.query.compiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;

import org.springframework.stereotype.Component;

import com.jobsearch.query.Condition;
import com.jobsearch.query.FieldType;
import com.jobsearch.query.LogicalOperator;
import com.jobsearch.query.Operator;
import com.jobsearch.query.QueryNode;
import com.jobsearch.query.QueryValidationException;

/**
 * Компилятор дерева поискового запроса в параметризованный SQL.
 *
 * Два прохода по дереву:
 * 1. собираем поля из всех условий - от них зависят нужные JOIN-ы
 * 2. строим WHERE и параллельно список параметров ($1, $2, ...)
 *
 * Значения никогда не подставляются в текст запроса, только через параметры.
 * Состояния нет, поэтому один бин обслуживает все запросы одновременно.
 */
@Component
public class QueryCompiler {

    private static final String BASE_SELECT = "SELECT DISTINCT jp.id, jp.datetime_pulled FROM job_posts jp";

    /**
     * Порядок JOIN-ов фиксирован и не зависит от порядка полей в дереве.
     */
    private static final List<FieldType> JOIN_ORDER =
        List.of(FieldType.ORGANIZATION, FieldType.TECHNOLOGY, FieldType.JOB_FUNCTION);

    /**
     * Полная компиляция: SELECT + JOIN-ы + WHERE + LIMIT.
     *
     * @param tree корень дерева запроса
     * @param limit максимум строк; вставляется в текст как есть, диапазон проверяет сервис
     */
    public CompiledQuery compile(QueryNode tree, int limit) {
        Set<FieldType> requiredFields = collectRequiredFields(tree);
        String baseStatement = buildBaseStatement(requiredFields);
        PredicateFragment where = compilePredicate(tree, 0);

        String statement = baseStatement + " WHERE " + where.getSql() + " LIMIT " + limit;
        return new CompiledQuery(statement, where.getParameters(), Collections.unmodifiableSet(requiredFields));
    }

    /**
     * Все поля, встречающиеся в условиях на любой глубине.
     * NOT здесь ничем не отличается от AND / OR: важен только факт использования поля.
     */
    public Set<FieldType> collectRequiredFields(QueryNode node) {
        Set<FieldType> fields = EnumSet.noneOf(FieldType.class);
        collectRequiredFields(node, fields);
        return fields;
    }

    private void collectRequiredFields(QueryNode node, Set<FieldType> fields) {
        if (node instanceof Condition) {
            fields.add(requireField((Condition) node));
        } else if (node instanceof Operator) {
            for (QueryNode child : ((Operator) node).getChildren()) {
                collectRequiredFields(child, fields);
            }
        } else {
            throw unknownNode(node);
        }
    }

    public String buildBaseStatement(Set<FieldType> requiredFields) {
        StringJoiner statement = new StringJoiner(" ");
        statement.add(BASE_SELECT);
        for (FieldType field : JOIN_ORDER) {
            if (requiredFields.contains(field)) {
                joinsFor(field).forEach(statement::add);
            }
        }
        return statement.toString();
    }

    /**
     * Рекурсивно компилирует поддерево в условие WHERE.
     *
     * @param node корень поддерева
     * @param paramOffset сколько параметров уже занято слева от поддерева
     */
    public PredicateFragment compilePredicate(QueryNode node, int paramOffset) {
        if (node instanceof Condition) {
            return compileCondition((Condition) node, paramOffset);
        } else if (node instanceof Operator) {
            return compileOperator((Operator) node, paramOffset);
        }
        throw unknownNode(node);
    }

    private PredicateFragment compileCondition(Condition condition, int paramOffset) {
        String column = columnFor(requireField(condition));
        if (condition.getValue() == null) {
            throw new QueryValidationException("Condition value must not be null");
        }

        // ILIKE + %value% = регистронезависимый поиск подстроки
        String sql = column + " ILIKE $" + (paramOffset + 1);
        String parameter = "%" + condition.getValue() + "%";
        return new PredicateFragment(sql, List.of(parameter), paramOffset + 1);
    }

    private PredicateFragment compileOperator(Operator operator, int paramOffset) {
        LogicalOperator logicalOperator = operator.getOperator();
        if (logicalOperator == null) {
            throw new QueryValidationException("Operator node is missing 'operator'");
        }

        return switch (logicalOperator) {
            case NOT -> compileNot(operator.getChildren(), paramOffset);
            case AND, OR -> compileJunction(logicalOperator, operator.getChildren(), paramOffset);
        };
    }

    private PredicateFragment compileNot(List<QueryNode> children, int paramOffset) {
        if (children.size() != 1) {
            throw new QueryValidationException(
                "NOT operator requires exactly one child, got " + children.size());
        }

        PredicateFragment child = compilePredicate(children.get(0), paramOffset);
        return new PredicateFragment("NOT (" + child.getSql() + ")", child.getParameters(), child.getNextOffset());
    }

    private PredicateFragment compileJunction(LogicalOperator operator, List<QueryNode> children, int paramOffset) {
        if (children.isEmpty()) {
            throw new QueryValidationException(operator + " operator requires at least one child");
        }

        StringJoiner sql = new StringJoiner(" " + operator.name() + " ");
        List<String> parameters = new ArrayList<>();
        int offset = paramOffset;

        // Слева направо: порядок параметров обязан совпадать с порядком плейсхолдеров
        for (QueryNode child : children) {
            PredicateFragment fragment = compilePredicate(child, offset);
            sql.add("(" + fragment.getSql() + ")");
            parameters.addAll(fragment.getParameters());
            offset = fragment.getNextOffset();
        }

        return new PredicateFragment(sql.toString(), List.copyOf(parameters), offset);
    }

    private String columnFor(FieldType field) {
        return switch (field) {
            case ORGANIZATION -> "o.name";
            case TECHNOLOGY -> "t.name";
            case JOB_FUNCTION -> "jf.name";
        };
    }

    private List<String> joinsFor(FieldType field) {
        return switch (field) {
            case ORGANIZATION -> List.of(
                "INNER JOIN organizations o ON jp.organization_id = o.id");
            case TECHNOLOGY -> List.of(
                "INNER JOIN job_posts_tech jpt ON jp.id = jpt.job_post_id",
                "INNER JOIN tech t ON jpt.tech_id = t.id");
            case JOB_FUNCTION -> List.of(
                "INNER JOIN job_posts_job_functions jpjf ON jp.id = jpjf.job_post_id",
                "INNER JOIN job_functions jf ON jpjf.job_function_id = jf.id");
        };
    }

    private FieldType requireField(Condition condition) {
        if (condition.getField() == null) {
            throw new QueryValidationException("Condition node is missing 'field'");
        }
        return condition.getField();
    }

    private QueryValidationException unknownNode(QueryNode node) {
        if (node == null) {
            return new QueryValidationException("Query node must not be null");
        }
        return new QueryValidationException("Unknown node type: " + node.type());
    }
}
