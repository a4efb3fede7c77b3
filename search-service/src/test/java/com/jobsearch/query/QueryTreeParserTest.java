package com.jobsearch.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.jobsearch.dto.ConditionRequest;
import com.jobsearch.dto.QueryNodeRequest;

class QueryTreeParserTest {

    private final QueryTreeParser parser = new QueryTreeParser();

    @Test
    void shouldParseNestedTree() {
        QueryNodeRequest request = operator("AND",
            operator("NOT", condition("organization", "apple")),
            operator("OR",
                condition("job_function", "statistician"),
                condition("technology", "psql")));

        QueryNode tree = parser.parse(request);

        assertThat(tree).isEqualTo(Operator.and(
            Operator.not(Condition.of(FieldType.ORGANIZATION, "apple")),
            Operator.or(
                Condition.of(FieldType.JOB_FUNCTION, "statistician"),
                Condition.of(FieldType.TECHNOLOGY, "psql"))));
    }

    @Test
    void shouldKeepArityCheckForCompiler() {
        QueryNode tree = parser.parse(operator("OR"));

        assertThat(tree).isInstanceOf(Operator.class);
        assertThat(((Operator) tree).getChildren()).isEmpty();
    }

    @Test
    void shouldRejectUnknownNodeType() {
        QueryNodeRequest request = QueryNodeRequest.builder().type("range").build();

        assertThatThrownBy(() -> parser.parse(request))
            .isInstanceOf(QueryValidationException.class)
            .hasMessage("Unknown node type: range");
    }

    @Test
    void shouldRejectMissingType() {
        assertThatThrownBy(() -> parser.parse(new QueryNodeRequest()))
            .isInstanceOf(QueryValidationException.class)
            .hasMessage("Query node is missing 'type'");
    }

    @Test
    void shouldRejectUnknownFieldEagerly() {
        QueryNodeRequest request = operator("AND",
            condition("organization", "apple"),
            condition("salary", "100k"));

        assertThatThrownBy(() -> parser.parse(request))
            .isInstanceOf(QueryValidationException.class)
            .hasMessage("Unknown field: salary");
    }

    @Test
    void shouldRejectUnknownOperator() {
        QueryNodeRequest request = operator("XOR", condition("organization", "apple"));

        assertThatThrownBy(() -> parser.parse(request))
            .isInstanceOf(QueryValidationException.class)
            .hasMessage("Unknown operator: XOR");
    }

    @Test
    void shouldRejectConditionNodeWithoutCondition() {
        QueryNodeRequest request = QueryNodeRequest.builder().type("condition").build();

        assertThatThrownBy(() -> parser.parse(request))
            .isInstanceOf(QueryValidationException.class)
            .hasMessage("Condition node is missing 'condition'");
    }

    @Test
    void shouldRejectOperatorNodeWithoutChildren() {
        QueryNodeRequest request = QueryNodeRequest.builder().type("operator").operator("NOT").build();

        assertThatThrownBy(() -> parser.parse(request))
            .isInstanceOf(QueryValidationException.class)
            .hasMessage("Operator node is missing 'children'");
    }

    @Test
    void shouldRejectNullValue() {
        assertThatThrownBy(() -> parser.parse(condition("technology", null)))
            .isInstanceOf(QueryValidationException.class)
            .hasMessage("Condition value must not be null");
    }

    private static QueryNodeRequest condition(String field, String value) {
        return QueryNodeRequest.builder()
            .type("condition")
            .condition(new ConditionRequest(field, value))
            .build();
    }

    private static QueryNodeRequest operator(String operator, QueryNodeRequest... children) {
        return QueryNodeRequest.builder()
            .type("operator")
            .operator(operator)
            .children(List.of(children))
            .build();
    }
}
