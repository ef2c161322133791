package com.vcc.router.model;

import java.util.List;

/**
 * One comparison of a request field against a literal. {@code value} is used by
 * EQ, LT and GTE; {@code values} by IN.
 */
public record FieldCondition(
        String field,
        ConditionOperator op,
        String value,
        List<String> values
) {

    public FieldCondition {
        values = values != null ? List.copyOf(values) : List.of();
    }

    public static FieldCondition eq(String field, String value) {
        return new FieldCondition(field, ConditionOperator.EQ, value, null);
    }

    public static FieldCondition in(String field, List<String> values) {
        return new FieldCondition(field, ConditionOperator.IN, null, values);
    }

    public static FieldCondition lt(String field, String value) {
        return new FieldCondition(field, ConditionOperator.LT, value, null);
    }

    public static FieldCondition gte(String field, String value) {
        return new FieldCondition(field, ConditionOperator.GTE, value, null);
    }
}
