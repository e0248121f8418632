package org.stepflow.analysis.filter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A filter as it arrives from the caller. Field and operator are free-form here and only become
 * typed once {@link FilterValidator} accepts them.
 */
public class Filter {
    private final String field;
    private final String operator;
    private final Object value;

    @JsonCreator
    public Filter(@JsonProperty("field") String field,
                  @JsonProperty("operator") String operator,
                  @JsonProperty("value") Object value) {
        this.field = field;
        this.operator = operator;
        this.value = value;
    }

    public static Filter of(String field, String operator, String value) {
        return new Filter(field, operator, value);
    }

    public static Filter of(String field, String operator, List<String> values) {
        return new Filter(field, operator, ImmutableList.copyOf(values));
    }

    public static Filter of(String field, String operator) {
        return new Filter(field, operator, null);
    }

    @JsonProperty
    public String getField() {
        return field;
    }

    @JsonProperty
    public String getOperator() {
        return operator;
    }

    @JsonProperty
    public Object getValue() {
        return value;
    }

    @Override
    public String toString() {
        return field + " " + operator + (value == null ? "" : " " + value);
    }
}
