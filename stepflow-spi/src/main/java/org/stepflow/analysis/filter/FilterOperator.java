package org.stepflow.analysis.filter;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum FilterOperator {
    EQUALS("equals", ValueShape.SCALAR),
    NOT_EQUALS("not_equals", ValueShape.SCALAR),
    CONTAINS("contains", ValueShape.SCALAR),
    NOT_CONTAINS("not_contains", ValueShape.SCALAR),
    STARTS_WITH("starts_with", ValueShape.SCALAR),
    ENDS_WITH("ends_with", ValueShape.SCALAR),
    IN("in", ValueShape.ARRAY),
    NOT_IN("not_in", ValueShape.ARRAY),
    IS_NULL("is_null", ValueShape.NONE),
    IS_NOT_NULL("is_not_null", ValueShape.NONE);

    private static final Map<String, FilterOperator> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toMap(FilterOperator::getName, Function.identity()));

    private final String name;
    private final ValueShape shape;

    FilterOperator(String name, ValueShape shape) {
        this.name = name;
        this.shape = shape;
    }

    public static Optional<FilterOperator> fromName(String name) {
        return Optional.ofNullable(name).map(BY_NAME::get);
    }

    public String getName() {
        return name;
    }

    public ValueShape getShape() {
        return shape;
    }

    public enum ValueShape {
        NONE, SCALAR, ARRAY
    }
}
