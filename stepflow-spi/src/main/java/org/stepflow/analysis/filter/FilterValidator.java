/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.stepflow.analysis.filter;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static java.lang.String.format;

/**
 * Turns caller-supplied filters into {@link Predicate} nodes. Unknown fields, unknown operators and
 * values of the wrong shape are all collected; nothing is built unless every filter is valid.
 */
public final class FilterValidator {
    private FilterValidator() {
    }

    public static ValidationResult<List<Predicate>> validate(List<Filter> filters) {
        if (filters == null || filters.isEmpty()) {
            return ValidationResult.valid(ImmutableList.of());
        }

        List<String> errors = new ArrayList<>();
        ImmutableList.Builder<Predicate> predicates = ImmutableList.builder();

        for (int i = 0; i < filters.size(); i++) {
            Filter filter = filters.get(i);
            if (filter == null) {
                errors.add("Filter at index " + i + " is null");
                continue;
            }

            Optional<FilterField> field = FilterField.fromColumn(filter.getField());
            Optional<FilterOperator> operator = FilterOperator.fromName(filter.getOperator());
            if (!field.isPresent()) {
                errors.add("Invalid field: " + filter.getField());
            }
            if (!operator.isPresent()) {
                errors.add("Invalid operator: " + filter.getOperator());
            }
            if (!field.isPresent() || !operator.isPresent()) {
                continue;
            }

            Optional<Predicate> predicate = toPredicate(i, field.get(), operator.get(), filter.getValue(), errors);
            predicate.ifPresent(predicates::add);
        }

        if (!errors.isEmpty()) {
            return ValidationResult.invalid(errors);
        }
        return ValidationResult.valid(predicates.build());
    }

    private static Optional<Predicate> toPredicate(int index, FilterField field, FilterOperator operator, Object value, List<String> errors) {
        String parameter = Predicate.parameterName(index, field, operator);

        switch (operator.getShape()) {
            case NONE:
                return Optional.of(new Predicate.IsNull(field, operator == FilterOperator.IS_NOT_NULL));
            case ARRAY: {
                if (!(value instanceof Collection)) {
                    errors.add(format("Operator %s requires an array value for field %s", operator.getName(), field.getColumn()));
                    return Optional.empty();
                }
                Collection<?> items = (Collection<?>) value;
                if (items.isEmpty()) {
                    errors.add(format("Operator %s requires at least one value for field %s", operator.getName(), field.getColumn()));
                    return Optional.empty();
                }
                ImmutableList.Builder<String> values = ImmutableList.builder();
                for (Object item : items) {
                    if (!(item instanceof String)) {
                        errors.add(format("Operator %s accepts only string items for field %s", operator.getName(), field.getColumn()));
                        return Optional.empty();
                    }
                    values.add((String) item);
                }
                return Optional.of(new Predicate.InList(field, operator == FilterOperator.NOT_IN, parameter, values.build()));
            }
            case SCALAR: {
                if (value instanceof Collection) {
                    errors.add(format("Operator %s does not accept an array value for field %s", operator.getName(), field.getColumn()));
                    return Optional.empty();
                }
                if (value == null) {
                    errors.add(format("Operator %s requires a value for field %s", operator.getName(), field.getColumn()));
                    return Optional.empty();
                }
                if (!(value instanceof String)) {
                    errors.add(format("Operator %s requires a string value for field %s", operator.getName(), field.getColumn()));
                    return Optional.empty();
                }
                return Optional.of(scalarPredicate(field, operator, parameter, (String) value));
            }
            default:
                throw new IllegalStateException("Unknown value shape: " + operator.getShape());
        }
    }

    private static Predicate scalarPredicate(FilterField field, FilterOperator operator, String parameter, String value) {
        switch (operator) {
            case EQUALS:
                return new Predicate.Comparison(field, false, parameter, value);
            case NOT_EQUALS:
                return new Predicate.Comparison(field, true, parameter, value);
            case CONTAINS:
                return new Predicate.Like(field, false, parameter, "%" + escapeLikePattern(value) + "%");
            case NOT_CONTAINS:
                return new Predicate.Like(field, true, parameter, "%" + escapeLikePattern(value) + "%");
            case STARTS_WITH:
                return new Predicate.Like(field, false, parameter, escapeLikePattern(value) + "%");
            case ENDS_WITH:
                return new Predicate.Like(field, false, parameter, "%" + escapeLikePattern(value));
            default:
                throw new IllegalStateException("Not a scalar operator: " + operator);
        }
    }

    /**
     * Escapes the LIKE metacharacters so user input always matches literally.
     */
    public static String escapeLikePattern(String value) {
        StringBuilder builder = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' || c == '%' || c == '_') {
                builder.append('\\');
            }
            builder.append(c);
        }
        return builder.toString();
    }
}
