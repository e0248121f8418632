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

import java.util.List;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Node of a validated filter tree. Every node references an allow-listed column; values are kept apart
 * from the rendered text and are only ever bound as query parameters by a dialect formatter.
 */
public abstract class Predicate {
    private final FilterField field;
    private final boolean negated;

    protected Predicate(FilterField field, boolean negated) {
        this.field = requireNonNull(field, "field is null");
        this.negated = negated;
    }

    public FilterField getField() {
        return field;
    }

    public boolean isNegated() {
        return negated;
    }

    public abstract <R, C> R accept(PredicateVisitor<R, C> visitor, C context);

    /**
     * Binding name that stays unique when the same field is filtered more than once.
     */
    public static String parameterName(int index, FilterField field, FilterOperator operator) {
        return "f" + index + "_" + field.getColumn() + "_" + operator.getName();
    }

    public static class Comparison
            extends Predicate {
        private final String parameter;
        private final String value;

        public Comparison(FilterField field, boolean negated, String parameter, String value) {
            super(field, negated);
            this.parameter = requireNonNull(parameter, "parameter is null");
            this.value = requireNonNull(value, "value is null");
        }

        public String getParameter() {
            return parameter;
        }

        public String getValue() {
            return value;
        }

        @Override
        public <R, C> R accept(PredicateVisitor<R, C> visitor, C context) {
            return visitor.visitComparison(this, context);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Comparison)) {
                return false;
            }
            Comparison that = (Comparison) o;
            return getField() == that.getField() && isNegated() == that.isNegated()
                    && parameter.equals(that.parameter) && value.equals(that.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(getField(), isNegated(), parameter, value);
        }
    }

    public static class Like
            extends Predicate {
        private final String parameter;
        private final String pattern;

        public Like(FilterField field, boolean negated, String parameter, String pattern) {
            super(field, negated);
            this.parameter = requireNonNull(parameter, "parameter is null");
            this.pattern = requireNonNull(pattern, "pattern is null");
        }

        public String getParameter() {
            return parameter;
        }

        public String getPattern() {
            return pattern;
        }

        @Override
        public <R, C> R accept(PredicateVisitor<R, C> visitor, C context) {
            return visitor.visitLike(this, context);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Like)) {
                return false;
            }
            Like that = (Like) o;
            return getField() == that.getField() && isNegated() == that.isNegated()
                    && parameter.equals(that.parameter) && pattern.equals(that.pattern);
        }

        @Override
        public int hashCode() {
            return Objects.hash(getField(), isNegated(), parameter, pattern);
        }
    }

    public static class InList
            extends Predicate {
        private final String parameter;
        private final List<String> values;

        public InList(FilterField field, boolean negated, String parameter, List<String> values) {
            super(field, negated);
            this.parameter = requireNonNull(parameter, "parameter is null");
            this.values = ImmutableList.copyOf(values);
        }

        public String getParameter() {
            return parameter;
        }

        public List<String> getValues() {
            return values;
        }

        @Override
        public <R, C> R accept(PredicateVisitor<R, C> visitor, C context) {
            return visitor.visitInList(this, context);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof InList)) {
                return false;
            }
            InList that = (InList) o;
            return getField() == that.getField() && isNegated() == that.isNegated()
                    && parameter.equals(that.parameter) && values.equals(that.values);
        }

        @Override
        public int hashCode() {
            return Objects.hash(getField(), isNegated(), parameter, values);
        }
    }

    public static class IsNull
            extends Predicate {
        public IsNull(FilterField field, boolean negated) {
            super(field, negated);
        }

        @Override
        public <R, C> R accept(PredicateVisitor<R, C> visitor, C context) {
            return visitor.visitIsNull(this, context);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof IsNull)) {
                return false;
            }
            IsNull that = (IsNull) o;
            return getField() == that.getField() && isNegated() == that.isNegated();
        }

        @Override
        public int hashCode() {
            return Objects.hash(getField(), isNegated());
        }
    }
}
