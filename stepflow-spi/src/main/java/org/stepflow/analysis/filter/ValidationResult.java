package org.stepflow.analysis.filter;

import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkState;

/**
 * Either a value or every problem found while producing it. Validation keeps going after the first
 * problem so the caller can report all of them at once.
 */
public class ValidationResult<T> {
    private final T value;
    private final List<String> errors;

    private ValidationResult(T value, List<String> errors) {
        this.value = value;
        this.errors = ImmutableList.copyOf(errors);
    }

    public static <T> ValidationResult<T> valid(T value) {
        return new ValidationResult<>(value, ImmutableList.of());
    }

    public static <T> ValidationResult<T> invalid(List<String> errors) {
        checkState(!errors.isEmpty(), "an invalid result needs at least one error");
        return new ValidationResult<>(null, errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public T get() {
        checkState(isValid(), "result is invalid: %s", errors);
        return value;
    }

    public List<String> getErrors() {
        return errors;
    }

    public T getOrThrow() {
        if (!isValid()) {
            throw new FilterValidationException(errors);
        }
        return value;
    }
}
