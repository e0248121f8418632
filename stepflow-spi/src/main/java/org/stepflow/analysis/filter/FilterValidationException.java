package org.stepflow.analysis.filter;

import com.google.common.collect.ImmutableList;
import org.stepflow.util.StepflowException;

import java.util.List;

import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;

public class FilterValidationException
        extends StepflowException {
    private final List<String> errors;

    public FilterValidationException(List<String> errors) {
        super("Invalid filters: " + String.join(", ", errors), BAD_REQUEST);
        this.errors = ImmutableList.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
