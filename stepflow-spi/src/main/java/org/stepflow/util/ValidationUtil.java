package org.stepflow.util;

import org.stepflow.analysis.FunnelAnalyzer.FunnelStep;

import javax.annotation.Nullable;

import java.util.List;

import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;
import static java.lang.String.format;

public final class ValidationUtil {
    private ValidationUtil()
            throws InstantiationException {
        throw new InstantiationException("The class is not created for instantiation");
    }

    public static <T> T checkNotNull(T value, String name) {
        checkArgument(value != null, name + " is null");
        return value;
    }

    public static String checkNotEmpty(String value, String name) {
        checkArgument(value != null && !value.trim().isEmpty(), name + " is empty");
        return value;
    }

    public static void checkArgument(boolean expression, @Nullable String errorMessage) {
        if (!expression) {
            if (errorMessage == null) {
                throw new StepflowException(BAD_REQUEST);
            } else {
                throw new StepflowException(errorMessage, BAD_REQUEST);
            }
        }
    }

    /**
     * Rejects step lists that are empty or whose step numbers are not 1..N in list order.
     */
    public static List<FunnelStep> checkSteps(List<FunnelStep> steps) {
        checkArgument(steps != null && !steps.isEmpty(), "Funnel steps parameter is empty");
        for (int i = 0; i < steps.size(); i++) {
            FunnelStep step = checkNotNull(steps.get(i), "step");
            if (step.getStepNumber() != i + 1) {
                throw new StepflowException(format("Step numbers must be contiguous and start from 1, " +
                        "expected %d but got %d", i + 1, step.getStepNumber()), BAD_REQUEST);
            }
        }
        return steps;
    }

    /**
     * Identifiers come from configuration only, this guards against a misconfigured table or column name.
     */
    public static String checkTableColumn(String column, char escape) {
        checkNotEmpty(column, "column");
        if (!column.matches("^[A-Za-z_][A-Za-z0-9_.]*$")) {
            throw new IllegalArgumentException("Invalid identifier: " + column);
        }
        return escape + column.replace(".", escape + "." + escape) + escape;
    }
}
