package org.stepflow.util;

import com.google.common.collect.ImmutableList;
import org.stepflow.analysis.FunnelAnalyzer.FunnelStep;
import org.testng.annotations.Test;

import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;
import static org.stepflow.analysis.FunnelAnalyzer.StepType.PAGE_VIEW;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.expectThrows;

public class TestValidationUtil {
    @Test
    public void testEmptySteps() {
        StepflowException exception = expectThrows(StepflowException.class, () -> ValidationUtil.checkSteps(ImmutableList.of()));

        assertEquals(exception.getStatusCode(), BAD_REQUEST);
    }

    @Test
    public void testStepsMustBeContiguous() {
        expectThrows(StepflowException.class, () -> ValidationUtil.checkSteps(ImmutableList.of(
                new FunnelStep(1, "Home", PAGE_VIEW, "/"),
                new FunnelStep(3, "Pricing", PAGE_VIEW, "/pricing"))));
    }

    @Test
    public void testBlankStepTarget() {
        expectThrows(StepflowException.class, () -> new FunnelStep(1, "Home", PAGE_VIEW, " "));
    }

    @Test
    public void testTableColumn() {
        assertEquals(ValidationUtil.checkTableColumn("analytics.events", '`'), "`analytics`.`events`");
        assertEquals(ValidationUtil.checkTableColumn("client_id", '"'), "\"client_id\"");
        expectThrows(IllegalArgumentException.class, () -> ValidationUtil.checkTableColumn("time; DROP", '`'));
    }
}
