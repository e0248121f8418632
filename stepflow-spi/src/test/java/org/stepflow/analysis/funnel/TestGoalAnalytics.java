package org.stepflow.analysis.funnel;

import com.google.common.collect.ImmutableList;
import org.stepflow.analysis.FunnelAnalyzer.FunnelStep;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.List;

import static org.stepflow.analysis.FunnelAnalyzer.StepType.EVENT;
import static org.stepflow.analysis.funnel.FunnelFixtures.at;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;

public class TestGoalAnalytics {
    private static final FunnelStep GOAL = new FunnelStep(1, "Newsletter", EVENT, "newsletter_signup");

    @Test
    public void testRateAgainstTotalVisitors() {
        FunnelResult result = GoalAnalytics.compute(GOAL, reach(50), 1000);

        assertEquals(result.overallConversionRate, 5.0);
        assertEquals(result.entrants, 1000);
        assertEquals(result.completions, 50);
        assertEquals(result.avgCompletionSeconds, 0);
        assertEquals(result.avgCompletionFormatted, "—");
        assertTrue(result.timeSeries.isEmpty());
        assertEquals(result.steps, ImmutableList.of(new StepStatistic(1, "Newsletter", 50, 1000, 5.0, 0, 0.0, 0)));
    }

    @Test
    public void testCompletionsDoNotDependOnBaseline() {
        StepReach reach = reach(7);

        assertEquals(GoalAnalytics.compute(GOAL, reach, 10).completions, GoalAnalytics.compute(GOAL, reach, 10_000).completions);
    }

    @Test
    public void testZeroVisitors() {
        assertEquals(GoalAnalytics.compute(GOAL, reach(0), 0).overallConversionRate, 0.0);
    }

    @Test
    public void testMultiStepReachRejected() {
        StepReach reach = StepReach.builder(2).build();

        expectThrows(IllegalArgumentException.class, () -> GoalAnalytics.compute(GOAL, reach, 10));
    }

    private static StepReach reach(int visitors) {
        List<RawStepEvent> events = new ArrayList<>();
        for (int i = 0; i < visitors; i++) {
            events.add(new RawStepEvent(1, "v" + i, at(i)));
        }
        return FunnelStateMachine.evaluateAll(VisitorEventGrouper.group(events), 1);
    }
}
