package org.stepflow.analysis.funnel;

import com.google.common.collect.ImmutableList;
import org.stepflow.analysis.FunnelAnalyzer.FunnelStep;

import static com.google.common.base.Preconditions.checkArgument;
import static org.stepflow.analysis.funnel.FunnelMath.percentage;
import static org.stepflow.util.TimeUtil.NO_DURATION;

/**
 * A single step measured against every visitor of the scope rather than against its own entrants.
 */
public final class GoalAnalytics {
    private GoalAnalytics() {
    }

    public static FunnelResult compute(FunnelStep step, StepReach reach, long totalVisitors) {
        checkArgument(reach.getTotalSteps() == 1, "goal is a single step, got %s", reach.getTotalSteps());
        checkArgument(totalVisitors >= 0, "total visitors is negative");

        long completions = reach.getCompletions();
        double rate = percentage(completions, totalVisitors);

        StepStatistic statistic = new StepStatistic(step.getStepNumber(), step.getName(), completions,
                totalVisitors, rate, 0, 0, 0);

        return new FunnelResult(rate, totalVisitors, completions, 0, NO_DURATION, 1, 0,
                ImmutableList.of(statistic), ImmutableList.of());
    }
}
