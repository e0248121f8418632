package org.stepflow.analysis.funnel;

import com.google.common.collect.ImmutableList;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * How far one visitor got: the highest contiguous step and the time each of those steps was matched.
 */
public class FunnelProgress {
    private final String visitorId;
    private final List<Instant> stepTimes;

    public FunnelProgress(String visitorId, List<Instant> stepTimes) {
        this.visitorId = visitorId;
        this.stepTimes = ImmutableList.copyOf(stepTimes);
    }

    public String getVisitorId() {
        return visitorId;
    }

    /**
     * 0 when the visitor never matched step 1.
     */
    public int getHighestStep() {
        return stepTimes.size();
    }

    public boolean hasReached(int step) {
        return step >= 1 && step <= stepTimes.size();
    }

    public Instant getEntryTime() {
        checkArgument(!stepTimes.isEmpty(), "visitor %s did not enter the funnel", visitorId);
        return stepTimes.get(0);
    }

    public Instant getStepTime(int step) {
        checkArgument(hasReached(step), "visitor %s did not reach step %s", visitorId, step);
        return stepTimes.get(step - 1);
    }

    /**
     * Seconds between matching {@code step - 1} and {@code step}.
     */
    public double getTransitionSeconds(int step) {
        checkArgument(step > 1, "step 1 has no transition");
        return seconds(getStepTime(step - 1), getStepTime(step));
    }

    public double getSecondsSinceEntry(int step) {
        return seconds(getEntryTime(), getStepTime(step));
    }

    private static double seconds(Instant from, Instant to) {
        return Duration.between(from, to).toMillis() / 1000.0;
    }
}
