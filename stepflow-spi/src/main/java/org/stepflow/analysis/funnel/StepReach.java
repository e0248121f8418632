package org.stepflow.analysis.funnel;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Per-step reached sets and timing samples for a group of visitors.
 */
public class StepReach {
    private final int totalSteps;
    private final List<Set<String>> reached;
    private final List<List<Double>> transitionSeconds;
    private final List<Double> completionSeconds;

    private StepReach(int totalSteps, List<Set<String>> reached, List<List<Double>> transitionSeconds, List<Double> completionSeconds) {
        this.totalSteps = totalSteps;
        this.reached = reached;
        this.transitionSeconds = transitionSeconds;
        this.completionSeconds = completionSeconds;
    }

    public static Builder builder(int totalSteps) {
        return new Builder(totalSteps);
    }

    public int getTotalSteps() {
        return totalSteps;
    }

    public Set<String> getReached(int step) {
        checkStep(step);
        return reached.get(step - 1);
    }

    public int getReachedCount(int step) {
        return getReached(step).size();
    }

    public int getEntrants() {
        return getReachedCount(1);
    }

    public int getCompletions() {
        return getReachedCount(totalSteps);
    }

    /**
     * Seconds from the previous step, one sample per visitor that made the transition. Always empty for step 1.
     */
    public List<Double> getTransitionSamples(int step) {
        checkStep(step);
        return transitionSeconds.get(step - 1);
    }

    /**
     * Seconds from step 1 to the final step for every visitor that completed a funnel of more than one step.
     */
    public List<Double> getCompletionSamples() {
        return completionSeconds;
    }

    private void checkStep(int step) {
        checkArgument(step >= 1 && step <= totalSteps, "step %s is out of range 1..%s", step, totalSteps);
    }

    public static class Builder {
        private final int totalSteps;
        private final List<Set<String>> reached;
        private final List<List<Double>> transitionSeconds;
        private final List<Double> completionSeconds = new ArrayList<>();

        private Builder(int totalSteps) {
            checkArgument(totalSteps >= 1, "funnel needs at least one step");
            this.totalSteps = totalSteps;
            this.reached = new ArrayList<>(totalSteps);
            this.transitionSeconds = new ArrayList<>(totalSteps);
            for (int i = 0; i < totalSteps; i++) {
                reached.add(new LinkedHashSet<>());
                transitionSeconds.add(new ArrayList<>());
            }
        }

        public Builder add(FunnelProgress progress) {
            int highest = progress.getHighestStep();
            for (int step = 1; step <= highest; step++) {
                reached.get(step - 1).add(progress.getVisitorId());
                if (step > 1) {
                    transitionSeconds.get(step - 1).add(progress.getTransitionSeconds(step));
                }
            }
            if (totalSteps > 1 && highest == totalSteps) {
                completionSeconds.add(progress.getSecondsSinceEntry(totalSteps));
            }
            return this;
        }

        public StepReach build() {
            ImmutableList.Builder<Set<String>> sets = ImmutableList.builder();
            ImmutableList.Builder<List<Double>> samples = ImmutableList.builder();
            for (int i = 0; i < totalSteps; i++) {
                sets.add(ImmutableSet.copyOf(reached.get(i)));
                samples.add(ImmutableList.copyOf(transitionSeconds.get(i)));
            }
            return new StepReach(totalSteps, sets.build(), samples.build(), ImmutableList.copyOf(completionSeconds));
        }
    }
}
