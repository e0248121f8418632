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
package org.stepflow.analysis.funnel;

import com.google.common.collect.ImmutableList;
import org.stepflow.analysis.FunnelAnalyzer.FunnelStep;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static org.stepflow.analysis.funnel.FunnelMath.percentage;
import static org.stepflow.analysis.funnel.FunnelMath.roundedMean;
import static org.stepflow.util.TimeUtil.formatDuration;

public final class FunnelAggregator {
    private FunnelAggregator() {
    }

    /**
     * Turns the reached sets into per-step statistics. The time series is left empty.
     */
    public static FunnelResult aggregate(List<FunnelStep> steps, StepReach reach) {
        checkArgument(steps.size() == reach.getTotalSteps(), "reach was computed for %s steps, got %s",
                reach.getTotalSteps(), steps.size());

        long entrants = reach.getEntrants();
        ImmutableList.Builder<StepStatistic> statistics = ImmutableList.builder();

        int biggestDropoffStep = 1;
        double biggestDropoffRate = -1;

        for (FunnelStep step : steps) {
            int number = step.getStepNumber();
            long users = reach.getReachedCount(number);

            double conversionRate;
            long dropoffs;
            double dropoffRate;
            if (number == 1) {
                conversionRate = 100;
                dropoffs = 0;
                dropoffRate = 0;
            } else {
                long previous = reach.getReachedCount(number - 1);
                conversionRate = percentage(users, previous);
                dropoffs = previous - users;
                dropoffRate = percentage(dropoffs, previous);

                // strictly greater, ties stay on the earliest step
                if (dropoffRate > biggestDropoffRate) {
                    biggestDropoffRate = dropoffRate;
                    biggestDropoffStep = number;
                }
            }

            statistics.add(new StepStatistic(number, step.getName(), users, entrants, conversionRate,
                    dropoffs, dropoffRate, roundedMean(reach.getTransitionSamples(number))));
        }

        long completions = reach.getCompletions();
        long avgCompletion = roundedMean(reach.getCompletionSamples());

        return new FunnelResult(
                percentage(completions, entrants),
                entrants,
                completions,
                avgCompletion,
                formatDuration(avgCompletion),
                biggestDropoffStep,
                Math.max(biggestDropoffRate, 0),
                statistics.build(),
                ImmutableList.of());
    }
}
