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

import javax.annotation.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Strict in-order funnel progression. A visitor advances only when the next event in time is exactly the
 * step that is expected next; any other event is ignored, so a step can neither be skipped nor reset by a
 * later repetition of an earlier one.
 */
public final class FunnelStateMachine {
    private static final Comparator<RawStepEvent> BY_TIME = Comparator.comparing(RawStepEvent::getOccurredAt);

    private FunnelStateMachine() {
    }

    public static FunnelProgress evaluate(String visitorId, List<RawStepEvent> events, int totalSteps) {
        checkArgument(totalSteps >= 1, "funnel needs at least one step");

        // List.sort is stable, equal timestamps keep arrival order
        List<RawStepEvent> ordered = new ArrayList<>(events);
        ordered.sort(BY_TIME);

        List<Instant> stepTimes = new ArrayList<>(totalSteps);
        int expected = 1;
        for (RawStepEvent event : ordered) {
            if (expected > totalSteps) {
                break;
            }
            if (event.getStepNumber() == expected) {
                stepTimes.add(event.getOccurredAt());
                expected++;
            }
        }

        return new FunnelProgress(visitorId, stepTimes);
    }

    public static StepReach evaluateAll(Map<String, List<RawStepEvent>> timelines, int totalSteps) {
        return evaluateAll(timelines, totalSteps, null);
    }

    /**
     * Runs every visitor, or only those in {@code visitors} when it is given, and collects the reached sets.
     */
    public static StepReach evaluateAll(Map<String, List<RawStepEvent>> timelines, int totalSteps, @Nullable Set<String> visitors) {
        StepReach.Builder reach = StepReach.builder(totalSteps);
        for (Map.Entry<String, List<RawStepEvent>> timeline : timelines.entrySet()) {
            if (visitors != null && !visitors.contains(timeline.getKey())) {
                continue;
            }
            reach.add(evaluate(timeline.getKey(), timeline.getValue(), totalSteps));
        }
        return reach.build();
    }
}
