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
package org.stepflow.analysis.referrer;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import org.stepflow.analysis.funnel.FunnelStateMachine;
import org.stepflow.analysis.funnel.RawStepEvent;
import org.stepflow.analysis.funnel.StepReach;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.stepflow.analysis.funnel.FunnelMath.percentage;

/**
 * Splits visitors by the referrer of their first event and evaluates the funnel once per group.
 */
public class ReferrerSegmenter {
    private final ReferrerParser parser;

    @Inject
    public ReferrerSegmenter(ReferrerParser parser) {
        this.parser = parser;
    }

    public List<ReferrerSegment> segment(Map<String, List<RawStepEvent>> timelines, int totalSteps) {
        Map<String, Group> groups = new LinkedHashMap<>();
        for (Map.Entry<String, List<RawStepEvent>> timeline : timelines.entrySet()) {
            if (timeline.getValue().isEmpty()) {
                continue;
            }
            ParsedReferrer parsed = parser.parse(timeline.getValue().get(0).getReferrer());
            groups.computeIfAbsent(ReferrerParser.segmentKey(parsed), key -> new Group(parsed))
                    .visitors.add(timeline.getKey());
        }

        List<ReferrerSegment> segments = new ArrayList<>(groups.size());
        for (Map.Entry<String, Group> entry : groups.entrySet()) {
            StepReach reach = FunnelStateMachine.evaluateAll(timelines, totalSteps, entry.getValue().visitors);
            long entrants = reach.getEntrants();
            if (entrants == 0) {
                continue;
            }
            long completions = reach.getCompletions();
            segments.add(new ReferrerSegment(entry.getKey(), entry.getValue().parsed, entrants, completions,
                    percentage(completions, entrants)));
        }

        // stable, equal entrant counts keep first-seen order
        segments.sort(Comparator.comparingLong((ReferrerSegment segment) -> segment.entrants).reversed());
        return ImmutableList.copyOf(segments);
    }

    private static class Group {
        private final ParsedReferrer parsed;
        private final Set<String> visitors = new LinkedHashSet<>();

        private Group(ParsedReferrer parsed) {
            this.parsed = parsed;
        }
    }
}
