package org.stepflow.analysis.referrer;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.stepflow.analysis.funnel.FunnelStateMachine;
import org.stepflow.analysis.funnel.RawStepEvent;
import org.stepflow.analysis.funnel.VisitorEventGrouper;
import org.testng.annotations.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;

public class TestReferrerSegmenter {
    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    private final ReferrerSegmenter segmenter = new ReferrerSegmenter(new ReferrerParser(
            new StaticReferrerProvider(ImmutableMap.of("google.com", new ReferrerInfo("Google", Medium.SEARCH)))));

    @Test
    public void testSegmentsSortedByEntrants() {
        List<RawStepEvent> events = ImmutableList.of(
                event(1, "a", 0, ""),
                event(2, "a", 10, ""),
                event(1, "b", 0, "https://google.com/"),
                event(2, "b", 5, "https://google.com/"),
                event(1, "c", 0, "https://www.google.com/search"),
                event(1, "d", 0, "https://blog.example.com/post"),
                event(2, "e", 0, "https://blog.example.com/post"));

        List<ReferrerSegment> segments = segmenter.segment(VisitorEventGrouper.group(events), 2);

        assertEquals(segments, ImmutableList.of(
                new ReferrerSegment("google.com", new ParsedReferrer("Google", "search", "google.com", "https://google.com/"), 2, 1, 50.0),
                new ReferrerSegment("direct", ParsedReferrer.DIRECT, 1, 1, 100.0),
                new ReferrerSegment("blog.example.com", new ParsedReferrer("blog.example.com", "referrer", "blog.example.com",
                        "https://blog.example.com/post"), 1, 0, 0.0)));
    }

    @Test
    public void testGroupsWithoutEntrantsAreDropped() {
        List<RawStepEvent> events = ImmutableList.of(
                event(1, "a", 0, null),
                event(2, "b", 0, "https://google.com/"));

        List<ReferrerSegment> segments = segmenter.segment(VisitorEventGrouper.group(events), 2);

        assertEquals(segments.size(), 1);
        assertEquals(segments.get(0).referrerKey, "direct");
    }

    @Test
    public void testEntrantsAreConserved() {
        Random random = new Random(7);
        String[] referrers = {"", "https://google.com", "https://a.example", "https://b.example", "garbage value"};
        List<RawStepEvent> events = new ArrayList<>();
        for (int visitor = 0; visitor < 200; visitor++) {
            String referrer = referrers[random.nextInt(referrers.length)];
            int count = 1 + random.nextInt(4);
            for (int i = 0; i < count; i++) {
                events.add(event(1 + random.nextInt(3), "v" + visitor, random.nextInt(100), referrer));
            }
        }
        Map<String, List<RawStepEvent>> timelines = VisitorEventGrouper.group(events);

        long entrants = 0;
        long completions = 0;
        for (ReferrerSegment segment : segmenter.segment(timelines, 3)) {
            assertTrue(segment.entrants > 0);
            entrants += segment.entrants;
            completions += segment.completions;
        }

        assertEquals(entrants, FunnelStateMachine.evaluateAll(timelines, 3).getEntrants());
        assertEquals(completions, FunnelStateMachine.evaluateAll(timelines, 3).getCompletions());
    }

    private static RawStepEvent event(int step, String visitor, long seconds, String referrer) {
        return new RawStepEvent(step, "Step " + step, visitor, "s-" + visitor, T0.plusSeconds(seconds), referrer);
    }
}
