package org.stepflow.analysis.funnel;

import org.testng.annotations.Test;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Arrays;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNull;

public class TestRawStepEvent {
    @Test
    public void testFromRow() {
        RawStepEvent event = RawStepEvent.fromRow(Arrays.asList(2, "Pricing", "s1", "v1",
                Instant.parse("2024-03-01T10:00:00Z")), false);

        assertEquals(event.getStepNumber(), 2);
        assertEquals(event.getStepName(), "Pricing");
        assertEquals(event.getSessionId(), "s1");
        assertEquals(event.getVisitorId(), "v1");
        assertNull(event.getReferrer());
    }

    @Test
    public void testFromRowWithReferrer() {
        RawStepEvent event = RawStepEvent.fromRow(Arrays.asList(1L, "Home", "s1", "v1",
                "2024-03-01 10:00:00", "https://google.com"), true);

        assertEquals(event.getStepNumber(), 1);
        assertEquals(event.getOccurredAt(), Instant.parse("2024-03-01T10:00:00Z"));
        assertEquals(event.getReferrer(), "https://google.com");
    }

    @Test
    public void testTimestampForms() {
        Instant expected = Instant.parse("2024-03-01T10:00:00Z");

        assertEquals(RawStepEvent.toInstant("2024-03-01T10:00:00Z"), expected);
        assertEquals(RawStepEvent.toInstant(expected.getEpochSecond()), expected);
        assertEquals(RawStepEvent.toInstant(LocalDateTime.of(2024, 3, 1, 10, 0)), expected);
        assertEquals(RawStepEvent.toInstant("2024-03-01 10:00:00.000"), expected);
    }
}
