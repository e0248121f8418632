package org.stepflow.analysis.funnel;

import javax.annotation.Nullable;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;

import static java.time.ZoneOffset.UTC;
import static java.util.Objects.requireNonNull;

/**
 * First occurrence of one funnel step for one visitor, as returned by the step query.
 */
public class RawStepEvent {
    private static final DateTimeFormatter SQL_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss[.SSS]");

    private final int stepNumber;
    private final String stepName;
    private final String visitorId;
    private final String sessionId;
    private final Instant occurredAt;
    @Nullable
    private final String referrer;

    public RawStepEvent(int stepNumber, String stepName, String visitorId, String sessionId, Instant occurredAt, @Nullable String referrer) {
        this.stepNumber = stepNumber;
        this.stepName = stepName;
        this.visitorId = requireNonNull(visitorId, "visitorId is null");
        this.sessionId = sessionId;
        this.occurredAt = requireNonNull(occurredAt, "occurredAt is null");
        this.referrer = referrer;
    }

    public RawStepEvent(int stepNumber, String visitorId, Instant occurredAt) {
        this(stepNumber, "Step " + stepNumber, visitorId, null, occurredAt, null);
    }

    /**
     * Reads a row laid out as {@code step_number, step_name, session_id, visitor_id, first_occurrence[, referrer]}.
     */
    public static RawStepEvent fromRow(List<Object> row, boolean withReferrer) {
        return new RawStepEvent(
                ((Number) row.get(0)).intValue(),
                Objects.toString(row.get(1), null),
                Objects.toString(row.get(3), null),
                Objects.toString(row.get(2), null),
                toInstant(row.get(4)),
                withReferrer ? Objects.toString(row.get(5), null) : null);
    }

    static Instant toInstant(Object value) {
        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof Number) {
            return Instant.ofEpochSecond(((Number) value).longValue());
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toInstant(UTC);
        }
        String text = requireNonNull(value, "timestamp is null").toString();
        if (text.endsWith("Z")) {
            return Instant.parse(text);
        }
        return LocalDateTime.parse(text, SQL_TIMESTAMP).toInstant(UTC);
    }

    public int getStepNumber() {
        return stepNumber;
    }

    public String getStepName() {
        return stepName;
    }

    public String getVisitorId() {
        return visitorId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    @Nullable
    public String getReferrer() {
        return referrer;
    }

    @Override
    public String toString() {
        return "RawStepEvent{" +
                "step=" + stepNumber +
                ", visitor='" + visitorId + '\'' +
                ", at=" + occurredAt +
                (referrer == null ? "" : ", referrer='" + referrer + '\'') +
                '}';
    }
}
