package org.stepflow.analysis.referrer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public class ReferrerSegment {
    @JsonProperty("referrer_key")
    public final String referrerKey;
    @JsonProperty("parsed_referrer")
    public final ParsedReferrer parsedReferrer;
    @JsonProperty("entrants")
    public final long entrants;
    @JsonProperty("completions")
    public final long completions;
    @JsonProperty("conversion_rate_pct")
    public final double conversionRate;

    @JsonCreator
    public ReferrerSegment(@JsonProperty("referrer_key") String referrerKey,
                           @JsonProperty("parsed_referrer") ParsedReferrer parsedReferrer,
                           @JsonProperty("entrants") long entrants,
                           @JsonProperty("completions") long completions,
                           @JsonProperty("conversion_rate_pct") double conversionRate) {
        this.referrerKey = referrerKey;
        this.parsedReferrer = parsedReferrer;
        this.entrants = entrants;
        this.completions = completions;
        this.conversionRate = conversionRate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReferrerSegment)) {
            return false;
        }
        ReferrerSegment that = (ReferrerSegment) o;
        return entrants == that.entrants && completions == that.completions
                && Double.compare(that.conversionRate, conversionRate) == 0
                && Objects.equals(referrerKey, that.referrerKey)
                && Objects.equals(parsedReferrer, that.parsedReferrer);
    }

    @Override
    public int hashCode() {
        return Objects.hash(referrerKey, parsedReferrer, entrants, completions, conversionRate);
    }

    @Override
    public String toString() {
        return referrerKey + "{entrants=" + entrants + ", completions=" + completions + ", rate=" + conversionRate + "}";
    }
}
