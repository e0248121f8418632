package org.stepflow.analysis.funnel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.Objects;

public class DailyPoint {
    @JsonProperty("date")
    public final LocalDate date;
    @JsonProperty("entrants")
    public final long entrants;
    @JsonProperty("conversions")
    public final long conversions;
    @JsonProperty("conversion_rate_pct")
    public final double conversionRate;
    @JsonProperty("dropoffs")
    public final long dropoffs;
    @JsonProperty("avg_seconds")
    public final long avgSeconds;

    @JsonCreator
    public DailyPoint(@JsonProperty("date") LocalDate date,
                      @JsonProperty("entrants") long entrants,
                      @JsonProperty("conversions") long conversions,
                      @JsonProperty("conversion_rate_pct") double conversionRate,
                      @JsonProperty("dropoffs") long dropoffs,
                      @JsonProperty("avg_seconds") long avgSeconds) {
        this.date = date;
        this.entrants = entrants;
        this.conversions = conversions;
        this.conversionRate = conversionRate;
        this.dropoffs = dropoffs;
        this.avgSeconds = avgSeconds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DailyPoint)) {
            return false;
        }
        DailyPoint that = (DailyPoint) o;
        return entrants == that.entrants
                && conversions == that.conversions
                && Double.compare(that.conversionRate, conversionRate) == 0
                && dropoffs == that.dropoffs
                && avgSeconds == that.avgSeconds
                && Objects.equals(date, that.date);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, entrants, conversions, conversionRate, dropoffs, avgSeconds);
    }

    @Override
    public String toString() {
        return date + "{entrants=" + entrants + ", conversions=" + conversions + ", avgSeconds=" + avgSeconds + "}";
    }
}
