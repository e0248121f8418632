package org.stepflow.analysis.funnel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public class StepStatistic {
    @JsonProperty("step_number")
    public final int stepNumber;
    @JsonProperty("step_name")
    public final String stepName;
    @JsonProperty("users_reached")
    public final long usersReached;
    @JsonProperty("total_entrants")
    public final long totalEntrants;
    @JsonProperty("conversion_rate_pct")
    public final double conversionRate;
    @JsonProperty("dropoffs")
    public final long dropoffs;
    @JsonProperty("dropoff_rate_pct")
    public final double dropoffRate;
    @JsonProperty("avg_seconds_to_complete")
    public final long avgSecondsToComplete;

    @JsonCreator
    public StepStatistic(@JsonProperty("step_number") int stepNumber,
                         @JsonProperty("step_name") String stepName,
                         @JsonProperty("users_reached") long usersReached,
                         @JsonProperty("total_entrants") long totalEntrants,
                         @JsonProperty("conversion_rate_pct") double conversionRate,
                         @JsonProperty("dropoffs") long dropoffs,
                         @JsonProperty("dropoff_rate_pct") double dropoffRate,
                         @JsonProperty("avg_seconds_to_complete") long avgSecondsToComplete) {
        this.stepNumber = stepNumber;
        this.stepName = stepName;
        this.usersReached = usersReached;
        this.totalEntrants = totalEntrants;
        this.conversionRate = conversionRate;
        this.dropoffs = dropoffs;
        this.dropoffRate = dropoffRate;
        this.avgSecondsToComplete = avgSecondsToComplete;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StepStatistic)) {
            return false;
        }
        StepStatistic that = (StepStatistic) o;
        return stepNumber == that.stepNumber
                && usersReached == that.usersReached
                && totalEntrants == that.totalEntrants
                && Double.compare(that.conversionRate, conversionRate) == 0
                && dropoffs == that.dropoffs
                && Double.compare(that.dropoffRate, dropoffRate) == 0
                && avgSecondsToComplete == that.avgSecondsToComplete
                && Objects.equals(stepName, that.stepName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stepNumber, stepName, usersReached, totalEntrants, conversionRate, dropoffs, dropoffRate, avgSecondsToComplete);
    }

    @Override
    public String toString() {
        return "StepStatistic{" +
                "step=" + stepNumber +
                ", name='" + stepName + '\'' +
                ", reached=" + usersReached +
                ", conversion=" + conversionRate +
                ", dropoffs=" + dropoffs +
                ", dropoffRate=" + dropoffRate +
                ", avgSeconds=" + avgSecondsToComplete +
                '}';
    }
}
