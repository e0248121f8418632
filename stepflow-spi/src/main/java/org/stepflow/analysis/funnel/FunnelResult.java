package org.stepflow.analysis.funnel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.List;

public class FunnelResult {
    @JsonProperty("overall_conversion_rate_pct")
    public final double overallConversionRate;
    @JsonProperty("entrants")
    public final long entrants;
    @JsonProperty("completions")
    public final long completions;
    @JsonProperty("avg_completion_seconds")
    public final long avgCompletionSeconds;
    @JsonProperty("avg_completion_formatted")
    public final String avgCompletionFormatted;
    @JsonProperty("biggest_dropoff_step")
    public final int biggestDropoffStep;
    @JsonProperty("biggest_dropoff_rate_pct")
    public final double biggestDropoffRate;
    @JsonProperty("steps")
    public final List<StepStatistic> steps;
    @JsonProperty("time_series")
    public final List<DailyPoint> timeSeries;

    @JsonCreator
    public FunnelResult(@JsonProperty("overall_conversion_rate_pct") double overallConversionRate,
                        @JsonProperty("entrants") long entrants,
                        @JsonProperty("completions") long completions,
                        @JsonProperty("avg_completion_seconds") long avgCompletionSeconds,
                        @JsonProperty("avg_completion_formatted") String avgCompletionFormatted,
                        @JsonProperty("biggest_dropoff_step") int biggestDropoffStep,
                        @JsonProperty("biggest_dropoff_rate_pct") double biggestDropoffRate,
                        @JsonProperty("steps") List<StepStatistic> steps,
                        @JsonProperty("time_series") List<DailyPoint> timeSeries) {
        this.overallConversionRate = overallConversionRate;
        this.entrants = entrants;
        this.completions = completions;
        this.avgCompletionSeconds = avgCompletionSeconds;
        this.avgCompletionFormatted = avgCompletionFormatted;
        this.biggestDropoffStep = biggestDropoffStep;
        this.biggestDropoffRate = biggestDropoffRate;
        this.steps = ImmutableList.copyOf(steps);
        this.timeSeries = timeSeries == null ? ImmutableList.of() : ImmutableList.copyOf(timeSeries);
    }

    public FunnelResult withTimeSeries(List<DailyPoint> timeSeries) {
        return new FunnelResult(overallConversionRate, entrants, completions, avgCompletionSeconds, avgCompletionFormatted,
                biggestDropoffStep, biggestDropoffRate, steps, timeSeries);
    }

    public StepStatistic getStep(int stepNumber) {
        return steps.get(stepNumber - 1);
    }

    @Override
    public String toString() {
        return "FunnelResult{" +
                "overall=" + overallConversionRate +
                ", entrants=" + entrants +
                ", completions=" + completions +
                ", avgCompletion=" + avgCompletionFormatted +
                ", biggestDropoffStep=" + biggestDropoffStep +
                ", steps=" + steps +
                '}';
    }
}
