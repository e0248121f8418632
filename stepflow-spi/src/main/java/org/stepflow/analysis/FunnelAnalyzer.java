package org.stepflow.analysis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.stepflow.analysis.filter.Filter;
import org.stepflow.analysis.funnel.FunnelResult;
import org.stepflow.analysis.referrer.ReferrerSegment;
import org.stepflow.util.StepflowException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;
import static org.stepflow.util.ValidationUtil.checkNotEmpty;
import static org.stepflow.util.ValidationUtil.checkNotNull;

public interface FunnelAnalyzer {
    CompletableFuture<FunnelResult> computeFunnel(RequestContext context,
                                                  List<FunnelStep> steps,
                                                  List<Filter> filters,
                                                  AnalysisWindow window);

    /**
     * Single step measured against {@code totalVisitors}, the number of distinct visitors of the scope in
     * the same window, instead of against its own entrants.
     */
    CompletableFuture<FunnelResult> computeGoal(RequestContext context,
                                                FunnelStep step,
                                                List<Filter> filters,
                                                AnalysisWindow window,
                                                long totalVisitors);

    CompletableFuture<List<ReferrerSegment>> computeReferrerBreakdown(RequestContext context,
                                                                      List<FunnelStep> steps,
                                                                      List<Filter> filters,
                                                                      AnalysisWindow window);

    /**
     * Distinct visitors with at least one page view in the window.
     */
    CompletableFuture<Long> countVisitors(RequestContext context, AnalysisWindow window);

    enum StepType {
        PAGE_VIEW, EVENT;

        @JsonCreator
        public static StepType get(String name) {
            return valueOf(name.toUpperCase());
        }

        @JsonProperty
        public String value() {
            return name();
        }
    }

    class FunnelStep {
        private final int stepNumber;
        private final String name;
        private final StepType type;
        private final String target;

        @JsonCreator
        public FunnelStep(@JsonProperty("step_number") int stepNumber,
                          @JsonProperty("name") String name,
                          @JsonProperty("type") StepType type,
                          @JsonProperty("target") String target) {
            if (stepNumber < 1) {
                throw new StepflowException("Step number must be positive: " + stepNumber, BAD_REQUEST);
            }
            this.stepNumber = stepNumber;
            this.name = checkNotEmpty(name, "step name");
            this.type = checkNotNull(type, "step type");
            this.target = checkNotEmpty(target, "step target");
        }

        @JsonProperty("step_number")
        public int getStepNumber() {
            return stepNumber;
        }

        @JsonProperty
        public String getName() {
            return name;
        }

        @JsonProperty
        public StepType getType() {
            return type;
        }

        @JsonProperty
        public String getTarget() {
            return target;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof FunnelStep)) {
                return false;
            }
            FunnelStep that = (FunnelStep) o;
            return stepNumber == that.stepNumber && name.equals(that.name) && type == that.type && target.equals(that.target);
        }

        @Override
        public int hashCode() {
            return Objects.hash(stepNumber, name, type, target);
        }

        @Override
        public String toString() {
            return stepNumber + ":" + type + "(" + target + ")";
        }
    }

    class AnalysisWindow {
        public final LocalDate startDate;
        public final LocalDate endDate;
        public final ZoneId timezone;

        @JsonCreator
        public AnalysisWindow(@JsonProperty("startDate") LocalDate startDate,
                              @JsonProperty("endDate") LocalDate endDate,
                              @JsonProperty("timezone") ZoneId timezone) {
            this.startDate = checkNotNull(startDate, "startDate");
            this.endDate = checkNotNull(endDate, "endDate");
            this.timezone = timezone == null ? ZoneOffset.UTC : timezone;
            if (endDate.isBefore(startDate)) {
                throw new StepflowException("endDate must not be before startDate", BAD_REQUEST);
            }
        }

        public AnalysisWindow(LocalDate startDate, LocalDate endDate) {
            this(startDate, endDate, ZoneOffset.UTC);
        }

        @JsonIgnore
        public Instant getStart() {
            return startDate.atStartOfDay(timezone).toInstant();
        }

        /**
         * Last second of {@link #endDate}, the window is inclusive on both ends.
         */
        @JsonIgnore
        public Instant getEnd() {
            return endDate.atTime(LocalTime.of(23, 59, 59)).atZone(timezone).toInstant();
        }
    }
}
