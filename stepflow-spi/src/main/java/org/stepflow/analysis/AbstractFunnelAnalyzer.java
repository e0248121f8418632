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
package org.stepflow.analysis;

import com.google.common.collect.ImmutableList;
import io.airlift.log.Logger;
import io.airlift.units.Duration;
import org.stepflow.analysis.filter.Filter;
import org.stepflow.analysis.filter.FilterValidator;
import org.stepflow.analysis.filter.Predicate;
import org.stepflow.analysis.funnel.DailyPoint;
import org.stepflow.analysis.funnel.FunnelAggregator;
import org.stepflow.analysis.funnel.FunnelResult;
import org.stepflow.analysis.funnel.FunnelStateMachine;
import org.stepflow.analysis.funnel.GoalAnalytics;
import org.stepflow.analysis.funnel.RawStepEvent;
import org.stepflow.analysis.funnel.TimeSeriesReconstructor;
import org.stepflow.analysis.funnel.VisitorEventGrouper;
import org.stepflow.analysis.referrer.ReferrerSegment;
import org.stepflow.analysis.referrer.ReferrerSegmenter;
import org.stepflow.config.FunnelConfig;
import org.stepflow.report.QueryExecution;
import org.stepflow.report.QueryExecutor;
import org.stepflow.report.QueryResult;
import org.stepflow.sql.QueryParameters;
import org.stepflow.util.StepflowException;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;

import static io.netty.handler.codec.http.HttpResponseStatus.BAD_GATEWAY;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static org.stepflow.collection.FieldType.STRING;
import static org.stepflow.collection.FieldType.TIMESTAMP;
import static org.stepflow.util.ValidationUtil.checkArgument;
import static org.stepflow.util.ValidationUtil.checkNotNull;
import static org.stepflow.util.ValidationUtil.checkSteps;

/**
 * Validates the request, builds the step queries through the dialect methods, runs them on the
 * {@link QueryExecutor} and evaluates the returned step tuples in memory.
 */
public abstract class AbstractFunnelAnalyzer
        implements FunnelAnalyzer {
    private static final Logger LOGGER = Logger.get(AbstractFunnelAnalyzer.class);

    public static final String COMPUTATION_FAILED = "Funnel computation failed";

    protected static final String SCOPE_PARAMETER = "scope";
    protected static final String START_PARAMETER = "start_time";
    protected static final String END_PARAMETER = "end_time";

    protected final FunnelConfig config;
    private final QueryExecutor executor;
    private final ReferrerSegmenter segmenter;

    public AbstractFunnelAnalyzer(FunnelConfig config, QueryExecutor executor, ReferrerSegmenter segmenter) {
        this.config = config;
        this.executor = executor;
        this.segmenter = segmenter;
    }

    /**
     * Renders the filter predicates as a conjunction that can be appended to a WHERE clause, starting with
     * {@code AND}, or an empty string when there are no predicates.
     */
    public abstract String formatPredicates(List<Predicate> predicates, QueryParameters parameters);

    /**
     * One row per visitor that matched the step:
     * {@code step_number, step_name, session_id, visitor_id, first_occurrence[, referrer]}.
     */
    public abstract String buildStepQuery(FunnelStep step, String filterClause, QueryParameters parameters, boolean includeReferrer);

    /**
     * Distinct union of the step queries, ordered by visitor and time.
     */
    public abstract String getFunnelQuery(List<String> stepQueries, boolean includeReferrer);

    /**
     * Daily rows of {@code date, users, conversions, avg_time}.
     */
    public abstract String getTimeSeriesQuery(List<String> stepQueries, int totalSteps);

    public abstract String getVisitorCountQuery(QueryParameters parameters);

    @Override
    public CompletableFuture<FunnelResult> computeFunnel(RequestContext context, List<FunnelStep> steps,
                                                         List<Filter> filters, AnalysisWindow window) {
        List<FunnelStep> funnelSteps = ImmutableList.copyOf(checkSteps(steps));
        checkNotNull(window, "window");
        List<Predicate> predicates = FilterValidator.validate(filters).getOrThrow();

        QueryParameters parameters = bindWindow(context, window);
        String filterClause = formatPredicates(predicates, parameters);
        List<String> stepQueries = funnelSteps.stream()
                .map(step -> buildStepQuery(step, filterClause, parameters, false))
                .collect(Collectors.toList());
        String funnelQuery = getFunnelQuery(stepQueries, false);
        String timeSeriesQuery = getTimeSeriesQuery(stepQueries, funnelSteps.size());
        parameters.freeze();

        LOGGER.debug("Running funnel of %d steps for scope %s", funnelSteps.size(), context.scope);

        QueryExecution primary = executor.executeRawQuery(context, funnelQuery, parameters);
        QueryExecution secondary = executor.executeRawQuery(context, timeSeriesQuery, parameters);

        CompletableFuture<FunnelResult> funnel = primary(context, primary, result -> {
            Map<String, List<RawStepEvent>> timelines = toTimelines(result, false);
            return FunnelAggregator.aggregate(funnelSteps, FunnelStateMachine.evaluateAll(timelines, funnelSteps.size()));
        });
        CompletableFuture<List<DailyPoint>> series = timeSeries(context, secondary);
        // the series is useless once the funnel failed, stop it instead of waiting for its timeout
        funnel.whenComplete((value, failure) -> {
            if (failure != null) {
                secondary.kill();
            }
        });

        return killOnCancel(funnel.thenCombine(series, FunnelResult::withTimeSeries), primary, secondary);
    }

    @Override
    public CompletableFuture<FunnelResult> computeGoal(RequestContext context, FunnelStep step, List<Filter> filters,
                                                       AnalysisWindow window, long totalVisitors) {
        checkNotNull(step, "step");
        checkSteps(ImmutableList.of(step));
        checkNotNull(window, "window");
        checkArgument(totalVisitors >= 0, "Total visitors must not be negative");
        List<Predicate> predicates = FilterValidator.validate(filters).getOrThrow();

        QueryParameters parameters = bindWindow(context, window);
        String filterClause = formatPredicates(predicates, parameters);
        String query = getFunnelQuery(ImmutableList.of(buildStepQuery(step, filterClause, parameters, false)), false);
        parameters.freeze();

        QueryExecution execution = executor.executeRawQuery(context, query, parameters);
        CompletableFuture<FunnelResult> goal = primary(context, execution,
                result -> GoalAnalytics.compute(step, FunnelStateMachine.evaluateAll(toTimelines(result, false), 1), totalVisitors));
        return killOnCancel(goal, execution);
    }

    @Override
    public CompletableFuture<List<ReferrerSegment>> computeReferrerBreakdown(RequestContext context, List<FunnelStep> steps,
                                                                             List<Filter> filters, AnalysisWindow window) {
        List<FunnelStep> funnelSteps = ImmutableList.copyOf(checkSteps(steps));
        checkNotNull(window, "window");
        List<Predicate> predicates = FilterValidator.validate(filters).getOrThrow();

        QueryParameters parameters = bindWindow(context, window);
        String filterClause = formatPredicates(predicates, parameters);
        List<String> stepQueries = funnelSteps.stream()
                .map(step -> buildStepQuery(step, filterClause, parameters, true))
                .collect(Collectors.toList());
        String query = getFunnelQuery(stepQueries, true);
        parameters.freeze();

        QueryExecution execution = executor.executeRawQuery(context, query, parameters);
        CompletableFuture<List<ReferrerSegment>> segments = primary(context, execution,
                result -> segmenter.segment(toTimelines(result, true), funnelSteps.size()));
        return killOnCancel(segments, execution);
    }

    @Override
    public CompletableFuture<Long> countVisitors(RequestContext context, AnalysisWindow window) {
        checkNotNull(window, "window");
        QueryParameters parameters = bindWindow(context, window);
        String query = getVisitorCountQuery(parameters);
        parameters.freeze();

        QueryExecution execution = executor.executeRawQuery(context, query, parameters);
        CompletableFuture<Long> count = primary(context, execution, result -> {
            if (result.getResult() == null || result.getResult().isEmpty()) {
                return 0L;
            }
            Object value = result.getResult().get(0).get(0);
            return value instanceof Number ? ((Number) value).longValue() : Long.parseLong(String.valueOf(value));
        });
        return killOnCancel(count, execution);
    }

    protected QueryParameters bindWindow(RequestContext context, AnalysisWindow window) {
        QueryParameters parameters = new QueryParameters();
        parameters.bind(SCOPE_PARAMETER, STRING, context.scope);
        parameters.bind(START_PARAMETER, TIMESTAMP, window.getStart());
        parameters.bind(END_PARAMETER, TIMESTAMP, window.getEnd());
        return parameters;
    }

    protected Duration getTimeout(RequestContext context) {
        return context.timeout.orElse(config.getQueryTimeout());
    }

    private static Map<String, List<RawStepEvent>> toTimelines(QueryResult result, boolean withReferrer) {
        List<List<Object>> rows = result.getResult() == null ? ImmutableList.of() : result.getResult();
        List<RawStepEvent> events = rows.stream()
                .map(row -> RawStepEvent.fromRow(row, withReferrer))
                .collect(Collectors.toList());
        return VisitorEventGrouper.group(events);
    }

    /**
     * Any failure of the main query fails the whole request.
     */
    private <T> CompletableFuture<T> primary(RequestContext context, QueryExecution execution, Function<QueryResult, T> mapper) {
        Duration timeout = getTimeout(context);
        return withTimeout(execution.getResult(), timeout).handle((result, ex) -> {
            if (ex != null) {
                Throwable cause = unwrap(ex);
                if (cause instanceof TimeoutException) {
                    execution.kill();
                    LOGGER.error("Funnel query for scope %s did not finish in %s", context.scope, timeout);
                } else {
                    LOGGER.error(cause, "Funnel query for scope %s failed", context.scope);
                }
                throw new StepflowException(COMPUTATION_FAILED, INTERNAL_SERVER_ERROR, cause);
            }
            if (result.isFailed()) {
                LOGGER.error("Funnel query for scope %s failed: %s", context.scope, result.getError().message);
                throw new StepflowException(COMPUTATION_FAILED, INTERNAL_SERVER_ERROR,
                        new StepflowException(result.getError().message, BAD_GATEWAY));
            }
            return mapper.apply(result);
        });
    }

    /**
     * The daily series is optional, a failure only leaves it empty.
     */
    private CompletableFuture<List<DailyPoint>> timeSeries(RequestContext context, QueryExecution execution) {
        Duration timeout = getTimeout(context);
        return withTimeout(execution.getResult(), timeout).handle((result, ex) -> {
            if (ex != null) {
                Throwable cause = unwrap(ex);
                if (cause instanceof TimeoutException) {
                    execution.kill();
                }
                LOGGER.warn(cause, "Time series query for scope %s failed, returning the funnel without it", context.scope);
                return ImmutableList.<DailyPoint>of();
            }
            if (result.isFailed()) {
                LOGGER.warn("Time series query for scope %s failed: %s", context.scope, result.getError().message);
                return ImmutableList.<DailyPoint>of();
            }
            try {
                return TimeSeriesReconstructor.fromRows(result);
            } catch (RuntimeException e) {
                LOGGER.warn(e, "Unable to read the time series of scope %s", context.scope);
                return ImmutableList.<DailyPoint>of();
            }
        });
    }

    private static <T> CompletableFuture<T> withTimeout(CompletableFuture<T> future, Duration timeout) {
        // a dependent stage, the executor's own future is left untouched
        return future.thenApply(Function.identity()).orTimeout(timeout.toMillis(), MILLISECONDS);
    }

    private static <T> CompletableFuture<T> killOnCancel(CompletableFuture<T> future, QueryExecution... executions) {
        future.whenComplete((result, ex) -> {
            if (ex instanceof CancellationException) {
                for (QueryExecution execution : executions) {
                    execution.kill();
                }
            }
        });
        return future;
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable cause = ex;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
