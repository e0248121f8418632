package org.stepflow.analysis;

import com.google.common.collect.ImmutableList;
import io.airlift.units.Duration;
import org.stepflow.analysis.FunnelAnalyzer.AnalysisWindow;
import org.stepflow.analysis.InMemoryQueryExecutor.PendingQueryExecution;
import org.stepflow.analysis.filter.Filter;
import org.stepflow.analysis.filter.FilterValidationException;
import org.stepflow.analysis.funnel.DailyPoint;
import org.stepflow.analysis.funnel.FunnelResult;
import org.stepflow.analysis.funnel.RawStepEvent;
import org.stepflow.analysis.referrer.ReferrerSegment;
import org.stepflow.collection.SchemaField;
import org.stepflow.config.FunnelConfig;
import org.stepflow.report.QueryError;
import org.stepflow.report.QueryResult;
import org.stepflow.sql.QueryParameters;
import org.stepflow.util.StepflowException;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static org.stepflow.analysis.AbstractFunnelAnalyzer.COMPUTATION_FAILED;
import static org.stepflow.analysis.funnel.FunnelFixtures.STEPS;
import static org.stepflow.analysis.funnel.FunnelFixtures.at;
import static org.stepflow.analysis.funnel.FunnelFixtures.events;
import static org.stepflow.collection.FieldType.DOUBLE;
import static org.stepflow.collection.FieldType.LONG;
import static org.stepflow.collection.FieldType.STRING;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;

public class TestAbstractFunnelAnalyzer {
    private static final RequestContext CONTEXT = new RequestContext("site-1");
    private static final AnalysisWindow WINDOW = new AnalysisWindow(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 7));
    private static final List<SchemaField> SERIES_METADATA = ImmutableList.of(
            new SchemaField("date", STRING),
            new SchemaField("users", LONG),
            new SchemaField("conversions", LONG),
            new SchemaField("avg_time", DOUBLE));

    private InMemoryQueryExecutor executor;
    private TestingFunnelAnalyzer analyzer;

    @BeforeMethod
    public void setUp() {
        executor = new InMemoryQueryExecutor();
        analyzer = new TestingFunnelAnalyzer(new FunnelConfig(), executor);
    }

    @Test
    public void testFunnelWithTimeSeries() {
        executor.respond(rows(events(), false))
                .respond(new QueryResult(SERIES_METADATA, ImmutableList.of(Arrays.asList("2024-03-01", 2L, 1L, 30.0))));

        FunnelResult result = analyzer.computeFunnel(CONTEXT, STEPS, ImmutableList.of(), WINDOW).join();

        assertEquals(result.entrants, 2);
        assertEquals(result.completions, 1);
        assertEquals(result.overallConversionRate, 50.0);
        assertEquals(result.avgCompletionFormatted, "30s");
        assertEquals(result.biggestDropoffStep, 2);
        assertEquals(result.timeSeries, ImmutableList.of(new DailyPoint(LocalDate.of(2024, 3, 1), 2, 1, 50.0, 1, 30)));
        assertEquals(executor.getQueries(), ImmutableList.of(
                "funnel(step 1, step 2, step 3)",
                "series(step 1, step 2, step 3)"));
    }

    @Test
    public void testWindowAndStepsAreBound() {
        analyzer.computeFunnel(CONTEXT, STEPS, ImmutableList.of(Filter.of("country", "equals", "DE")), WINDOW).join();

        QueryParameters parameters = executor.getParameters().get(0);
        assertTrue(parameters.isFrozen());
        assertEquals(parameters.get("scope").value, "site-1");
        assertEquals(parameters.get("start_time").value, WINDOW.getStart());
        assertEquals(parameters.get("end_time").value, WINDOW.getEnd());
        assertEquals(parameters.get("target_3").value, "signup_completed");
        assertEquals(executor.getQueries().get(0), "funnel(step 1 AND country, step 2 AND country, step 3 AND country)");
    }

    @Test
    public void testInvalidFilterIssuesNoQuery() {
        FilterValidationException exception = expectThrows(FilterValidationException.class,
                () -> analyzer.computeFunnel(CONTEXT, STEPS, ImmutableList.of(Filter.of("password", "equals", "x")), WINDOW));

        assertEquals(exception.getErrors(), ImmutableList.of("Invalid field: password"));
        assertTrue(executor.getQueries().isEmpty());
    }

    @Test
    public void testEmptyStepsRejected() {
        expectThrows(StepflowException.class, () -> analyzer.computeFunnel(CONTEXT, ImmutableList.of(), ImmutableList.of(), WINDOW));
        assertTrue(executor.getQueries().isEmpty());
    }

    @Test
    public void testFailedTimeSeriesLeavesFunnelIntact() {
        executor.respond(rows(events(), false))
                .respond(QueryResult.errorResult(QueryError.create("Memory limit exceeded")));

        FunnelResult result = analyzer.computeFunnel(CONTEXT, STEPS, ImmutableList.of(), WINDOW).join();

        assertEquals(result.entrants, 2);
        assertEquals(result.completions, 1);
        assertTrue(result.timeSeries.isEmpty());
    }

    @Test
    public void testUnreachableTimeSeriesLeavesFunnelIntact() {
        PendingQueryExecution series = new PendingQueryExecution();
        executor.respond(rows(events(), false)).respond(series);

        CompletableFuture<FunnelResult> future = analyzer.computeFunnel(CONTEXT, STEPS, ImmutableList.of(), WINDOW);
        series.fail(new IllegalStateException("connection refused"));

        FunnelResult result = future.join();
        assertEquals(result.steps.size(), 3);
        assertTrue(result.timeSeries.isEmpty());
    }

    @Test
    public void testFailedPrimaryQueryFailsRequest() {
        executor.respond(QueryResult.errorResult(QueryError.create("Table analytics.events doesn't exist")));

        CompletionException exception = expectThrows(CompletionException.class,
                () -> analyzer.computeFunnel(CONTEXT, STEPS, ImmutableList.of(), WINDOW).join());

        assertTrue(exception.getCause() instanceof StepflowException);
        StepflowException cause = (StepflowException) exception.getCause();
        assertEquals(cause.getMessage(), COMPUTATION_FAILED);
        assertEquals(cause.getStatusCode(), INTERNAL_SERVER_ERROR);
    }

    @Test(timeOut = 10_000)
    public void testFailedPrimaryQueryKillsTimeSeries() {
        PendingQueryExecution series = new PendingQueryExecution();
        executor.respond(QueryResult.errorResult(QueryError.create("Table analytics.events doesn't exist"))).respond(series);

        CompletionException exception = expectThrows(CompletionException.class,
                () -> analyzer.computeFunnel(CONTEXT, STEPS, ImmutableList.of(), WINDOW).join());

        assertEquals(exception.getCause().getMessage(), COMPUTATION_FAILED);
        assertTrue(series.isKilled());
    }

    @Test
    public void testTimeoutKillsQuery() {
        PendingQueryExecution primary = new PendingQueryExecution();
        executor.respond(primary);
        RequestContext context = new RequestContext("site-1", new Duration(50, TimeUnit.MILLISECONDS));

        CompletionException exception = expectThrows(CompletionException.class,
                () -> analyzer.computeFunnel(context, STEPS, ImmutableList.of(), WINDOW).join());

        assertEquals(exception.getCause().getMessage(), COMPUTATION_FAILED);
        assertTrue(primary.isKilled());
    }

    @Test
    public void testCancelKillsQueries() {
        PendingQueryExecution primary = new PendingQueryExecution();
        PendingQueryExecution series = new PendingQueryExecution();
        executor.respond(primary).respond(series);

        CompletableFuture<FunnelResult> future = analyzer.computeFunnel(CONTEXT, STEPS, ImmutableList.of(), WINDOW);
        assertFalse(future.isDone());
        future.cancel(true);

        assertTrue(primary.isKilled());
        assertTrue(series.isKilled());
    }

    @Test
    public void testGoalUsesBaseline() {
        executor.respond(rows(ImmutableList.of(
                new RawStepEvent(1, "A", at(0)),
                new RawStepEvent(1, "B", at(5))), false));

        FunnelResult result = analyzer.computeGoal(CONTEXT, STEPS.get(0), ImmutableList.of(), WINDOW, 10).join();

        assertEquals(result.completions, 2);
        assertEquals(result.entrants, 10);
        assertEquals(result.overallConversionRate, 20.0);
        assertTrue(result.timeSeries.isEmpty());
        assertEquals(executor.getQueries(), ImmutableList.of("funnel(step 1)"));
    }

    @Test
    public void testGoalRejectsNegativeBaseline() {
        expectThrows(StepflowException.class,
                () -> analyzer.computeGoal(CONTEXT, STEPS.get(0), ImmutableList.of(), WINDOW, -1));
        assertTrue(executor.getQueries().isEmpty());
    }

    @Test
    public void testReferrerBreakdown() {
        executor.respond(rows(ImmutableList.of(
                new RawStepEvent(1, "Home", "A", "s1", at(0), "https://www.google.com/"),
                new RawStepEvent(2, "Pricing", "A", "s1", at(5), "https://www.google.com/"),
                new RawStepEvent(3, "Signup", "A", "s1", at(9), "https://www.google.com/"),
                new RawStepEvent(1, "Home", "B", "s2", at(0), null)), true));

        List<ReferrerSegment> segments = analyzer.computeReferrerBreakdown(CONTEXT, STEPS, ImmutableList.of(), WINDOW).join();

        assertEquals(segments.stream().map(segment -> segment.referrerKey).collect(Collectors.toList()),
                ImmutableList.of("google.com", "direct"));
        assertEquals(segments.get(0).conversionRate, 100.0);
        assertEquals(segments.get(1).completions, 0);
    }

    @Test
    public void testCountVisitors() {
        executor.respond(new QueryResult(ImmutableList.of(new SchemaField("visitors", LONG)),
                ImmutableList.of(Arrays.<Object>asList(1234L))));

        assertEquals(analyzer.countVisitors(CONTEXT, WINDOW).join().longValue(), 1234L);
        assertEquals(executor.getQueries(), ImmutableList.of("visitors"));
    }

    @Test
    public void testCountVisitorsWithoutRows() {
        assertEquals(analyzer.countVisitors(CONTEXT, WINDOW).join().longValue(), 0L);
    }

    private static QueryResult rows(List<RawStepEvent> events, boolean withReferrer) {
        List<List<Object>> rows = events.stream()
                .map(event -> withReferrer
                        ? Arrays.<Object>asList(event.getStepNumber(), event.getStepName(), event.getSessionId(),
                        event.getVisitorId(), event.getOccurredAt(), event.getReferrer())
                        : Arrays.<Object>asList(event.getStepNumber(), event.getStepName(), event.getSessionId(),
                        event.getVisitorId(), event.getOccurredAt()))
                .collect(Collectors.toList());
        return new QueryResult(ImmutableList.of(), rows);
    }
}
