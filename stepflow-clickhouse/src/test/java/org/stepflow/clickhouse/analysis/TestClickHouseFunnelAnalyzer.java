package org.stepflow.clickhouse.analysis;

import com.google.common.collect.ImmutableList;
import org.stepflow.analysis.FunnelAnalyzer.AnalysisWindow;
import org.stepflow.analysis.FunnelAnalyzer.FunnelStep;
import org.stepflow.analysis.InMemoryQueryExecutor;
import org.stepflow.analysis.RequestContext;
import org.stepflow.analysis.filter.Filter;
import org.stepflow.analysis.referrer.ReferrerParser;
import org.stepflow.analysis.referrer.ReferrerSegmenter;
import org.stepflow.analysis.referrer.StaticReferrerProvider;
import org.stepflow.config.FunnelConfig;
import org.stepflow.sql.NamedParameterValue;
import org.stepflow.sql.QueryParameters;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.time.LocalDate;

import static org.stepflow.analysis.FunnelAnalyzer.StepType.EVENT;
import static org.stepflow.analysis.FunnelAnalyzer.StepType.PAGE_VIEW;
import static org.stepflow.collection.FieldType.STRING;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;

public class TestClickHouseFunnelAnalyzer {
    private static final RequestContext CONTEXT = new RequestContext("site-1");
    private static final AnalysisWindow WINDOW = new AnalysisWindow(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 31));
    private static final FunnelStep HOME = new FunnelStep(1, "Home", PAGE_VIEW, "/home");
    private static final FunnelStep CHECKOUT = new FunnelStep(2, "Checkout", EVENT, "checkout_started");

    private InMemoryQueryExecutor executor;
    private ClickHouseFunnelAnalyzer analyzer;

    @BeforeMethod
    public void setUp() {
        executor = new InMemoryQueryExecutor();
        analyzer = new ClickHouseFunnelAnalyzer(new FunnelConfig(), executor,
                new ReferrerSegmenter(new ReferrerParser(new StaticReferrerProvider())));
    }

    @Test
    public void testPageViewStep() {
        QueryParameters parameters = new QueryParameters();
        String query = analyzer.buildStepQuery(new FunnelStep(1, "Offers", PAGE_VIEW, "/50%_off"), "", parameters, false);

        assertTrue(query.startsWith("SELECT 1 AS step_number, {step_name_0:String} AS step_name"));
        assertTrue(query.contains("FROM `analytics`.`events`"));
        assertTrue(query.contains("`event_name` = {page_view_event:String}"));
        assertTrue(query.contains("(`path` = {target_0:String} OR `path` LIKE {target_0_like:String})"));
        assertTrue(query.endsWith("GROUP BY e.visitor_id"));
        assertFalse(query.contains("/50%_off"));

        assertEquals(parameters.get("target_0"), new NamedParameterValue(STRING, "/50%_off"));
        assertEquals(parameters.get("target_0_like"), new NamedParameterValue(STRING, "%/50\\%\\_off%"));
        assertEquals(parameters.get("page_view_event"), new NamedParameterValue(STRING, "screen_view"));
    }

    @Test
    public void testEventStepUnionsCustomEvents() {
        QueryParameters parameters = new QueryParameters();
        String query = analyzer.buildStepQuery(CHECKOUT, " AND `country` = {f0_country_equals:String}", parameters, false);

        assertTrue(query.contains("FROM `analytics`.`custom_events`"));
        assertTrue(query.contains("UNION ALL"));
        assertTrue(query.contains("`timestamp` >= {start_time:DateTime('UTC')}"));
        assertEquals(countOccurrences(query, "{target_1:String}"), 2);
        assertEquals(countOccurrences(query, "{f0_country_equals:String}"), 1);
        assertEquals(parameters.get("step_name_1").value, "Checkout");
    }

    @Test
    public void testReferrerJoin() {
        String query = analyzer.buildStepQuery(HOME, "", new QueryParameters(), true);

        assertTrue(query.contains("any(vr.visitor_referrer) AS referrer"));
        assertTrue(query.contains("argMin(`referrer`, `time`)"));
        assertTrue(query.contains("LEFT JOIN ("));
    }

    @Test
    public void testFunnelIssuesParameterizedQueries() {
        analyzer.computeFunnel(CONTEXT, ImmutableList.of(HOME, CHECKOUT),
                ImmutableList.of(Filter.of("country", "equals", "'; DROP TABLE events; --")), WINDOW).join();

        assertEquals(executor.getQueries().size(), 2);
        String funnel = executor.getQueries().get(0);
        String series = executor.getQueries().get(1);
        assertTrue(funnel.startsWith("WITH all_step_events AS ("));
        assertTrue(funnel.endsWith("ORDER BY visitor_id, first_occurrence"));
        assertTrue(series.contains("WHERE step_number = 2 GROUP BY day, visitor_id"));
        for (String query : executor.getQueries()) {
            assertFalse(query.contains("DROP TABLE"));
            assertFalse(query.contains("site-1"));
            assertFalse(query.contains("checkout_started"));
        }

        QueryParameters parameters = executor.getParameters().get(0);
        assertTrue(parameters.isFrozen());
        assertEquals(parameters.get("scope").value, "site-1");
        assertEquals(parameters.get("f0_country_equals").value, "'; DROP TABLE events; --");
    }

    @Test
    public void testVisitorCountQuery() {
        analyzer.countVisitors(CONTEXT, WINDOW).join();

        String query = executor.getQueries().get(0);
        assertTrue(query.startsWith("SELECT uniqExact(`anonymous_id`) AS visitors"));
        assertTrue(query.contains("`client_id` = {scope:String}"));
    }

    @Test
    public void testInvalidIdentifierInConfiguration() {
        ClickHouseFunnelAnalyzer misconfigured = new ClickHouseFunnelAnalyzer(new FunnelConfig().setEventsTable("events; DROP"),
                executor, new ReferrerSegmenter(new ReferrerParser(new StaticReferrerProvider())));

        expectThrows(IllegalArgumentException.class, () -> misconfigured.buildStepQuery(HOME, "", new QueryParameters(), false));
    }

    private static int countOccurrences(String text, String part) {
        int count = 0;
        int index = text.indexOf(part);
        while (index >= 0) {
            count++;
            index = text.indexOf(part, index + part.length());
        }
        return count;
    }
}
