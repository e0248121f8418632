package org.stepflow.clickhouse.analysis;

import com.google.inject.Inject;
import org.stepflow.analysis.AbstractFunnelAnalyzer;
import org.stepflow.analysis.filter.FilterValidator;
import org.stepflow.analysis.filter.Predicate;
import org.stepflow.analysis.referrer.ReferrerSegmenter;
import org.stepflow.config.FunnelConfig;
import org.stepflow.report.QueryExecutor;
import org.stepflow.sql.QueryParameters;

import java.util.List;

import static java.lang.String.format;
import static org.stepflow.clickhouse.analysis.ClickHousePredicateFormatter.placeholder;
import static org.stepflow.collection.FieldType.STRING;
import static org.stepflow.collection.FieldType.TIMESTAMP;
import static org.stepflow.util.ValidationUtil.checkTableColumn;

public class ClickHouseFunnelAnalyzer
        extends AbstractFunnelAnalyzer {
    private static final String PAGE_VIEW_PARAMETER = "page_view_event";

    @Inject
    public ClickHouseFunnelAnalyzer(FunnelConfig config, QueryExecutor executor, ReferrerSegmenter segmenter) {
        super(config, executor, segmenter);
    }

    @Override
    public String formatPredicates(List<Predicate> predicates, QueryParameters parameters) {
        return ClickHousePredicateFormatter.formatPredicates(predicates, parameters);
    }

    @Override
    public String buildStepQuery(FunnelStep step, String filterClause, QueryParameters parameters, boolean includeReferrer) {
        int idx = step.getStepNumber() - 1;
        String name = parameters.bind("step_name_" + idx, STRING, step.getName());
        String target = parameters.bind("target_" + idx, STRING, step.getTarget());

        String source;
        switch (step.getType()) {
            case PAGE_VIEW:
                String targetLike = parameters.bind("target_" + idx + "_like", STRING,
                        "%" + FilterValidator.escapeLikePattern(step.getTarget()) + "%");
                source = format("SELECT %s AS visitor_id, %s AS session_id, %s AS occurred_at\n" +
                                "        FROM %s\n" +
                                "        WHERE %s\n" +
                                "          AND %s = %s\n" +
                                "          AND (%s = %s OR %s LIKE %s)%s",
                        column(config.getUserColumn()), column(config.getSessionColumn()), column(config.getTimeColumn()),
                        table(config.getEventsTable()),
                        windowCondition(config.getTimeColumn()),
                        column("event_name"), pageViewEvent(parameters),
                        column("path"), placeholder(target, STRING), column("path"), placeholder(targetLike, STRING),
                        filterClause);
                break;
            case EVENT:
                // filters only apply to instrumented events, custom events carry none of the filter columns
                source = format("SELECT %s AS visitor_id, %s AS session_id, %s AS occurred_at\n" +
                                "        FROM %s\n" +
                                "        WHERE %s\n" +
                                "          AND %s = %s%s\n" +
                                "        UNION ALL\n" +
                                "        SELECT %s AS visitor_id, %s AS session_id, %s AS occurred_at\n" +
                                "        FROM %s\n" +
                                "        WHERE %s\n" +
                                "          AND %s = %s",
                        column(config.getUserColumn()), column(config.getSessionColumn()), column(config.getTimeColumn()),
                        table(config.getEventsTable()),
                        windowCondition(config.getTimeColumn()),
                        column("event_name"), placeholder(target, STRING), filterClause,
                        column(config.getUserColumn()), column(config.getSessionColumn()), column(config.getCustomEventsTimeColumn()),
                        table(config.getCustomEventsTable()),
                        windowCondition(config.getCustomEventsTimeColumn()),
                        column("event_name"), placeholder(target, STRING));
                break;
            default:
                throw new IllegalStateException("Unknown step type: " + step.getType());
        }

        return format("SELECT %d AS step_number, %s AS step_name, any(e.session_id) AS session_id,\n" +
                        "    e.visitor_id AS visitor_id, min(e.occurred_at) AS first_occurrence%s\n" +
                        "FROM (\n" +
                        "        %s\n" +
                        ") e%s\n" +
                        "GROUP BY e.visitor_id",
                step.getStepNumber(), placeholder(name, STRING),
                includeReferrer ? ", any(vr.visitor_referrer) AS referrer" : "",
                source,
                includeReferrer ? "\nLEFT JOIN (" + firstReferrerQuery(parameters) + ") vr ON e.visitor_id = vr.referrer_visitor" : "");
    }

    @Override
    public String getFunnelQuery(List<String> stepQueries, boolean includeReferrer) {
        return format("WITH all_step_events AS (\n%s\n)\n" +
                        "SELECT DISTINCT step_number, step_name, session_id, visitor_id, first_occurrence%s\n" +
                        "FROM all_step_events\n" +
                        "ORDER BY visitor_id, first_occurrence",
                String.join("\nUNION ALL\n", stepQueries),
                includeReferrer ? ", referrer" : "");
    }

    @Override
    public String getTimeSeriesQuery(List<String> stepQueries, int totalSteps) {
        return format("WITH all_step_events AS (\n%s\n),\n" +
                        "daily_first AS (\n" +
                        "    SELECT toDate(first_occurrence) AS day, visitor_id, min(first_occurrence) AS first_time\n" +
                        "    FROM all_step_events WHERE step_number = 1 GROUP BY day, visitor_id\n" +
                        "),\n" +
                        "daily_last AS (\n" +
                        "    SELECT toDate(first_occurrence) AS day, visitor_id, max(first_occurrence) AS last_time\n" +
                        "    FROM all_step_events WHERE step_number = %d GROUP BY day, visitor_id\n" +
                        ")\n" +
                        "SELECT toString(f.day) AS date, uniqExact(f.visitor_id) AS users,\n" +
                        "    uniqExactIf(l.visitor_id, l.visitor_id != '') AS conversions,\n" +
                        "    avg(if(l.visitor_id != '', dateDiff('second', f.first_time, l.last_time), 0)) AS avg_time\n" +
                        "FROM daily_first f\n" +
                        "LEFT JOIN daily_last l ON f.visitor_id = l.visitor_id AND f.day = l.day\n" +
                        "GROUP BY f.day\n" +
                        "ORDER BY f.day",
                String.join("\nUNION ALL\n", stepQueries), totalSteps);
    }

    @Override
    public String getVisitorCountQuery(QueryParameters parameters) {
        return format("SELECT uniqExact(%s) AS visitors\n" +
                        "FROM %s\n" +
                        "WHERE %s\n" +
                        "  AND %s = %s",
                column(config.getUserColumn()),
                table(config.getEventsTable()),
                windowCondition(config.getTimeColumn()),
                column("event_name"), pageViewEvent(parameters));
    }

    /**
     * Earliest non-empty referrer of each visitor among page views in the window.
     */
    private String firstReferrerQuery(QueryParameters parameters) {
        return format("SELECT %s AS referrer_visitor, argMin(%s, %s) AS visitor_referrer\n" +
                        "    FROM %s\n" +
                        "    WHERE %s\n" +
                        "      AND %s = %s AND %s != ''\n" +
                        "    GROUP BY %s",
                column(config.getUserColumn()), column("referrer"), column(config.getTimeColumn()),
                table(config.getEventsTable()),
                windowCondition(config.getTimeColumn()),
                column("event_name"), pageViewEvent(parameters), column("referrer"),
                column(config.getUserColumn()));
    }

    private String pageViewEvent(QueryParameters parameters) {
        return placeholder(parameters.bind(PAGE_VIEW_PARAMETER, STRING, config.getPageViewEvent()), STRING);
    }

    private String windowCondition(String timeColumn) {
        String time = column(timeColumn);
        return format("%s = %s AND %s >= %s AND %s <= %s",
                column(config.getScopeColumn()), placeholder(SCOPE_PARAMETER, STRING),
                time, placeholder(START_PARAMETER, TIMESTAMP),
                time, placeholder(END_PARAMETER, TIMESTAMP));
    }

    private static String column(String name) {
        return checkTableColumn(name, '`');
    }

    private static String table(String name) {
        return column(name);
    }
}
