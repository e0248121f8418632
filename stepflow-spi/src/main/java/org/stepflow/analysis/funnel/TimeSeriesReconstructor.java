package org.stepflow.analysis.funnel;

import com.google.common.collect.ImmutableList;
import org.stepflow.collection.SchemaField;
import org.stepflow.report.QueryResult;

import java.time.LocalDate;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static org.stepflow.analysis.funnel.FunnelMath.percentage;
import static org.stepflow.analysis.funnel.FunnelMath.roundedMean;

/**
 * Maps the rows of the daily query, {@code date, users, conversions, avg_time}, to {@link DailyPoint}s.
 */
public final class TimeSeriesReconstructor {
    private TimeSeriesReconstructor() {
    }

    public static List<DailyPoint> fromRows(QueryResult result) {
        checkArgument(!result.isFailed(), "time series query failed");
        if (result.getResult() == null) {
            return ImmutableList.of();
        }

        int date = indexOf(result.getMetadata(), "date", 0);
        int users = indexOf(result.getMetadata(), "users", 1);
        int conversions = indexOf(result.getMetadata(), "conversions", 2);
        int avgTime = indexOf(result.getMetadata(), "avg_time", 3);

        ImmutableList.Builder<DailyPoint> points = ImmutableList.builder();
        for (List<Object> row : result.getResult()) {
            long entrants = toLong(row.get(users));
            long converted = toLong(row.get(conversions));
            points.add(new DailyPoint(
                    toDate(row.get(date)),
                    entrants,
                    converted,
                    percentage(converted, entrants),
                    entrants - converted,
                    roundedMean(toDouble(row.get(avgTime)))));
        }
        return points.build();
    }

    private static int indexOf(List<SchemaField> metadata, String name, int fallback) {
        if (metadata == null) {
            return fallback;
        }
        for (int i = 0; i < metadata.size(); i++) {
            if (metadata.get(i).getName().equals(name)) {
                return i;
            }
        }
        return fallback;
    }

    private static long toLong(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return Long.parseLong(value.toString());
    }

    private static double toDouble(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return Double.parseDouble(value.toString());
    }

    private static LocalDate toDate(Object value) {
        if (value instanceof LocalDate) {
            return (LocalDate) value;
        }
        String text = value.toString();
        return LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text);
    }
}
