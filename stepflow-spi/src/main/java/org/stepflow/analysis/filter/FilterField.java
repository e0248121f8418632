package org.stepflow.analysis.filter;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Event columns a filter may reference. Anything outside this list is rejected before a query is built.
 */
public enum FilterField {
    EVENT_NAME("event_name"),
    PATH("path"),
    QUERY_STRING("query_string"),
    REFERRER("referrer"),
    USER_AGENT("user_agent"),
    COUNTRY("country"),
    REGION("region"),
    CITY("city"),
    DEVICE_TYPE("device_type"),
    BROWSER_NAME("browser_name"),
    OS_NAME("os_name"),
    SCREEN_RESOLUTION("screen_resolution"),
    LANGUAGE("language"),
    UTM_SOURCE("utm_source"),
    UTM_MEDIUM("utm_medium"),
    UTM_CAMPAIGN("utm_campaign"),
    UTM_TERM("utm_term"),
    UTM_CONTENT("utm_content");

    private static final Map<String, FilterField> BY_COLUMN = Arrays.stream(values())
            .collect(Collectors.toMap(FilterField::getColumn, Function.identity()));

    private final String column;

    FilterField(String column) {
        this.column = column;
    }

    public static Optional<FilterField> fromColumn(String column) {
        return Optional.ofNullable(column).map(BY_COLUMN::get);
    }

    public String getColumn() {
        return column;
    }
}
