package org.stepflow.config;

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;
import io.airlift.units.Duration;

import java.util.concurrent.TimeUnit;

public class FunnelConfig {
    private String eventsTable = "analytics.events";
    private String customEventsTable = "analytics.custom_events";
    private String timeColumn = "time";
    private String customEventsTimeColumn = "timestamp";
    private String userColumn = "anonymous_id";
    private String sessionColumn = "session_id";
    private String scopeColumn = "client_id";
    private String pageViewEvent = "screen_view";
    private Duration queryTimeout = new Duration(2, TimeUnit.MINUTES);

    public String getEventsTable() {
        return eventsTable;
    }

    @Config("funnel.events-table")
    @ConfigDescription("Table that holds page views and instrumented events")
    public FunnelConfig setEventsTable(String eventsTable) {
        this.eventsTable = eventsTable;
        return this;
    }

    public String getCustomEventsTable() {
        return customEventsTable;
    }

    @Config("funnel.custom-events-table")
    @ConfigDescription("Table that holds user-defined custom events")
    public FunnelConfig setCustomEventsTable(String customEventsTable) {
        this.customEventsTable = customEventsTable;
        return this;
    }

    public String getTimeColumn() {
        return timeColumn;
    }

    @Config("funnel.time-column")
    public FunnelConfig setTimeColumn(String timeColumn) {
        this.timeColumn = timeColumn;
        return this;
    }

    public String getCustomEventsTimeColumn() {
        return customEventsTimeColumn;
    }

    @Config("funnel.custom-events-time-column")
    public FunnelConfig setCustomEventsTimeColumn(String customEventsTimeColumn) {
        this.customEventsTimeColumn = customEventsTimeColumn;
        return this;
    }

    public String getUserColumn() {
        return userColumn;
    }

    @Config("funnel.user-column")
    @ConfigDescription("Column that identifies a visitor")
    public FunnelConfig setUserColumn(String userColumn) {
        this.userColumn = userColumn;
        return this;
    }

    public String getSessionColumn() {
        return sessionColumn;
    }

    @Config("funnel.session-column")
    public FunnelConfig setSessionColumn(String sessionColumn) {
        this.sessionColumn = sessionColumn;
        return this;
    }

    public String getScopeColumn() {
        return scopeColumn;
    }

    @Config("funnel.scope-column")
    @ConfigDescription("Column that scopes events to a single website")
    public FunnelConfig setScopeColumn(String scopeColumn) {
        this.scopeColumn = scopeColumn;
        return this;
    }

    public String getPageViewEvent() {
        return pageViewEvent;
    }

    @Config("funnel.page-view-event")
    public FunnelConfig setPageViewEvent(String pageViewEvent) {
        this.pageViewEvent = pageViewEvent;
        return this;
    }

    public Duration getQueryTimeout() {
        return queryTimeout;
    }

    @Config("funnel.query-timeout")
    @ConfigDescription("Default deadline for funnel queries when the caller does not supply one")
    public FunnelConfig setQueryTimeout(Duration queryTimeout) {
        this.queryTimeout = queryTimeout;
        return this;
    }
}
