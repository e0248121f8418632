package org.stepflow.report;

import org.stepflow.analysis.RequestContext;
import org.stepflow.sql.QueryParameters;

public interface QueryExecutor {
    /**
     * Issues a parameterized read query against the event store. The executor owns the connection;
     * callers only see the returned execution.
     */
    QueryExecution executeRawQuery(RequestContext context, String sqlQuery, QueryParameters parameters);
}
