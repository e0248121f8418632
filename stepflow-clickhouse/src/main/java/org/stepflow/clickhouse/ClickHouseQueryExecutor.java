package org.stepflow.clickhouse;

import com.google.inject.Inject;
import io.airlift.http.client.HttpClient;
import io.airlift.log.Logger;
import org.stepflow.analysis.RequestContext;
import org.stepflow.clickhouse.analysis.ClickHouseQueryExecution;
import org.stepflow.report.QueryExecution;
import org.stepflow.report.QueryExecutor;
import org.stepflow.sql.QueryParameters;

import static com.google.common.base.Preconditions.checkArgument;

public class ClickHouseQueryExecutor
        implements QueryExecutor {
    private static final Logger LOGGER = Logger.get(ClickHouseQueryExecutor.class);

    private final ClickHouseConfig config;
    private final HttpClient httpClient;

    @Inject
    public ClickHouseQueryExecutor(ClickHouseConfig config, @ForClickHouse HttpClient httpClient) {
        this.config = config;
        this.httpClient = httpClient;
    }

    @Override
    public QueryExecution executeRawQuery(RequestContext context, String sqlQuery, QueryParameters parameters) {
        checkArgument(parameters.isFrozen(), "parameters must be frozen before the query is executed");
        ClickHouseQueryExecution execution = new ClickHouseQueryExecution(httpClient, config, sqlQuery, parameters);
        LOGGER.debug("Sent query %s for scope %s with %d parameters", execution.getQueryId(), context.scope,
                parameters.asMap().size());
        return execution;
    }
}
