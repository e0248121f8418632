package org.stepflow.clickhouse;

import com.google.inject.Binder;
import com.google.inject.Provides;
import com.google.inject.Scopes;
import com.google.inject.Singleton;
import io.airlift.http.client.HttpClient;
import io.airlift.http.client.HttpClientConfig;
import io.airlift.http.client.jetty.JettyHttpClient;
import org.stepflow.analysis.FunnelAnalyzer;
import org.stepflow.analysis.referrer.ReferrerProvider;
import org.stepflow.analysis.referrer.StaticReferrerProvider;
import org.stepflow.clickhouse.analysis.ClickHouseFunnelAnalyzer;
import org.stepflow.config.FunnelConfig;
import org.stepflow.plugin.StepflowModule;
import org.stepflow.report.QueryExecutor;

public class ClickHouseModule
        extends StepflowModule {
    @Override
    protected void setup(Binder binder) {
        buildConfigObject(FunnelConfig.class);
        buildConfigObject(ClickHouseConfig.class);

        binder.bind(ReferrerProvider.class).to(StaticReferrerProvider.class).in(Scopes.SINGLETON);
        binder.bind(QueryExecutor.class).to(ClickHouseQueryExecutor.class).in(Scopes.SINGLETON);
        binder.bind(FunnelAnalyzer.class).to(ClickHouseFunnelAnalyzer.class).in(Scopes.SINGLETON);
    }

    @Provides
    @Singleton
    @ForClickHouse
    public HttpClient getHttpClient(ClickHouseConfig config) {
        return new JettyHttpClient(new HttpClientConfig()
                .setConnectTimeout(config.getConnectTimeout()));
    }

    @Override
    public String name() {
        return "ClickHouse funnel backend";
    }

    @Override
    public String description() {
        return "Runs funnel step queries on ClickHouse over its HTTP interface.";
    }
}
