package org.stepflow.clickhouse;

import com.google.common.collect.ImmutableMap;
import com.google.common.net.MediaType;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.util.Modules;
import io.airlift.configuration.ConfigurationFactory;
import io.airlift.http.client.HttpClient;
import io.airlift.http.client.HttpStatus;
import io.airlift.http.client.testing.TestingHttpClient;
import io.airlift.units.Duration;
import org.stepflow.analysis.FunnelAnalyzer;
import org.stepflow.clickhouse.analysis.ClickHouseFunnelAnalyzer;
import org.stepflow.config.FunnelConfig;
import org.stepflow.report.QueryExecutor;
import org.testng.annotations.Test;

import java.net.URI;
import java.util.concurrent.TimeUnit;

import static io.airlift.http.client.testing.TestingResponse.mockResponse;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;

public class TestClickHouseModule {
    @Test
    public void testConfigurationIsBound() {
        Injector injector = createInjector(ImmutableMap.of(
                "clickhouse.address", "http://clickhouse:8123",
                "clickhouse.user", "reader",
                "funnel.events-table", "web.events",
                "funnel.query-timeout", "30s"));

        ClickHouseConfig clickHouseConfig = injector.getInstance(ClickHouseConfig.class);
        assertEquals(clickHouseConfig.getAddress(), URI.create("http://clickhouse:8123"));
        assertEquals(clickHouseConfig.getUser(), "reader");
        assertNull(clickHouseConfig.getPassword());

        FunnelConfig funnelConfig = injector.getInstance(FunnelConfig.class);
        assertEquals(funnelConfig.getEventsTable(), "web.events");
        assertEquals(funnelConfig.getCustomEventsTable(), "analytics.custom_events");
        assertEquals(funnelConfig.getQueryTimeout(), new Duration(30, TimeUnit.SECONDS));
    }

    @Test
    public void testAnalyzerWiring() {
        Injector injector = createInjector(ImmutableMap.of());

        FunnelAnalyzer analyzer = injector.getInstance(FunnelAnalyzer.class);
        assertTrue(analyzer instanceof ClickHouseFunnelAnalyzer);
        assertSame(injector.getInstance(FunnelAnalyzer.class), analyzer);
        assertTrue(injector.getInstance(QueryExecutor.class) instanceof ClickHouseQueryExecutor);
    }

    @Test
    public void testConfigurationFactoryRequired() {
        expectThrows(RuntimeException.class, () -> Guice.createInjector(new ClickHouseModule()));
    }

    private static Injector createInjector(ImmutableMap<String, String> properties) {
        ClickHouseModule module = new ClickHouseModule();
        module.setConfigurationFactory(new ConfigurationFactory(properties));
        HttpClient httpClient = new TestingHttpClient(request -> mockResponse(HttpStatus.OK, MediaType.JSON_UTF_8, "{}"));
        return Guice.createInjector(Modules.override(module).with(binder ->
                binder.bind(HttpClient.class).annotatedWith(ForClickHouse.class).toInstance(httpClient)));
    }
}
