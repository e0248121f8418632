package org.stepflow.clickhouse;

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;
import io.airlift.configuration.ConfigSecuritySensitive;
import io.airlift.units.Duration;

import java.net.URI;
import java.util.concurrent.TimeUnit;

public class ClickHouseConfig {
    private URI address = URI.create("http://127.0.0.1:8123");
    private String user;
    private String password;
    private Duration connectTimeout = new Duration(10, TimeUnit.SECONDS);

    public URI getAddress() {
        return address;
    }

    @Config("clickhouse.address")
    public ClickHouseConfig setAddress(URI address) {
        this.address = address;
        return this;
    }

    public String getUser() {
        return user;
    }

    @Config("clickhouse.user")
    public ClickHouseConfig setUser(String user) {
        this.user = user;
        return this;
    }

    public String getPassword() {
        return password;
    }

    @Config("clickhouse.password")
    @ConfigSecuritySensitive
    public ClickHouseConfig setPassword(String password) {
        this.password = password;
        return this;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    @Config("clickhouse.connect-timeout")
    @ConfigDescription("Connect timeout of the HTTP client that talks to ClickHouse")
    public ClickHouseConfig setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
        return this;
    }
}
