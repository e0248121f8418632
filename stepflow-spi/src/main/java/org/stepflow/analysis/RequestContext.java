package org.stepflow.analysis;

import io.airlift.units.Duration;

import java.util.Optional;

import static org.stepflow.util.ValidationUtil.checkNotEmpty;

public class RequestContext {
    public final String scope;
    public final Optional<Duration> timeout;

    public RequestContext(String scope) {
        this(scope, Optional.empty());
    }

    public RequestContext(String scope, Duration timeout) {
        this(scope, Optional.of(timeout));
    }

    public RequestContext(String scope, Optional<Duration> timeout) {
        this.scope = checkNotEmpty(scope, "scope");
        this.timeout = timeout;
    }
}
