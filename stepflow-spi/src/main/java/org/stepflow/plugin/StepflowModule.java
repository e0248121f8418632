package org.stepflow.plugin;

import com.google.inject.Binder;
import io.airlift.configuration.ConfigurationAwareModule;
import io.airlift.configuration.ConfigurationFactory;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Base of every backend module. Config objects are built from the {@link ConfigurationFactory} handed to
 * the module and bound as instances.
 */
public abstract class StepflowModule
        implements ConfigurationAwareModule {
    private ConfigurationFactory configurationFactory;
    private Binder binder;

    @Override
    public synchronized void setConfigurationFactory(ConfigurationFactory configurationFactory) {
        this.configurationFactory = checkNotNull(configurationFactory, "configurationFactory is null");
    }

    @Override
    public final synchronized void configure(Binder binder) {
        checkState(this.binder == null, "re-entry not allowed");
        checkState(configurationFactory != null, "configurationFactory is not set for module %s", name());
        this.binder = checkNotNull(binder, "binder is null");

        try {
            setup(binder);
        } finally {
            this.binder = null;
        }
    }

    protected synchronized <T> T buildConfigObject(Class<T> configClass) {
        T config = configurationFactory.build(configClass);
        binder.bind(configClass).toInstance(config);
        return config;
    }

    protected abstract void setup(Binder binder);

    public abstract String name();

    public abstract String description();
}
