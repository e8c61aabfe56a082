package com.acme.wiring.micronaut.config;

import com.acme.wiring.config.EndpointNamingConfig;
import com.acme.wiring.registration.ConsumerRegistration;
import com.acme.wiring.registration.ConsumerRegistry;
import io.micronaut.context.annotation.Property;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs effective consumer wiring configuration on application startup for troubleshooting.
 * Disabled in test environment.
 */
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<StartupEvent> {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLogger.class);

    private final EndpointNamingConfig namingConfig;
    private final ConsumerRegistry registry;

    @Property(name = "consumers.discovery.enabled", defaultValue = "true")
    private boolean discoveryEnabled;

    @Property(name = "consumers.configure-endpoints.enabled", defaultValue = "true")
    private boolean configureEndpointsEnabled;

    public ConfigurationLogger(EndpointNamingConfig namingConfig, ConsumerRegistry registry) {
        this.namingConfig = namingConfig;
        this.registry = registry;
    }

    @Override
    public void onApplicationEvent(StartupEvent event) {
        LOG.info("━━━ Consumer Wiring Configuration ━━━");
        LOG.info("  Endpoint Prefix:    {} (Prepended to every derived endpoint name)",
                namingConfig.getPrefix().isEmpty() ? "<none>" : namingConfig.getPrefix());
        LOG.info("  Kebab Case:         {} (Derived endpoint names are kebab-cased)", namingConfig.isKebabCase());
        LOG.info("  Auto Discovery:     {} (MessageConsumer beans registered automatically)",
                discoveryEnabled ? "ENABLED" : "DISABLED");
        LOG.info("  Configure On Start: {} (Unconfigured consumers connected at startup)",
                configureEndpointsEnabled ? "ENABLED" : "DISABLED");

        LOG.info("━━━ Registered Consumers ━━━");
        for (ConsumerRegistration registration : registry.getRegistrations()) {
            LOG.info("  {} [state={}, configureEndpoints={}]",
                    registration.getType().getName(),
                    registration.getState(),
                    registration.isIncludeInConfigureEndpoints());
        }
        LOG.info("");
    }
}
