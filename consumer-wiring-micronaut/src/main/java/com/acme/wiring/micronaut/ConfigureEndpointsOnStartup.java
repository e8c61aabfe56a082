package com.acme.wiring.micronaut;

import com.acme.wiring.endpoint.ReceiveEndpointConnector;
import com.acme.wiring.registration.ConfigureEndpoints;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Places every discovered consumer that was not configured explicitly on its receive endpoint once
 * the application has started. Only active when the application provides a transport connector.
 */
@Singleton
@Requires(beans = ReceiveEndpointConnector.class)
@Requires(property = "consumers.configure-endpoints.enabled", value = "true", defaultValue = "true")
@RequiredArgsConstructor
@Slf4j
public class ConfigureEndpointsOnStartup implements ApplicationEventListener<StartupEvent> {
    private final ConfigureEndpoints configureEndpoints;
    private final ReceiveEndpointConnector connector;
    private final BeanContextRegistrationContext registrationContext;

    @Override
    public void onApplicationEvent(StartupEvent event) {
        log.info("Configuring receive endpoints for registered consumers...");
        int endpoints = configureEndpoints.configure(connector, registrationContext);
        log.info("Receive endpoint configuration complete: {} endpoint(s) connected", endpoints);
    }
}
