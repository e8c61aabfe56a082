package com.acme.wiring.micronaut.config;

import com.acme.wiring.config.EndpointNamingConfig;
import com.acme.wiring.definition.DefaultEndpointNameFormatter;
import com.acme.wiring.definition.EndpointNameFormatter;
import com.acme.wiring.registration.ConfigureEndpoints;
import com.acme.wiring.registration.ConsumerRegistry;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;

/**
 * Factory for the framework-free wiring beans.
 *
 * <p>The core module stays free of framework dependencies; this module does the DI wiring.
 */
@Factory
public class ConsumerWiringFactory {

  /** Creates EndpointNamingConfig bean populated from consumers.endpoint-naming.* properties */
  @Singleton
  @ConfigurationProperties("consumers.endpoint-naming")
  public EndpointNamingConfig endpointNamingConfig() {
    return new EndpointNamingConfig();
  }

  @Singleton
  public EndpointNameFormatter endpointNameFormatter(EndpointNamingConfig namingConfig) {
    return new DefaultEndpointNameFormatter(namingConfig);
  }

  /** Creates ConsumerRegistry singleton */
  @Singleton
  public ConsumerRegistry consumerRegistry() {
    return new ConsumerRegistry();
  }

  @Singleton
  public ConfigureEndpoints configureEndpoints(
      ConsumerRegistry registry, EndpointNameFormatter formatter) {
    return new ConfigureEndpoints(registry, formatter);
  }
}
