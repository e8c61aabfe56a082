package com.acme.wiring.definition;

import com.acme.wiring.configurator.ConsumerConfigurator;
import com.acme.wiring.endpoint.ReceiveEndpointConfigurator;
import com.acme.wiring.spi.RegistrationContext;

/**
 * Per consumer type configuration policy, applied each time the consumer is bound to a receive
 * endpoint.
 *
 * @param <T> consumer type
 */
public interface ConsumerDefinition<T> {

  Class<T> getConsumerType();

  /** Name of the endpoint the consumer is placed on when endpoints are configured in bulk. */
  String getEndpointName(EndpointNameFormatter formatter);

  /** Consumer level concurrency, or {@code null} when unbounded. */
  Integer getConcurrentMessageLimit();

  EndpointDefinition<T> getEndpointDefinition();

  void setEndpointDefinition(EndpointDefinition<T> endpointDefinition);

  /**
   * Sets endpoint and consumer options. Runs before any configure action queued on the
   * registration.
   */
  void configure(
      ReceiveEndpointConfigurator endpointConfigurator,
      ConsumerConfigurator<T> consumerConfigurator,
      RegistrationContext context);
}
