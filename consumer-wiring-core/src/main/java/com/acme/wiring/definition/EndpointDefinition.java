package com.acme.wiring.definition;

import com.acme.wiring.endpoint.ReceiveEndpointConfigurator;

/**
 * Endpoint level settings of a consumer, registered separately from its {@link
 * ConsumerDefinition} so naming and endpoint behaviour can be changed independently.
 *
 * @param <T> consumer type
 */
public interface EndpointDefinition<T> {

  Class<T> getConsumerType();

  /** Endpoint name, or {@code null} to let the consumer definition derive one. */
  String getEndpointName(EndpointNameFormatter formatter);

  Integer getPrefetchCount();

  Integer getConcurrentMessageLimit();

  /** Applies the endpoint settings before any consumer is bound to the endpoint. */
  void configure(ReceiveEndpointConfigurator configurator);
}
