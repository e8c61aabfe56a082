package com.acme.wiring.endpoint;

import java.net.URI;

/**
 * Transport side builder of one receive endpoint. Specifications added here accumulate; nothing
 * is replaced.
 */
public interface ReceiveEndpointConfigurator {

  /**
   * Address the endpoint receives from. Must name the endpoint: an opaque address such as {@code
   * queue:orders}, or one whose path ends in the endpoint name. Consumers are not configured on an
   * endpoint whose address names none.
   *
   * @see EndpointAddresses#endpointName(URI)
   */
  URI getInputAddress();

  int getPrefetchCount();

  void setPrefetchCount(int prefetchCount);

  Integer getConcurrentMessageLimit();

  void setConcurrentMessageLimit(Integer concurrentMessageLimit);

  void addEndpointSpecification(EndpointSpecification specification);
}
