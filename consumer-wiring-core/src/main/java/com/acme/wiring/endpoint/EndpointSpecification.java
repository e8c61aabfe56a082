package com.acme.wiring.endpoint;

/** A unit of configuration added to a receive endpoint; the transport builds it into a pipe. */
public interface EndpointSpecification {

  ConsumePipe build();
}
