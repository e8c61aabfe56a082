package com.acme.wiring.definition;

/** Derives receive endpoint names from consumer types. */
public interface EndpointNameFormatter {

  String consumer(Class<?> consumerType);
}
