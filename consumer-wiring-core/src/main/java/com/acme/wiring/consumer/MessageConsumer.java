package com.acme.wiring.consumer;

/** Marker for handler types that process messages delivered to a receive endpoint. */
public interface MessageConsumer {

  void consume(ConsumeContext context) throws Exception;
}
