package com.acme.wiring.endpoint;

import com.acme.wiring.consumer.ConsumeContext;

/** Delivers received messages to whatever an endpoint specification bound to the endpoint. */
@FunctionalInterface
public interface ConsumePipe {

  void send(ConsumeContext context) throws Exception;
}
