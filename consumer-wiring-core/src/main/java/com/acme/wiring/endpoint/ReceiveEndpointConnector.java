package com.acme.wiring.endpoint;

import java.util.function.Consumer;

/** Creates receive endpoints on the transport, e.g. one queue listener per name. */
public interface ReceiveEndpointConnector {

  void connectReceiveEndpoint(String queueName, Consumer<ReceiveEndpointConfigurator> configure);
}
