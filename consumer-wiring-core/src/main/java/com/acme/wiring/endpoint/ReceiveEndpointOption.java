package com.acme.wiring.endpoint;

import com.acme.wiring.configurator.ConsumerOption;

/** Consumer option that also needs to adjust the receive endpoint it is bound to. */
public interface ReceiveEndpointOption extends ConsumerOption {

  void configure(String endpointName, ReceiveEndpointConfigurator configurator);
}
