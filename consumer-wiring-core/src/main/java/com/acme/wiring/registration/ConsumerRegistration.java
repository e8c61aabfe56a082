package com.acme.wiring.registration;

import com.acme.wiring.configurator.ConsumerConfigurator;
import com.acme.wiring.definition.ConsumerDefinition;
import com.acme.wiring.endpoint.ReceiveEndpointConfigurator;
import com.acme.wiring.spi.RegistrationContext;
import java.util.function.Consumer;

/** Registration of one consumer type, as seen by code that does not know the type statically. */
public interface ConsumerRegistration {

  Class<?> getType();

  RegistrationState getState();

  /** True while the consumer is neither excluded nor already configured on an endpoint. */
  boolean isIncludeInConfigureEndpoints();

  void excludeFromConfigureEndpoints();

  /**
   * Queues {@code action} when {@code consumerType} is this registration's type; any other type is
   * ignored.
   */
  <C> void addConfigureAction(Class<C> consumerType, Consumer<ConsumerConfigurator<C>> action);

  /** Binds the consumer to the endpoint being built. */
  void configure(ReceiveEndpointConfigurator configurator, RegistrationContext context);

  ConsumerDefinition<?> getDefinition(RegistrationContext context);

  ConsumerRegistrationConfigurator<?> getConsumerRegistrationConfigurator(
      RegistrationConfigurator registrationConfigurator);
}
