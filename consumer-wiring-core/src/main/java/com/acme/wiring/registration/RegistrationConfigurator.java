package com.acme.wiring.registration;

import com.acme.wiring.consumer.ConsumerFactoryDecorator;
import com.acme.wiring.consumer.MessageConsumer;
import com.acme.wiring.definition.ConsumerDefinition;
import com.acme.wiring.definition.EndpointDefinition;

/**
 * Composition time surface for registering consumers together with the definitions and
 * decorators the registration context later resolves for them.
 */
public interface RegistrationConfigurator {

  <T extends MessageConsumer> ConsumerRegistrationConfigurator<T> addConsumer(Class<T> consumerType);

  <T> void addConsumerDefinition(ConsumerDefinition<T> definition);

  <T> void addEndpointDefinition(EndpointDefinition<T> definition);

  <T> void addConsumerFactoryDecorator(ConsumerFactoryDecorator<T> decorator);
}
