package com.acme.wiring.context;

import com.acme.wiring.consumer.ConsumerFactoryDecorator;
import com.acme.wiring.consumer.MessageConsumer;
import com.acme.wiring.definition.ConsumerDefinition;
import com.acme.wiring.definition.EndpointDefinition;
import com.acme.wiring.registration.ConsumerRegistrationConfigurator;
import com.acme.wiring.registration.ConsumerRegistry;
import com.acme.wiring.registration.RegistrationConfigurator;
import java.util.Objects;

/** Registers consumers in a {@link ConsumerRegistry} and their services in a map context. */
public class SimpleRegistrationConfigurator implements RegistrationConfigurator {

  private final ConsumerRegistry registry;
  private final SimpleRegistrationContext context;

  public SimpleRegistrationConfigurator(ConsumerRegistry registry, SimpleRegistrationContext context) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.context = Objects.requireNonNull(context, "context");
  }

  @Override
  public <T extends MessageConsumer> ConsumerRegistrationConfigurator<T> addConsumer(
      Class<T> consumerType) {
    return registry.addConsumer(consumerType).getConsumerRegistrationConfigurator(this);
  }

  @Override
  public <T> void addConsumerDefinition(ConsumerDefinition<T> definition) {
    context.registerConsumerDefinition(definition);
  }

  @Override
  public <T> void addEndpointDefinition(EndpointDefinition<T> definition) {
    context.registerEndpointDefinition(definition);
  }

  @Override
  public <T> void addConsumerFactoryDecorator(ConsumerFactoryDecorator<T> decorator) {
    context.registerConsumerFactoryDecorator(decorator);
  }

  public ConsumerRegistry getRegistry() {
    return registry;
  }

  public SimpleRegistrationContext getContext() {
    return context;
  }
}
