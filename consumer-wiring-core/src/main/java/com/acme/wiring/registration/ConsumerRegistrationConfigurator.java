package com.acme.wiring.registration;

import com.acme.wiring.configurator.ConsumerConfigurator;
import com.acme.wiring.consumer.ConsumerFactoryDecorator;
import com.acme.wiring.definition.ConsumerDefinition;
import com.acme.wiring.definition.ConsumerEndpointDefinition;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Typed view of one consumer registration. Everything added here is keyed by the consumer type,
 * so actions and definitions cannot end up on another consumer.
 */
public class ConsumerRegistrationConfigurator<T> {

  private final RegistrationConfigurator registrationConfigurator;
  private final DefaultConsumerRegistration<T> registration;

  public ConsumerRegistrationConfigurator(
      RegistrationConfigurator registrationConfigurator,
      DefaultConsumerRegistration<T> registration) {
    this.registrationConfigurator =
        Objects.requireNonNull(registrationConfigurator, "registrationConfigurator");
    this.registration = Objects.requireNonNull(registration, "registration");
  }

  public Class<T> getConsumerType() {
    return registration.getType();
  }

  public ConsumerRegistration getRegistration() {
    return registration;
  }

  /** Queues an action run against the consumer configurator each time the consumer is wired. */
  public ConsumerRegistrationConfigurator<T> configure(Consumer<ConsumerConfigurator<T>> action) {
    registration.addConfigureAction(action);
    return this;
  }

  /**
   * Registers an endpoint definition for the consumer, replacing the definition's own. At most one
   * endpoint definition may be registered per consumer type.
   *
   * @throws IllegalStateException if one is already registered
   */
  public ConsumerRegistrationConfigurator<T> endpoint(
      Consumer<ConsumerEndpointDefinition<T>> configure) {
    ConsumerEndpointDefinition<T> endpointDefinition =
        new ConsumerEndpointDefinition<>(registration.getType());
    configure.accept(endpointDefinition);
    registrationConfigurator.addEndpointDefinition(endpointDefinition);
    return this;
  }

  /** @throws IllegalStateException if a definition is already registered for the consumer type */
  public ConsumerRegistrationConfigurator<T> definition(ConsumerDefinition<T> definition) {
    requireSameType(definition.getConsumerType());
    registrationConfigurator.addConsumerDefinition(definition);
    return this;
  }

  public ConsumerRegistrationConfigurator<T> decorate(ConsumerFactoryDecorator<T> decorator) {
    requireSameType(decorator.getConsumerType());
    registrationConfigurator.addConsumerFactoryDecorator(decorator);
    return this;
  }

  public ConsumerRegistrationConfigurator<T> excludeFromConfigureEndpoints() {
    registration.excludeFromConfigureEndpoints();
    return this;
  }

  private void requireSameType(Class<?> consumerType) {
    if (consumerType != registration.getType()) {
      throw new IllegalArgumentException(
          "Expected consumer type "
              + registration.getType().getName()
              + " but was "
              + (consumerType == null ? null : consumerType.getName()));
    }
  }
}
