package com.acme.wiring.registration;

import com.acme.wiring.configurator.ConsumerConfigurator;
import com.acme.wiring.consumer.MessageConsumer;
import com.acme.wiring.endpoint.ReceiveEndpointConfigurator;
import com.acme.wiring.spi.RegistrationContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of consumer registrations, one per consumer type, in registration order. This is a
 * generic infrastructure component. Pure POJO - no framework dependencies.
 */
public class ConsumerRegistry {
  private static final Logger log = LoggerFactory.getLogger(ConsumerRegistry.class);

  private final Map<Class<?>, DefaultConsumerRegistration<?>> registrations = new LinkedHashMap<>();

  /** Registers {@code consumerType}, or returns the existing registration if already present. */
  public synchronized <T extends MessageConsumer> DefaultConsumerRegistration<T> addConsumer(
      Class<T> consumerType) {
    Objects.requireNonNull(consumerType, "consumerType");
    DefaultConsumerRegistration<T> existing = lookup(consumerType);
    if (existing != null) {
      log.debug("Consumer already registered: {}", consumerType.getName());
      return existing;
    }
    log.info("Registering consumer: {}", consumerType.getName());
    DefaultConsumerRegistration<T> registration = new DefaultConsumerRegistration<>(consumerType);
    registrations.put(consumerType, registration);
    return registration;
  }

  public synchronized Optional<ConsumerRegistration> find(Class<?> consumerType) {
    return Optional.ofNullable(registrations.get(consumerType));
  }

  public synchronized boolean contains(Class<?> consumerType) {
    return registrations.containsKey(consumerType);
  }

  /** Snapshot of all registrations, in the order they were added. */
  public synchronized List<ConsumerRegistration> getRegistrations() {
    return Collections.unmodifiableList(new ArrayList<>(registrations.values()));
  }

  /**
   * Queues a configure action on the registration of {@code consumerType}.
   *
   * @throws IllegalStateException if no consumer of that type is registered
   */
  public <T> void addConfigureAction(
      Class<T> consumerType, Consumer<ConsumerConfigurator<T>> action) {
    require(consumerType).addConfigureAction(action);
  }

  /**
   * Binds {@code consumerType} to an endpoint the caller is building, outside the bulk pass.
   *
   * @throws IllegalStateException if no consumer of that type is registered
   */
  public void configureConsumer(
      Class<?> consumerType, ReceiveEndpointConfigurator configurator, RegistrationContext context) {
    require(consumerType).configure(configurator, context);
  }

  private synchronized <T> DefaultConsumerRegistration<T> require(Class<T> consumerType) {
    DefaultConsumerRegistration<T> registration = lookup(consumerType);
    if (registration == null) {
      String error = "No consumer registered for type: " + consumerType.getName();
      log.error(error);
      throw new IllegalStateException(error);
    }
    return registration;
  }

  @SuppressWarnings("unchecked")
  private <T> DefaultConsumerRegistration<T> lookup(Class<T> consumerType) {
    // keyed by the registration's own type
    return (DefaultConsumerRegistration<T>) registrations.get(consumerType);
  }
}
