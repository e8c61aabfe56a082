package com.acme.wiring.definition;

import com.acme.wiring.spi.RegistrationContext;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the definition of one consumer type and keeps it. The first resolution wins, later
 * calls return the same instance even if the context would now resolve differently.
 *
 * <p>Not synchronized. Concurrent first calls may each resolve, the last one stored is what every
 * later caller sees.
 */
public class ConsumerDefinitionResolver<T> {
  private static final Logger log = LoggerFactory.getLogger(ConsumerDefinitionResolver.class);

  private final Class<T> consumerType;
  private volatile ConsumerDefinition<T> definition;

  public ConsumerDefinitionResolver(Class<T> consumerType) {
    this.consumerType = Objects.requireNonNull(consumerType, "consumerType");
  }

  public ConsumerDefinition<T> resolve(RegistrationContext context) {
    ConsumerDefinition<T> resolved = definition;
    if (resolved != null) {
      return resolved;
    }

    Optional<ConsumerDefinition<T>> registered = context.findConsumerDefinition(consumerType);
    resolved = registered.orElseGet(() -> new DefaultConsumerDefinition<>(consumerType));
    if (registered.isEmpty()) {
      log.debug("No definition registered for {}, using defaults", consumerType.getSimpleName());
    }

    Optional<EndpointDefinition<T>> endpointDefinition =
        context.findEndpointDefinition(consumerType);
    if (endpointDefinition.isPresent()) {
      resolved.setEndpointDefinition(endpointDefinition.get());
    }

    definition = resolved;
    return resolved;
  }

  public boolean isResolved() {
    return definition != null;
  }
}
