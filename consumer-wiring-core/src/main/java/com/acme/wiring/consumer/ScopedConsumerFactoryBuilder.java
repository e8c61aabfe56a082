package com.acme.wiring.consumer;

import com.acme.wiring.spi.RegistrationContext;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the consumer factory bound to a registration context, wrapped by whatever decorators the
 * context holds for the exact consumer type. A new factory is built on every call.
 */
public class ScopedConsumerFactoryBuilder<T> {
  private static final Logger log = LoggerFactory.getLogger(ScopedConsumerFactoryBuilder.class);

  private final Class<T> consumerType;

  public ScopedConsumerFactoryBuilder(Class<T> consumerType) {
    this.consumerType = Objects.requireNonNull(consumerType, "consumerType");
  }

  public ConsumerFactory<T> build(RegistrationContext context) {
    ConsumerFactory<T> factory = new ScopeConsumerFactory<>(consumerType, context);

    for (ConsumerFactoryDecorator<T> decorator : context.getConsumerFactoryDecorators(consumerType)) {
      factory =
          Objects.requireNonNull(
              decorator.decorate(factory), () -> "Decorator returned no factory: " + decorator);
      log.debug(
          "Decorated consumer factory for {} with {}", consumerType.getSimpleName(), decorator);
    }
    return factory;
  }
}
