package com.acme.wiring.consumer;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Wraps the consumer factory of one consumer type. Decorators registered for the same type are
 * applied in ascending {@link #getOrder()}, each receiving the result of the previous one.
 *
 * @param <T> consumer type
 */
public interface ConsumerFactoryDecorator<T> {

  Class<T> getConsumerType();

  ConsumerFactory<T> decorate(ConsumerFactory<T> factory);

  default int getOrder() {
    return 0;
  }

  static <T> ConsumerFactoryDecorator<T> of(
      Class<T> consumerType, UnaryOperator<ConsumerFactory<T>> decorator) {
    Objects.requireNonNull(consumerType, "consumerType");
    Objects.requireNonNull(decorator, "decorator");
    return new ConsumerFactoryDecorator<>() {
      @Override
      public Class<T> getConsumerType() {
        return consumerType;
      }

      @Override
      public ConsumerFactory<T> decorate(ConsumerFactory<T> factory) {
        return decorator.apply(factory);
      }
    };
  }
}
