package com.acme.wiring.configurator;

import com.acme.wiring.consumer.ConsumerFactory;
import com.acme.wiring.endpoint.ConsumePipe;
import com.acme.wiring.endpoint.EndpointSpecification;
import com.acme.wiring.endpoint.ReceiveEndpointConfigurator;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Collects the options of one consumer for one receive endpoint. Built fresh each time a
 * registration is configured and handed to the endpoint as its specification.
 *
 * @param <T> consumer type
 */
public class ConsumerConfigurator<T> implements EndpointSpecification {

  private final ConsumerFactory<T> consumerFactory;
  private final ReceiveEndpointConfigurator endpointConfigurator;
  private final List<ConsumerOption> options = new ArrayList<>();

  public ConsumerConfigurator(
      ConsumerFactory<T> consumerFactory, ReceiveEndpointConfigurator endpointConfigurator) {
    this.consumerFactory = Objects.requireNonNull(consumerFactory, "consumerFactory");
    this.endpointConfigurator = Objects.requireNonNull(endpointConfigurator, "endpointConfigurator");
  }

  public ConsumerFactory<T> getConsumerFactory() {
    return consumerFactory;
  }

  public ReceiveEndpointConfigurator getEndpointConfigurator() {
    return endpointConfigurator;
  }

  public ConsumerConfigurator<T> concurrentMessageLimit(int limit) {
    options(ConcurrencyLimitOption.class, () -> new ConcurrencyLimitOption(limit)).setLimit(limit);
    return this;
  }

  /** Configured limit, or {@code null} when unbounded. */
  public Integer getConcurrentMessageLimit() {
    return findOption(ConcurrencyLimitOption.class).map(ConcurrencyLimitOption::getLimit).orElse(null);
  }

  public ConsumerConfigurator<T> retryLimit(int retryLimit) {
    options(RetryOption.class, () -> new RetryOption(retryLimit)).setRetryLimit(retryLimit);
    return this;
  }

  public int getRetryLimit() {
    return findOption(RetryOption.class).map(RetryOption::getRetryLimit).orElse(0);
  }

  /** Returns the option of {@code type}, adding the one from {@code factory} when absent. */
  public <O extends ConsumerOption> O options(Class<O> type, Supplier<? extends O> factory) {
    Objects.requireNonNull(type, "type");
    return findOption(type)
        .orElseGet(
            () -> {
              O option = Objects.requireNonNull(factory.get(), "option");
              options.add(option);
              return option;
            });
  }

  public ConsumerConfigurator<T> addOption(ConsumerOption option) {
    options.add(Objects.requireNonNull(option, "option"));
    return this;
  }

  /** Options assignable to {@code type}, in the order they were added. */
  public <O> List<O> selectOptions(Class<O> type) {
    List<O> selected = new ArrayList<>();
    for (ConsumerOption option : options) {
      if (type.isInstance(option)) {
        selected.add(type.cast(option));
      }
    }
    return selected;
  }

  public List<ConsumerOption> getOptions() {
    return Collections.unmodifiableList(options);
  }

  private <O extends ConsumerOption> Optional<O> findOption(Class<O> type) {
    for (ConsumerOption option : options) {
      if (type.isInstance(option)) {
        return Optional.of(type.cast(option));
      }
    }
    return Optional.empty();
  }

  @Override
  public ConsumePipe build() {
    return new ConsumerMessagePipe<>(consumerFactory, getConcurrentMessageLimit(), getRetryLimit());
  }

  @Override
  public String toString() {
    return "ConsumerConfigurator{options=" + options + '}';
  }
}
