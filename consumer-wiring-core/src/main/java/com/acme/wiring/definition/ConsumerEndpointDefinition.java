package com.acme.wiring.definition;

import com.acme.wiring.endpoint.ReceiveEndpointConfigurator;
import java.util.Objects;

/** Settable endpoint definition, as produced by the registration configurator. */
public class ConsumerEndpointDefinition<T> implements EndpointDefinition<T> {

  private final Class<T> consumerType;
  private String name;
  private Integer prefetchCount;
  private Integer concurrentMessageLimit;

  public ConsumerEndpointDefinition(Class<T> consumerType) {
    this.consumerType = Objects.requireNonNull(consumerType, "consumerType");
  }

  @Override
  public Class<T> getConsumerType() {
    return consumerType;
  }

  @Override
  public String getEndpointName(EndpointNameFormatter formatter) {
    return name;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  @Override
  public Integer getPrefetchCount() {
    return prefetchCount;
  }

  public void setPrefetchCount(Integer prefetchCount) {
    if (prefetchCount != null && prefetchCount < 1) {
      throw new IllegalArgumentException("Prefetch count must be positive: " + prefetchCount);
    }
    this.prefetchCount = prefetchCount;
  }

  @Override
  public Integer getConcurrentMessageLimit() {
    return concurrentMessageLimit;
  }

  public void setConcurrentMessageLimit(Integer concurrentMessageLimit) {
    if (concurrentMessageLimit != null && concurrentMessageLimit < 1) {
      throw new IllegalArgumentException(
          "Concurrent message limit must be positive: " + concurrentMessageLimit);
    }
    this.concurrentMessageLimit = concurrentMessageLimit;
  }

  @Override
  public void configure(ReceiveEndpointConfigurator configurator) {
    if (prefetchCount != null) {
      configurator.setPrefetchCount(prefetchCount);
    }
    if (concurrentMessageLimit != null) {
      configurator.setConcurrentMessageLimit(concurrentMessageLimit);
    }
  }

  @Override
  public String toString() {
    return "ConsumerEndpointDefinition{consumer="
        + consumerType.getSimpleName()
        + ", name="
        + name
        + ", prefetchCount="
        + prefetchCount
        + ", concurrentMessageLimit="
        + concurrentMessageLimit
        + '}';
  }
}
