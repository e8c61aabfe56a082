package com.acme.wiring.definition;

import com.acme.wiring.configurator.ConsumerConfigurator;
import com.acme.wiring.endpoint.ReceiveEndpointConfigurator;
import com.acme.wiring.spi.RegistrationContext;
import java.util.Objects;

/**
 * Base for application supplied consumer definitions. Subclasses set the endpoint name and
 * concurrency in their constructor and override {@link #configureConsumer} for anything else.
 *
 * <pre>
 * public class SubmitOrderConsumerDefinition extends BaseConsumerDefinition&lt;SubmitOrderConsumer&gt; {
 *     public SubmitOrderConsumerDefinition() {
 *         super(SubmitOrderConsumer.class);
 *         setEndpointName("orders");
 *         setConcurrentMessageLimit(8);
 *     }
 *
 *     {@literal @}Override
 *     protected void configureConsumer(ReceiveEndpointConfigurator endpoint,
 *             ConsumerConfigurator&lt;SubmitOrderConsumer&gt; consumer, RegistrationContext context) {
 *         consumer.retryLimit(3);
 *     }
 * }
 * </pre>
 */
public abstract class BaseConsumerDefinition<T> implements ConsumerDefinition<T> {

  private final Class<T> consumerType;
  private volatile String endpointName;
  private Integer concurrentMessageLimit;
  private EndpointDefinition<T> endpointDefinition;

  protected BaseConsumerDefinition(Class<T> consumerType) {
    this.consumerType = Objects.requireNonNull(consumerType, "consumerType");
  }

  @Override
  public Class<T> getConsumerType() {
    return consumerType;
  }

  /**
   * Explicit name first, then the endpoint definition's name, then the formatter. The first
   * derived name sticks.
   */
  @Override
  public String getEndpointName(EndpointNameFormatter formatter) {
    String name = endpointName;
    if (name == null || name.isBlank()) {
      if (endpointDefinition != null) {
        name = endpointDefinition.getEndpointName(formatter);
      }
      if (name == null || name.isBlank()) {
        name = formatter.consumer(consumerType);
      }
      endpointName = name;
    }
    return name;
  }

  protected void setEndpointName(String endpointName) {
    this.endpointName = endpointName;
  }

  @Override
  public Integer getConcurrentMessageLimit() {
    return concurrentMessageLimit;
  }

  protected void setConcurrentMessageLimit(Integer concurrentMessageLimit) {
    this.concurrentMessageLimit = concurrentMessageLimit;
  }

  @Override
  public EndpointDefinition<T> getEndpointDefinition() {
    return endpointDefinition;
  }

  @Override
  public void setEndpointDefinition(EndpointDefinition<T> endpointDefinition) {
    this.endpointDefinition = endpointDefinition;
  }

  @Override
  public final void configure(
      ReceiveEndpointConfigurator endpointConfigurator,
      ConsumerConfigurator<T> consumerConfigurator,
      RegistrationContext context) {
    if (concurrentMessageLimit != null) {
      consumerConfigurator.concurrentMessageLimit(concurrentMessageLimit);
    }
    configureConsumer(endpointConfigurator, consumerConfigurator, context);
  }

  /** Hook for consumer specific options; the default does nothing. */
  protected void configureConsumer(
      ReceiveEndpointConfigurator endpointConfigurator,
      ConsumerConfigurator<T> consumerConfigurator,
      RegistrationContext context) {}
}
