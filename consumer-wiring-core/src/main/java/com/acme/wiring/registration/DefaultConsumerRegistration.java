package com.acme.wiring.registration;

import com.acme.wiring.configurator.ConsumerConfigurator;
import com.acme.wiring.consumer.ConsumerFactory;
import com.acme.wiring.consumer.ScopedConsumerFactoryBuilder;
import com.acme.wiring.core.TypeNames;
import com.acme.wiring.definition.ConsumerDefinition;
import com.acme.wiring.definition.ConsumerDefinitionResolver;
import com.acme.wiring.endpoint.EndpointAddresses;
import com.acme.wiring.endpoint.ReceiveEndpointConfigurator;
import com.acme.wiring.endpoint.ReceiveEndpointOption;
import com.acme.wiring.spi.RegistrationContext;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A single consumer, resolved per message from the registration context. The consumer definition,
 * if one is registered, is resolved once and applied every time the consumer is bound to an
 * endpoint.
 *
 * <p>{@link #configure} is not safe for concurrent calls on the same registration: both calls run
 * to completion and both add a specification to their endpoint.
 *
 * @param <T> consumer type
 */
public class DefaultConsumerRegistration<T> implements ConsumerRegistration {
  private static final Logger log = LoggerFactory.getLogger(DefaultConsumerRegistration.class);

  private final Class<T> type;
  private final List<Consumer<ConsumerConfigurator<T>>> configureActions =
      new CopyOnWriteArrayList<>();
  private final ConsumerDefinitionResolver<T> definitionResolver;
  private final ScopedConsumerFactoryBuilder<T> factoryBuilder;
  private volatile RegistrationState state = RegistrationState.UNCONFIGURED;
  private volatile boolean excluded;

  public DefaultConsumerRegistration(Class<T> type) {
    this.type = Objects.requireNonNull(type, "type");
    this.definitionResolver = new ConsumerDefinitionResolver<>(type);
    this.factoryBuilder = new ScopedConsumerFactoryBuilder<>(type);
    this.excluded = type.isAnnotationPresent(ExcludeFromConfigureEndpoints.class);
  }

  @Override
  public Class<T> getType() {
    return type;
  }

  @Override
  public RegistrationState getState() {
    return state;
  }

  @Override
  public boolean isIncludeInConfigureEndpoints() {
    return !excluded && state == RegistrationState.UNCONFIGURED;
  }

  @Override
  public void excludeFromConfigureEndpoints() {
    excluded = true;
  }

  public void addConfigureAction(Consumer<ConsumerConfigurator<T>> action) {
    configureActions.add(Objects.requireNonNull(action, "action"));
  }

  @Override
  @SuppressWarnings("unchecked")
  public <C> void addConfigureAction(
      Class<C> consumerType, Consumer<ConsumerConfigurator<C>> action) {
    if (type != consumerType) {
      log.debug(
          "Ignoring configure action for {} on registration of {}",
          consumerType == null ? null : consumerType.getSimpleName(),
          type.getSimpleName());
      return;
    }
    // C == T, checked above
    addConfigureAction((Consumer<ConsumerConfigurator<T>>) (Consumer<?>) action);
  }

  @Override
  public void configure(ReceiveEndpointConfigurator configurator, RegistrationContext context) {
    // fails before the definition or any action sees the endpoint
    String endpointName = EndpointAddresses.endpointName(configurator.getInputAddress());

    ConsumerDefinition<T> definition = definitionResolver.resolve(context);

    ConsumerFactory<T> consumerFactory = factoryBuilder.build(context);
    ConsumerConfigurator<T> consumerConfigurator =
        new ConsumerConfigurator<>(consumerFactory, configurator);

    definition.configure(configurator, consumerConfigurator, context);

    for (Consumer<ConsumerConfigurator<T>> action : configureActions) {
      action.accept(consumerConfigurator);
    }

    for (ReceiveEndpointOption option :
        consumerConfigurator.selectOptions(ReceiveEndpointOption.class)) {
      option.configure(endpointName, configurator);
    }

    log.info("Configured endpoint {}, Consumer: {}", endpointName, TypeNames.shortName(type));

    configurator.addEndpointSpecification(consumerConfigurator);

    state = RegistrationState.CONFIGURED;
  }

  @Override
  public ConsumerDefinition<T> getDefinition(RegistrationContext context) {
    return definitionResolver.resolve(context);
  }

  @Override
  public ConsumerRegistrationConfigurator<T> getConsumerRegistrationConfigurator(
      RegistrationConfigurator registrationConfigurator) {
    return new ConsumerRegistrationConfigurator<>(registrationConfigurator, this);
  }

  @Override
  public String toString() {
    return "ConsumerRegistration{type=" + type.getName() + ", state=" + state + '}';
  }
}
