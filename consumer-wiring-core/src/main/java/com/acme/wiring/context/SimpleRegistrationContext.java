package com.acme.wiring.context;

import com.acme.wiring.consumer.ConsumeContext;
import com.acme.wiring.consumer.ConsumeScope;
import com.acme.wiring.consumer.ConsumerFactoryDecorator;
import com.acme.wiring.core.RegistrationResolutionException;
import com.acme.wiring.definition.ConsumerDefinition;
import com.acme.wiring.definition.EndpointDefinition;
import com.acme.wiring.spi.RegistrationContext;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registration context backed by plain maps, for applications that do not run a dependency
 * injection container. Consumer instances come from suppliers, one instance per message scope.
 */
public class SimpleRegistrationContext implements RegistrationContext {
  private static final Logger log = LoggerFactory.getLogger(SimpleRegistrationContext.class);

  private final Map<Class<?>, ConsumerDefinition<?>> consumerDefinitions = new ConcurrentHashMap<>();
  private final Map<Class<?>, EndpointDefinition<?>> endpointDefinitions = new ConcurrentHashMap<>();
  private final List<ConsumerFactoryDecorator<?>> decorators = new CopyOnWriteArrayList<>();
  private final Map<Class<?>, Supplier<?>> instanceSuppliers = new ConcurrentHashMap<>();

  public <T> SimpleRegistrationContext registerInstanceSupplier(
      Class<T> type, Supplier<? extends T> supplier) {
    instanceSuppliers.put(
        Objects.requireNonNull(type, "type"), Objects.requireNonNull(supplier, "supplier"));
    return this;
  }

  /**
   * @throws IllegalStateException if a definition is already registered for the consumer type
   */
  public <T> SimpleRegistrationContext registerConsumerDefinition(ConsumerDefinition<T> definition) {
    if (consumerDefinitions.putIfAbsent(definition.getConsumerType(), definition) != null) {
      throw alreadyRegistered("Consumer definition", definition.getConsumerType());
    }
    return this;
  }

  /**
   * @throws IllegalStateException if an endpoint definition is already registered for the consumer
   *     type
   */
  public <T> SimpleRegistrationContext registerEndpointDefinition(EndpointDefinition<T> definition) {
    if (endpointDefinitions.putIfAbsent(definition.getConsumerType(), definition) != null) {
      throw alreadyRegistered("Endpoint definition", definition.getConsumerType());
    }
    return this;
  }

  private static IllegalStateException alreadyRegistered(String kind, Class<?> consumerType) {
    String error = kind + " already registered for consumer type: " + consumerType.getName();
    log.error(error);
    return new IllegalStateException(error);
  }

  public <T> SimpleRegistrationContext registerConsumerFactoryDecorator(
      ConsumerFactoryDecorator<T> decorator) {
    decorators.add(Objects.requireNonNull(decorator, "decorator"));
    return this;
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> Optional<ConsumerDefinition<T>> findConsumerDefinition(Class<T> consumerType) {
    return Optional.ofNullable((ConsumerDefinition<T>) consumerDefinitions.get(consumerType));
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> Optional<EndpointDefinition<T>> findEndpointDefinition(Class<T> consumerType) {
    return Optional.ofNullable((EndpointDefinition<T>) endpointDefinitions.get(consumerType));
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> List<ConsumerFactoryDecorator<T>> getConsumerFactoryDecorators(Class<T> consumerType) {
    List<ConsumerFactoryDecorator<T>> matching = new ArrayList<>();
    for (ConsumerFactoryDecorator<?> decorator : decorators) {
      if (decorator.getConsumerType() == consumerType) {
        matching.add((ConsumerFactoryDecorator<T>) decorator);
      }
    }
    matching.sort(Comparator.comparingInt(ConsumerFactoryDecorator<T>::getOrder));
    return matching;
  }

  @Override
  public ConsumeScope openScope(ConsumeContext context) {
    return new SupplierScope();
  }

  private final class SupplierScope implements ConsumeScope {
    private final List<Object> instances = new ArrayList<>();

    @Override
    public <T> T getInstance(Class<T> type) {
      Supplier<?> supplier = instanceSuppliers.get(type);
      if (supplier == null) {
        throw new RegistrationResolutionException("No instance supplier registered for " + type.getName());
      }
      Object instance = supplier.get();
      if (!type.isInstance(instance)) {
        throw new RegistrationResolutionException(
            "Supplier for " + type.getName() + " returned " + instance);
      }
      instances.add(instance);
      return type.cast(instance);
    }

    @Override
    public void close() {
      for (int i = instances.size() - 1; i >= 0; i--) {
        if (instances.get(i) instanceof AutoCloseable closeable) {
          try {
            closeable.close();
          } catch (Exception e) {
            log.warn("Failed to release {}", closeable, e);
          }
        }
      }
      instances.clear();
    }
  }
}
