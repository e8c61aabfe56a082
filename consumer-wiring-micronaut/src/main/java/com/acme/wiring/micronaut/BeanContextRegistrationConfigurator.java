package com.acme.wiring.micronaut;

import com.acme.wiring.consumer.ConsumerFactoryDecorator;
import com.acme.wiring.consumer.MessageConsumer;
import com.acme.wiring.definition.ConsumerDefinition;
import com.acme.wiring.definition.EndpointDefinition;
import com.acme.wiring.registration.ConsumerRegistrationConfigurator;
import com.acme.wiring.registration.ConsumerRegistry;
import com.acme.wiring.registration.RegistrationConfigurator;
import io.micronaut.context.BeanContext;
import io.micronaut.inject.qualifiers.Qualifiers;
import jakarta.inject.Singleton;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Registers consumers in the {@link ConsumerRegistry} and their definitions and decorators as
 * singletons of the bean context, where {@link BeanContextRegistrationContext} finds them. Like the
 * map based context, it takes one consumer definition and one endpoint definition per consumer type.
 */
@Singleton
@RequiredArgsConstructor
@Slf4j
public class BeanContextRegistrationConfigurator implements RegistrationConfigurator {
    private final ConsumerRegistry registry;
    private final BeanContext beanContext;
    private final AtomicInteger decoratorSequence = new AtomicInteger();
    private final Set<Class<?>> consumerDefinitionTypes = ConcurrentHashMap.newKeySet();
    private final Set<Class<?>> endpointDefinitionTypes = ConcurrentHashMap.newKeySet();

    @Override
    public <T extends MessageConsumer> ConsumerRegistrationConfigurator<T> addConsumer(Class<T> consumerType) {
        return registry.addConsumer(consumerType).getConsumerRegistrationConfigurator(this);
    }

    /**
     * @throws IllegalStateException if a definition was already registered here for the consumer type
     */
    @Override
    public <T> void addConsumerDefinition(ConsumerDefinition<T> definition) {
        requireFirst(consumerDefinitionTypes, "Consumer definition", definition.getConsumerType());
        log.info("Registering consumer definition for {}", definition.getConsumerType().getSimpleName());
        beanContext.registerSingleton(
                ConsumerDefinition.class, definition, Qualifiers.byName(definition.getConsumerType().getName()));
    }

    /**
     * @throws IllegalStateException if an endpoint definition was already registered here for the
     *     consumer type
     */
    @Override
    public <T> void addEndpointDefinition(EndpointDefinition<T> definition) {
        requireFirst(endpointDefinitionTypes, "Endpoint definition", definition.getConsumerType());
        log.info("Registering endpoint definition for {}", definition.getConsumerType().getSimpleName());
        beanContext.registerSingleton(
                EndpointDefinition.class, definition, Qualifiers.byName(definition.getConsumerType().getName()));
    }

    @Override
    public <T> void addConsumerFactoryDecorator(ConsumerFactoryDecorator<T> decorator) {
        String name = decorator.getConsumerType().getName() + "#" + decoratorSequence.incrementAndGet();
        log.info("Registering consumer factory decorator {}", name);
        beanContext.registerSingleton(ConsumerFactoryDecorator.class, decorator, Qualifiers.byName(name));
    }

    private static void requireFirst(Set<Class<?>> registered, String kind, Class<?> consumerType) {
        if (!registered.add(consumerType)) {
            String error = kind + " already registered for consumer type: " + consumerType.getName();
            log.error(error);
            throw new IllegalStateException(error);
        }
    }
}
