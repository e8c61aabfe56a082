package com.acme.wiring.micronaut.discovery;

import com.acme.wiring.consumer.MessageConsumer;
import com.acme.wiring.registration.ConsumerRegistry;
import io.micronaut.context.BeanContext;
import io.micronaut.context.annotation.Context;
import io.micronaut.context.annotation.Requires;
import io.micronaut.inject.BeanDefinition;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Modifier;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Auto-discovers consumer beans and registers them in the {@link ConsumerRegistry}.
 *
 * <p>Convention: every bean definition whose type implements {@link MessageConsumer} is registered
 * once under its declared class. AOP proxies ({@code $Intercepted}) are registered under the class
 * they proxy. Only bean definitions are inspected; consumer instances are created per message.
 *
 * <p>Example:
 *
 * <pre>
 * {@literal @}Prototype
 * public class SubmitOrderConsumer implements MessageConsumer {
 *     public void consume(ConsumeContext context) {
 *         // Auto-discovered and registered, endpoint "submit-order"
 *     }
 * }
 * </pre>
 */
@Context
@Requires(property = "consumers.discovery.enabled", value = "true", defaultValue = "true")
@RequiredArgsConstructor
@Slf4j
public class AutoConsumerDiscovery {
    private final BeanContext beanContext;
    private final ConsumerRegistry registry;

    @PostConstruct
    public void discoverConsumers() {
        log.info("Auto-discovering message consumers...");

        Set<Class<? extends MessageConsumer>> consumerTypes = collectCandidates();
        for (Class<? extends MessageConsumer> consumerType : consumerTypes) {
            registry.addConsumer(consumerType);
        }

        log.info("Auto-discovery complete: {} consumer(s) registered", consumerTypes.size());
    }

    /**
     * Collect consumer types from bean definitions, collapsing proxies onto their target class
     */
    private Set<Class<? extends MessageConsumer>> collectCandidates() {
        Set<Class<? extends MessageConsumer>> consumerTypes = new LinkedHashSet<>();

        for (BeanDefinition<?> beanDefinition : beanContext.getAllBeanDefinitions()) {
            Class<?> beanClass = unwrapProxy(beanDefinition.getBeanType());

            if (!MessageConsumer.class.isAssignableFrom(beanClass)
                    || beanClass.isInterface()
                    || Modifier.isAbstract(beanClass.getModifiers())) {
                continue;
            }

            if (consumerTypes.add(beanClass.asSubclass(MessageConsumer.class))) {
                log.debug("Found consumer bean: {}", beanClass.getName());
            }
        }

        return consumerTypes;
    }

    private static Class<?> unwrapProxy(Class<?> beanClass) {
        Class<?> current = beanClass;
        while (current.getName().contains("$Intercepted") && current.getSuperclass() != null) {
            current = current.getSuperclass();
        }
        return current;
    }
}
