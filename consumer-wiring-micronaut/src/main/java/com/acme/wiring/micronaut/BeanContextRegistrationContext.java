package com.acme.wiring.micronaut;

import com.acme.wiring.consumer.ConsumeContext;
import com.acme.wiring.consumer.ConsumeScope;
import com.acme.wiring.consumer.ConsumerFactoryDecorator;
import com.acme.wiring.core.RegistrationResolutionException;
import com.acme.wiring.definition.ConsumerDefinition;
import com.acme.wiring.definition.EndpointDefinition;
import com.acme.wiring.spi.RegistrationContext;
import io.micronaut.context.BeanContext;
import io.micronaut.context.exceptions.BeanContextException;
import jakarta.inject.Singleton;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Registration context over the Micronaut bean context.
 *
 * <p>Definitions and decorators are ordinary beans; a bean applies to the consumer type its
 * {@code getConsumerType()} returns. Consumers are created per message with {@link
 * BeanContext#createBean(Class)} and destroyed when the scope closes.
 */
@Singleton
@RequiredArgsConstructor
@Slf4j
public class BeanContextRegistrationContext implements RegistrationContext {
    private final BeanContext beanContext;

    @Override
    @SuppressWarnings("unchecked")
    public <T> Optional<ConsumerDefinition<T>> findConsumerDefinition(Class<T> consumerType) {
        List<ConsumerDefinition<?>> matches =
                beansFor(ConsumerDefinition.class, consumerType, ConsumerDefinition::getConsumerType);
        validateUnique("consumer definition", consumerType, matches);
        return matches.stream().findFirst().map(d -> (ConsumerDefinition<T>) d);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> Optional<EndpointDefinition<T>> findEndpointDefinition(Class<T> consumerType) {
        List<EndpointDefinition<?>> matches =
                beansFor(EndpointDefinition.class, consumerType, EndpointDefinition::getConsumerType);
        validateUnique("endpoint definition", consumerType, matches);
        return matches.stream().findFirst().map(d -> (EndpointDefinition<T>) d);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> List<ConsumerFactoryDecorator<T>> getConsumerFactoryDecorators(Class<T> consumerType) {
        List<ConsumerFactoryDecorator<T>> decorators = new ArrayList<>();
        List<ConsumerFactoryDecorator<?>> matches =
                beansFor(ConsumerFactoryDecorator.class, consumerType, ConsumerFactoryDecorator::getConsumerType);
        for (ConsumerFactoryDecorator<?> decorator : matches) {
            decorators.add((ConsumerFactoryDecorator<T>) decorator);
        }
        decorators.sort(Comparator.comparingInt(ConsumerFactoryDecorator<T>::getOrder));
        return decorators;
    }

    @Override
    public ConsumeScope openScope(ConsumeContext context) {
        return new BeanContextConsumeScope(beanContext);
    }

    /** Beans of the raw {@code beanType}, viewed as {@code B}, that apply to {@code consumerType}. */
    @SuppressWarnings("unchecked")
    private <B> List<B> beansFor(
            Class<? super B> beanType, Class<?> consumerType, Function<? super B, Class<?>> typeOf) {
        try {
            List<B> matches = new ArrayList<>();
            for (Object bean : beanContext.getBeansOfType(beanType)) {
                // instance of beanType, which B only parameterizes
                B candidate = (B) bean;
                if (typeOf.apply(candidate) == consumerType) {
                    matches.add(candidate);
                }
            }
            return matches;
        } catch (BeanContextException e) {
            throw new RegistrationResolutionException(
                    "Unable to resolve " + beanType.getSimpleName() + " beans for " + consumerType.getName(), e);
        }
    }

    private void validateUnique(String kind, Class<?> consumerType, List<?> matches) {
        if (matches.size() > 1) {
            String errorMsg =
                    String.format(
                            "Ambiguous %s registration for consumer '%s': found %d beans %s. "
                                    + "Only one %s per consumer type is allowed.",
                            kind, consumerType.getName(), matches.size(), matches, kind);
            log.error(errorMsg);
            throw new RegistrationResolutionException(errorMsg);
        }
    }
}
