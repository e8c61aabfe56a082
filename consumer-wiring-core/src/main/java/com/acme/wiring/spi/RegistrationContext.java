package com.acme.wiring.spi;

import com.acme.wiring.consumer.ConsumeContext;
import com.acme.wiring.consumer.ConsumeScope;
import com.acme.wiring.consumer.ConsumerFactoryDecorator;
import com.acme.wiring.definition.ConsumerDefinition;
import com.acme.wiring.definition.EndpointDefinition;
import java.util.List;
import java.util.Optional;

/**
 * Resolution context backing consumer registrations. Passed explicitly to every wiring operation;
 * implementations only read from the underlying container.
 *
 * <p>Lookup failures other than absence are reported as {@link
 * com.acme.wiring.core.RegistrationResolutionException}.
 */
public interface RegistrationContext {

    /** Definition registered for exactly {@code consumerType}, if any. */
    <T> Optional<ConsumerDefinition<T>> findConsumerDefinition(Class<T> consumerType);

    /** Endpoint definition registered for exactly {@code consumerType}, if any. */
    <T> Optional<EndpointDefinition<T>> findEndpointDefinition(Class<T> consumerType);

    /** Decorators for exactly {@code consumerType}, in the order they are to be applied. */
    <T> List<ConsumerFactoryDecorator<T>> getConsumerFactoryDecorators(Class<T> consumerType);

    /** Opens the resolution scope for one message. */
    ConsumeScope openScope(ConsumeContext context);
}
