package com.acme.wiring.micronaut;

import com.acme.wiring.consumer.ConsumeContext;
import com.acme.wiring.consumer.ConsumeScope;
import com.acme.wiring.consumer.ConsumerFactory;
import com.acme.wiring.consumer.ConsumerFactoryDecorator;
import com.acme.wiring.consumer.MessageConsumer;
import com.acme.wiring.core.RegistrationResolutionException;
import com.acme.wiring.definition.ConsumerDefinition;
import com.acme.wiring.definition.ConsumerEndpointDefinition;
import com.acme.wiring.definition.DefaultConsumerDefinition;
import com.acme.wiring.definition.EndpointDefinition;
import io.micronaut.context.BeanContext;
import io.micronaut.context.exceptions.BeanContextException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("BeanContextRegistrationContext Tests")
class BeanContextRegistrationContextTest {

    @Mock
    private BeanContext mockBeanContext;

    private BeanContextRegistrationContext context;

    @BeforeEach
    void setUp() {
        context = new BeanContextRegistrationContext(mockBeanContext);
    }

    public static class OrderConsumer implements MessageConsumer {
        @Override
        public void consume(ConsumeContext context) {
        }
    }

    public static class PaymentConsumer implements MessageConsumer {
        @Override
        public void consume(ConsumeContext context) {
        }
    }

    @Nested
    @DisplayName("Definition lookup")
    class DefinitionLookupTests {

        @Test
        @DisplayName("Should return the definition bean declared for the consumer type")
        void shouldReturnMatchingDefinition() {
            ConsumerDefinition<OrderConsumer> orderDefinition = new DefaultConsumerDefinition<>(OrderConsumer.class);
            ConsumerDefinition<PaymentConsumer> paymentDefinition =
                    new DefaultConsumerDefinition<>(PaymentConsumer.class);
            when(mockBeanContext.getBeansOfType(ConsumerDefinition.class))
                    .thenReturn(List.of(paymentDefinition, orderDefinition));

            Optional<ConsumerDefinition<OrderConsumer>> result = context.findConsumerDefinition(OrderConsumer.class);

            assertThat(result).containsSame(orderDefinition);
        }

        @Test
        @DisplayName("Should return empty when no definition bean matches")
        void shouldReturnEmptyWhenNoneMatches() {
            when(mockBeanContext.getBeansOfType(ConsumerDefinition.class))
                    .thenReturn(List.of(new DefaultConsumerDefinition<>(PaymentConsumer.class)));

            assertThat(context.findConsumerDefinition(OrderConsumer.class)).isEmpty();
        }

        @Test
        @DisplayName("Should reject two definition beans for one consumer type")
        void shouldRejectAmbiguousDefinitions() {
            when(mockBeanContext.getBeansOfType(ConsumerDefinition.class))
                    .thenReturn(List.of(
                            new DefaultConsumerDefinition<>(OrderConsumer.class),
                            new DefaultConsumerDefinition<>(OrderConsumer.class)));

            assertThatThrownBy(() -> context.findConsumerDefinition(OrderConsumer.class))
                    .isInstanceOf(RegistrationResolutionException.class)
                    .hasMessageContaining("Ambiguous consumer definition")
                    .hasMessageContaining(OrderConsumer.class.getName());
        }

        @Test
        @DisplayName("Should wrap bean context failures")
        void shouldWrapBeanContextFailures() {
            BeanContextException failure = new BeanContextException("definition bean failed to start");
            when(mockBeanContext.getBeansOfType(ConsumerDefinition.class)).thenThrow(failure);

            assertThatThrownBy(() -> context.findConsumerDefinition(OrderConsumer.class))
                    .isInstanceOf(RegistrationResolutionException.class)
                    .hasCause(failure);
        }

        @Test
        @DisplayName("Should return the endpoint definition bean declared for the consumer type")
        void shouldReturnMatchingEndpointDefinition() {
            ConsumerEndpointDefinition<OrderConsumer> endpointDefinition =
                    new ConsumerEndpointDefinition<>(OrderConsumer.class);
            when(mockBeanContext.getBeansOfType(EndpointDefinition.class)).thenReturn(List.of(endpointDefinition));

            Optional<EndpointDefinition<OrderConsumer>> result = context.findEndpointDefinition(OrderConsumer.class);

            assertThat(result).containsSame(endpointDefinition);
            assertThat(context.findEndpointDefinition(PaymentConsumer.class)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Decorators")
    class DecoratorTests {

        @Test
        @DisplayName("Should return only decorators for the consumer type, in ascending order")
        void shouldFilterAndSortDecorators() {
            ConsumerFactoryDecorator<OrderConsumer> late = decorator(OrderConsumer.class, 10);
            ConsumerFactoryDecorator<OrderConsumer> early = decorator(OrderConsumer.class, -5);
            ConsumerFactoryDecorator<PaymentConsumer> other = decorator(PaymentConsumer.class, 0);
            when(mockBeanContext.getBeansOfType(ConsumerFactoryDecorator.class))
                    .thenReturn(List.of(late, other, early));

            List<ConsumerFactoryDecorator<OrderConsumer>> result =
                    context.getConsumerFactoryDecorators(OrderConsumer.class);

            assertThat(result).containsExactly(early, late);
        }

        private <T> ConsumerFactoryDecorator<T> decorator(Class<T> type, int order) {
            return new ConsumerFactoryDecorator<>() {
                @Override
                public Class<T> getConsumerType() {
                    return type;
                }

                @Override
                public ConsumerFactory<T> decorate(ConsumerFactory<T> factory) {
                    return factory;
                }

                @Override
                public int getOrder() {
                    return order;
                }
            };
        }
    }

    @Nested
    @DisplayName("Scopes")
    class ScopeTests {

        @Test
        @DisplayName("Should create consumers per scope and destroy them in reverse order on close")
        void shouldCreateAndDestroyInReverse() {
            OrderConsumer order = new OrderConsumer();
            PaymentConsumer payment = new PaymentConsumer();
            when(mockBeanContext.createBean(OrderConsumer.class)).thenReturn(order);
            when(mockBeanContext.createBean(PaymentConsumer.class)).thenReturn(payment);

            try (ConsumeScope scope = context.openScope(ConsumeContext.of("SubmitOrder", "{}"))) {
                assertThat(scope.getInstance(OrderConsumer.class)).isSameAs(order);
                assertThat(scope.getInstance(PaymentConsumer.class)).isSameAs(payment);
                verify(mockBeanContext, never()).destroyBean(order);
            }

            InOrder inOrder = inOrder(mockBeanContext);
            inOrder.verify(mockBeanContext).destroyBean(payment);
            inOrder.verify(mockBeanContext).destroyBean(order);
        }

        @Test
        @DisplayName("Should wrap consumer creation failures")
        void shouldWrapCreationFailure() {
            when(mockBeanContext.createBean(OrderConsumer.class))
                    .thenThrow(new BeanContextException("No bean of type OrderConsumer"));

            try (ConsumeScope scope = context.openScope(ConsumeContext.of("SubmitOrder", "{}"))) {
                assertThatThrownBy(() -> scope.getInstance(OrderConsumer.class))
                        .isInstanceOf(RegistrationResolutionException.class)
                        .hasMessageContaining(OrderConsumer.class.getName());
            }
        }

        @Test
        @DisplayName("Should keep destroying remaining consumers when one fails")
        void shouldContinueAfterDestroyFailure() {
            OrderConsumer order = new OrderConsumer();
            PaymentConsumer payment = new PaymentConsumer();
            when(mockBeanContext.createBean(OrderConsumer.class)).thenReturn(order);
            when(mockBeanContext.createBean(PaymentConsumer.class)).thenReturn(payment);
            doThrow(new IllegalStateException("boom")).when(mockBeanContext).destroyBean(payment);

            ConsumeScope scope = context.openScope(ConsumeContext.of("SubmitOrder", "{}"));
            scope.getInstance(OrderConsumer.class);
            scope.getInstance(PaymentConsumer.class);

            assertThatCode(scope::close).doesNotThrowAnyException();
            verify(mockBeanContext).destroyBean(order);
        }
    }
}
