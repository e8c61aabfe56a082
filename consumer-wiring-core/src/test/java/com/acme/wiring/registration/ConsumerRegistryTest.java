package com.acme.wiring.registration;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.acme.wiring.configurator.ConsumerConfigurator;
import com.acme.wiring.consumer.ConsumeContext;
import com.acme.wiring.consumer.MessageConsumer;
import com.acme.wiring.context.SimpleRegistrationContext;
import com.acme.wiring.endpoint.InMemoryReceiveEndpointConfigurator;
import com.acme.wiring.spi.RegistrationContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for ConsumerRegistry */
class ConsumerRegistryTest {

  public static class PaymentConsumer implements MessageConsumer {
    @Override
    public void consume(ConsumeContext context) {}
  }

  public static class RefundConsumer implements MessageConsumer {
    @Override
    public void consume(ConsumeContext context) {}
  }

  private ConsumerRegistry registry;

  @BeforeEach
  void setUp() {
    registry = new ConsumerRegistry();
  }

  @Nested
  @DisplayName("Consumer Registration Tests")
  class ConsumerRegistrationTests {

    @Test
    @DisplayName("addConsumer - should return the existing registration for a known type")
    void testAddConsumerIdempotent() {
      DefaultConsumerRegistration<PaymentConsumer> first = registry.addConsumer(PaymentConsumer.class);
      DefaultConsumerRegistration<PaymentConsumer> second = registry.addConsumer(PaymentConsumer.class);

      assertThat(second).isSameAs(first);
      assertThat(registry.getRegistrations()).hasSize(1);
    }

    @Test
    @DisplayName("getRegistrations - should keep registration order")
    void testRegistrationOrder() {
      registry.addConsumer(RefundConsumer.class);
      registry.addConsumer(PaymentConsumer.class);

      assertThat(registry.getRegistrations())
          .extracting(ConsumerRegistration::getType)
          .containsExactly(RefundConsumer.class, PaymentConsumer.class);
    }

    @Test
    @DisplayName("find - should be empty for unknown types")
    void testFindUnknown() {
      assertThat(registry.find(PaymentConsumer.class)).isEmpty();
      assertThat(registry.contains(PaymentConsumer.class)).isFalse();
    }
  }

  @Nested
  @DisplayName("Configure Action Tests")
  class ConfigureActionTests {

    @Test
    @DisplayName("addConfigureAction - should route the action to the consumer's registration")
    void testAddConfigureAction() {
      registry.addConsumer(PaymentConsumer.class);
      registry.addConsumer(RefundConsumer.class);
      InMemoryReceiveEndpointConfigurator endpoint = new InMemoryReceiveEndpointConfigurator("payments");
      SimpleRegistrationContext context =
          new SimpleRegistrationContext().registerInstanceSupplier(PaymentConsumer.class, PaymentConsumer::new);

      registry.addConfigureAction(PaymentConsumer.class, c -> c.retryLimit(5));
      registry.configureConsumer(PaymentConsumer.class, endpoint, context);

      ConsumerConfigurator<?> specification = (ConsumerConfigurator<?>) endpoint.getSpecifications().get(0);
      assertThat(specification.getRetryLimit()).isEqualTo(5);
      assertThat(registry.find(RefundConsumer.class).orElseThrow().getState())
          .isEqualTo(RegistrationState.UNCONFIGURED);
    }

    @Test
    @DisplayName("addConfigureAction - should throw for an unregistered consumer type")
    void testAddConfigureActionUnknownType() {
      assertThatThrownBy(() -> registry.addConfigureAction(PaymentConsumer.class, c -> {}))
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("No consumer registered for type")
          .hasMessageContaining("PaymentConsumer");
    }

    @Test
    @DisplayName("configureConsumer - should throw for an unregistered consumer type")
    void testConfigureConsumerUnknownType() {
      assertThatThrownBy(
              () ->
                  registry.configureConsumer(
                      RefundConsumer.class,
                      new InMemoryReceiveEndpointConfigurator("refunds"),
                      mock(RegistrationContext.class)))
          .isInstanceOf(IllegalStateException.class);
    }
  }
}
