package com.acme.wiring.definition;

import static org.assertj.core.api.Assertions.*;

import com.acme.wiring.config.EndpointNamingConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for DefaultEndpointNameFormatter */
class DefaultEndpointNameFormatterTest {

  static class SubmitOrderConsumer {}

  static class OrderHandler {}

  static class HTTPCallbackConsumer {}

  static class Consumer {}

  @Test
  @DisplayName("consumer - should strip the Consumer suffix and kebab-case the rest")
  void testStripsSuffix() {
    assertThat(new DefaultEndpointNameFormatter().consumer(SubmitOrderConsumer.class))
        .isEqualTo("submit-order");
  }

  @Test
  @DisplayName("consumer - should keep other suffixes")
  void testKeepsOtherSuffix() {
    assertThat(new DefaultEndpointNameFormatter().consumer(OrderHandler.class))
        .isEqualTo("order-handler");
  }

  @Test
  @DisplayName("consumer - should split acronyms from the following word")
  void testAcronym() {
    assertThat(new DefaultEndpointNameFormatter().consumer(HTTPCallbackConsumer.class))
        .isEqualTo("http-callback");
  }

  @Test
  @DisplayName("consumer - should not strip a name that is only the suffix")
  void testSuffixOnly() {
    assertThat(new DefaultEndpointNameFormatter().consumer(Consumer.class)).isEqualTo("consumer");
  }

  @Test
  @DisplayName("consumer - should apply the configured prefix and casing")
  void testConfigured() {
    EndpointNamingConfig config = new EndpointNamingConfig();
    config.setPrefix("billing.");
    config.setKebabCase(false);

    assertThat(new DefaultEndpointNameFormatter(config).consumer(SubmitOrderConsumer.class))
        .isEqualTo("billing.SubmitOrder");
  }

  @Test
  @DisplayName("EndpointNamingConfig - should default to no prefix and kebab-case")
  void testConfigDefaults() {
    EndpointNamingConfig config = new EndpointNamingConfig();

    assertThat(config.getPrefix()).isEmpty();
    assertThat(config.isKebabCase()).isTrue();

    config.setPrefix(null);
    assertThat(config.getPrefix()).isEmpty();
  }
}
