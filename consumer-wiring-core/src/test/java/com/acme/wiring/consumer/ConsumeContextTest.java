package com.acme.wiring.consumer;

import static org.assertj.core.api.Assertions.*;

import com.acme.wiring.core.PermanentException;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for ConsumeContext */
class ConsumeContextTest {

  public record SubmitOrder(String orderId, int quantity) {}

  @Test
  @DisplayName("payloadAs - should read the JSON payload into the requested type")
  void testPayloadAs() {
    ConsumeContext context = ConsumeContext.of("SubmitOrder", "{\"orderId\":\"ORD-1\",\"quantity\":3}");

    SubmitOrder order = context.payloadAs(SubmitOrder.class);

    assertThat(order).isEqualTo(new SubmitOrder("ORD-1", 3));
  }

  @Test
  @DisplayName("payloadAs - unreadable payloads are permanent failures")
  void testPayloadUnreadable() {
    ConsumeContext context = ConsumeContext.of("SubmitOrder", "not json");

    assertThatThrownBy(() -> context.payloadAs(SubmitOrder.class))
        .isInstanceOf(PermanentException.class)
        .hasMessageContaining("SubmitOrder");
  }

  @Test
  @DisplayName("headers - should be copied and default to empty")
  void testHeaders() {
    Map<String, String> headers = new HashMap<>();
    headers.put("tenant", "acme");
    ConsumeContext context =
        new ConsumeContext(UUID.randomUUID(), UUID.randomUUID(), "SubmitOrder", "{}", headers);
    headers.put("tenant", "other");

    assertThat(context.headers()).containsEntry("tenant", "acme");
    assertThat(new ConsumeContext(UUID.randomUUID(), null, "SubmitOrder", "{}", null).headers())
        .isEmpty();
  }
}
