package com.acme.wiring.consumer;

import com.acme.wiring.core.Jsons;
import java.util.Map;
import java.util.UUID;

/**
 * A message as delivered to a consumer. The payload is kept as received; consumers read it into
 * their own types with {@link #payloadAs(Class)}.
 */
public record ConsumeContext(
    UUID messageId,
    UUID correlationId,
    String messageType,
    String payload,
    Map<String, String> headers
) {
    public ConsumeContext {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static ConsumeContext of(String messageType, String payload) {
        return new ConsumeContext(UUID.randomUUID(), UUID.randomUUID(), messageType, payload, Map.of());
    }

    public <T> T payloadAs(Class<T> type) {
        return Jsons.fromJson(payload, type);
    }
}
