package com.acme.wiring.consumer;

import com.acme.wiring.core.TypeNames;
import com.acme.wiring.spi.RegistrationContext;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Resolves a fresh consumer from a per-message scope of the registration context. The consumer
 * lives exactly as long as the scope.
 */
public class ScopeConsumerFactory<T> implements ConsumerFactory<T> {
  private static final Logger log = LoggerFactory.getLogger(ScopeConsumerFactory.class);

  private final Class<T> consumerType;
  private final RegistrationContext context;

  public ScopeConsumerFactory(Class<T> consumerType, RegistrationContext context) {
    this.consumerType = Objects.requireNonNull(consumerType, "consumerType");
    this.context = Objects.requireNonNull(context, "context");
  }

  @Override
  public void send(ConsumeContext message, ConsumerInvocation<T> invocation) throws Exception {
    try (MDC.MDCCloseable ignoredId = MDC.putCloseable("messageId", String.valueOf(message.messageId()));
        MDC.MDCCloseable ignoredType = MDC.putCloseable("consumerType", TypeNames.shortName(consumerType));
        ConsumeScope scope = context.openScope(message)) {
      T consumer = scope.getInstance(consumerType);
      log.debug("Dispatching {} id={} to {}", message.messageType(), message.messageId(), consumer);
      invocation.invoke(consumer, message);
    }
  }

  public Class<T> getConsumerType() {
    return consumerType;
  }
}
