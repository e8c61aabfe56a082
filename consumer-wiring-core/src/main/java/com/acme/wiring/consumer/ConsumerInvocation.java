package com.acme.wiring.consumer;

/** What to do with a consumer instance once a factory has produced it for a message. */
@FunctionalInterface
public interface ConsumerInvocation<T> {

  void invoke(T consumer, ConsumeContext context) throws Exception;
}
