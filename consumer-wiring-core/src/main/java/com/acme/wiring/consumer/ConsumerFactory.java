package com.acme.wiring.consumer;

/**
 * Creation strategy for consumer instances. A factory owns the lifetime of the instances it
 * produces: an instance is only valid for the duration of {@link #send}.
 *
 * @param <T> consumer type
 */
public interface ConsumerFactory<T> {

  /** Produces a consumer for {@code context} and hands it to {@code invocation}. */
  void send(ConsumeContext context, ConsumerInvocation<T> invocation) throws Exception;
}
