package com.acme.wiring.consumer;

/**
 * Resolution scope covering the processing of a single message. Instances resolved from the scope
 * are released when the scope is closed.
 */
public interface ConsumeScope extends AutoCloseable {

  <T> T getInstance(Class<T> type);

  @Override
  void close();
}
