package com.acme.wiring.core;

/**
 * Failure of the resolution context while looking up definitions, decorators or consumer
 * instances. Always propagated to the caller of the wiring operation.
 */
public class RegistrationResolutionException extends RuntimeException {
  public RegistrationResolutionException(String message) {
    super(message);
  }

  public RegistrationResolutionException(String message, Throwable e) {
    super(message, e);
  }
}
