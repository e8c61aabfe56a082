package com.acme.wiring.core;

/** Raised by a consumer when a message can never succeed; the consume pipe does not retry it. */
public class PermanentException extends RuntimeException {
  public PermanentException(String message) {
    super(message);
  }

  public PermanentException(String message, Throwable e) {
    super(message, e);
  }
}
