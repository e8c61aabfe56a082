package com.acme.wiring.registration;

/**
 * Wiring state of a consumer registration, read by the bulk configure-endpoints pass to skip
 * consumers that were already placed on an endpoint.
 *
 * <p>Advisory only. It does not stop a second explicit {@code configure} call, which binds the
 * consumer again.
 */
public enum RegistrationState {
  UNCONFIGURED,
  CONFIGURED
}
