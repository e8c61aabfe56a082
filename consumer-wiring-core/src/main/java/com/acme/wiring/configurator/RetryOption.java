package com.acme.wiring.configurator;

/** Number of redeliveries to the consumer after a failure. */
public class RetryOption implements ConsumerOption {

  private int retryLimit;

  public RetryOption(int retryLimit) {
    setRetryLimit(retryLimit);
  }

  public int getRetryLimit() {
    return retryLimit;
  }

  public void setRetryLimit(int retryLimit) {
    if (retryLimit < 0) {
      throw new IllegalArgumentException("Retry limit must not be negative: " + retryLimit);
    }
    this.retryLimit = retryLimit;
  }

  @Override
  public String toString() {
    return "RetryOption{retryLimit=" + retryLimit + '}';
  }
}
