package com.acme.wiring.definition;

/** Used for consumers that have no definition registered: formatter naming, no limits. */
public class DefaultConsumerDefinition<T> extends BaseConsumerDefinition<T> {

  public DefaultConsumerDefinition(Class<T> consumerType) {
    super(consumerType);
  }
}
