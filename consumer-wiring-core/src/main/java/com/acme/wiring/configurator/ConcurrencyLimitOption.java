package com.acme.wiring.configurator;

import com.acme.wiring.endpoint.ReceiveEndpointConfigurator;
import com.acme.wiring.endpoint.ReceiveEndpointOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounds the number of messages a consumer processes at once. The endpoint must prefetch at
 * least that many messages, so the prefetch count is raised when it is lower.
 */
public class ConcurrencyLimitOption implements ReceiveEndpointOption {
  private static final Logger log = LoggerFactory.getLogger(ConcurrencyLimitOption.class);

  private int limit;

  public ConcurrencyLimitOption(int limit) {
    setLimit(limit);
  }

  public int getLimit() {
    return limit;
  }

  public void setLimit(int limit) {
    if (limit < 1) {
      throw new IllegalArgumentException("Concurrent message limit must be positive: " + limit);
    }
    this.limit = limit;
  }

  @Override
  public void configure(String endpointName, ReceiveEndpointConfigurator configurator) {
    if (configurator.getPrefetchCount() < limit) {
      log.debug(
          "Raising prefetch count of {} from {} to {}",
          endpointName,
          configurator.getPrefetchCount(),
          limit);
      configurator.setPrefetchCount(limit);
    }
  }

  @Override
  public String toString() {
    return "ConcurrencyLimitOption{limit=" + limit + '}';
  }
}
