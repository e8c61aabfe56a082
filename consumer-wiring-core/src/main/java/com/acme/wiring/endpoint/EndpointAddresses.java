package com.acme.wiring.endpoint;

import java.net.URI;
import java.util.Objects;

public final class EndpointAddresses {

  private EndpointAddresses() {}

  /**
   * Endpoint name of an input address. {@code queue:orders?durable=false} gives {@code orders},
   * {@code amqp://host/vhost/orders} gives {@code orders}.
   */
  public static String endpointName(URI address) {
    Objects.requireNonNull(address, "address");

    if (address.isOpaque()) {
      String name = address.getSchemeSpecificPart();
      int query = name.indexOf('?');
      return query < 0 ? name : name.substring(0, query);
    }

    String path = address.getPath();
    if (path == null || path.isEmpty()) {
      throw new IllegalArgumentException("Input address has no endpoint name: " + address);
    }
    int end = path.length();
    while (end > 0 && path.charAt(end - 1) == '/') {
      end--;
    }
    if (end == 0) {
      throw new IllegalArgumentException("Input address has no endpoint name: " + address);
    }
    return path.substring(path.lastIndexOf('/', end - 1) + 1, end);
  }
}
