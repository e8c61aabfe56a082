package com.acme.wiring.definition;

import com.acme.wiring.config.EndpointNamingConfig;
import com.acme.wiring.core.TypeNames;
import java.util.Locale;
import java.util.Objects;

/**
 * Names endpoints after the consumer type. A trailing {@code Consumer} is dropped, so {@code
 * SubmitOrderConsumer} becomes {@code submit-order} and {@code OrderHandler} becomes {@code
 * order-handler} with the default configuration.
 */
public class DefaultEndpointNameFormatter implements EndpointNameFormatter {
  private static final String CONSUMER_SUFFIX = "Consumer";

  private final EndpointNamingConfig config;

  public DefaultEndpointNameFormatter() {
    this(new EndpointNamingConfig());
  }

  public DefaultEndpointNameFormatter(EndpointNamingConfig config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  @Override
  public String consumer(Class<?> consumerType) {
    String name = TypeNames.shortName(consumerType);
    if (name.endsWith(CONSUMER_SUFFIX) && name.length() > CONSUMER_SUFFIX.length()) {
      name = name.substring(0, name.length() - CONSUMER_SUFFIX.length());
    }
    return config.getPrefix() + (config.isKebabCase() ? kebabCase(name) : name);
  }

  static String kebabCase(String name) {
    StringBuilder sb = new StringBuilder(name.length() + 4);
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (Character.isUpperCase(c)) {
        boolean afterLower = i > 0 && !Character.isUpperCase(name.charAt(i - 1));
        boolean acronymEnd =
            i > 0
                && Character.isUpperCase(name.charAt(i - 1))
                && i + 1 < name.length()
                && Character.isLowerCase(name.charAt(i + 1));
        if (sb.length() > 0 && (afterLower || acronymEnd) && sb.charAt(sb.length() - 1) != '-') {
          sb.append('-');
        }
        sb.append(Character.toLowerCase(c));
      } else if (c == '$' || c == '_') {
        sb.append('-');
      } else {
        sb.append(c);
      }
    }
    return sb.toString().toLowerCase(Locale.ROOT);
  }
}
