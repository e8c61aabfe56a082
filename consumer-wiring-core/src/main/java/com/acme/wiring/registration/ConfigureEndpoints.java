package com.acme.wiring.registration;

import com.acme.wiring.definition.ConsumerDefinition;
import com.acme.wiring.definition.EndpointDefinition;
import com.acme.wiring.definition.EndpointNameFormatter;
import com.acme.wiring.endpoint.ReceiveEndpointConnector;
import com.acme.wiring.spi.RegistrationContext;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bulk pass that places every consumer not yet configured on a receive endpoint named by its
 * definition. Consumers sharing a name share the endpoint. Consumers already configured, or
 * excluded, are skipped, so running the pass again only picks up new registrations.
 */
public class ConfigureEndpoints {
  private static final Logger log = LoggerFactory.getLogger(ConfigureEndpoints.class);

  private final ConsumerRegistry registry;
  private final EndpointNameFormatter formatter;

  public ConfigureEndpoints(ConsumerRegistry registry, EndpointNameFormatter formatter) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.formatter = Objects.requireNonNull(formatter, "formatter");
  }

  /** Configures all remaining consumers. Returns the number of endpoints connected. */
  public int configure(ReceiveEndpointConnector connector, RegistrationContext context) {
    return configure(connector, context, registration -> true);
  }

  public int configure(
      ReceiveEndpointConnector connector,
      RegistrationContext context,
      Predicate<ConsumerRegistration> filter) {
    Map<String, List<ConsumerRegistration>> byEndpoint = new LinkedHashMap<>();
    Map<String, EndpointDefinition<?>> endpointDefinitions = new LinkedHashMap<>();

    for (ConsumerRegistration registration : registry.getRegistrations()) {
      if (!registration.isIncludeInConfigureEndpoints() || !filter.test(registration)) {
        log.debug("Skipping {} ({})", registration.getType().getSimpleName(), registration.getState());
        continue;
      }
      ConsumerDefinition<?> definition = registration.getDefinition(context);
      String endpointName = definition.getEndpointName(formatter);

      byEndpoint.computeIfAbsent(endpointName, k -> new ArrayList<>()).add(registration);
      if (definition.getEndpointDefinition() != null) {
        endpointDefinitions.putIfAbsent(endpointName, definition.getEndpointDefinition());
      }
    }

    for (Map.Entry<String, List<ConsumerRegistration>> entry : byEndpoint.entrySet()) {
      String endpointName = entry.getKey();
      List<ConsumerRegistration> consumers = entry.getValue();
      EndpointDefinition<?> endpointDefinition = endpointDefinitions.get(endpointName);

      log.info("Configuring receive endpoint {} ({} consumer(s))", endpointName, consumers.size());

      connector.connectReceiveEndpoint(
          endpointName,
          endpoint -> {
            if (endpointDefinition != null) {
              endpointDefinition.configure(endpoint);
            }
            for (ConsumerRegistration registration : consumers) {
              registration.configure(endpoint, context);
            }
          });
    }
    return byEndpoint.size();
  }
}
