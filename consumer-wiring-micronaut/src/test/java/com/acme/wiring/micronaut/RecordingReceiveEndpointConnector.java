package com.acme.wiring.micronaut;

import com.acme.wiring.endpoint.EndpointSpecification;
import com.acme.wiring.endpoint.ReceiveEndpointConfigurator;
import com.acme.wiring.endpoint.ReceiveEndpointConnector;
import jakarta.inject.Singleton;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/** Transport stand-in for context tests; keeps connected endpoints by queue name. */
@Singleton
public class RecordingReceiveEndpointConnector implements ReceiveEndpointConnector {

    private final Map<String, RecordingEndpoint> endpoints = new LinkedHashMap<>();

    @Override
    public synchronized void connectReceiveEndpoint(String queueName, Consumer<ReceiveEndpointConfigurator> configure) {
        configure.accept(endpoints.computeIfAbsent(queueName, RecordingEndpoint::new));
    }

    public synchronized Map<String, RecordingEndpoint> getEndpoints() {
        return new LinkedHashMap<>(endpoints);
    }

    public static class RecordingEndpoint implements ReceiveEndpointConfigurator {
        private final URI inputAddress;
        private final List<EndpointSpecification> specifications = new ArrayList<>();
        private int prefetchCount = 1;
        private Integer concurrentMessageLimit;

        RecordingEndpoint(String queueName) {
            this.inputAddress = URI.create("queue:" + queueName);
        }

        @Override
        public URI getInputAddress() {
            return inputAddress;
        }

        @Override
        public int getPrefetchCount() {
            return prefetchCount;
        }

        @Override
        public void setPrefetchCount(int prefetchCount) {
            this.prefetchCount = prefetchCount;
        }

        @Override
        public Integer getConcurrentMessageLimit() {
            return concurrentMessageLimit;
        }

        @Override
        public void setConcurrentMessageLimit(Integer concurrentMessageLimit) {
            this.concurrentMessageLimit = concurrentMessageLimit;
        }

        @Override
        public void addEndpointSpecification(EndpointSpecification specification) {
            specifications.add(specification);
        }

        public List<EndpointSpecification> getSpecifications() {
            return specifications;
        }
    }
}
