package com.acme.wiring.configurator;

/** Option accumulated on a {@link ConsumerConfigurator}. */
public interface ConsumerOption {}
