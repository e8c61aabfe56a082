package com.acme.wiring.config;

/**
 * Configuration for endpoint naming conventions. Pure POJO - no framework dependencies.
 */
public class EndpointNamingConfig {

  private String prefix = "";
  private boolean kebabCase = true;

  public String getPrefix() {
    return prefix;
  }

  public void setPrefix(String prefix) {
    this.prefix = prefix == null ? "" : prefix;
  }

  public boolean isKebabCase() {
    return kebabCase;
  }

  public void setKebabCase(boolean kebabCase) {
    this.kebabCase = kebabCase;
  }
}
