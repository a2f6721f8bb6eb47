package com.botcity.maestro.client;

/**
 * Severity of an alert shown on the portal.
 */
public enum AlertType {
  INFO("INFO"),
  WARN("WARN"),
  ERROR("ERROR");

  private final String value;

  AlertType(String value) {
    this.value = value;
  }

  public String getValue() {
    return this.value;
  }
}
