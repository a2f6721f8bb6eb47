package com.botcity.maestro.client;

public class ConfigurationException extends IllegalArgumentException {
  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
