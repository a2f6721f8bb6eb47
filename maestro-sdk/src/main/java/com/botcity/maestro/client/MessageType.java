package com.botcity.maestro.client;

/**
 * Body format of a message sent through the portal.
 */
public enum MessageType {
  TEXT("TEXT"),
  HTML("HTML");

  private final String value;

  MessageType(String value) {
    this.value = value;
  }

  public String getValue() {
    return this.value;
  }
}
