package com.botcity.maestro.client;

/**
 * Generic envelope returned by most mutating endpoints.
 */
public class ServerMessage {
  private String message;
  private String type;
  private String result;

  public ServerMessage(String message, String type, String result) {
    this.message = message;
    this.type = type;
    this.result = result;
  }

  public String getMessage() {
    return this.message;
  }

  public String getType() {
    return this.type;
  }

  public String getResult() {
    return this.result;
  }

  @Override
  public String toString() {
    return "ServerMessage [message=" + message + ", type=" + type + ", result=" + result + "]";
  }
}
