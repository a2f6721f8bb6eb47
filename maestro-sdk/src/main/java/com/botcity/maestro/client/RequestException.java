package com.botcity.maestro.client;

/**
 * Thrown when a portal endpoint answers with anything other than HTTP 200.
 * {@link #getServerMessage()} holds the {@code message} member of the JSON error body, or the raw
 * body when it is not JSON.
 */
public class RequestException extends MaestroException {
  private final int statusCode;
  private final String serverMessage;

  public RequestException(String operation, int statusCode, String serverMessage) {
    super(String.format("Error during %s. Server returned %d. %s", operation, statusCode, serverMessage));
    this.statusCode = statusCode;
    this.serverMessage = serverMessage;
  }

  public int getStatusCode() {
    return this.statusCode;
  }

  public String getServerMessage() {
    return this.serverMessage;
  }
}
