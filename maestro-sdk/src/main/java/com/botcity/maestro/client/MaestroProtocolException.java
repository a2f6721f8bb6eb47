package com.botcity.maestro.client;

/**
 * Thrown when a successful response does not have the shape the endpoint promises.
 */
public class MaestroProtocolException extends MaestroException {
  public MaestroProtocolException(String message) {
    super(message);
  }

  public MaestroProtocolException(String message, Throwable cause) {
    super(message, cause);
  }
}
