package com.botcity.maestro.client;

/**
 * Thrown when the login endpoint answers with anything other than HTTP 200.
 */
public class AuthenticationException extends MaestroException {
  private final int statusCode;
  private final String body;

  public AuthenticationException(int statusCode, String body) {
    super(String.format("Error during login. Server returned %d. %s", statusCode, body));
    this.statusCode = statusCode;
    this.body = body;
  }

  public int getStatusCode() {
    return this.statusCode;
  }

  public String getBody() {
    return this.body;
  }
}
