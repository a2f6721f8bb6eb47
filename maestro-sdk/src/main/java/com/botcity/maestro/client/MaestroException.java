package com.botcity.maestro.client;

import java.io.IOException;

/**
 * Base type for failures reported by the BotMaestro portal or caused by an unexpected response.
 * Transport failures are not wrapped and surface as plain {@link IOException}.
 */
public class MaestroException extends IOException {
  public MaestroException(String message) {
    super(message);
  }

  public MaestroException(String message, Throwable cause) {
    super(message, cause);
  }
}
