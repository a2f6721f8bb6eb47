package com.botcity.maestro.client;

public class PreconditionException extends IllegalStateException {
  public PreconditionException(String message) {
    super(message);
  }
}
