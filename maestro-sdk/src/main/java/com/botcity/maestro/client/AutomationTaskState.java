package com.botcity.maestro.client;

/**
 * Lifecycle states the portal reports for a task.
 */
public enum AutomationTaskState {
  START("START"),
  RUNNING("RUNNING"),
  FINISHED("FINISHED"),
  CANCELED("CANCELED"),
  PENDING("PENDING");

  private final String value;

  AutomationTaskState(String value) {
    this.value = value;
  }

  public String getValue() {
    return this.value;
  }
}
