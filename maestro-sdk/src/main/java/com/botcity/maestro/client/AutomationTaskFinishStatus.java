package com.botcity.maestro.client;

/**
 * Condition in which a task is finished.
 */
public enum AutomationTaskFinishStatus {
  SUCCESS("SUCCESS"),
  PARTIALLY_COMPLETED("PARTIALLY_COMPLETED"),
  FAILED("FAILED");

  private final String value;

  AutomationTaskFinishStatus(String value) {
    this.value = value;
  }

  public String getValue() {
    return this.value;
  }
}
