package com.botcity.maestro.client;

import java.util.Collections;
import java.util.Map;

/**
 * A unit of automation work tracked by the portal.
 * {@code state} and {@code finishStatus} are kept as the raw strings the portal sends.
 */
public class AutomationTask {
  private Integer id;
  private String state;
  private Map<String, Object> parameters;
  private Integer activityId;
  private String activityLabel;
  private Integer userCreationId;
  private Integer organizationCreationId;
  private String dateCreation;
  private String dateLastModified;
  private String finishStatus;
  private String finishMessage;
  private Boolean test;

  public AutomationTask() {
  }

  public AutomationTask(Integer id, String activityLabel, String state, Map<String, Object> parameters) {
    this.id = id;
    this.activityLabel = activityLabel;
    this.state = state;
    this.parameters = parameters;
  }

  public Integer getId() {
    return id;
  }

  public String getState() {
    return state;
  }

  public Map<String, Object> getParameters() {
    return parameters != null ? Collections.unmodifiableMap(parameters) : Collections.<String, Object>emptyMap();
  }

  public Integer getActivityId() {
    return activityId;
  }

  public String getActivityLabel() {
    return activityLabel;
  }

  public Integer getUserCreationId() {
    return userCreationId;
  }

  public Integer getOrganizationCreationId() {
    return organizationCreationId;
  }

  public String getDateCreation() {
    return dateCreation;
  }

  public String getDateLastModified() {
    return dateLastModified;
  }

  public String getFinishStatus() {
    return finishStatus;
  }

  public String getFinishMessage() {
    return finishMessage;
  }

  public boolean isTest() {
    return test != null && test;
  }

  public boolean isInState(AutomationTaskState expected) {
    return expected.getValue().equalsIgnoreCase(state);
  }

  @Override
  public String toString() {
    return String.format("AutomationTask{id=%s, activityLabel='%s', state='%s', finishStatus='%s'}",
        id, activityLabel, state, finishStatus);
  }
}
