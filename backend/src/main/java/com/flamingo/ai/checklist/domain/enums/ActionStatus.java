package com.flamingo.ai.checklist.domain.enums;

/** Execution status column of a rendered checklist row. */
public enum ActionStatus {
  PENDING("Pending"),
  COMMUNICATED("Communicated"),
  EXECUTED("Executed"),
  REPORTED("Reported"),
  NOT_APPLICABLE("Not applicable");

  private final String label;

  ActionStatus(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }
}
