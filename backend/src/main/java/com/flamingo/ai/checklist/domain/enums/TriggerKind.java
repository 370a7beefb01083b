package com.flamingo.ai.checklist.domain.enums;

/** Normalized shape of an action's free-text "when" field. */
public enum TriggerKind {
  /** A calendar date, month or clock time, e.g. "by the end of October". */
  ABSOLUTE_TIME(0, "Scheduled"),

  /** A bounded delay from activation, e.g. "within 2 hours". */
  RELATIVE_DEADLINE(1, "Deadline"),

  /** An event or condition, or any text that could not be parsed. */
  EVENT_TRIGGER(2, "Event-triggered");

  private final int sortOrder;
  private final String label;

  TriggerKind(int sortOrder, String label) {
    this.sortOrder = sortOrder;
    this.label = label;
  }

  public int getSortOrder() {
    return sortOrder;
  }

  public String getLabel() {
    return label;
  }
}
