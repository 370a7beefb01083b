package com.flamingo.ai.checklist.domain.enums;

/** Organizational tier an action applies to. Used for grouping and for the selection floor. */
public enum OperationalLevel {
  /** Ministry or national coordination level. */
  NATIONAL(2, "National"),

  /** Regional directorate or university level. */
  REGIONAL(1, "Regional"),

  /** Hospital, health center or other local facility. */
  LOCAL(0, "Local");

  private final int rank;
  private final String label;

  OperationalLevel(int rank, String label) {
    this.rank = rank;
    this.label = label;
  }

  public int getRank() {
    return rank;
  }

  public String getLabel() {
    return label;
  }

  /** Returns {@code true} if this level sits at or above {@code floor} in the hierarchy. */
  public boolean isAtLeast(OperationalLevel floor) {
    return rank >= floor.rank;
  }
}
