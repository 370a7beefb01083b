package com.flamingo.ai.checklist.domain.model;

import com.flamingo.ai.checklist.domain.enums.OperationalLevel;
import java.util.Set;

/**
 * Options recognized by the selector.
 *
 * @param includeFlagged render flagged actions in the checklist as well as the report
 * @param minOperationalLevel lowest operational level kept in the checklist
 * @param excludeSubjects node ids whose actions are left out
 */
public record SelectionPolicy(
    boolean includeFlagged, OperationalLevel minOperationalLevel, Set<String> excludeSubjects) {

  public SelectionPolicy {
    minOperationalLevel = minOperationalLevel == null ? OperationalLevel.LOCAL : minOperationalLevel;
    excludeSubjects = excludeSubjects == null ? Set.of() : Set.copyOf(excludeSubjects);
  }

  public static SelectionPolicy defaults() {
    return new SelectionPolicy(false, OperationalLevel.LOCAL, Set.of());
  }

  public SelectionPolicy withExcludeSubjects(Set<String> subjects) {
    return new SelectionPolicy(includeFlagged, minOperationalLevel, subjects);
  }
}
