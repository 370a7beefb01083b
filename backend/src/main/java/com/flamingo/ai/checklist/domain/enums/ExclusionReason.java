package com.flamingo.ai.checklist.domain.enums;

/** Why the selector left an action out of the rendered checklist. */
public enum ExclusionReason {
  FLAGGED,
  BELOW_OPERATIONAL_LEVEL,
  EXCLUDED_SUBJECT
}
