package com.flamingo.ai.checklist.domain.enums;

/** Fields an action must carry to pass schema validation. */
public enum ActionField {
  WHO,
  WHAT,
  WHEN
}
