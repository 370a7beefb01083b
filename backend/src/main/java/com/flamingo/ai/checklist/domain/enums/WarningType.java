package com.flamingo.ai.checklist.domain.enums;

/** Kinds of non-fatal outcomes surfaced in the metadata report. */
public enum WarningType {
  /** A node's backend call failed after all retries; the node contributed nothing. */
  EXTRACTION_FAILURE,

  /** A formula had no confidently linked action and was discarded. */
  UNRESOLVED_FORMULA,

  /** Two actions were close to the merge threshold but kept separate. */
  DEDUPLICATION_AMBIGUITY,

  /** An action's "who" could not be bound to a taxonomy role. */
  UNRESOLVED_ROLE,

  /** The formatted checklist disagrees with the actions it was built from. */
  QUALITY_CHECK
}
