package com.flamingo.ai.checklist.domain.enums;

/**
 * States of the checklist pipeline.
 *
 * <p>The happy path is strictly linear. {@link #FAILED} is reachable only through a
 * pipeline-level fault, never from a single node's extraction failure.
 */
public enum PipelineStage {
  INGESTED,
  EXTRACTED,
  DEDUPLICATED,
  SELECTED,
  NORMALIZED,
  FORMATTED,
  DONE,
  FAILED;

  /** Returns the successor on the happy path. */
  public PipelineStage next() {
    return switch (this) {
      case INGESTED -> EXTRACTED;
      case EXTRACTED -> DEDUPLICATED;
      case DEDUPLICATED -> SELECTED;
      case SELECTED -> NORMALIZED;
      case NORMALIZED -> FORMATTED;
      case FORMATTED -> DONE;
      case DONE, FAILED -> throw new IllegalStateException("No transition out of " + this);
    };
  }

  public boolean isTerminal() {
    return this == DONE || this == FAILED;
  }

  /** Returns {@code true} if the state machine allows moving from this stage to {@code target}. */
  public boolean canTransitionTo(PipelineStage target) {
    if (isTerminal()) {
      return false;
    }
    return target == FAILED || target == next();
  }
}
