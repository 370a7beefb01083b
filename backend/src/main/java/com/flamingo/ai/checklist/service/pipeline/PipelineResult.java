package com.flamingo.ai.checklist.service.pipeline;

import com.flamingo.ai.checklist.domain.enums.PipelineStage;
import com.flamingo.ai.checklist.domain.model.PipelineState;
import com.flamingo.ai.checklist.service.format.model.ChecklistDocument;

/**
 * Outcome of one pipeline run.
 *
 * @param stage terminal stage, {@link PipelineStage#DONE} or {@link PipelineStage#FAILED}
 * @param checklist the checklist, {@code null} on failure
 * @param markdown Markdown rendering of the checklist, {@code null} on failure
 * @param report counters, warnings and flagged actions
 * @param failureReason diagnostic when the run failed
 * @param state the final pipeline state
 */
public record PipelineResult(
    PipelineStage stage,
    ChecklistDocument checklist,
    String markdown,
    MetadataReport report,
    String failureReason,
    PipelineState state) {

  public boolean isDone() {
    return stage == PipelineStage.DONE;
  }
}
