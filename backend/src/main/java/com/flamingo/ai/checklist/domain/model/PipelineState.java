package com.flamingo.ai.checklist.domain.model;

import com.flamingo.ai.checklist.domain.enums.PipelineStage;
import com.flamingo.ai.checklist.service.format.model.ChecklistDocument;
import java.util.List;

/**
 * Snapshot threaded through the pipeline. Each stage consumes one state and returns a new one;
 * nothing here is mutated after construction.
 *
 * @param stage stage that produced this snapshot
 * @param completeActions actions that passed validation (canonical after deduplication)
 * @param flaggedActions actions that failed validation (canonical after deduplication)
 * @param tables tables collected from all nodes
 * @param includedActions actions selected for the checklist, normalized after the normalize stage
 * @param excludedActions actions the selector left out
 * @param checklist rendered checklist, {@code null} before formatting
 * @param metadata counters and warnings
 * @param failureReason diagnostic when {@code stage} is {@link PipelineStage#FAILED}
 */
public record PipelineState(
    PipelineStage stage,
    List<Action> completeActions,
    List<Action> flaggedActions,
    List<Table> tables,
    List<Action> includedActions,
    List<ExcludedAction> excludedActions,
    ChecklistDocument checklist,
    PipelineMetadata metadata,
    String failureReason) {

  public PipelineState {
    completeActions = List.copyOf(completeActions);
    flaggedActions = List.copyOf(flaggedActions);
    tables = List.copyOf(tables);
    includedActions = List.copyOf(includedActions);
    excludedActions = List.copyOf(excludedActions);
  }

  public static PipelineState ingested() {
    return new PipelineState(
        PipelineStage.INGESTED,
        List.of(),
        List.of(),
        List.of(),
        List.of(),
        List.of(),
        null,
        PipelineMetadata.empty(),
        null);
  }

  public PipelineState withActions(
      PipelineStage nextStage, List<Action> complete, List<Action> flagged,
      PipelineMetadata newMetadata) {
    return new PipelineState(
        nextStage, complete, flagged, tables, includedActions, excludedActions, checklist,
        newMetadata, failureReason);
  }

  public PipelineState withTables(List<Table> newTables) {
    return new PipelineState(
        stage, completeActions, flaggedActions, newTables, includedActions, excludedActions,
        checklist, metadata, failureReason);
  }

  public PipelineState withSelection(
      PipelineStage nextStage, List<Action> included, List<ExcludedAction> excluded,
      PipelineMetadata newMetadata) {
    return new PipelineState(
        nextStage, completeActions, flaggedActions, tables, included, excluded, checklist,
        newMetadata, failureReason);
  }

  public PipelineState withChecklist(
      PipelineStage nextStage, ChecklistDocument document, PipelineMetadata newMetadata) {
    return new PipelineState(
        nextStage, completeActions, flaggedActions, tables, includedActions, excludedActions,
        document, newMetadata, failureReason);
  }

  public PipelineState withStage(PipelineStage nextStage) {
    return new PipelineState(
        nextStage, completeActions, flaggedActions, tables, includedActions, excludedActions,
        checklist, metadata, failureReason);
  }

  public PipelineState failed(String reason) {
    return new PipelineState(
        PipelineStage.FAILED, completeActions, flaggedActions, tables, includedActions,
        excludedActions, checklist, metadata, reason);
  }
}
