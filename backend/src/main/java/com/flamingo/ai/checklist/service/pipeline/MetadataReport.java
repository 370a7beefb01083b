package com.flamingo.ai.checklist.service.pipeline;

import com.flamingo.ai.checklist.domain.enums.ExclusionReason;
import com.flamingo.ai.checklist.domain.model.FlaggedAction;
import com.flamingo.ai.checklist.domain.model.PipelineMetadata;
import com.flamingo.ai.checklist.domain.model.PipelineState;
import com.flamingo.ai.checklist.domain.model.PipelineWarning;
import java.util.List;
import java.util.Map;

/**
 * Run report delivered next to the checklist. Flagged actions are always listed here, whether or
 * not the selection policy rendered them.
 */
public record MetadataReport(
    int actionsWithFormulas,
    int flaggedCount,
    int nodesFailed,
    int unresolvedRoles,
    Map<String, Integer> counters,
    List<PipelineWarning> warnings,
    List<FlaggedAction> flaggedActions,
    List<String> failedNodeIds,
    List<Exclusion> exclusions) {

  /** An action the selector left out. */
  public record Exclusion(String actionId, ExclusionReason reason) {}

  public static MetadataReport from(PipelineState state) {
    PipelineMetadata metadata = state.metadata();
    return new MetadataReport(
        metadata.get(PipelineMetadata.ACTIONS_WITH_FORMULAS),
        metadata.get(PipelineMetadata.FLAGGED_COUNT),
        metadata.get(PipelineMetadata.NODES_FAILED),
        metadata.get(PipelineMetadata.UNRESOLVED_ROLES),
        metadata.sortedCounters(),
        metadata.warnings(),
        state.flaggedActions().stream().map(FlaggedAction::from).toList(),
        metadata.failedNodeIds(),
        state.excludedActions().stream()
            .map(excluded -> new Exclusion(excluded.action().id(), excluded.reason()))
            .toList());
  }
}
