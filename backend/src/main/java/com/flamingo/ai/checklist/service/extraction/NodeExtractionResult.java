package com.flamingo.ai.checklist.service.extraction;

import com.flamingo.ai.checklist.domain.model.Action;
import com.flamingo.ai.checklist.domain.model.PipelineWarning;
import com.flamingo.ai.checklist.domain.model.Table;
import java.util.List;

/**
 * Everything one node contributed to the run.
 *
 * @param nodeId the extracted node
 * @param completeActions actions that passed validation
 * @param flaggedActions actions with at least one empty field
 * @param tables tables found in the node
 * @param formulasIntegrated formulas now owned by an action
 * @param formulasDiscarded formulas that were dropped
 * @param warnings non-fatal outcomes for this node
 */
public record NodeExtractionResult(
    String nodeId,
    List<Action> completeActions,
    List<Action> flaggedActions,
    List<Table> tables,
    int formulasIntegrated,
    int formulasDiscarded,
    List<PipelineWarning> warnings) {

  public NodeExtractionResult {
    completeActions = List.copyOf(completeActions);
    flaggedActions = List.copyOf(flaggedActions);
    tables = List.copyOf(tables);
    warnings = List.copyOf(warnings);
  }
}
