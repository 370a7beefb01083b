package com.flamingo.ai.checklist.service.dedup;

import com.flamingo.ai.checklist.domain.model.Action;
import com.flamingo.ai.checklist.domain.model.PipelineWarning;
import java.util.List;

/**
 * Canonical actions after merging.
 *
 * @param completeActions canonical complete actions in extraction order
 * @param flaggedActions canonical flagged actions in extraction order
 * @param mergesPerformed number of actions absorbed into another
 * @param warnings borderline pairs and formulas dropped by a merge
 */
public record DeduplicationResult(
    List<Action> completeActions,
    List<Action> flaggedActions,
    int mergesPerformed,
    List<PipelineWarning> warnings) {

  public DeduplicationResult {
    completeActions = List.copyOf(completeActions);
    flaggedActions = List.copyOf(flaggedActions);
    warnings = List.copyOf(warnings);
  }
}
