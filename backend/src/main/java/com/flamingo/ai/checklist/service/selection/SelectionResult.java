package com.flamingo.ai.checklist.service.selection;

import com.flamingo.ai.checklist.domain.model.Action;
import com.flamingo.ai.checklist.domain.model.ExcludedAction;
import java.util.List;

/** Actions kept for the checklist and those left out, both in extraction order. */
public record SelectionResult(List<Action> included, List<ExcludedAction> excluded) {

  public SelectionResult {
    included = List.copyOf(included);
    excluded = List.copyOf(excluded);
  }
}
