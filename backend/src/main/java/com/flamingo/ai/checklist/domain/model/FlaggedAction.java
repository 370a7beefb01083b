package com.flamingo.ai.checklist.domain.model;

import com.flamingo.ai.checklist.domain.enums.ActionField;
import java.util.List;
import java.util.Set;

/**
 * Report view of an action that failed schema validation, kept for human triage.
 *
 * @param actionId identifier of the canonical action
 * @param who extracted responsible party, possibly blank
 * @param what extracted directive, possibly blank
 * @param when extracted timing, possibly blank
 * @param missingFields fields that were empty after trimming
 * @param actorFlagged the responsible party is missing
 * @param timingFlagged the responsible party is present but the timing is missing
 * @param references every subject the action was found in
 */
public record FlaggedAction(
    String actionId,
    String who,
    String what,
    String when,
    Set<ActionField> missingFields,
    boolean actorFlagged,
    boolean timingFlagged,
    List<SourceReference> references) {

  public static FlaggedAction from(Action action) {
    Set<ActionField> missing = action.missingFields();
    boolean actorFlagged = missing.contains(ActionField.WHO);
    boolean timingFlagged = !actorFlagged && missing.contains(ActionField.WHEN);
    return new FlaggedAction(
        action.id(),
        action.who(),
        action.what(),
        action.when(),
        missing,
        actorFlagged,
        timingFlagged,
        action.references());
  }
}
