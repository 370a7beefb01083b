package com.flamingo.ai.checklist.service.selection;

import com.flamingo.ai.checklist.config.ChecklistProperties;
import com.flamingo.ai.checklist.domain.enums.ExclusionReason;
import com.flamingo.ai.checklist.domain.enums.OperationalLevel;
import com.flamingo.ai.checklist.domain.model.Action;
import com.flamingo.ai.checklist.domain.model.ExcludedAction;
import com.flamingo.ai.checklist.domain.model.SelectionPolicy;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Decides which canonical actions reach the rendered checklist. A pure filter: action content is
 * never touched, and flagged actions stay in the report whatever the policy says.
 *
 * <p>Duplicate variants are already ranked by the deduplicator's survivor choice, so each arrives
 * here as one canonical action; candidates are ordered by extraction order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActionSelector {

  private final ChecklistProperties properties;

  /**
   * Applies {@code policy}. An action is excluded for the first rule it breaks, checked in the
   * order flagged, excluded subject, operational level.
   *
   * @param complete canonical complete actions
   * @param flagged canonical flagged actions
   * @param policy the selection policy
   * @return included and excluded actions, each in extraction order
   */
  public SelectionResult select(List<Action> complete, List<Action> flagged,
      SelectionPolicy policy) {
    List<Action> candidates = new ArrayList<>(complete);
    candidates.addAll(flagged);
    candidates.sort(Comparator.comparing(Action::order).thenComparing(Action::id));

    List<Action> included = new ArrayList<>();
    List<ExcludedAction> excluded = new ArrayList<>();
    for (Action action : candidates) {
      ExclusionReason reason = exclusionReason(action, policy);
      if (reason == null) {
        included.add(action);
      } else {
        log.debug("Excluding action {}: {}", action.id(), reason);
        excluded.add(new ExcludedAction(action, reason));
      }
    }

    log.info(
        "Selected {} of {} actions ({} excluded)",
        included.size(),
        candidates.size(),
        excluded.size());
    return new SelectionResult(included, excluded);
  }

  private ExclusionReason exclusionReason(Action action, SelectionPolicy policy) {
    if (!action.isComplete() && !policy.includeFlagged()) {
      return ExclusionReason.FLAGGED;
    }
    if (!policy.excludeSubjects().isEmpty()
        && !action.sourceNodeIds().isEmpty()
        && policy.excludeSubjects().containsAll(action.sourceNodeIds())) {
      return ExclusionReason.EXCLUDED_SUBJECT;
    }
    OperationalLevel level =
        action.level() != null ? action.level() : properties.getFormat().getDefaultOperationalLevel();
    if (!level.isAtLeast(policy.minOperationalLevel())) {
      return ExclusionReason.BELOW_OPERATIONAL_LEVEL;
    }
    return null;
  }
}
