package com.flamingo.ai.checklist.service.role;

import com.flamingo.ai.checklist.config.ChecklistProperties;
import com.flamingo.ai.checklist.domain.enums.WarningType;
import com.flamingo.ai.checklist.domain.model.Action;
import com.flamingo.ai.checklist.domain.model.PipelineWarning;
import com.flamingo.ai.checklist.domain.model.RoleAssignment;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Binds each action's "who" to a canonical role. Anything below the confidence threshold stays
 * unresolved and is rendered as needing assignment; a wrong binding is worse than none.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RoleAssigner {

  private final RoleTaxonomy roleTaxonomy;
  private final ChecklistProperties properties;

  /**
   * Result of assigning roles to a set of actions.
   *
   * @param actions the actions with {@link Action#role()} set, same order as the input
   * @param unresolved number of actions left unresolved
   * @param warnings one {@link WarningType#UNRESOLVED_ROLE} per unresolved action
   */
  public record RoleAssignmentResult(
      List<Action> actions, int unresolved, List<PipelineWarning> warnings) {}

  public RoleAssignment assign(String who) {
    if (who == null || who.isBlank()) {
      return RoleAssignment.unresolved(who);
    }
    double threshold = properties.getRoles().getMatchThreshold();
    Optional<RoleMatch> match = roleTaxonomy.resolve(who);
    if (match.isPresent() && match.get().confidence() >= threshold) {
      RoleMatch role = match.get();
      return RoleAssignment.resolved(role.roleId(), role.roleName(), role.confidence(), who);
    }
    return RoleAssignment.unresolved(who);
  }

  public RoleAssignmentResult assignAll(List<Action> actions) {
    List<Action> assigned = new ArrayList<>(actions.size());
    List<PipelineWarning> warnings = new ArrayList<>();
    for (Action action : actions) {
      RoleAssignment role = assign(action.who());
      if (!role.isResolved()) {
        log.warn("No confident role for '{}' (action {})", action.who(), action.id());
        warnings.add(
            new PipelineWarning(
                WarningType.UNRESOLVED_ROLE,
                action.id(),
                "Responsible party '" + action.who() + "' needs assignment to a role"));
      }
      assigned.add(action.withRole(role));
    }
    return new RoleAssignmentResult(assigned, warnings.size(), warnings);
  }
}
