package com.flamingo.ai.checklist.service.role;

import java.util.Optional;

/** Lookup against the organizational role taxonomy. Roles are positions, never people. */
public interface RoleTaxonomy {

  /**
   * Finds the best candidate role for a free-text responsible party.
   *
   * @param who the text to resolve
   * @return the best candidate, or empty if nothing matches or the best score is shared by
   *     different roles
   */
  Optional<RoleMatch> resolve(String who);

  /** Looks up a role by its id. */
  Optional<RoleMatch> findById(String roleId);
}
