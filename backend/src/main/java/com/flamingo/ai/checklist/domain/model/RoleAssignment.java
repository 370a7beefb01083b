package com.flamingo.ai.checklist.domain.model;

/**
 * Binding of an action's free-text "who" to a canonical organizational role.
 *
 * @param roleId taxonomy role id, {@code null} when unresolved
 * @param roleName display name of the role, {@code null} when unresolved
 * @param confidence match score in [0, 1]
 * @param sourceText the "who" text that was looked up
 */
public record RoleAssignment(String roleId, String roleName, double confidence, String sourceText) {

  public static final String NEEDS_ASSIGNMENT = "NEEDS ASSIGNMENT";

  public static RoleAssignment resolved(String roleId, String roleName, double confidence,
      String sourceText) {
    return new RoleAssignment(roleId, roleName, confidence, sourceText);
  }

  public static RoleAssignment unresolved(String sourceText) {
    return new RoleAssignment(null, null, 0.0, sourceText);
  }

  public boolean isResolved() {
    return roleId != null;
  }

  /** Role name, or an explicit "needs assignment" marker carrying the original text. */
  public String displayName() {
    if (isResolved()) {
      return roleName;
    }
    return sourceText == null || sourceText.isBlank()
        ? NEEDS_ASSIGNMENT
        : NEEDS_ASSIGNMENT + " (" + sourceText.trim() + ")";
  }
}
