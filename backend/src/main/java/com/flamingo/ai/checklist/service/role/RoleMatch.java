package com.flamingo.ai.checklist.service.role;

/**
 * Best taxonomy candidate for a "who" text.
 *
 * @param roleId taxonomy role id
 * @param roleName display name
 * @param confidence match score in [0, 1], 1 for an exact name or alias match
 */
public record RoleMatch(String roleId, String roleName, double confidence) {}
