package com.flamingo.ai.checklist.service.format.model;

import java.util.List;

/**
 * Sign-off stub. Always addressed to a role, never to a person.
 *
 * @param roleId taxonomy id of the confirming role, {@code null} if it could not be resolved
 * @param roleLabel role name, or the "needs assignment" marker
 * @param fields blank fields to be completed at sign-off
 */
public record ExecutionConfirmation(String roleId, String roleLabel, List<String> fields) {

  public static final List<String> DEFAULT_FIELDS =
      List.of("Position", "Signature", "Date and time of confirmation");

  public ExecutionConfirmation {
    fields = List.copyOf(fields);
  }
}
