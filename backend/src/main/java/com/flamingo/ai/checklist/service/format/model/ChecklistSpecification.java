package com.flamingo.ai.checklist.service.format.model;

import lombok.Builder;

/** The "Checklist Specifications" block. Unknown values are rendered as {@code "..."}. */
@Builder
public record ChecklistSpecification(
    String checklistName,
    String scope,
    String jurisdiction,
    String crisisArea,
    String checklistType,
    String referenceProtocols,
    String operationalSetting,
    String processOwner,
    String responsibleParties,
    String activationTrigger,
    String objective,
    int numberOfActions) {

  public static final String PLACEHOLDER = "...";
  public static final String DO_NOT_COMPLETE = "Do not complete this section";
}
