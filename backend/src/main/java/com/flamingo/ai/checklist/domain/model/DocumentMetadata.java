package com.flamingo.ai.checklist.domain.model;

import lombok.Builder;

/**
 * Document-level metadata used to fill the checklist's specification block. Every field is
 * optional; missing values render as a placeholder.
 */
@Builder
public record DocumentMetadata(
    String checklistName,
    String scope,
    String jurisdiction,
    String crisisArea,
    String checklistType,
    String referenceProtocols,
    String operationalSetting,
    String processOwner,
    String activationTrigger,
    String objective) {

  public static DocumentMetadata empty() {
    return DocumentMetadata.builder().build();
  }
}
