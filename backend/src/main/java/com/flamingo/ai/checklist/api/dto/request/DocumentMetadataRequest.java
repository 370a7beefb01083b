package com.flamingo.ai.checklist.api.dto.request;

import com.flamingo.ai.checklist.domain.model.DocumentMetadata;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for document-level checklist metadata. All fields are optional. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentMetadataRequest {

  private String checklistName;
  private String scope;
  private String jurisdiction;
  private String crisisArea;
  private String checklistType;
  private String referenceProtocols;
  private String operationalSetting;
  private String processOwner;
  private String activationTrigger;
  private String objective;

  public DocumentMetadata toDomain() {
    return DocumentMetadata.builder()
        .checklistName(checklistName)
        .scope(scope)
        .jurisdiction(jurisdiction)
        .crisisArea(crisisArea)
        .checklistType(checklistType)
        .referenceProtocols(referenceProtocols)
        .operationalSetting(operationalSetting)
        .processOwner(processOwner)
        .activationTrigger(activationTrigger)
        .objective(objective)
        .build();
  }
}
