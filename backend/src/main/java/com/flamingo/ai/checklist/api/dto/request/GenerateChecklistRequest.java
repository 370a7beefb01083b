package com.flamingo.ai.checklist.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for generating a checklist from a document tree. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerateChecklistRequest {

  @NotNull(message = "Document is required")
  @Valid
  private DocumentNodeRequest document;

  private DocumentMetadataRequest metadata;

  private SelectionPolicyRequest policy;
}
