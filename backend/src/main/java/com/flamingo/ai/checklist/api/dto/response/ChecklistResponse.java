package com.flamingo.ai.checklist.api.dto.response;

import com.flamingo.ai.checklist.domain.enums.PipelineStage;
import com.flamingo.ai.checklist.service.format.model.ChecklistDocument;
import com.flamingo.ai.checklist.service.pipeline.MetadataReport;
import com.flamingo.ai.checklist.service.pipeline.PipelineResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a generated checklist. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChecklistResponse {

  private PipelineStage stage;
  private ChecklistDocument checklist;
  private String markdown;
  private MetadataReport report;

  public static ChecklistResponse fromResult(PipelineResult result) {
    return ChecklistResponse.builder()
        .stage(result.stage())
        .checklist(result.checklist())
        .markdown(result.markdown())
        .report(result.report())
        .build();
  }
}
