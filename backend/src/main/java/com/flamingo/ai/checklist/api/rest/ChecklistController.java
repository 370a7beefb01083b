package com.flamingo.ai.checklist.api.rest;

import com.flamingo.ai.checklist.api.dto.request.GenerateChecklistRequest;
import com.flamingo.ai.checklist.api.dto.response.ChecklistResponse;
import com.flamingo.ai.checklist.config.ChecklistProperties;
import com.flamingo.ai.checklist.domain.model.DocumentMetadata;
import com.flamingo.ai.checklist.domain.model.SelectionPolicy;
import com.flamingo.ai.checklist.exception.ChecklistGenerationException;
import com.flamingo.ai.checklist.service.pipeline.ChecklistPipeline;
import com.flamingo.ai.checklist.service.pipeline.PipelineResult;
import jakarta.validation.Valid;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for checklist generation. */
@RestController
@RequestMapping("/api/checklists")
@RequiredArgsConstructor
@Slf4j
public class ChecklistController {

  private final ChecklistPipeline checklistPipeline;
  private final ChecklistProperties properties;

  /** Runs the pipeline over the submitted document tree. */
  @PostMapping
  public ResponseEntity<ChecklistResponse> generate(
      @Valid @RequestBody GenerateChecklistRequest request) {
    SelectionPolicy defaults = properties.getSelection().toPolicy();
    SelectionPolicy policy =
        request.getPolicy() == null ? defaults : request.getPolicy().toDomain(defaults);
    DocumentMetadata metadata =
        request.getMetadata() == null
            ? DocumentMetadata.empty()
            : request.getMetadata().toDomain();

    log.info("Checklist requested for document {}", request.getDocument().getId());
    PipelineResult result =
        checklistPipeline.run(request.getDocument().toDomain(null), metadata, policy);
    if (!result.isDone()) {
      throw new ChecklistGenerationException(result.failureReason());
    }
    return ResponseEntity.ok(ChecklistResponse.fromResult(result));
  }

  /** Returns a simple health check response. */
  @GetMapping("/health")
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "checklist-extractor");
    return ResponseEntity.ok(health);
  }
}
