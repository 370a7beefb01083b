package com.flamingo.ai.checklist.exception;

import com.flamingo.ai.checklist.domain.enums.PipelineStage;

/** Exception thrown when a pipeline run ends in {@link PipelineStage#FAILED}. */
public class ChecklistGenerationException extends RuntimeException {

  private final String userMessage;

  public ChecklistGenerationException(String diagnostic) {
    super(diagnostic);
    this.userMessage = "Checklist could not be generated: " + diagnostic;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
