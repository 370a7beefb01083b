package com.flamingo.ai.checklist.service.extraction;

import com.flamingo.ai.checklist.agent.dto.ExtractionResponse;
import com.flamingo.ai.checklist.exception.ExtractionFailureException;

/**
 * Per-node extraction service. Implementations either return a complete response or throw;
 * a malformed response counts as a failed call.
 */
public interface ExtractionBackend {

  /**
   * Extracts raw actions, formulas and tables from one node.
   *
   * @param request the node content
   * @return the backend's response, never {@code null}
   * @throws ExtractionFailureException if the call fails, times out or returns malformed output
   */
  ExtractionResponse extract(ExtractionRequest request);
}
