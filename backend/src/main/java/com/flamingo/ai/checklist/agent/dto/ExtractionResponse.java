package com.flamingo.ai.checklist.agent.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Structured output from ActionExtractionAgent for one document node.
 *
 * <p>Null entries are kept so the extractor can reject malformed output.
 */
public record ExtractionResponse(
    List<ExtractedAction> actions, List<ExtractedFormula> formulas, List<ExtractedTable> tables) {

  public ExtractionResponse {
    actions = copy(actions);
    formulas = copy(formulas);
    tables = copy(tables);
  }

  private static <T> List<T> copy(List<T> values) {
    return values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
  }
}
