package com.flamingo.ai.checklist.service.extraction;

import com.flamingo.ai.checklist.domain.model.DocumentNode;
import java.util.List;

/**
 * Input to one backend call. Formulas are labelled {@code F1..Fn} in list order.
 *
 * @param nodeId node being extracted
 * @param title node heading
 * @param text node body text
 * @param tables raw table blocks
 * @param formulas raw formula strings
 */
public record ExtractionRequest(
    String nodeId, String title, String text, List<String> tables, List<String> formulas) {

  public ExtractionRequest {
    tables = List.copyOf(tables);
    formulas = List.copyOf(formulas);
  }

  public static ExtractionRequest of(DocumentNode node) {
    return new ExtractionRequest(
        node.id(), node.title(), node.text(), node.tables(), node.formulas());
  }

  public static String formulaLabel(int index) {
    return "F" + (index + 1);
  }
}
