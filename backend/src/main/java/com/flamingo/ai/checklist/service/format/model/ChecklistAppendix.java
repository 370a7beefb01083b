package com.flamingo.ai.checklist.service.format.model;

import java.util.List;

/**
 * A table attached to the checklist.
 *
 * @param letter appendix letter (A, B, ...)
 * @param tableId id of the source table
 * @param title appendix title
 * @param header header row
 * @param rows body rows
 * @param reference label of the subject the table came from
 * @param relatedActions row numbers pointing at this appendix
 */
public record ChecklistAppendix(
    String letter,
    String tableId,
    String title,
    List<String> header,
    List<List<String>> rows,
    String reference,
    List<Integer> relatedActions) {

  public ChecklistAppendix {
    header = List.copyOf(header);
    rows = rows.stream().map(List::copyOf).toList();
    relatedActions = List.copyOf(relatedActions);
  }
}
