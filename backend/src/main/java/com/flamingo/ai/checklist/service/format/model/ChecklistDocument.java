package com.flamingo.ai.checklist.service.format.model;

import java.util.List;

/**
 * The rendered checklist: specification, content grouped by level and trigger kind, execution
 * confirmation, and appendix tables.
 */
public record ChecklistDocument(
    ChecklistSpecification specification,
    List<ChecklistSection> sections,
    ExecutionConfirmation confirmation,
    List<ChecklistAppendix> appendices) {

  public ChecklistDocument {
    sections = List.copyOf(sections);
    appendices = List.copyOf(appendices);
  }

  public int rowCount() {
    return sections.stream().mapToInt(s -> s.rows().size()).sum();
  }
}
