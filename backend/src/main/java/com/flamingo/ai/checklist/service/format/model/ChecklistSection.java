package com.flamingo.ai.checklist.service.format.model;

import com.flamingo.ai.checklist.domain.enums.OperationalLevel;
import com.flamingo.ai.checklist.domain.enums.TriggerKind;
import java.util.List;

/** Rows sharing an operational level and a trigger kind. */
public record ChecklistSection(
    OperationalLevel level, TriggerKind triggerKind, List<ChecklistRow> rows) {

  public ChecklistSection {
    rows = List.copyOf(rows);
  }

  public String heading() {
    return level.getLabel() + " / " + triggerKind.getLabel();
  }
}
