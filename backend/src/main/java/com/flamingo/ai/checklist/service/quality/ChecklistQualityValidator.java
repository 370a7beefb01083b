package com.flamingo.ai.checklist.service.quality;

import com.flamingo.ai.checklist.domain.enums.WarningType;
import com.flamingo.ai.checklist.domain.model.Action;
import com.flamingo.ai.checklist.domain.model.FormulaReference;
import com.flamingo.ai.checklist.domain.model.PipelineWarning;
import com.flamingo.ai.checklist.service.format.model.ChecklistDocument;
import com.flamingo.ai.checklist.service.format.model.ChecklistRow;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Checks a formatted checklist against the actions it was built from. Problems are reported as
 * {@link WarningType#QUALITY_CHECK} warnings; the checklist itself is never changed.
 */
@Service
@Slf4j
public class ChecklistQualityValidator {

  static final String CHECKLIST_SUBJECT = "checklist";

  /**
   * Validates {@code document}.
   *
   * @param document the formatted checklist
   * @param included the actions selected for the checklist
   * @return one warning per problem found, empty when the checklist is sound
   */
  public List<PipelineWarning> validate(ChecklistDocument document, List<Action> included) {
    List<PipelineWarning> issues = new ArrayList<>();
    List<ChecklistRow> rows =
        document.sections().stream().flatMap(section -> section.rows().stream()).toList();

    if (rows.size() != included.size()) {
      issues.add(issue(CHECKLIST_SUBJECT,
          "Checklist has " + rows.size() + " rows for " + included.size() + " included actions"));
    }
    if (document.specification().numberOfActions() != rows.size()) {
      issues.add(issue(CHECKLIST_SUBJECT,
          "Specification declares " + document.specification().numberOfActions()
              + " actions but the checklist has " + rows.size() + " rows"));
    }

    Map<String, ChecklistRow> rowsByAction = new LinkedHashMap<>();
    for (int i = 0; i < rows.size(); i++) {
      ChecklistRow row = rows.get(i);
      if (row.number() != i + 1) {
        issues.add(issue(row.actionId(),
            "Row numbered " + row.number() + " at position " + (i + 1)));
      }
      if (row.responsibleRole() == null || row.responsibleRole().isBlank()) {
        issues.add(issue(row.actionId(), "Row " + row.number() + " has no responsible role"));
      }
      rowsByAction.put(row.actionId(), row);
    }

    for (Action action : included) {
      ChecklistRow row = rowsByAction.get(action.id());
      if (row == null) {
        issues.add(issue(action.id(), "Included action has no checklist row"));
        continue;
      }
      FormulaReference formula = action.formulaReference();
      if (formula != null && !mentions(row, formula.equation())) {
        issues.add(issue(action.id(),
            "Row " + row.number() + " lost formula " + formula.formulaId()));
      }
    }

    if (issues.isEmpty()) {
      log.debug("Checklist passed quality validation: {} rows", rows.size());
    } else {
      log.warn("Checklist failed {} quality checks", issues.size());
    }
    return issues;
  }

  private static boolean mentions(ChecklistRow row, String equation) {
    return (row.action() != null && row.action().contains(equation))
        || (row.remarks() != null && row.remarks().contains(equation));
  }

  private static PipelineWarning issue(String subjectId, String message) {
    return new PipelineWarning(WarningType.QUALITY_CHECK, subjectId, message);
  }
}
