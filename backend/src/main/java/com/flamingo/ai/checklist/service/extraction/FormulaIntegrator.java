package com.flamingo.ai.checklist.service.extraction;

import com.flamingo.ai.checklist.config.ChecklistProperties;
import com.flamingo.ai.checklist.domain.enums.WarningType;
import com.flamingo.ai.checklist.domain.model.Action;
import com.flamingo.ai.checklist.domain.model.Formula;
import com.flamingo.ai.checklist.domain.model.PipelineWarning;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Moves each formula of a node into exactly one action of the same node.
 *
 * <p>A formula goes to the first action that names it. An unnamed formula goes to the node's only
 * action when there is exactly one; otherwise it is discarded with a warning. An action owns at
 * most one formula, so a second formula aimed at the same action is discarded as well.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FormulaIntegrator {

  public static final String FORMULA_MARKER = "Calculate using formula: `";

  private final ChecklistProperties properties;

  /**
   * Result of integrating one node's formulas.
   *
   * @param actions the node's actions, with formulas folded into their descriptions
   * @param integrated formulas now owned by an action
   * @param discarded formulas that were dropped
   * @param warnings one {@link WarningType#UNRESOLVED_FORMULA} per discarded formula
   */
  public record FormulaIntegration(
      List<Action> actions, int integrated, int discarded, List<PipelineWarning> warnings) {}

  /**
   * Integrates formulas into actions.
   *
   * @param actions the node's actions in extraction order
   * @param formulaRefs label each action claims, parallel to {@code actions}, entries may be null
   * @param formulas the node's formulas keyed by label, in label order
   * @return the integration outcome
   */
  public FormulaIntegration integrate(
      List<Action> actions, List<String> formulaRefs, Map<String, Formula> formulas) {
    if (formulas.isEmpty()) {
      return new FormulaIntegration(actions, 0, 0, List.of());
    }

    Map<String, Integer> owners = new HashMap<>();
    boolean[] taken = new boolean[actions.size()];
    for (int i = 0; i < actions.size(); i++) {
      String ref = formulaRefs.get(i);
      if (ref == null || ref.isBlank()) {
        continue;
      }
      if (!formulas.containsKey(ref)) {
        log.debug("Action {} claims unknown formula {}", actions.get(i).id(), ref);
        continue;
      }
      if (!owners.containsKey(ref) && !taken[i]) {
        owners.put(ref, i);
        taken[i] = true;
      }
    }

    List<PipelineWarning> warnings = new ArrayList<>();
    for (Map.Entry<String, Formula> entry : formulas.entrySet()) {
      String label = entry.getKey();
      Formula formula = entry.getValue();
      if (owners.containsKey(label)) {
        continue;
      }
      if (actions.size() == 1 && !taken[0]) {
        owners.put(label, 0);
        taken[0] = true;
        continue;
      }
      log.warn(
          "Discarding formula {} ('{}'): no action in the node is linked to it",
          formula.id(),
          formula.equation());
      warnings.add(
          new PipelineWarning(
              WarningType.UNRESOLVED_FORMULA,
              formula.id(),
              "Formula '" + formula.equation() + "' has no linked action and was discarded"));
    }

    List<Action> result = new ArrayList<>(actions);
    for (Map.Entry<String, Formula> entry : formulas.entrySet()) {
      Formula formula = entry.getValue();
      Integer owner = owners.get(entry.getKey());
      if (owner != null) {
        Action action = result.get(owner);
        result.set(owner, action.withFormula(appendFormula(action.what(), formula),
            formula.toReference()));
      }
    }

    return new FormulaIntegration(result, owners.size(), warnings.size(), warnings);
  }

  /** Appends the standard formula sentence to a description. */
  public String appendFormula(String what, Formula formula) {
    String example =
        formula.example() == null || formula.example().isBlank()
            ? properties.getFormat().getFormulaExamplePlaceholder()
            : formula.example();
    String suffix =
        FORMULA_MARKER + formula.equation() + "`. Example: `" + example + "`.";
    String base = what == null ? "" : what.strip();
    return base.isEmpty() ? suffix : base + " " + suffix;
  }

  /** The description without the appended formula sentence. */
  public static String baseDescription(String what) {
    if (what == null) {
      return "";
    }
    int index = what.indexOf(FORMULA_MARKER);
    return index < 0 ? what : what.substring(0, index).strip();
  }
}
