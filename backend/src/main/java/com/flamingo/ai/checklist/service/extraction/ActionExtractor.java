package com.flamingo.ai.checklist.service.extraction;

import com.flamingo.ai.checklist.agent.dto.ExtractedAction;
import com.flamingo.ai.checklist.agent.dto.ExtractedFormula;
import com.flamingo.ai.checklist.agent.dto.ExtractedTable;
import com.flamingo.ai.checklist.agent.dto.ExtractionResponse;
import com.flamingo.ai.checklist.domain.enums.ActionField;
import com.flamingo.ai.checklist.domain.enums.OperationalLevel;
import com.flamingo.ai.checklist.domain.model.Action;
import com.flamingo.ai.checklist.domain.model.DocumentNode;
import com.flamingo.ai.checklist.domain.model.ExtractionOrder;
import com.flamingo.ai.checklist.domain.model.Formula;
import com.flamingo.ai.checklist.domain.model.RawAction;
import com.flamingo.ai.checklist.domain.model.SourceReference;
import com.flamingo.ai.checklist.domain.model.Table;
import com.flamingo.ai.checklist.domain.model.TextSpan;
import com.flamingo.ai.checklist.exception.ExtractionFailureException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns one document node into validated actions and tables.
 *
 * <p>Calls the {@link ExtractionBackend} once, folds the node's formulas into the actions that use
 * them, and splits the result into complete and flagged actions. An action is complete iff who,
 * what and when are all non-empty after trimming.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActionExtractor {

  private final ExtractionBackend extractionBackend;
  private final FormulaIntegrator formulaIntegrator;
  private final ActionIdGenerator actionIdGenerator;

  /**
   * Extracts one node.
   *
   * @param node the node to extract
   * @param nodeIndex pre-order index of the node
   * @param nodeLevel operational level in effect for the node, inherited or declared
   * @return the node's contribution
   * @throws ExtractionFailureException if the backend fails or returns malformed output
   */
  public NodeExtractionResult extract(DocumentNode node, int nodeIndex, OperationalLevel nodeLevel) {
    ExtractionResponse response = extractionBackend.extract(ExtractionRequest.of(node));
    if (response == null) {
      throw new ExtractionFailureException(node.id(), "Backend returned no response");
    }

    Map<String, Formula> formulas = collectFormulas(node, response);

    List<RawAction> rawActions = new ArrayList<>();
    for (int i = 0; i < response.actions().size(); i++) {
      ExtractedAction dto = response.actions().get(i);
      if (dto == null) {
        throw new ExtractionFailureException(
            node.id(), "Malformed backend response: action " + i + " is null");
      }
      rawActions.add(toRawAction(node, nodeIndex, i, dto));
    }

    List<Action> actions = new ArrayList<>();
    List<String> formulaRefs = new ArrayList<>();
    for (RawAction raw : rawActions) {
      actions.add(validate(node, raw, nodeLevel));
      formulaRefs.add(raw.formulaRef());
    }

    FormulaIntegrator.FormulaIntegration integration =
        formulaIntegrator.integrate(actions, formulaRefs, formulas);

    List<Action> complete = new ArrayList<>();
    List<Action> flagged = new ArrayList<>();
    for (Action action : integration.actions()) {
      if (action.isComplete()) {
        complete.add(action);
      } else {
        log.debug("Flagged action {} in node {}: missing {}", action.id(), node.id(),
            action.missingFields());
        flagged.add(action);
      }
    }

    List<Table> tables = new ArrayList<>();
    for (int i = 0; i < response.tables().size(); i++) {
      ExtractedTable dto = response.tables().get(i);
      if (dto != null) {
        tables.add(toTable(node, i, dto));
      }
    }

    log.debug(
        "Node {} extracted: {} complete, {} flagged, {} tables, {} formulas integrated",
        node.id(),
        complete.size(),
        flagged.size(),
        tables.size(),
        integration.integrated());

    return new NodeExtractionResult(
        node.id(),
        complete,
        flagged,
        tables,
        integration.integrated(),
        integration.discarded(),
        integration.warnings());
  }

  private RawAction toRawAction(DocumentNode node, int nodeIndex, int index, ExtractedAction dto) {
    SourceReference reference =
        new SourceReference(node.id(), node.title(), span(node, dto.spanStart(), dto.spanEnd()));
    return new RawAction(
        dto.who(),
        dto.what(),
        dto.when(),
        dto.context(),
        reference,
        dto.formulaRef() == null ? null : dto.formulaRef().strip(),
        parseLevel(node.id(), dto.operationalLevel()),
        new ExtractionOrder(nodeIndex, index));
  }

  private Action validate(DocumentNode node, RawAction raw, OperationalLevel nodeLevel) {
    String who = strip(raw.who());
    String what = strip(raw.what());
    String when = strip(raw.when());

    Set<ActionField> missing = EnumSet.noneOf(ActionField.class);
    if (who.isEmpty()) {
      missing.add(ActionField.WHO);
    }
    if (what.isEmpty()) {
      missing.add(ActionField.WHAT);
    }
    if (when.isEmpty()) {
      missing.add(ActionField.WHEN);
    }

    String id =
        actionIdGenerator.actionId(node.id(), raw.order().actionIndex(), who, what, when);
    OperationalLevel level = raw.level() != null ? raw.level() : nodeLevel;

    return new Action(
        id,
        who,
        what,
        when,
        strip(raw.context()),
        List.of(raw.reference()),
        null,
        level,
        missing,
        raw.order(),
        null,
        null);
  }

  /**
   * Node formulas keep their {@code F<n>} labels; formulas only the backend reported are appended
   * after them. Keys are the labels actions use to claim a formula.
   */
  private Map<String, Formula> collectFormulas(DocumentNode node, ExtractionResponse response) {
    Map<String, ExtractedFormula> reported = new LinkedHashMap<>();
    List<ExtractedFormula> unlabelled = new ArrayList<>();
    for (ExtractedFormula dto : response.formulas()) {
      if (dto == null) {
        continue;
      }
      if (dto.ref() == null || dto.ref().isBlank()) {
        unlabelled.add(dto);
      } else {
        reported.putIfAbsent(dto.ref().strip(), dto);
      }
    }

    SourceReference reference =
        new SourceReference(node.id(), node.title(), TextSpan.whole(node.text()));
    Map<String, Formula> formulas = new LinkedHashMap<>();
    for (int i = 0; i < node.formulas().size(); i++) {
      String label = ExtractionRequest.formulaLabel(i);
      ExtractedFormula dto = reported.remove(label);
      formulas.put(label, toFormula(node.id(), label, node.formulas().get(i), dto, reference));
    }

    List<Map.Entry<String, ExtractedFormula>> extra = new ArrayList<>(reported.entrySet());
    unlabelled.forEach(dto -> extra.add(Map.entry("", dto)));
    for (Map.Entry<String, ExtractedFormula> entry : extra) {
      ExtractedFormula dto = entry.getValue();
      if (dto.formula() == null || dto.formula().isBlank()) {
        continue;
      }
      String label = ExtractionRequest.formulaLabel(formulas.size());
      Formula formula = toFormula(node.id(), label, dto.formula(), dto, reference);
      formulas.put(entry.getKey().isEmpty() ? label : entry.getKey(), formula);
    }
    return formulas;
  }

  private Formula toFormula(
      String nodeId, String label, String equation, ExtractedFormula dto,
      SourceReference reference) {
    String description = dto == null ? "" : strip(dto.formulaContext());
    return new Formula(nodeId + ":" + label, equation.strip(), description, example(dto),
        reference);
  }

  private static String example(ExtractedFormula dto) {
    if (dto == null) {
      return null;
    }
    String computation = strip(dto.computationExample());
    String result = strip(dto.sampleResult());
    if (!computation.isEmpty() && !result.isEmpty()) {
      return computation + " = " + result;
    }
    if (!computation.isEmpty()) {
      return computation;
    }
    return result.isEmpty() ? null : result;
  }

  private Table toTable(DocumentNode node, int index, ExtractedTable dto) {
    SourceReference reference =
        new SourceReference(node.id(), node.title(), TextSpan.whole(node.text()));
    return new Table(
        actionIdGenerator.tableId(node.id(), index, dto.title(), dto.headers()),
        dto.title(),
        cells(dto.headers()),
        dto.rows() == null
            ? List.of()
            : dto.rows().stream().filter(Objects::nonNull).map(ActionExtractor::cells).toList(),
        reference);
  }

  private static List<String> cells(List<String> row) {
    return row == null ? List.of() : row.stream().map(ActionExtractor::strip).toList();
  }

  private static TextSpan span(DocumentNode node, Integer start, Integer end) {
    int length = node.text().length();
    if (start == null || end == null || start < 0 || end < start || end > length) {
      return TextSpan.whole(node.text());
    }
    return new TextSpan(start, end);
  }

  private static OperationalLevel parseLevel(String nodeId, String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    String normalized = value.strip().toUpperCase(Locale.ROOT);
    for (OperationalLevel level : OperationalLevel.values()) {
      if (level.name().equals(normalized)) {
        return level;
      }
    }
    log.debug("Ignoring unknown operational level '{}' in node {}", value, nodeId);
    return null;
  }

  private static String strip(String value) {
    return value == null ? "" : value.strip();
  }
}
