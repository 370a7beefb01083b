package com.flamingo.ai.checklist.service.format;

import com.flamingo.ai.checklist.config.ChecklistProperties;
import com.flamingo.ai.checklist.domain.enums.ActionStatus;
import com.flamingo.ai.checklist.domain.enums.OperationalLevel;
import com.flamingo.ai.checklist.domain.enums.TriggerKind;
import com.flamingo.ai.checklist.domain.model.Action;
import com.flamingo.ai.checklist.domain.model.DocumentMetadata;
import com.flamingo.ai.checklist.domain.model.FormulaReference;
import com.flamingo.ai.checklist.domain.model.RoleAssignment;
import com.flamingo.ai.checklist.domain.model.SourceReference;
import com.flamingo.ai.checklist.domain.model.Table;
import com.flamingo.ai.checklist.domain.model.TimingAnnotation;
import com.flamingo.ai.checklist.service.format.model.ChecklistAppendix;
import com.flamingo.ai.checklist.service.format.model.ChecklistDocument;
import com.flamingo.ai.checklist.service.format.model.ChecklistRow;
import com.flamingo.ai.checklist.service.format.model.ChecklistSection;
import com.flamingo.ai.checklist.service.format.model.ChecklistSpecification;
import com.flamingo.ai.checklist.service.format.model.ExecutionConfirmation;
import com.flamingo.ai.checklist.service.role.RoleTaxonomy;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Renders normalized actions into the three-part checklist: specification, content grouped by
 * operational level then trigger kind, and execution confirmation. Tables become lettered
 * appendices.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChecklistFormatter {

  private static final Comparator<OperationalLevel> LEVEL_ORDER =
      Comparator.comparingInt(OperationalLevel::getRank).reversed();

  private final ChecklistProperties properties;
  private final RoleTaxonomy roleTaxonomy;

  /**
   * Builds the checklist.
   *
   * @param actions included actions, timing and role already assigned
   * @param tables tables to attach as appendices
   * @param metadata document-level values for the specification block
   * @return the checklist document
   */
  public ChecklistDocument format(
      List<Action> actions, List<Table> tables, DocumentMetadata metadata) {
    List<String> letters = new ArrayList<>();
    for (int i = 0; i < tables.size(); i++) {
      letters.add(appendixLetter(i));
    }

    Map<SectionKey, List<Action>> grouped = new LinkedHashMap<>();
    actions.stream()
        .sorted(rowOrder())
        .forEach(
            action ->
                grouped
                    .computeIfAbsent(
                        new SectionKey(levelOf(action), timingOf(action).kind()),
                        key -> new ArrayList<>())
                    .add(action));

    List<ChecklistSection> sections = new ArrayList<>();
    Map<String, List<Integer>> rowsByTable = new LinkedHashMap<>();
    tables.forEach(table -> rowsByTable.put(table.id(), new ArrayList<>()));
    int number = 0;
    for (Map.Entry<SectionKey, List<Action>> entry : grouped.entrySet()) {
      List<ChecklistRow> rows = new ArrayList<>();
      for (Action action : entry.getValue()) {
        number++;
        List<String> appendixRefs = new ArrayList<>();
        for (int i = 0; i < tables.size(); i++) {
          Table table = tables.get(i);
          if (action.sourceNodeIds().contains(table.reference().nodeId())) {
            appendixRefs.add(letters.get(i));
            rowsByTable.get(table.id()).add(number);
          }
        }
        rows.add(toRow(number, action, appendixRefs));
      }
      sections.add(new ChecklistSection(entry.getKey().level(), entry.getKey().kind(), rows));
    }

    List<ChecklistAppendix> appendices = new ArrayList<>();
    for (int i = 0; i < tables.size(); i++) {
      Table table = tables.get(i);
      appendices.add(
          new ChecklistAppendix(
              letters.get(i),
              table.id(),
              table.title().isBlank() ? "Table " + letters.get(i) : table.title(),
              table.header(),
              table.rows(),
              table.reference().label(),
              rowsByTable.get(table.id())));
    }

    ChecklistDocument document =
        new ChecklistDocument(
            specification(metadata, actions, number), sections, confirmation(), appendices);
    log.info(
        "Formatted checklist: {} rows in {} sections, {} appendices",
        number,
        sections.size(),
        appendices.size());
    return document;
  }

  private ChecklistRow toRow(int number, Action action, List<String> appendixRefs) {
    RoleAssignment role =
        action.role() != null ? action.role() : RoleAssignment.unresolved(action.who());
    return new ChecklistRow(
        number,
        action.id(),
        action.what(),
        role.displayName(),
        action.when(),
        ActionStatus.PENDING,
        remarks(action, role, appendixRefs));
  }

  private String remarks(Action action, RoleAssignment role, List<String> appendixRefs) {
    List<String> parts = new ArrayList<>();
    FormulaReference formula = action.formulaReference();
    if (formula != null) {
      parts.add(
          "Formula " + formula.formulaId() + ": `" + formula.equation() + "` (source: "
              + formula.reference().label() + ")");
    }
    appendixRefs.forEach(letter -> parts.add("See Appendix " + letter));
    if (!role.isResolved()) {
      parts.add("Responsible role needs assignment");
    }
    if (!action.isComplete()) {
      parts.add("Incomplete: missing " + action.missingFields().stream()
          .map(field -> field.name().toLowerCase(Locale.ROOT))
          .sorted()
          .collect(Collectors.joining(", ")));
    }
    parts.add("Source: " + action.references().stream()
        .map(SourceReference::label)
        .collect(Collectors.joining("; ")));
    return String.join(". ", parts);
  }

  private ChecklistSpecification specification(
      DocumentMetadata metadata, List<Action> actions, int numberOfActions) {
    DocumentMetadata meta = metadata == null ? DocumentMetadata.empty() : metadata;
    TreeSet<String> roles = new TreeSet<>();
    actions.stream()
        .map(Action::role)
        .filter(role -> role != null && role.isResolved())
        .forEach(role -> roles.add(role.roleName()));

    return ChecklistSpecification.builder()
        .checklistName(orPlaceholder(meta.checklistName()))
        .scope(orPlaceholder(meta.scope()))
        .jurisdiction(orPlaceholder(meta.jurisdiction()))
        .crisisArea(orPlaceholder(meta.crisisArea()))
        .checklistType(orPlaceholder(meta.checklistType()))
        .referenceProtocols(orPlaceholder(meta.referenceProtocols()))
        .operationalSetting(orPlaceholder(meta.operationalSetting()))
        .processOwner(orPlaceholder(meta.processOwner()))
        .responsibleParties(roles.isEmpty() ? ChecklistSpecification.PLACEHOLDER
            : String.join(", ", roles))
        .activationTrigger(orPlaceholder(meta.activationTrigger()))
        .objective(orPlaceholder(meta.objective()))
        .numberOfActions(numberOfActions)
        .build();
  }

  private ExecutionConfirmation confirmation() {
    String roleId = properties.getFormat().getConfirmingRole();
    return roleTaxonomy
        .findById(roleId)
        .map(role -> new ExecutionConfirmation(role.roleId(), role.roleName(),
            ExecutionConfirmation.DEFAULT_FIELDS))
        .orElseGet(
            () -> {
              log.warn("Confirming role '{}' is not in the role taxonomy", roleId);
              return new ExecutionConfirmation(
                  null,
                  RoleAssignment.NEEDS_ASSIGNMENT + " (" + roleId + ")",
                  ExecutionConfirmation.DEFAULT_FIELDS);
            });
  }

  private Comparator<Action> rowOrder() {
    return Comparator.comparing(this::levelOf, LEVEL_ORDER)
        .thenComparingInt(action -> timingOf(action).kind().getSortOrder())
        .thenComparing(
            action -> timingOf(action).deadline(),
            Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(Action::order)
        .thenComparing(Action::id);
  }

  private OperationalLevel levelOf(Action action) {
    return action.level() != null
        ? action.level()
        : properties.getFormat().getDefaultOperationalLevel();
  }

  private static TimingAnnotation timingOf(Action action) {
    return action.timing() != null ? action.timing() : TimingAnnotation.event(action.when());
  }

  private static String orPlaceholder(String value) {
    return value == null || value.isBlank() ? ChecklistSpecification.PLACEHOLDER : value;
  }

  /** A, B, ..., Z, AA, AB, ... */
  static String appendixLetter(int index) {
    StringBuilder letters = new StringBuilder();
    int value = index;
    do {
      letters.insert(0, (char) ('A' + value % 26));
      value = value / 26 - 1;
    } while (value >= 0);
    return letters.toString();
  }

  private record SectionKey(OperationalLevel level, TriggerKind kind) {}
}
