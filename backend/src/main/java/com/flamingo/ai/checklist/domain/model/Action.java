package com.flamingo.ai.checklist.domain.model;

import com.flamingo.ai.checklist.domain.enums.ActionField;
import com.flamingo.ai.checklist.domain.enums.OperationalLevel;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Canonical action produced by validation.
 *
 * <p>Actions are never edited in place. Deduplication, timing normalization and role assignment
 * all return new instances through the {@code with*} methods.
 *
 * @param id content-derived identifier, stable across reruns on identical input
 * @param who responsible party as extracted
 * @param what directive, including the formula suffix when a formula was integrated
 * @param when timing as extracted, kept verbatim for audit
 * @param context supporting text from the source
 * @param references every subject this action was found in, without duplicates
 * @param formulaReference formula absorbed by this action, or {@code null}
 * @param level operational level
 * @param missingFields fields that were empty after trimming; empty for a complete action
 * @param order extraction position of the first occurrence
 * @param timing normalized "when", {@code null} until the timing stage runs
 * @param role canonical role binding, {@code null} until the role stage runs
 */
public record Action(
    String id,
    String who,
    String what,
    String when,
    String context,
    List<SourceReference> references,
    FormulaReference formulaReference,
    OperationalLevel level,
    Set<ActionField> missingFields,
    ExtractionOrder order,
    TimingAnnotation timing,
    RoleAssignment role) {

  public Action {
    who = who == null ? "" : who;
    what = what == null ? "" : what;
    when = when == null ? "" : when;
    context = context == null ? "" : context;
    references = List.copyOf(new LinkedHashSet<>(references));
    missingFields =
        missingFields == null || missingFields.isEmpty()
            ? Set.of()
            : Set.copyOf(EnumSet.copyOf(missingFields));
    if (formulaReference != null && !what.contains(formulaReference.equation())) {
      throw new IllegalArgumentException(
          "Action " + id + " references formula " + formulaReference.formulaId()
              + " but its description does not contain the equation");
    }
  }

  public boolean isComplete() {
    return missingFields.isEmpty();
  }

  public boolean hasFormula() {
    return formulaReference != null;
  }

  /** Returns a copy whose references are this action's followed by {@code extra}. */
  public Action withAddedReferences(Collection<SourceReference> extra) {
    List<SourceReference> merged = new ArrayList<>(references);
    merged.addAll(extra);
    return new Action(
        id, who, what, when, context, merged, formulaReference, level, missingFields, order,
        timing, role);
  }

  public Action withFormula(String newWhat, FormulaReference formula) {
    return new Action(
        id, who, newWhat, when, context, references, formula, level, missingFields, order,
        timing, role);
  }

  public Action withContext(String newContext) {
    return new Action(
        id, who, what, when, newContext, references, formulaReference, level, missingFields,
        order, timing, role);
  }

  public Action withTiming(TimingAnnotation newTiming) {
    return new Action(
        id, who, what, when, context, references, formulaReference, level, missingFields, order,
        newTiming, role);
  }

  public Action withRole(RoleAssignment newRole) {
    return new Action(
        id, who, what, when, context, references, formulaReference, level, missingFields, order,
        timing, newRole);
  }

  /** Identifiers of every node this action was found in, in reference order. */
  public Set<String> sourceNodeIds() {
    Set<String> ids = new LinkedHashSet<>();
    references.forEach(r -> ids.add(r.nodeId()));
    return ids;
  }
}
