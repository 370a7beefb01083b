package com.flamingo.ai.checklist.domain.model;

/**
 * A calculation found in a subject. Formulas never reach the output on their own: each one is
 * either integrated into exactly one action or discarded.
 *
 * @param id formula identifier, {@code <nodeId>:F<n>}
 * @param equation raw equation text as written in the source
 * @param description what the formula calculates, may be empty
 * @param example worked example supplied by the backend, may be {@code null}
 * @param reference where the formula was found
 */
public record Formula(
    String id, String equation, String description, String example, SourceReference reference) {

  public FormulaReference toReference() {
    return new FormulaReference(id, equation, reference);
  }
}
