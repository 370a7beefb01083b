package com.flamingo.ai.checklist.domain.model;

/**
 * Provenance of the formula an action absorbed. The equation text is always present verbatim
 * inside the owning action's {@code what}.
 */
public record FormulaReference(String formulaId, String equation, SourceReference reference) {}
