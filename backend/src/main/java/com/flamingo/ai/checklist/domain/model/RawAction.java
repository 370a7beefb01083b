package com.flamingo.ai.checklist.domain.model;

import com.flamingo.ai.checklist.domain.enums.OperationalLevel;

/**
 * Candidate action as returned by the extraction backend for one node, before validation.
 *
 * @param who responsible party, free text
 * @param what directive, free text
 * @param when timing or trigger, free text
 * @param context surrounding text the backend used to justify the action
 * @param reference node and span the action came from
 * @param formulaRef local formula reference ({@code F1}, {@code F2}, ...) or {@code null}
 * @param level level override supplied by the backend, or {@code null}
 * @param order position in the extraction sequence
 */
public record RawAction(
    String who,
    String what,
    String when,
    String context,
    SourceReference reference,
    String formulaRef,
    OperationalLevel level,
    ExtractionOrder order) {}
