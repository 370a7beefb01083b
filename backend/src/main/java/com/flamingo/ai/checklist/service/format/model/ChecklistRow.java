package com.flamingo.ai.checklist.service.format.model;

import com.flamingo.ai.checklist.domain.enums.ActionStatus;

/**
 * One checklist line.
 *
 * @param number 1-based position across the whole checklist
 * @param actionId canonical action id
 * @param action directive text, formula suffix included
 * @param responsibleRole canonical role name or a "needs assignment" marker
 * @param timing the original "when" text
 * @param status execution status, {@link ActionStatus#PENDING} when rendered
 * @param remarks formula provenance, appendix pointers and source references
 */
public record ChecklistRow(
    int number,
    String actionId,
    String action,
    String responsibleRole,
    String timing,
    ActionStatus status,
    String remarks) {}
