package com.flamingo.ai.checklist.domain.model;

import com.flamingo.ai.checklist.domain.enums.WarningType;

/**
 * A degraded but non-fatal outcome recorded during a run.
 *
 * @param type warning category
 * @param subjectId node id, action id or formula id the warning is about
 * @param message human-readable detail
 */
public record PipelineWarning(WarningType type, String subjectId, String message) {}
