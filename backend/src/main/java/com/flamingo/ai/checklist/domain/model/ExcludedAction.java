package com.flamingo.ai.checklist.domain.model;

import com.flamingo.ai.checklist.domain.enums.ExclusionReason;

/** An action the selector kept out of the rendered checklist, with the reason. */
public record ExcludedAction(Action action, ExclusionReason reason) {}
