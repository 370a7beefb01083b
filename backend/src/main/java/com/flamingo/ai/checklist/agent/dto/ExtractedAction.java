package com.flamingo.ai.checklist.agent.dto;

/** One candidate action as returned by the model. */
public record ExtractedAction(
    String who,
    String what,
    String when,
    String context,
    String formulaRef, // "F1", "F2", ... or null
    String operationalLevel, // "national", "regional", "local" or null
    Integer spanStart,
    Integer spanEnd) {}
