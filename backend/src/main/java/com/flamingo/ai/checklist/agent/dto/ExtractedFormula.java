package com.flamingo.ai.checklist.agent.dto;

/** A formula found in the node, with a worked example when the model could compute one. */
public record ExtractedFormula(
    String ref, // matches the F<n> label given in the prompt, or a new label
    String formula,
    String computationExample,
    String sampleResult,
    String formulaContext) {}
