package com.flamingo.ai.checklist.agent.dto;

import java.util.List;

/** A table or checklist found in the node. */
public record ExtractedTable(String title, List<String> headers, List<List<String>> rows) {}
