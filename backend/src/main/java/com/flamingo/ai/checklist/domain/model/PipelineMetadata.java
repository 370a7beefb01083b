package com.flamingo.ai.checklist.domain.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Counters and warnings accumulated across stages. Every mutator returns a new instance.
 *
 * @param counters named counters, see the {@code *_KEY} constants
 * @param warnings non-fatal outcomes in the order they were recorded
 * @param failedNodeIds nodes whose extraction failed after all retries
 */
public record PipelineMetadata(
    Map<String, Integer> counters, List<PipelineWarning> warnings, List<String> failedNodeIds) {

  public static final String ACTIONS_WITH_FORMULAS = "actions_with_formulas";
  public static final String FLAGGED_COUNT = "flagged_count";
  public static final String NODES_FAILED = "nodes_failed";
  public static final String NODES_PROCESSED = "nodes_processed";
  public static final String NODES_SKIPPED = "nodes_skipped";
  public static final String UNRESOLVED_ROLES = "unresolved_roles";
  public static final String FORMULAS_INTEGRATED = "formulas_integrated";
  public static final String FORMULAS_DISCARDED = "formulas_discarded";
  public static final String MERGES_PERFORMED = "merges_performed";
  public static final String TABLES_COUNT = "tables_count";
  public static final String INCLUDED_COUNT = "included_count";
  public static final String EXCLUDED_COUNT = "excluded_count";
  public static final String QUALITY_ISSUES = "quality_issues";

  public PipelineMetadata {
    counters = Map.copyOf(counters);
    warnings = List.copyOf(warnings);
    failedNodeIds = List.copyOf(failedNodeIds);
  }

  public static PipelineMetadata empty() {
    return new PipelineMetadata(Map.of(), List.of(), List.of());
  }

  public int get(String key) {
    return counters.getOrDefault(key, 0);
  }

  public PipelineMetadata increment(String key, int delta) {
    Map<String, Integer> updated = new TreeMap<>(counters);
    updated.merge(key, delta, Integer::sum);
    return new PipelineMetadata(updated, warnings, failedNodeIds);
  }

  public PipelineMetadata set(String key, int value) {
    Map<String, Integer> updated = new TreeMap<>(counters);
    updated.put(key, value);
    return new PipelineMetadata(updated, warnings, failedNodeIds);
  }

  public PipelineMetadata withWarnings(Collection<PipelineWarning> extra) {
    List<PipelineWarning> updated = new ArrayList<>(warnings);
    updated.addAll(extra);
    return new PipelineMetadata(counters, updated, failedNodeIds);
  }

  public PipelineMetadata withFailedNode(String nodeId) {
    List<String> updated = new ArrayList<>(failedNodeIds);
    updated.add(nodeId);
    return new PipelineMetadata(counters, warnings, updated).increment(NODES_FAILED, 1);
  }

  /** Counters as a sorted map, for stable serialization. */
  public Map<String, Integer> sortedCounters() {
    return new TreeMap<>(counters);
  }
}
