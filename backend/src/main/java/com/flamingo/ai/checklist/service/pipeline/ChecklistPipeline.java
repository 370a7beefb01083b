package com.flamingo.ai.checklist.service.pipeline;

import com.flamingo.ai.checklist.config.ChecklistProperties;
import com.flamingo.ai.checklist.domain.enums.OperationalLevel;
import com.flamingo.ai.checklist.domain.enums.PipelineStage;
import com.flamingo.ai.checklist.domain.enums.WarningType;
import com.flamingo.ai.checklist.domain.model.Action;
import com.flamingo.ai.checklist.domain.model.DocumentMetadata;
import com.flamingo.ai.checklist.domain.model.DocumentNode;
import com.flamingo.ai.checklist.domain.model.PipelineMetadata;
import com.flamingo.ai.checklist.domain.model.PipelineState;
import com.flamingo.ai.checklist.domain.model.PipelineWarning;
import com.flamingo.ai.checklist.domain.model.SelectionPolicy;
import com.flamingo.ai.checklist.domain.model.Table;
import com.flamingo.ai.checklist.exception.ExtractionFailureException;
import com.flamingo.ai.checklist.exception.MalformedTreeException;
import com.flamingo.ai.checklist.exception.PipelineConfigurationException;
import com.flamingo.ai.checklist.service.dedup.ActionDeduplicator;
import com.flamingo.ai.checklist.service.dedup.DeduplicationResult;
import com.flamingo.ai.checklist.service.extraction.ActionExtractor;
import com.flamingo.ai.checklist.service.extraction.ExtractionRetryPolicy;
import com.flamingo.ai.checklist.service.extraction.NodeExtractionResult;
import com.flamingo.ai.checklist.service.format.ChecklistFormatter;
import com.flamingo.ai.checklist.service.format.ChecklistMarkdownRenderer;
import com.flamingo.ai.checklist.service.format.model.ChecklistDocument;
import com.flamingo.ai.checklist.service.quality.ChecklistQualityValidator;
import com.flamingo.ai.checklist.service.role.RoleAssigner;
import com.flamingo.ai.checklist.service.selection.ActionSelector;
import com.flamingo.ai.checklist.service.selection.SelectionResult;
import com.flamingo.ai.checklist.service.timing.TimingNormalizer;
import com.flamingo.ai.checklist.service.tree.DocumentTreeTraverser;
import com.flamingo.ai.checklist.service.tree.TraversalEntry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs the checklist pipeline as a state machine:
 * INGESTED, EXTRACTED, DEDUPLICATED, SELECTED, NORMALIZED, FORMATTED, DONE. The checklist is
 * quality-checked on the way from FORMATTED to DONE.
 *
 * <p>Every stage takes the previous {@link PipelineState} and returns a new one. Node extraction
 * fans out over the extraction executor and joins before deduplication; a node that keeps failing
 * contributes nothing and the run goes on. Only an empty tree, a malformed tree or a bad
 * configuration ends the run in FAILED.
 */
@Service
@Slf4j
public class ChecklistPipeline {

  private final ChecklistProperties properties;
  private final DocumentTreeTraverser treeTraverser;
  private final ActionExtractor actionExtractor;
  private final ExtractionRetryPolicy retryPolicy;
  private final ActionDeduplicator deduplicator;
  private final ActionSelector selector;
  private final TimingNormalizer timingNormalizer;
  private final RoleAssigner roleAssigner;
  private final ChecklistFormatter formatter;
  private final ChecklistMarkdownRenderer markdownRenderer;
  private final ChecklistQualityValidator qualityValidator;
  private final Executor extractionExecutor;
  private final MeterRegistry meterRegistry;

  public ChecklistPipeline(
      ChecklistProperties properties,
      DocumentTreeTraverser treeTraverser,
      ActionExtractor actionExtractor,
      ExtractionRetryPolicy retryPolicy,
      ActionDeduplicator deduplicator,
      ActionSelector selector,
      TimingNormalizer timingNormalizer,
      RoleAssigner roleAssigner,
      ChecklistFormatter formatter,
      ChecklistMarkdownRenderer markdownRenderer,
      ChecklistQualityValidator qualityValidator,
      @Qualifier("extractionExecutor") Executor extractionExecutor,
      MeterRegistry meterRegistry) {
    this.properties = properties;
    this.treeTraverser = treeTraverser;
    this.actionExtractor = actionExtractor;
    this.retryPolicy = retryPolicy;
    this.deduplicator = deduplicator;
    this.selector = selector;
    this.timingNormalizer = timingNormalizer;
    this.roleAssigner = roleAssigner;
    this.formatter = formatter;
    this.markdownRenderer = markdownRenderer;
    this.qualityValidator = qualityValidator;
    this.extractionExecutor = extractionExecutor;
    this.meterRegistry = meterRegistry;
  }

  /** Runs the pipeline without cancellation. */
  @Timed(value = "checklist.pipeline.run", description = "Time to run the checklist pipeline")
  public PipelineResult run(DocumentNode root, DocumentMetadata metadata, SelectionPolicy policy) {
    return run(root, metadata, policy, new PipelineCancellation());
  }

  /**
   * Runs the pipeline.
   *
   * @param root root of the document tree
   * @param metadata document-level values for the specification block, may be {@code null}
   * @param policy selection policy, {@code null} for the configured default
   * @param cancellation cooperative cancellation signal
   * @return the terminal result, never {@code null}
   */
  @Timed(value = "checklist.pipeline.run", description = "Time to run the checklist pipeline")
  public PipelineResult run(
      DocumentNode root,
      DocumentMetadata metadata,
      SelectionPolicy policy,
      PipelineCancellation cancellation) {
    PipelineState state = PipelineState.ingested();

    try {
      properties.validate();
    } catch (PipelineConfigurationException e) {
      return finish(state.failed("Configuration error: " + e.getMessage()));
    }
    if (root == null) {
      return finish(state.failed("Document tree is empty"));
    }

    List<TraversalEntry> entries;
    try {
      entries = treeTraverser.traverse(root);
    } catch (MalformedTreeException e) {
      return finish(state.failed("Malformed document tree: " + e.getMessage()));
    }
    if (entries.stream().allMatch(entry -> entry.node().isContentEmpty())) {
      return finish(state.failed("Document tree has no content"));
    }

    SelectionPolicy basePolicy = policy != null ? policy : properties.getSelection().toPolicy();
    SelectionPolicy effectivePolicy =
        basePolicy.withExcludeSubjects(
            treeTraverser.withDescendants(entries, basePolicy.excludeSubjects()));
    log.info(
        "Starting checklist pipeline: {} nodes, policy {}", entries.size(), effectivePolicy);

    while (!state.stage().isTerminal()) {
      PipelineStage current = state.stage();
      PipelineState next =
          switch (current) {
            case INGESTED -> extract(state, entries, cancellation);
            case EXTRACTED -> deduplicate(state);
            case DEDUPLICATED -> select(state, effectivePolicy);
            case SELECTED -> normalize(state);
            case NORMALIZED -> format(state, metadata);
            case FORMATTED -> verify(state);
            case DONE, FAILED -> throw new IllegalStateException("Terminal stage " + current);
          };
      if (!current.canTransitionTo(next.stage())) {
        throw new IllegalStateException(
            "Illegal pipeline transition " + current + " -> " + next.stage());
      }
      log.debug("Pipeline stage {} -> {}", current, next.stage());
      state = next;
    }
    return finish(state);
  }

  private PipelineState extract(
      PipelineState state, List<TraversalEntry> entries, PipelineCancellation cancellation) {
    OperationalLevel defaultLevel = properties.getFormat().getDefaultOperationalLevel();

    List<CompletableFuture<NodeOutcome>> futures = new ArrayList<>();
    for (TraversalEntry entry : entries) {
      if (entry.node().isContentEmpty()) {
        continue;
      }
      OperationalLevel level = entry.level() != null ? entry.level() : defaultLevel;
      futures.add(submit(entry, level, cancellation));
    }
    CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

    List<Action> complete = new ArrayList<>();
    List<Action> flagged = new ArrayList<>();
    List<Table> tables = new ArrayList<>();
    PipelineMetadata metadata = state.metadata();
    for (CompletableFuture<NodeOutcome> future : futures) {
      NodeOutcome outcome = future.join();
      if (outcome.skipped()) {
        metadata = metadata.increment(PipelineMetadata.NODES_SKIPPED, 1);
      } else if (outcome.result() == null) {
        metadata =
            metadata
                .withFailedNode(outcome.nodeId())
                .withWarnings(
                    List.of(
                        new PipelineWarning(
                            WarningType.EXTRACTION_FAILURE, outcome.nodeId(), outcome.error())));
      } else {
        NodeExtractionResult result = outcome.result();
        complete.addAll(result.completeActions());
        flagged.addAll(result.flaggedActions());
        tables.addAll(result.tables());
        metadata =
            metadata
                .increment(PipelineMetadata.NODES_PROCESSED, 1)
                .increment(PipelineMetadata.FORMULAS_INTEGRATED, result.formulasIntegrated())
                .increment(PipelineMetadata.FORMULAS_DISCARDED, result.formulasDiscarded())
                .withWarnings(result.warnings());
      }
    }
    metadata = metadata.set(PipelineMetadata.TABLES_COUNT, tables.size());

    log.info(
        "Extraction finished: {} complete, {} flagged, {} tables, {} nodes failed, {} skipped",
        complete.size(),
        flagged.size(),
        tables.size(),
        metadata.get(PipelineMetadata.NODES_FAILED),
        metadata.get(PipelineMetadata.NODES_SKIPPED));

    return state
        .withActions(PipelineStage.EXTRACTED, complete, flagged, metadata)
        .withTables(tables);
  }

  private CompletableFuture<NodeOutcome> submit(
      TraversalEntry entry, OperationalLevel level, PipelineCancellation cancellation) {
    try {
      return CompletableFuture.supplyAsync(
          () -> extractNode(entry, level, cancellation), extractionExecutor);
    } catch (RejectedExecutionException e) {
      String nodeId = entry.node().id();
      meterRegistry.counter("checklist.extraction.node.failed").increment();
      log.warn("Node {} was not dispatched: {}", nodeId, e.getMessage());
      return CompletableFuture.completedFuture(
          new NodeOutcome(nodeId, null, "Extraction not dispatched: " + e.getMessage(), false));
    }
  }

  private NodeOutcome extractNode(
      TraversalEntry entry, OperationalLevel level, PipelineCancellation cancellation) {
    String nodeId = entry.node().id();
    if (cancellation.isCancelled()) {
      log.info("Skipping node {}: run cancelled", nodeId);
      return new NodeOutcome(nodeId, null, null, true);
    }
    try {
      NodeExtractionResult result =
          retryPolicy.execute(
              nodeId, () -> actionExtractor.extract(entry.node(), entry.index(), level));
      meterRegistry.counter("checklist.extraction.node.success").increment();
      return new NodeOutcome(nodeId, result, null, false);
    } catch (ExtractionFailureException e) {
      meterRegistry.counter("checklist.extraction.node.failed").increment();
      log.warn(
          "Node {} contributed no actions after {} attempts: {}",
          nodeId,
          retryPolicy.maxAttempts(),
          e.getMessage());
      return new NodeOutcome(nodeId, null, e.getMessage(), false);
    }
  }

  private PipelineState deduplicate(PipelineState state) {
    DeduplicationResult result =
        deduplicator.deduplicate(state.completeActions(), state.flaggedActions());
    List<Action> canonical = new ArrayList<>(result.completeActions());
    canonical.addAll(result.flaggedActions());
    PipelineMetadata metadata =
        state
            .metadata()
            .set(PipelineMetadata.MERGES_PERFORMED, result.mergesPerformed())
            .set(PipelineMetadata.FLAGGED_COUNT, result.flaggedActions().size())
            .set(
                PipelineMetadata.ACTIONS_WITH_FORMULAS,
                (int) canonical.stream().filter(Action::hasFormula).count())
            .withWarnings(result.warnings());
    return state.withActions(
        PipelineStage.DEDUPLICATED, result.completeActions(), result.flaggedActions(), metadata);
  }

  private PipelineState select(PipelineState state, SelectionPolicy policy) {
    SelectionResult result =
        selector.select(state.completeActions(), state.flaggedActions(), policy);
    PipelineMetadata metadata =
        state
            .metadata()
            .set(PipelineMetadata.INCLUDED_COUNT, result.included().size())
            .set(PipelineMetadata.EXCLUDED_COUNT, result.excluded().size());
    return state.withSelection(
        PipelineStage.SELECTED, result.included(), result.excluded(), metadata);
  }

  private PipelineState normalize(PipelineState state) {
    List<Action> timed =
        state.includedActions().stream()
            .map(action -> action.withTiming(timingNormalizer.normalize(action.when())))
            .toList();
    RoleAssigner.RoleAssignmentResult roles = roleAssigner.assignAll(timed);
    PipelineMetadata metadata =
        state
            .metadata()
            .set(PipelineMetadata.UNRESOLVED_ROLES, roles.unresolved())
            .withWarnings(roles.warnings());
    return state.withSelection(
        PipelineStage.NORMALIZED, roles.actions(), state.excludedActions(), metadata);
  }

  private PipelineState format(PipelineState state, DocumentMetadata metadata) {
    ChecklistDocument document =
        formatter.format(state.includedActions(), state.tables(), metadata);
    return state.withChecklist(PipelineStage.FORMATTED, document, state.metadata());
  }

  private PipelineState verify(PipelineState state) {
    List<PipelineWarning> issues =
        qualityValidator.validate(state.checklist(), state.includedActions());
    PipelineMetadata metadata =
        state.metadata().set(PipelineMetadata.QUALITY_ISSUES, issues.size()).withWarnings(issues);
    return state.withChecklist(PipelineStage.DONE, state.checklist(), metadata);
  }

  private PipelineResult finish(PipelineState state) {
    boolean done = state.stage() == PipelineStage.DONE;
    meterRegistry
        .counter("checklist.pipeline.runs", "outcome", done ? "done" : "failed")
        .increment();
    if (!done) {
      log.error("Checklist pipeline failed: {}", state.failureReason());
      return new PipelineResult(
          state.stage(), null, null, MetadataReport.from(state), state.failureReason(), state);
    }
    log.info(
        "Checklist pipeline done: {} rows, {} flagged, {} nodes failed, {} unresolved roles",
        state.checklist().rowCount(),
        state.metadata().get(PipelineMetadata.FLAGGED_COUNT),
        state.metadata().get(PipelineMetadata.NODES_FAILED),
        state.metadata().get(PipelineMetadata.UNRESOLVED_ROLES));
    return new PipelineResult(
        state.stage(),
        state.checklist(),
        markdownRenderer.render(state.checklist()),
        MetadataReport.from(state),
        null,
        state);
  }

  private record NodeOutcome(
      String nodeId, NodeExtractionResult result, String error, boolean skipped) {}
}
