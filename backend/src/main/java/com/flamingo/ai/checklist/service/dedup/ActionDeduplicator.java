package com.flamingo.ai.checklist.service.dedup;

import com.flamingo.ai.checklist.config.ChecklistProperties;
import com.flamingo.ai.checklist.domain.enums.WarningType;
import com.flamingo.ai.checklist.domain.model.Action;
import com.flamingo.ai.checklist.domain.model.PipelineWarning;
import com.flamingo.ai.checklist.domain.model.TimingAnnotation;
import com.flamingo.ai.checklist.service.extraction.FormulaIntegrator;
import com.flamingo.ai.checklist.service.timing.TimingNormalizer;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Merges near-duplicate actions found in different subjects into one canonical action.
 *
 * <p>Two actions merge when the token-Jaccard similarity of their {@code who + what} reaches
 * {@code checklist.deduplication.similarity-threshold} and their "when" values do not contradict.
 * Actions are visited in extraction order and passes repeat until nothing merges, so the output
 * holds no pair above the threshold.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActionDeduplicator {

  private static final Comparator<Action> EXTRACTION_ORDER =
      Comparator.comparing(Action::order).thenComparing(Action::id);

  private final ChecklistProperties properties;
  private final TimingNormalizer timingNormalizer;
  private final MeterRegistry meterRegistry;

  public DeduplicationResult deduplicate(List<Action> complete, List<Action> flagged) {
    double threshold = properties.getDeduplication().getSimilarityThreshold();
    double ambiguity = properties.getDeduplication().getAmbiguityThreshold();

    List<Action> pool = new ArrayList<>(complete.size() + flagged.size());
    pool.addAll(complete);
    pool.addAll(flagged);
    pool.sort(EXTRACTION_ORDER);

    List<PipelineWarning> warnings = new ArrayList<>();
    int merges = 0;
    List<Action> canonical = pool;
    while (true) {
      MergePass pass = mergePass(canonical, threshold, warnings);
      merges += pass.merges();
      canonical = pass.actions();
      if (pass.merges() == 0) {
        break;
      }
    }

    warnings.addAll(borderlinePairs(canonical, ambiguity, threshold));

    List<Action> canonicalComplete =
        canonical.stream().filter(Action::isComplete).sorted(EXTRACTION_ORDER).toList();
    List<Action> canonicalFlagged =
        canonical.stream().filter(a -> !a.isComplete()).sorted(EXTRACTION_ORDER).toList();

    if (merges > 0) {
      meterRegistry.counter("checklist.dedup.merges").increment(merges);
    }
    log.info(
        "Deduplicated {} actions into {} ({} complete, {} flagged, {} merges)",
        pool.size(),
        canonical.size(),
        canonicalComplete.size(),
        canonicalFlagged.size(),
        merges);

    return new DeduplicationResult(canonicalComplete, canonicalFlagged, merges, warnings);
  }

  /** Similarity of two actions over their responsible party and directive. */
  public double similarity(Action left, Action right) {
    return TokenSimilarity.jaccard(comparableText(left), comparableText(right));
  }

  /**
   * "When" values are compatible if either is blank, they are the same text, or they normalize to
   * the same trigger kind and one refines the other.
   */
  public boolean compatibleWhen(Action left, Action right) {
    String a = TokenSimilarity.normalize(left.when());
    String b = TokenSimilarity.normalize(right.when());
    if (a.isEmpty() || b.isEmpty() || a.equals(b)) {
      return true;
    }
    TimingAnnotation ta = timingNormalizer.normalize(left.when());
    TimingAnnotation tb = timingNormalizer.normalize(right.when());
    if (ta.kind() != tb.kind()) {
      return false;
    }
    return ta.value().equalsIgnoreCase(tb.value()) || a.contains(b) || b.contains(a);
  }

  private MergePass mergePass(List<Action> actions, double threshold,
      List<PipelineWarning> warnings) {
    List<Action> canonical = new ArrayList<>();
    int merges = 0;
    for (Action candidate : actions) {
      int bestIndex = -1;
      double bestScore = -1.0;
      for (int i = 0; i < canonical.size(); i++) {
        Action existing = canonical.get(i);
        if (!compatibleWhen(existing, candidate)) {
          continue;
        }
        double score = similarity(existing, candidate);
        if (score >= threshold && score > bestScore) {
          bestScore = score;
          bestIndex = i;
        }
      }
      if (bestIndex < 0) {
        canonical.add(candidate);
      } else {
        Action existing = canonical.get(bestIndex);
        log.debug(
            "Merging {} into {} (similarity {})",
            candidate.id(),
            existing.id(),
            String.format("%.2f", bestScore));
        canonical.set(bestIndex, merge(existing, candidate, warnings));
        merges++;
      }
    }
    return new MergePass(canonical, merges);
  }

  /**
   * Merges two duplicates. The survivor keeps its id; references are unioned and a formula is
   * never lost when only one side has it.
   */
  Action merge(Action first, Action second, List<PipelineWarning> warnings) {
    Action survivor = preferred(first, second) ? first : second;
    Action absorbed = survivor == first ? second : first;

    Action merged = survivor.withAddedReferences(absorbed.references());
    if (!merged.hasFormula() && absorbed.hasFormula()) {
      String suffix = formulaSuffix(absorbed.what());
      String base = merged.what().strip();
      String what = base.isEmpty() ? suffix : base + " " + suffix;
      merged = merged.withFormula(what, absorbed.formulaReference());
    } else if (merged.hasFormula() && absorbed.hasFormula()
        && !merged.formulaReference().formulaId().equals(absorbed.formulaReference().formulaId())) {
      log.warn(
          "Formula {} dropped while merging {} into {}",
          absorbed.formulaReference().formulaId(),
          absorbed.id(),
          merged.id());
      warnings.add(
          new PipelineWarning(
              WarningType.UNRESOLVED_FORMULA,
              absorbed.formulaReference().formulaId(),
              "Formula dropped: action " + absorbed.id() + " merged into " + merged.id()
                  + ", which already carries formula "
                  + merged.formulaReference().formulaId()));
    }
    if (merged.context().isBlank() && !absorbed.context().isBlank()) {
      merged = merged.withContext(absorbed.context());
    }
    return merged;
  }

  /** Returns {@code true} if {@code a} should survive a merge with {@code b}. */
  private boolean preferred(Action a, Action b) {
    if (a.isComplete() != b.isComplete()) {
      return a.isComplete();
    }
    if (a.hasFormula() != b.hasFormula()) {
      return a.hasFormula();
    }
    if (a.context().length() != b.context().length()) {
      return a.context().length() > b.context().length();
    }
    if (a.references().size() != b.references().size()) {
      return a.references().size() > b.references().size();
    }
    return EXTRACTION_ORDER.compare(a, b) <= 0;
  }

  private List<PipelineWarning> borderlinePairs(
      List<Action> actions, double ambiguity, double threshold) {
    List<PipelineWarning> warnings = new ArrayList<>();
    for (int i = 0; i < actions.size(); i++) {
      for (int j = i + 1; j < actions.size(); j++) {
        Action left = actions.get(i);
        Action right = actions.get(j);
        if (!compatibleWhen(left, right)) {
          continue;
        }
        double score = similarity(left, right);
        if (score >= ambiguity && score < threshold) {
          log.warn(
              "Borderline duplicates kept separate: {} and {} (similarity {})",
              left.id(),
              right.id(),
              String.format("%.2f", score));
          warnings.add(
              new PipelineWarning(
                  WarningType.DEDUPLICATION_AMBIGUITY,
                  left.id() + "," + right.id(),
                  String.format(
                      "Actions %s and %s are similar (%.2f) but below the merge threshold %.2f",
                      left.id(), right.id(), score, threshold)));
        }
      }
    }
    return warnings;
  }

  private static Set<String> comparableText(Action action) {
    return TokenSimilarity.tokens(
        action.who() + " " + FormulaIntegrator.baseDescription(action.what()));
  }

  private static String formulaSuffix(String what) {
    int index = what.indexOf(FormulaIntegrator.FORMULA_MARKER);
    return index < 0 ? what : what.substring(index);
  }

  private record MergePass(List<Action> actions, int merges) {}
}
