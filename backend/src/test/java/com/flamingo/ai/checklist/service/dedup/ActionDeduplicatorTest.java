package com.flamingo.ai.checklist.service.dedup;

import static com.flamingo.ai.checklist.TestFixtures.action;
import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.checklist.TestFixtures;
import com.flamingo.ai.checklist.config.ChecklistProperties;
import com.flamingo.ai.checklist.domain.enums.WarningType;
import com.flamingo.ai.checklist.domain.model.Action;
import com.flamingo.ai.checklist.domain.model.Formula;
import com.flamingo.ai.checklist.domain.model.SourceReference;
import com.flamingo.ai.checklist.service.extraction.FormulaIntegrator;
import com.flamingo.ai.checklist.service.timing.TimingNormalizer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ActionDeduplicator Tests")
class ActionDeduplicatorTest {

  private static final String WAREHOUSE =
      "Each hospital is obligated to create a secure warehouse for strategic reserve storage";

  private SimpleMeterRegistry meterRegistry;
  private FormulaIntegrator formulaIntegrator;
  private ActionDeduplicator deduplicator;

  @BeforeEach
  void setUp() {
    ChecklistProperties properties = TestFixtures.properties();
    meterRegistry = new SimpleMeterRegistry();
    formulaIntegrator = new FormulaIntegrator(properties);
    deduplicator = new ActionDeduplicator(properties, new TimingNormalizer(), meterRegistry);
  }

  @Test
  @DisplayName("should merge the same directive found in two sections and keep both sources")
  void shouldMergeDuplicates_whenFoundInTwoSections() {
    Action first = action("a1", "2.5", 4, 0, "hospital", WAREHOUSE, "ongoing");
    Action second = action("a2", "2.6", 5, 1, "hospital", WAREHOUSE, "ongoing");

    DeduplicationResult result = deduplicator.deduplicate(List.of(first, second), List.of());

    assertThat(result.completeActions()).singleElement()
        .satisfies(action -> {
          assertThat(action.id()).isEqualTo("a1");
          assertThat(action.references()).extracting(SourceReference::nodeId)
              .containsExactly("2.5", "2.6");
        });
    assertThat(result.mergesPerformed()).isEqualTo(1);
    assertThat(meterRegistry.counter("checklist.dedup.merges").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should keep similar actions apart and warn when the score is borderline")
  void shouldWarnAmbiguity_whenSimilarityBetweenThresholds() {
    Action daily = action("a1", "n1", 0, 0, "logistics officer",
        "Check fuel stock levels daily at the main depot", "ongoing");
    Action weekly = action("a2", "n2", 1, 0, "logistics officer",
        "Check fuel stock levels weekly at the main depot", "ongoing");

    DeduplicationResult result = deduplicator.deduplicate(List.of(daily, weekly), List.of());

    assertThat(deduplicator.similarity(daily, weekly)).isBetween(0.70, 0.85);
    assertThat(result.completeActions()).hasSize(2);
    assertThat(result.warnings()).singleElement()
        .satisfies(w -> {
          assertThat(w.type()).isEqualTo(WarningType.DEDUPLICATION_AMBIGUITY);
          assertThat(w.subjectId()).isEqualTo("a1,a2");
        });
  }

  @Test
  @DisplayName("should not merge identical directives whose timings contradict")
  void shouldKeepBoth_whenTimingsIncompatible() {
    Action relative = action("a1", "n1", 0, 0, "hospital", WAREHOUSE, "within 2 hours");
    Action absolute = action("a2", "n2", 1, 0, "hospital", WAREHOUSE, "by the end of October");

    DeduplicationResult result = deduplicator.deduplicate(List.of(relative, absolute), List.of());

    assertThat(deduplicator.compatibleWhen(relative, absolute)).isFalse();
    assertThat(result.completeActions()).hasSize(2);
    assertThat(result.mergesPerformed()).isZero();
  }

  @Test
  @DisplayName("should keep the complete action when it duplicates a flagged one")
  void shouldPreferCompleteAction_whenMergingWithFlagged() {
    Action flagged = action("a1", "n1", 0, 0, "triage officer", "Open the triage area", "");
    Action complete =
        action("a2", "n2", 1, 0, "triage officer", "Open the triage area", "within 30 minutes");

    DeduplicationResult result = deduplicator.deduplicate(List.of(complete), List.of(flagged));

    assertThat(result.flaggedActions()).isEmpty();
    assertThat(result.completeActions()).singleElement()
        .satisfies(action -> {
          assertThat(action.id()).isEqualTo("a2");
          assertThat(action.references()).extracting(SourceReference::nodeId)
              .containsExactly("n2", "n1");
        });
  }

  @Test
  @DisplayName("should carry the formula of an absorbed action over to the survivor")
  void shouldCarryFormula_whenAbsorbedActionOwnsIt() {
    Formula formula =
        new Formula("n2:F1", "W = P * 3", "", null, TestFixtures.reference("n2"));
    Action plain = action("a1", "n1", 0, 0, "logistics officer", "Estimate the water reserve",
        "within 2 hours");
    Action withFormula =
        action("a2", "n2", 1, 0, "logistics officer", "Estimate the water reserve", "")
            .withFormula(
                formulaIntegrator.appendFormula("Estimate the water reserve", formula),
                formula.toReference());

    DeduplicationResult result = deduplicator.deduplicate(List.of(plain), List.of(withFormula));

    assertThat(result.completeActions()).singleElement()
        .satisfies(action -> {
          assertThat(action.id()).isEqualTo("a1");
          assertThat(action.formulaReference().formulaId()).isEqualTo("n2:F1");
          assertThat(action.what())
              .isEqualTo("Estimate the water reserve Calculate using formula: `W = P * 3`. "
                  + "Example: `insert local values`.");
        });
  }

  @Test
  @DisplayName("should warn when a merge drops one of two different formulas")
  void shouldWarnFormulaDropped_whenBothActionsOwnFormulas() {
    Formula left = new Formula("n1:F1", "W = P * 3", "", null, TestFixtures.reference("n1"));
    Formula right = new Formula("n2:F1", "W = P * 4", "", null, TestFixtures.reference("n2"));
    Action first = withFormula(
        action("a1", "n1", 0, 0, "logistics officer", "Estimate the water reserve", "daily"),
        left);
    Action second = withFormula(
        action("a2", "n2", 1, 0, "logistics officer", "Estimate the water reserve", "daily"),
        right);

    DeduplicationResult result = deduplicator.deduplicate(List.of(first, second), List.of());

    assertThat(result.completeActions()).singleElement()
        .satisfies(a -> assertThat(a.formulaReference().formulaId()).isEqualTo("n1:F1"));
    assertThat(result.warnings()).singleElement()
        .satisfies(w -> {
          assertThat(w.type()).isEqualTo(WarningType.UNRESOLVED_FORMULA);
          assertThat(w.subjectId()).isEqualTo("n2:F1");
        });
  }

  @Test
  @DisplayName("should leave no pair above the threshold and ignore input order")
  void shouldConvergeDeterministically_whenInputShuffled() {
    List<Action> actions = new ArrayList<>(List.of(
        action("a1", "n1", 0, 0, "hospital", WAREHOUSE, "ongoing"),
        action("a2", "n1", 0, 1, "triage officer", "Open the triage area", "upon code red"),
        action("a3", "n2", 1, 0, "hospital", WAREHOUSE, "ongoing"),
        action("a4", "n2", 1, 1, "triage officer", "Open the triage area", "upon code red"),
        action("a5", "n3", 2, 0, "hospital", WAREHOUSE + ".", "ongoing"),
        action("a6", "n3", 2, 1, "logistics officer", "Order fuel", "within 2 days")));

    DeduplicationResult ordered = deduplicator.deduplicate(actions, List.of());
    Collections.shuffle(actions, new Random(42));
    DeduplicationResult shuffled = deduplicator.deduplicate(actions, List.of());

    assertThat(ordered.completeActions()).extracting(Action::id)
        .containsExactly("a1", "a2", "a6");
    assertThat(shuffled.completeActions()).isEqualTo(ordered.completeActions());
    List<Action> canonical = ordered.completeActions();
    for (int i = 0; i < canonical.size(); i++) {
      for (int j = i + 1; j < canonical.size(); j++) {
        assertThat(deduplicator.similarity(canonical.get(i), canonical.get(j))).isLessThan(0.85);
      }
    }
  }

  private Action withFormula(Action action, Formula formula) {
    return action.withFormula(
        formulaIntegrator.appendFormula(action.what(), formula), formula.toReference());
  }
}
