package com.flamingo.ai.checklist.service.extraction;

import static com.flamingo.ai.checklist.TestFixtures.extracted;
import static com.flamingo.ai.checklist.TestFixtures.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.flamingo.ai.checklist.TestFixtures;
import com.flamingo.ai.checklist.agent.dto.ExtractedAction;
import com.flamingo.ai.checklist.agent.dto.ExtractedFormula;
import com.flamingo.ai.checklist.agent.dto.ExtractedTable;
import com.flamingo.ai.checklist.agent.dto.ExtractionResponse;
import com.flamingo.ai.checklist.domain.enums.ActionField;
import com.flamingo.ai.checklist.domain.enums.OperationalLevel;
import com.flamingo.ai.checklist.domain.enums.WarningType;
import com.flamingo.ai.checklist.domain.model.Action;
import com.flamingo.ai.checklist.domain.model.DocumentNode;
import com.flamingo.ai.checklist.exception.ExtractionFailureException;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ActionExtractor Tests")
class ActionExtractorTest {

  private static final String STAFFING = "Staff = (Census / Ratio) + 1";

  @Mock private ExtractionBackend extractionBackend;

  private ActionExtractor extractor;

  @BeforeEach
  void setUp() {
    extractor =
        new ActionExtractor(
            extractionBackend,
            new FormulaIntegrator(TestFixtures.properties()),
            new ActionIdGenerator());
  }

  @Test
  @DisplayName("should flag exactly the actions with an empty who, what or when")
  void shouldFlagExactlyIncompleteActions_whenFieldsAreBlank() {
    DocumentNode node = node("n1", null, "1. Triage", "Triage text");
    when(extractionBackend.extract(any()))
        .thenReturn(
            response(
                extracted("triage lead", "Open the triage area", "within 30 minutes"),
                extracted("   ", "Call the blood bank", "upon activation"),
                extracted("triage lead", "Record arrivals", " \t"),
                extracted("triage lead", "", "hourly"),
                extracted(null, null, null)));

    NodeExtractionResult result = extractor.extract(node, 0, OperationalLevel.LOCAL);

    assertThat(result.completeActions()).extracting(Action::what)
        .containsExactly("Open the triage area");
    assertThat(result.flaggedActions()).hasSize(4);
    assertThat(result.flaggedActions()).extracting(Action::missingFields)
        .containsExactly(
            Set.of(ActionField.WHO),
            Set.of(ActionField.WHEN),
            Set.of(ActionField.WHAT),
            Set.of(ActionField.WHO, ActionField.WHAT, ActionField.WHEN));
  }

  @Test
  @DisplayName("should fold a linked formula into the action description")
  void shouldIntegrateFormula_whenActionClaimsIt() {
    DocumentNode node =
        node("n1", null, "Staffing", "text", List.of(STAFFING), null);
    when(extractionBackend.extract(any()))
        .thenReturn(
            new ExtractionResponse(
                List.of(
                    extracted("head nurse", "Post the shift roster", "daily"),
                    extracted("head nurse", "Compute nurses needed per shift", "every shift", "F1")),
                List.of(new ExtractedFormula("F1", STAFFING, "(40 / 5) + 1", "9 nurses", "")),
                List.of()));

    NodeExtractionResult result = extractor.extract(node, 0, OperationalLevel.LOCAL);

    Action withFormula = result.completeActions().get(1);
    assertThat(withFormula.what())
        .isEqualTo(
            "Compute nurses needed per shift Calculate using formula: `" + STAFFING
                + "`. Example: `(40 / 5) + 1 = 9 nurses`.");
    assertThat(withFormula.formulaReference().formulaId()).isEqualTo("n1:F1");
    assertThat(result.completeActions().get(0).hasFormula()).isFalse();
    assertThat(result.formulasIntegrated()).isEqualTo(1);
  }

  @Test
  @DisplayName("should give an unclaimed formula to the only action of the node")
  void shouldAttachFormulaToSingleAction_whenUnclaimed() {
    DocumentNode node = node("n1", null, "Staffing", "text", List.of(STAFFING), null);
    when(extractionBackend.extract(any()))
        .thenReturn(response(extracted("head nurse", "Compute nurses needed", "every shift")));

    NodeExtractionResult result = extractor.extract(node, 0, OperationalLevel.LOCAL);

    Action action = result.completeActions().get(0);
    assertThat(action.what()).contains(STAFFING).contains("Example: `insert local values`");
    assertThat(result.warnings()).isEmpty();
  }

  @Test
  @DisplayName("should discard an unclaimed formula with a warning when several actions exist")
  void shouldDiscardFormula_whenUnclaimedAndAmbiguous() {
    DocumentNode node = node("n1", null, "Staffing", "text", List.of(STAFFING), null);
    when(extractionBackend.extract(any()))
        .thenReturn(
            response(
                extracted("head nurse", "Post the roster", "daily"),
                extracted("head nurse", "Call in reserve staff", "when census exceeds 40")));

    NodeExtractionResult result = extractor.extract(node, 0, OperationalLevel.LOCAL);

    assertThat(result.completeActions()).noneMatch(Action::hasFormula);
    assertThat(result.completeActions()).noneMatch(a -> a.what().contains(STAFFING));
    assertThat(result.formulasDiscarded()).isEqualTo(1);
    assertThat(result.warnings()).singleElement()
        .satisfies(w -> {
          assertThat(w.type()).isEqualTo(WarningType.UNRESOLVED_FORMULA);
          assertThat(w.subjectId()).isEqualTo("n1:F1");
        });
  }

  @Test
  @DisplayName("should produce the same ids when extracting identical input twice")
  void shouldProduceStableIds_whenExtractingTwice() {
    DocumentNode node = node("n1", null, "Triage", "text");
    when(extractionBackend.extract(any()))
        .thenReturn(response(extracted("triage lead", "Open the triage area", "immediately")));

    String first = extractor.extract(node, 0, OperationalLevel.LOCAL).completeActions().get(0).id();
    String second =
        extractor.extract(node, 0, OperationalLevel.LOCAL).completeActions().get(0).id();

    assertThat(first).isEqualTo(second).startsWith("act-");
  }

  @Test
  @DisplayName("should prefer the level reported for the action over the node level")
  void shouldOverrideLevel_whenActionReportsOne() {
    DocumentNode node = node("n1", null, "Coordination", "text");
    when(extractionBackend.extract(any()))
        .thenReturn(
            response(
                new ExtractedAction("ministry", "Declare the emergency", "upon code red", "",
                    null, "National", null, null),
                extracted("hospital", "Activate the plan", "upon code red")));

    NodeExtractionResult result = extractor.extract(node, 3, OperationalLevel.REGIONAL);

    assertThat(result.completeActions()).extracting(Action::level)
        .containsExactly(OperationalLevel.NATIONAL, OperationalLevel.REGIONAL);
    assertThat(result.completeActions().get(1).order().nodeIndex()).isEqualTo(3);
  }

  @Test
  @DisplayName("should keep the reported span when it fits the node text")
  void shouldUseReportedSpan_whenInsideText() {
    DocumentNode node = node("n1", null, "Triage", "0123456789");
    when(extractionBackend.extract(any()))
        .thenReturn(
            response(
                new ExtractedAction("triage lead", "Open area", "now", "", null, null, 2, 5),
                new ExtractedAction("triage lead", "Close area", "later", "", null, null, 4, 99)));

    NodeExtractionResult result = extractor.extract(node, 0, OperationalLevel.LOCAL);

    assertThat(result.completeActions().get(0).references().get(0).span().start()).isEqualTo(2);
    assertThat(result.completeActions().get(1).references().get(0).span().end()).isEqualTo(10);
  }

  @Test
  @DisplayName("should map tables with a stable id and the node reference")
  void shouldMapTables_whenBackendReportsThem() {
    DocumentNode node = node("n1", null, "Supplies", "text");
    when(extractionBackend.extract(any()))
        .thenReturn(
            new ExtractionResponse(
                List.of(),
                List.of(),
                List.of(new ExtractedTable("Stock levels", List.of("Item", "Days"),
                    List.of(List.of("Water", "3"), List.of("Fuel", "7"))))));

    NodeExtractionResult result = extractor.extract(node, 0, OperationalLevel.LOCAL);

    assertThat(result.tables()).singleElement()
        .satisfies(table -> {
          assertThat(table.id()).startsWith("tbl-");
          assertThat(table.rows()).hasSize(2);
          assertThat(table.reference().nodeId()).isEqualTo("n1");
        });
  }

  @Test
  @DisplayName("should treat a null action in the response as a failed call")
  void shouldThrow_whenResponseContainsNullAction() {
    DocumentNode node = node("n1", null, "Triage", "text");
    when(extractionBackend.extract(any()))
        .thenReturn(new ExtractionResponse(Arrays.asList((ExtractedAction) null), null, null));

    assertThatThrownBy(() -> extractor.extract(node, 0, OperationalLevel.LOCAL))
        .isInstanceOf(ExtractionFailureException.class)
        .hasMessageContaining("Malformed");
  }

  private static ExtractionResponse response(ExtractedAction... actions) {
    return new ExtractionResponse(List.of(actions), List.of(), List.of());
  }
}
