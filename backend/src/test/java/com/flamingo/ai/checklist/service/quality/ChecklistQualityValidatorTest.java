package com.flamingo.ai.checklist.service.quality;

import static com.flamingo.ai.checklist.TestFixtures.action;
import static com.flamingo.ai.checklist.TestFixtures.reference;
import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.checklist.TestFixtures;
import com.flamingo.ai.checklist.config.ChecklistProperties;
import com.flamingo.ai.checklist.domain.enums.ActionStatus;
import com.flamingo.ai.checklist.domain.enums.OperationalLevel;
import com.flamingo.ai.checklist.domain.enums.TriggerKind;
import com.flamingo.ai.checklist.domain.enums.WarningType;
import com.flamingo.ai.checklist.domain.model.Action;
import com.flamingo.ai.checklist.domain.model.DocumentMetadata;
import com.flamingo.ai.checklist.domain.model.FormulaReference;
import com.flamingo.ai.checklist.domain.model.PipelineWarning;
import com.flamingo.ai.checklist.service.format.ChecklistFormatter;
import com.flamingo.ai.checklist.service.format.model.ChecklistDocument;
import com.flamingo.ai.checklist.service.format.model.ChecklistRow;
import com.flamingo.ai.checklist.service.format.model.ChecklistSection;
import com.flamingo.ai.checklist.service.role.ConfiguredRoleTaxonomy;
import com.flamingo.ai.checklist.service.timing.TimingNormalizer;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ChecklistQualityValidator Tests")
class ChecklistQualityValidatorTest {

  private static final String EQUATION = "Staff = (Beds * Occupancy) / Ratio";

  private final ChecklistQualityValidator validator = new ChecklistQualityValidator();
  private final TimingNormalizer timingNormalizer = new TimingNormalizer();

  private ChecklistFormatter formatter;
  private List<Action> actions;

  @BeforeEach
  void setUp() {
    ChecklistProperties properties = TestFixtures.properties();
    formatter = new ChecklistFormatter(properties, new ConfiguredRoleTaxonomy(properties));
    Action staffing = action("a1", "n1", 0, 0, "ministry", "Compute staffing", "within 2 hours");
    actions =
        List.of(
            timed(staffing.withFormula(
                "Compute staffing. Calculate using formula: `" + EQUATION + "`",
                new FormulaReference("F1", EQUATION, reference("n1")))),
            timed(action("a2", "n1", 0, 1, "", "Call the blood bank", "upon code red")));
  }

  @Test
  @DisplayName("should report nothing for a checklist built from its actions")
  void shouldReturnNoIssues_whenChecklistMatchesActions() {
    ChecklistDocument document = formatter.format(actions, List.of(), DocumentMetadata.empty());

    assertThat(validator.validate(document, actions)).isEmpty();
  }

  @Test
  @DisplayName("should report a row count that differs from the included actions")
  void shouldReportMissingRow_whenActionNotRendered() {
    ChecklistDocument document =
        formatter.format(actions.subList(0, 1), List.of(), DocumentMetadata.empty());

    List<PipelineWarning> issues = validator.validate(document, actions);

    assertThat(issues).extracting(PipelineWarning::type).containsOnly(WarningType.QUALITY_CHECK);
    assertThat(issues).extracting(PipelineWarning::subjectId)
        .containsExactly(ChecklistQualityValidator.CHECKLIST_SUBJECT, "a2");
  }

  @Test
  @DisplayName("should report rows without a role and rows that lost their formula")
  void shouldReportRowDefects_whenRowsTampered() {
    ChecklistDocument formatted = formatter.format(actions, List.of(), DocumentMetadata.empty());
    ChecklistDocument tampered =
        new ChecklistDocument(
            formatted.specification(),
            List.of(new ChecklistSection(OperationalLevel.LOCAL, TriggerKind.RELATIVE_DEADLINE,
                List.of(
                    new ChecklistRow(1, "a1", "Compute staffing", "Ministry", "within 2 hours",
                        ActionStatus.PENDING, "Source: Section n1"),
                    new ChecklistRow(2, "a2", "Call the blood bank", " ", "upon code red",
                        ActionStatus.PENDING, "Source: Section n1")))),
            formatted.confirmation(),
            formatted.appendices());

    List<PipelineWarning> issues = validator.validate(tampered, actions);

    assertThat(issues).extracting(PipelineWarning::subjectId).containsExactly("a2", "a1");
    assertThat(issues.get(0).message()).contains("no responsible role");
    assertThat(issues.get(1).message()).contains("lost formula F1");
  }

  private Action timed(Action action) {
    return action.withTiming(timingNormalizer.normalize(action.when()));
  }
}
