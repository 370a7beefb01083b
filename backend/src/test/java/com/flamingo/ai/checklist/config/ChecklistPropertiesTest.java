package com.flamingo.ai.checklist.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.checklist.TestFixtures;
import com.flamingo.ai.checklist.domain.enums.OperationalLevel;
import com.flamingo.ai.checklist.domain.model.SelectionPolicy;
import com.flamingo.ai.checklist.exception.PipelineConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ChecklistProperties Tests")
class ChecklistPropertiesTest {

  @Test
  @DisplayName("should accept the defaults")
  void shouldPassValidation_whenUsingDefaults() {
    assertThatCode(() -> new ChecklistProperties().validate()).doesNotThrowAnyException();
  }

  @Test
  @DisplayName("should name the key when the similarity threshold is out of range")
  void shouldThrow_whenSimilarityThresholdAboveOne() {
    ChecklistProperties properties = new ChecklistProperties();
    properties.getDeduplication().setSimilarityThreshold(1.5);

    assertThatThrownBy(properties::validate)
        .isInstanceOf(PipelineConfigurationException.class)
        .hasMessageContaining("checklist.deduplication.similarity-threshold");
  }

  @Test
  @DisplayName("should reject an ambiguity threshold above the merge threshold")
  void shouldThrow_whenAmbiguityAboveSimilarity() {
    ChecklistProperties properties = new ChecklistProperties();
    properties.getDeduplication().setAmbiguityThreshold(0.9);

    assertThatThrownBy(properties::validate)
        .isInstanceOf(PipelineConfigurationException.class)
        .extracting(e -> ((PipelineConfigurationException) e).getKey())
        .isEqualTo("checklist.deduplication.ambiguity-threshold");
  }

  @Test
  @DisplayName("should reject zero concurrency")
  void shouldThrow_whenConcurrencyIsZero() {
    ChecklistProperties properties = new ChecklistProperties();
    properties.getExtraction().setConcurrency(0);

    assertThatThrownBy(properties::validate)
        .hasMessageContaining("checklist.extraction.concurrency");
  }

  @Test
  @DisplayName("should reject duplicate role ids in the taxonomy")
  void shouldThrow_whenTaxonomyHasDuplicateIds() {
    ChecklistProperties properties = new ChecklistProperties();
    properties.getRoles().getTaxonomy().add(TestFixtures.role("hospital", "Hospital"));
    properties.getRoles().getTaxonomy().add(TestFixtures.role("hospital", "Hospital Again"));

    assertThatThrownBy(properties::validate).hasMessageContaining("duplicate role id hospital");
  }

  @Test
  @DisplayName("should build the default selection policy from configuration")
  void shouldBuildPolicy_whenSelectionConfigured() {
    ChecklistProperties properties = new ChecklistProperties();
    properties.getSelection().setIncludeFlagged(true);
    properties.getSelection().setMinOperationalLevel(OperationalLevel.REGIONAL);
    properties.getSelection().getExcludeSubjects().add("n-9");

    SelectionPolicy policy = properties.getSelection().toPolicy();

    assertThat(policy.includeFlagged()).isTrue();
    assertThat(policy.minOperationalLevel()).isEqualTo(OperationalLevel.REGIONAL);
    assertThat(policy.excludeSubjects()).containsExactly("n-9");
  }
}
