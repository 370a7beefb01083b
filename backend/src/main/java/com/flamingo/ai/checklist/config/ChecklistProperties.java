package com.flamingo.ai.checklist.config;

import com.flamingo.ai.checklist.domain.enums.OperationalLevel;
import com.flamingo.ai.checklist.domain.model.SelectionPolicy;
import com.flamingo.ai.checklist.exception.PipelineConfigurationException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the checklist pipeline. */
@Configuration
@ConfigurationProperties(prefix = "checklist")
@Getter
@Setter
public class ChecklistProperties {

  private Extraction extraction = new Extraction();
  private Deduplication deduplication = new Deduplication();
  private Selection selection = new Selection();
  private Roles roles = new Roles();
  private Format format = new Format();

  @Getter
  @Setter
  public static class Extraction {
    /** Worker-pool size for per-node backend calls. */
    private int concurrency = 4;

    /** Attempts per node, first call included. */
    private int maxAttempts = 3;

    private long initialBackoffMs = 500;
    private double backoffMultiplier = 2.0;
    private int callTimeoutSeconds = 60;
  }

  @Getter
  @Setter
  public static class Deduplication {
    /** Token-Jaccard similarity at or above which two actions merge. */
    private double similarityThreshold = 0.85;

    /** Lower bound of the band reported as a borderline pair. */
    private double ambiguityThreshold = 0.70;
  }

  @Getter
  @Setter
  public static class Selection {
    private boolean includeFlagged = false;
    private OperationalLevel minOperationalLevel = OperationalLevel.LOCAL;
    private List<String> excludeSubjects = new ArrayList<>();

    public SelectionPolicy toPolicy() {
      return new SelectionPolicy(
          includeFlagged, minOperationalLevel, new LinkedHashSet<>(excludeSubjects));
    }
  }

  @Getter
  @Setter
  public static class Roles {
    /** Minimum alias similarity for a confident binding. */
    private double matchThreshold = 0.8;

    private List<RoleDefinition> taxonomy = new ArrayList<>();
  }

  /** One entry of the organizational role taxonomy. */
  @Getter
  @Setter
  public static class RoleDefinition {
    private String id;
    private String name;
    private List<String> aliases = new ArrayList<>();
  }

  @Getter
  @Setter
  public static class Format {
    private OperationalLevel defaultOperationalLevel = OperationalLevel.LOCAL;
    private String formulaExamplePlaceholder = "insert local values";

    /** Taxonomy role id addressed by the execution confirmation block. */
    private String confirmingRole = "incident-commander";
  }

  public Duration initialBackoff() {
    return Duration.ofMillis(extraction.initialBackoffMs);
  }

  /**
   * Checks every setting the pipeline depends on.
   *
   * @throws PipelineConfigurationException naming the first offending key
   */
  public void validate() {
    if (extraction.concurrency < 1) {
      throw new PipelineConfigurationException(
          "checklist.extraction.concurrency", "must be at least 1, was " + extraction.concurrency);
    }
    if (extraction.maxAttempts < 1) {
      throw new PipelineConfigurationException(
          "checklist.extraction.max-attempts", "must be at least 1, was " + extraction.maxAttempts);
    }
    if (extraction.initialBackoffMs < 0) {
      throw new PipelineConfigurationException(
          "checklist.extraction.initial-backoff-ms",
          "must not be negative, was " + extraction.initialBackoffMs);
    }
    if (extraction.backoffMultiplier < 1.0) {
      throw new PipelineConfigurationException(
          "checklist.extraction.backoff-multiplier",
          "must be at least 1.0, was " + extraction.backoffMultiplier);
    }
    double merge = deduplication.similarityThreshold;
    if (merge <= 0.0 || merge > 1.0) {
      throw new PipelineConfigurationException(
          "checklist.deduplication.similarity-threshold", "must be in (0, 1], was " + merge);
    }
    double ambiguity = deduplication.ambiguityThreshold;
    if (ambiguity <= 0.0 || ambiguity > merge) {
      throw new PipelineConfigurationException(
          "checklist.deduplication.ambiguity-threshold",
          "must be in (0, similarity-threshold], was " + ambiguity);
    }
    if (roles.matchThreshold <= 0.0 || roles.matchThreshold > 1.0) {
      throw new PipelineConfigurationException(
          "checklist.roles.match-threshold", "must be in (0, 1], was " + roles.matchThreshold);
    }
    Set<String> roleIds = new HashSet<>();
    for (RoleDefinition role : roles.taxonomy) {
      if (role.getId() == null || role.getId().isBlank()) {
        throw new PipelineConfigurationException("checklist.roles.taxonomy", "role without id");
      }
      if (!roleIds.add(role.getId())) {
        throw new PipelineConfigurationException(
            "checklist.roles.taxonomy", "duplicate role id " + role.getId());
      }
    }
    if (selection.minOperationalLevel == null) {
      throw new PipelineConfigurationException(
          "checklist.selection.min-operational-level", "must be set");
    }
    if (format.defaultOperationalLevel == null) {
      throw new PipelineConfigurationException(
          "checklist.format.default-operational-level", "must be set");
    }
  }
}
