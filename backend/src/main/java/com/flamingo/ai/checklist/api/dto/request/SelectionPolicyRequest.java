package com.flamingo.ai.checklist.api.dto.request;

import com.flamingo.ai.checklist.domain.enums.OperationalLevel;
import com.flamingo.ai.checklist.domain.model.SelectionPolicy;
import java.util.LinkedHashSet;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for the selection policy. Unset fields fall back to the configured defaults. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SelectionPolicyRequest {

  private Boolean includeFlagged;
  private OperationalLevel minOperationalLevel;
  private List<String> excludeSubjects;

  public SelectionPolicy toDomain(SelectionPolicy defaults) {
    return new SelectionPolicy(
        includeFlagged != null ? includeFlagged : defaults.includeFlagged(),
        minOperationalLevel != null ? minOperationalLevel : defaults.minOperationalLevel(),
        excludeSubjects != null ? new LinkedHashSet<>(excludeSubjects) : defaults.excludeSubjects());
  }
}
