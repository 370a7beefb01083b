package com.flamingo.ai.checklist.service.role;

import com.flamingo.ai.checklist.config.ChecklistProperties;
import com.flamingo.ai.checklist.config.ChecklistProperties.RoleDefinition;
import com.flamingo.ai.checklist.service.dedup.TokenSimilarity;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * {@link RoleTaxonomy} read from {@code checklist.roles.taxonomy}. A role matches on its id, name
 * or any alias: exactly (confidence 1.0) or by token Jaccard.
 */
@Component
@RequiredArgsConstructor
public class ConfiguredRoleTaxonomy implements RoleTaxonomy {

  private final ChecklistProperties properties;

  @Override
  public Optional<RoleMatch> resolve(String who) {
    String normalized = TokenSimilarity.normalize(who);
    if (normalized.isEmpty()) {
      return Optional.empty();
    }

    RoleMatch best = null;
    boolean tied = false;
    for (RoleDefinition role : properties.getRoles().getTaxonomy()) {
      double score = score(normalized, role);
      if (score <= 0.0) {
        continue;
      }
      if (best == null || score > best.confidence()) {
        best = new RoleMatch(role.getId(), displayName(role), score);
        tied = false;
      } else if (score == best.confidence() && !role.getId().equals(best.roleId())) {
        tied = true;
      }
    }
    return tied ? Optional.empty() : Optional.ofNullable(best);
  }

  @Override
  public Optional<RoleMatch> findById(String roleId) {
    return properties.getRoles().getTaxonomy().stream()
        .filter(role -> role.getId().equals(roleId))
        .findFirst()
        .map(role -> new RoleMatch(role.getId(), displayName(role), 1.0));
  }

  private double score(String normalizedWho, RoleDefinition role) {
    double best = 0.0;
    for (String candidate : candidates(role)) {
      String normalized = TokenSimilarity.normalize(candidate);
      if (normalized.isEmpty()) {
        continue;
      }
      if (normalized.equals(normalizedWho)) {
        return 1.0;
      }
      best = Math.max(best, TokenSimilarity.jaccard(normalizedWho, normalized));
    }
    return best;
  }

  private static List<String> candidates(RoleDefinition role) {
    List<String> candidates = new ArrayList<>();
    candidates.add(role.getId().replace('-', ' '));
    if (role.getName() != null) {
      candidates.add(role.getName());
    }
    candidates.addAll(role.getAliases());
    return candidates;
  }

  private static String displayName(RoleDefinition role) {
    return role.getName() == null || role.getName().isBlank() ? role.getId() : role.getName();
  }
}
