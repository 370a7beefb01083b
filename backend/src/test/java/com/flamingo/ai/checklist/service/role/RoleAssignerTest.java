package com.flamingo.ai.checklist.service.role;

import static com.flamingo.ai.checklist.TestFixtures.action;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.flamingo.ai.checklist.TestFixtures;
import com.flamingo.ai.checklist.domain.enums.WarningType;
import com.flamingo.ai.checklist.domain.model.Action;
import com.flamingo.ai.checklist.domain.model.RoleAssignment;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("RoleAssigner Tests")
class RoleAssignerTest {

  @Mock private RoleTaxonomy roleTaxonomy;

  private RoleAssigner roleAssigner;

  @BeforeEach
  void setUp() {
    roleAssigner = new RoleAssigner(roleTaxonomy, TestFixtures.properties());
  }

  @Test
  @DisplayName("should bind the role when the match is confident")
  void shouldResolveRole_whenConfidenceAboveThreshold() {
    when(roleTaxonomy.resolve("hospital director"))
        .thenReturn(Optional.of(new RoleMatch("hospital", "Hospital Management", 1.0)));

    RoleAssignment assignment = roleAssigner.assign("hospital director");

    assertThat(assignment.isResolved()).isTrue();
    assertThat(assignment.displayName()).isEqualTo("Hospital Management");
    assertThat(assignment.sourceText()).isEqualTo("hospital director");
  }

  @Test
  @DisplayName("should leave the role unresolved when the match is weak")
  void shouldLeaveUnresolved_whenConfidenceBelowThreshold() {
    when(roleTaxonomy.resolve("the logistics unit"))
        .thenReturn(Optional.of(new RoleMatch("logistics-officer", "Logistics Officer", 0.67)));

    RoleAssignment assignment = roleAssigner.assign("the logistics unit");

    assertThat(assignment.isResolved()).isFalse();
    assertThat(assignment.displayName()).isEqualTo("NEEDS ASSIGNMENT (the logistics unit)");
  }

  @Test
  @DisplayName("should not consult the taxonomy for a blank who")
  void shouldLeaveUnresolved_whenWhoBlank() {
    assertThat(roleAssigner.assign("").displayName()).isEqualTo("NEEDS ASSIGNMENT");
  }

  @Test
  @DisplayName("should warn once per unresolved action and keep the input order")
  void shouldWarnPerUnresolvedAction_whenAssigningAll() {
    when(roleTaxonomy.resolve("hospital"))
        .thenReturn(Optional.of(new RoleMatch("hospital", "Hospital Management", 1.0)));
    when(roleTaxonomy.resolve("volunteers")).thenReturn(Optional.empty());
    List<Action> actions =
        List.of(
            action("a1", "n1", 0, 0, "hospital", "Activate the plan", "upon code red"),
            action("a2", "n1", 0, 1, "volunteers", "Direct traffic", "upon code red"));

    RoleAssigner.RoleAssignmentResult result = roleAssigner.assignAll(actions);

    assertThat(result.actions()).extracting(Action::id).containsExactly("a1", "a2");
    assertThat(result.actions().get(0).role().roleId()).isEqualTo("hospital");
    assertThat(result.unresolved()).isEqualTo(1);
    assertThat(result.warnings()).singleElement()
        .satisfies(w -> {
          assertThat(w.type()).isEqualTo(WarningType.UNRESOLVED_ROLE);
          assertThat(w.subjectId()).isEqualTo("a2");
        });
  }
}
