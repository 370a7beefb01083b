package com.flamingo.ai.checklist.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.checklist.api.dto.request.GenerateChecklistRequest;
import com.flamingo.ai.checklist.api.rest.ChecklistController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests for the public endpoints:
 *
 * <ul>
 *   <li>POST /api/checklists - Generate a checklist from a document tree
 *   <li>GET /api/checklists/health - Health check
 * </ul>
 */
class ApiContractTest {

  @Nested
  @DisplayName("ChecklistController API contract")
  class ChecklistControllerContract {

    @Test
    @DisplayName("should be mapped to /api/checklists")
    void shouldBeMappedToApiChecklists() {
      RequestMapping mapping = ChecklistController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/checklists");
    }

    @Test
    @DisplayName("should generate on POST to the base path")
    void shouldGenerateOnPost() throws NoSuchMethodException {
      PostMapping mapping =
          ChecklistController.class
              .getMethod("generate", GenerateChecklistRequest.class)
              .getAnnotation(PostMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).isEmpty();
    }

    @Test
    @DisplayName("should expose health under /health")
    void shouldExposeHealth() throws NoSuchMethodException {
      GetMapping mapping =
          ChecklistController.class.getMethod("health").getAnnotation(GetMapping.class);
      assertThat(mapping.value()).containsExactly("/health");
    }
  }
}
