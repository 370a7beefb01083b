package com.flamingo.ai.checklist.api.dto.request;

import com.flamingo.ai.checklist.domain.enums.OperationalLevel;
import com.flamingo.ai.checklist.domain.model.DocumentNode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for one node of the document tree. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentNodeRequest {

  @NotBlank(message = "Node id is required")
  private String id;

  private String title;
  private String text;
  private List<String> tables;
  private List<String> formulas;
  private OperationalLevel operationalLevel;

  @Valid private List<DocumentNodeRequest> children;

  /** Converts this subtree to domain nodes; {@code parentId} comes from the enclosing node. */
  public DocumentNode toDomain(String parentId) {
    List<DocumentNode> domainChildren = new ArrayList<>();
    if (children != null) {
      for (DocumentNodeRequest child : children) {
        if (child != null) {
          domainChildren.add(child.toDomain(id));
        }
      }
    }
    return new DocumentNode(
        id, parentId, title, text, tables, formulas, operationalLevel, domainChildren);
  }
}
