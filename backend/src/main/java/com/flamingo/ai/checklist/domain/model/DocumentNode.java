package com.flamingo.ai.checklist.domain.model;

import com.flamingo.ai.checklist.domain.enums.OperationalLevel;
import java.util.List;

/**
 * A subject (section) of the source document tree.
 *
 * <p>Nodes are created once at ingestion and never change. {@code parentId} is a lookup-only
 * back-pointer; ownership runs strictly from parent to {@code children}.
 *
 * @param id node identifier, unique within the tree
 * @param parentId identifier of the parent node, {@code null} for the root
 * @param title section heading
 * @param text raw body text of this section (excluding children)
 * @param tables raw table blocks embedded in this section
 * @param formulas raw formula strings embedded in this section
 * @param level operational level declared on this node, {@code null} to inherit
 * @param children ordered sub-sections
 */
public record DocumentNode(
    String id,
    String parentId,
    String title,
    String text,
    List<String> tables,
    List<String> formulas,
    OperationalLevel level,
    List<DocumentNode> children) {

  public DocumentNode {
    text = text == null ? "" : text;
    tables = tables == null ? List.of() : List.copyOf(tables);
    formulas = formulas == null ? List.of() : List.copyOf(formulas);
    children = children == null ? List.of() : List.copyOf(children);
  }

  /** Returns {@code true} if this node carries no extractable content of its own. */
  public boolean isContentEmpty() {
    return text.isBlank() && tables.isEmpty() && formulas.isEmpty();
  }
}
