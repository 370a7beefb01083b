package com.flamingo.ai.checklist.service.tree;

import com.flamingo.ai.checklist.domain.enums.OperationalLevel;
import com.flamingo.ai.checklist.domain.model.DocumentNode;
import java.util.List;

/**
 * A node in pre-order position.
 *
 * @param node the node
 * @param index pre-order index, 0 for the root
 * @param level operational level in effect: the node's own, else the nearest ancestor's, else
 *     {@code null}
 * @param path ids from the root down to this node, inclusive
 */
public record TraversalEntry(
    DocumentNode node, int index, OperationalLevel level, List<String> path) {

  public TraversalEntry {
    path = List.copyOf(path);
  }
}
