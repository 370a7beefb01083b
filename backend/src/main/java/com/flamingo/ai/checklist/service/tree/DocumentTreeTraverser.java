package com.flamingo.ai.checklist.service.tree;

import com.flamingo.ai.checklist.domain.enums.OperationalLevel;
import com.flamingo.ai.checklist.domain.model.DocumentNode;
import com.flamingo.ai.checklist.exception.MalformedTreeException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Flattens a document tree into a deterministic pre-order sequence.
 *
 * <p>The input comes from an external parser, so the traversal re-checks that it really is a tree:
 * every id is unique, no id repeats along a path, each child's {@code parentId} names its actual
 * parent, and no node instance is reachable twice.
 */
@Component
public class DocumentTreeTraverser {

  /**
   * Traverses {@code root} in pre-order.
   *
   * @param root the root node
   * @return one entry per node, root first, children in declared order
   * @throws MalformedTreeException if the structure is not a tree
   */
  public List<TraversalEntry> traverse(DocumentNode root) {
    Objects.requireNonNull(root, "root");
    if (root.id() == null || root.id().isBlank()) {
      throw new MalformedTreeException(null, "Root node has no id");
    }

    List<TraversalEntry> entries = new ArrayList<>();
    Set<String> seenIds = new HashSet<>();
    Set<DocumentNode> seenInstances = Collections.newSetFromMap(new IdentityHashMap<>());
    Deque<Frame> stack = new ArrayDeque<>();
    stack.push(new Frame(root, null, root.level(), List.of()));

    while (!stack.isEmpty()) {
      Frame frame = stack.pop();
      DocumentNode node = frame.node();
      if (node.id() == null || node.id().isBlank()) {
        throw new MalformedTreeException(frame.parentId(), "Node without id under "
            + frame.parentId());
      }
      if (frame.ancestors().contains(node.id())) {
        throw new MalformedTreeException(node.id(), "Cycle detected at node " + node.id()
            + " via path " + String.join(" > ", frame.ancestors()));
      }
      if (!seenInstances.add(node)) {
        throw new MalformedTreeException(node.id(), "Node " + node.id()
            + " is reachable from more than one parent");
      }
      if (!seenIds.add(node.id())) {
        throw new MalformedTreeException(node.id(), "Duplicate node id " + node.id());
      }
      if (frame.parentId() != null && node.parentId() != null
          && !node.parentId().equals(frame.parentId())) {
        throw new MalformedTreeException(node.id(), "Node " + node.id() + " declares parent "
            + node.parentId() + " but is a child of " + frame.parentId());
      }

      OperationalLevel level = node.level() != null ? node.level() : frame.inheritedLevel();
      List<String> path = append(frame.ancestors(), node.id());
      entries.add(new TraversalEntry(node, entries.size(), level, path));

      List<DocumentNode> children = node.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(new Frame(children.get(i), node.id(), level, path));
      }
    }
    return entries;
  }

  /**
   * Expands a set of node ids to include every descendant of those nodes.
   *
   * @param entries a traversal produced by {@link #traverse(DocumentNode)}
   * @param ids the ids to expand
   * @return the ids plus all their descendants, in traversal order
   */
  public Set<String> withDescendants(List<TraversalEntry> entries, Collection<String> ids) {
    Set<String> expanded = new LinkedHashSet<>();
    if (ids.isEmpty()) {
      return expanded;
    }
    for (TraversalEntry entry : entries) {
      if (entry.path().stream().anyMatch(ids::contains)) {
        expanded.add(entry.node().id());
      }
    }
    return expanded;
  }

  private static List<String> append(List<String> path, String id) {
    List<String> result = new ArrayList<>(path.size() + 1);
    result.addAll(path);
    result.add(id);
    return result;
  }

  private record Frame(
      DocumentNode node, String parentId, OperationalLevel inheritedLevel,
      List<String> ancestors) {}
}
