package com.flamingo.ai.checklist.domain.model;

import java.util.Comparator;

/**
 * Pointer from an extracted item back to the subject it came from.
 *
 * @param nodeId identifier of the originating document node
 * @param nodeTitle heading of the originating node, for display
 * @param span character range in the node's text
 */
public record SourceReference(String nodeId, String nodeTitle, TextSpan span) {

  public static final Comparator<SourceReference> ORDER =
      Comparator.comparing(SourceReference::nodeId)
          .thenComparingInt(r -> r.span().start())
          .thenComparingInt(r -> r.span().end());

  /** Human-readable label, e.g. {@code "2.5 Supply Chain [n-2-5]"}. */
  public String label() {
    if (nodeTitle == null || nodeTitle.isBlank()) {
      return "[" + nodeId + "]";
    }
    return nodeTitle + " [" + nodeId + "]";
  }
}
