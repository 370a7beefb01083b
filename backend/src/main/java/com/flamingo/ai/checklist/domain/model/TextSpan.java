package com.flamingo.ai.checklist.domain.model;

/**
 * Character range inside a node's raw text.
 *
 * @param start inclusive start offset
 * @param end exclusive end offset
 */
public record TextSpan(int start, int end) {

  public TextSpan {
    if (start < 0 || end < start) {
      throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
    }
  }

  /** Span covering the whole of {@code text}. */
  public static TextSpan whole(String text) {
    return new TextSpan(0, text == null ? 0 : text.length());
  }
}
