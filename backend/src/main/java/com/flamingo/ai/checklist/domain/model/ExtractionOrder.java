package com.flamingo.ai.checklist.domain.model;

import java.util.Comparator;

/**
 * Position of an action in the deterministic extraction sequence.
 *
 * @param nodeIndex pre-order index of the originating node
 * @param actionIndex order of the action within the backend's response for that node
 */
public record ExtractionOrder(int nodeIndex, int actionIndex)
    implements Comparable<ExtractionOrder> {

  private static final Comparator<ExtractionOrder> COMPARATOR =
      Comparator.comparingInt(ExtractionOrder::nodeIndex)
          .thenComparingInt(ExtractionOrder::actionIndex);

  @Override
  public int compareTo(ExtractionOrder other) {
    return COMPARATOR.compare(this, other);
  }
}
