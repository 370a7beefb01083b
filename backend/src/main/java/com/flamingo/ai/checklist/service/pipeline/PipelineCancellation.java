package com.flamingo.ai.checklist.service.pipeline;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal for a pipeline run. Once cancelled, node extractions that have
 * not started are skipped; running ones finish and their results are kept.
 */
public class PipelineCancellation {

  private final AtomicBoolean cancelled = new AtomicBoolean();

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }
}
