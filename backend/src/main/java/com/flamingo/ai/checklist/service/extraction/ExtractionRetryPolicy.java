package com.flamingo.ai.checklist.service.extraction;

import com.flamingo.ai.checklist.config.ChecklistProperties;
import com.flamingo.ai.checklist.exception.ExtractionFailureException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * The single retry policy wrapped around every node-level extraction call: bounded attempts with
 * exponential backoff, read from {@code checklist.extraction.*}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExtractionRetryPolicy {

  private final ChecklistProperties properties;
  private final MeterRegistry meterRegistry;

  /**
   * Runs {@code call} until it succeeds or the attempts are used up.
   *
   * @param nodeId node the call belongs to, for logging and errors
   * @param call the extraction call
   * @return the call's result
   * @throws ExtractionFailureException when the last attempt fails
   */
  public <T> T execute(String nodeId, Supplier<T> call) {
    Retry retry = Retry.of("extraction-" + nodeId, retryConfig());
    retry
        .getEventPublisher()
        .onRetry(
            event -> {
              meterRegistry.counter("checklist.extraction.retries").increment();
              log.warn(
                  "Extraction of node {} failed (attempt {}), retrying in {} ms: {}",
                  nodeId,
                  event.getNumberOfRetryAttempts(),
                  event.getWaitInterval().toMillis(),
                  event.getLastThrowable() == null
                      ? "unknown error"
                      : event.getLastThrowable().getMessage());
            });

    try {
      return Retry.decorateSupplier(retry, call).get();
    } catch (ExtractionFailureException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ExtractionFailureException(
          nodeId, "Extraction failed after " + maxAttempts() + " attempts: " + e.getMessage(), e);
    }
  }

  public int maxAttempts() {
    return properties.getExtraction().getMaxAttempts();
  }

  private RetryConfig retryConfig() {
    ChecklistProperties.Extraction extraction = properties.getExtraction();
    IntervalFunction interval =
        extraction.getInitialBackoffMs() < 1
            ? attempt -> 0L
            : IntervalFunction.ofExponentialBackoff(
                extraction.getInitialBackoffMs(), extraction.getBackoffMultiplier());
    return RetryConfig.custom()
        .maxAttempts(extraction.getMaxAttempts())
        .intervalFunction(interval)
        .retryExceptions(RuntimeException.class)
        .build();
  }
}
