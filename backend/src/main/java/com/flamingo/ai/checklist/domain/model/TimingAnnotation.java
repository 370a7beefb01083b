package com.flamingo.ai.checklist.domain.model;

import com.flamingo.ai.checklist.domain.enums.TriggerKind;
import java.time.Duration;

/**
 * Normalized form of an action's "when" text.
 *
 * @param kind trigger shape
 * @param value normalized value: an ISO-8601 date, month-day or time for {@link
 *     TriggerKind#ABSOLUTE_TIME}, an ISO-8601 duration for {@link TriggerKind#RELATIVE_DEADLINE},
 *     the event phrase (or the raw text if unparsed) for {@link TriggerKind#EVENT_TRIGGER}
 * @param deadline parsed duration for relative deadlines, otherwise {@code null}
 */
public record TimingAnnotation(TriggerKind kind, String value, Duration deadline) {

  public static TimingAnnotation event(String value) {
    return new TimingAnnotation(TriggerKind.EVENT_TRIGGER, value, null);
  }

  public static TimingAnnotation relative(Duration deadline) {
    return new TimingAnnotation(TriggerKind.RELATIVE_DEADLINE, deadline.toString(), deadline);
  }

  public static TimingAnnotation absolute(String value) {
    return new TimingAnnotation(TriggerKind.ABSOLUTE_TIME, value, null);
  }
}
