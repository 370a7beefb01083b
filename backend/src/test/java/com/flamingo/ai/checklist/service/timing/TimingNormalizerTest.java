package com.flamingo.ai.checklist.service.timing;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.checklist.domain.enums.TriggerKind;
import com.flamingo.ai.checklist.domain.model.TimingAnnotation;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("TimingNormalizer Tests")
class TimingNormalizerTest {

  private final TimingNormalizer normalizer = new TimingNormalizer();

  @ParameterizedTest(name = "{0} -> {1}")
  @CsvSource({
    "within 2 hours, PT2H",
    "Within 30 minutes of activation, PT30M",
    "no later than three days after the event, PT72H",
    "within one week, PT168H",
    "in 2 months, PT1440H",
    "within 24 hours of the earthquake, PT24H"
  })
  @DisplayName("should parse relative deadlines into durations")
  void shouldParseRelativeDeadline_whenDurationPresent(String when, String expected) {
    TimingAnnotation timing = normalizer.normalize(when);

    assertThat(timing.kind()).isEqualTo(TriggerKind.RELATIVE_DEADLINE);
    assertThat(timing.value()).isEqualTo(expected);
    assertThat(timing.deadline()).isEqualTo(Duration.parse(expected));
  }

  @ParameterizedTest(name = "{0} -> {1}")
  @CsvSource({
    "by the end of October, --10-31",
    "15 March, --03-15",
    "March 15th, --03-15",
    "on 2024-05-01, 2024-05-01",
    "by June, --06",
    "every day at 8:00, 08:00"
  })
  @DisplayName("should parse absolute times")
  void shouldParseAbsoluteTime_whenDateOrClockPresent(String when, String expected) {
    TimingAnnotation timing = normalizer.normalize(when);

    assertThat(timing.kind()).isEqualTo(TriggerKind.ABSOLUTE_TIME);
    assertThat(timing.value()).isEqualTo(expected);
    assertThat(timing.deadline()).isNull();
  }

  @Test
  @DisplayName("should extract the event phrase after a trigger word")
  void shouldParseEventTrigger_whenTriggerWordPresent() {
    assertThat(normalizer.normalize("Upon activation of the plan."))
        .isEqualTo(TimingAnnotation.event("activation of the plan"));
    assertThat(normalizer.normalize("Immediately after code red is declared"))
        .isEqualTo(TimingAnnotation.event("code red is declared"));
  }

  @Test
  @DisplayName("should keep the original case of the event phrase")
  void shouldKeepEventCase_whenTriggerWordPresent() {
    assertThat(normalizer.normalize("upon  declaration of Code Red"))
        .isEqualTo(TimingAnnotation.event("declaration of Code Red"));
  }

  @ParameterizedTest(name = "{0}")
  @CsvSource({
    "within 99999999999999999999 days",
    "within 9999999999999999 days",
    "in 999999999999999999 months",
    "within 9223372036854775807 minutes"
  })
  @DisplayName("should keep out-of-range deadlines verbatim as event triggers")
  void shouldKeepRawText_whenDeadlineOutOfRange(String when) {
    assertThat(normalizer.normalize(when)).isEqualTo(TimingAnnotation.event(when));
  }

  @Test
  @DisplayName("should keep unrecognized text verbatim as an event trigger")
  void shouldKeepRawText_whenNothingMatches() {
    assertThat(normalizer.normalize("Ongoing")).isEqualTo(TimingAnnotation.event("Ongoing"));
  }

  @Test
  @DisplayName("should return an empty event trigger for blank input")
  void shouldReturnEmptyEvent_whenBlank() {
    assertThat(normalizer.normalize("  ")).isEqualTo(TimingAnnotation.event(""));
    assertThat(normalizer.normalize(null)).isEqualTo(TimingAnnotation.event(""));
  }
}
