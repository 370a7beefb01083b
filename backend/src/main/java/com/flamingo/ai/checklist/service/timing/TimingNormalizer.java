package com.flamingo.ai.checklist.service.timing;

import com.flamingo.ai.checklist.domain.model.TimingAnnotation;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.Month;
import java.time.MonthDay;
import java.time.format.TextStyle;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Classifies free-text "when" values into {@code absolute_time}, {@code relative_deadline} or
 * {@code event_trigger}. Text that matches no pattern is kept verbatim as an event trigger.
 */
@Component
@Slf4j
public class TimingNormalizer {

  private static final String MONTHS =
      "january|february|march|april|may|june|july|august|september|october|november|december"
          + "|jan|feb|mar|apr|jun|jul|aug|sep|sept|oct|nov|dec";

  private static final Pattern RELATIVE =
      Pattern.compile(
          "\\b(?:within|in|no later than|not later than|not more than|up to)\\s+"
              + "(?:the\\s+)?(?:first\\s+|next\\s+)?"
              + "(\\d+|an?|one|two|three|four|five|six|seven|eight|nine|ten|eleven|twelve"
              + "|twenty-four|twenty four|forty-eight|forty eight|seventy-two|seventy two)"
              + "\\s*-?\\s*(minutes?|mins?|hours?|hrs?|h|days?|weeks?|months?)\\b");

  private static final Pattern ISO_DATE = Pattern.compile("\\b(\\d{4}-\\d{2}-\\d{2})\\b");

  private static final Pattern END_OF_MONTH =
      Pattern.compile("\\bend of (?:the month of\\s+)?(" + MONTHS + ")\\b");

  private static final Pattern DAY_MONTH =
      Pattern.compile("\\b(\\d{1,2})(?:st|nd|rd|th)?\\s+(?:of\\s+)?(" + MONTHS + ")\\b");

  private static final Pattern MONTH_DAY =
      Pattern.compile("\\b(" + MONTHS + ")\\s+(\\d{1,2})(?:st|nd|rd|th)?\\b");

  private static final Pattern MONTH_ONLY =
      Pattern.compile("\\b(?:by|in|during|before)\\s+(" + MONTHS + ")\\b");

  private static final Pattern CLOCK_TIME = Pattern.compile("\\b([01]?\\d|2[0-3]):([0-5]\\d)\\b");

  private static final Pattern EVENT =
      Pattern.compile(
          "^(?:immediately\\s+|promptly\\s+)?(?:upon|after|following|when|once|on|as soon as"
              + "|at the time of|in the event of|in case of|if)\\s+(.+)$",
          Pattern.CASE_INSENSITIVE);

  private static final Map<String, Integer> NUMBER_WORDS =
      Map.ofEntries(
          Map.entry("a", 1),
          Map.entry("an", 1),
          Map.entry("one", 1),
          Map.entry("two", 2),
          Map.entry("three", 3),
          Map.entry("four", 4),
          Map.entry("five", 5),
          Map.entry("six", 6),
          Map.entry("seven", 7),
          Map.entry("eight", 8),
          Map.entry("nine", 9),
          Map.entry("ten", 10),
          Map.entry("eleven", 11),
          Map.entry("twelve", 12),
          Map.entry("twenty-four", 24),
          Map.entry("twenty four", 24),
          Map.entry("forty-eight", 48),
          Map.entry("forty eight", 48),
          Map.entry("seventy-two", 72),
          Map.entry("seventy two", 72));

  /**
   * Normalizes a "when" value. The input itself is never modified.
   *
   * @param when the raw text, may be {@code null} or blank
   * @return the annotation, never {@code null}
   */
  public TimingAnnotation normalize(String when) {
    if (when == null || when.isBlank()) {
      return TimingAnnotation.event("");
    }
    String text = when.strip();
    String collapsed = text.replaceAll("\\s+", " ");
    String lower = collapsed.toLowerCase(Locale.ROOT);

    TimingAnnotation relative = relative(lower);
    if (relative != null) {
      return relative;
    }
    TimingAnnotation absolute = absolute(lower);
    if (absolute != null) {
      return absolute;
    }
    Matcher event = EVENT.matcher(collapsed);
    if (event.matches()) {
      return TimingAnnotation.event(trimPunctuation(event.group(1)));
    }

    log.debug("Unrecognized timing '{}', kept as event trigger", text);
    return TimingAnnotation.event(text);
  }

  private TimingAnnotation relative(String lower) {
    Matcher matcher = RELATIVE.matcher(lower);
    if (!matcher.find()) {
      return null;
    }
    String amountText = matcher.group(1);
    String unit = matcher.group(2);
    try {
      Integer words = NUMBER_WORDS.get(amountText);
      long amount = words != null ? words : Long.parseLong(amountText);
      return TimingAnnotation.relative(duration(amount, unit));
    } catch (NumberFormatException | ArithmeticException e) {
      log.debug("Deadline amount '{}' out of range: {}", amountText, e.getMessage());
      return null;
    }
  }

  private static Duration duration(long amount, String unit) {
    if (unit.startsWith("min")) {
      return Duration.ofMinutes(amount);
    } else if (unit.startsWith("h")) {
      return Duration.ofHours(amount);
    } else if (unit.startsWith("d")) {
      return Duration.ofDays(amount);
    } else if (unit.startsWith("w")) {
      return Duration.ofDays(Math.multiplyExact(amount, 7));
    }
    return Duration.ofDays(Math.multiplyExact(amount, 30));
  }

  private TimingAnnotation absolute(String lower) {
    Matcher iso = ISO_DATE.matcher(lower);
    if (iso.find()) {
      try {
        return TimingAnnotation.absolute(LocalDate.parse(iso.group(1)).toString());
      } catch (DateTimeException e) {
        log.debug("Ignoring invalid date '{}': {}", iso.group(1), e.getMessage());
      }
    }

    Matcher endOfMonth = END_OF_MONTH.matcher(lower);
    if (endOfMonth.find()) {
      Month month = month(endOfMonth.group(1));
      return TimingAnnotation.absolute(MonthDay.of(month, month.length(false)).toString());
    }

    Matcher dayMonth = DAY_MONTH.matcher(lower);
    if (dayMonth.find()) {
      MonthDay monthDay = monthDay(month(dayMonth.group(2)), dayMonth.group(1));
      if (monthDay != null) {
        return TimingAnnotation.absolute(monthDay.toString());
      }
    }

    Matcher monthDayMatcher = MONTH_DAY.matcher(lower);
    if (monthDayMatcher.find()) {
      MonthDay monthDay = monthDay(month(monthDayMatcher.group(1)), monthDayMatcher.group(2));
      if (monthDay != null) {
        return TimingAnnotation.absolute(monthDay.toString());
      }
    }

    Matcher monthOnly = MONTH_ONLY.matcher(lower);
    if (monthOnly.find()) {
      return TimingAnnotation.absolute(String.format("--%02d", month(monthOnly.group(1)).getValue()));
    }

    Matcher clock = CLOCK_TIME.matcher(lower);
    if (clock.find()) {
      return TimingAnnotation.absolute(
          String.format("%02d:%s", Integer.parseInt(clock.group(1)), clock.group(2)));
    }
    return null;
  }

  private static MonthDay monthDay(Month month, String day) {
    int value = Integer.parseInt(day);
    if (value < 1 || value > month.maxLength()) {
      return null;
    }
    return MonthDay.of(month, value);
  }

  private static Month month(String name) {
    for (Month month : Month.values()) {
      String full = month.getDisplayName(TextStyle.FULL, Locale.ENGLISH).toLowerCase(Locale.ROOT);
      if (full.startsWith(name)) {
        return month;
      }
    }
    throw new IllegalArgumentException("Unknown month " + name);
  }

  private static String trimPunctuation(String value) {
    return value.strip().replaceAll("[.;,:]+$", "");
  }
}
