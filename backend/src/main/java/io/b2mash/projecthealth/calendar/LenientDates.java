package io.b2mash.projecthealth.calendar;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Parses dates supplied as text by form layers. Accepts ISO dates ({@code 2024-01-05}) and ISO or
 * SQL-style timestamps, keeping only the calendar date. Anything else, including dates outside
 * years 1 to 9999, is treated as absent.
 */
public final class LenientDates {

  static final int MIN_YEAR = 1;
  static final int MAX_YEAR = 9999;

  private LenientDates() {}

  public static Optional<LocalDate> parse(String text) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    String trimmed = text.trim();
    int timeSeparator = indexOfTimeSeparator(trimmed);
    String datePart = timeSeparator >= 0 ? trimmed.substring(0, timeSeparator) : trimmed;
    try {
      return Optional.of(LocalDate.parse(datePart))
          .filter(date -> date.getYear() >= MIN_YEAR && date.getYear() <= MAX_YEAR);
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }

  private static int indexOfTimeSeparator(String text) {
    int t = text.indexOf('T');
    return t >= 0 ? t : text.indexOf(' ');
  }
}
