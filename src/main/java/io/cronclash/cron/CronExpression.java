package io.cronclash.cron;

import io.cronclash.CronClashException;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A five-field cron expression as written by the user.
 *
 * <p>Only the field structure is validated: each field is a single non-empty token and {@code raw}
 * splits into exactly these fields. Field values are kept verbatim, so {@code 99} in the hour
 * position is accepted here and simply never projected (see {@link
 * io.cronclash.eval.OccurrenceProjector}).
 *
 * @param minute the minute field
 * @param hour the hour field
 * @param dayOfMonth the day-of-month field
 * @param month the month field
 * @param dayOfWeek the day-of-week field
 * @param raw the original text, used verbatim in messages and reports
 */
public record CronExpression(
    String minute, String hour, String dayOfMonth, String month, String dayOfWeek, String raw) {

  /** Number of fields in a cron expression. */
  public static final int FIELD_COUNT = 5;

  /** Wildcard field value. */
  public static final String ANY = "*";

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  /**
   * Creates a new CronExpression.
   *
   * @throws IllegalArgumentException if a field is not a single token, or {@code raw} does not
   *     split into the given fields
   */
  public CronExpression {
    List<String> given = Arrays.asList(minute, hour, dayOfMonth, month, dayOfWeek);
    for (String field : given) {
      if (field == null || field.isEmpty() || WHITESPACE.matcher(field).find()) {
        throw new IllegalArgumentException("cron field must be a single token, got " + field);
      }
    }
    if (raw == null || !Arrays.asList(tokens(raw)).equals(given)) {
      throw new IllegalArgumentException(
          "cron text '" + raw + "' does not match fields " + String.join(" ", given));
    }
  }

  /**
   * Parses a cron expression.
   *
   * @param text the cron text, e.g. {@code "0 2 * * *"}
   * @return the parsed expression
   * @throws CronClashException if the text does not contain exactly five fields
   */
  public static CronExpression parse(String text) throws CronClashException {
    if (text == null) {
      throw CronClashException.invalidSchedule("cron expression is missing", "");
    }
    String[] fields = tokens(text);
    if (fields.length != FIELD_COUNT) {
      throw CronClashException.invalidSchedule(
          "expected " + FIELD_COUNT + " cron fields, got " + fields.length, text);
    }
    return new CronExpression(fields[0], fields[1], fields[2], fields[3], fields[4], text);
  }

  private static String[] tokens(String text) {
    String trimmed = text.trim();
    return trimmed.isEmpty() ? new String[0] : WHITESPACE.split(trimmed);
  }

  /**
   * Returns true if the text parses as a cron expression.
   *
   * @param text the cron text
   * @return true if {@link #parse(String)} would succeed
   */
  public static boolean isValid(String text) {
    try {
      parse(text);
      return true;
    } catch (CronClashException e) {
      return false;
    }
  }

  /**
   * Returns the five fields in order.
   *
   * @return minute, hour, day-of-month, month, day-of-week
   */
  public List<String> fields() {
    return List.of(minute, hour, dayOfMonth, month, dayOfWeek);
  }

  /**
   * Returns true if day-of-month, month and day-of-week are all wildcards.
   *
   * @return true if the expression fires every day
   */
  public boolean isEveryDay() {
    return ANY.equals(dayOfMonth) && ANY.equals(month) && ANY.equals(dayOfWeek);
  }

  @Override
  public String toString() {
    return raw;
  }
}
