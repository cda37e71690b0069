package io.cronclash.conflict;

import io.cronclash.cron.CronExpression;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A recurring job and what is known about its cost.
 *
 * @param name the display name (not necessarily unique)
 * @param schedule the cron schedule
 * @param sourceFile the file the job was found in
 * @param lineNumber the 1-based line the job was found on
 * @param description free text, may be empty
 * @param estimatedDurationMinutes how long one run is expected to take
 * @param resourceIntensive whether a run consumes significant I/O or CPU
 * @param tags resource-class and grouping labels
 */
public record ScheduledJob(
    String name,
    CronExpression schedule,
    String sourceFile,
    int lineNumber,
    String description,
    int estimatedDurationMinutes,
    boolean resourceIntensive,
    Set<String> tags) {

  /** Duration assumed when none is known. */
  public static final int DEFAULT_DURATION_MINUTES = 30;

  /** Validates the duration and makes an insertion-ordered, unmodifiable copy of tags. */
  public ScheduledJob {
    if (estimatedDurationMinutes <= 0) {
      throw new IllegalArgumentException(
          "estimated duration must be positive, got " + estimatedDurationMinutes);
    }
    description = description == null ? "" : description;
    tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
  }

  /**
   * Creates a job with default duration, no intensity flag and no tags.
   *
   * @param name the display name
   * @param schedule the cron schedule
   * @param sourceFile the file the job was found in
   * @param lineNumber the 1-based line the job was found on
   * @return a new ScheduledJob
   */
  public static ScheduledJob of(
      String name, CronExpression schedule, String sourceFile, int lineNumber) {
    return new ScheduledJob(
        name, schedule, sourceFile, lineNumber, "", DEFAULT_DURATION_MINUTES, false, Set.of());
  }

  /**
   * Returns a copy with the specified description.
   *
   * @param description the description
   * @return a new ScheduledJob with the updated description
   */
  public ScheduledJob withDescription(String description) {
    return new ScheduledJob(
        name,
        schedule,
        sourceFile,
        lineNumber,
        description,
        estimatedDurationMinutes,
        resourceIntensive,
        tags);
  }

  /**
   * Returns a copy with the specified estimated duration.
   *
   * @param minutes the duration in minutes
   * @return a new ScheduledJob with the updated duration
   */
  public ScheduledJob withDuration(int minutes) {
    return new ScheduledJob(
        name, schedule, sourceFile, lineNumber, description, minutes, resourceIntensive, tags);
  }

  /**
   * Returns a copy with the specified intensity flag.
   *
   * @param intensive whether the job is resource intensive
   * @return a new ScheduledJob with the updated flag
   */
  public ScheduledJob withResourceIntensive(boolean intensive) {
    return new ScheduledJob(
        name,
        schedule,
        sourceFile,
        lineNumber,
        description,
        estimatedDurationMinutes,
        intensive,
        tags);
  }

  /**
   * Returns a copy with the specified tags.
   *
   * @param tags the tags
   * @return a new ScheduledJob with the updated tags
   */
  public ScheduledJob withTags(Collection<String> tags) {
    return new ScheduledJob(
        name,
        schedule,
        sourceFile,
        lineNumber,
        description,
        estimatedDurationMinutes,
        resourceIntensive,
        new LinkedHashSet<>(tags));
  }
}
