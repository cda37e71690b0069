package io.cronclash.discovery;

import io.cronclash.CronClashException;
import io.cronclash.conflict.ScheduledJob;
import io.cronclash.cron.CronExpression;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * A job definition assumed for a file with a well-known name.
 *
 * @param name the display name
 * @param cron the cron text
 * @param durationMinutes the estimated duration
 * @param resourceIntensive whether the job is resource intensive
 * @param tags the tags
 */
public record KnownJob(
    String name, String cron, int durationMinutes, boolean resourceIntensive, List<String> tags) {
  /** Creates a new KnownJob with a defensive copy of tags. */
  public KnownJob {
    tags = List.copyOf(tags);
  }

  /**
   * Builds the scheduled job this definition stands for.
   *
   * @param sourceFile the provenance to record
   * @param fileName the registry key the definition was found under
   * @return the job, attributed to line 1
   * @throws CronClashException if the cron text is malformed
   */
  public ScheduledJob toJob(String sourceFile, String fileName) throws CronClashException {
    return new ScheduledJob(
        name,
        CronExpression.parse(cron),
        sourceFile,
        1,
        "From " + fileName,
        durationMinutes,
        resourceIntensive,
        new LinkedHashSet<>(tags));
  }
}
