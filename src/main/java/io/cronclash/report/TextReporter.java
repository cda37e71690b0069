package io.cronclash.report;

import io.cronclash.CheckResult;
import io.cronclash.conflict.ScheduleConflict;
import io.cronclash.conflict.ScheduledJob;

/** Renders a check result as a plain-text report. */
public final class TextReporter {
  private static final String RULE = "=".repeat(60);
  private static final String SUB_RULE = "-".repeat(40);

  private TextReporter() {}

  /**
   * Renders the report.
   *
   * @param result the check result
   * @param verbose whether to list every job
   * @return the report text
   */
  public static String render(CheckResult result, boolean verbose) {
    StringBuilder sb = new StringBuilder();
    sb.append('\n').append(RULE).append('\n');
    sb.append("SCHEDULE CONFLICT REPORT\n");
    sb.append(RULE).append('\n');
    sb.append("\nJobs found: ").append(result.jobs().size()).append('\n');
    sb.append("Conflicts found: ").append(result.conflicts().size()).append('\n');

    if (verbose && !result.jobs().isEmpty()) {
      sb.append("\nScheduled Jobs:\n");
      sb.append(SUB_RULE).append('\n');
      for (ScheduledJob job : result.jobs()) {
        renderJob(sb, job);
      }
    }

    if (result.conflicts().isEmpty()) {
      sb.append("\nNo scheduling conflicts detected.\n");
    } else {
      sb.append("\nConflicts Detected:\n");
      sb.append(SUB_RULE).append('\n');
      for (ScheduleConflict conflict : result.conflicts()) {
        sb.append("  [")
            .append(conflict.severity().label())
            .append("] ")
            .append(conflict.message())
            .append('\n');
      }
    }
    return sb.toString();
  }

  private static void renderJob(StringBuilder sb, ScheduledJob job) {
    sb.append("  - ").append(job.name()).append('\n');
    sb.append("    Schedule: ").append(job.schedule().raw()).append('\n');
    sb.append("    Source: ").append(job.sourceFile()).append(':').append(job.lineNumber());
    sb.append('\n');
    sb.append("    Duration: ~").append(job.estimatedDurationMinutes()).append(" min\n");
    if (!job.tags().isEmpty()) {
      sb.append("    Tags: ").append(String.join(", ", job.tags())).append('\n');
    }
  }
}
