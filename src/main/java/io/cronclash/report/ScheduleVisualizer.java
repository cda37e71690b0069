package io.cronclash.report;

import io.cronclash.conflict.ScheduledJob;
import io.cronclash.eval.OccurrenceProjector;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Draws a 24-hour grid with one row per job.
 *
 * <p>A row marks the hours covered by the job's next run, assuming it lasts {@code duration / 60}
 * hours (at least one). Runs are not wrapped past midnight. Jobs whose schedule cannot be
 * projected get an empty row.
 */
public final class ScheduleVisualizer {
  private static final int NAME_WIDTH = 20;
  private static final int HOURS = 24;

  private ScheduleVisualizer() {}

  /**
   * Renders the grid.
   *
   * @param jobs the jobs to draw, in row order
   * @param projector projects each job's next run
   * @param anchor the instant to project from
   * @return the grid text
   */
  public static String renderDaily(
      List<ScheduledJob> jobs, OccurrenceProjector projector, Instant anchor) {
    StringBuilder sb = new StringBuilder();
    sb.append("\nDaily Schedule (24-hour view)\n");
    sb.append("=".repeat(60)).append('\n');

    sb.append(String.format("%-" + NAME_WIDTH + "s ", "Hour:"));
    for (int h = 0; h < HOURS; h++) {
      sb.append(String.format("%2d", h));
    }
    sb.append('\n');
    sb.append(" ".repeat(NAME_WIDTH + 1)).append("-".repeat(HOURS * 2)).append('\n');

    for (ScheduledJob job : jobs) {
      sb.append(String.format("%-" + NAME_WIDTH + "s ", truncate(job.name())));
      char[] row = row(job, projector, anchor);
      for (char cell : row) {
        sb.append(' ').append(cell);
      }
      sb.append('\n');
    }

    sb.append('\n');
    sb.append("Legend: # = scheduled job, . = idle\n");
    return sb.toString();
  }

  /**
   * Computes the hour cells of one job.
   *
   * @param job the job
   * @param projector projects the job's next run
   * @param anchor the instant to project from
   * @return 24 cells, {@code '#'} for busy hours and {@code '.'} for idle ones
   */
  static char[] row(ScheduledJob job, OccurrenceProjector projector, Instant anchor) {
    char[] row = new char[HOURS];
    Arrays.fill(row, '.');
    List<Instant> runs = projector.project(job.schedule(), anchor, 1);
    if (runs.isEmpty()) {
      return row;
    }
    int start = runs.get(0).atZone(projector.zone()).getHour();
    int hours = Math.max(1, job.estimatedDurationMinutes() / 60);
    for (int h = start; h < Math.min(HOURS, start + hours); h++) {
      row[h] = '#';
    }
    return row;
  }

  private static String truncate(String name) {
    return name.length() <= NAME_WIDTH ? name : name.substring(0, NAME_WIDTH);
  }
}
