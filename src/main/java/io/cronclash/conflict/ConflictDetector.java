package io.cronclash.conflict;

import io.cronclash.overlap.IntervalOverlapEngine;
import io.cronclash.overlap.OverlapWindow;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compares every unordered pair of jobs and collects the classified overlaps.
 *
 * <p>Pairs {@code (i, j)} with {@code i < j} are visited in input order, so the output order is
 * stable for a given input. Each pair is checked with the longer of the two estimated durations.
 * The anchor instant is read from the clock once per {@link #detect(List)} call and shared by all
 * pairs.
 */
public final class ConflictDetector {
  private static final Logger log = LoggerFactory.getLogger(ConflictDetector.class);

  private final IntervalOverlapEngine engine;
  private final ConflictClassifier classifier;
  private final Clock clock;

  /**
   * Creates a detector anchored at the system UTC clock.
   *
   * @param engine the overlap engine
   * @param classifier the severity classifier
   */
  public ConflictDetector(IntervalOverlapEngine engine, ConflictClassifier classifier) {
    this(engine, classifier, Clock.systemUTC());
  }

  /**
   * Creates a detector.
   *
   * @param engine the overlap engine
   * @param classifier the severity classifier
   * @param clock the source of the anchor instant
   */
  public ConflictDetector(
      IntervalOverlapEngine engine, ConflictClassifier classifier, Clock clock) {
    this.engine = engine;
    this.classifier = classifier;
    this.clock = clock;
  }

  /**
   * Detects conflicts anchored at the current instant of the detector's clock.
   *
   * @param jobs the jobs in input order
   * @return the conflicts in pair-visiting order
   */
  public List<ScheduleConflict> detect(List<ScheduledJob> jobs) {
    return detect(jobs, clock.instant());
  }

  /**
   * Detects conflicts anchored at the given instant.
   *
   * @param jobs the jobs in input order
   * @param anchor the instant all projections start from
   * @return the conflicts in pair-visiting order
   */
  public List<ScheduleConflict> detect(List<ScheduledJob> jobs, Instant anchor) {
    List<ScheduleConflict> conflicts = new ArrayList<>();
    for (int i = 0; i < jobs.size(); i++) {
      ScheduledJob job1 = jobs.get(i);
      for (int j = i + 1; j < jobs.size(); j++) {
        ScheduledJob job2 = jobs.get(j);
        int duration =
            Math.max(job1.estimatedDurationMinutes(), job2.estimatedDurationMinutes());
        Optional<OverlapWindow> window =
            engine.findOverlap(job1.schedule(), job2.schedule(), duration, anchor);
        if (window.isPresent()) {
          ScheduleConflict conflict = classifier.classify(job1, job2);
          log.debug(
              "{} conflict between '{}' and '{}' at {}",
              conflict.severity(),
              job1.name(),
              job2.name(),
              window.get().first());
          conflicts.add(conflict);
        }
      }
    }
    return List.copyOf(conflicts);
  }
}
