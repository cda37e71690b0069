package io.cronclash.discovery;

import io.cronclash.CronClashException;
import io.cronclash.conflict.ScheduledJob;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Maps exact file names to the job each such file is assumed to define. */
public final class KnownJobRegistry {
  private static final Logger log = LoggerFactory.getLogger(KnownJobRegistry.class);

  private final Map<String, KnownJob> entries;

  /**
   * Creates a registry. Iteration follows the map's order.
   *
   * @param entries file name to job definition
   */
  public KnownJobRegistry(Map<String, KnownJob> entries) {
    this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
  }

  /**
   * Returns a registry with no entries.
   *
   * @return an empty registry
   */
  public static KnownJobRegistry empty() {
    return new KnownJobRegistry(Map.of());
  }

  /**
   * Returns the built-in registry of the platform's backup and pruning jobs.
   *
   * @return the default registry
   */
  public static KnownJobRegistry defaults() {
    Map<String, KnownJob> known = new LinkedHashMap<>();
    known.put(
        "backup_scheduler.py",
        new KnownJob("Daily Backup", "0 2 * * *", 60, true, List.of("backup", "io-intensive")));
    known.put(
        "prune_backups.py",
        new KnownJob("Backup Pruning", "0 3 * * *", 30, true, List.of("cleanup", "io-intensive")));
    return new KnownJobRegistry(known);
  }

  /**
   * Looks up the definition for a file name.
   *
   * @param fileName the bare file name, without directories
   * @return the definition, or empty if the name is not known
   */
  public Optional<KnownJob> lookup(String fileName) {
    return Optional.ofNullable(entries.get(fileName));
  }

  /**
   * Builds the job for a file, if its name is known.
   *
   * @param sourceFile the path to record as provenance
   * @param fileName the bare file name
   * @return the job, or empty if the name is unknown or its cron text is malformed
   */
  public Optional<ScheduledJob> jobFor(String sourceFile, String fileName) {
    Optional<KnownJob> known = lookup(fileName);
    if (known.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(known.get().toJob(sourceFile, fileName));
    } catch (CronClashException e) {
      log.warn("Skipping known job for {}: {}", fileName, e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Builds every registered job, attributing each to {@code dirPrefix/fileName}.
   *
   * @param dirPrefix the directory to record in provenance
   * @return the jobs in registry order
   */
  public List<ScheduledJob> allJobs(String dirPrefix) {
    List<ScheduledJob> jobs = new ArrayList<>();
    for (String fileName : entries.keySet()) {
      jobFor(dirPrefix + "/" + fileName, fileName).ifPresent(jobs::add);
    }
    return jobs;
  }

  /**
   * Returns the registered file names and definitions.
   *
   * @return an unmodifiable view of the entries
   */
  public Map<String, KnownJob> entries() {
    return entries;
  }
}
