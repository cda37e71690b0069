package io.cronclash.discovery;

import io.cronclash.CronClashException;
import io.cronclash.conflict.ScheduledJob;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads source files from disk and turns them into jobs.
 *
 * <p>For each file the registry is consulted first by bare file name, then the content is handed
 * to the {@link JobDiscovery}. A discovered job with the same cron text as the file's registry job
 * is dropped, since it describes the same schedule. A file that cannot be read contributes no jobs.
 */
public final class SourceScanner {
  private static final Logger log = LoggerFactory.getLogger(SourceScanner.class);

  /** Extension of the files scanned when walking a directory. */
  public static final String SOURCE_SUFFIX = ".py";

  private final KnownJobRegistry registry;
  private final JobDiscovery discovery;

  /**
   * Creates a scanner.
   *
   * @param registry the known-job registry
   * @param discovery the text discovery
   */
  public SourceScanner(KnownJobRegistry registry, JobDiscovery discovery) {
    this.registry = registry;
    this.discovery = discovery;
  }

  /**
   * Scans a single file.
   *
   * @param file the file to scan
   * @return the jobs found, registry job first
   */
  public List<ScheduledJob> scanFile(Path file) {
    String content;
    try {
      content = Files.readString(file);
    } catch (IOException | UncheckedIOException e) {
      log.warn("Could not read {}: {}", file, e.getMessage());
      return List.of();
    }

    String sourceFile = file.toString();
    Path fileName = file.getFileName();
    List<ScheduledJob> jobs = new ArrayList<>();
    Optional<ScheduledJob> known =
        fileName == null ? Optional.empty() : registry.jobFor(sourceFile, fileName.toString());
    known.ifPresent(jobs::add);

    for (ScheduledJob job : discovery.discover(sourceFile, content)) {
      if (known.isPresent() && sameSchedule(known.get(), job)) {
        log.debug("{}:{} repeats the known schedule", sourceFile, job.lineNumber());
        continue;
      }
      jobs.add(job);
    }
    return jobs;
  }

  /**
   * Scans every {@code .py} file below a directory, in path order.
   *
   * @param dir the directory to walk
   * @return the jobs found; empty if the directory does not exist
   * @throws CronClashException if the directory exists but cannot be walked
   */
  public List<ScheduledJob> scanDirectory(Path dir) throws CronClashException {
    if (!Files.isDirectory(dir)) {
      return List.of();
    }
    List<Path> files;
    try (Stream<Path> walk = Files.walk(dir)) {
      files =
          walk.filter(Files::isRegularFile)
              .filter(p -> p.getFileName().toString().endsWith(SOURCE_SUFFIX))
              .sorted()
              .collect(Collectors.toList());
    } catch (IOException | UncheckedIOException e) {
      throw CronClashException.discovery("could not walk " + dir + ": " + e.getMessage(), e);
    }
    return scanAll(files);
  }

  /**
   * Scans the files a glob names.
   *
   * <p>A glob without wildcard characters is a literal path, resolved against {@code base} unless
   * it is absolute; a directory is scanned like {@link #scanDirectory(Path)}. Otherwise only the
   * glob's leading literal directory is walked, and the remaining pattern is matched against paths
   * relative to it. Matches are scanned in path order.
   *
   * @param base the directory relative globs are resolved against
   * @param glob the glob, e.g. {@code press/cron/*.py}
   * @return the jobs found
   * @throws CronClashException if the directory to search cannot be walked
   */
  public List<ScheduledJob> scanGlob(Path base, String glob) throws CronClashException {
    List<String> segments = List.of(glob.split("/", -1));
    int fixed = 0;
    while (fixed < segments.size() && !hasWildcard(segments.get(fixed))) {
      fixed++;
    }

    if (fixed == segments.size()) {
      Path target = base.resolve(glob);
      if (Files.isDirectory(target)) {
        return scanDirectory(target);
      }
      if (!Files.isRegularFile(target)) {
        log.warn("No files match {}", glob);
        return List.of();
      }
      return scanFile(target);
    }

    String prefix = String.join("/", segments.subList(0, fixed));
    Path root = fixed == 0 ? base : base.resolve(prefix.isEmpty() ? "/" : prefix);
    if (!Files.isDirectory(root)) {
      log.warn("No files match {}", glob);
      return List.of();
    }
    PathMatcher matcher =
        FileSystems.getDefault()
            .getPathMatcher("glob:" + String.join("/", segments.subList(fixed, segments.size())));
    List<Path> files;
    try (Stream<Path> walk = Files.walk(root)) {
      files =
          walk.filter(Files::isRegularFile)
              .filter(p -> matcher.matches(root.relativize(p)))
              .sorted()
              .collect(Collectors.toList());
    } catch (IOException | UncheckedIOException e) {
      throw CronClashException.discovery("could not walk " + root + ": " + e.getMessage(), e);
    }
    if (files.isEmpty()) {
      log.warn("No files match {}", glob);
    }
    return scanAll(files);
  }

  /**
   * Returns every registry job, attributed to files under {@code dirPrefix}.
   *
   * @param dirPrefix the directory to record in provenance
   * @return the registry jobs
   */
  public List<ScheduledJob> registryFallback(String dirPrefix) {
    return registry.allJobs(dirPrefix);
  }

  private List<ScheduledJob> scanAll(List<Path> files) {
    List<ScheduledJob> jobs = new ArrayList<>();
    for (Path file : files) {
      jobs.addAll(scanFile(file));
    }
    return jobs;
  }

  private static boolean hasWildcard(String segment) {
    return segment.chars().anyMatch(c -> c == '*' || c == '?' || c == '[' || c == '{');
  }

  private static boolean sameSchedule(ScheduledJob a, ScheduledJob b) {
    return a.schedule().fields().equals(b.schedule().fields());
  }
}
