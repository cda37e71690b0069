package io.cronclash.discovery;

import io.cronclash.conflict.ScheduledJob;
import java.util.List;

/** Finds scheduled jobs in a blob of source text. */
@FunctionalInterface
public interface JobDiscovery {

  /**
   * Discovers the jobs defined in a file's content.
   *
   * @param sourceFile the file the content came from, recorded as provenance
   * @param content the full text of the file
   * @return the jobs found, in line order; empty if none
   */
  List<ScheduledJob> discover(String sourceFile, String content);
}
