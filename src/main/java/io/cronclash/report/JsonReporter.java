package io.cronclash.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.cronclash.CheckResult;
import io.cronclash.CronClashException;
import io.cronclash.conflict.ScheduleConflict;
import io.cronclash.conflict.ScheduledJob;

/**
 * Renders a check result as a JSON document for CI consumption.
 *
 * <p>Layout:
 *
 * <pre>
 * {
 *   "timestamp": "2024-01-01T01:00:00Z",
 *   "summary": {"jobs_found": 2, "conflicts_found": 1, "errors": 1, "warnings": 0},
 *   "jobs": [{"name", "schedule", "source_file", "line_number", "duration_minutes",
 *             "resource_intensive", "tags"}],
 *   "conflicts": [{"severity", "message", "job1", "job2"}]
 * }
 * </pre>
 *
 * <p>The timestamp is the anchor the check ran at.
 */
public final class JsonReporter {
  private static final ObjectMapper MAPPER =
      new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  private JsonReporter() {}

  /**
   * Builds the report tree.
   *
   * @param result the check result
   * @return the report as a JSON object
   */
  public static ObjectNode toTree(CheckResult result) {
    ObjectNode root = MAPPER.createObjectNode();
    root.put("timestamp", result.anchor().toString());

    ObjectNode summary = root.putObject("summary");
    summary.put("jobs_found", result.jobs().size());
    summary.put("conflicts_found", result.conflicts().size());
    summary.put("errors", result.errors());
    summary.put("warnings", result.warnings());

    ArrayNode jobs = root.putArray("jobs");
    for (ScheduledJob job : result.jobs()) {
      ObjectNode node = jobs.addObject();
      node.put("name", job.name());
      node.put("schedule", job.schedule().raw());
      node.put("source_file", job.sourceFile());
      node.put("line_number", job.lineNumber());
      node.put("duration_minutes", job.estimatedDurationMinutes());
      node.put("resource_intensive", job.resourceIntensive());
      ArrayNode tags = node.putArray("tags");
      job.tags().forEach(tags::add);
    }

    ArrayNode conflicts = root.putArray("conflicts");
    for (ScheduleConflict conflict : result.conflicts()) {
      ObjectNode node = conflicts.addObject();
      node.put("severity", conflict.severity().value());
      node.put("message", conflict.message());
      node.put("job1", conflict.job1().name());
      node.put("job2", conflict.job2().name());
    }
    return root;
  }

  /**
   * Renders the report as pretty-printed JSON.
   *
   * @param result the check result
   * @return the JSON text
   * @throws CronClashException if serialization fails
   */
  public static String render(CheckResult result) throws CronClashException {
    try {
      return MAPPER.writeValueAsString(toTree(result));
    } catch (JsonProcessingException e) {
      throw CronClashException.report("could not serialize report: " + e.getOriginalMessage(), e);
    }
  }
}
