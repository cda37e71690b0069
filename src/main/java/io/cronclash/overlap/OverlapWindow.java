package io.cronclash.overlap;

/**
 * The first pair of intersecting running windows found for two schedules.
 *
 * @param first the window of the first schedule
 * @param second the window of the second schedule
 */
public record OverlapWindow(Interval first, Interval second) {}
