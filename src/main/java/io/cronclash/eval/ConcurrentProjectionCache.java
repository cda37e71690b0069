package io.cronclash.eval;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/** Unbounded in-memory {@link ProjectionCache}, scoped to whoever holds the instance. */
public final class ConcurrentProjectionCache implements ProjectionCache {
  private final Map<ProjectionKey, List<Instant>> entries = new ConcurrentHashMap<>();

  @Override
  public List<Instant> get(ProjectionKey key, Supplier<List<Instant>> projection) {
    return entries.computeIfAbsent(key, k -> List.copyOf(projection.get()));
  }

  /**
   * Returns the number of cached projections.
   *
   * @return the entry count
   */
  public int size() {
    return entries.size();
  }

  /** Drops all cached projections. */
  public void clear() {
    entries.clear();
  }
}
