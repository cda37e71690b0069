package io.cronclash.eval;

import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

/** Memoizes projected occurrences. Implementations must be safe for concurrent use. */
public interface ProjectionCache {

  /**
   * Returns the cached occurrences for the key, computing and storing them if absent.
   *
   * @param key the projection key
   * @param projection computes the occurrences on a miss
   * @return the occurrences, never null
   */
  List<Instant> get(ProjectionKey key, Supplier<List<Instant>> projection);

  /**
   * Returns a cache that stores nothing.
   *
   * @return a pass-through cache
   */
  static ProjectionCache none() {
    return (key, projection) -> projection.get();
  }
}
