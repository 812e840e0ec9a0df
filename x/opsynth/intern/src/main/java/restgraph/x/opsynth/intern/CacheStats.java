package restgraph.x.opsynth.intern;

/**
 * Counters of a {@link NodeInterningCache} since its last reset.
 *
 * @param hits lookups answered with an already cached instance
 * @param misses lookups that stored the offered node as the canonical instance
 * @param collisions approximate signature matches rejected by exact verification
 * @param size number of canonical instances currently held
 */
public record CacheStats(long hits, long misses, long collisions, int size) {

  /** Returns the share of lookups answered from the cache, or 0 when there were none. */
  public double hitRate() {
    long lookups = hits + misses + collisions;
    return lookups == 0 ? 0d : (double) hits / lookups;
  }
}
