package restgraph.x.opsynth.intern;

import graphql.language.Node;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Canonicalizing store for graphql-java AST nodes.
 *
 * <p>{@link #intern(Node)} maps a node to the single instance held for its {@link NodeKind} and
 * structural signature, so structurally equal subtrees built repeatedly (for example an {@code {
 * id }} selection built once per request) share one instance. Lookups are partitioned by kind, so
 * equal signature text can never equate nodes of unrelated kinds.
 *
 * <p>Signatures are bounded by {@link StructuralHasher#MAX_DEPTH}. When a match relied on the
 * reduced digest of a deep subtree, the two candidates are compared by exact digest first; if they
 * differ, the offered node is returned as is, is not cached, and the collision is counted.
 *
 * <p>A cache may be private to one synthesis call or shared across calls and threads; all methods
 * are synchronized. Owners of a long-lived cache should {@link #reset()} it whenever the schema
 * changes so canonical instances of a retired schema are released.
 */
public final class NodeInterningCache {

  private static final Logger logger = LoggerFactory.getLogger(NodeInterningCache.class);

  private final StructuralHasher hasher = new StructuralHasher();
  private final Map<NodeKind, Map<String, Node<?>>> partitions = new EnumMap<>(NodeKind.class);

  private long hits;
  private long misses;
  private long collisions;

  /**
   * Returns the canonical instance for a node, storing the node itself when none exists yet.
   *
   * @param node the freshly built node
   * @param <T> the node class; a canonical instance always has the same class as the offered node
   * @return the canonical instance
   * @throws IllegalArgumentException if the node is not part of an executable document
   */
  public synchronized <T extends Node<?>> T intern(T node) {
    StructuralHasher.Signature signature = hasher.signature(node);
    Map<String, Node<?>> partition =
        partitions.computeIfAbsent(signature.kind(), kind -> new HashMap<>());
    String key = signature.key();
    Node<?> cached = partition.get(key);
    if (cached == null) {
      partition.put(key, node);
      misses++;
      return node;
    }
    if (cached == node) {
      hits++;
      return node;
    }
    if (cached.getClass() != node.getClass()
        || (signature.approximate()
            && !hasher.merkleDigest(cached).equals(hasher.merkleDigest(node)))) {
      collisions++;
      logger.debug(
          "Signature collision for {} node {}; keeping the new instance uncached",
          signature.kind(),
          node.getClass().getSimpleName());
      hasher.forget(node);
      return node;
    }
    hits++;
    hasher.forget(node);
    // cached has the class of node, checked above
    @SuppressWarnings("unchecked")
    T canonical = (T) cached;
    return canonical;
  }

  /** Returns true when this exact instance is the canonical one held for its signature. */
  public synchronized boolean isCanonical(Node<?> node) {
    Map<String, Node<?>> partition = partitions.get(NodeKind.of(node));
    return partition != null && partition.get(hasher.transientSignature(node).key()) == node;
  }

  /** Returns the number of canonical instances held across all kinds. */
  public synchronized int size() {
    int size = 0;
    for (Map<String, Node<?>> partition : partitions.values()) {
      size += partition.size();
    }
    return size;
  }

  /** Returns the number of canonical instances held for one kind. */
  public synchronized int size(NodeKind kind) {
    Map<String, Node<?>> partition = partitions.get(kind);
    return partition == null ? 0 : partition.size();
  }

  /** Returns a snapshot of the counters. */
  public synchronized CacheStats stats() {
    return new CacheStats(hits, misses, collisions, size());
  }

  /** Releases every canonical instance and memoized digest, and zeroes the counters. */
  public synchronized void reset() {
    logger.debug("Resetting node cache holding {} canonical nodes", size());
    partitions.clear();
    hasher.clear();
    hits = 0;
    misses = 0;
    collisions = 0;
  }

  int memoizedDigestCount() {
    return hasher.memoizedCount();
  }
}
