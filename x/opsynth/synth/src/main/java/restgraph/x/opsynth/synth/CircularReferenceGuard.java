package restgraph.x.opsynth.synth;

import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLScalarType;
import java.util.ArrayList;
import java.util.List;

/**
 * The stack of types on the branch currently being expanded, used to stop expanding a type that
 * already occurs on that branch too often.
 *
 * <p>Every {@link #push} is paired with a {@link #pop} on all exit paths, so sibling branches,
 * including the members of a union or interface fan-out, never see each other's ancestors.
 */
public final class CircularReferenceGuard {

  private final List<GraphQLNamedType> ancestors = new ArrayList<>();

  public void push(GraphQLNamedType type) {
    ancestors.add(type);
  }

  /**
   * Removes the most recently pushed type.
   *
   * @throws IllegalStateException if nothing was pushed
   */
  public void pop() {
    if (ancestors.isEmpty()) {
      throw new IllegalStateException("Ancestor path is empty");
    }
    ancestors.remove(ancestors.size() - 1);
  }

  /**
   * Checks whether the type on top of the path occurs on it more often than allowed. Scalars
   * cannot recurse and are never circular.
   *
   * @param threshold the maximum number of occurrences allowed
   * @return true when the branch must be truncated
   */
  public boolean isCircular(int threshold) {
    if (ancestors.isEmpty()) {
      return false;
    }
    GraphQLNamedType top = ancestors.get(ancestors.size() - 1);
    if (top instanceof GraphQLScalarType) {
      return false;
    }
    int occurrences = 0;
    for (GraphQLNamedType ancestor : ancestors) {
      if (ancestor.getName().equals(top.getName())) {
        occurrences++;
      }
    }
    return occurrences > threshold;
  }

  /**
   * Checks whether descending into a type would make the path circular, leaving the path as it
   * was.
   *
   * @param type the type about to be expanded
   * @param threshold the maximum number of occurrences allowed
   * @return true when the descent must be skipped
   */
  public boolean wouldBeCircular(GraphQLNamedType type, int threshold) {
    push(type);
    try {
      return isCircular(threshold);
    } finally {
      pop();
    }
  }

  /** Returns the number of types on the path. */
  public int depth() {
    return ancestors.size();
  }
}
