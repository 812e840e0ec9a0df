package restgraph.x.opsynth.synth;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Which fields of a selection set to include.
 *
 * <p>A selected-fields value is either boolean, selecting every field below it and honouring the
 * numeric depth limit, or a tree naming the fields to include. A tree overrides the depth limit for
 * the paths it covers; a field it does not name, or maps to {@link #none()}, is left out.
 */
public final class SelectedFields {

  private static final SelectedFields ALL = new SelectedFields(true, null);
  private static final SelectedFields NONE = new SelectedFields(false, null);

  private final boolean enabled;
  private final @Nullable Map<String, SelectedFields> children;

  private SelectedFields(boolean enabled, @Nullable Map<String, SelectedFields> children) {
    this.enabled = enabled;
    this.children = children;
  }

  /** Selects every field, down to the depth limit. */
  public static SelectedFields all() {
    return ALL;
  }

  /** Selects nothing; meaningful as a value inside a {@link #tree(Map)}. */
  public static SelectedFields none() {
    return NONE;
  }

  /**
   * Selects exactly the named fields, each with its own nested selection.
   *
   * @param children nested selections keyed by field name
   * @return the tree
   */
  public static SelectedFields tree(Map<String, SelectedFields> children) {
    return new SelectedFields(true, Collections.unmodifiableMap(new LinkedHashMap<>(children)));
  }

  /**
   * Converts a JSON-like structure, as decoded from a request, into a selection. Values must be
   * {@link Boolean} or nested maps.
   *
   * @param tree the decoded structure
   * @return the equivalent selection tree
   * @throws IllegalArgumentException if a value is neither a boolean nor a map
   */
  public static SelectedFields fromMap(Map<String, ?> tree) {
    Map<String, SelectedFields> children = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : tree.entrySet()) {
      Object value = entry.getValue();
      if (value instanceof Boolean selected) {
        children.put(entry.getKey(), selected ? ALL : NONE);
      } else if (value instanceof Map<?, ?> nested) {
        children.put(entry.getKey(), fromMap(asStringKeyed(entry.getKey(), nested)));
      } else {
        throw new IllegalArgumentException(
            "Selected field '"
                + entry.getKey()
                + "' must be a boolean or an object, got: "
                + value);
      }
    }
    return tree(children);
  }

  /** Returns true when this value is an explicit tree rather than a boolean. */
  public boolean isTree() {
    return children != null;
  }

  /**
   * Resolves the selection for one field of the selection set this value applies to.
   *
   * @param fieldName the field name
   * @return the nested selection, or null when the field is not selected
   */
  public @Nullable SelectedFields select(String fieldName) {
    if (children == null) {
      return ALL;
    }
    SelectedFields child = children.get(fieldName);
    if (child == null || (!child.isTree() && !child.enabled)) {
      return null;
    }
    return child;
  }

  private static Map<String, ?> asStringKeyed(String fieldName, Map<?, ?> nested) {
    Map<String, Object> result = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : nested.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(
            "Selected fields below '" + fieldName + "' must be keyed by field name");
      }
      result.put(key, entry.getValue());
    }
    return result;
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SelectedFields other)) {
      return false;
    }
    return enabled == other.enabled && Objects.equals(children, other.children);
  }

  @Override
  public int hashCode() {
    return Objects.hash(enabled, children);
  }

  @Override
  public String toString() {
    if (children == null) {
      return Boolean.toString(enabled);
    }
    return children.toString();
  }
}
