package restgraph.x.opsynth.synth;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Options controlling how an operation is synthesized.
 *
 * @param models type names collapsed to an {@code { id }} selection when reached below the root
 * @param ignore type names, or {@code Type.field} coordinates, exempt from model collapsing
 * @param depthLimit deepest selection set expanded with boolean selected fields; 0 means no limit
 * @param circularReferenceDepth how often a type may appear on one ancestor path
 * @param argNames variable names of the arguments to expose, or null to expose all
 * @param selectedFields which fields of the root field's selection set to include
 */
public record SynthesisOptions(
    List<String> models,
    List<String> ignore,
    int depthLimit,
    int circularReferenceDepth,
    @Nullable Set<String> argNames,
    SelectedFields selectedFields) {

  /** Depth limit meaning "no limit". */
  public static final int UNBOUNDED = Integer.MAX_VALUE;

  public SynthesisOptions {
    if (depthLimit < 0) {
      throw new IllegalArgumentException("depthLimit must not be negative: " + depthLimit);
    }
    if (circularReferenceDepth < 1) {
      throw new IllegalArgumentException(
          "circularReferenceDepth must be at least 1: " + circularReferenceDepth);
    }
    if (depthLimit == 0) {
      depthLimit = UNBOUNDED;
    }
    models = List.copyOf(models);
    ignore = List.copyOf(ignore);
    argNames = argNames == null ? null : Set.copyOf(argNames);
  }

  /** Returns the options with every default applied. */
  public static SynthesisOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns true when the type collapses to its identifier below the root. */
  public boolean isModel(String typeName) {
    return models.contains(typeName);
  }

  /** Returns true when a type name or {@code Type.field} coordinate is on the ignore list. */
  public boolean isIgnored(String typeNameOrCoordinate) {
    return ignore.contains(typeNameOrCoordinate);
  }

  /** Returns true when the argument bound to this variable name may be exposed. */
  public boolean allowsArgument(String variableName) {
    return argNames == null || argNames.contains(variableName);
  }

  /** Returns a builder preloaded with these options. */
  public Builder toBuilder() {
    Builder builder =
        new Builder()
            .models(models)
            .ignore(ignore)
            .depthLimit(depthLimit)
            .circularReferenceDepth(circularReferenceDepth)
            .selectedFields(selectedFields);
    if (argNames != null) {
      builder.argNames(argNames);
    }
    return builder;
  }

  /** Builder for {@link SynthesisOptions}. */
  public static final class Builder {
    private final List<String> models = new ArrayList<>();
    private final List<String> ignore = new ArrayList<>();
    private int depthLimit = UNBOUNDED;
    private int circularReferenceDepth = 1;
    private @Nullable Set<String> argNames;
    private SelectedFields selectedFields = SelectedFields.all();

    private Builder() {}

    public Builder models(Collection<String> models) {
      this.models.addAll(models);
      return this;
    }

    public Builder models(String... models) {
      return models(List.of(models));
    }

    public Builder ignore(Collection<String> ignore) {
      this.ignore.addAll(ignore);
      return this;
    }

    public Builder ignore(String... ignore) {
      return ignore(List.of(ignore));
    }

    public Builder depthLimit(int depthLimit) {
      this.depthLimit = depthLimit;
      return this;
    }

    public Builder circularReferenceDepth(int circularReferenceDepth) {
      this.circularReferenceDepth = circularReferenceDepth;
      return this;
    }

    /** Restricts the exposed arguments to these variable names. */
    public Builder argNames(Collection<String> argNames) {
      if (this.argNames == null) {
        this.argNames = new LinkedHashSet<>();
      }
      this.argNames.addAll(argNames);
      return this;
    }

    public Builder argNames(String... argNames) {
      return argNames(List.of(argNames));
    }

    public Builder selectedFields(SelectedFields selectedFields) {
      this.selectedFields = selectedFields;
      return this;
    }

    /**
     * Builds the options.
     *
     * @throws IllegalArgumentException if the depth limit is negative or the circular reference
     *     depth is below 1
     */
    public SynthesisOptions build() {
      return new SynthesisOptions(
          models, ignore, depthLimit, circularReferenceDepth, argNames, selectedFields);
    }
  }
}
