package restgraph.x.opsynth.synth;

import graphql.language.VariableDefinition;
import graphql.schema.GraphQLSchema;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;
import restgraph.x.opsynth.intern.NodeInterningCache;

/**
 * Mutable state of a single synthesis call: the ancestor and field paths of the branch being
 * expanded, the variables collected so far and the return type last seen at each field path. One
 * context is created per call and discarded afterwards.
 */
final class SynthesisContext {

  private final GraphQLSchema schema;
  private final SynthesisOptions options;
  private final NodeInterningCache cache;
  private final Set<String> rootTypeNames;
  private final CircularReferenceGuard ancestors = new CircularReferenceGuard();
  private final List<String> path = new ArrayList<>();
  private final List<VariableDefinition> variables = new ArrayList<>();
  private final Map<String, String> variableOrigins = new HashMap<>();
  private final Map<String, String> fieldTypes = new HashMap<>();

  SynthesisContext(GraphQLSchema schema, SynthesisOptions options, NodeInterningCache cache) {
    this.schema = schema;
    this.options = options;
    this.cache = cache;
    this.rootTypeNames = RootTypes.rootTypeNames(schema);
  }

  GraphQLSchema schema() {
    return schema;
  }

  SynthesisOptions options() {
    return options;
  }

  NodeInterningCache cache() {
    return cache;
  }

  CircularReferenceGuard ancestors() {
    return ancestors;
  }

  boolean isRootType(String typeName) {
    return rootTypeNames.contains(typeName);
  }

  void pushPath(String fieldName) {
    path.add(fieldName);
  }

  void popPath() {
    path.remove(path.size() - 1);
  }

  List<String> path() {
    return List.copyOf(path);
  }

  @Nullable String lastPathSegment() {
    return path.isEmpty() ? null : path.get(path.size() - 1);
  }

  /** Key identifying the current field path for alias bookkeeping. */
  String fieldPathKey() {
    return String.join(".", path);
  }

  /** Variable name for an argument of the field on top of the path. */
  String qualifiedArgumentName(String argumentName) {
    if (path.isEmpty()) {
      return argumentName;
    }
    return String.join("_", path) + "_" + argumentName;
  }

  /**
   * Records the return type seen at the current field path.
   *
   * @return the type recorded for the path before, or null on the first visit
   */
  @Nullable String recordFieldType(String typeString) {
    return fieldTypes.put(fieldPathKey(), typeString);
  }

  /**
   * Registers a variable under the preferred name, or under a suffixed name when the preferred
   * one already stands for a different argument. Registering the same argument again returns the
   * name it was registered under.
   *
   * @param preferredName the name derived from the field path
   * @param origin identifies the argument: its field path, name and input type
   * @param factory builds the definition for the name finally chosen
   * @return the variable name to reference
   */
  String registerVariable(
      String preferredName, String origin, Function<String, VariableDefinition> factory) {
    String name = preferredName;
    for (int suffix = 2; ; suffix++) {
      String existing = variableOrigins.get(name);
      if (existing == null) {
        variableOrigins.put(name, origin);
        variables.add(factory.apply(name));
        return name;
      }
      if (existing.equals(origin)) {
        return name;
      }
      name = preferredName + "_" + suffix;
    }
  }

  /**
   * Returns the registered variables the finished operation references, in registration order.
   * Variables registered for a field that was dropped afterwards, because its selection set came
   * out empty, are left out.
   */
  List<VariableDefinition> variableDefinitions(Set<String> referenced) {
    List<VariableDefinition> used = new ArrayList<>(variables.size());
    for (VariableDefinition variable : variables) {
      if (referenced.contains(variable.getName())) {
        used.add(variable);
      }
    }
    return used;
  }
}
