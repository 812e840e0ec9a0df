package restgraph.x.opsynth.synth;

import graphql.language.OperationDefinition;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLSchema;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/** Lookups of a schema's root operation types. */
public final class RootTypes {

  private RootTypes() {
    // Static utility class
  }

  /**
   * Returns the names of the query, mutation and subscription types the schema defines.
   *
   * @param schema the schema
   * @return the defined root type names, query first
   */
  public static Set<String> rootTypeNames(GraphQLSchema schema) {
    Set<String> names = new LinkedHashSet<>();
    for (OperationDefinition.Operation kind : OperationDefinition.Operation.values()) {
      GraphQLObjectType rootType = rootType(schema, kind);
      if (rootType != null) {
        names.add(rootType.getName());
      }
    }
    return names;
  }

  /**
   * Returns the root type for an operation kind.
   *
   * @param schema the schema
   * @param kind the operation kind
   * @return the root type, or null when the schema does not support the operation kind
   */
  public static @Nullable GraphQLObjectType rootType(
      GraphQLSchema schema, OperationDefinition.Operation kind) {
    return switch (kind) {
      case QUERY -> schema.getQueryType();
      case MUTATION -> schema.getMutationType();
      case SUBSCRIPTION -> schema.getSubscriptionType();
    };
  }

  /**
   * Returns the root type for an operation kind, which must exist.
   *
   * @param schema the schema
   * @param kind the operation kind
   * @return the root type
   * @throws IllegalArgumentException if the schema does not define a root type for the kind
   */
  public static GraphQLObjectType definedRootType(
      GraphQLSchema schema, OperationDefinition.Operation kind) {
    GraphQLObjectType rootType = rootType(schema, kind);
    if (rootType == null) {
      throw new IllegalArgumentException(
          "Root type " + kind.name().toLowerCase(Locale.ROOT) + " not defined");
    }
    return rootType;
  }
}
