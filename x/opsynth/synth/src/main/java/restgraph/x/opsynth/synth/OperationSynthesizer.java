package restgraph.x.opsynth.synth;

import graphql.language.Argument;
import graphql.language.Document;
import graphql.language.Field;
import graphql.language.InlineFragment;
import graphql.language.OperationDefinition;
import graphql.language.Selection;
import graphql.language.SelectionSet;
import graphql.language.VariableReference;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLSchema;
import graphql.schema.GraphQLTypeUtil;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import restgraph.x.opsynth.intern.NodeInterningCache;

/**
 * Builds a complete GraphQL operation for one root field: the field with every reachable
 * sub-field selected and each exposed argument bound to an operation variable.
 *
 * <p>For the schema
 *
 * <pre>{@code
 * type Query { user(id: ID!): User }
 * type User { id: ID! name: String friends: [User] }
 * }</pre>
 *
 * synthesizing {@code user} as a query with {@code User} as a model yields
 *
 * <pre>{@code
 * query user_query($id: ID!) {
 *   user(id: $id) { id name friends { id } }
 * }
 * }</pre>
 *
 * <p>Each call keeps its working state to itself, so one synthesizer can serve concurrent calls.
 * The nodes it produces are canonicalized through its {@link NodeInterningCache}; sharing that
 * cache between synthesizers lets operations built from one schema share common subtrees.
 */
public class OperationSynthesizer {

  private static final Logger logger = LoggerFactory.getLogger(OperationSynthesizer.class);

  private final NodeInterningCache cache;

  /** Creates a synthesizer with a private node cache. */
  public OperationSynthesizer() {
    this(new NodeInterningCache());
  }

  /**
   * Creates a synthesizer interning its nodes into the given cache.
   *
   * @param cache the cache, possibly shared with other synthesizers
   */
  public OperationSynthesizer(NodeInterningCache cache) {
    this.cache = cache;
  }

  public NodeInterningCache cache() {
    return cache;
  }

  /**
   * Synthesizes the operation for a root field.
   *
   * @param schema the schema to read the type graph from
   * @param fieldName the root field to select
   * @param kind the operation kind, which selects the root type
   * @param options the synthesis options
   * @return the operation, named {@code <fieldName>_<kind>}
   * @throws IllegalArgumentException if the schema has no root type for the kind, the root type has
   *     no such field, the allow-list excludes a required argument of the root field, or the field
   *     has a composite type and none of its sub-fields survives the options
   */
  public OperationDefinition synthesize(
      GraphQLSchema schema,
      String fieldName,
      OperationDefinition.Operation kind,
      SynthesisOptions options) {
    OperationDefinition operation = synthesizeIfSelectable(schema, fieldName, kind, options);
    if (operation == null) {
      throw new IllegalArgumentException(
          "Nothing can be selected below "
              + RootTypes.definedRootType(schema, kind).getName()
              + "."
              + fieldName
              + " with the given options");
    }
    return operation;
  }

  /**
   * Synthesizes the operation for a root field, or returns null when the field has a composite
   * type and none of its sub-fields survives the options.
   *
   * @throws IllegalArgumentException if the schema has no root type for the kind, the root type has
   *     no such field, or the allow-list excludes a required argument of the root field
   */
  @Nullable OperationDefinition synthesizeIfSelectable(
      GraphQLSchema schema,
      String fieldName,
      OperationDefinition.Operation kind,
      SynthesisOptions options) {
    GraphQLObjectType rootType = RootTypes.definedRootType(schema, kind);
    GraphQLFieldDefinition field = rootType.getFieldDefinition(fieldName);
    if (field == null) {
      throw new IllegalArgumentException(
          "Field " + fieldName + " is not defined on " + rootType.getName());
    }

    SynthesisContext context = new SynthesisContext(schema, options, cache);
    ArgumentVariableBinder binder = new ArgumentVariableBinder(context);
    List<String> excluded = binder.excludedRequiredRootArguments(field);
    if (!excluded.isEmpty()) {
      throw new IllegalArgumentException(
          "Required arguments "
              + excluded
              + " of "
              + rootType.getName()
              + "."
              + fieldName
              + " are not in the argument allow-list");
    }
    binder.bindRootArguments(field);

    SchemaWalker walker = new SchemaWalker(context, binder);
    Field root =
        Objects.requireNonNull(
            walker.resolveField(rootType, field, true, options.selectedFields(), 0),
            "root field was dropped");
    if (root.getSelectionSet() == null
        && !SchemaWalker.isLeaf((GraphQLNamedType) GraphQLTypeUtil.unwrapAll(field.getType()))) {
      logger.debug("No sub-field of {}.{} is selectable", rootType.getName(), fieldName);
      return null;
    }

    OperationDefinition operation =
        cache.intern(
            OperationDefinition.newOperationDefinition()
                .operation(kind)
                .name(operationName(fieldName, kind))
                .variableDefinitions(context.variableDefinitions(referencedVariables(root)))
                .selectionSet(
                    cache.intern(
                        SelectionSet.newSelectionSet()
                            .selections(List.<Selection<?>>of(root))
                            .build()))
                .build());
    logger.debug(
        "Synthesized {} with {} variables; {}",
        operation.getName(),
        operation.getVariableDefinitions().size(),
        cache.stats());
    return operation;
  }

  /** Synthesizes with default options. */
  public OperationDefinition synthesize(
      GraphQLSchema schema, String fieldName, OperationDefinition.Operation kind) {
    return synthesize(schema, fieldName, kind, SynthesisOptions.defaults());
  }

  /**
   * Wraps an operation in a document, the form printers and executors accept.
   *
   * @param operation a synthesized operation
   * @return an interned document holding only that operation
   */
  public Document toDocument(OperationDefinition operation) {
    return cache.intern(Document.newDocument().definition(operation).build());
  }

  /**
   * Checks whether {@link #synthesize} can build an operation for the field under these options,
   * that is whether the allow-list exposes every required argument of the field.
   */
  public static boolean isSynthesizable(GraphQLFieldDefinition field, SynthesisOptions options) {
    return field.getArguments().stream()
        .noneMatch(
            argument ->
                GraphQLTypeUtil.isNonNull(argument.getType())
                    && !options.allowsArgument(argument.getName()));
  }

  /** Collects the names of the variables referenced by arguments anywhere below a selection. */
  static Set<String> referencedVariables(Selection<?> selection) {
    Set<String> names = new HashSet<>();
    collectVariables(selection, names);
    return names;
  }

  private static void collectVariables(Selection<?> selection, Set<String> names) {
    SelectionSet selectionSet = null;
    if (selection instanceof Field field) {
      for (Argument argument : field.getArguments()) {
        if (argument.getValue() instanceof VariableReference variable) {
          names.add(variable.getName());
        }
      }
      selectionSet = field.getSelectionSet();
    } else if (selection instanceof InlineFragment fragment) {
      selectionSet = fragment.getSelectionSet();
    }
    if (selectionSet != null) {
      for (Selection<?> child : selectionSet.getSelections()) {
        collectVariables(child, names);
      }
    }
  }

  static String operationName(String fieldName, OperationDefinition.Operation kind) {
    return fieldName + "_" + kind.name().toLowerCase(Locale.ROOT);
  }
}
