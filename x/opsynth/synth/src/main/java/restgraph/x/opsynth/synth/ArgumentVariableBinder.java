package restgraph.x.opsynth.synth;

import graphql.language.Argument;
import graphql.language.ListType;
import graphql.language.NonNullType;
import graphql.language.Type;
import graphql.language.TypeName;
import graphql.language.Value;
import graphql.language.VariableDefinition;
import graphql.language.VariableReference;
import graphql.schema.GraphQLArgument;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLList;
import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLNonNull;
import graphql.schema.GraphQLType;
import graphql.schema.GraphQLTypeUtil;
import graphql.schema.InputValueWithState;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import restgraph.x.opsynth.intern.NodeInterningCache;

/**
 * Turns schema arguments into operation variables and the argument nodes referencing them.
 *
 * <p>Nested arguments are named after their field path, {@code posts_comments_limit} for the
 * {@code limit} argument of {@code comments} below {@code posts}, so arguments of different fields
 * never share a variable. The root field's arguments keep their own names.
 */
final class ArgumentVariableBinder {

  private final SynthesisContext context;
  private final NodeInterningCache cache;

  ArgumentVariableBinder(SynthesisContext context) {
    this.context = context;
    this.cache = context.cache();
  }

  /**
   * Returns the names of the root field's non-null arguments the allow-list excludes. A root field
   * cannot be dropped from its own operation, so any such argument makes the call unsatisfiable.
   */
  List<String> excludedRequiredRootArguments(GraphQLFieldDefinition field) {
    List<String> excluded = new ArrayList<>();
    for (GraphQLArgument argument : field.getArguments()) {
      if (GraphQLTypeUtil.isNonNull(argument.getType())
          && !context.options().allowsArgument(argument.getName())) {
        excluded.add(argument.getName());
      }
    }
    return excluded;
  }

  /**
   * Registers a variable for every allowed argument of the root field, under the argument's own
   * name. Must run while the field path is empty.
   */
  void bindRootArguments(GraphQLFieldDefinition field) {
    for (GraphQLArgument argument : field.getArguments()) {
      if (context.options().allowsArgument(argument.getName())) {
        register(argument, argument.getName(), field.getName());
      }
    }
  }

  /**
   * Builds the argument list of the field on top of the field path.
   *
   * @param field the field being selected
   * @param firstCall whether this is the root field, whose variables are already registered
   * @return the arguments, or null when a required argument is excluded and the field must be
   *     dropped
   */
  @Nullable List<Argument> bindArguments(GraphQLFieldDefinition field, boolean firstCall) {
    List<GraphQLArgument> exposed = new ArrayList<>(field.getArguments().size());
    for (GraphQLArgument argument : field.getArguments()) {
      if (context.options().allowsArgument(variableName(argument, firstCall))) {
        exposed.add(argument);
      } else if (GraphQLTypeUtil.isNonNull(argument.getType())) {
        return null;
      }
    }
    List<Argument> arguments = new ArrayList<>(exposed.size());
    for (GraphQLArgument argument : exposed) {
      String variableName = variableName(argument, firstCall);
      if (!firstCall) {
        variableName = register(argument, variableName, context.fieldPathKey());
      }
      arguments.add(
          cache.intern(
              Argument.newArgument()
                  .name(argument.getName())
                  .value(
                      cache.intern(
                          VariableReference.newVariableReference().name(variableName).build()))
                  .build()));
    }
    return arguments;
  }

  private String variableName(GraphQLArgument argument, boolean firstCall) {
    return firstCall ? argument.getName() : context.qualifiedArgumentName(argument.getName());
  }

  private String register(GraphQLArgument argument, String preferredName, String fieldPath) {
    String origin =
        fieldPath
            + "("
            + argument.getName()
            + ":"
            + GraphQLTypeUtil.simplePrint(argument.getType())
            + ")";
    return context.registerVariable(
        preferredName, origin, name -> variableDefinition(argument, name));
  }

  private VariableDefinition variableDefinition(GraphQLArgument argument, String name) {
    VariableDefinition.Builder definition =
        VariableDefinition.newVariableDefinition()
            .name(name)
            .type(typeReference(argument.getType()));
    Value<?> defaultValue = literalDefault(argument);
    if (defaultValue != null) {
      definition.defaultValue(defaultValue);
    }
    return cache.intern(definition.build());
  }

  /** Translates list, non-null and named input types into interned type references. */
  Type<?> typeReference(GraphQLType type) {
    if (type instanceof GraphQLList listType) {
      return cache.intern(
          ListType.newListType().type(typeReference(listType.getWrappedType())).build());
    }
    if (type instanceof GraphQLNonNull nonNullType) {
      return cache.intern(
          NonNullType.newNonNullType().type(typeReference(nonNullType.getWrappedType())).build());
    }
    return cache.intern(TypeName.newTypeName().name(((GraphQLNamedType) type).getName()).build());
  }

  /** Returns the argument's schema default when it was declared as a literal, as SDL does. */
  private static @Nullable Value<?> literalDefault(GraphQLArgument argument) {
    InputValueWithState defaultValue = argument.getArgumentDefaultValue();
    if (defaultValue.isLiteral() && defaultValue.getValue() instanceof Value<?> literal) {
      return literal;
    }
    return null;
  }
}
