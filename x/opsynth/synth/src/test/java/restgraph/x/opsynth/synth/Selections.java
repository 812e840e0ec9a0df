package restgraph.x.opsynth.synth;

import graphql.language.Argument;
import graphql.language.Field;
import graphql.language.InlineFragment;
import graphql.language.ListType;
import graphql.language.NonNullType;
import graphql.language.OperationDefinition;
import graphql.language.Selection;
import graphql.language.SelectionSet;
import graphql.language.Type;
import graphql.language.TypeName;
import graphql.language.VariableDefinition;
import graphql.language.VariableReference;
import graphql.schema.GraphQLSchema;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/** Compact one-line rendering of synthesized selections, for readable assertions. */
final class Selections {

  private static final GraphQLSchemaLoader loader = new GraphQLSchemaLoader();

  private Selections() {}

  static GraphQLSchema schema(String sdl) {
    return loader.parse(sdl);
  }

  static GraphQLSchema testSchema() {
    try (Reader reader = testSchemaReader()) {
      return loader.parse(reader);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  static Reader testSchemaReader() {
    InputStream inputStream =
        Objects.requireNonNull(
            Selections.class.getClassLoader().getResourceAsStream("test-schema.graphqls"));
    return new InputStreamReader(inputStream, StandardCharsets.UTF_8);
  }

  /** Renders the operation's selection set, e.g. {@code { user(id: $id) { id name } }}. */
  static String render(OperationDefinition operation) {
    return render(operation.getSelectionSet());
  }

  static String render(SelectionSet selectionSet) {
    StringBuilder out = new StringBuilder("{");
    for (Selection<?> selection : selectionSet.getSelections()) {
      out.append(' ').append(render(selection));
    }
    return out.append(" }").toString();
  }

  static String render(Selection<?> selection) {
    if (selection instanceof Field field) {
      StringBuilder out = new StringBuilder();
      if (field.getAlias() != null) {
        out.append(field.getAlias()).append(": ");
      }
      out.append(field.getName());
      if (!field.getArguments().isEmpty()) {
        out.append(
            field.getArguments().stream()
                .map(Selections::render)
                .collect(Collectors.joining(", ", "(", ")")));
      }
      if (field.getSelectionSet() != null) {
        out.append(' ').append(render(field.getSelectionSet()));
      }
      return out.toString();
    }
    if (selection instanceof InlineFragment fragment) {
      return "... on "
          + fragment.getTypeCondition().getName()
          + " "
          + render(fragment.getSelectionSet());
    }
    throw new IllegalArgumentException("Unexpected selection " + selection);
  }

  private static String render(Argument argument) {
    VariableReference variable = (VariableReference) argument.getValue();
    return argument.getName() + ": $" + variable.getName();
  }

  static Field rootField(OperationDefinition operation) {
    return (Field) operation.getSelectionSet().getSelections().get(0);
  }

  /** Follows field names down from the root field. */
  static Field field(OperationDefinition operation, String... path) {
    Field current = rootField(operation);
    for (String name : path) {
      current =
          current.getSelectionSet().getSelectionsOfType(Field.class).stream()
              .filter(f -> f.getName().equals(name))
              .findFirst()
              .orElseThrow(() -> new AssertionError("No field " + name));
    }
    return current;
  }

  static List<String> variableNames(OperationDefinition operation) {
    return operation.getVariableDefinitions().stream().map(VariableDefinition::getName).toList();
  }

  static VariableDefinition variable(OperationDefinition operation, String name) {
    return operation.getVariableDefinitions().stream()
        .filter(v -> v.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("No variable " + name));
  }

  static String render(Type<?> type) {
    if (type instanceof NonNullType nonNull) {
      return render(nonNull.getType()) + "!";
    }
    if (type instanceof ListType list) {
      return "[" + render(list.getType()) + "]";
    }
    return ((TypeName) type).getName();
  }
}
