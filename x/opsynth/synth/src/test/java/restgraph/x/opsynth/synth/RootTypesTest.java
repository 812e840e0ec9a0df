package restgraph.x.opsynth.synth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import graphql.language.OperationDefinition.Operation;
import graphql.schema.GraphQLSchema;
import org.junit.jupiter.api.Test;

class RootTypesTest {

  private final GraphQLSchema schema = Selections.testSchema();

  @Test
  void listsDefinedRootTypes() {
    assertThat(RootTypes.rootTypeNames(schema)).containsExactly("Query", "Mutation");
  }

  @Test
  void resolvesRootTypeByKind() {
    assertThat(RootTypes.rootType(schema, Operation.QUERY).getName()).isEqualTo("Query");
    assertThat(RootTypes.rootType(schema, Operation.MUTATION).getName()).isEqualTo("Mutation");
    assertThat(RootTypes.rootType(schema, Operation.SUBSCRIPTION)).isNull();
  }

  @Test
  void honoursRenamedRootTypes() {
    GraphQLSchema renamed =
        Selections.schema(
            """
            schema { query: RootQuery }
            type RootQuery { ping: String }
            """);

    assertThat(RootTypes.definedRootType(renamed, Operation.QUERY).getName())
        .isEqualTo("RootQuery");
    assertThat(RootTypes.rootTypeNames(renamed)).containsExactly("RootQuery");
  }

  @Test
  void definedRootTypeFailsForMissingKind() {
    assertThatThrownBy(() -> RootTypes.definedRootType(schema, Operation.SUBSCRIPTION))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Root type subscription not defined");
  }
}
