package restgraph.x.opsynth.synth;

import static org.assertj.core.api.Assertions.assertThat;

import graphql.language.TypeName;
import graphql.language.VariableDefinition;
import graphql.schema.GraphQLSchema;
import java.util.Set;
import java.util.function.Function;
import org.junit.jupiter.api.Test;
import restgraph.x.opsynth.intern.NodeInterningCache;

class SynthesisContextTest {

  private static final GraphQLSchema SCHEMA = Selections.schema("type Query { ping: String }");

  private final SynthesisContext context =
      new SynthesisContext(SCHEMA, SynthesisOptions.defaults(), new NodeInterningCache());

  private static final Function<String, VariableDefinition> INT =
      name ->
          VariableDefinition.newVariableDefinition()
              .name(name)
              .type(TypeName.newTypeName().name("Int").build())
              .build();

  @Test
  void qualifiesArgumentsWithTheFieldPath() {
    assertThat(context.qualifiedArgumentName("id")).isEqualTo("id");

    context.pushPath("posts");
    context.pushPath("comments");

    assertThat(context.qualifiedArgumentName("limit")).isEqualTo("posts_comments_limit");
    assertThat(context.fieldPathKey()).isEqualTo("posts.comments");
    assertThat(context.lastPathSegment()).isEqualTo("comments");

    context.popPath();
    assertThat(context.path()).containsExactly("posts");
  }

  @Test
  void reusesTheNameOfTheSameArgument() {
    String first = context.registerVariable("limit", "posts(limit:Int)", INT);
    String second = context.registerVariable("limit", "posts(limit:Int)", INT);

    assertThat(first).isEqualTo("limit");
    assertThat(second).isEqualTo("limit");
    assertThat(context.variableDefinitions(Set.of("limit"))).hasSize(1);
  }

  @Test
  void suffixesNamesOfDifferentArguments() {
    assertThat(context.registerVariable("a_b_c", "a.b(c:Int)", INT)).isEqualTo("a_b_c");
    assertThat(context.registerVariable("a_b_c", "a_b(c:Int)", INT)).isEqualTo("a_b_c_2");
    assertThat(context.registerVariable("a_b_c", "a.b(c:Int!)", INT)).isEqualTo("a_b_c_3");
    assertThat(context.registerVariable("a_b_c", "a_b(c:Int)", INT)).isEqualTo("a_b_c_2");
  }

  @Test
  void keepsOnlyReferencedVariablesInRegistrationOrder() {
    context.registerVariable("first", "users(first:Int)", INT);
    context.registerVariable("users_posts_limit", "users.posts(limit:Int)", INT);
    context.registerVariable("after", "users(after:Int)", INT);

    assertThat(context.variableDefinitions(Set.of("after", "first")))
        .extracting(VariableDefinition::getName)
        .containsExactly("first", "after");
  }

  @Test
  void recordsTheLastTypeSeenAtAPath() {
    context.pushPath("media");
    context.pushPath("size");

    assertThat(context.recordFieldType("Int")).isNull();
    assertThat(context.recordFieldType("Float")).isEqualTo("Int");
  }

  @Test
  void knowsRootTypes() {
    assertThat(context.isRootType("Query")).isTrue();
    assertThat(context.isRootType("User")).isFalse();
  }
}
