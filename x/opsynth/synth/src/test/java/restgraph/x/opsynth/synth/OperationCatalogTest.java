package restgraph.x.opsynth.synth;

import static org.assertj.core.api.Assertions.assertThat;
import static restgraph.x.opsynth.synth.Selections.field;
import static restgraph.x.opsynth.synth.Selections.render;

import graphql.ParseAndValidate;
import graphql.language.AstPrinter;
import graphql.language.OperationDefinition;
import graphql.language.OperationDefinition.Operation;
import graphql.language.SelectionSet;
import graphql.schema.GraphQLSchema;
import graphql.validation.ValidationError;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import restgraph.x.opsynth.intern.NodeKind;

class OperationCatalogTest {

  private final GraphQLSchema schema = Selections.testSchema();
  private final OperationSynthesizer synthesizer = new OperationSynthesizer();
  private final OperationCatalog catalog = new OperationCatalog(synthesizer);

  @Test
  void synthesizesEveryRootFieldInDeclarationOrder() {
    Map<String, OperationDefinition> queries =
        catalog.synthesizeAll(schema, Operation.QUERY, SynthesisOptions.defaults());
    Map<String, OperationDefinition> mutations =
        catalog.synthesizeAll(schema, Operation.MUTATION, SynthesisOptions.defaults());

    assertThat(queries.keySet())
        .containsExactly("user", "users", "post", "search", "node", "viewer");
    assertThat(mutations.keySet()).containsExactly("createPost", "deletePost");
    assertThat(mutations.get("createPost").getName()).isEqualTo("createPost_mutation");
  }

  @Test
  void synthesizedOperationsAreValidAgainstTheSchema() {
    for (SynthesisOptions options :
        List.of(
            SynthesisOptions.defaults(),
            SynthesisOptions.builder().models("User", "Post").build(),
            SynthesisOptions.builder().circularReferenceDepth(2).build(),
            SynthesisOptions.builder().depthLimit(2).build())) {
      for (Operation kind : List.of(Operation.QUERY, Operation.MUTATION)) {
        Map<String, OperationDefinition> operations = catalog.synthesizeAll(schema, kind, options);
        for (OperationDefinition operation : operations.values()) {
          List<ValidationError> errors =
              ParseAndValidate.validate(schema, synthesizer.toDocument(operation));

          assertThat(errors)
              .as("%s with %s", AstPrinter.printAst(operation), options)
              .isEmpty();
        }
      }
    }
  }

  @Test
  void aliasesConflictingFieldsOfInterfaceImplementations() {
    OperationDefinition node =
        catalog.synthesizeAll(schema, Operation.QUERY, SynthesisOptions.defaults()).get("node");

    assertThat(render(node)).contains("... on Comment { id body author {");
    assertThat(render(node)).contains("authorUserNonNull: author {");
  }

  @Test
  void skipsFieldsWithExcludedRequiredArguments() {
    SynthesisOptions options = SynthesisOptions.builder().argNames("term", "first").build();

    Map<String, OperationDefinition> queries =
        catalog.synthesizeAll(schema, Operation.QUERY, options);

    assertThat(queries.keySet()).containsExactly("users", "search", "viewer");
    assertThat(Selections.variableNames(queries.get("users"))).containsExactly("first");
  }

  @Test
  void skipsCompositeFieldsWithNothingLeftToSelect() {
    GraphQLSchema dropped =
        Selections.schema(
            """
            type Query { user: User version: String }
            type User { avatar(size: Int!): String }
            """);
    SynthesisOptions options = SynthesisOptions.builder().argNames("other").build();

    Map<String, OperationDefinition> queries =
        catalog.synthesizeAll(dropped, Operation.QUERY, options);

    assertThat(queries.keySet()).containsExactly("version");
    assertThat(render(queries.get("version"))).isEqualTo("{ version }");
  }

  @Test
  void returnsNothingForUndefinedRootType() {
    assertThat(catalog.synthesizeAll(schema, Operation.SUBSCRIPTION, SynthesisOptions.defaults()))
        .isEmpty();
  }

  @Test
  void sharesCommonSubtreesAcrossOperations() {
    SynthesisOptions options = SynthesisOptions.builder().models("User").build();

    OperationDefinition post =
        catalog.synthesizeAll(schema, Operation.QUERY, options).get("post");
    OperationDefinition createPost =
        catalog.synthesizeAll(schema, Operation.MUTATION, options).get("createPost");

    SelectionSet postAuthor = field(post, "author").getSelectionSet();
    SelectionSet createdAuthor = field(createPost, "author").getSelectionSet();
    assertThat(render(postAuthor)).isEqualTo("{ id }");
    assertThat(createdAuthor).isSameAs(postAuthor);
    assertThat(field(post, "comments", "author")).isSameAs(field(post, "author"));
    assertThat(synthesizer.cache().stats().hits()).isPositive();
    assertThat(synthesizer.cache().size(NodeKind.OPERATION_DEFINITION)).isEqualTo(8);
  }

  @Test
  void servesConcurrentCallsWithTheSameResults() throws Exception {
    List<String> fields = List.of("user", "users", "post", "search", "node", "viewer");
    Map<String, OperationDefinition> expected =
        new OperationCatalog().synthesizeAll(schema, Operation.QUERY, SynthesisOptions.defaults());

    ExecutorService executor = Executors.newFixedThreadPool(6);
    try {
      List<Future<OperationDefinition>> futures = new ArrayList<>();
      for (int i = 0; i < 24; i++) {
        String field = fields.get(i % fields.size());
        futures.add(executor.submit(() -> synthesizer.synthesize(schema, field, Operation.QUERY)));
      }
      for (int i = 0; i < futures.size(); i++) {
        String field = fields.get(i % fields.size());
        assertThat(AstPrinter.printAst(futures.get(i).get(30, TimeUnit.SECONDS)))
            .isEqualTo(AstPrinter.printAst(expected.get(field)));
      }
    } finally {
      executor.shutdownNow();
    }
  }
}
