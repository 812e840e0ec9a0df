package restgraph.x.opsynth.synth;

import graphql.schema.GraphQLSchema;
import graphql.schema.idl.SchemaParser;
import graphql.schema.idl.TypeDefinitionRegistry;
import graphql.schema.idl.UnExecutableSchemaGenerator;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.util.List;

/**
 * Loads GraphQL SDL into a {@link GraphQLSchema} suitable for operation synthesis. The schema is
 * not wired to data fetchers; synthesis only reads its type graph.
 */
public class GraphQLSchemaLoader {

  private final SchemaParser schemaParser = new SchemaParser();

  /**
   * Parses a GraphQL schema from a Reader.
   *
   * @param reader the reader to parse from
   * @return the schema
   * @throws IOException if there's an error reading the content
   */
  public GraphQLSchema parse(Reader reader) throws IOException {
    return parse(readAll(reader));
  }

  /**
   * Parses a GraphQL schema from SDL text.
   *
   * @param sdl the schema definition language text
   * @return the schema
   * @throws graphql.schema.idl.errors.SchemaProblem if the SDL is invalid
   */
  public GraphQLSchema parse(String sdl) {
    return build(schemaParser.parse(sdl));
  }

  /**
   * Parses a GraphQL schema file.
   *
   * @param schemaFile the schema file to parse
   * @return the schema
   */
  public GraphQLSchema parse(File schemaFile) {
    return parse(List.of(schemaFile));
  }

  /**
   * Parses multiple GraphQL schema files and merges them into one schema. Type extensions in later
   * files apply to types declared in earlier ones.
   *
   * @param schemaFiles the schema files to parse
   * @return the merged schema
   */
  public GraphQLSchema parse(List<File> schemaFiles) {
    TypeDefinitionRegistry registry = new TypeDefinitionRegistry();
    for (File schemaFile : schemaFiles) {
      registry.merge(schemaParser.parse(schemaFile));
    }
    return build(registry);
  }

  private GraphQLSchema build(TypeDefinitionRegistry registry) {
    return UnExecutableSchemaGenerator.makeUnExecutableSchema(registry);
  }

  /** Reads all content from a Reader into a String. */
  private String readAll(Reader reader) throws IOException {
    StringBuilder sb = new StringBuilder();
    try (BufferedReader br = new BufferedReader(reader)) {
      String line;
      while ((line = br.readLine()) != null) {
        sb.append(line).append("\n");
      }
    }
    return sb.toString();
  }
}
