package restgraph.x.opsynth.synth;

import graphql.language.OperationDefinition;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLSchema;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Synthesizes one operation per field of a root type, the set a REST layer exposes as endpoints.
 * All operations are built through one synthesizer, so subtrees common to several of them, such as
 * the {@code { id }} selection of model types, are held once.
 */
public class OperationCatalog {

  private static final Logger logger = LoggerFactory.getLogger(OperationCatalog.class);

  private final OperationSynthesizer synthesizer;

  public OperationCatalog() {
    this(new OperationSynthesizer());
  }

  public OperationCatalog(OperationSynthesizer synthesizer) {
    this.synthesizer = synthesizer;
  }

  /**
   * Synthesizes an operation for every field of the root type of {@code kind}. Fields with a
   * required argument the allow-list excludes cannot be called and are skipped, as are composite
   * fields none of whose sub-fields survives the options.
   *
   * @param schema the schema
   * @param kind the operation kind
   * @param options the options applied to every field
   * @return operations keyed by root field name, in field declaration order; empty when the schema
   *     has no root type for the kind
   */
  public Map<String, OperationDefinition> synthesizeAll(
      GraphQLSchema schema, OperationDefinition.Operation kind, SynthesisOptions options) {
    GraphQLObjectType rootType = RootTypes.rootType(schema, kind);
    if (rootType == null) {
      return Collections.emptyMap();
    }
    Map<String, OperationDefinition> operations = new LinkedHashMap<>();
    for (GraphQLFieldDefinition field : rootType.getFieldDefinitions()) {
      if (!OperationSynthesizer.isSynthesizable(field, options)) {
        logger.warn(
            "Skipping {}.{}: a required argument is not in the argument allow-list",
            rootType.getName(),
            field.getName());
        continue;
      }
      OperationDefinition operation =
          synthesizer.synthesizeIfSelectable(schema, field.getName(), kind, options);
      if (operation == null) {
        logger.warn(
            "Skipping {}.{}: none of its sub-fields is selectable",
            rootType.getName(),
            field.getName());
        continue;
      }
      operations.put(field.getName(), operation);
    }
    logger.info(
        "Synthesized {} {} operations; {}",
        operations.size(),
        kind.name().toLowerCase(Locale.ROOT),
        synthesizer.cache().stats());
    return Collections.unmodifiableMap(operations);
  }
}
