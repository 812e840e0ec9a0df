package restgraph.x.opsynth.synth;

import graphql.language.Argument;
import graphql.language.Field;
import graphql.language.InlineFragment;
import graphql.language.Selection;
import graphql.language.SelectionSet;
import graphql.language.TypeName;
import graphql.schema.GraphQLEnumType;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLInterfaceType;
import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLScalarType;
import graphql.schema.GraphQLTypeUtil;
import graphql.schema.GraphQLUnionType;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import restgraph.x.opsynth.intern.NodeInterningCache;

/**
 * Recursively builds the selection set of a type: every reachable field, with unions and
 * interfaces expanded into one inline fragment per possible object type.
 *
 * <p>Nothing here fails. A branch that cannot be expanded is left out instead: circular types past
 * the configured threshold, fields whose required arguments are not exposed, fields deselected by
 * the selected-fields tree, and composite fields or fragments whose own selection set came out
 * empty.
 */
final class SchemaWalker {

  private static final Logger logger = LoggerFactory.getLogger(SchemaWalker.class);

  /** Field selected for types collapsed as models. */
  static final String IDENTIFIER_FIELD = "id";

  private final SynthesisContext context;
  private final ArgumentVariableBinder binder;
  private final NodeInterningCache cache;

  SchemaWalker(SynthesisContext context, ArgumentVariableBinder binder) {
    this.context = context;
    this.binder = binder;
    this.cache = context.cache();
  }

  /**
   * Builds the selection set for a type.
   *
   * @param parent the object type declaring the field that led here, or the abstract type whose
   *     possible types are being expanded
   * @param type the type to select from
   * @param firstCall whether this is the root field's own selection set
   * @param selected the fields to include
   * @param depth the depth of this selection set, 1 for the root field's
   * @return the selection set, or null when nothing is selected
   */
  @Nullable SelectionSet resolveSelectionSet(
      GraphQLNamedType parent,
      GraphQLNamedType type,
      boolean firstCall,
      SelectedFields selected,
      int depth) {
    if (!selected.isTree() && depth > context.options().depthLimit()) {
      if (logger.isTraceEnabled()) {
        logger.trace("Depth limit reached at {} below {}", type.getName(), context.path());
      }
      return null;
    }
    if (type instanceof GraphQLUnionType unionType) {
      return resolvePossibleTypes(unionType, unionType.getTypes(), selected, depth);
    }
    if (type instanceof GraphQLInterfaceType interfaceType) {
      return resolvePossibleTypes(interfaceType, implementations(interfaceType), selected, depth);
    }
    if (type instanceof GraphQLObjectType objectType && !context.isRootType(type.getName())) {
      return resolveObject(parent, objectType, firstCall, selected, depth);
    }
    return null;
  }

  /**
   * Builds the selection for one field of {@code parent}. The field's name is on top of the field
   * path while its arguments and selection set are resolved.
   *
   * @return the field, or null when a required argument is not exposed and the field must be
   *     dropped
   */
  @Nullable Field resolveField(
      GraphQLObjectType parent,
      GraphQLFieldDefinition field,
      boolean firstCall,
      SelectedFields selected,
      int depth) {
    context.pushPath(field.getName());
    try {
      List<Argument> arguments = binder.bindArguments(field, firstCall);
      if (arguments == null) {
        if (logger.isTraceEnabled()) {
          logger.trace("Dropping {} for an excluded required argument", context.path());
        }
        return null;
      }
      String alias = aliasFor(field);
      GraphQLNamedType fieldType = (GraphQLNamedType) GraphQLTypeUtil.unwrapAll(field.getType());
      SelectionSet selectionSet = null;
      if (!isLeaf(fieldType)) {
        context.ancestors().push(parent);
        try {
          selectionSet = resolveSelectionSet(parent, fieldType, firstCall, selected, depth + 1);
        } finally {
          context.ancestors().pop();
        }
      }
      return cache.intern(
          Field.newField()
              .name(field.getName())
              .alias(alias)
              .arguments(arguments)
              .selectionSet(selectionSet)
              .build());
    } finally {
      context.popPath();
    }
  }

  private @Nullable SelectionSet resolveObject(
      GraphQLNamedType parent,
      GraphQLObjectType type,
      boolean firstCall,
      SelectedFields selected,
      int depth) {
    if (!firstCall && context.options().isModel(type.getName()) && !isIgnored(parent, type)) {
      return identifierSelection();
    }
    int threshold = context.options().circularReferenceDepth();
    List<Selection<?>> selections = new ArrayList<>();
    for (GraphQLFieldDefinition field : type.getFieldDefinitions()) {
      GraphQLNamedType fieldType = (GraphQLNamedType) GraphQLTypeUtil.unwrapAll(field.getType());
      if (context.ancestors().wouldBeCircular(fieldType, threshold)) {
        logger.trace("Skipping circular {}.{}", type.getName(), field.getName());
        continue;
      }
      SelectedFields fieldSelection = selected.select(field.getName());
      if (fieldSelection == null) {
        continue;
      }
      Field selection = resolveField(type, field, false, fieldSelection, depth);
      if (selection == null) {
        continue;
      }
      // a composite field is only valid with a sub-selection
      if (selection.getSelectionSet() == null && !isLeaf(fieldType)) {
        continue;
      }
      selections.add(selection);
    }
    return selections.isEmpty() ? null : selectionSet(selections);
  }

  private @Nullable SelectionSet resolvePossibleTypes(
      GraphQLNamedType abstractType,
      List<? extends GraphQLNamedType> possibleTypes,
      SelectedFields selected,
      int depth) {
    int threshold = context.options().circularReferenceDepth();
    List<Selection<?>> fragments = new ArrayList<>();
    for (GraphQLNamedType possibleType : possibleTypes) {
      if (context.ancestors().wouldBeCircular(possibleType, threshold)) {
        logger.trace("Skipping circular {} of {}", possibleType.getName(), abstractType.getName());
        continue;
      }
      SelectionSet selectionSet =
          resolveSelectionSet(abstractType, possibleType, false, selected, depth);
      if (selectionSet == null) {
        continue;
      }
      fragments.add(
          cache.intern(
              InlineFragment.newInlineFragment()
                  .typeCondition(
                      cache.intern(TypeName.newTypeName().name(possibleType.getName()).build()))
                  .selectionSet(selectionSet)
                  .build()));
    }
    return fragments.isEmpty() ? null : selectionSet(fragments);
  }

  /** Object types implementing the interface, by name for a stable fragment order. */
  private List<GraphQLObjectType> implementations(GraphQLInterfaceType interfaceType) {
    List<GraphQLObjectType> implementations =
        new ArrayList<>(context.schema().getImplementations(interfaceType));
    implementations.sort(Comparator.comparing(GraphQLObjectType::getName));
    return implementations;
  }

  private boolean isIgnored(GraphQLNamedType parent, GraphQLObjectType type) {
    if (context.options().isIgnored(type.getName())) {
      return true;
    }
    String fieldName = context.lastPathSegment();
    return fieldName != null && context.options().isIgnored(parent.getName() + "." + fieldName);
  }

  /**
   * Aliases the field when the same field path was already selected with another return type, as
   * happens when possible types of one abstract type declare a same-named field differently.
   */
  private @Nullable String aliasFor(GraphQLFieldDefinition field) {
    String typeString = GraphQLTypeUtil.simplePrint(field.getType());
    String previous = context.recordFieldType(typeString);
    if (previous == null || previous.equals(typeString)) {
      return null;
    }
    return field.getName() + sanitize(typeString);
  }

  static String sanitize(String typeString) {
    return typeString.replace("!", "NonNull").replace("[", "List").replace("]", "");
  }

  private SelectionSet identifierSelection() {
    Field identifier = cache.intern(Field.newField().name(IDENTIFIER_FIELD).build());
    return selectionSet(List.<Selection<?>>of(identifier));
  }

  private SelectionSet selectionSet(List<Selection<?>> selections) {
    return cache.intern(SelectionSet.newSelectionSet().selections(selections).build());
  }

  static boolean isLeaf(GraphQLNamedType type) {
    return type instanceof GraphQLScalarType || type instanceof GraphQLEnumType;
  }
}
