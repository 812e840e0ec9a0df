package restgraph.x.opsynth.intern;

import graphql.language.Argument;
import graphql.language.ArrayValue;
import graphql.language.BooleanValue;
import graphql.language.Definition;
import graphql.language.Directive;
import graphql.language.DirectivesContainer;
import graphql.language.Document;
import graphql.language.EnumValue;
import graphql.language.Field;
import graphql.language.FloatValue;
import graphql.language.FragmentDefinition;
import graphql.language.FragmentSpread;
import graphql.language.InlineFragment;
import graphql.language.IntValue;
import graphql.language.ListType;
import graphql.language.Node;
import graphql.language.NonNullType;
import graphql.language.ObjectField;
import graphql.language.ObjectValue;
import graphql.language.OperationDefinition;
import graphql.language.Selection;
import graphql.language.SelectionSet;
import graphql.language.SelectionSetContainer;
import graphql.language.StringValue;
import graphql.language.Type;
import graphql.language.TypeName;
import graphql.language.Value;
import graphql.language.VariableDefinition;
import graphql.language.VariableReference;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Computes structural signatures of graphql-java AST nodes.
 *
 * <p>A signature covers the semantic content of a node only: source locations, comments,
 * descriptions and ignored characters never contribute. Arguments, directive arguments, object
 * value fields and variable definitions are sorted by name, so their order is irrelevant.
 * Selection order and list value order are kept, because they are significant.
 *
 * <p>Signatures are bounded: selections and definitions nested more than {@link #MAX_DEPTH} levels
 * below the signed node are represented by a digest of a reduced feature summary (kind, name or
 * operation, and the counts of arguments, selections, directives and variable definitions). Two
 * subtrees that differ only below the bound therefore share a signature; {@link
 * Signature#approximate()} reports when that happened, and {@link #merkleDigest(Node)} gives the
 * exact, memoized digest to verify such matches with.
 *
 * <p>Every nested part (child selection, argument, directive, variable definition) is prefixed
 * with its length, so sibling and nested structures cannot produce the same text.
 *
 * <p>Memoized digests are kept in identity side tables owned by the hasher; nodes are never
 * mutated. Instances are not thread-safe.
 */
public final class StructuralHasher {

  /** Number of nested selection levels signed in full before reduced digests are used. */
  public static final int MAX_DEPTH = 3;

  /** Signatures shorter than this are used as cache keys as they are. */
  static final int RAW_KEY_LIMIT = 32;

  private static final String SEPARATOR = "|";

  private static final Comparator<Argument> BY_ARGUMENT_NAME =
      Comparator.comparing(Argument::getName);

  private final Map<Node<?>, String> reducedDigests = new IdentityHashMap<>();
  private final Map<Node<?>, String> merkleDigests = new IdentityHashMap<>();

  /**
   * The bounded structural signature of a node.
   *
   * @param kind the kind of the signed node
   * @param value the signature text
   * @param approximate whether part of the subtree was replaced by a reduced digest
   */
  public record Signature(NodeKind kind, String value, boolean approximate) {

    /** Returns the lookup key: the signature itself when short, else its SHA-256 hex digest. */
    public String key() {
      return value.length() < RAW_KEY_LIMIT ? value : sha256(value);
    }
  }

  /**
   * Computes the bounded signature of a node.
   *
   * @param node the node to sign
   * @return the signature
   * @throws IllegalArgumentException if the node is not part of an executable document
   */
  public Signature signature(Node<?> node) {
    return signature(node, true);
  }

  /**
   * Computes the bounded signature of a node without memoizing digests for its subtree, for
   * lookups of nodes that are not going to be kept.
   *
   * @param node the node to sign
   * @return the signature
   * @throws IllegalArgumentException if the node is not part of an executable document
   */
  public Signature transientSignature(Node<?> node) {
    return signature(node, false);
  }

  private Signature signature(Node<?> node, boolean memoize) {
    Walk walk = new Walk(true, memoize);
    String value = walk.sign(node, 0);
    return new Signature(NodeKind.of(node), value, walk.truncated);
  }

  /**
   * Returns the exact digest of a node's whole subtree. Nested selections and definitions
   * contribute through their own memoized digests, so a node whose children were digested before
   * costs a single level of work.
   *
   * @param node the node to digest
   * @return the SHA-256 hex digest of the node's full structure
   */
  public String merkleDigest(Node<?> node) {
    String digest = merkleDigests.get(node);
    if (digest == null) {
      digest = sha256(new Walk(false, true).sign(node, 0));
      merkleDigests.put(node, digest);
    }
    return digest;
  }

  /** Drops any digest memoized for this node instance. */
  public void forget(Node<?> node) {
    reducedDigests.remove(node);
    merkleDigests.remove(node);
  }

  /** Drops every memoized digest. */
  public void clear() {
    reducedDigests.clear();
    merkleDigests.clear();
  }

  /** Returns the number of node instances with a memoized digest of either tier. */
  public int memoizedCount() {
    return reducedDigests.size() + merkleDigests.size();
  }

  private String reducedDigest(Node<?> node, boolean memoize) {
    String digest = reducedDigests.get(node);
    if (digest == null) {
      digest = sha256(reducedFeatures(node));
      if (memoize) {
        reducedDigests.put(node, digest);
      }
    }
    return digest;
  }

  static String reducedFeatures(Node<?> node) {
    NodeKind kind = NodeKind.of(node);
    List<String> features = new ArrayList<>();
    features.add(kind.name());
    String name = nameOf(node, kind);
    if (name != null) {
      features.add(name);
    }
    int arguments = 0;
    if (node instanceof Field field) {
      arguments = field.getArguments().size();
    } else if (node instanceof Directive directive) {
      arguments = directive.getArguments().size();
    }
    if (arguments > 0) {
      features.add("args:" + arguments);
    }
    int selections = 0;
    if (node instanceof SelectionSet selectionSet) {
      selections = selectionSet.getSelections().size();
    } else if (node instanceof SelectionSetContainer<?> container
        && container.getSelectionSet() != null) {
      selections = container.getSelectionSet().getSelections().size();
    }
    if (selections > 0) {
      features.add("sels:" + selections);
    }
    if (node instanceof DirectivesContainer<?> container && !container.getDirectives().isEmpty()) {
      features.add("dirs:" + container.getDirectives().size());
    }
    if (node instanceof OperationDefinition operation
        && !operation.getVariableDefinitions().isEmpty()) {
      features.add("vars:" + operation.getVariableDefinitions().size());
    }
    return String.join(SEPARATOR, features);
  }

  private static @Nullable String nameOf(Node<?> node, NodeKind kind) {
    return switch (kind) {
      case FIELD -> ((Field) node).getName();
      case FRAGMENT_SPREAD -> ((FragmentSpread) node).getName();
      case FRAGMENT_DEFINITION -> ((FragmentDefinition) node).getName();
      case OPERATION_DEFINITION -> {
        OperationDefinition operation = (OperationDefinition) node;
        yield operation.getName() != null
            ? operation.getName()
            : operation.getOperation().name().toLowerCase(Locale.ROOT);
      }
      case INLINE_FRAGMENT -> null;
      case ARGUMENT -> ((Argument) node).getName();
      case DIRECTIVE -> ((Directive) node).getName();
      case VARIABLE_DEFINITION -> ((VariableDefinition) node).getName();
      case VARIABLE -> ((VariableReference) node).getName();
      case NAMED_TYPE -> ((TypeName) node).getName();
      case OBJECT_FIELD -> ((ObjectField) node).getName();
      case ENUM -> ((EnumValue) node).getName();
      case DOCUMENT,
          SELECTION_SET,
          LIST_TYPE,
          NON_NULL_TYPE,
          STRING,
          INT,
          FLOAT,
          BOOLEAN,
          NULL,
          LIST,
          OBJECT -> null;
    };
  }

  /** One signing pass; bounded passes record whether anything was truncated. */
  private final class Walk {
    private final boolean bounded;
    private final boolean memoize;
    private boolean truncated;

    private Walk(boolean bounded, boolean memoize) {
      this.bounded = bounded;
      this.memoize = memoize;
    }

    private String sign(Node<?> node, int depth) {
      if (bounded && depth > MAX_DEPTH) {
        truncated = true;
        return reducedDigest(node, memoize);
      }
      NodeKind kind = NodeKind.of(node);
      List<String> parts = new ArrayList<>();
      parts.add(kind.name());
      switch (kind) {
        case FIELD -> field((Field) node, depth, parts);
        case FRAGMENT_SPREAD -> {
          FragmentSpread spread = (FragmentSpread) node;
          parts.add(spread.getName());
          directives(spread.getDirectives(), parts);
        }
        case INLINE_FRAGMENT -> {
          InlineFragment fragment = (InlineFragment) node;
          if (fragment.getTypeCondition() != null) {
            parts.add("ON");
            parts.add(fragment.getTypeCondition().getName());
          }
          directives(fragment.getDirectives(), parts);
          selections(fragment.getSelectionSet(), depth, parts);
        }
        case OPERATION_DEFINITION -> operation((OperationDefinition) node, depth, parts);
        case DOCUMENT -> {
          for (Definition<?> definition : ((Document) node).getDefinitions()) {
            parts.add(child(definition, depth));
          }
        }
        case FRAGMENT_DEFINITION -> {
          FragmentDefinition fragment = (FragmentDefinition) node;
          parts.add(fragment.getName());
          parts.add("ON");
          parts.add(fragment.getTypeCondition().getName());
          directives(fragment.getDirectives(), parts);
          selections(fragment.getSelectionSet(), depth, parts);
        }
        case SELECTION_SET -> {
          for (Selection<?> selection : ((SelectionSet) node).getSelections()) {
            parts.add(child(selection, depth));
          }
        }
        case ARGUMENT -> {
          Argument argument = (Argument) node;
          parts.add(argument.getName());
          parts.add(valueSignature(argument.getValue()));
        }
        case DIRECTIVE -> {
          Directive directive = (Directive) node;
          parts.add(directive.getName());
          arguments(directive.getArguments(), parts);
        }
        case VARIABLE_DEFINITION -> variableDefinition((VariableDefinition) node, parts);
        case NAMED_TYPE, LIST_TYPE, NON_NULL_TYPE -> parts.add(typeSignature((Type<?>) node));
        case STRING, INT, FLOAT, BOOLEAN, ENUM, NULL, LIST, OBJECT, VARIABLE ->
            parts.add(valueSignature((Value<?>) node));
        case OBJECT_FIELD -> {
          ObjectField objectField = (ObjectField) node;
          parts.add(objectField.getName());
          parts.add(valueSignature(objectField.getValue()));
        }
      }
      return String.join(SEPARATOR, parts);
    }

    private String child(Node<?> child, int depth) {
      return frame(bounded ? sign(child, depth + 1) : merkleDigest(child));
    }

    private void field(Field field, int depth, List<String> parts) {
      parts.add(field.getName());
      if (field.getAlias() != null) {
        parts.add("AS");
        parts.add(field.getAlias());
      }
      if (!field.getArguments().isEmpty()) {
        parts.add("A");
        arguments(field.getArguments(), parts);
      }
      directives(field.getDirectives(), parts);
      if (field.getSelectionSet() != null) {
        selections(field.getSelectionSet(), depth, parts);
      }
    }

    private void operation(OperationDefinition operation, int depth, List<String> parts) {
      parts.add(operation.getOperation().name());
      if (operation.getName() != null) {
        parts.add(operation.getName());
      }
      if (!operation.getVariableDefinitions().isEmpty()) {
        parts.add("V");
        List<VariableDefinition> sorted = new ArrayList<>(operation.getVariableDefinitions());
        sorted.sort(Comparator.comparing(VariableDefinition::getName));
        for (VariableDefinition definition : sorted) {
          List<String> definitionParts = new ArrayList<>();
          variableDefinition(definition, definitionParts);
          parts.add(frame(String.join(SEPARATOR, definitionParts)));
        }
      }
      directives(operation.getDirectives(), parts);
      selections(operation.getSelectionSet(), depth, parts);
    }

    private void selections(@Nullable SelectionSet selectionSet, int depth, List<String> parts) {
      if (selectionSet == null) {
        return;
      }
      parts.add("S");
      for (Selection<?> selection : selectionSet.getSelections()) {
        parts.add(child(selection, depth));
      }
    }
  }

  private static void variableDefinition(VariableDefinition definition, List<String> parts) {
    parts.add(definition.getName());
    parts.add(typeSignature(definition.getType()));
    if (definition.getDefaultValue() != null) {
      parts.add("DEF");
      parts.add(valueSignature(definition.getDefaultValue()));
    }
    directives(definition.getDirectives(), parts);
  }

  private static void arguments(List<Argument> arguments, List<String> parts) {
    List<Argument> sorted = new ArrayList<>(arguments);
    sorted.sort(BY_ARGUMENT_NAME);
    for (Argument argument : sorted) {
      parts.add(frame(argument.getName() + SEPARATOR + valueSignature(argument.getValue())));
    }
  }

  private static void directives(List<Directive> directives, List<String> parts) {
    if (directives.isEmpty()) {
      return;
    }
    parts.add("D");
    for (Directive directive : directives) {
      List<String> directiveParts = new ArrayList<>();
      directiveParts.add(directive.getName());
      arguments(directive.getArguments(), directiveParts);
      parts.add(frame(String.join(SEPARATOR, directiveParts)));
    }
  }

  /**
   * Prefixes a nested signature with its length, so the parts of a child can never be read as
   * parts of its parent or of the next sibling.
   */
  static String frame(String signature) {
    return signature.length() + ":" + signature;
  }

  /** Signature of an input value; strings carry their length so separators inside stay harmless. */
  static String valueSignature(@Nullable Value<?> value) {
    if (value == null) {
      return "NULL";
    }
    NodeKind kind = NodeKind.of(value);
    return switch (kind) {
      case STRING -> {
        String text = ((StringValue) value).getValue();
        yield "S:" + text.length() + ":" + text;
      }
      case INT -> "I:" + ((IntValue) value).getValue();
      case FLOAT -> "F:" + ((FloatValue) value).getValue().toPlainString();
      case BOOLEAN -> "B:" + ((BooleanValue) value).isValue();
      case ENUM -> "E:" + ((EnumValue) value).getName();
      case NULL -> "NULL";
      case VARIABLE -> "V:" + ((VariableReference) value).getName();
      case LIST -> {
        List<String> items = new ArrayList<>();
        for (Value<?> item : ((ArrayValue) value).getValues()) {
          items.add(valueSignature(item));
        }
        yield "L:[" + String.join(",", items) + "]";
      }
      case OBJECT -> {
        List<ObjectField> fields = new ArrayList<>(((ObjectValue) value).getObjectFields());
        fields.sort(Comparator.comparing(ObjectField::getName));
        List<String> items = new ArrayList<>();
        for (ObjectField field : fields) {
          items.add(field.getName() + ":" + valueSignature(field.getValue()));
        }
        yield "O:{" + String.join(",", items) + "}";
      }
      default -> throw new IllegalArgumentException("Not a value node: " + kind);
    };
  }

  static String typeSignature(Type<?> type) {
    if (type instanceof ListType listType) {
      return "[" + typeSignature(listType.getType()) + "]";
    } else if (type instanceof NonNullType nonNullType) {
      return typeSignature(nonNullType.getType()) + "!";
    }
    return ((TypeName) type).getName();
  }

  static String sha256(String content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      // every Java platform is required to provide SHA-256
      throw new IllegalStateException("SHA-256 is not available", e);
    }
  }
}
