package restgraph.x.opsynth.intern;

import graphql.language.Argument;
import graphql.language.ArrayValue;
import graphql.language.BooleanValue;
import graphql.language.Directive;
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
import graphql.language.NullValue;
import graphql.language.ObjectField;
import graphql.language.ObjectValue;
import graphql.language.OperationDefinition;
import graphql.language.SelectionSet;
import graphql.language.StringValue;
import graphql.language.TypeName;
import graphql.language.VariableDefinition;
import graphql.language.VariableReference;

/**
 * The closed set of executable-document node kinds that can be signed and interned. Schema
 * definition nodes (type definitions, schema extensions) are not part of an operation and are
 * rejected.
 */
public enum NodeKind {
  DOCUMENT,
  OPERATION_DEFINITION,
  FRAGMENT_DEFINITION,
  SELECTION_SET,
  FIELD,
  FRAGMENT_SPREAD,
  INLINE_FRAGMENT,
  ARGUMENT,
  DIRECTIVE,
  VARIABLE_DEFINITION,
  VARIABLE,
  NAMED_TYPE,
  LIST_TYPE,
  NON_NULL_TYPE,
  STRING,
  INT,
  FLOAT,
  BOOLEAN,
  ENUM,
  NULL,
  LIST,
  OBJECT,
  OBJECT_FIELD;

  /**
   * Classifies a graphql-java AST node.
   *
   * @param node the node to classify
   * @return the kind of the node
   * @throws IllegalArgumentException if the node is not part of an executable document
   */
  public static NodeKind of(Node<?> node) {
    if (node instanceof Field) {
      return FIELD;
    } else if (node instanceof SelectionSet) {
      return SELECTION_SET;
    } else if (node instanceof InlineFragment) {
      return INLINE_FRAGMENT;
    } else if (node instanceof FragmentSpread) {
      return FRAGMENT_SPREAD;
    } else if (node instanceof Argument) {
      return ARGUMENT;
    } else if (node instanceof VariableReference) {
      return VARIABLE;
    } else if (node instanceof TypeName) {
      return NAMED_TYPE;
    } else if (node instanceof ListType) {
      return LIST_TYPE;
    } else if (node instanceof NonNullType) {
      return NON_NULL_TYPE;
    } else if (node instanceof VariableDefinition) {
      return VARIABLE_DEFINITION;
    } else if (node instanceof Directive) {
      return DIRECTIVE;
    } else if (node instanceof OperationDefinition) {
      return OPERATION_DEFINITION;
    } else if (node instanceof FragmentDefinition) {
      return FRAGMENT_DEFINITION;
    } else if (node instanceof Document) {
      return DOCUMENT;
    } else if (node instanceof StringValue) {
      return STRING;
    } else if (node instanceof IntValue) {
      return INT;
    } else if (node instanceof FloatValue) {
      return FLOAT;
    } else if (node instanceof BooleanValue) {
      return BOOLEAN;
    } else if (node instanceof EnumValue) {
      return ENUM;
    } else if (node instanceof NullValue) {
      return NULL;
    } else if (node instanceof ArrayValue) {
      return LIST;
    } else if (node instanceof ObjectValue) {
      return OBJECT;
    } else if (node instanceof ObjectField) {
      return OBJECT_FIELD;
    }
    throw new IllegalArgumentException(
        "Not an executable document node: " + node.getClass().getSimpleName());
  }

  /** Returns true for the kinds that denote input values (literals and variable references). */
  public boolean isValue() {
    return switch (this) {
      case STRING, INT, FLOAT, BOOLEAN, ENUM, NULL, LIST, OBJECT, VARIABLE -> true;
      default -> false;
    };
  }

  /** Returns true for the kinds that denote variable type references. */
  public boolean isTypeReference() {
    return this == NAMED_TYPE || this == LIST_TYPE || this == NON_NULL_TYPE;
  }
}
