package com.gqlcanon.ast;

import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;

/**
 * Immutable query document AST. Nullable components ({@code name}, {@code alias},
 * {@code selectionSet} of a leaf field, {@code defaultValue}, {@code typeCondition})
 * are plain {@code null} when absent.
 */
public sealed interface Node permits Node.Document, Node.Definition, Node.VariableDefinition,
        Node.SelectionSet, Node.Selection, Node.Argument, Node.ObjectField, Value, TypeRef {

    record Document(ImmutableList<Definition> definitions) implements Node {
        public static Document of(Definition... definitions) {
            return new Document(Lists.immutable.of(definitions));
        }
    }

    sealed interface Definition extends Node permits OperationDefinition, FragmentDefinition {}

    record OperationDefinition(OperationType operation,
                               String name,
                               ImmutableList<VariableDefinition> variableDefinitions,
                               SelectionSet selectionSet) implements Definition {
        public OperationDefinition withName(String newName) {
            return new OperationDefinition(operation, newName, variableDefinitions, selectionSet);
        }

        public OperationDefinition withVariableDefinitions(ImmutableList<VariableDefinition> definitions) {
            return new OperationDefinition(operation, name, definitions, selectionSet);
        }

        public OperationDefinition withSelectionSet(SelectionSet newSelectionSet) {
            return new OperationDefinition(operation, name, variableDefinitions, newSelectionSet);
        }
    }

    record FragmentDefinition(String name, String typeCondition, SelectionSet selectionSet) implements Definition {}

    record VariableDefinition(String variable, TypeRef type, Value defaultValue) implements Node {
        public VariableDefinition withDefaultValue(Value value) {
            return new VariableDefinition(variable, type, value);
        }
    }

    record SelectionSet(ImmutableList<Selection> selections) implements Node {
        public static SelectionSet of(Selection... selections) {
            return new SelectionSet(Lists.immutable.of(selections));
        }
    }

    sealed interface Selection extends Node permits Field, FragmentSpread, InlineFragment {}

    record Field(String alias, String name, ImmutableList<Argument> arguments, SelectionSet selectionSet)
            implements Selection {
        public static Field of(String name) {
            return new Field(null, name, Lists.immutable.empty(), null);
        }

        public Field withAlias(String newAlias) {
            return new Field(newAlias, name, arguments, selectionSet);
        }

        public Field withArguments(ImmutableList<Argument> newArguments) {
            return new Field(alias, name, newArguments, selectionSet);
        }

        public Field withSelectionSet(SelectionSet newSelectionSet) {
            return new Field(alias, name, arguments, newSelectionSet);
        }
    }

    record FragmentSpread(String name) implements Selection {}

    record InlineFragment(String typeCondition, SelectionSet selectionSet) implements Selection {}

    record Argument(String name, Value value) implements Node {}

    record ObjectField(String name, Value value) implements Node {}
}
