package com.gqlcanon.traversal;

import com.gqlcanon.ast.Node;
import com.gqlcanon.ast.TypeRef;
import com.gqlcanon.ast.Value;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Depth-first rewriting walk over an immutable AST. Nodes are entered pre-order and left
 * post-order; siblings are visited left to right. A node whose children all came back
 * unchanged is returned as-is, otherwise a new node is built around the new children.
 * Type references are leaves and are never handed to the visitor.
 */
public final class Traverser {
    private final QueryVisitor visitor;
    private final TraversalContext context = new TraversalContext();

    private Traverser(QueryVisitor visitor) {
        this.visitor = visitor;
    }

    public static Node.Document traverse(Node.Document document, QueryVisitor visitor) {
        Node result = traverse((Node) document, visitor);
        if (!(result instanceof Node.Document rewritten)) {
            throw new IllegalStateException("Document was replaced by " + result.getClass().getSimpleName());
        }
        return rewritten;
    }

    public static Node traverse(Node root, QueryVisitor visitor) {
        Node result = new Traverser(visitor).visit(root);
        if (result == null) {
            throw new IllegalStateException("Cannot remove the root " + root.getClass().getSimpleName());
        }
        return result;
    }

    /**
     * @return the visited node, its replacement, or {@code null} when the visitor removed it
     */
    private Node visit(Node node) {
        VisitAction onEnter = enter(node);
        if (onEnter instanceof VisitAction.Remove) {
            return null;
        }
        if (onEnter instanceof VisitAction.Skip) {
            return node;
        }
        Node current = onEnter instanceof VisitAction.Replace replace ? replace.node() : node;

        context.push(current);
        Node rebuilt;
        try {
            rebuilt = visitChildren(current);
        } finally {
            context.pop();
        }

        VisitAction onLeave = leave(rebuilt);
        if (onLeave instanceof VisitAction.Remove) {
            return null;
        }
        if (onLeave instanceof VisitAction.Replace replace) {
            return replace.node();
        }
        return rebuilt;
    }

    private Node visitChildren(Node node) {
        if (node instanceof Node.Document document) {
            ImmutableList<Node.Definition> definitions = visitList(document.definitions(), Node.Definition.class);
            return definitions == document.definitions() ? document : new Node.Document(definitions);
        }
        if (node instanceof Node.OperationDefinition operation) {
            ImmutableList<Node.VariableDefinition> variables =
                    visitList(operation.variableDefinitions(), Node.VariableDefinition.class);
            Node.SelectionSet selectionSet = visitChild(operation.selectionSet(), Node.SelectionSet.class, operation);
            if (variables == operation.variableDefinitions() && selectionSet == operation.selectionSet()) {
                return operation;
            }
            return new Node.OperationDefinition(operation.operation(), operation.name(), variables, selectionSet);
        }
        if (node instanceof Node.FragmentDefinition fragment) {
            Node.SelectionSet selectionSet = visitChild(fragment.selectionSet(), Node.SelectionSet.class, fragment);
            return selectionSet == fragment.selectionSet()
                    ? fragment
                    : new Node.FragmentDefinition(fragment.name(), fragment.typeCondition(), selectionSet);
        }
        if (node instanceof Node.VariableDefinition definition) {
            Value defaultValue = visitChild(definition.defaultValue(), Value.class, definition);
            return defaultValue == definition.defaultValue() ? definition : definition.withDefaultValue(defaultValue);
        }
        if (node instanceof Node.SelectionSet selectionSet) {
            ImmutableList<Node.Selection> selections = visitList(selectionSet.selections(), Node.Selection.class);
            return selections == selectionSet.selections() ? selectionSet : new Node.SelectionSet(selections);
        }
        if (node instanceof Node.Field field) {
            ImmutableList<Node.Argument> arguments = visitList(field.arguments(), Node.Argument.class);
            Node.SelectionSet selectionSet = visitChild(field.selectionSet(), Node.SelectionSet.class, field);
            if (arguments == field.arguments() && selectionSet == field.selectionSet()) {
                return field;
            }
            return new Node.Field(field.alias(), field.name(), arguments, selectionSet);
        }
        if (node instanceof Node.InlineFragment fragment) {
            Node.SelectionSet selectionSet = visitChild(fragment.selectionSet(), Node.SelectionSet.class, fragment);
            return selectionSet == fragment.selectionSet()
                    ? fragment
                    : new Node.InlineFragment(fragment.typeCondition(), selectionSet);
        }
        if (node instanceof Node.Argument argument) {
            Value value = visitChild(argument.value(), Value.class, argument);
            return value == argument.value() ? argument : new Node.Argument(argument.name(), value);
        }
        if (node instanceof Node.ObjectField objectField) {
            Value value = visitChild(objectField.value(), Value.class, objectField);
            return value == objectField.value() ? objectField : new Node.ObjectField(objectField.name(), value);
        }
        if (node instanceof Value.ListValue list) {
            ImmutableList<Value> values = visitList(list.values(), Value.class);
            return values == list.values() ? list : new Value.ListValue(values);
        }
        if (node instanceof Value.ObjectValue object) {
            ImmutableList<Node.ObjectField> fields = visitList(object.fields(), Node.ObjectField.class);
            return fields == object.fields() ? object : new Value.ObjectValue(fields);
        }
        // fragment spreads, scalar values, variables and type references have no visited children
        return node;
    }

    private <T extends Node> ImmutableList<T> visitList(ImmutableList<T> nodes, Class<T> kind) {
        MutableList<T> visited = Lists.mutable.withInitialCapacity(nodes.size());
        boolean changed = false;
        for (T node : nodes) {
            Node result = visit(node);
            if (result != node) {
                changed = true;
            }
            if (result != null) {
                visited.add(checkKind(result, kind, node));
            }
        }
        return changed ? visited.toImmutable() : nodes;
    }

    private <T extends Node> T visitChild(T child, Class<T> kind, Node parent) {
        if (child == null) {
            return null;
        }
        Node result = visit(child);
        if (result == null) {
            throw new IllegalStateException("Only list elements can be removed, not the "
                    + child.getClass().getSimpleName() + " of " + parent.getClass().getSimpleName());
        }
        return checkKind(result, kind, child);
    }

    private static <T extends Node> T checkKind(Node result, Class<T> kind, Node original) {
        if (!kind.isInstance(result)) {
            throw new IllegalStateException("Cannot replace " + original.getClass().getSimpleName()
                    + " with " + result.getClass().getSimpleName());
        }
        return kind.cast(result);
    }

    private VisitAction enter(Node node) {
        if (node instanceof Node.Document document) {
            return visitor.enterDocument(document, context);
        }
        if (node instanceof Node.OperationDefinition operation) {
            return visitor.enterOperationDefinition(operation, context);
        }
        if (node instanceof Node.FragmentDefinition fragment) {
            return visitor.enterFragmentDefinition(fragment, context);
        }
        if (node instanceof Node.VariableDefinition definition) {
            return visitor.enterVariableDefinition(definition, context);
        }
        if (node instanceof Node.SelectionSet selectionSet) {
            return visitor.enterSelectionSet(selectionSet, context);
        }
        if (node instanceof Node.Field field) {
            return visitor.enterField(field, context);
        }
        if (node instanceof Node.FragmentSpread spread) {
            return visitor.enterFragmentSpread(spread, context);
        }
        if (node instanceof Node.InlineFragment fragment) {
            return visitor.enterInlineFragment(fragment, context);
        }
        if (node instanceof Node.Argument argument) {
            return visitor.enterArgument(argument, context);
        }
        if (node instanceof Node.ObjectField objectField) {
            return visitor.enterObjectField(objectField, context);
        }
        if (node instanceof Value value) {
            return visitor.enterValue(value, context);
        }
        if (node instanceof TypeRef) {
            return VisitAction.skip();
        }
        throw new IllegalStateException("Unknown node kind: " + node.getClass().getName());
    }

    private VisitAction leave(Node node) {
        if (node instanceof Node.Document document) {
            return visitor.leaveDocument(document, context);
        }
        if (node instanceof Node.OperationDefinition operation) {
            return visitor.leaveOperationDefinition(operation, context);
        }
        if (node instanceof Node.FragmentDefinition fragment) {
            return visitor.leaveFragmentDefinition(fragment, context);
        }
        if (node instanceof Node.VariableDefinition definition) {
            return visitor.leaveVariableDefinition(definition, context);
        }
        if (node instanceof Node.SelectionSet selectionSet) {
            return visitor.leaveSelectionSet(selectionSet, context);
        }
        if (node instanceof Node.Field field) {
            return visitor.leaveField(field, context);
        }
        if (node instanceof Node.FragmentSpread spread) {
            return visitor.leaveFragmentSpread(spread, context);
        }
        if (node instanceof Node.InlineFragment fragment) {
            return visitor.leaveInlineFragment(fragment, context);
        }
        if (node instanceof Node.Argument argument) {
            return visitor.leaveArgument(argument, context);
        }
        if (node instanceof Node.ObjectField objectField) {
            return visitor.leaveObjectField(objectField, context);
        }
        if (node instanceof Value value) {
            return visitor.leaveValue(value, context);
        }
        if (node instanceof TypeRef) {
            return VisitAction.idle();
        }
        throw new IllegalStateException("Unknown node kind: " + node.getClass().getName());
    }
}
