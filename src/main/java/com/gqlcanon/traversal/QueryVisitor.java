package com.gqlcanon.traversal;

import com.gqlcanon.ast.Node;
import com.gqlcanon.ast.Value;

/**
 * Per-kind callbacks for {@link Traverser}. Every kind-specific method falls back to
 * {@link #enter(Node, TraversalContext)} or {@link #leave(Node, TraversalContext)},
 * which do nothing unless overridden.
 */
public abstract class QueryVisitor {

    public VisitAction enter(Node node, TraversalContext context) {
        return VisitAction.idle();
    }

    public VisitAction leave(Node node, TraversalContext context) {
        return VisitAction.idle();
    }

    public VisitAction enterDocument(Node.Document node, TraversalContext context) {
        return enter(node, context);
    }

    public VisitAction leaveDocument(Node.Document node, TraversalContext context) {
        return leave(node, context);
    }

    public VisitAction enterOperationDefinition(Node.OperationDefinition node, TraversalContext context) {
        return enter(node, context);
    }

    public VisitAction leaveOperationDefinition(Node.OperationDefinition node, TraversalContext context) {
        return leave(node, context);
    }

    public VisitAction enterFragmentDefinition(Node.FragmentDefinition node, TraversalContext context) {
        return enter(node, context);
    }

    public VisitAction leaveFragmentDefinition(Node.FragmentDefinition node, TraversalContext context) {
        return leave(node, context);
    }

    public VisitAction enterVariableDefinition(Node.VariableDefinition node, TraversalContext context) {
        return enter(node, context);
    }

    public VisitAction leaveVariableDefinition(Node.VariableDefinition node, TraversalContext context) {
        return leave(node, context);
    }

    public VisitAction enterSelectionSet(Node.SelectionSet node, TraversalContext context) {
        return enter(node, context);
    }

    public VisitAction leaveSelectionSet(Node.SelectionSet node, TraversalContext context) {
        return leave(node, context);
    }

    public VisitAction enterField(Node.Field node, TraversalContext context) {
        return enter(node, context);
    }

    public VisitAction leaveField(Node.Field node, TraversalContext context) {
        return leave(node, context);
    }

    public VisitAction enterFragmentSpread(Node.FragmentSpread node, TraversalContext context) {
        return enter(node, context);
    }

    public VisitAction leaveFragmentSpread(Node.FragmentSpread node, TraversalContext context) {
        return leave(node, context);
    }

    public VisitAction enterInlineFragment(Node.InlineFragment node, TraversalContext context) {
        return enter(node, context);
    }

    public VisitAction leaveInlineFragment(Node.InlineFragment node, TraversalContext context) {
        return leave(node, context);
    }

    public VisitAction enterArgument(Node.Argument node, TraversalContext context) {
        return enter(node, context);
    }

    public VisitAction leaveArgument(Node.Argument node, TraversalContext context) {
        return leave(node, context);
    }

    public VisitAction enterObjectField(Node.ObjectField node, TraversalContext context) {
        return enter(node, context);
    }

    public VisitAction leaveObjectField(Node.ObjectField node, TraversalContext context) {
        return leave(node, context);
    }

    /** Called for every value kind, variables and containers included. */
    public VisitAction enterValue(Value node, TraversalContext context) {
        return enter(node, context);
    }

    public VisitAction leaveValue(Value node, TraversalContext context) {
        return leave(node, context);
    }
}
