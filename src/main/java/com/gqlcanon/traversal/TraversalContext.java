package com.gqlcanon.traversal;

import com.gqlcanon.ast.Node;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Ancestor chain of the node currently being visited. The chain does not include the
 * node itself and reflects replacements made on enter.
 */
public final class TraversalContext {
    private final MutableList<Node> ancestors = Lists.mutable.empty();

    TraversalContext() {
    }

    /** Closest ancestor, or {@code null} at the root. */
    public Node parent() {
        return ancestors.isEmpty() ? null : ancestors.getLast();
    }

    /** Root first. */
    public ListIterable<Node> ancestors() {
        return ancestors.asUnmodifiable();
    }

    public boolean isWithin(Class<? extends Node> kind) {
        return ancestors.anySatisfy(kind::isInstance);
    }

    public <T extends Node> T nearest(Class<T> kind) {
        for (int i = ancestors.size() - 1; i >= 0; i--) {
            Node ancestor = ancestors.get(i);
            if (kind.isInstance(ancestor)) {
                return kind.cast(ancestor);
            }
        }
        return null;
    }

    public int depth() {
        return ancestors.size();
    }

    void push(Node node) {
        ancestors.add(node);
    }

    void pop() {
        ancestors.remove(ancestors.size() - 1);
    }
}
