package com.gqlcanon.traversal;

import com.gqlcanon.ast.Node;

public sealed interface VisitAction {
    record Idle() implements VisitAction {}

    /** Do not descend into the node; its leave callback is not invoked either. */
    record Skip() implements VisitAction {}

    /** Drop the node from the list that holds it. */
    record Remove() implements VisitAction {}

    record Replace(Node node) implements VisitAction {}

    VisitAction IDLE = new Idle();
    VisitAction SKIP = new Skip();
    VisitAction REMOVE = new Remove();

    static VisitAction idle() {
        return IDLE;
    }

    static VisitAction skip() {
        return SKIP;
    }

    static VisitAction remove() {
        return REMOVE;
    }

    static VisitAction replace(Node node) {
        return new Replace(node);
    }
}
