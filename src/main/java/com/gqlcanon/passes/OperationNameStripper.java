package com.gqlcanon.passes;

import com.gqlcanon.ast.Node;
import com.gqlcanon.traversal.QueryVisitor;
import com.gqlcanon.traversal.TraversalContext;
import com.gqlcanon.traversal.Traverser;
import com.gqlcanon.traversal.VisitAction;

public class OperationNameStripper implements DocumentPass {
    private static final QueryVisitor VISITOR = new QueryVisitor() {
        @Override
        public VisitAction enterOperationDefinition(Node.OperationDefinition operation, TraversalContext context) {
            return operation.name() == null ? VisitAction.skip() : VisitAction.replace(operation.withName(null));
        }

        @Override
        public VisitAction enterSelectionSet(Node.SelectionSet selectionSet, TraversalContext context) {
            return VisitAction.skip();
        }
    };

    @Override
    public Node.Document apply(Node.Document document) {
        return Traverser.traverse(document, VISITOR);
    }
}
