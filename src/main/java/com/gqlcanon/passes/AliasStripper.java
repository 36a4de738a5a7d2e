package com.gqlcanon.passes;

import com.gqlcanon.ast.Node;
import com.gqlcanon.traversal.QueryVisitor;
import com.gqlcanon.traversal.TraversalContext;
import com.gqlcanon.traversal.Traverser;
import com.gqlcanon.traversal.VisitAction;

public class AliasStripper implements DocumentPass {
    private static final QueryVisitor VISITOR = new QueryVisitor() {
        @Override
        public VisitAction enterField(Node.Field field, TraversalContext context) {
            return field.alias() == null ? VisitAction.idle() : VisitAction.replace(field.withAlias(null));
        }
    };

    @Override
    public Node.Document apply(Node.Document document) {
        return Traverser.traverse(document, VISITOR);
    }

    /** Strips aliases below any node, not only documents. */
    public static Node strip(Node node) {
        return Traverser.traverse(node, VISITOR);
    }
}
