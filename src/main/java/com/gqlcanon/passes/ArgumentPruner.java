package com.gqlcanon.passes;

import com.gqlcanon.ast.Node;
import com.gqlcanon.traversal.QueryVisitor;
import com.gqlcanon.traversal.TraversalContext;
import com.gqlcanon.traversal.Traverser;
import com.gqlcanon.traversal.VisitAction;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.block.factory.HashingStrategies;

public class ArgumentPruner implements DocumentPass {
    private static final QueryVisitor VISITOR = new QueryVisitor() {
        @Override
        public VisitAction enterField(Node.Field field, TraversalContext context) {
            ImmutableList<Node.Argument> arguments =
                    field.arguments().distinct(HashingStrategies.fromFunction(Node.Argument::name));
            if (arguments.size() == field.arguments().size()) {
                return VisitAction.idle();
            }
            return VisitAction.replace(field.withArguments(arguments));
        }
    };

    @Override
    public Node.Document apply(Node.Document document) {
        return Traverser.traverse(document, VISITOR);
    }
}
