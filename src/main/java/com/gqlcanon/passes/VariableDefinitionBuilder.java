package com.gqlcanon.passes;

import com.gqlcanon.ast.Node;
import com.gqlcanon.ast.TypeRef;
import com.gqlcanon.ast.Value;
import com.gqlcanon.schema.InputTypeOracle;
import com.gqlcanon.traversal.QueryVisitor;
import com.gqlcanon.traversal.TraversalContext;
import com.gqlcanon.traversal.Traverser;
import com.gqlcanon.traversal.VisitAction;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rebuilds the variable declarations of every operation from the variables it uses. Existing
 * declarations are dropped; each referenced variable is declared once, in order of first use,
 * with the input type expected at its last use. Variables used inside fragment definitions
 * are not seen, so fragments should be inlined first.
 */
public class VariableDefinitionBuilder implements DocumentPass {
    private static final Logger LOG = LoggerFactory.getLogger(VariableDefinitionBuilder.class);

    private final InputTypeOracle oracle;

    public VariableDefinitionBuilder(InputTypeOracle oracle) {
        this.oracle = oracle;
    }

    @Override
    public Node.Document apply(Node.Document document) {
        return Traverser.traverse(document, new QueryVisitor() {
            private final Map<String, TypeRef> used = new LinkedHashMap<>();

            @Override
            public VisitAction enterOperationDefinition(Node.OperationDefinition operation, TraversalContext context) {
                used.clear();
                return VisitAction.idle();
            }

            @Override
            public VisitAction enterFragmentDefinition(Node.FragmentDefinition fragment, TraversalContext context) {
                return VisitAction.skip();
            }

            @Override
            public VisitAction enterVariableDefinition(Node.VariableDefinition definition, TraversalContext context) {
                return VisitAction.remove();
            }

            @Override
            public VisitAction enterValue(Value value, TraversalContext context) {
                if (value instanceof Value.Variable variable) {
                    used.put(variable.name(), oracle.expectedInputType(value, context));
                }
                return VisitAction.idle();
            }

            @Override
            public VisitAction leaveOperationDefinition(Node.OperationDefinition operation, TraversalContext context) {
                MutableList<Node.VariableDefinition> definitions = Lists.mutable.empty();
                used.forEach((name, type) -> {
                    if (type == null) {
                        LOG.warn("Cannot infer the type of variable ${}, leaving it undeclared", name);
                    } else {
                        definitions.add(new Node.VariableDefinition(name, type, null));
                    }
                });
                return VisitAction.replace(operation.withVariableDefinitions(definitions.toImmutable()));
            }
        });
    }
}
