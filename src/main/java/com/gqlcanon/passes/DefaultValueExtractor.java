package com.gqlcanon.passes;

import com.gqlcanon.ast.Node;
import com.gqlcanon.traversal.QueryVisitor;
import com.gqlcanon.traversal.TraversalContext;
import com.gqlcanon.traversal.Traverser;
import com.gqlcanon.traversal.VisitAction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class DefaultValueExtractor implements DocumentPass {

    @Override
    public Node.Document apply(Node.Document document) {
        return extract(document).document();
    }

    public DefaultValues extract(Node.Document document) {
        Map<String, Object> defaults = new LinkedHashMap<>();
        Node.Document rewritten = Traverser.traverse(document, new QueryVisitor() {
            @Override
            public VisitAction enterVariableDefinition(Node.VariableDefinition definition, TraversalContext context) {
                if (definition.defaultValue() == null) {
                    return VisitAction.skip();
                }
                defaults.put(definition.variable(), UntypedValues.valueOf(definition.defaultValue(), Map.of()));
                return VisitAction.replace(definition.withDefaultValue(null));
            }

            @Override
            public VisitAction enterSelectionSet(Node.SelectionSet selectionSet, TraversalContext context) {
                return VisitAction.skip();
            }
        });
        return new DefaultValues(rewritten, Collections.unmodifiableMap(defaults));
    }
}
