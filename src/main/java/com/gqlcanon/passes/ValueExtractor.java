package com.gqlcanon.passes;

import com.gqlcanon.ast.Node;
import com.gqlcanon.ast.Value;
import com.gqlcanon.json.VariablesParser;
import com.gqlcanon.traversal.QueryVisitor;
import com.gqlcanon.traversal.TraversalContext;
import com.gqlcanon.traversal.Traverser;
import com.gqlcanon.traversal.VisitAction;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * Replaces argument values with positional placeholder variables ({@code $_0}, {@code $_1}, ...)
 * and collects the values they replaced. Object values are descended into rather than
 * extracted, lists are extracted whole. Values passed to an argument or object field whose
 * name is ignored stay in the document, as do variable default values. A variable reference
 * is itself replaced, its value looked up among the variables supplied with the query.
 */
public class ValueExtractor implements DocumentPass {
    private final ImmutableSet<String> ignoredArguments;
    private final Map<String, ?> variables;

    public ValueExtractor() {
        this(Set.of(), Map.of());
    }

    public ValueExtractor(Collection<String> ignoredArguments) {
        this(ignoredArguments, Map.of());
    }

    public ValueExtractor(Collection<String> ignoredArguments, Map<String, ?> variables) {
        this.ignoredArguments = Sets.immutable.withAll(ignoredArguments);
        this.variables = variables;
    }

    /**
     * @param variablesJson the variables supplied with the query, as a JSON object
     */
    public ValueExtractor(Collection<String> ignoredArguments, String variablesJson) {
        this(ignoredArguments, new VariablesParser().parse(variablesJson));
    }

    @Override
    public Node.Document apply(Node.Document document) {
        return extract(document).document();
    }

    public ExtractedValues extract(Node.Document document) {
        MutableList<Object> values = Lists.mutable.empty();
        Node.Document rewritten = Traverser.traverse(document, new QueryVisitor() {
            @Override
            public VisitAction enterValue(Value value, TraversalContext context) {
                if (value instanceof Value.ObjectValue || context.isWithin(Node.VariableDefinition.class)) {
                    return VisitAction.idle();
                }
                String owner = ownerName(context);
                if (owner != null && ignoredArguments.contains(owner)) {
                    return VisitAction.idle();
                }
                values.add(value instanceof Value.Variable variable
                        ? UntypedValues.variableValue(variable.name(), variables)
                        : UntypedValues.valueOf(value, variables));
                return VisitAction.replace(new Value.Variable("_" + (values.size() - 1)));
            }
        });
        return new ExtractedValues(rewritten, values.asUnmodifiable());
    }

    /** Name of the closest enclosing argument or object field. */
    private static String ownerName(TraversalContext context) {
        ListIterable<Node> ancestors = context.ancestors();
        for (int i = ancestors.size() - 1; i >= 0; i--) {
            Node ancestor = ancestors.get(i);
            if (ancestor instanceof Node.Argument argument) {
                return argument.name();
            }
            if (ancestor instanceof Node.ObjectField field) {
                return field.name();
            }
        }
        return null;
    }
}
