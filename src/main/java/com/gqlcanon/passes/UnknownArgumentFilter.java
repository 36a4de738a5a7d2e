package com.gqlcanon.passes;

import com.gqlcanon.ast.Node;
import com.gqlcanon.schema.ArgumentValidator;
import com.gqlcanon.schema.KnownArgumentNames;
import com.gqlcanon.schema.Schema;
import com.gqlcanon.schema.UnknownArgument;
import com.gqlcanon.traversal.QueryVisitor;
import com.gqlcanon.traversal.TraversalContext;
import com.gqlcanon.traversal.Traverser;
import com.gqlcanon.traversal.VisitAction;
import org.eclipse.collections.api.list.ImmutableList;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Removes the arguments a validator reports as unknown. Reported arguments are matched by
 * identity, so an identical argument on a field that does declare it is kept.
 */
public class UnknownArgumentFilter implements DocumentPass {
    private final ArgumentValidator validator;

    public UnknownArgumentFilter(Schema schema) {
        this(new KnownArgumentNames(schema));
    }

    public UnknownArgumentFilter(ArgumentValidator validator) {
        this.validator = validator;
    }

    @Override
    public Node.Document apply(Node.Document document) {
        ImmutableList<UnknownArgument> unknown = validator.validate(document);
        if (unknown.isEmpty()) {
            return document;
        }
        Set<Node.Argument> reported = Collections.newSetFromMap(new IdentityHashMap<>());
        unknown.forEach(error -> reported.add(error.argument()));
        return Traverser.traverse(document, new QueryVisitor() {
            @Override
            public VisitAction enterArgument(Node.Argument argument, TraversalContext context) {
                return reported.contains(argument) ? VisitAction.remove() : VisitAction.skip();
            }
        });
    }
}
