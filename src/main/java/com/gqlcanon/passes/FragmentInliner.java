package com.gqlcanon.passes;

import com.gqlcanon.StructuralViolationException;
import com.gqlcanon.UnresolvedReferenceException;
import com.gqlcanon.ast.Node;
import com.gqlcanon.traversal.QueryVisitor;
import com.gqlcanon.traversal.TraversalContext;
import com.gqlcanon.traversal.Traverser;
import com.gqlcanon.traversal.VisitAction;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.eclipse.collections.impl.factory.Sets;

/**
 * Replaces every fragment spread with the selections of the fragment it names and drops
 * all fragment definitions. When a fragment is defined more than once the last definition
 * is used. Fragment bodies are themselves inlined before being spliced in, so no spread
 * survives at any depth.
 */
public class FragmentInliner implements DocumentPass {

    @Override
    public Node.Document apply(Node.Document document) {
        MutableMap<String, Node.FragmentDefinition> fragments = Maps.mutable.empty();
        for (Node.Definition definition : document.definitions()) {
            if (definition instanceof Node.FragmentDefinition fragment) {
                fragments.put(fragment.name(), fragment);
            }
        }
        return Traverser.traverse(document, new Splicer(fragments));
    }

    /**
     * Splices resolved fragment bodies into selection sets. Resolved bodies are memoized
     * for the duration of one document.
     */
    private static final class Splicer extends QueryVisitor {
        private final MutableMap<String, Node.FragmentDefinition> fragments;
        private final MutableMap<String, ImmutableList<Node.Selection>> resolved = Maps.mutable.empty();
        private final MutableSet<String> inProgress = Sets.mutable.empty();

        Splicer(MutableMap<String, Node.FragmentDefinition> fragments) {
            this.fragments = fragments;
        }

        @Override
        public VisitAction enterFragmentDefinition(Node.FragmentDefinition fragment, TraversalContext context) {
            return VisitAction.remove();
        }

        @Override
        public VisitAction enterSelectionSet(Node.SelectionSet selectionSet, TraversalContext context) {
            if (!selectionSet.selections().anySatisfy(Node.FragmentSpread.class::isInstance)) {
                return VisitAction.idle();
            }
            MutableList<Node.Selection> selections = Lists.mutable.empty();
            for (Node.Selection selection : selectionSet.selections()) {
                if (selection instanceof Node.FragmentSpread spread) {
                    selections.addAllIterable(body(spread.name()));
                } else {
                    selections.add(selection);
                }
            }
            return VisitAction.replace(new Node.SelectionSet(selections.toImmutable()));
        }

        private ImmutableList<Node.Selection> body(String name) {
            ImmutableList<Node.Selection> body = resolved.get(name);
            if (body != null) {
                return body;
            }
            Node.FragmentDefinition fragment = fragments.get(name);
            if (fragment == null) {
                throw new UnresolvedReferenceException("Unknown fragment \"" + name + "\"");
            }
            if (!inProgress.add(name)) {
                throw new StructuralViolationException("Fragment \"" + name + "\" spreads itself");
            }
            body = ((Node.SelectionSet) Traverser.traverse(fragment.selectionSet(), this)).selections();
            inProgress.remove(name);
            resolved.put(name, body);
            return body;
        }
    }
}
