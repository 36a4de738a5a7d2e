package com.gqlcanon.passes;

import com.gqlcanon.ast.Node;
import com.gqlcanon.traversal.QueryVisitor;
import com.gqlcanon.traversal.TraversalContext;
import com.gqlcanon.traversal.Traverser;
import com.gqlcanon.traversal.VisitAction;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.api.tuple.Pair;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.eclipse.collections.impl.tuple.Tuples;

/**
 * Merges sibling fields that share both name and alias. Arguments and sub-selections of
 * the merged fields are concatenated in encounter order; duplicate arguments are left for
 * {@link ArgumentPruner}. Selection sets holding anything other than fields are left as is.
 * <p>
 * Merging happens when a selection set is entered, so the concatenated sub-selections are
 * merged in turn when the traversal descends into them.
 */
public class Factorizer implements DocumentPass {

    @Override
    public Node.Document apply(Node.Document document) {
        return Traverser.traverse(document, new QueryVisitor() {
            @Override
            public VisitAction enterSelectionSet(Node.SelectionSet selectionSet, TraversalContext context) {
                Node.SelectionSet merged = merge(selectionSet);
                return merged == selectionSet ? VisitAction.idle() : VisitAction.replace(merged);
            }
        });
    }

    static Node.SelectionSet merge(Node.SelectionSet selectionSet) {
        MutableList<Node.Field> fields = Lists.mutable.withInitialCapacity(selectionSet.selections().size());
        MutableMap<Pair<String, String>, Integer> positions = Maps.mutable.empty();
        for (Node.Selection selection : selectionSet.selections()) {
            if (!(selection instanceof Node.Field field)) {
                return selectionSet;
            }
            Pair<String, String> key = Tuples.pair(field.name(), field.alias());
            Integer position = positions.get(key);
            if (position == null) {
                positions.put(key, fields.size());
                fields.add(field);
            } else {
                fields.set(position, mergeFields(fields.get(position), field));
            }
        }
        if (fields.size() == selectionSet.selections().size()) {
            return selectionSet;
        }
        return new Node.SelectionSet(Lists.immutable.<Node.Selection>withAll(fields));
    }

    private static Node.Field mergeFields(Node.Field first, Node.Field second) {
        Node.SelectionSet selectionSet;
        if (first.selectionSet() == null) {
            selectionSet = second.selectionSet();
        } else if (second.selectionSet() == null) {
            selectionSet = first.selectionSet();
        } else {
            selectionSet = new Node.SelectionSet(
                    first.selectionSet().selections().newWithAll(second.selectionSet().selections()));
        }
        return new Node.Field(first.alias(), first.name(),
                first.arguments().newWithAll(second.arguments()), selectionSet);
    }
}
