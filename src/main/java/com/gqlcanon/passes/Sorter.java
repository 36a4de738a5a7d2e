package com.gqlcanon.passes;

import com.gqlcanon.ast.Node;
import com.gqlcanon.ast.Value;
import com.gqlcanon.output.AstPrinter;
import com.gqlcanon.traversal.QueryVisitor;
import com.gqlcanon.traversal.TraversalContext;
import com.gqlcanon.traversal.Traverser;
import com.gqlcanon.traversal.VisitAction;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.tuple.Pair;
import org.eclipse.collections.impl.tuple.Tuples;

import java.util.Comparator;

/**
 * Orders field arguments, object value fields and selections by their printed form with
 * aliases removed, so that two fields differing only by alias sort by their content.
 * Children are sorted before their parents, hence a node's key already reflects the
 * canonical order of everything below it. The sort is stable and idempotent.
 */
public class Sorter implements DocumentPass {
    static final Comparator<String> CODE_POINT_ORDER = Sorter::compareCodePoints;

    private static final QueryVisitor VISITOR = new QueryVisitor() {
        @Override
        public VisitAction leaveField(Node.Field field, TraversalContext context) {
            ImmutableList<Node.Argument> arguments = sorted(field.arguments());
            return arguments == field.arguments() ? VisitAction.idle() : VisitAction.replace(field.withArguments(arguments));
        }

        @Override
        public VisitAction leaveValue(Value value, TraversalContext context) {
            if (!(value instanceof Value.ObjectValue object)) {
                return VisitAction.idle();
            }
            ImmutableList<Node.ObjectField> fields = sorted(object.fields());
            return fields == object.fields() ? VisitAction.idle() : VisitAction.replace(new Value.ObjectValue(fields));
        }

        @Override
        public VisitAction leaveSelectionSet(Node.SelectionSet selectionSet, TraversalContext context) {
            ImmutableList<Node.Selection> selections = sorted(selectionSet.selections());
            return selections == selectionSet.selections()
                    ? VisitAction.idle()
                    : VisitAction.replace(new Node.SelectionSet(selections));
        }
    };

    @Override
    public Node.Document apply(Node.Document document) {
        return Traverser.traverse(document, VISITOR);
    }

    /** The printed text of {@code node} once every alias inside it is removed. */
    static String sortKey(Node node) {
        return AstPrinter.print(AliasStripper.strip(node));
    }

    /** @return {@code nodes} itself when it is already in order */
    private static <T extends Node> ImmutableList<T> sorted(ImmutableList<T> nodes) {
        if (nodes.size() < 2) {
            return nodes;
        }
        MutableList<Pair<String, T>> keyed = nodes.collect(node -> Tuples.pair(sortKey(node), node)).toList();
        MutableList<T> ordered = keyed
                .sortThis(Comparator.<Pair<String, T>, String>comparing(Pair::getOne, CODE_POINT_ORDER))
                .collect(Pair::getTwo);
        for (int i = 0; i < ordered.size(); i++) {
            if (ordered.get(i) != nodes.get(i)) {
                return ordered.toImmutable();
            }
        }
        return nodes;
    }

    private static int compareCodePoints(String left, String right) {
        int i = 0;
        int j = 0;
        while (i < left.length() && j < right.length()) {
            int a = left.codePointAt(i);
            int b = right.codePointAt(j);
            if (a != b) {
                return Integer.compare(a, b);
            }
            i += Character.charCount(a);
            j += Character.charCount(b);
        }
        return Integer.compare(left.length() - i, right.length() - j);
    }
}
