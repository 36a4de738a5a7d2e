package com.gqlcanon.passes;

import com.gqlcanon.StructuralViolationException;
import com.gqlcanon.ast.Node;
import com.gqlcanon.ast.OperationType;
import org.eclipse.collections.api.list.ImmutableList;

import java.util.stream.Stream;

/**
 * Splits the query (or subscription) operation of a document into one document per root
 * field. Each document keeps the operation kind and its variable declarations; the name is
 * dropped, and so is the root field's alias unless asked otherwise. Mutations are ignored.
 */
public class RootQuerySplitter {
    private final boolean removeAliases;

    public RootQuerySplitter() {
        this(true);
    }

    public RootQuerySplitter(boolean removeAliases) {
        this.removeAliases = removeAliases;
    }

    /**
     * The document is checked as a whole before the stream is returned; documents are built
     * as the stream is consumed.
     *
     * @throws StructuralViolationException when the document holds more than one query or
     *                                      subscription operation, or a root selection is not a field
     */
    public Stream<Node.Document> split(Node.Document document) {
        ImmutableList<Node.OperationDefinition> operations = document.definitions()
                .selectInstancesOf(Node.OperationDefinition.class)
                .reject(operation -> operation.operation() == OperationType.MUTATION);
        if (operations.size() > 1) {
            throw new StructuralViolationException("Document contains more than one query operation");
        }
        if (operations.isEmpty()) {
            return Stream.empty();
        }
        Node.OperationDefinition operation = operations.getFirst();
        Node.Selection unexpected = operation.selectionSet().selections()
                .detect(selection -> !(selection instanceof Node.Field));
        if (unexpected != null) {
            throw new StructuralViolationException("Unexpected root selection " + unexpected.getClass().getSimpleName());
        }
        return operation.selectionSet().selections().castToList().stream()
                .map(selection -> (Node.Field) selection)
                .map(field -> Node.Document.of(new Node.OperationDefinition(
                        operation.operation(),
                        null,
                        operation.variableDefinitions(),
                        Node.SelectionSet.of(removeAliases ? field.withAlias(null) : field))));
    }
}
