package com.gqlcanon.schema;

import com.gqlcanon.ast.Node;
import com.gqlcanon.ast.TypeRef;
import com.gqlcanon.traversal.TraversalContext;

/**
 * Reports the input type the schema expects at a position of a document being traversed.
 */
public interface InputTypeOracle {

    /**
     * @param node    the node being visited, usually a {@link com.gqlcanon.ast.Value}
     * @param context the ancestors of {@code node}
     * @return the expected input type, or {@code null} when the schema does not describe the position
     */
    TypeRef expectedInputType(Node node, TraversalContext context);

    /** @return the named type, or {@code null} when unknown */
    SchemaType namedType(String name);
}
