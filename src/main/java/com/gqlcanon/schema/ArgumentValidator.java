package com.gqlcanon.schema;

import com.gqlcanon.ast.Node;
import org.eclipse.collections.api.list.ImmutableList;

@FunctionalInterface
public interface ArgumentValidator {
    ImmutableList<UnknownArgument> validate(Node.Document document);
}
