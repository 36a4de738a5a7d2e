package com.gqlcanon.schema;

import com.gqlcanon.ast.Node;

public record UnknownArgument(Node.Argument argument, String fieldName, String typeName) {

    public String message() {
        return "Unknown argument '" + argument.name() + "' on field '" + typeName + "." + fieldName + "'.";
    }
}
