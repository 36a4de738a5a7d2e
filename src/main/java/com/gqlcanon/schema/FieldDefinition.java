package com.gqlcanon.schema;

import com.gqlcanon.ast.TypeRef;
import org.eclipse.collections.api.list.ImmutableList;

public record FieldDefinition(String name, ImmutableList<InputValueDefinition> arguments, TypeRef type) {
    public InputValueDefinition argument(String argumentName) {
        return arguments.detect(argument -> argument.name().equals(argumentName));
    }
}
