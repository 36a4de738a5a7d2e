package com.gqlcanon.ast;

public sealed interface TypeRef extends Node {
    record NamedType(String name) implements TypeRef {}

    record ListType(TypeRef ofType) implements TypeRef {}

    record NonNullType(TypeRef ofType) implements TypeRef {}

    // strips list and non-null wrappers
    static String namedTypeOf(TypeRef type) {
        TypeRef current = type;
        while (!(current instanceof NamedType)) {
            current = current instanceof ListType list ? list.ofType() : ((NonNullType) current).ofType();
        }
        return ((NamedType) current).name();
    }
}
