package com.gqlcanon.schema;

import org.eclipse.collections.api.list.ImmutableList;

/**
 * Named schema types. List and non-null wrappers are not types of their own here: field,
 * argument and input field types are kept as {@link com.gqlcanon.ast.TypeRef}s and resolved
 * by name through {@link Schema#namedType(String)}.
 */
public sealed interface SchemaType {
    String name();

    record ScalarType(String name) implements SchemaType {}

    record EnumType(String name, ImmutableList<String> values) implements SchemaType {}

    record InputObjectType(String name, ImmutableList<InputValueDefinition> fields) implements SchemaType {
        public InputValueDefinition field(String fieldName) {
            return fields.detect(field -> field.name().equals(fieldName));
        }
    }

    record UnionType(String name, ImmutableList<String> members) implements SchemaType {}

    /** Types that declare fields and can therefore be selected from. */
    sealed interface CompositeType extends SchemaType permits ObjectType, InterfaceType {
        ImmutableList<FieldDefinition> fields();

        default FieldDefinition field(String fieldName) {
            return fields().detect(field -> field.name().equals(fieldName));
        }
    }

    record ObjectType(String name, ImmutableList<FieldDefinition> fields) implements CompositeType {}

    record InterfaceType(String name, ImmutableList<FieldDefinition> fields) implements CompositeType {}
}
