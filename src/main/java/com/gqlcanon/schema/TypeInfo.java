package com.gqlcanon.schema;

import com.gqlcanon.ast.Node;
import com.gqlcanon.ast.TypeRef;
import com.gqlcanon.ast.Value;
import com.gqlcanon.traversal.TraversalContext;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Schema position tracking computed from the ancestor chain. Walking the chain from the
 * root yields the enclosing composite type, the field definition being selected and the
 * input type expected by the innermost argument, object field or list.
 */
public final class TypeInfo implements InputTypeOracle {
    private static final FieldDefinition TYPENAME = new FieldDefinition(
            "__typename", Lists.immutable.empty(),
            new TypeRef.NonNullType(new TypeRef.NamedType("String")));

    private final Schema schema;

    public TypeInfo(Schema schema) {
        this.schema = schema;
    }

    public Schema schema() {
        return schema;
    }

    /**
     * Where a node sits in the schema. Any component may be {@code null} when the schema
     * does not describe the position.
     */
    public record Position(SchemaType parentType, FieldDefinition fieldDefinition, TypeRef inputType) {}

    @Override
    public TypeRef expectedInputType(Node node, TraversalContext context) {
        return positionOf(node, context).inputType();
    }

    @Override
    public SchemaType namedType(String name) {
        return schema.namedType(name);
    }

    public Position positionOf(Node node, TraversalContext context) {
        SchemaType parentType = null;
        FieldDefinition fieldDefinition = null;
        TypeRef inputType = null;

        ImmutableList<Node> path = context.ancestors().toList().toImmutable().newWith(node);
        for (int i = 0; i < path.size(); i++) {
            Node current = path.get(i);
            boolean isAncestor = i < path.size() - 1;
            if (current instanceof Node.OperationDefinition operation) {
                parentType = schema.rootType(operation.operation());
                fieldDefinition = null;
            } else if (current instanceof Node.FragmentDefinition fragment) {
                parentType = schema.namedType(fragment.typeCondition());
                fieldDefinition = null;
            } else if (current instanceof Node.InlineFragment fragment && fragment.typeCondition() != null) {
                parentType = schema.namedType(fragment.typeCondition());
            } else if (current instanceof Node.Field field) {
                fieldDefinition = fieldOf(parentType, field.name());
                if (isAncestor) {
                    parentType = fieldDefinition == null ? null : schema.namedType(TypeRef.namedTypeOf(fieldDefinition.type()));
                }
            } else if (current instanceof Node.VariableDefinition definition) {
                inputType = definition.type();
            } else if (current instanceof Node.Argument argument) {
                InputValueDefinition definition = fieldDefinition == null ? null : fieldDefinition.argument(argument.name());
                inputType = definition == null ? null : definition.type();
            } else if (current instanceof Node.ObjectField objectField) {
                InputValueDefinition definition = inputType == null ? null : inputFieldOf(inputType, objectField.name());
                inputType = definition == null ? null : definition.type();
            } else if (current instanceof Value.ListValue && isAncestor && inputType != null) {
                TypeRef listType = nullable(inputType);
                inputType = listType instanceof TypeRef.ListType list ? list.ofType() : listType;
            }
        }
        return new Position(parentType, fieldDefinition, inputType);
    }

    private FieldDefinition fieldOf(SchemaType parentType, String fieldName) {
        if (fieldName.equals("__typename") && (parentType instanceof SchemaType.CompositeType
                || parentType instanceof SchemaType.UnionType)) {
            return TYPENAME;
        }
        return parentType instanceof SchemaType.CompositeType composite ? composite.field(fieldName) : null;
    }

    private InputValueDefinition inputFieldOf(TypeRef type, String fieldName) {
        TypeRef nullable = nullable(type);
        if (!(nullable instanceof TypeRef.NamedType named)) {
            return null;
        }
        return schema.namedType(named.name()) instanceof SchemaType.InputObjectType input ? input.field(fieldName) : null;
    }

    private static TypeRef nullable(TypeRef type) {
        return type instanceof TypeRef.NonNullType nonNull ? nonNull.ofType() : type;
    }
}
