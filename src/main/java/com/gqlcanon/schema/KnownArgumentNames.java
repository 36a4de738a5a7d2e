package com.gqlcanon.schema;

import com.gqlcanon.ast.Node;
import com.gqlcanon.traversal.QueryVisitor;
import com.gqlcanon.traversal.TraversalContext;
import com.gqlcanon.traversal.Traverser;
import com.gqlcanon.traversal.VisitAction;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Reports field arguments the schema does not declare. Fields the schema does not know
 * are left alone, as are fields whose enclosing type cannot be determined.
 */
public class KnownArgumentNames implements ArgumentValidator {
    private final TypeInfo typeInfo;

    public KnownArgumentNames(Schema schema) {
        this.typeInfo = new TypeInfo(schema);
    }

    @Override
    public ImmutableList<UnknownArgument> validate(Node.Document document) {
        MutableList<UnknownArgument> errors = Lists.mutable.empty();
        Traverser.traverse(document, new QueryVisitor() {
            @Override
            public VisitAction enterField(Node.Field field, TraversalContext context) {
                TypeInfo.Position position = typeInfo.positionOf(field, context);
                FieldDefinition definition = position.fieldDefinition();
                if (definition == null || position.parentType() == null) {
                    return VisitAction.idle();
                }
                for (Node.Argument argument : field.arguments()) {
                    if (definition.argument(argument.name()) == null) {
                        errors.add(new UnknownArgument(argument, field.name(), position.parentType().name()));
                    }
                }
                return VisitAction.idle();
            }
        });
        return errors.toImmutable();
    }
}
