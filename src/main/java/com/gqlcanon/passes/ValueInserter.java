package com.gqlcanon.passes;

import com.gqlcanon.ast.Node;
import com.gqlcanon.ast.TypeRef;
import com.gqlcanon.ast.Value;
import com.gqlcanon.json.VariablesParser;
import com.gqlcanon.schema.InputTypeOracle;
import com.gqlcanon.schema.SchemaType;
import com.gqlcanon.traversal.QueryVisitor;
import com.gqlcanon.traversal.TraversalContext;
import com.gqlcanon.traversal.Traverser;
import com.gqlcanon.traversal.VisitAction;

import java.util.Map;

/**
 * Replaces variable references with literals built from the supplied variable values. With a
 * type oracle each literal is shaped by the input type expected where the variable is used;
 * an input object passed as a JSON string is parsed first. A value that has no literal form
 * in the expected type leaves the reference in place. Declarations are not modified.
 */
public class ValueInserter implements DocumentPass {
    private final Map<String, ?> variables;
    private final InputTypeOracle oracle;

    public ValueInserter(Map<String, ?> variables) {
        this(variables, null);
    }

    public ValueInserter(Map<String, ?> variables, InputTypeOracle oracle) {
        this.variables = variables;
        this.oracle = oracle;
    }

    public ValueInserter(String variablesJson) {
        this(variablesJson, null);
    }

    public ValueInserter(String variablesJson, InputTypeOracle oracle) {
        this(new VariablesParser().parse(variablesJson), oracle);
    }

    @Override
    public Node.Document apply(Node.Document document) {
        VariablesParser parser = new VariablesParser();
        return Traverser.traverse(document, new QueryVisitor() {
            @Override
            public VisitAction enterValue(Value value, TraversalContext context) {
                if (!(value instanceof Value.Variable variable) || context.isWithin(Node.VariableDefinition.class)) {
                    return VisitAction.idle();
                }
                Object supplied = UntypedValues.variableValue(variable.name(), variables);
                TypeRef type = oracle == null ? null : oracle.expectedInputType(value, context);
                if (type != null && supplied instanceof String json && expectsInputObject(type)) {
                    supplied = parser.parseValue(json);
                }
                Value literal = ValueConverter.toLiteral(supplied, type, oracle);
                return literal == null ? VisitAction.idle() : VisitAction.replace(literal);
            }
        });
    }

    private boolean expectsInputObject(TypeRef type) {
        TypeRef nullable = type instanceof TypeRef.NonNullType nonNull ? nonNull.ofType() : type;
        return nullable instanceof TypeRef.NamedType named
                && oracle.namedType(named.name()) instanceof SchemaType.InputObjectType;
    }
}
