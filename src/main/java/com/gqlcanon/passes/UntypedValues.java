package com.gqlcanon.passes;

import com.gqlcanon.UnresolvedReferenceException;
import com.gqlcanon.ast.Node;
import com.gqlcanon.ast.Value;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts literals to plain Java values without consulting a schema: integers become
 * {@link Long} (or {@link BigInteger}), floats {@link Double}, enum values their name,
 * lists {@link java.util.List}s and objects insertion-ordered {@link Map}s.
 */
final class UntypedValues {

    private UntypedValues() {
    }

    /**
     * @param variables values of the variables the literal may reference
     * @throws UnresolvedReferenceException when a referenced variable has no value
     */
    static Object valueOf(Value value, Map<String, ?> variables) {
        if (value instanceof Value.IntValue intValue) {
            return parseInteger(intValue.value());
        }
        if (value instanceof Value.FloatValue floatValue) {
            return Double.parseDouble(floatValue.value());
        }
        if (value instanceof Value.StringValue string) {
            return string.value();
        }
        if (value instanceof Value.BooleanValue bool) {
            return bool.value();
        }
        if (value instanceof Value.NullValue) {
            return null;
        }
        if (value instanceof Value.EnumValue enumValue) {
            return enumValue.value();
        }
        if (value instanceof Value.ListValue list) {
            MutableList<Object> items = Lists.mutable.withInitialCapacity(list.values().size());
            list.values().forEach(item -> items.add(valueOf(item, variables)));
            return items;
        }
        if (value instanceof Value.ObjectValue object) {
            Map<String, Object> fields = new LinkedHashMap<>();
            for (Node.ObjectField field : object.fields()) {
                fields.put(field.name(), valueOf(field.value(), variables));
            }
            return fields;
        }
        Value.Variable variable = (Value.Variable) value;
        return variableValue(variable.name(), variables);
    }

    static Object variableValue(String name, Map<String, ?> variables) {
        if (!variables.containsKey(name)) {
            throw new UnresolvedReferenceException("No value provided for variable " + name);
        }
        return variables.get(name);
    }

    private static Object parseInteger(String text) {
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            return new BigInteger(text);
        }
    }
}
