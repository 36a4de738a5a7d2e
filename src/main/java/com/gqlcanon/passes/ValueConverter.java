package com.gqlcanon.passes;

import com.gqlcanon.ast.Node;
import com.gqlcanon.ast.TypeRef;
import com.gqlcanon.ast.Value;
import com.gqlcanon.schema.InputTypeOracle;
import com.gqlcanon.schema.InputValueDefinition;
import com.gqlcanon.schema.SchemaType;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Builds literals from plain Java values. With an input type the literal follows the type:
 * enum types give enum values, {@code ID} strings holding an integer give int values, input
 * objects list their fields in declaration order. Without a type the literal follows the Java
 * type of the value.
 * <p>
 * Every method returns {@code null} when the value has no literal form in the requested type.
 */
final class ValueConverter {
    private static final Pattern INTEGER_STRING = Pattern.compile("^-?(?:0|[1-9][0-9]*)$");
    private static final Pattern FLOAT_STRING = Pattern.compile("^-?(?:0|[1-9][0-9]*)(?:\\.[0-9]+)?(?:[eE][+-]?[0-9]+)?$");

    private ValueConverter() {
    }

    static Value toLiteral(Object value, TypeRef type, InputTypeOracle schema) {
        if (type == null) {
            return toLiteral(value);
        }
        if (type instanceof TypeRef.NonNullType nonNull) {
            Value literal = toLiteral(value, nonNull.ofType(), schema);
            return literal instanceof Value.NullValue ? null : literal;
        }
        if (value == null) {
            return new Value.NullValue();
        }
        if (type instanceof TypeRef.ListType list) {
            if (value instanceof Iterable<?> items) {
                MutableList<Value> values = Lists.mutable.empty();
                for (Object item : items) {
                    Value literal = toLiteral(item, list.ofType(), schema);
                    if (literal != null) {
                        values.add(literal);
                    }
                }
                return new Value.ListValue(values.toImmutable());
            }
            return toLiteral(value, list.ofType(), schema);
        }
        SchemaType named = schema.namedType(((TypeRef.NamedType) type).name());
        if (named instanceof SchemaType.InputObjectType input) {
            return toObjectLiteral(value, input, schema);
        }
        if (named instanceof SchemaType.EnumType enumType) {
            return value instanceof String name && enumType.values().contains(name) ? new Value.EnumValue(name) : null;
        }
        if (named instanceof SchemaType.ScalarType scalar) {
            return toScalarLiteral(value, scalar.name());
        }
        return toLiteral(value);
    }

    /** Literal for a value of unknown type. */
    static Value toLiteral(Object value) {
        if (value == null) {
            return new Value.NullValue();
        }
        if (value instanceof Boolean bool) {
            return new Value.BooleanValue(bool);
        }
        if (isIntegral(value)) {
            return new Value.IntValue(value.toString());
        }
        if (value instanceof BigDecimal decimal) {
            return new Value.FloatValue(decimal.toPlainString());
        }
        if (value instanceof Number number) {
            return floatLiteral(number.doubleValue());
        }
        if (value instanceof String string) {
            return new Value.StringValue(string);
        }
        if (value instanceof Map<?, ?> map) {
            MutableList<Node.ObjectField> fields = Lists.mutable.empty();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                Value literal = toLiteral(entry.getValue());
                if (literal != null) {
                    fields.add(new Node.ObjectField(String.valueOf(entry.getKey()), literal));
                }
            }
            return new Value.ObjectValue(fields.toImmutable());
        }
        if (value instanceof Iterable<?> items) {
            MutableList<Value> values = Lists.mutable.empty();
            for (Object item : items) {
                Value literal = toLiteral(item);
                if (literal != null) {
                    values.add(literal);
                }
            }
            return new Value.ListValue(values.toImmutable());
        }
        return null;
    }

    private static Value toObjectLiteral(Object value, SchemaType.InputObjectType type, InputTypeOracle schema) {
        if (!(value instanceof Map<?, ?> map)) {
            return null;
        }
        MutableList<Node.ObjectField> fields = Lists.mutable.empty();
        for (InputValueDefinition field : type.fields()) {
            if (!map.containsKey(field.name())) {
                continue;
            }
            Value literal = toLiteral(map.get(field.name()), field.type(), schema);
            if (literal != null) {
                fields.add(new Node.ObjectField(field.name(), literal));
            }
        }
        return new Value.ObjectValue(fields.toImmutable());
    }

    private static Value toScalarLiteral(Object value, String scalar) {
        return switch (scalar) {
            case "Int" -> intLiteral(value);
            case "Float" -> {
                if (value instanceof Boolean bool) {
                    yield floatLiteral(bool ? 1 : 0);
                }
                if (value instanceof Number number) {
                    yield floatLiteral(number.doubleValue());
                }
                yield value instanceof String string && FLOAT_STRING.matcher(string).matches()
                        ? floatLiteral(Double.parseDouble(string))
                        : null;
            }
            case "String" -> {
                if (value instanceof String || value instanceof Boolean || isIntegral(value)) {
                    yield new Value.StringValue(value.toString());
                }
                yield value instanceof Number number ? new Value.StringValue(formatFloat(number.doubleValue())) : null;
            }
            case "Boolean" -> {
                if (value instanceof Boolean bool) {
                    yield new Value.BooleanValue(bool);
                }
                yield value instanceof Number number ? new Value.BooleanValue(number.doubleValue() != 0) : null;
            }
            case "ID" -> {
                if (isIntegral(value)) {
                    yield new Value.IntValue(value.toString());
                }
                if (!(value instanceof String string)) {
                    yield null;
                }
                yield INTEGER_STRING.matcher(string).matches() ? new Value.IntValue(string) : new Value.StringValue(string);
            }
            // custom scalars serialize as they are
            default -> value instanceof Map || value instanceof Iterable ? null : toLiteral(value);
        };
    }

    private static Value intLiteral(Object value) {
        if (value instanceof Boolean bool) {
            return new Value.IntValue(bool ? "1" : "0");
        }
        if (isIntegral(value)) {
            return new Value.IntValue(value.toString());
        }
        if (value instanceof Number number && isWhole(number.doubleValue())) {
            return new Value.IntValue(Long.toString((long) number.doubleValue()));
        }
        return value instanceof String string && INTEGER_STRING.matcher(string).matches() ? new Value.IntValue(string) : null;
    }

    private static Value floatLiteral(double value) {
        return Double.isFinite(value) ? new Value.FloatValue(formatFloat(value)) : null;
    }

    /**
     * Shortest decimal form of {@code value}: integral values lose their fraction, very small
     * and very large magnitudes use a two-digit exponent ({@code 1e-05}, {@code 1.5e+20}).
     */
    static String formatFloat(double value) {
        double magnitude = Math.abs(value);
        if (magnitude != 0 && (magnitude < 1e-4 || magnitude >= 1e16)) {
            String text = Double.toString(value);
            int exponentAt = text.indexOf('E');
            String mantissa = text.substring(0, exponentAt);
            if (mantissa.endsWith(".0")) {
                mantissa = mantissa.substring(0, mantissa.length() - 2);
            }
            int exponent = Integer.parseInt(text.substring(exponentAt + 1));
            return mantissa + "e" + (exponent < 0 ? "-" : "+") + String.format("%02d", Math.abs(exponent));
        }
        if (isWhole(value)) {
            return BigDecimal.valueOf(value).toBigInteger().toString();
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger;
    }

    private static boolean isWhole(double value) {
        return Double.isFinite(value) && value == Math.rint(value);
    }
}
