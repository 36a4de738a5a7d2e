package com.gqlcanon.output;

import com.gqlcanon.ast.Node;
import com.gqlcanon.ast.OperationType;
import com.gqlcanon.ast.TypeRef;
import com.gqlcanon.ast.Value;
import org.eclipse.collections.api.list.ListIterable;

/**
 * Prints an AST back to query text in the reference GraphQL printer's layout: two-space
 * indented blocks, arguments wrapped onto their own lines once the field line passes
 * 80 characters, and the {@code query} keyword omitted for anonymous queries without
 * variables. The output doubles as the canonical sort key, so the layout must not drift.
 */
public final class AstPrinter {
    private static final int MAX_LINE_LENGTH = 80;

    private AstPrinter() {
    }

    public static String print(Node node) {
        if (node instanceof Node.Document document) {
            return join(document.definitions().collect(AstPrinter::print), "\n\n");
        }
        if (node instanceof Node.OperationDefinition operation) {
            return printOperation(operation);
        }
        if (node instanceof Node.FragmentDefinition fragment) {
            return "fragment " + fragment.name() + " on " + fragment.typeCondition() + " "
                    + print(fragment.selectionSet());
        }
        if (node instanceof Node.VariableDefinition definition) {
            return "$" + definition.variable() + ": " + print(definition.type())
                    + wrap(" = ", definition.defaultValue() == null ? "" : print(definition.defaultValue()), "");
        }
        if (node instanceof Node.SelectionSet selectionSet) {
            return block(selectionSet.selections().collect(AstPrinter::print));
        }
        if (node instanceof Node.Field field) {
            return printField(field);
        }
        if (node instanceof Node.FragmentSpread spread) {
            return "..." + spread.name();
        }
        if (node instanceof Node.InlineFragment fragment) {
            return joinNonEmpty(" ",
                    "...",
                    wrap("on ", fragment.typeCondition(), ""),
                    print(fragment.selectionSet()));
        }
        if (node instanceof Node.Argument argument) {
            return argument.name() + ": " + print(argument.value());
        }
        if (node instanceof Node.ObjectField objectField) {
            return objectField.name() + ": " + print(objectField.value());
        }
        if (node instanceof Value value) {
            return printValue(value);
        }
        if (node instanceof TypeRef type) {
            return printType(type);
        }
        throw new IllegalArgumentException("Unknown node kind: " + node.getClass().getName());
    }

    private static String printOperation(Node.OperationDefinition operation) {
        String variables = wrap("(", join(operation.variableDefinitions().collect(AstPrinter::print), ", "), ")");
        String prefix = joinNonEmpty(" ",
                operation.operation().keyword(),
                joinNonEmpty("", operation.name(), variables));
        String selectionSet = print(operation.selectionSet());
        // anonymous queries use the shorthand form
        if (operation.operation() == OperationType.QUERY && prefix.equals("query")) {
            return selectionSet;
        }
        return prefix + " " + selectionSet;
    }

    private static String printField(Node.Field field) {
        String prefix = wrap("", field.alias(), ": ") + field.name();
        ListIterable<String> arguments = field.arguments().collect(AstPrinter::print);
        String argumentsLine = prefix + wrap("(", join(arguments, ", "), ")");
        if (argumentsLine.length() > MAX_LINE_LENGTH) {
            argumentsLine = prefix + wrap("(\n", indent(join(arguments, "\n")), "\n)");
        }
        String selectionSet = field.selectionSet() == null ? "" : print(field.selectionSet());
        return joinNonEmpty(" ", argumentsLine, selectionSet);
    }

    private static String printValue(Value value) {
        if (value instanceof Value.IntValue intValue) {
            return intValue.value();
        }
        if (value instanceof Value.FloatValue floatValue) {
            return floatValue.value();
        }
        if (value instanceof Value.StringValue string) {
            return quote(string.value());
        }
        if (value instanceof Value.BooleanValue bool) {
            return bool.value() ? "true" : "false";
        }
        if (value instanceof Value.NullValue) {
            return "null";
        }
        if (value instanceof Value.EnumValue enumValue) {
            return enumValue.value();
        }
        if (value instanceof Value.ListValue list) {
            return "[" + join(list.values().collect(AstPrinter::print), ", ") + "]";
        }
        if (value instanceof Value.ObjectValue object) {
            return "{" + join(object.fields().collect(AstPrinter::print), ", ") + "}";
        }
        return "$" + ((Value.Variable) value).name();
    }

    private static String printType(TypeRef type) {
        if (type instanceof TypeRef.NamedType named) {
            return named.name();
        }
        if (type instanceof TypeRef.ListType list) {
            return "[" + printType(list.ofType()) + "]";
        }
        return printType(((TypeRef.NonNullType) type).ofType()) + "!";
    }

    static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2);
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20 || (c >= 0x7F && c <= 0x9F)) {
                        sb.append(String.format("\\u%04X", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    private static String block(ListIterable<String> lines) {
        return wrap("{\n", indent(join(lines, "\n")), "\n}");
    }

    private static String indent(String text) {
        return wrap("  ", text.replace("\n", "\n  "), "");
    }

    private static String wrap(String start, String text, String end) {
        return text == null || text.isEmpty() ? "" : start + text + end;
    }

    /** Joins the non-empty parts. */
    private static String join(ListIterable<String> parts, String separator) {
        return parts.reject(String::isEmpty).makeString(separator);
    }

    private static String joinNonEmpty(String separator, String... parts) {
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            if (part == null || part.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(separator);
            }
            sb.append(part);
        }
        return sb.toString();
    }
}
