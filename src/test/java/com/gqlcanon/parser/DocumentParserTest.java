package com.gqlcanon.parser;

import com.gqlcanon.ast.Node;
import com.gqlcanon.ast.OperationType;
import com.gqlcanon.ast.TypeRef;
import com.gqlcanon.ast.Value;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class DocumentParserTest {

    @Test
    public void testShorthandQuery() {
        Node.Document document = DocumentParser.parse("{ a b }");
        Node.OperationDefinition operation = (Node.OperationDefinition) document.definitions().getOnly();
        assertEquals(OperationType.QUERY, operation.operation());
        assertNull(operation.name());
        assertEquals(Lists.immutable.of(Node.Field.of("a"), Node.Field.of("b")), operation.selectionSet().selections());
    }

    @Test
    public void testOperationWithVariables() {
        Node.Document document = DocumentParser.parse("subscription S($a: [Int!]! = [1], $b: String) { f }");
        Node.OperationDefinition operation = (Node.OperationDefinition) document.definitions().getOnly();
        assertEquals(OperationType.SUBSCRIPTION, operation.operation());
        assertEquals("S", operation.name());
        assertEquals(new Node.VariableDefinition("a",
                new TypeRef.NonNullType(new TypeRef.ListType(new TypeRef.NonNullType(new TypeRef.NamedType("Int")))),
                new Value.ListValue(Lists.immutable.of(new Value.IntValue("1")))),
                operation.variableDefinitions().get(0));
        assertNull(operation.variableDefinitions().get(1).defaultValue());
    }

    @Test
    public void testFieldsAliasesAndArguments() {
        Node.Document document = DocumentParser.parse("{ x: f(a: 1, b: $v) { g } }");
        Node.Field field = (Node.Field) ((Node.OperationDefinition) document.definitions().getOnly())
                .selectionSet().selections().getOnly();
        assertEquals("x", field.alias());
        assertEquals("f", field.name());
        assertEquals(new Node.Argument("b", new Value.Variable("v")), field.arguments().get(1));
        assertEquals(Node.SelectionSet.of(Node.Field.of("g")), field.selectionSet());
    }

    @Test
    public void testFragments() {
        Node.Document document = DocumentParser.parse("""
                query { ...F ... on T { a } ... { b } }
                fragment F on Query { c }
                """);
        Node.OperationDefinition operation = (Node.OperationDefinition) document.definitions().get(0);
        assertEquals(new Node.FragmentSpread("F"), operation.selectionSet().selections().get(0));
        assertEquals("T", ((Node.InlineFragment) operation.selectionSet().selections().get(1)).typeCondition());
        assertNull(((Node.InlineFragment) operation.selectionSet().selections().get(2)).typeCondition());
        assertEquals(new Node.FragmentDefinition("F", "Query", Node.SelectionSet.of(Node.Field.of("c"))),
                document.definitions().get(1));
    }

    @Test
    public void testValues() {
        Value value = DocumentParser.parseValue("{i: -12, f: 1.5e3, s: \"a\\u0041\\n\", b: false, n: null, e: RED, l: [1, [2]]}");
        Value.ObjectValue object = (Value.ObjectValue) value;
        assertEquals(new Value.IntValue("-12"), object.fields().get(0).value());
        assertEquals(new Value.FloatValue("1.5e3"), object.fields().get(1).value());
        assertEquals(new Value.StringValue("aA\n"), object.fields().get(2).value());
        assertEquals(new Value.BooleanValue(false), object.fields().get(3).value());
        assertEquals(new Value.NullValue(), object.fields().get(4).value());
        assertEquals(new Value.EnumValue("RED"), object.fields().get(5).value());
        assertEquals(new Value.ListValue(Lists.immutable.of(new Value.IntValue("1"),
                new Value.ListValue(Lists.immutable.of(new Value.IntValue("2"))))), object.fields().get(6).value());
    }

    @Test
    public void testCommentsCommasAndBomAreIgnored() {
        Node.Document withNoise = DocumentParser.parse("\uFEFF# leading comment\n{ a,, b # trailing\n }");
        assertEquals(DocumentParser.parse("{ a b }"), withNoise);
    }

    // ============================================================
    // Errors
    // ============================================================

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "   ",
            "{",
            "{ }",
            "{ a(x: ) }",
            "{ a(x: \"unterminated) }",
            "{ a(x: 01) }",
            "query Q($v Int) { a }",
            "fragment on on T { a }",
            "{ a } extra",
            "{ a @include(if: true) }",
            "type T { a: Int }"
    })
    public void testSyntaxErrors(String source) {
        assertThrows(IllegalArgumentException.class, () -> DocumentParser.parse(source));
    }

    @ParameterizedTest
    @ValueSource(strings = {"{ caf\u00e9 }", "{ \u00e9t\u00e9 }", "{ a(x: \u0663) }", "{ a(x: 1\u0663) }"})
    public void testNamesAndNumbersAreAscii(String source) {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class, () -> DocumentParser.parse(source));
        assertTrue(error.getMessage().contains("Unexpected character"), error.getMessage());
    }

    @Test
    public void testErrorReportsPosition() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> DocumentParser.parse("{\n  a(x: ]) }"));
        assertTrue(error.getMessage().startsWith("Syntax error at 2:8"), error.getMessage());
    }

    @Test
    public void testVariablesNotAllowedInDefaultValues() {
        assertThrows(IllegalArgumentException.class, () -> DocumentParser.parse("query ($a: Int = $b) { f }"));
    }
}
