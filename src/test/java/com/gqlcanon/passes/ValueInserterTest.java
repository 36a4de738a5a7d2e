package com.gqlcanon.passes;

import com.gqlcanon.UnresolvedReferenceException;
import com.gqlcanon.ast.Node;
import com.gqlcanon.output.AstPrinter;
import com.gqlcanon.parser.DocumentParser;
import com.gqlcanon.parser.SchemaParser;
import com.gqlcanon.schema.TypeInfo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ValueInserterTest {

    private static final TypeInfo TYPE_INFO = new TypeInfo(SchemaParser.parse("""
            type Query {
                token(id: ID, where: TokenFilter, unit: Unit, first: Int!, amount: Float, names: [String!]): Token
            }
            type Token { id: ID }
            enum Unit { WEI ETHER }
            input TokenFilter { name: String, ids: [ID!], unit: Unit }
            """));

    private static void assertPrints(String expected, Node.Document actual) {
        assertEquals(AstPrinter.print(DocumentParser.parse(expected)), AstPrinter.print(actual));
    }

    // ===== Untyped =====

    @Test
    public void testUntypedInsertion() {
        Node.Document result = new ValueInserter(Map.of("_0", 42, "_1", "test_enum_value", "_2", 324.021, "_3", "test_string"))
                .apply(DocumentParser.parse("""
                        {
                            token(something_int: $_0, id: {something_enum: $_1, something_float: $_2, something_str: $_3}) {
                                name
                                id
                            }
                        }
                        """));
        assertPrints("""
                {
                    token(something_int: 42, id: {something_enum: "test_enum_value", something_float: 324.021, something_str: "test_string"}) {
                        name
                        id
                    }
                }
                """, result);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{ token(something: $first_var, id: {chimney: none, diesel: {piano: $secondvar}}) { name id } }",
            "query ($first_var: sometype, $secondvar: someothertype) "
                    + "{ token(something: $first_var, id: {chimney: none, diesel: {piano: $secondvar}}) { name id } }"
    })
    public void testJsonVariables(String query) {
        Node.Document result = new ValueInserter("""
                {
                    "first_var": "sdfsdf",
                    "secondvar": 54
                }
                """).apply(DocumentParser.parse(query));
        String expected = query.replace("something: $first_var", "something: \"sdfsdf\"")
                .replace("piano: $secondvar", "piano: 54");
        assertPrints(expected, result);
    }

    @Test
    public void testDeclarationsAreNotModified() {
        Node.Document result = new ValueInserter(Map.of("a", 5)).apply(DocumentParser.parse("query ($a: Int = 1) { f(x: $a) }"));
        assertPrints("query ($a: Int = 1) { f(x: 5) }", result);
    }

    @Test
    public void testStructuredValues() {
        Map<String, Object> where = new LinkedHashMap<>();
        where.put("b", List.of(1, "two"));
        where.put("a", null);
        Node.Document result = new ValueInserter(Map.of("w", where)).apply(DocumentParser.parse("{ f(where: $w) }"));
        assertPrints("{ f(where: {b: [1, \"two\"], a: null}) }", result);
    }

    @Test
    public void testMissingVariable() {
        assertThrows(UnresolvedReferenceException.class,
                () -> new ValueInserter(Map.of()).apply(DocumentParser.parse("{ f(x: $a) }")));
    }

    // ===== Typed =====

    @Test
    public void testLiteralsFollowExpectedTypes() {
        Map<String, Object> variables = new HashMap<>();
        variables.put("id", "123");
        variables.put("where", "{\"unit\": \"WEI\", \"ids\": [\"0xabc\", 7], \"name\": \"x\"}");
        variables.put("unit", "ETHER");
        variables.put("amount", 2);
        variables.put("names", "solo");
        Node.Document result = new ValueInserter(variables, TYPE_INFO).apply(DocumentParser.parse(
                "{ token(id: $id, where: $where, unit: $unit, amount: $amount, names: $names) { id } }"));
        assertPrints("""
                {
                    token(id: 123, where: {name: "x", ids: ["0xabc", 7], unit: WEI}, unit: ETHER, amount: 2, names: "solo") {
                        id
                    }
                }
                """, result);
    }

    @Test
    public void testUnrepresentableValuesLeaveTheVariable() {
        Map<String, Object> variables = new HashMap<>();
        variables.put("first", null);
        variables.put("unit", "PURPLE");
        Node.Document result = new ValueInserter(variables, TYPE_INFO).apply(DocumentParser.parse(
                "{ token(first: $first, unit: $unit) { id } }"));
        assertPrints("{ token(first: $first, unit: $unit) { id } }", result);
    }

    @Test
    public void testUnknownPositionsFallBackToUntyped() {
        Node.Document result = new ValueInserter(Map.of("x", "ETHER"), TYPE_INFO).apply(DocumentParser.parse(
                "{ other(unit: $x) }"));
        assertPrints("{ other(unit: \"ETHER\") }", result);
    }
}
