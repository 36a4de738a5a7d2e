package com.gqlcanon.passes;

import com.gqlcanon.UnresolvedReferenceException;
import com.gqlcanon.output.AstPrinter;
import com.gqlcanon.parser.DocumentParser;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ValueExtractorTest {

    private static void assertPrints(String expected, ExtractedValues result) {
        assertEquals(AstPrinter.print(DocumentParser.parse(expected)), AstPrinter.print(result.document()));
    }

    // ===== Literals =====

    @Test
    public void testIgnoredArgumentsKeepTheirValues() {
        ExtractedValues result = new ValueExtractor(List.of("piano")).extract(DocumentParser.parse("""
                {
                    token(something: "sdgsdfg", id: {chimney: 42, diesel: {piano: 54}}) {
                        name
                        id
                    }
                }
                """));
        assertPrints("""
                {
                    token(something: $_0, id: {chimney: $_1, diesel: {piano: 54}}) {
                        name
                        id
                    }
                }
                """, result);
        assertEquals(List.of("sdgsdfg", 42L), result.values());
    }

    @Test
    public void testEveryKindOfLiteral() {
        ExtractedValues result = new ValueExtractor().extract(DocumentParser.parse(
                "{ f(i: 7, f: 1.5, s: \"x\", b: true, n: null, e: ASC, l: [1, [2]], big: 99999999999999999999) }"));
        assertPrints("{ f(i: $_0, f: $_1, s: $_2, b: $_3, n: $_4, e: $_5, l: $_6, big: $_7) }", result);
        assertEquals(Arrays.asList(7L, 1.5, "x", true, null, "ASC", List.of(1L, List.of(2L)),
                new BigInteger("99999999999999999999")), result.values());
    }

    @Test
    public void testVariableDefaultsAreNotExtracted() {
        ExtractedValues result = new ValueExtractor().extract(DocumentParser.parse(
                "query ($first: Int = 10) { polls(skip: 5) { id } }"));
        assertPrints("query ($first: Int = 10) { polls(skip: $_0) { id } }", result);
        assertEquals(List.of(5L), result.values());
    }

    @Test
    public void testValuesAreUnmodifiable() {
        ExtractedValues result = new ValueExtractor().extract(DocumentParser.parse("{ f(a: 1) }"));
        assertThrows(UnsupportedOperationException.class, () -> result.values().add(2L));
    }

    @Test
    public void testApplyReturnsRewrittenDocument() {
        assertEquals("{\n  f(a: $_0)\n}", AstPrinter.print(new ValueExtractor().apply(DocumentParser.parse("{ f(a: 1) }"))));
    }

    // ===== Variables =====

    @Test
    public void testVariablesAreResolved() {
        ExtractedValues result = new ValueExtractor(List.of("piano"), Map.of("var", "{piano: 54}"))
                .extract(DocumentParser.parse("""
                        {
                            token(something: "sdgsdfg", id: {chimney: 42, diesel: $var}) {
                                name
                                id
                            }
                        }
                        """));
        assertPrints("""
                {
                    token(something: $_0, id: {chimney: $_1, diesel: $_2}) {
                        name
                        id
                    }
                }
                """, result);
        assertEquals(List.of("sdgsdfg", 42L, "{piano: 54}"), result.values());
    }

    @Test
    public void testVariablesFromJson() {
        ExtractedValues result = new ValueExtractor(List.of(), "{\"ids\": [1, 2], \"where\": {\"a\": true}}")
                .extract(DocumentParser.parse("{ f(ids: $ids, where: $where, list: [$ids]) }"));
        assertPrints("{ f(ids: $_0, where: $_1, list: $_2) }", result);
        assertEquals(List.of(1L, 2L), result.values().get(0));
        assertEquals(Map.of("a", true), result.values().get(1));
        assertEquals(List.of(List.of(1L, 2L)), result.values().get(2));
    }

    @Test
    public void testMissingVariable() {
        UnresolvedReferenceException e = assertThrows(UnresolvedReferenceException.class,
                () -> new ValueExtractor().extract(DocumentParser.parse("{ f(a: $missing) }")));
        assertEquals("No value provided for variable missing", e.getMessage());
    }
}
