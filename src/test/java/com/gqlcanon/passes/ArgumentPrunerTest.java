package com.gqlcanon.passes;

import com.gqlcanon.ast.Node;
import com.gqlcanon.output.AstPrinter;
import com.gqlcanon.parser.DocumentParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ArgumentPrunerTest {
    private final ArgumentPruner pruner = new ArgumentPruner();

    @Test
    public void testFirstOccurrenceOfEachNameWins() {
        Node.Document result = pruner.apply(DocumentParser.parse("""
                {
                    polls(first: 1) {
                        votes(a: a, a: b, capital: fossil, b: c, a: c, capital: a) {
                            id
                        }
                    }
                }
                """));
        assertEquals(AstPrinter.print(DocumentParser.parse("""
                {
                    polls(first: 1) {
                        votes(a: a, capital: fossil, b: c) {
                            id
                        }
                    }
                }
                """)), AstPrinter.print(result));
    }

    @Test
    public void testObjectValueFieldsAreNotPruned() {
        Node.Document result = pruner.apply(DocumentParser.parse("{ f(where: {a: 1, a: 2}) }"));
        assertEquals("{\n  f(where: {a: 1, a: 2})\n}", AstPrinter.print(result));
    }

    @Test
    public void testDistinctArgumentsLeaveDocumentUntouched() {
        Node.Document document = DocumentParser.parse("{ f(a: 1, b: 2) { g(a: 1) } }");
        assertSame(document, pruner.apply(document));
    }
}
