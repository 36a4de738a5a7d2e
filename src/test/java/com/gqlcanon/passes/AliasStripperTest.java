package com.gqlcanon.passes;

import com.gqlcanon.ast.Node;
import com.gqlcanon.output.AstPrinter;
import com.gqlcanon.parser.DocumentParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AliasStripperTest {

    @Test
    public void testAliasesAreRemovedAtEveryDepth() {
        Node.Document result = new AliasStripper().apply(DocumentParser.parse("""
                {
                    alias1: polls(first: 1) {
                        v: votes(a: a) {
                            id
                        }
                    }
                }
                """));
        assertEquals(AstPrinter.print(DocumentParser.parse("""
                {
                    polls(first: 1) {
                        votes(a: a) {
                            id
                        }
                    }
                }
                """)), AstPrinter.print(result));
    }

    @Test
    public void testStripBelowAnyNode() {
        Node.OperationDefinition operation = (Node.OperationDefinition) DocumentParser
                .parse("{ a: f { b: g } }").definitions().getOnly();
        Node stripped = AliasStripper.strip(operation.selectionSet());
        assertEquals("{\n  f {\n    g\n  }\n}", AstPrinter.print(stripped));
    }

    @Test
    public void testWithoutAliasesDocumentIsUntouched() {
        Node.Document document = DocumentParser.parse("{ f { g } }");
        assertSame(document, new AliasStripper().apply(document));
    }
}
