package com.gqlcanon.passes;

import com.gqlcanon.ast.Node;
import com.gqlcanon.output.AstPrinter;
import com.gqlcanon.parser.DocumentParser;
import com.gqlcanon.parser.SchemaParser;
import com.gqlcanon.schema.Schema;
import com.gqlcanon.schema.UnknownArgument;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class UnknownArgumentFilterTest {

    private static final Schema SCHEMA = SchemaParser.parse("""
            type Potato {
                id: ID
                apple: Apple
            }

            type Apple {
                name: String
                fruit: ID
            }

            type Query {
                potato(
                    banana: Int
                    garlic: String
                ): Potato

                apple(
                    tomato: ID
                    orange: String
                ): Apple
            }
            """);

    @Test
    public void testUnknownArgumentsAreRemoved() {
        Node.Document result = new UnknownArgumentFilter(SCHEMA).apply(DocumentParser.parse("""
                {
                    potato(banana: 42, pear: 56, onion: "garlic") {
                        id
                        apple (orange: 12) {
                            name
                        }
                    }
                }
                """));
        assertEquals(AstPrinter.print(DocumentParser.parse("""
                {
                    potato(banana: 42) {
                        id
                        apple {
                            name
                        }
                    }
                }
                """)), AstPrinter.print(result));
    }

    @Test
    public void testValidDocumentIsUntouched() {
        Node.Document document = DocumentParser.parse("{ potato(banana: 1) { id } apple(orange: \"x\") { name } }");
        assertSame(document, new UnknownArgumentFilter(SCHEMA).apply(document));
    }

    @Test
    public void testReportedArgumentsAreMatchedByIdentity() {
        Node.Document document = DocumentParser.parse("{ a(x: 1) b(x: 1) }");
        Node.Field first = (Node.Field) ((Node.OperationDefinition) document.definitions().getOnly())
                .selectionSet().selections().getFirst();
        UnknownArgumentFilter filter = new UnknownArgumentFilter(
                doc -> Lists.immutable.of(new UnknownArgument(first.arguments().getOnly(), "a", "Query")));
        assertEquals("{\n  a\n  b(x: 1)\n}", AstPrinter.print(filter.apply(document)));
    }
}
