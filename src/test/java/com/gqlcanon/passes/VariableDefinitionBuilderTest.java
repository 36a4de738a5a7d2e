package com.gqlcanon.passes;

import com.gqlcanon.ast.Node;
import com.gqlcanon.output.AstPrinter;
import com.gqlcanon.parser.DocumentParser;
import com.gqlcanon.parser.SchemaParser;
import com.gqlcanon.schema.TypeInfo;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class VariableDefinitionBuilderTest {

    private static final VariableDefinitionBuilder BUILDER = new VariableDefinitionBuilder(new TypeInfo(SchemaParser.parse("""
            type Apple {
                name: String
                fruit: ID
            }

            type Potato {
                id: ID
                apple(tomato: ID, orange: String): Apple
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

            input Basket { size: Int!, fruits: [ID!] }

            type Mutation { fill(basket: Basket, ids: [ID!]!): Boolean }
            """)));

    private static void assertBuilt(String input, String expected) {
        Node.Document result = BUILDER.apply(DocumentParser.parse(input));
        assertEquals(AstPrinter.print(DocumentParser.parse(expected)), AstPrinter.print(result));
    }

    @Test
    public void testVariablesAreDeclaredInOrderOfUse() {
        assertBuilt("""
                {
                    potato(banana: $firstvar, garlic: $secondvar) {
                        id
                        apple (orange: $thirdvar) {
                            name
                        }
                    }
                }
                """, """
                query ($firstvar: Int, $secondvar: String, $thirdvar: String) {
                    potato(banana: $firstvar, garlic: $secondvar) {
                        id
                        apple (orange: $thirdvar) {
                            name
                        }
                    }
                }
                """);
    }

    @Test
    public void testExistingDeclarationsAreReplaced() {
        assertBuilt("query Q($banana: Float = 1.5, $unused: String) { potato(banana: $banana) { id } }",
                "query Q($banana: Int) { potato(banana: $banana) { id } }");
    }

    @Test
    public void testNestedInputPositions() {
        assertBuilt("mutation { fill(basket: {size: $size, fruits: [$fruit]}, ids: $ids) }",
                "mutation ($size: Int!, $fruit: ID!, $ids: [ID!]!) { fill(basket: {size: $size, fruits: [$fruit]}, ids: $ids) }");
    }

    @Test
    public void testLastUseDecidesTheType() {
        assertBuilt("{ potato(banana: $x) { apple(orange: $x) { name } } }",
                "query ($x: String) { potato(banana: $x) { apple(orange: $x) { name } } }");
    }

    @Test
    public void testUntypedVariablesAreLeftUndeclared() {
        assertBuilt("{ potato(banana: $a, pear: $b) { id } }", "query ($a: Int) { potato(banana: $a, pear: $b) { id } }");
    }

    @Test
    public void testEachOperationHasItsOwnDeclarations() {
        assertBuilt("query A { potato(banana: $a) { id } } query B { apple(tomato: $b) { name } }",
                "query A($a: Int) { potato(banana: $a) { id } } query B($b: ID) { apple(tomato: $b) { name } }");
    }

    @Test
    public void testFragmentsAreNotVisited() {
        assertBuilt("{ potato { ...P } } fragment P on Potato { apple(tomato: $t) { name } }",
                "{ potato { ...P } } fragment P on Potato { apple(tomato: $t) { name } }");
    }
}
