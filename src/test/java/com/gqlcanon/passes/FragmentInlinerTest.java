package com.gqlcanon.passes;

import com.gqlcanon.StructuralViolationException;
import com.gqlcanon.UnresolvedReferenceException;
import com.gqlcanon.ast.Node;
import com.gqlcanon.output.AstPrinter;
import com.gqlcanon.parser.DocumentParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FragmentInlinerTest {
    private final FragmentInliner inliner = new FragmentInliner();

    private void assertInlined(String input, String expected) {
        Node.Document result = inliner.apply(DocumentParser.parse(input));
        assertEquals(AstPrinter.print(DocumentParser.parse(expected)), AstPrinter.print(result));
    }

    @Test
    public void testSpreadsAreReplacedInPlace() {
        assertInlined("""
                {
                    potato(first: 1) {
                        banana
                        ...fragment1
                        pear
                        ...fragment2
                        tomato {
                            ...fragment1
                        }
                    }
                }

                fragment fragment1 on Food {
                    something
                    somethingelse {
                        id
                    }
                }

                fragment fragment2 on MoreFood {
                    importantthing {
                        indeed {
                            id
                        }
                    }
                    id
                }
                """, """
                {
                    potato(first: 1) {
                        banana
                        something
                        somethingelse {
                            id
                        }
                        pear
                        importantthing {
                            indeed {
                                id
                            }
                        }
                        id
                        tomato {
                            something
                            somethingelse {
                                id
                            }
                        }
                    }
                }
                """);
    }

    @Test
    public void testNestedFragments() {
        assertInlined("""
                query IntrospectionQuery {
                    __schema {
                        types { ...FullType }
                        directives { name args { ...InputValue } }
                    }
                }
                fragment FullType on __Type {
                    kind
                    fields(includeDeprecated: true) { name args { ...InputValue } type { ...TypeRef } }
                }
                fragment InputValue on __InputValue { name type { ...TypeRef } defaultValue }
                fragment TypeRef on __Type { kind name ofType { kind name } }
                """, """
                query IntrospectionQuery {
                    __schema {
                        types {
                            kind
                            fields(includeDeprecated: true) {
                                name
                                args { name type { kind name ofType { kind name } } defaultValue }
                                type { kind name ofType { kind name } }
                            }
                        }
                        directives {
                            name
                            args { name type { kind name ofType { kind name } } defaultValue }
                        }
                    }
                }
                """);
    }

    @Test
    public void testLastDefinitionWins() {
        assertInlined("{ a { ...F } } fragment F on A { x } fragment F on A { y }", "{ a { y } }");
    }

    @Test
    public void testInlineFragmentsAreKept() {
        assertInlined("{ a { ... on A { ...F } } } fragment F on A { x }", "{ a { ... on A { x } } }");
    }

    @Test
    public void testUnusedFragmentsAreDropped() {
        assertInlined("{ a } fragment Unused on A { x }", "{ a }");
    }

    @Test
    public void testUnknownFragment() {
        UnresolvedReferenceException e = assertThrows(UnresolvedReferenceException.class,
                () -> inliner.apply(DocumentParser.parse("{ a { ...Missing } }")));
        assertEquals("Unknown fragment \"Missing\"", e.getMessage());
    }

    @Test
    public void testCyclicFragments() {
        StructuralViolationException e = assertThrows(StructuralViolationException.class,
                () -> inliner.apply(DocumentParser.parse("""
                        { a { ...A } }
                        fragment A on T { x { ...B } }
                        fragment B on T { y { ...A } }
                        """)));
        assertTrue(e.getMessage().endsWith("spreads itself"));
    }
}
