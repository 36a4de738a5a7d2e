package com.gqlcanon.parser;

import com.gqlcanon.ast.OperationType;
import com.gqlcanon.ast.TypeRef;
import com.gqlcanon.ast.Value;
import com.gqlcanon.schema.FieldDefinition;
import com.gqlcanon.schema.Schema;
import com.gqlcanon.schema.SchemaType;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SchemaParserTest {

    private static final String SDL = """
            \"""
            Root of every query.
            \"""
            type Query {
                "Look a token up"
                token(id: ID!, where: TokenFilter, first: Int = 10): Token @deprecated(reason: "no")
                search(text: String): [SearchResult!]!
            }

            interface Node {
                id: ID!
            }

            type Token implements Node & Named {
                id: ID!
                name: String
                kind: Kind
            }

            union SearchResult = | Token | Account

            type Account { id: ID! }

            enum Kind { FUNGIBLE NON_FUNGIBLE }

            input TokenFilter {
                name_in: [String!]
                kind: Kind = FUNGIBLE
            }

            scalar BigInt
            """;

    @Test
    public void testTypesAreDefined() {
        Schema schema = SchemaParser.parse(SDL);

        assertInstanceOf(SchemaType.ObjectType.class, schema.namedType("Token"));
        assertInstanceOf(SchemaType.InterfaceType.class, schema.namedType("Node"));
        assertEquals(Lists.immutable.of("Token", "Account"), ((SchemaType.UnionType) schema.namedType("SearchResult")).members());
        assertEquals(Lists.immutable.of("FUNGIBLE", "NON_FUNGIBLE"), ((SchemaType.EnumType) schema.namedType("Kind")).values());
        assertInstanceOf(SchemaType.ScalarType.class, schema.namedType("BigInt"));
        assertInstanceOf(SchemaType.ScalarType.class, schema.namedType("ID"));
        assertNull(schema.namedType("Missing"));
    }

    @Test
    public void testFieldsAndArguments() {
        Schema schema = SchemaParser.parse(SDL);
        FieldDefinition token = schema.rootType(OperationType.QUERY).field("token");

        assertEquals(new TypeRef.NamedType("Token"), token.type());
        assertEquals(new TypeRef.NonNullType(new TypeRef.NamedType("ID")), token.argument("id").type());
        assertEquals(new Value.IntValue("10"), token.argument("first").defaultValue());
        assertNull(token.argument("missing"));

        SchemaType.InputObjectType filter = (SchemaType.InputObjectType) schema.namedType("TokenFilter");
        assertEquals(new Value.EnumValue("FUNGIBLE"), filter.field("kind").defaultValue());
    }

    @Test
    public void testConventionalRootTypes() {
        Schema schema = SchemaParser.parse(SDL);
        assertEquals("Query", schema.rootType(OperationType.QUERY).name());
        assertNull(schema.rootType(OperationType.MUTATION));
    }

    @Test
    public void testExplicitSchemaDefinition() {
        Schema schema = SchemaParser.parse("""
                schema { query: Root subscription: Events }
                type Root { a: Int }
                type Events { b: Int }
                """);
        assertEquals("Root", schema.rootType(OperationType.QUERY).name());
        assertEquals("Events", schema.rootType(OperationType.SUBSCRIPTION).name());
    }

    @Test
    public void testErrors() {
        assertThrows(IllegalArgumentException.class, () -> SchemaParser.parse(""));
        assertThrows(IllegalArgumentException.class, () -> SchemaParser.parse("type A { a: Int } type A { b: Int }"));
        assertThrows(IllegalArgumentException.class, () -> SchemaParser.parse("schema { query: Missing }"));
        assertThrows(IllegalArgumentException.class, () -> SchemaParser.parse("query { a }"));
        assertThrows(IllegalArgumentException.class, () -> SchemaParser.parse("type A { a Int }"));
    }
}
