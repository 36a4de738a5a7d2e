package com.gqlcanon.parser;

import com.gqlcanon.ast.TypeRef;
import com.gqlcanon.ast.Value;
import com.gqlcanon.parser.Lexer.Kind;
import com.gqlcanon.parser.Lexer.Token;
import com.gqlcanon.schema.FieldDefinition;
import com.gqlcanon.schema.InputValueDefinition;
import com.gqlcanon.schema.Schema;
import com.gqlcanon.schema.SchemaType;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Builds a {@link Schema} from schema definition language. Supports {@code schema},
 * {@code scalar}, {@code type}, {@code interface}, {@code union}, {@code enum} and
 * {@code input} definitions; descriptions and directive usages are read and dropped.
 */
public class SchemaParser {
    private final DocumentParser cursor;

    private SchemaParser(String source) {
        this.cursor = new DocumentParser(source);
    }

    public static Schema parse(String source) {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("Syntax error: empty schema");
        }
        return new SchemaParser(source).parseSchema();
    }

    private Schema parseSchema() {
        Schema.Builder builder = Schema.builder();
        while (cursor.peek().kind() != Kind.EOF) {
            skipDescription();
            Token keyword = cursor.peek();
            if (keyword.kind() != Kind.NAME) {
                throw DocumentParser.unexpected(keyword);
            }
            switch (keyword.text()) {
                case "schema" -> parseSchemaDefinition(builder);
                case "scalar" -> {
                    cursor.advance();
                    String name = cursor.expectName();
                    skipDirectives();
                    builder.type(new SchemaType.ScalarType(name));
                }
                case "type" -> {
                    cursor.advance();
                    String name = cursor.expectName();
                    skipImplements();
                    skipDirectives();
                    builder.type(new SchemaType.ObjectType(name, parseFieldDefinitions()));
                }
                case "interface" -> {
                    cursor.advance();
                    String name = cursor.expectName();
                    skipImplements();
                    skipDirectives();
                    builder.type(new SchemaType.InterfaceType(name, parseFieldDefinitions()));
                }
                case "union" -> builder.type(parseUnion());
                case "enum" -> builder.type(parseEnum());
                case "input" -> {
                    cursor.advance();
                    String name = cursor.expectName();
                    skipDirectives();
                    builder.type(new SchemaType.InputObjectType(name, parseInputFields()));
                }
                default -> throw DocumentParser.unexpected(keyword);
            }
        }
        return builder.build();
    }

    private void parseSchemaDefinition(Schema.Builder builder) {
        cursor.advance();
        skipDirectives();
        cursor.expectPunctuator("{");
        while (!cursor.peek().is(Kind.PUNCTUATOR, "}")) {
            Token operation = cursor.peek();
            String operationName = cursor.expectName();
            cursor.expectPunctuator(":");
            String typeName = cursor.expectName();
            switch (operationName) {
                case "query" -> builder.queryType(typeName);
                case "mutation" -> builder.mutationType(typeName);
                case "subscription" -> builder.subscriptionType(typeName);
                default -> throw DocumentParser.unexpected(operation);
            }
        }
        cursor.advance();
    }

    private ImmutableList<FieldDefinition> parseFieldDefinitions() {
        MutableList<FieldDefinition> fields = Lists.mutable.empty();
        if (!cursor.peek().is(Kind.PUNCTUATOR, "{")) {
            return fields.toImmutable();
        }
        cursor.advance();
        while (!cursor.peek().is(Kind.PUNCTUATOR, "}")) {
            skipDescription();
            String name = cursor.expectName();
            ImmutableList<InputValueDefinition> arguments = Lists.immutable.empty();
            if (cursor.peek().is(Kind.PUNCTUATOR, "(")) {
                cursor.advance();
                arguments = parseInputValues(")");
            }
            cursor.expectPunctuator(":");
            TypeRef type = cursor.parseTypeReference();
            skipDirectives();
            fields.add(new FieldDefinition(name, arguments, type));
        }
        cursor.advance();
        return fields.toImmutable();
    }

    private ImmutableList<InputValueDefinition> parseInputFields() {
        if (!cursor.peek().is(Kind.PUNCTUATOR, "{")) {
            return Lists.immutable.empty();
        }
        cursor.advance();
        return parseInputValues("}");
    }

    /** Reads input value definitions up to and including the closing punctuator. */
    private ImmutableList<InputValueDefinition> parseInputValues(String closing) {
        MutableList<InputValueDefinition> values = Lists.mutable.empty();
        while (!cursor.peek().is(Kind.PUNCTUATOR, closing)) {
            skipDescription();
            String name = cursor.expectName();
            cursor.expectPunctuator(":");
            TypeRef type = cursor.parseTypeReference();
            Value defaultValue = null;
            if (cursor.peek().is(Kind.PUNCTUATOR, "=")) {
                cursor.advance();
                defaultValue = cursor.parseValueLiteral(true);
            }
            skipDirectives();
            values.add(new InputValueDefinition(name, type, defaultValue));
        }
        cursor.advance();
        return values.toImmutable();
    }

    private SchemaType.UnionType parseUnion() {
        cursor.advance();
        String name = cursor.expectName();
        skipDirectives();
        MutableList<String> members = Lists.mutable.empty();
        if (cursor.peek().is(Kind.PUNCTUATOR, "=")) {
            cursor.advance();
            if (cursor.peek().is(Kind.PUNCTUATOR, "|")) {
                cursor.advance();
            }
            members.add(cursor.expectName());
            while (cursor.peek().is(Kind.PUNCTUATOR, "|")) {
                cursor.advance();
                members.add(cursor.expectName());
            }
        }
        return new SchemaType.UnionType(name, members.toImmutable());
    }

    private SchemaType.EnumType parseEnum() {
        cursor.advance();
        String name = cursor.expectName();
        skipDirectives();
        MutableList<String> values = Lists.mutable.empty();
        if (cursor.peek().is(Kind.PUNCTUATOR, "{")) {
            cursor.advance();
            while (!cursor.peek().is(Kind.PUNCTUATOR, "}")) {
                skipDescription();
                values.add(cursor.expectName());
                skipDirectives();
            }
            cursor.advance();
        }
        return new SchemaType.EnumType(name, values.toImmutable());
    }

    private void skipImplements() {
        if (!cursor.peek().is(Kind.NAME, "implements")) {
            return;
        }
        cursor.advance();
        if (cursor.peek().is(Kind.PUNCTUATOR, "&")) {
            cursor.advance();
        }
        cursor.expectName();
        while (cursor.peek().is(Kind.PUNCTUATOR, "&")) {
            cursor.advance();
            cursor.expectName();
        }
    }

    private void skipDescription() {
        Kind kind = cursor.peek().kind();
        if (kind == Kind.STRING || kind == Kind.BLOCK_STRING) {
            cursor.advance();
        }
    }

    private void skipDirectives() {
        while (cursor.peek().is(Kind.PUNCTUATOR, "@")) {
            cursor.advance();
            cursor.expectName();
            if (cursor.peek().is(Kind.PUNCTUATOR, "(")) {
                cursor.advance();
                while (!cursor.peek().is(Kind.PUNCTUATOR, ")")) {
                    cursor.expectName();
                    cursor.expectPunctuator(":");
                    cursor.parseValueLiteral(true);
                }
                cursor.advance();
            }
        }
    }
}
