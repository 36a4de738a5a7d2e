package com.gqlcanon.parser;

import com.gqlcanon.ast.Node;
import com.gqlcanon.ast.OperationType;
import com.gqlcanon.ast.TypeRef;
import com.gqlcanon.ast.Value;
import com.gqlcanon.parser.Lexer.Kind;
import com.gqlcanon.parser.Lexer.Token;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Recursive descent parser for executable query documents: operations, fragments,
 * variables and every value kind. Directives are not part of the AST and are rejected.
 * Syntax errors are reported as {@link IllegalArgumentException} with a line and column.
 */
public class DocumentParser {
    private final MutableList<Token> tokens;
    private int index;

    DocumentParser(String source) {
        this.tokens = Lexer.tokenize(source);
    }

    public static Node.Document parse(String source) {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("Syntax error: empty document");
        }
        DocumentParser parser = new DocumentParser(source);
        Node.Document document = parser.parseDocument();
        parser.expectEnd();
        return document;
    }

    /** Parses a single value literal such as {@code {a: [1, 2]}}. */
    public static Value parseValue(String source) {
        DocumentParser parser = new DocumentParser(source);
        Value value = parser.parseValueLiteral(false);
        parser.expectEnd();
        return value;
    }

    public static TypeRef parseType(String source) {
        DocumentParser parser = new DocumentParser(source);
        TypeRef type = parser.parseTypeReference();
        parser.expectEnd();
        return type;
    }

    Node.Document parseDocument() {
        MutableList<Node.Definition> definitions = Lists.mutable.empty();
        do {
            definitions.add(parseDefinition());
        } while (peek().kind() != Kind.EOF);
        return new Node.Document(definitions.toImmutable());
    }

    private Node.Definition parseDefinition() {
        Token token = peek();
        if (token.is(Kind.PUNCTUATOR, "{")) {
            return new Node.OperationDefinition(OperationType.QUERY, null, Lists.immutable.empty(), parseSelectionSet());
        }
        if (token.kind() == Kind.NAME) {
            switch (token.text()) {
                case "query", "mutation", "subscription" -> {
                    return parseOperationDefinition();
                }
                case "fragment" -> {
                    return parseFragmentDefinition();
                }
                default -> {
                    // fall through to the error below
                }
            }
        }
        throw unexpected(token);
    }

    private Node.OperationDefinition parseOperationDefinition() {
        OperationType operation = OperationType.fromKeyword(advance().text());
        String name = peek().kind() == Kind.NAME ? advance().text() : null;
        ImmutableList<Node.VariableDefinition> variables = parseVariableDefinitions();
        rejectDirectives();
        return new Node.OperationDefinition(operation, name, variables, parseSelectionSet());
    }

    private ImmutableList<Node.VariableDefinition> parseVariableDefinitions() {
        if (!peek().is(Kind.PUNCTUATOR, "(")) {
            return Lists.immutable.empty();
        }
        advance();
        MutableList<Node.VariableDefinition> definitions = Lists.mutable.empty();
        do {
            expectPunctuator("$");
            String variable = expectName();
            expectPunctuator(":");
            TypeRef type = parseTypeReference();
            Value defaultValue = null;
            if (peek().is(Kind.PUNCTUATOR, "=")) {
                advance();
                defaultValue = parseValueLiteral(true);
            }
            rejectDirectives();
            definitions.add(new Node.VariableDefinition(variable, type, defaultValue));
        } while (!peek().is(Kind.PUNCTUATOR, ")"));
        advance();
        return definitions.toImmutable();
    }

    private Node.FragmentDefinition parseFragmentDefinition() {
        advance();
        Token nameToken = peek();
        String name = expectName();
        if (name.equals("on")) {
            throw unexpected(nameToken);
        }
        expectKeyword("on");
        String typeCondition = expectName();
        rejectDirectives();
        return new Node.FragmentDefinition(name, typeCondition, parseSelectionSet());
    }

    Node.SelectionSet parseSelectionSet() {
        expectPunctuator("{");
        MutableList<Node.Selection> selections = Lists.mutable.empty();
        do {
            selections.add(parseSelection());
        } while (!peek().is(Kind.PUNCTUATOR, "}"));
        advance();
        return new Node.SelectionSet(selections.toImmutable());
    }

    private Node.Selection parseSelection() {
        if (peek().is(Kind.PUNCTUATOR, "...")) {
            advance();
            if (peek().is(Kind.NAME, "on")) {
                advance();
                String typeCondition = expectName();
                rejectDirectives();
                return new Node.InlineFragment(typeCondition, parseSelectionSet());
            }
            if (peek().kind() == Kind.NAME) {
                String name = advance().text();
                rejectDirectives();
                return new Node.FragmentSpread(name);
            }
            rejectDirectives();
            return new Node.InlineFragment(null, parseSelectionSet());
        }
        return parseField();
    }

    private Node.Field parseField() {
        String nameOrAlias = expectName();
        String alias = null;
        String name = nameOrAlias;
        if (peek().is(Kind.PUNCTUATOR, ":")) {
            advance();
            alias = nameOrAlias;
            name = expectName();
        }
        ImmutableList<Node.Argument> arguments = parseArguments();
        rejectDirectives();
        Node.SelectionSet selectionSet = peek().is(Kind.PUNCTUATOR, "{") ? parseSelectionSet() : null;
        return new Node.Field(alias, name, arguments, selectionSet);
    }

    private ImmutableList<Node.Argument> parseArguments() {
        if (!peek().is(Kind.PUNCTUATOR, "(")) {
            return Lists.immutable.empty();
        }
        advance();
        MutableList<Node.Argument> arguments = Lists.mutable.empty();
        do {
            String name = expectName();
            expectPunctuator(":");
            arguments.add(new Node.Argument(name, parseValueLiteral(false)));
        } while (!peek().is(Kind.PUNCTUATOR, ")"));
        advance();
        return arguments.toImmutable();
    }

    Value parseValueLiteral(boolean constant) {
        Token token = peek();
        switch (token.kind()) {
            case INT -> {
                advance();
                return new Value.IntValue(token.text());
            }
            case FLOAT -> {
                advance();
                return new Value.FloatValue(token.text());
            }
            case STRING, BLOCK_STRING -> {
                advance();
                return new Value.StringValue(token.text());
            }
            case NAME -> {
                advance();
                return switch (token.text()) {
                    case "true" -> new Value.BooleanValue(true);
                    case "false" -> new Value.BooleanValue(false);
                    case "null" -> new Value.NullValue();
                    default -> new Value.EnumValue(token.text());
                };
            }
            case PUNCTUATOR -> {
                if (token.text().equals("$") && !constant) {
                    advance();
                    return new Value.Variable(expectName());
                }
                if (token.text().equals("[")) {
                    return parseList(constant);
                }
                if (token.text().equals("{")) {
                    return parseObject(constant);
                }
                throw unexpected(token);
            }
            default -> throw unexpected(token);
        }
    }

    private Value.ListValue parseList(boolean constant) {
        expectPunctuator("[");
        MutableList<Value> values = Lists.mutable.empty();
        while (!peek().is(Kind.PUNCTUATOR, "]")) {
            values.add(parseValueLiteral(constant));
        }
        advance();
        return new Value.ListValue(values.toImmutable());
    }

    private Value.ObjectValue parseObject(boolean constant) {
        expectPunctuator("{");
        MutableList<Node.ObjectField> fields = Lists.mutable.empty();
        while (!peek().is(Kind.PUNCTUATOR, "}")) {
            String name = expectName();
            expectPunctuator(":");
            fields.add(new Node.ObjectField(name, parseValueLiteral(constant)));
        }
        advance();
        return new Value.ObjectValue(fields.toImmutable());
    }

    TypeRef parseTypeReference() {
        TypeRef type;
        if (peek().is(Kind.PUNCTUATOR, "[")) {
            advance();
            type = new TypeRef.ListType(parseTypeReference());
            expectPunctuator("]");
        } else {
            type = new TypeRef.NamedType(expectName());
        }
        if (peek().is(Kind.PUNCTUATOR, "!")) {
            advance();
            return new TypeRef.NonNullType(type);
        }
        return type;
    }

    private void rejectDirectives() {
        Token token = peek();
        if (token.is(Kind.PUNCTUATOR, "@")) {
            throw new IllegalArgumentException("Syntax error at " + token.line() + ":" + token.column()
                    + ": directives are not supported");
        }
    }

    Token peek() {
        return tokens.get(index);
    }

    Token advance() {
        Token token = tokens.get(index);
        if (token.kind() != Kind.EOF) {
            index++;
        }
        return token;
    }

    String expectName() {
        Token token = advance();
        if (token.kind() != Kind.NAME) {
            throw unexpected(token);
        }
        return token.text();
    }

    void expectKeyword(String keyword) {
        Token token = advance();
        if (!token.is(Kind.NAME, keyword)) {
            throw unexpected(token, "expected \"" + keyword + "\"");
        }
    }

    void expectPunctuator(String punctuator) {
        Token token = advance();
        if (!token.is(Kind.PUNCTUATOR, punctuator)) {
            throw unexpected(token, "expected \"" + punctuator + "\"");
        }
    }

    void expectEnd() {
        Token token = peek();
        if (token.kind() != Kind.EOF) {
            throw unexpected(token);
        }
    }

    static IllegalArgumentException unexpected(Token token) {
        return unexpected(token, null);
    }

    static IllegalArgumentException unexpected(Token token, String expectation) {
        String message = "Syntax error at " + token.line() + ":" + token.column() + ": unexpected " + token.describe();
        return new IllegalArgumentException(expectation == null ? message : message + ", " + expectation);
    }
}
