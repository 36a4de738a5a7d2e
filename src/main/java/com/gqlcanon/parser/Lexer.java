package com.gqlcanon.parser;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Tokenizer shared by {@link DocumentParser} and {@link SchemaParser}. Commas, whitespace,
 * comments and a leading byte order mark are insignificant and never surface as tokens.
 */
final class Lexer {

    enum Kind {
        PUNCTUATOR,
        NAME,
        INT,
        FLOAT,
        STRING,
        BLOCK_STRING,
        EOF
    }

    record Token(Kind kind, String text, int line, int column) {
        boolean is(Kind expectedKind, String expectedText) {
            return kind == expectedKind && text.equals(expectedText);
        }

        String describe() {
            return kind == Kind.EOF ? "<EOF>" : "\"" + text + "\"";
        }
    }

    private final String source;
    private int position;
    private int line = 1;
    private int lineStart;

    private Lexer(String source) {
        this.source = source;
        if (!source.isEmpty() && source.charAt(0) == '\uFEFF') {
            position = 1;
        }
    }

    static MutableList<Token> tokenize(String source) {
        Lexer lexer = new Lexer(source);
        MutableList<Token> tokens = Lists.mutable.empty();
        Token token;
        do {
            token = lexer.next();
            tokens.add(token);
        } while (token.kind() != Kind.EOF);
        return tokens;
    }

    private Token next() {
        skipIgnored();
        int column = position - lineStart + 1;
        if (position >= source.length()) {
            return new Token(Kind.EOF, "", line, column);
        }
        char c = source.charAt(position);
        switch (c) {
            case '!', '$', '&', '(', ')', ':', '=', '@', '[', ']', '{', '|', '}' -> {
                position++;
                return new Token(Kind.PUNCTUATOR, String.valueOf(c), line, column);
            }
            case '.' -> {
                if (source.startsWith("...", position)) {
                    position += 3;
                    return new Token(Kind.PUNCTUATOR, "...", line, column);
                }
                throw error("Unexpected character \".\"", line, column);
            }
            case '"' -> {
                if (source.startsWith("\"\"\"", position)) {
                    return readBlockString(line, column);
                }
                return readString(line, column);
            }
            default -> {
                if (isNameStart(c)) {
                    return readName(line, column);
                }
                if (c == '-' || isDigit(c)) {
                    return readNumber(line, column);
                }
                throw error("Unexpected character \"" + c + "\"", line, column);
            }
        }
    }

    private void skipIgnored() {
        while (position < source.length()) {
            char c = source.charAt(position);
            if (c == '\n') {
                position++;
                newLine();
            } else if (c == '\r') {
                position++;
                if (position < source.length() && source.charAt(position) == '\n') {
                    position++;
                }
                newLine();
            } else if (c == ' ' || c == '\t' || c == ',') {
                position++;
            } else if (c == '#') {
                while (position < source.length() && source.charAt(position) != '\n' && source.charAt(position) != '\r') {
                    position++;
                }
            } else {
                return;
            }
        }
    }

    private void newLine() {
        line++;
        lineStart = position;
    }

    private Token readName(int tokenLine, int column) {
        int start = position;
        while (position < source.length()) {
            char c = source.charAt(position);
            if (isNameStart(c) || isDigit(c)) {
                position++;
            } else {
                break;
            }
        }
        return new Token(Kind.NAME, source.substring(start, position), tokenLine, column);
    }

    private Token readNumber(int tokenLine, int column) {
        int start = position;
        boolean isFloat = false;
        if (peek() == '-') {
            position++;
        }
        if (peek() == '0') {
            position++;
            if (isDigit(peek())) {
                throw error("Invalid number, unexpected digit after 0", tokenLine, column);
            }
        } else {
            readDigits(tokenLine, column);
        }
        if (peek() == '.') {
            isFloat = true;
            position++;
            readDigits(tokenLine, column);
        }
        if (peek() == 'e' || peek() == 'E') {
            isFloat = true;
            position++;
            if (peek() == '+' || peek() == '-') {
                position++;
            }
            readDigits(tokenLine, column);
        }
        if (peek() == '.' || isNameStart(peek())) {
            throw error("Invalid number, unexpected \"" + peek() + "\"", tokenLine, column);
        }
        return new Token(isFloat ? Kind.FLOAT : Kind.INT, source.substring(start, position), tokenLine, column);
    }

    private void readDigits(int tokenLine, int column) {
        if (!isDigit(peek())) {
            throw error("Invalid number, expected digit", tokenLine, column);
        }
        while (isDigit(peek())) {
            position++;
        }
    }

    private char peek() {
        return position < source.length() ? source.charAt(position) : '\0';
    }

    private Token readString(int tokenLine, int column) {
        position++;
        StringBuilder value = new StringBuilder();
        while (position < source.length()) {
            char c = source.charAt(position);
            if (c == '"') {
                position++;
                return new Token(Kind.STRING, value.toString(), tokenLine, column);
            }
            if (c == '\n' || c == '\r') {
                break;
            }
            if (c == '\\') {
                position++;
                char escaped = peek();
                switch (escaped) {
                    case '"' -> value.append('"');
                    case '\\' -> value.append('\\');
                    case '/' -> value.append('/');
                    case 'b' -> value.append('\b');
                    case 'f' -> value.append('\f');
                    case 'n' -> value.append('\n');
                    case 'r' -> value.append('\r');
                    case 't' -> value.append('\t');
                    case 'u' -> {
                        if (position + 5 > source.length()) {
                            throw error("Invalid unicode escape", tokenLine, column);
                        }
                        String hex = source.substring(position + 1, position + 5);
                        try {
                            value.append((char) Integer.parseInt(hex, 16));
                        } catch (NumberFormatException e) {
                            throw error("Invalid unicode escape \\u" + hex, tokenLine, column);
                        }
                        position += 4;
                    }
                    default -> throw error("Invalid escape sequence \\" + escaped, tokenLine, column);
                }
                position++;
            } else {
                value.append(c);
                position++;
            }
        }
        throw error("Unterminated string", tokenLine, column);
    }

    private Token readBlockString(int tokenLine, int column) {
        position += 3;
        StringBuilder raw = new StringBuilder();
        while (position < source.length()) {
            if (source.startsWith("\"\"\"", position)) {
                position += 3;
                return new Token(Kind.BLOCK_STRING, blockStringValue(raw.toString()), tokenLine, column);
            }
            if (source.startsWith("\\\"\"\"", position)) {
                raw.append("\"\"\"");
                position += 4;
                continue;
            }
            char c = source.charAt(position);
            raw.append(c);
            position++;
            if (c == '\n' || (c == '\r' && peek() != '\n')) {
                newLine();
            }
        }
        throw error("Unterminated block string", tokenLine, column);
    }

    /** Removes the common indentation and the leading and trailing blank lines. */
    static String blockStringValue(String raw) {
        String[] lines = raw.split("\r\n|\r|\n", -1);
        int commonIndent = Integer.MAX_VALUE;
        for (int i = 1; i < lines.length; i++) {
            int indent = leadingWhitespace(lines[i]);
            if (indent < lines[i].length() && indent < commonIndent) {
                commonIndent = indent;
            }
        }
        MutableList<String> result = Lists.mutable.of(lines);
        if (commonIndent != Integer.MAX_VALUE) {
            for (int i = 1; i < result.size(); i++) {
                String current = result.get(i);
                result.set(i, current.length() < commonIndent ? "" : current.substring(commonIndent));
            }
        }
        while (!result.isEmpty() && isBlank(result.getFirst())) {
            result.remove(0);
        }
        while (!result.isEmpty() && isBlank(result.getLast())) {
            result.remove(result.size() - 1);
        }
        return result.makeString("\n");
    }

    // names and numbers are ASCII only
    private static boolean isNameStart(char c) {
        return c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static int leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }

    private static boolean isBlank(String line) {
        return leadingWhitespace(line) == line.length();
    }

    private static IllegalArgumentException error(String message, int line, int column) {
        return new IllegalArgumentException("Syntax error at " + line + ":" + column + ": " + message);
    }
}
