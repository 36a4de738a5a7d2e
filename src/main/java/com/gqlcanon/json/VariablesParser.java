package com.gqlcanon.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.gqlcanon.MalformedVariablesException;
import org.eclipse.collections.impl.factory.Lists;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads variable bundles and single values from JSON into plain Java values: objects
 * become insertion-ordered {@link Map}s, arrays {@link List}s, integers {@link Long} (or
 * {@link java.math.BigInteger} when they do not fit), other numbers {@link Double}.
 */
public class VariablesParser {
    private final JsonFactory factory = new JsonFactory();

    /**
     * @throws IOException                 when the input is not valid JSON
     * @throws MalformedVariablesException when the top-level value is not an object
     */
    public Map<String, Object> parse(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            return bundle(parser);
        }
    }

    public Map<String, Object> parse(String json) {
        try (JsonParser parser = factory.createParser(json)) {
            return bundle(parser);
        } catch (IOException e) {
            throw new MalformedVariablesException("Invalid variables JSON: " + reason(e), e);
        }
    }

    /** Decodes {@code json} as UTF-8; invalid byte sequences are an error. */
    public Map<String, Object> parse(byte[] json) {
        try (JsonParser parser = factory.createParser(json)) {
            return bundle(parser);
        } catch (IOException e) {
            throw new MalformedVariablesException("Invalid variables JSON: " + reason(e), e);
        }
    }

    /** Parses any JSON value, scalars included. */
    public Object parseValue(String json) {
        try (JsonParser parser = factory.createParser(json)) {
            Object value = parseValue(parser, parser.nextToken());
            expectEnd(parser);
            return value;
        } catch (IOException e) {
            throw new MalformedVariablesException("Invalid JSON value: " + reason(e), e);
        }
    }

    private Map<String, Object> bundle(JsonParser parser) throws IOException {
        JsonToken token = parser.nextToken();
        if (token != JsonToken.START_OBJECT) {
            throw new MalformedVariablesException("Variables must be a JSON object, got " + describe(token));
        }
        Map<String, Object> variables = parseObject(parser);
        expectEnd(parser);
        return variables;
    }

    private Object parseValue(JsonParser parser, JsonToken token) throws IOException {
        if (token == null) {
            throw new IOException("Unexpected end of JSON input");
        }
        return switch (token) {
            case START_OBJECT -> parseObject(parser);
            case START_ARRAY -> parseArray(parser);
            case VALUE_STRING -> parser.getText();
            case VALUE_NUMBER_INT -> parser.getNumberType() == JsonParser.NumberType.BIG_INTEGER
                    ? parser.getBigIntegerValue() : (Object) parser.getLongValue();
            case VALUE_NUMBER_FLOAT -> parser.getDoubleValue();
            case VALUE_TRUE -> Boolean.TRUE;
            case VALUE_FALSE -> Boolean.FALSE;
            case VALUE_NULL -> null;
            default -> throw new IOException("Unexpected JSON token: " + token);
        };
    }

    private Map<String, Object> parseObject(JsonParser parser) throws IOException {
        Map<String, Object> fields = new LinkedHashMap<>();
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.currentName();
            fields.put(fieldName, parseValue(parser, parser.nextToken()));
        }
        return fields;
    }

    private List<Object> parseArray(JsonParser parser) throws IOException {
        var elements = Lists.mutable.<Object>empty();
        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            elements.add(parseValue(parser, token));
        }
        return elements;
    }

    private static void expectEnd(JsonParser parser) throws IOException {
        JsonToken trailing = parser.nextToken();
        if (trailing != null) {
            throw new IOException("Unexpected trailing JSON token: " + trailing);
        }
    }

    private static String reason(IOException e) {
        return e instanceof JsonProcessingException processing ? processing.getOriginalMessage() : e.getMessage();
    }

    private static String describe(JsonToken token) {
        return token == null ? "nothing" : token.name();
    }
}
