package com.gqlcanon.ast;

import org.eclipse.collections.api.list.ImmutableList;

/**
 * Argument and object field values. Numbers keep their source text so that printing
 * a parsed document reproduces the literal exactly.
 */
public sealed interface Value extends Node {
    record IntValue(String value) implements Value {}

    record FloatValue(String value) implements Value {}

    record StringValue(String value) implements Value {}

    record BooleanValue(boolean value) implements Value {}

    record NullValue() implements Value {}

    record EnumValue(String value) implements Value {}

    record ListValue(ImmutableList<Value> values) implements Value {}

    record ObjectValue(ImmutableList<Node.ObjectField> fields) implements Value {}

    record Variable(String name) implements Value {}
}
