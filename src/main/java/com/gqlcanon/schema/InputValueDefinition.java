package com.gqlcanon.schema;

import com.gqlcanon.ast.TypeRef;
import com.gqlcanon.ast.Value;

public record InputValueDefinition(String name, TypeRef type, Value defaultValue) {}
