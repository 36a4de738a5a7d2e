package com.gqlcanon.passes;

import com.gqlcanon.ast.Node;

import java.util.Map;

public record DefaultValues(Node.Document document, Map<String, Object> defaults) {}
