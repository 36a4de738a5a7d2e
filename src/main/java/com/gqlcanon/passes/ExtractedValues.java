package com.gqlcanon.passes;

import com.gqlcanon.ast.Node;

import java.util.List;

public record ExtractedValues(Node.Document document, List<Object> values) {}
