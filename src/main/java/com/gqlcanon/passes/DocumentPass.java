package com.gqlcanon.passes;

import com.gqlcanon.ast.Node;

@FunctionalInterface
public interface DocumentPass {
    Node.Document apply(Node.Document document);

    default DocumentPass andThen(DocumentPass next) {
        return document -> next.apply(apply(document));
    }
}
