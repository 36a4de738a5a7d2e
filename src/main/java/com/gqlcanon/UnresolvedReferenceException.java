package com.gqlcanon;

public class UnresolvedReferenceException extends CanonicalizationException {
    public UnresolvedReferenceException(String message) {
        super(message);
    }
}
