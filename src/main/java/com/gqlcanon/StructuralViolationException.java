package com.gqlcanon;

public class StructuralViolationException extends CanonicalizationException {
    public StructuralViolationException(String message) {
        super(message);
    }
}
