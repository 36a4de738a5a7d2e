package com.gqlcanon;

public class CanonicalizationException extends RuntimeException {
    public CanonicalizationException(String message) {
        super(message);
    }

    public CanonicalizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
