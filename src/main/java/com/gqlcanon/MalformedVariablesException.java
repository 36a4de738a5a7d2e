package com.gqlcanon;

public class MalformedVariablesException extends CanonicalizationException {
    public MalformedVariablesException(String message) {
        super(message);
    }

    public MalformedVariablesException(String message, Throwable cause) {
        super(message, cause);
    }
}
