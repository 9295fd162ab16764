package com.claimrules.infrastructure.ai.parsing;

public class ResponseParseException extends RuntimeException {

    public ResponseParseException(String message) {
        super(message);
    }
}
