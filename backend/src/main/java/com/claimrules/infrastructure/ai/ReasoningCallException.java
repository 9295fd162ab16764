package com.claimrules.infrastructure.ai;

public class ReasoningCallException extends RuntimeException {

    public ReasoningCallException(String message) {
        super(message);
    }

    public ReasoningCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
