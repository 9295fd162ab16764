package com.claimrules.domain.extraction.exception;

public class InvalidPipelineConfigException extends RuntimeException {

    public InvalidPipelineConfigException(String message) {
        super(message);
    }
}
