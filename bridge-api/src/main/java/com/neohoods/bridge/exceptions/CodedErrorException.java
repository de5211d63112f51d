package com.neohoods.bridge.exceptions;

import java.util.Collections;
import java.util.Map;

import lombok.Getter;

@Getter
public class CodedErrorException extends RuntimeException {

    private final CodedError error;
    private final Map<String, Object> variables;

    public CodedErrorException(CodedError error) {
        this(error, Collections.emptyMap());
    }

    public CodedErrorException(CodedError error, Map<String, Object> variables) {
        super(error.getDefaultMessage());
        this.error = error;
        this.variables = variables;
    }

    public CodedErrorException(CodedError error, Map<String, Object> variables, Throwable cause) {
        super(error.getDefaultMessage() + ": " + cause.getMessage(), cause);
        this.error = error;
        this.variables = variables;
    }
}
