package com.arriraw.error;

import lombok.Getter;

/**
 * Exception thrown when header metadata cannot be read.
 */
@Getter
public class ArriException extends Exception {
    private final ErrorType errorType;

    public ArriException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public ArriException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    @Override
    public String toString() {
        return String.format("ArriException{type=%s, message='%s'}", errorType, getMessage());
    }
}
