package com.verdictrag.exception;

/**
 * Root of the pipeline's unchecked exception hierarchy.
 */
public class RagException extends RuntimeException {

    public RagException(String message) {
        super(message);
    }

    public RagException(String message, Throwable cause) {
        super(message, cause);
    }
}
