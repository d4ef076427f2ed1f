package com.verdictrag.exception;

public class RegistryLookupException extends RagException {

    public RegistryLookupException(String message) {
        super(message);
    }

    public RegistryLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
