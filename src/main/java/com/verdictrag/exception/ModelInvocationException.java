package com.verdictrag.exception;

import lombok.Getter;

/**
 * Raised by a {@link com.verdictrag.service.llm.LanguageModel} when generation does not
 * produce a usable answer.
 */
@Getter
public class ModelInvocationException extends RagException {

    public enum Reason {
        TIMEOUT,
        UPSTREAM_ERROR,
        EMPTY_RESPONSE,
        UNAVAILABLE,
        INTERRUPTED
    }

    private final Reason reason;

    public ModelInvocationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ModelInvocationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public static ModelInvocationException timeout(long millis) {
        return new ModelInvocationException(Reason.TIMEOUT,
                "Language model did not answer within " + millis + "ms");
    }

    public static ModelInvocationException upstream(Throwable cause) {
        return new ModelInvocationException(Reason.UPSTREAM_ERROR,
                "Language model call failed: " + cause.getMessage(), cause);
    }

    public static ModelInvocationException emptyResponse() {
        return new ModelInvocationException(Reason.EMPTY_RESPONSE,
                "Language model returned an empty answer");
    }
}
