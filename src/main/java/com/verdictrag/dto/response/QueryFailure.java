package com.verdictrag.dto.response;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class QueryFailure {

    public enum Type {
        MODEL_TIMEOUT,
        MODEL_ERROR,
        MODEL_UNAVAILABLE,
        EMBEDDING_FAILURE,
        CANCELLED
    }

    String question;

    Type type;

    String message;

    /**
     * Text the widget layer can show instead of an answer.
     */
    public String userFacing() {
        return switch (type) {
            case CANCELLED -> "The request was cancelled before an answer was produced.";
            default -> "A technical problem prevented an answer. Please contact the firm directly.";
        };
    }
}
