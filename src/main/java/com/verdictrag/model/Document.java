package com.verdictrag.model;

import java.time.Instant;
import java.util.Map;

import lombok.Builder;
import lombok.Value;

/**
 * A legal document whose text has already been extracted from its source format.
 */
@Value
@Builder(toBuilder = true)
public class Document {

    String id;

    String title;

    /**
     * Jurisdiction tag, e.g. "South Africa" or "Western Cape".
     */
    String jurisdiction;

    /**
     * Null when unlabelled; ingestion then classifies the text.
     */
    DocumentType documentType;

    String text;

    @Builder.Default
    Instant createdAt = Instant.now();

    @Builder.Default
    Map<String, String> extra = Map.of();
}
