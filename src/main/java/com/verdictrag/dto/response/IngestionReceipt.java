package com.verdictrag.dto.response;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class IngestionReceipt {

    String documentId;

    int chunkCount;

    /**
     * Distinct citation strings found across all chunks.
     */
    int citationCount;

    boolean replacedExisting;
}
