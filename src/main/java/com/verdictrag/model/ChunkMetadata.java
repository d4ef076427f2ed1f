package com.verdictrag.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Value;

/**
 * Fixed metadata schema stored with every indexed chunk. Free-form values go into
 * {@link #extra} so filter predicates stay typed.
 */
@Value
@Builder(toBuilder = true)
public class ChunkMetadata implements Serializable {

    private static final long serialVersionUID = 1L;

    String documentId;

    String documentTitle;

    int chunkIndex;

    String jurisdiction;

    DocumentType documentType;

    @Builder.Default
    List<String> citations = List.of();

    @Builder.Default
    List<String> legalTerms = List.of();

    int wordCount;

    @Builder.Default
    Map<String, String> extra = Map.of();
}
