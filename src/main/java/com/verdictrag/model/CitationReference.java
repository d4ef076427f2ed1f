package com.verdictrag.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Curated, authoritative record of a citation. Used as ground truth when validating answers.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class CitationReference {

    String citation;

    String title;

    String jurisdiction;

    /**
     * Court or issuing authority.
     */
    String court;

    Integer year;

    /**
     * Id of the ingested document holding the authority's text, when there is one.
     */
    String documentId;

    @Builder.Default
    double weight = 1.0;
}
