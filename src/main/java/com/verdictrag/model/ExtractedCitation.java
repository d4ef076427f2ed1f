package com.verdictrag.model;

import java.io.Serializable;

import lombok.Builder;
import lombok.Value;

/**
 * One distinct citation string found in a text span.
 */
@Value
@Builder(toBuilder = true)
public class ExtractedCitation implements Serializable {

    private static final long serialVersionUID = 1L;

    String text;

    /**
     * Type label such as {@code law-report} or {@code apex-court}.
     */
    String type;

    String authority;

    Integer year;

    /**
     * How many times the exact string occurred in the scanned text.
     */
    int occurrences;

    int firstOffset;

    /**
     * Surrounding text of the first occurrence.
     */
    String context;
}
