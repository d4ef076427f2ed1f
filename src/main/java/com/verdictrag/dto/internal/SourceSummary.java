package com.verdictrag.dto.internal;

import java.util.List;

import com.verdictrag.model.DocumentType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceSummary {

    private String documentId;

    private String title;

    private String jurisdiction;

    private DocumentType documentType;

    /**
     * Citations found in the retrieved chunks of this document.
     */
    private List<String> citations;

    private Double topScore;

    private String excerpt;
}
