package com.verdictrag.dto.request;

import java.util.Map;

import com.verdictrag.model.DocumentType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Metadata edit for an ingested document. Null fields are left unchanged.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DocumentMetadataUpdate {

    private String title;

    private String jurisdiction;

    private DocumentType documentType;

    private Map<String, String> extra;
}
