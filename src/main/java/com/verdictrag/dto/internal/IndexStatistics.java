package com.verdictrag.dto.internal;

import java.util.Set;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class IndexStatistics {

    int totalChunks;

    int uniqueDocuments;

    Set<String> jurisdictions;

    Set<String> documentTypes;

    String embeddingModel;

    int dimension;
}
