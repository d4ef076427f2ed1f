package com.verdictrag.service.index;

import java.util.Map;
import java.util.Set;

import com.verdictrag.model.ChunkMetadata;
import com.verdictrag.model.DocumentType;

import lombok.Builder;
import lombok.Value;

/**
 * Metadata predicate applied before similarity ranking. Unset fields match everything.
 */
@Value
@Builder
public class ChunkFilter {

    public static final ChunkFilter NONE = ChunkFilter.builder().build();

    /**
     * Compared case-insensitively.
     */
    String jurisdiction;

    DocumentType documentType;

    Set<String> documentIds;

    /**
     * A citation the chunk must contain, compared with whitespace collapsed.
     */
    String citation;

    @Builder.Default
    Map<String, String> extra = Map.of();

    public static ChunkFilter jurisdiction(String jurisdiction) {
        return ChunkFilter.builder().jurisdiction(jurisdiction).build();
    }

    public boolean isEmpty() {
        return jurisdiction == null && documentType == null && documentIds == null
                && citation == null && extra.isEmpty();
    }

    public boolean matches(ChunkMetadata metadata) {
        if (metadata == null) {
            return isEmpty();
        }
        if (jurisdiction != null && !jurisdiction.equalsIgnoreCase(metadata.getJurisdiction())) {
            return false;
        }
        if (documentType != null && documentType != metadata.getDocumentType()) {
            return false;
        }
        if (documentIds != null && !documentIds.contains(metadata.getDocumentId())) {
            return false;
        }
        if (citation != null) {
            String wanted = normalize(citation);
            boolean found = metadata.getCitations().stream()
                    .anyMatch(c -> normalize(c).equals(wanted));
            if (!found) {
                return false;
            }
        }
        for (Map.Entry<String, String> entry : extra.entrySet()) {
            if (!entry.getValue().equals(metadata.getExtra().get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    private static String normalize(String value) {
        return value.trim().replaceAll("\\s+", " ");
    }
}
