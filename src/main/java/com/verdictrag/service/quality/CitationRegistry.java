package com.verdictrag.service.quality;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

import com.verdictrag.model.CitationReference;

/**
 * Authoritative citation records consulted by the quality validator.
 */
public interface CitationRegistry {

    /**
     * @throws com.verdictrag.exception.RegistryLookupException when the registry cannot be consulted
     */
    Optional<CitationReference> find(String citation);

    /**
     * Batch lookup. Citations that are not registered are absent from the returned map.
     *
     * @throws com.verdictrag.exception.RegistryLookupException when the registry cannot be consulted
     */
    Map<String, CitationReference> findAll(Collection<String> citations);

    void register(CitationReference reference);

    int size();
}
