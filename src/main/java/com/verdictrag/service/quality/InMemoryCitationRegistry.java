package com.verdictrag.service.quality;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Service;

import com.verdictrag.exception.MalformedInputException;
import com.verdictrag.model.CitationReference;

import lombok.extern.slf4j.Slf4j;

/**
 * Thread-safe registry keyed by citation string with whitespace collapsed, so
 * {@code "2019 (2)  SA 343 (SCA)"} and {@code "2019 (2) SA 343 (SCA)"} resolve alike.
 */
@Slf4j
@Service
public class InMemoryCitationRegistry implements CitationRegistry {

    private final Map<String, CitationReference> references = new ConcurrentHashMap<>();

    @Override
    public Optional<CitationReference> find(String citation) {
        if (citation == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(references.get(normalize(citation)));
    }

    @Override
    public Map<String, CitationReference> findAll(Collection<String> citations) {
        Map<String, CitationReference> found = new LinkedHashMap<>();
        for (String citation : citations) {
            find(citation).ifPresent(reference -> found.put(citation, reference));
        }
        return found;
    }

    @Override
    public void register(CitationReference reference) {
        if (reference == null || reference.getCitation() == null || reference.getCitation().isBlank()) {
            throw new MalformedInputException("Citation reference requires a citation string");
        }
        CitationReference previous = references.put(normalize(reference.getCitation()), reference);
        if (previous != null) {
            log.debug("Citation {} re-registered", reference.getCitation());
        }
    }

    @Override
    public int size() {
        return references.size();
    }

    static String normalize(String citation) {
        return citation.trim().replaceAll("\\s+", " ");
    }
}
