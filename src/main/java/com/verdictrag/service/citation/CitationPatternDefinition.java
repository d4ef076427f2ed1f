package com.verdictrag.service.citation;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One entry of a citation pattern catalog file.
 */
@Value
@Builder
@Jacksonized
public class CitationPatternDefinition {

    String type;

    String authority;

    String regex;

    @Builder.Default
    boolean caseInsensitive = false;
}
