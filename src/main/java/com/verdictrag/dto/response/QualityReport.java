package com.verdictrag.dto.response;

import java.util.List;

import com.verdictrag.model.QualityLevel;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class QualityReport {

    double citationValidity;

    double terminologyDensity;

    double relevance;

    double hedging;

    double compositeScore;

    QualityLevel level;

    List<String> suggestions;

    List<String> issues;

    List<String> citationsChecked;

    /**
     * Citations not present in the registry, including those whose lookup failed.
     */
    List<String> invalidCitations;

    List<String> unresolvedCitations;

    /**
     * Citations in the answer that none of the context chunks contain.
     */
    List<String> ungroundedCitations;

    List<String> legalTermsFound;

    int hedgingPhraseCount;
}
