package com.verdictrag.service.citation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.verdictrag.model.ExtractedCitation;
import com.verdictrag.service.citation.CitationPatternCatalog.CompiledPattern;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Finds legal citation strings in text. Stateless apart from the immutable pattern catalog,
 * so one instance is shared by ingestion and validation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CitationExtractor {

    private static final Pattern YEAR = Pattern.compile("\\b(?:1[6-9]|20)\\d{2}\\b");
    private static final Pattern TRAILING_COURT = Pattern.compile("\\(([A-Z]{1,5})\\)\\s*$");
    private static final int CONTEXT_WINDOW = 100;

    private static final Pattern NEUTRAL_COURT = Pattern.compile("\\]\\s+(ZA[A-Z]+)\\s");

    private static final Comparator<Match> LEFTMOST_LONGEST = Comparator
            .comparingInt(Match::start)
            .thenComparing(Comparator.comparingInt(Match::length).reversed())
            .thenComparingInt(m -> m.pattern().order());

    private final CitationPatternCatalog catalog;

    /**
     * Distinct citations ordered by first occurrence, each with its occurrence count.
     */
    public List<ExtractedCitation> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<Match> candidates = new ArrayList<>();
        for (CompiledPattern compiled : catalog.getPatterns()) {
            Matcher matcher = compiled.pattern().matcher(text);
            while (matcher.find()) {
                if (matcher.end() > matcher.start()) {
                    candidates.add(new Match(matcher.start(), matcher.end(), compiled));
                }
            }
        }
        candidates.sort(LEFTMOST_LONGEST);

        Map<String, ExtractedCitation> distinct = new LinkedHashMap<>();
        int lastEnd = -1;
        for (Match match : candidates) {
            if (match.start() < lastEnd) {
                continue;
            }
            lastEnd = match.end();

            String citation = text.substring(match.start(), match.end());
            distinct.merge(citation, toCitation(citation, match, text),
                    (existing, ignored) -> existing.toBuilder()
                            .occurrences(existing.getOccurrences() + 1)
                            .build());
        }

        log.debug("Extracted {} distinct citations from {} candidate matches", distinct.size(), candidates.size());
        return List.copyOf(distinct.values());
    }

    public List<String> extractStrings(String text) {
        return extract(text).stream().map(ExtractedCitation::getText).toList();
    }

    public String getCatalogVersion() {
        return catalog.getVersion();
    }

    private ExtractedCitation toCitation(String citation, Match match, String text) {
        return ExtractedCitation.builder()
                .text(citation)
                .type(match.pattern().type())
                .authority(resolveAuthority(citation, match.pattern()))
                .year(extractYear(citation))
                .occurrences(1)
                .firstOffset(match.start())
                .context(context(text, match))
                .build();
    }

    // Text around the first occurrence, up to CONTEXT_WINDOW characters each side
    private static String context(String text, Match match) {
        int from = Math.max(0, match.start() - CONTEXT_WINDOW);
        int to = Math.min(text.length(), match.end() + CONTEXT_WINDOW);
        return text.substring(from, to).strip();
    }

    private String resolveAuthority(String citation, CompiledPattern pattern) {
        Matcher neutral = NEUTRAL_COURT.matcher(citation);
        if (neutral.find() && catalog.courtName(neutral.group(1)) != null) {
            return catalog.courtName(neutral.group(1));
        }
        Matcher trailing = TRAILING_COURT.matcher(citation);
        if (trailing.find() && catalog.courtName(trailing.group(1)) != null) {
            return catalog.courtName(trailing.group(1));
        }
        return pattern.authority();
    }

    private Integer extractYear(String citation) {
        Matcher matcher = YEAR.matcher(citation);
        return matcher.find() ? Integer.valueOf(matcher.group()) : null;
    }

    private record Match(int start, int end, CompiledPattern pattern) {
        int length() {
            return end - start;
        }
    }
}
