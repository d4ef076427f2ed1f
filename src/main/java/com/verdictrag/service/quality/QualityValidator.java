package com.verdictrag.service.quality;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.verdictrag.config.LegalRagProperties;
import com.verdictrag.dto.response.QualityReport;
import com.verdictrag.exception.RegistryLookupException;
import com.verdictrag.model.Chunk;
import com.verdictrag.model.CitationReference;
import com.verdictrag.model.QualityLevel;
import com.verdictrag.service.citation.CitationExtractor;
import com.verdictrag.util.LegalTokenizer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Scores a generated answer against the retrieved context and the citation registry.
 * Each component score is in [0,1]; the composite is a fixed convex combination of them.
 * The registry is read, never written.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QualityValidator {

    static final double VALIDITY_WEIGHT = 0.4;
    static final double TERMINOLOGY_WEIGHT = 0.3;
    static final double RELEVANCE_WEIGHT = 0.2;
    static final double HEDGING_WEIGHT = 0.1;

    private static final double COMPOSITE_SCALE = 1e9;

    private static final int BRIEF_ANSWER_CHARS = 100;

    private static final List<String> HEDGING_PHRASES = List.of(
            "might", "may be", "possibly", "perhaps", "probably", "presumably",
            "it seems", "it appears", "seemingly", "apparently",
            "i think", "i believe", "i guess", "i suppose",
            "not sure", "not certain", "uncertain", "unclear",
            "arguably", "maybe", "could be", "sort of", "kind of");

    private static final Pattern HEDGING_PATTERN = hedgingPattern();

    private static final Pattern EXTERNAL_SEARCH = Pattern.compile("\\b(google|search)\\b", Pattern.CASE_INSENSITIVE);

    private final CitationExtractor citationExtractor;
    private final CitationRegistry registry;
    private final LegalVocabulary vocabulary;
    private final LegalTokenizer tokenizer;
    private final LegalRagProperties properties;

    public QualityReport validate(String question, String answer, List<Chunk> context) {
        String safeAnswer = answer != null ? answer : "";
        String safeQuestion = question != null ? question : "";
        List<Chunk> chunks = context != null ? context : List.of();
        LegalRagProperties.Quality config = properties.getQuality();

        List<String> citations = citationExtractor.extractStrings(safeAnswer);
        CitationCheck check = checkCitations(citations);
        double validity = (double) check.valid().size() / Math.max(1, citations.size());

        List<String> terms = vocabulary.findTerms(safeAnswer);
        double terminology = Math.min(1.0, terms.size() / config.getExpectedTermDensity());

        double relevance = relevance(safeQuestion, safeAnswer);

        int hedges = countHedges(safeAnswer);
        double hedging = clamp(1.0 - Math.max(0, hedges - config.getHedgingAllowance()) * config.getHedgingPenalty());

        double composite = composite(validity, terminology, relevance, hedging);

        List<String> ungrounded = ungroundedCitations(citations, chunks);

        List<String> suggestions = suggestions(validity, terminology, relevance, hedging, ungrounded, config);
        List<String> issues = issues(safeAnswer, ungrounded);

        QualityLevel level = QualityLevel.of(composite);
        log.debug("Quality | composite={} | level={} | validity={} | terminology={} | relevance={} | hedging={}",
                String.format("%.3f", composite), level, validity, terminology, relevance, hedging);

        return QualityReport.builder()
                .citationValidity(validity)
                .terminologyDensity(terminology)
                .relevance(relevance)
                .hedging(hedging)
                .compositeScore(composite)
                .level(level)
                .suggestions(suggestions)
                .issues(issues)
                .citationsChecked(citations)
                .invalidCitations(check.invalid())
                .unresolvedCitations(check.unresolved())
                .ungroundedCitations(ungrounded)
                .legalTermsFound(terms)
                .hedgingPhraseCount(hedges)
                .build();
    }

    // ============================================================
    // Components
    // ============================================================

    private CitationCheck checkCitations(List<String> citations) {
        List<String> valid = new ArrayList<>();
        List<String> invalid = new ArrayList<>();
        List<String> unresolved = new ArrayList<>();
        if (citations.isEmpty()) {
            return new CitationCheck(valid, invalid, unresolved);
        }

        Map<String, CitationReference> found;
        try {
            found = registry.findAll(citations);
        } catch (RegistryLookupException e) {
            log.warn("Batch registry lookup failed, checking citations one by one: {}", e.getMessage());
            found = new LinkedHashMap<>();
            for (String citation : citations) {
                try {
                    CitationReference reference = registry.find(citation).orElse(null);
                    if (reference != null) {
                        found.put(citation, reference);
                    }
                } catch (RegistryLookupException single) {
                    log.warn("Registry lookup failed for {}: {}", citation, single.getMessage());
                    unresolved.add(citation);
                }
            }
        }

        for (String citation : citations) {
            if (found.containsKey(citation)) {
                valid.add(citation);
            } else {
                invalid.add(citation);
            }
        }
        return new CitationCheck(valid, invalid, unresolved);
    }

    double relevance(String question, String answer) {
        Set<String> questionTokens = tokenizer.tokenSet(question);
        Set<String> answerTokens = tokenizer.tokenSet(answer);
        long shared = questionTokens.stream().filter(answerTokens::contains).count();
        return clamp((double) shared / Math.max(1, questionTokens.size()));
    }

    int countHedges(String answer) {
        Matcher matcher = HEDGING_PATTERN.matcher(answer);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private List<String> ungroundedCitations(List<String> citations, List<Chunk> context) {
        if (citations.isEmpty()) {
            return List.of();
        }
        Set<String> grounded = new LinkedHashSet<>();
        for (Chunk chunk : context) {
            String text = collapse(chunk.getText());
            for (String citation : citations) {
                if (text.contains(collapse(citation))) {
                    grounded.add(citation);
                }
            }
        }
        return citations.stream().filter(c -> !grounded.contains(c)).toList();
    }

    private List<String> suggestions(double validity, double terminology, double relevance, double hedging,
                                     List<String> ungrounded, LegalRagProperties.Quality config) {
        List<String> suggestions = new ArrayList<>();
        if (validity < config.getValidityThreshold()) {
            suggestions.add("Cite verifiable South African authorities, such as reported cases and statutes, with full references");
        }
        if (terminology < config.getTerminologyThreshold()) {
            suggestions.add("Use more precise South African legal terminology");
        }
        if (relevance < config.getRelevanceThreshold()) {
            suggestions.add("Address the question directly and stay on its subject");
        }
        if (hedging < config.getHedgingThreshold()) {
            suggestions.add("Use more decisive phrasing where the authorities support a conclusion");
        }
        if (!ungrounded.isEmpty()) {
            suggestions.add("Cite only authorities that appear in the retrieved sources: "
                    + String.join(", ", ungrounded));
        }
        return suggestions;
    }

    private List<String> issues(String answer, List<String> ungrounded) {
        List<String> issues = new ArrayList<>();
        String lower = answer.toLowerCase(Locale.ROOT);
        if (answer.strip().length() < BRIEF_ANSWER_CHARS) {
            issues.add("Response appears too brief for a legal query");
        }
        if (EXTERNAL_SEARCH.matcher(answer).find()) {
            issues.add("Response suggests an external search rather than providing legal analysis");
        }
        if (lower.contains("i am not a lawyer")) {
            issues.add("Unnecessary disclaimer may undermine the answer's authority");
        }
        if (!ungrounded.isEmpty()) {
            issues.add("Citations not found in the retrieved context: " + String.join(", ", ungrounded));
        }
        return issues;
    }

    // ============================================================
    // Helpers
    // ============================================================

    private static Pattern hedgingPattern() {
        String alternation = HEDGING_PHRASES.stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(phrase -> phrase.replace(" ", "\\s+"))
                .collect(Collectors.joining("|"));
        return Pattern.compile("(?<![\\p{L}\\p{N}])(?:" + alternation + ")(?![\\p{L}\\p{N}])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private static String collapse(String text) {
        return text == null ? "" : text.replaceAll("\\s+", " ");
    }

    /**
     * Weighted sum rounded to nine decimals, so a composite on a level boundary is not pushed
     * below it by floating-point error.
     */
    static double composite(double validity, double terminology, double relevance, double hedging) {
        double sum = VALIDITY_WEIGHT * validity
                + TERMINOLOGY_WEIGHT * terminology
                + RELEVANCE_WEIGHT * relevance
                + HEDGING_WEIGHT * hedging;
        return clamp(Math.round(sum * COMPOSITE_SCALE) / COMPOSITE_SCALE);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private record CitationCheck(List<String> valid, List<String> invalid, List<String> unresolved) {
    }
}
