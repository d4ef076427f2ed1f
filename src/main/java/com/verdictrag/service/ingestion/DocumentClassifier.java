package com.verdictrag.service.ingestion;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.verdictrag.model.DocumentType;

import lombok.extern.slf4j.Slf4j;

/**
 * Guesses the document type of unlabelled text from keyword and phrase indicators.
 * Each keyword present scores 1, each phrase match scores 2; confidence is the best
 * score over {@link #SATURATION}, capped at 1.
 */
@Slf4j
@Component
public class DocumentClassifier {

    static final double SATURATION = 5.0;

    private static final int KEYWORD_WEIGHT = 1;
    private static final int PHRASE_WEIGHT = 2;

    // Declaration order breaks ties
    private static final List<Rule> RULES = List.of(
            rule(DocumentType.JUDGMENT,
                    List.of("judgment", "court", "plaintiff", "defendant", "magistrate", "judge"),
                    List.of("in the matter of", "judgment delivered", "court[^.]{0,80}\\bheld")),
            rule(DocumentType.CONTRACT,
                    List.of("agreement", "contract", "party", "terms", "conditions", "consideration"),
                    List.of("this agreement", "the parties agree", "terms and conditions")),
            rule(DocumentType.STATUTE,
                    List.of("act", "section", "minister", "parliament"),
                    List.of("act\\s+\\d+\\s+of\\s+\\d{4}", "section\\s+\\d+", "minister may")),
            rule(DocumentType.PLEADING,
                    List.of("particulars of claim", "statement of case", "prayer", "wherefore"),
                    List.of("particulars of claim", "prayer[^.]{0,40}\\brelief", "wherefore\\s+plaintiff")),
            rule(DocumentType.REGULATION,
                    List.of("regulation", "regulations", "gazette", "notice"),
                    List.of("government\\s+gazette", "\\bGNR?\\s+\\d+", "these regulations")));

    public Classification classify(String text) {
        if (text == null || text.isBlank()) {
            return Classification.UNKNOWN;
        }

        DocumentType best = null;
        int bestScore = 0;
        for (Rule rule : RULES) {
            int score = rule.score(text);
            if (score > bestScore) {
                best = rule.type();
                bestScore = score;
            }
        }
        if (best == null) {
            return Classification.UNKNOWN;
        }

        double confidence = Math.min(1.0, bestScore / SATURATION);
        log.debug("Classified as {} (score={}, confidence={})", best, bestScore, confidence);
        return new Classification(best, confidence);
    }

    private static Rule rule(DocumentType type, List<String> keywords, List<String> phrases) {
        int flags = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        return new Rule(type,
                keywords.stream()
                        .map(k -> Pattern.compile("\\b" + Pattern.quote(k).replace(" ", "\\E\\s+\\Q") + "\\b", flags))
                        .toList(),
                phrases.stream().map(p -> Pattern.compile(p, flags)).toList());
    }

    public record Classification(DocumentType type, double confidence) {

        public static final Classification UNKNOWN = new Classification(DocumentType.OTHER, 0.0);
    }

    private record Rule(DocumentType type, List<Pattern> keywords, List<Pattern> phrases) {

        int score(String text) {
            int score = 0;
            for (Pattern keyword : keywords) {
                if (keyword.matcher(text).find()) {
                    score += KEYWORD_WEIGHT;
                }
            }
            for (Pattern phrase : phrases) {
                Matcher matcher = phrase.matcher(text);
                while (matcher.find()) {
                    score += PHRASE_WEIGHT;
                }
            }
            return score;
        }
    }
}
