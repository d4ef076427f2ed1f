package com.verdictrag.service.quality;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

/**
 * South African legal vocabulary. Terms match case-insensitively on word boundaries,
 * with any run of whitespace accepted between the words of a multi-word term.
 */
@Component
public class LegalVocabulary {

    private static final Set<String> TERMS = new LinkedHashSet<>(List.of(
            // Court hierarchy
            "constitutional court", "supreme court of appeal", "high court", "magistrates court",
            "magistrate", "judge", "justice", "acting judge",

            // Legal roles
            "advocate", "attorney", "counsel", "silk", "senior counsel", "prosecutor",
            "state attorney", "sheriff", "registrar", "clerk of court",

            // Legal concepts
            "plaintiff", "defendant", "appellant", "respondent", "applicant",
            "interdict", "mandamus", "certiorari", "review", "appeal",
            "jurisdiction", "standing", "locus standi", "mero motu",

            // SA specific
            "ubuntu", "boni mores", "common law", "roman-dutch law",
            "customary law", "indigenous law", "delict", "contract",
            "unjust enrichment", "estoppel", "prescription",

            // Constitutional
            "bill of rights", "constitutional democracy", "rule of law",
            "separation of powers", "constitutional supremacy",

            // Labour
            "ccma", "labour court", "labour appeal court", "bargaining council",
            "trade union", "collective bargaining", "strike", "lockout",

            // Commercial
            "close corporation", "pty ltd", "public company", "jse",
            "companies act", "business rescue", "liquidation"));

    private static final List<String> PHRASES = List.of(
            "in the matter of", "ex parte", "in re", "inter partes",
            "on the papers", "rule nisi", "final order", "interim order",
            "with costs", "no order as to costs", "punitive costs",
            "de facto", "de jure", "prima facie", "onus probandi");

    private final Map<String, Pattern> patterns;

    public LegalVocabulary() {
        Map<String, Pattern> compiled = new LinkedHashMap<>();
        for (String term : TERMS) {
            compiled.put(term, compile(term));
        }
        for (String phrase : PHRASES) {
            compiled.put(phrase, compile(phrase));
        }
        this.patterns = Collections.unmodifiableMap(compiled);
    }

    /**
     * Distinct vocabulary entries present in {@code text}, ordered by first occurrence.
     */
    public List<String> findTerms(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<Hit> hits = new ArrayList<>();
        for (Map.Entry<String, Pattern> entry : patterns.entrySet()) {
            Matcher matcher = entry.getValue().matcher(text);
            if (matcher.find()) {
                hits.add(new Hit(entry.getKey(), matcher.start()));
            }
        }
        hits.sort(Comparator.comparingInt(Hit::offset).thenComparing(Hit::term));
        return hits.stream().map(Hit::term).toList();
    }

    public int size() {
        return patterns.size();
    }

    private static Pattern compile(String term) {
        StringBuilder regex = new StringBuilder("(?<![\\p{L}\\p{N}])");
        String[] words = term.split(" ");
        for (int i = 0; i < words.length; i++) {
            if (i > 0) {
                regex.append("\\s+");
            }
            regex.append(Pattern.quote(words[i]));
        }
        regex.append("(?![\\p{L}\\p{N}])");
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private record Hit(String term, int offset) {
    }
}
