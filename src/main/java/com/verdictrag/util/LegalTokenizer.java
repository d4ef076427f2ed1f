package com.verdictrag.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

@Component
public class LegalTokenizer {

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    private static final Set<String> STOP_WORDS = Set.of(
        "a", "an", "the", "and", "or", "of", "to", "in", "on", "at", "by", "for",
        "with", "from", "as", "is", "are", "was", "were", "be", "been", "it", "its",
        "this", "that", "these", "those", "which", "what", "who", "how", "when",
        "where", "why", "do", "does", "did", "can", "i", "my", "me", "you", "your"
    );

    /**
     * Lower-cased word tokens in order, punctuation removed.
     */
    public List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        return Arrays.stream(NON_WORD.split(text.toLowerCase(Locale.ROOT)))
            .filter(word -> !word.isEmpty())
            .collect(Collectors.toList());
    }

    public Set<String> tokenSet(String text) {
        return new LinkedHashSet<>(tokenize(text));
    }

    /**
     * Content words only: stop words and single characters removed.
     */
    public List<String> tokenizeUnigram(String text) {
        return tokenize(text).stream()
            .filter(word -> word.length() > 1)
            .filter(word -> !STOP_WORDS.contains(word))
            .collect(Collectors.toList());
    }

    public List<String> tokenizeBigram(String text) {
        List<String> tokens = tokenizeUnigram(text);
        List<String> bigrams = new ArrayList<>();

        for (int i = 0; i < tokens.size() - 1; i++) {
            bigrams.add(tokens.get(i) + "_" + tokens.get(i + 1));
        }

        return bigrams;
    }

    public int countWords(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }
}
