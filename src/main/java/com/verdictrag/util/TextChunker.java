package com.verdictrag.util;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
public class TextChunker {

    /**
     * A contiguous slice of the source text.
     */
    public record TextSpan(int index, int start, int end, int overlapWithPrevious, String text) {
    }

    /**
     * Split text into spans of at most {@code targetSize} characters. Adjacent spans share
     * exactly {@code overlap} characters and together cover the whole text. Split points
     * are taken from the first separator, in priority order, that occurs inside the window;
     * a hard cut at the window end is the last resort.
     */
    public List<TextSpan> split(String text, ChunkingOptions options) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        int length = text.length();
        int targetSize = options.targetSize();
        int overlap = options.overlap();

        List<TextSpan> spans = new ArrayList<>();
        int start = 0;
        int overlapWithPrevious = 0;

        while (true) {
            int limit = Math.min(length, start + targetSize);
            int end = limit == length
                    ? length
                    : findSplit(text, start + overlap + 1, limit, options.separators());

            spans.add(new TextSpan(spans.size(), start, end, overlapWithPrevious, text.substring(start, end)));

            if (end >= length) {
                break;
            }

            int next = end - overlap;
            overlapWithPrevious = end - next;
            start = next;
        }

        log.debug("Split {} characters into {} spans (target={}, overlap={})",
                length, spans.size(), targetSize, overlap);
        return spans;
    }

    /**
     * End offset just after the highest-priority separator whose end lies in [minEnd, limit].
     */
    private int findSplit(String text, int minEnd, int limit, List<String> separators) {
        for (String separator : separators) {
            int idx = text.lastIndexOf(separator, limit - separator.length());
            if (idx >= 0 && idx + separator.length() >= minEnd) {
                return idx + separator.length();
            }
        }
        return limit;
    }

    /**
     * Truncate text to maximum length
     */
    public String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }

        return text.substring(0, maxLength) + "...";
    }
}
