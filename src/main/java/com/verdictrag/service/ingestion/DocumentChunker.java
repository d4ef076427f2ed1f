package com.verdictrag.service.ingestion;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.verdictrag.model.Chunk;
import com.verdictrag.model.ChunkMetadata;
import com.verdictrag.model.Document;
import com.verdictrag.model.ExtractedCitation;
import com.verdictrag.service.citation.CitationExtractor;
import com.verdictrag.service.quality.LegalVocabulary;
import com.verdictrag.util.ChunkingOptions;
import com.verdictrag.util.LegalTokenizer;
import com.verdictrag.util.TextChunker;
import com.verdictrag.util.TextChunker.TextSpan;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns a document into metadata-tagged chunks. Citations and legal terms are extracted
 * from each chunk's own span, so a citation cut by a split point is only reported where
 * it is complete.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DocumentChunker {

    private final TextChunker textChunker;
    private final CitationExtractor citationExtractor;
    private final LegalVocabulary vocabulary;
    private final LegalTokenizer tokenizer;

    public List<Chunk> chunk(Document document, ChunkingOptions options) {
        List<TextSpan> spans = textChunker.split(document.getText(), options);
        List<Chunk> chunks = new ArrayList<>(spans.size());

        for (TextSpan span : spans) {
            List<ExtractedCitation> citations = citationExtractor.extract(span.text());
            String chunkId = Chunk.chunkId(document.getId(), span.index());

            ChunkMetadata metadata = ChunkMetadata.builder()
                    .documentId(document.getId())
                    .documentTitle(document.getTitle())
                    .chunkIndex(span.index())
                    .jurisdiction(document.getJurisdiction())
                    .documentType(document.getDocumentType())
                    .citations(citations.stream().map(ExtractedCitation::getText).toList())
                    .legalTerms(vocabulary.findTerms(span.text()))
                    .wordCount(tokenizer.countWords(span.text()))
                    .extra(document.getExtra() != null ? Map.copyOf(document.getExtra()) : Map.of())
                    .build();

            chunks.add(Chunk.builder()
                    .id(chunkId)
                    .documentId(document.getId())
                    .index(span.index())
                    .text(span.text())
                    .startOffset(span.start())
                    .endOffset(span.end())
                    .overlapWithPrevious(span.overlapWithPrevious())
                    .citations(citations)
                    .metadata(metadata)
                    .build());
        }

        log.debug("Document {} chunked | chunks={}", document.getId(), chunks.size());
        return chunks;
    }
}
