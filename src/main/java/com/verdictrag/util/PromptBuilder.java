package com.verdictrag.util;

import java.util.List;

import org.springframework.stereotype.Component;

import com.verdictrag.dto.internal.ScoredChunk;
import com.verdictrag.model.ChunkMetadata;
import com.verdictrag.model.ConversationTurn;
import com.verdictrag.service.llm.LegalPrompt;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
public class PromptBuilder {

    static final String NO_CONTEXT_NOTICE =
            "No relevant context was found in the document collection for this question.";

    /* =========================================================
     * SYSTEM PROMPT
     * ========================================================= */
    public String buildSystemPrompt() {
        return """
                You are a professional legal research assistant specialising in South African law.

                Principles:
                1. ACCURACY: Base the answer on the legal sources provided
                2. CLARITY: Explain in plain, well-structured language
                3. CITATIONS: Refer to specific cases, statutes and sections using South African citation format
                4. DISCIPLINE: Never cite a case, statute or section that does not appear in the provided sources
                5. CAUTION: If the sources do not answer the question, say so plainly

                Answer in English. The answer is legal information, not legal advice.
                """;
    }

    /* =========================================================
     * STANDARD RAG PROMPT
     * ========================================================= */
    public String buildStandardPrompt(
            String question,
            List<ScoredChunk> context,
            List<ConversationTurn> history) {

        StringBuilder prompt = new StringBuilder();

        prompt.append("### TASK\n");
        prompt.append("Answer the legal question using the sources provided.\n\n");

        prompt.append("### RELEVANT LEGAL SOURCES\n");
        if (context == null || context.isEmpty()) {
            prompt.append(NO_CONTEXT_NOTICE).append("\n");
            prompt.append("Do not cite any authority. Explain that the collection does not cover the question ");
            prompt.append("and give only general orientation.\n\n");
        } else {
            prompt.append(formatContext(context)).append("\n");
        }

        if (history != null && !history.isEmpty()) {
            prompt.append("### CONVERSATION HISTORY\n");
            prompt.append(formatHistory(history)).append("\n");
        }

        prompt.append("### QUESTION\n");
        prompt.append(question).append("\n\n");

        prompt.append("### ANSWER REQUIREMENTS\n");
        prompt.append("- Be concise and address the question directly\n");
        prompt.append("- Cite the case, Act or section for each legal proposition\n");
        prompt.append("- Explain the legal reasoning\n\n");

        prompt.append("### ANSWER");

        return prompt.toString();
    }

    public LegalPrompt build(String question, List<ScoredChunk> context, List<ConversationTurn> history) {
        return new LegalPrompt(buildSystemPrompt(), buildStandardPrompt(question, context, history));
    }

    /* =========================================================
     * CONTEXT FORMAT
     * ========================================================= */
    public String formatContext(List<ScoredChunk> results) {
        StringBuilder context = new StringBuilder();

        for (int i = 0; i < results.size(); i++) {
            ScoredChunk r = results.get(i);
            ChunkMetadata metadata = r.getChunk().getMetadata();

            context.append("[SOURCE ").append(i + 1).append("]");
            if (metadata != null && metadata.getDocumentTitle() != null) {
                context.append(" ").append(metadata.getDocumentTitle());
            }
            List<String> citations = r.getChunk().citationStrings();
            if (!citations.isEmpty()) {
                context.append(" | ").append(String.join("; ", citations));
            }

            context.append("\n");
            context.append(r.getText()).append("\n");
            context.append("-".repeat(60)).append("\n");
        }

        return context.toString();
    }

    public String formatHistory(List<ConversationTurn> history) {
        StringBuilder formatted = new StringBuilder();
        for (ConversationTurn turn : history) {
            formatted.append("User: ").append(turn.question()).append("\n");
            formatted.append("Assistant: ").append(turn.answer()).append("\n");
        }
        return formatted.toString();
    }
}
