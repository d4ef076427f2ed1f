package com.verdictrag.dto.request;

import java.util.List;

import com.verdictrag.model.ConversationTurn;
import com.verdictrag.model.DocumentType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QueryRequest {

    private String question;

    /**
     * Restricts retrieval to chunks of this jurisdiction when set.
     */
    private String jurisdiction;

    private DocumentType documentType;

    /**
     * Prior turns, oldest first. Only the most recent ones reach the prompt.
     */
    @Builder.Default
    private List<ConversationTurn> history = List.of();
}
