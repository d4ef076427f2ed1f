package com.verdictrag.model;

public record ConversationTurn(String question, String answer) {
}
