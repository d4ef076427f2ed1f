package com.verdictrag.service.llm;

/**
 * System framing plus the user-turn text sent in a single generation call.
 */
public record LegalPrompt(String system, String user) {
}
