package com.verdictrag.service.llm;

import java.time.Duration;

/**
 * Text generation backend. Implementations make exactly one upstream call per invocation.
 */
public interface LanguageModel {

    /**
     * @throws com.verdictrag.exception.ModelInvocationException on timeout, upstream failure,
     *         an empty answer, an open circuit or interruption
     */
    String generate(LegalPrompt prompt, Duration timeout);
}
