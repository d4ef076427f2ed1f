package com.verdictrag.service.llm;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import com.verdictrag.exception.ModelInvocationException;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;

@SpringBootTest
class OllamaCircuitBreakerTests {

    @Autowired
    private LanguageModel languageModel;

    @Autowired
    private CircuitBreakerRegistry circuitBreakerRegistry;

    @AfterEach
    void closeCircuit() {
        circuitBreakerRegistry.circuitBreaker("ollama").transitionToClosedState();
    }

    @Test
    @DisplayName("open circuit rejects the call as model unavailable")
    void openCircuit() {
        CircuitBreaker breaker = circuitBreakerRegistry.circuitBreaker("ollama");
        breaker.transitionToForcedOpenState();

        assertThatThrownBy(() -> languageModel.generate(new LegalPrompt("system", "user"), Duration.ofSeconds(1)))
                .isInstanceOf(ModelInvocationException.class)
                .hasMessageContaining("circuit open")
                .extracting("reason")
                .isEqualTo(ModelInvocationException.Reason.UNAVAILABLE);
    }
}
