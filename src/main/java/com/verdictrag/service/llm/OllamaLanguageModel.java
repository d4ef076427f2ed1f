package com.verdictrag.service.llm;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.verdictrag.exception.ModelInvocationException;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
public class OllamaLanguageModel implements LanguageModel {

    private final ChatModel chatModel;
    private final OllamaOptions defaultOptions;
    private final ExecutorService llmExecutor;

    public OllamaLanguageModel(ChatModel chatModel,
                               OllamaOptions defaultOptions,
                               @Qualifier("llmExecutor") ExecutorService llmExecutor) {
        this.chatModel = chatModel;
        this.defaultOptions = defaultOptions;
        this.llmExecutor = llmExecutor;
    }

    /**
     * Generate answer with system and user messages, bounded by {@code timeout}.
     * The upstream call is cancelled when the timeout expires or the caller is interrupted.
     */
    @Override
    @CircuitBreaker(name = "ollama", fallbackMethod = "modelUnavailable")
    public String generate(LegalPrompt prompt, Duration timeout) {
        log.debug("Generating answer with LLM (timeout={}ms)", timeout.toMillis());

        TimeLimiter timeLimiter = TimeLimiter.of(TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build());

        AtomicReference<Future<String>> submitted = new AtomicReference<>();
        try {
            String content = timeLimiter.executeFutureSupplier(() -> {
                Future<String> future = llmExecutor.submit(() -> call(prompt));
                submitted.set(future);
                return future;
            });
            log.debug("LLM response generated successfully ({} chars)", content.length());
            return content;

        } catch (TimeoutException e) {
            log.warn("LLM call timed out after {}ms", timeout.toMillis());
            throw ModelInvocationException.timeout(timeout.toMillis());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            Future<String> future = submitted.get();
            if (future != null) {
                future.cancel(true);
            }
            throw new ModelInvocationException(ModelInvocationException.Reason.INTERRUPTED,
                    "Language model call was interrupted", e);

        } catch (ModelInvocationException e) {
            throw e;

        } catch (Exception e) {
            log.error("Error generating LLM response: {}", e.getMessage());
            throw ModelInvocationException.upstream(e);
        }
    }

    private String call(LegalPrompt legalPrompt) {
        List<Message> messages = new ArrayList<>();
        messages.add(new SystemMessage(legalPrompt.system()));
        messages.add(new UserMessage(legalPrompt.user()));

        ChatResponse response = chatModel.call(new Prompt(messages, defaultOptions));
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw ModelInvocationException.emptyResponse();
        }

        String content = response.getResult().getOutput().getText();
        if (content == null || content.isBlank()) {
            throw ModelInvocationException.emptyResponse();
        }
        return content;
    }

    /**
     * Fallback when the circuit breaker is open. Other failures propagate unchanged.
     */
    private String modelUnavailable(LegalPrompt prompt, Duration timeout, CallNotPermittedException e) {
        log.warn("LLM circuit open, rejecting call: {}", e.getMessage());
        throw new ModelInvocationException(ModelInvocationException.Reason.UNAVAILABLE,
                "Language model unavailable (circuit open)", e);
    }
}
