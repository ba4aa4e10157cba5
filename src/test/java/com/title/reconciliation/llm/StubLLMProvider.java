package com.title.reconciliation.llm;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Scripted provider for tests. Answers are keyed by the provider title quoted in the prompt.
 */
public class StubLLMProvider implements LLMProvider {

    private final Map<String, Function<String, LLMCompletion>> answers = new ConcurrentHashMap<>();
    private final AtomicInteger calls = new AtomicInteger();
    private volatile Function<String, LLMCompletion> fallback =
            prompt -> LLMCompletion.of(ModelResponseParser.REVIEW_MANUAL);
    private volatile boolean available = true;

    public StubLLMProvider answer(String providerTitle, String text) {
        return answer(providerTitle, prompt -> LLMCompletion.of(text));
    }

    public StubLLMProvider answer(String providerTitle, Function<String, LLMCompletion> answer) {
        answers.put(providerTitle, answer);
        return this;
    }

    /**
     * Every call for this title times out.
     */
    public StubLLMProvider timeoutFor(String providerTitle) {
        return answer(providerTitle, prompt -> {
            throw new TransientProviderException(TransientProviderException.Reason.TIMEOUT, "stub timeout");
        });
    }

    public StubLLMProvider fallback(Function<String, LLMCompletion> fallback) {
        this.fallback = fallback;
        return this;
    }

    public StubLLMProvider unavailable() {
        this.available = false;
        return this;
    }

    public int getCalls() {
        return calls.get();
    }

    @Override
    public LLMCompletion complete(String prompt, Duration timeout) {
        calls.incrementAndGet();
        for (Map.Entry<String, Function<String, LLMCompletion>> entry : answers.entrySet()) {
            if (prompt.contains("Provider title: \"" + entry.getKey() + "\"")) {
                return entry.getValue().apply(prompt);
            }
        }
        return fallback.apply(prompt);
    }

    @Override
    public String getProviderName() {
        return "Stub";
    }

    @Override
    public boolean isAvailable() {
        return available;
    }
}
