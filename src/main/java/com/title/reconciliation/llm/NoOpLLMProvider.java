package com.title.reconciliation.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * No-operation provider for when model integration is disabled.
 * Reports itself unavailable and answers every prompt with the manual review sentinel.
 */
public class NoOpLLMProvider implements LLMProvider {
    private static final Logger log = LoggerFactory.getLogger(NoOpLLMProvider.class);

    @Override
    public LLMCompletion complete(String prompt, Duration timeout) {
        log.debug("NoOp LLM provider called, prompt length {}", prompt.length());
        return LLMCompletion.of(ModelResponseParser.REVIEW_MANUAL);
    }

    @Override
    public String getProviderName() {
        return "NoOp";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
