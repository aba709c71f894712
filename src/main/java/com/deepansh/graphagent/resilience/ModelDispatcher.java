package com.deepansh.graphagent.resilience;

import com.deepansh.graphagent.exception.AllBackendsExhaustedException;
import com.deepansh.graphagent.exception.BackendExhaustedException;
import com.deepansh.graphagent.exception.TransientBackendException;
import com.deepansh.graphagent.llm.BoundModel;
import com.deepansh.graphagent.llm.LlmProperties;
import com.deepansh.graphagent.llm.ModelBackend;
import com.deepansh.graphagent.llm.ModelBackendRegistry;
import com.deepansh.graphagent.llm.TokenCounter;
import com.deepansh.graphagent.model.LlmResponse;
import com.deepansh.graphagent.model.Message;
import com.deepansh.graphagent.tool.ToolDefinition;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Resilient front door to the model backend registry.
 *
 * Per call, starting from the registry cursor:
 * 1. Invoke the current backend through its own Resilience4j {@link Retry}:
 *    up to R attempts with exponential backoff, retrying only transient failures.
 * 2. A structural failure, or R failed attempts, exhausts the backend for this call;
 *    the cursor advances circularly and the next backend gets a fresh R attempts.
 * 3. After every backend has been tried once, the call fails with
 *    {@link AllBackendsExhaustedException}.
 *
 * The cursor is sticky: a later call starts wherever the previous one ended.
 * The tool set is rebound to every backend the dispatcher rotates onto.
 */
@Slf4j
public class ModelDispatcher {

    private final ModelBackendRegistry registry;
    private final RetryRegistry retryRegistry;

    private volatile List<ToolDefinition> boundTools = List.of();
    private volatile BoundModel current;

    public ModelDispatcher(ModelBackendRegistry registry, LlmProperties.Retry retry) {
        this.registry = registry;
        this.retryRegistry = RetryRegistry.of(RetryConfig.custom()
                .maxAttempts(retry.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        retry.getInitialBackoff().toMillis(),
                        retry.getMultiplier(),
                        retry.getMaxBackoff().toMillis()))
                .retryOnException(TransientBackendException.class::isInstance)
                .build());
        this.retryRegistry.getEventPublisher().onEntryAdded(added -> added.getAddedEntry().getEventPublisher()
                .onRetry(event -> log.warn("Backend [{}] attempt {} failed, retrying in {}ms: {}",
                        event.getName(), event.getNumberOfRetryAttempts(),
                        event.getWaitInterval().toMillis(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "")));
        this.current = registry.current().bind(boundTools);
    }

    /**
     * Binds a tool set to the current backend; every later rotation rebinds it.
     */
    public synchronized void bindTools(List<ToolDefinition> tools) {
        this.boundTools = List.copyOf(tools);
        this.current = registry.current().bind(boundTools);
        log.info("Bound {} tools to backend [{}]", boundTools.size(), current.backendName());
    }

    /** The binding calls go through right now. */
    public BoundModel currentBinding() {
        return current;
    }

    /** Token counter of the backend the next call starts on. */
    public TokenCounter currentTokenCounter() {
        return registry.current().tokenCounter();
    }

    public LlmResponse call(List<Message> messages) {
        int size = registry.size();
        int index = registry.currentIndex();
        List<String> attempted = new ArrayList<>(size);
        BackendExhaustedException lastFailure = null;

        for (int tried = 0; tried < size; tried++) {
            BoundModel bound = bindingFor(registry.get(index));
            attempted.add(bound.backendName());

            try {
                return invokeWithRetry(bound, messages);
            } catch (BackendExhaustedException e) {
                lastFailure = e;
                log.error("{}, rotating to next backend", e.getMessage());
                int previous = index;
                index = (index + 1) % size;
                registry.advanceFrom(previous);
            }
        }

        throw new AllBackendsExhaustedException(attempted, lastFailure);
    }

    private LlmResponse invokeWithRetry(BoundModel bound, List<Message> messages) {
        Retry retry = retryRegistry.retry(bound.backendName());
        try {
            return Retry.decorateSupplier(retry, () -> bound.chat(messages)).get();
        } catch (RuntimeException e) {
            throw new BackendExhaustedException(bound.backendName(), e);
        }
    }

    private synchronized BoundModel bindingFor(ModelBackend backend) {
        BoundModel binding = current;
        if (binding.backend() != backend || !binding.tools().equals(boundTools)) {
            binding = backend.bind(boundTools);
            current = binding;
            log.info("Rebound {} tools to backend [{}]", boundTools.size(), backend.name());
        }
        return binding;
    }
}
