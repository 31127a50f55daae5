package com.autonomous.gateway.service;

import com.autonomous.gateway.exception.TypeValidationExhaustedException;
import com.autonomous.gateway.model.EndpointConfig;
import com.autonomous.gateway.model.ProviderRequest;
import com.autonomous.gateway.model.TypedAttempt;
import com.autonomous.gateway.model.TypedResult;
import com.autonomous.gateway.model.ValidationOutcome;
import com.autonomous.gateway.shape.KeywordInterpreter;
import com.autonomous.gateway.shape.ResponseInterpreter;
import com.autonomous.gateway.shape.Shape;
import com.autonomous.gateway.shape.ShapeInterpreter;
import com.autonomous.gateway.shape.UnparseableResponseException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Asks an endpoint for a value of a given shape and retries with corrective feedback until the
 * answer parses and validates. Transport failures are handled by {@link CallEnvelopeService}
 * and propagate unchanged; only format and shape failures consume attempts here.
 */
@Slf4j
@Service
public class TypedInvocationService {

    private static final int MAX_ECHOED_RESPONSE_CHARS = 2000;

    private enum State {
        DRAFTING,
        PARSING,
        VALIDATING,
        SUCCEEDED,
        EXHAUSTED
    }

    private final CallEnvelopeService envelope;

    public TypedInvocationService(CallEnvelopeService envelope) {
        this.envelope = envelope;
    }

    public <T> T invokeTyped(EndpointConfig config, String prompt, Shape<T> shape, int maxAttempts, SpendingScope scope) {
        return invoke(config, prompt, new ShapeInterpreter<>(shape), maxAttempts, scope);
    }

    public boolean invokeForBoolean(EndpointConfig config, String prompt, String trueKeyword, String falseKeyword,
                                    int maxAttempts, SpendingScope scope) {
        return invoke(config, prompt, new KeywordInterpreter(trueKeyword, falseKeyword), maxAttempts, scope);
    }

    public <T> T invoke(EndpointConfig config, String prompt, ResponseInterpreter<T> interpreter, int maxAttempts,
                        SpendingScope scope) {
        return invokeWithHistory(config, prompt, interpreter, maxAttempts, scope).getValue();
    }

    /**
     * Like {@link #invoke} but also returns every attempt made, the valid one last.
     */
    public <T> TypedResult<T> invokeWithHistory(EndpointConfig config, String prompt, ResponseInterpreter<T> interpreter,
                                                int maxAttempts, SpendingScope scope) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        String basePrompt = prompt + "\n\n" + interpreter.formatInstructions();
        List<TypedAttempt> history = new ArrayList<>();
        List<String> corrections = new ArrayList<>();

        State state = State.DRAFTING;
        String attemptPrompt = null;
        String raw = null;
        JsonNode parsed = null;
        T value = null;

        while (true) {
            switch (state) {
                case DRAFTING -> {
                    if (history.size() >= maxAttempts) {
                        state = State.EXHAUSTED;
                    } else {
                        attemptPrompt = compose(basePrompt, corrections);
                        ProviderRequest request = ProviderRequest.builder()
                            .model(config.getModel())
                            .prompt(attemptPrompt)
                            .build();
                        raw = envelope.execute(config, request, null, config.getDefaultMaxAttempts(), scope).getText();
                        log.debug("Typed attempt {} on {} returned: {}", history.size() + 1, config.getEndpointId(),
                            truncate(raw, 1000));
                        state = State.PARSING;
                    }
                }
                case PARSING -> {
                    try {
                        parsed = interpreter.parse(raw);
                        state = State.VALIDATING;
                    } catch (UnparseableResponseException e) {
                        reject(history, corrections, attemptPrompt, raw, ValidationOutcome.PARSE_FAILED,
                            List.of(e.getMessage()), config);
                        state = State.DRAFTING;
                    }
                }
                case VALIDATING -> {
                    List<String> problems = interpreter.validate(parsed);
                    if (problems.isEmpty()) {
                        try {
                            value = interpreter.convert(parsed);
                        } catch (IllegalArgumentException e) {
                            problems = List.of("the value could not be converted: " + e.getMessage());
                        }
                    }
                    if (problems.isEmpty()) {
                        history.add(new TypedAttempt(history.size() + 1, attemptPrompt, raw, ValidationOutcome.VALID, List.of()));
                        state = State.SUCCEEDED;
                    } else {
                        reject(history, corrections, attemptPrompt, raw, ValidationOutcome.SHAPE_MISMATCH, problems, config);
                        state = State.DRAFTING;
                    }
                }
                case SUCCEEDED -> {
                    log.debug("Got {} from {} after {} attempt(s)", interpreter.expectation(), config.getEndpointId(),
                        history.size());
                    return new TypedResult<>(value, List.copyOf(history));
                }
                case EXHAUSTED -> throw new TypeValidationExhaustedException(
                    config.getEndpointId(), interpreter.expectation(), history);
            }
        }
    }

    private void reject(List<TypedAttempt> history, List<String> corrections, String attemptPrompt, String raw,
                        ValidationOutcome outcome, List<String> problems, EndpointConfig config) {
        int index = history.size() + 1;
        history.add(new TypedAttempt(index, attemptPrompt, raw, outcome, List.copyOf(problems)));
        log.warn("Typed attempt {} on {} rejected ({}): {}", index, config.getEndpointId(), outcome, problems);

        StringBuilder note = new StringBuilder();
        note.append("Your response to attempt ").append(index).append(" was rejected. It was:\n<<<\n")
            .append(truncate(raw, MAX_ECHOED_RESPONSE_CHARS)).append("\n>>>\nProblems:\n");
        problems.forEach(problem -> note.append("- ").append(problem).append('\n'));
        note.append("Answer again and fix these problems.");
        corrections.add(note.toString());
    }

    private String compose(String basePrompt, List<String> corrections) {
        if (corrections.isEmpty()) {
            return basePrompt;
        }
        return basePrompt + "\n\n" + String.join("\n\n", corrections);
    }

    private static String truncate(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() > max ? text.substring(0, max) + "..." : text;
    }
}
