package com.autonomous.gateway.provider;

import com.autonomous.gateway.model.EndpointConfig;
import com.autonomous.gateway.model.ProviderRequest;
import com.autonomous.gateway.model.ProviderResponse;
import com.autonomous.gateway.service.EndpointConfigLoaderService;
import com.autonomous.gateway.service.PricingService;
import com.autonomous.gateway.service.TokenEstimator;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;

/**
 * Sends prompts through a local model command-line client ({@code <cli> --print --model <model> <prompt>}).
 * Token counts are estimated from text length and priced with the endpoint's rates.
 */
@Slf4j
@Service
public class CliProviderAdapter implements ProviderAdapter {

    private static final Pattern RATE_LIMITED = Pattern.compile("(?i)rate.?limit|too many requests|overloaded");
    private static final Pattern AUTH_FAILURE = Pattern.compile("(?i)invalid api key|authentication|unauthorized|not logged in");

    @Value("${gateway.provider.cli.path:claude}")
    private String cliPath;

    @Value("${gateway.provider.cli.timeout-minutes:30}")
    private long processTimeoutMinutes;

    private final EndpointConfigLoaderService configLoader;
    private final PricingService pricing;
    private final ExecutorService executor = Executors.newCachedThreadPool();

    public CliProviderAdapter(EndpointConfigLoaderService configLoader, PricingService pricing) {
        this.configLoader = configLoader;
        this.pricing = pricing;
    }

    public void setCliPath(String cliPath) {
        this.cliPath = cliPath;
    }

    public void setProcessTimeoutMinutes(long minutes) {
        this.processTimeoutMinutes = minutes;
    }

    @Override
    public CompletableFuture<ProviderResponse> send(String endpointId, ProviderRequest request) {
        EndpointConfig config = configLoader.require(endpointId);
        AtomicReference<Process> running = new AtomicReference<>();
        AtomicBoolean cancelled = new AtomicBoolean();

        CompletableFuture<ProviderResponse> future =
            CompletableFuture.supplyAsync(() -> runCli(config, request, running, cancelled), executor);
        future.whenComplete((response, error) -> {
            if (future.isCancelled()) {
                cancelled.set(true);
                Process process = running.get();
                if (process != null) {
                    process.destroyForcibly();
                }
            }
        });
        return future;
    }

    private ProviderResponse runCli(EndpointConfig config, ProviderRequest request,
                                    AtomicReference<Process> running, AtomicBoolean cancelled) {
        String prompt = request.getSystemPrompt() != null
            ? "System: " + request.getSystemPrompt() + "\n\n" + request.getPrompt()
            : request.getPrompt();
        String model = request.getModel() != null ? request.getModel() : config.getModel();

        List<String> command = new ArrayList<>();
        command.add(cliPath);
        command.add("--print");
        if (model != null) {
            command.add("--model");
            command.add(model);
        }
        command.add(prompt);

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new ProviderException(ProviderException.Kind.FATAL, "Cannot start " + cliPath + ": " + e.getMessage(), e);
        }
        running.set(process);
        if (cancelled.get()) {
            process.destroyForcibly();
        }

        try {
            StringBuilder output = new StringBuilder();
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(process.getInputStream()))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    output.append(line).append("\n");
                }
            }

            boolean finished = process.waitFor(processTimeoutMinutes, TimeUnit.MINUTES);
            if (!finished) {
                process.destroyForcibly();
                throw new ProviderException(ProviderException.Kind.RETRYABLE,
                    "CLI timed out after " + processTimeoutMinutes + " minutes");
            }

            String text = output.toString().trim();
            if (process.exitValue() != 0) {
                throw classify(process.exitValue(), text);
            }

            long promptTokens = TokenEstimator.estimate(prompt);
            long completionTokens = TokenEstimator.estimate(text);
            return ProviderResponse.builder()
                .text(text)
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .costUsd(pricing.calculateCost(config, promptTokens, completionTokens))
                .build();
        } catch (IOException e) {
            throw new ProviderException(ProviderException.Kind.RETRYABLE, "Failed reading CLI output: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ProviderException(ProviderException.Kind.RETRYABLE, "Interrupted while waiting for CLI", e);
        }
    }

    ProviderException classify(int exitCode, String output) {
        String message = String.format("CLI exited with %d: %s", exitCode,
            output.length() > 500 ? output.substring(0, 500) : output);
        if (AUTH_FAILURE.matcher(output).find()) {
            return new ProviderException(ProviderException.Kind.FATAL, message);
        }
        if (RATE_LIMITED.matcher(output).find()) {
            return new ProviderException(ProviderException.Kind.RATE_LIMITED, message);
        }
        return new ProviderException(ProviderException.Kind.RETRYABLE, message);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
