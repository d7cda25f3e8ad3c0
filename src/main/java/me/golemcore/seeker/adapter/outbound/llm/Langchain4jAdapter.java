/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.seeker.adapter.outbound.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.output.TokenUsage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.seeker.domain.model.LlmRequest;
import me.golemcore.seeker.domain.model.LlmResponse;
import me.golemcore.seeker.domain.model.LlmUsage;
import me.golemcore.seeker.domain.model.Message;
import me.golemcore.seeker.infrastructure.config.SeekerProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * LLM adapter using the langchain4j library.
 *
 * <p>
 * Supports OpenAI (and any OpenAI-compatible endpoint) and Anthropic chat
 * models. Models are addressed as {@code provider/model}; the planner and the
 * reader each use their own model and output token limit, so chat models are
 * created per (model, token limit) and cached.
 *
 * <p>
 * Rate limits are retried with exponential backoff, honouring a
 * {@code reset_seconds} hint in the error body when present.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 *
 * <p>
 * Configuration via {@code seeker.llm.providers.*}.
 *
 * @see LlmProviderAdapter
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmProviderAdapter {

    private static final int MAX_RETRIES = 5;
    private static final long INITIAL_BACKOFF_MS = 5_000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String PROVIDER_OPENAI = "openai";
    private static final List<String> RATE_LIMIT_MARKERS = List.of("rate_limit", "Too Many Requests", "429");
    private static final Pattern RESET_SECONDS_PATTERN = Pattern.compile("\"reset_seconds\"\\s*:\\s*(\\d+)");

    private final SeekerProperties properties;

    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();

    @Override
    public void initialize() {
        SeekerProperties.LlmProperties llm = properties.getLlm();
        try {
            modelFor(llm.getPlannerModel(), llm.getPlannerMaxTokens());
            modelFor(llm.getReaderModel(), llm.getReaderMaxTokens());
            log.info("Langchain4j adapter initialized with planner model: {}, reader model: {}",
                    llm.getPlannerModel(), llm.getReaderModel());
        } catch (Exception e) {
            log.warn("Failed to initialize Langchain4j adapter: {}", e.getMessage());
        }
    }

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        SeekerProperties.LlmProperties llm = properties.getLlm();
        String model = Objects.requireNonNullElse(request.getModel(), llm.getPlannerModel());
        int maxTokens = Objects.requireNonNullElse(request.getMaxTokens(), llm.getPlannerMaxTokens());
        return CompletableFuture.supplyAsync(() -> {
            ChatModel chatModel = modelFor(model, maxTokens);
            List<ChatMessage> messages = convertMessages(request);
            long started = System.nanoTime();
            ChatResponse response = chatWithBackoff(chatModel, messages, request);
            return convertResponse(response, model, Duration.ofNanos(System.nanoTime() - started));
        });
    }

    private ChatResponse chatWithBackoff(ChatModel chatModel, List<ChatMessage> messages, LlmRequest request) {
        int attempt = 0;
        while (true) {
            try {
                return chatModel.chat(messages);
            } catch (RuntimeException e) {
                if (!isRateLimitError(e) || attempt >= MAX_RETRIES) {
                    log.error("[LLM] {} failed for run {}", request.getStage(), request.getRunId(), e);
                    throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
                }
                long delayMs = backoffDelayMs(attempt, extractResetSeconds(e));
                attempt++;
                log.warn("[LLM] {} rate limited, retry {}/{} in {}ms", request.getStage(), attempt, MAX_RETRIES,
                        delayMs);
                pause(delayMs);
            }
        }
    }

    static long backoffDelayMs(int attempt, long resetSeconds) {
        long exponential = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
        if (resetSeconds <= 0) {
            return exponential;
        }
        return Math.max(TimeUnit.SECONDS.toMillis(resetSeconds + 1), exponential);
    }

    private static void pause(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("LLM chat interrupted during retry backoff", e);
        }
    }

    @Override
    public boolean isAvailable() {
        return properties.getLlm().getProviders().values().stream()
                .anyMatch(p -> p.getApiKey() != null && !p.getApiKey().isBlank());
    }

    ChatModel modelFor(String model, int maxTokens) {
        return models.computeIfAbsent(model + "|" + maxTokens, key -> createModel(model, maxTokens));
    }

    static String providerOf(String model) {
        return model.contains("/") ? model.substring(0, model.indexOf('/')).toLowerCase(Locale.ROOT)
                : PROVIDER_OPENAI;
    }

    static String stripProviderPrefix(String model) {
        return model.contains("/") ? model.substring(model.indexOf('/') + 1) : model;
    }

    /**
     * Reasoning models reject a custom temperature.
     */
    static boolean supportsTemperature(String modelName) {
        String name = modelName.toLowerCase(Locale.ROOT);
        return !(name.startsWith("o1") || name.startsWith("o3") || name.startsWith("o4")
                || name.startsWith("gpt-5"));
    }

    private SeekerProperties.ProviderProperties getProviderConfig(String providerName) {
        SeekerProperties.ProviderProperties config = properties.getLlm().getProviders().get(providerName);
        if (config == null || config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new IllegalStateException("Provider not configured: " + providerName
                    + ". Add seeker.llm.providers." + providerName + ".api-key");
        }
        return config;
    }

    private ChatModel createModel(String model, int maxTokens) {
        String provider = providerOf(model);
        SeekerProperties.ProviderProperties config = getProviderConfig(provider);
        String modelName = stripProviderPrefix(model);
        log.debug("[LLM] Creating {} model {} (max tokens {})", provider, modelName, maxTokens);

        if (PROVIDER_ANTHROPIC.equals(provider)) {
            return createAnthropicModel(modelName, maxTokens, config);
        }
        // All non-Anthropic providers use OpenAI-compatible API
        return createOpenAiModel(modelName, maxTokens, config);
    }

    private ChatModel createAnthropicModel(String modelName, int maxTokens,
            SeekerProperties.ProviderProperties config) {
        var builder = AnthropicChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0) // Retry handled by our backoff logic
                .maxTokens(maxTokens)
                .timeout(Duration.ofMillis(properties.getLlm().getTimeoutMs()));

        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        if (supportsTemperature(modelName)) {
            builder.temperature(properties.getLlm().getTemperature());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel(String modelName, int maxTokens, SeekerProperties.ProviderProperties config) {
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0) // Retry handled by our backoff logic
                .timeout(Duration.ofMillis(properties.getLlm().getTimeoutMs()));

        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        if (supportsTemperature(modelName)) {
            builder.temperature(properties.getLlm().getTemperature());
            builder.maxTokens(maxTokens);
        } else {
            builder.maxCompletionTokens(maxTokens);
        }
        return builder.build();
    }

    static boolean isRateLimitError(Throwable error) {
        for (Throwable cause : causeChain(error)) {
            if (cause instanceof RateLimitException) {
                return true;
            }
            String message = cause.getMessage();
            if (message != null && RATE_LIMIT_MARKERS.stream().anyMatch(message::contains)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Server-requested wait from a {@code reset_seconds} field anywhere in the
     * cause chain, or -1.
     */
    static long extractResetSeconds(Throwable error) {
        for (Throwable cause : causeChain(error)) {
            String message = cause.getMessage();
            if (message == null) {
                continue;
            }
            Matcher matcher = RESET_SECONDS_PATTERN.matcher(message);
            if (matcher.find()) {
                return Long.parseLong(matcher.group(1));
            }
        }
        return -1;
    }

    private static List<Throwable> causeChain(Throwable error) {
        List<Throwable> chain = new ArrayList<>();
        for (Throwable cause = error; cause != null && !chain.contains(cause); cause = cause.getCause()) {
            chain.add(cause);
        }
        return chain;
    }

    private static List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> converted = new ArrayList<>();
        String systemPrompt = request.getSystemPrompt();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            converted.add(SystemMessage.from(systemPrompt));
        }
        for (Message message : request.getMessages()) {
            converted.add(toChatMessage(message));
        }
        return converted;
    }

    private static ChatMessage toChatMessage(Message message) {
        String role = message.getRole() == null ? Message.ROLE_USER : message.getRole();
        return switch (role) {
        case Message.ROLE_ASSISTANT -> AiMessage.from(message.getContent());
        case Message.ROLE_SYSTEM -> SystemMessage.from(message.getContent());
        default -> UserMessage.from(message.getContent());
        };
    }

    private LlmResponse convertResponse(ChatResponse response, String model, Duration latency) {
        AiMessage aiMessage = response.aiMessage();
        LlmUsage usage = usageOf(response.tokenUsage());
        log.debug("[LLM] {} answered in {}ms ({} tokens)", model, latency.toMillis(),
                usage != null ? usage.totalTokens() : "?");
        return LlmResponse.builder()
                .content(aiMessage != null ? aiMessage.text() : null)
                .usage(usage)
                .model(model)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    static LlmUsage usageOf(TokenUsage tokenUsage) {
        if (tokenUsage == null) {
            return null;
        }
        int input = Objects.requireNonNullElse(tokenUsage.inputTokenCount(), 0);
        int output = Objects.requireNonNullElse(tokenUsage.outputTokenCount(), 0);
        return new LlmUsage(input, output, Objects.requireNonNullElse(tokenUsage.totalTokenCount(), input + output));
    }
}
