package me.golemcore.hub.adapter.outbound.llm;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.hub.domain.exception.ModelInvocationException;
import me.golemcore.hub.domain.loop.ModelReplyParser;
import me.golemcore.hub.domain.model.ContextLayer;
import me.golemcore.hub.domain.model.ContextSnapshot;
import me.golemcore.hub.domain.model.LayerKind;
import me.golemcore.hub.domain.model.ModelReply;
import me.golemcore.hub.infrastructure.config.HubProperties;
import me.golemcore.hub.port.outbound.ModelPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;

/**
 * Model adapter using the langchain4j library.
 *
 * <p>
 * Supports Anthropic and any OpenAI-compatible endpoint
 * ({@code hub.model.provider} = {@code anthropic} or {@code openai}). Makes a
 * single attempt per call; timeouts and retries belong to the caller. Errors
 * are classified into transient (rate limit, timeout, server side) and fatal
 * (authentication, bad request) {@link ModelInvocationException}s.
 */
@Component
@ConditionalOnExpression("'${hub.model.provider:none}' != 'none'")
@Slf4j
public class Langchain4jModelAdapter implements ModelPort {

    private static final String PROVIDER_ANTHROPIC = "anthropic";

    private final HubProperties properties;
    private final ModelReplyParser replyParser;

    private volatile ChatModel chatModel;

    public Langchain4jModelAdapter(HubProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.replyParser = new ModelReplyParser(objectMapper);
    }

    @Override
    public String getProviderId() {
        return properties.getModel().getProvider();
    }

    @Override
    public CompletableFuture<ModelReply> complete(ContextSnapshot prompt) {
        StringBuilder system = new StringBuilder();
        StringBuilder user = new StringBuilder();
        for (ContextLayer layer : prompt.getLayers()) {
            if (layer.getContent() == null || layer.getContent().isBlank()) {
                continue;
            }
            boolean isStatic = layer.getKind() == LayerKind.SYSTEM || layer.getKind() == LayerKind.DEVELOPER;
            StringBuilder target = isStatic ? system : user;
            target.append("## ").append(layer.getKind()).append('\n').append(layer.getContent()).append("\n\n");
        }
        system.append(ModelReplyParser.INSTRUCTIONS);
        return chat(List.of(SystemMessage.from(system.toString().strip()), UserMessage.from(user.toString().strip())))
                .thenApply(replyParser::parse);
    }

    @Override
    public CompletableFuture<String> completeText(String systemPrompt, String userPrompt) {
        return chat(List.of(SystemMessage.from(systemPrompt), UserMessage.from(userPrompt)));
    }

    @Override
    public boolean isAvailable() {
        String apiKey = properties.getModel().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    private CompletableFuture<String> chat(List<ChatMessage> messages) {
        return CompletableFuture.supplyAsync(() -> {
            ChatModel model = model();
            try {
                ChatResponse response = model.chat(messages);
                String text = response.aiMessage().text();
                return text != null ? text : "";
            } catch (RuntimeException e) {
                boolean transientFailure = isTransient(e);
                log.warn("[LLM] Call failed ({}): {}", transientFailure ? "transient" : "fatal", e.getMessage());
                throw new ModelInvocationException(transientFailure, "Model call failed: " + e.getMessage(), e);
            }
        });
    }

    private ChatModel model() {
        ChatModel model = chatModel;
        if (model == null) {
            synchronized (this) {
                if (chatModel == null) {
                    if (!isAvailable()) {
                        throw new ModelInvocationException(false,
                                "Model provider " + getProviderId() + " has no api key (hub.model.api-key)", null);
                    }
                    chatModel = createModel();
                    log.info("[LLM] Initialized {} model {}", getProviderId(), properties.getModel().getModelName());
                }
                model = chatModel;
            }
        }
        return model;
    }

    private ChatModel createModel() {
        HubProperties.ModelProperties config = properties.getModel();
        Duration timeout = Duration.ofMillis(config.getTimeoutMs());
        if (PROVIDER_ANTHROPIC.equals(config.getProvider())) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(config.getModelName())
                    .maxRetries(0)
                    .timeout(timeout);
            if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
                builder.baseUrl(config.getBaseUrl());
            }
            if (config.getTemperature() != null) {
                builder.temperature(config.getTemperature());
            }
            return builder.build();
        }
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModelName())
                .maxRetries(0)
                .timeout(timeout);
        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        if (config.getTemperature() != null) {
            builder.temperature(config.getTemperature());
        }
        return builder.build();
    }

    static boolean isTransient(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof dev.langchain4j.exception.RateLimitException) {
                return true;
            }
            String msg = current.getMessage() != null ? current.getMessage().toLowerCase(Locale.ROOT) : "";
            if (msg.contains("401") || msg.contains("403") || msg.contains("invalid api key")
                    || msg.contains("authentication") || msg.contains("invalid_request")) {
                return false;
            }
            if (msg.contains("429") || msg.contains("rate_limit") || msg.contains("timeout")
                    || msg.contains("timed out") || msg.contains("overloaded") || msg.contains("503")
                    || msg.contains("502") || msg.contains("500")) {
                return true;
            }
            current = current.getCause();
        }
        return true;
    }
}
