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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.hub.domain.exception.ModelInvocationException;
import me.golemcore.hub.domain.model.ContextSnapshot;
import me.golemcore.hub.domain.model.ModelReply;
import me.golemcore.hub.port.outbound.ModelPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Model port used when no provider is configured. Every call fails with a
 * fatal {@link ModelInvocationException}, so tasks end with a clear reason.
 */
@Component
@ConditionalOnProperty(prefix = "hub.model", name = "provider", havingValue = "none", matchIfMissing = true)
@Slf4j
public class NoOpModelAdapter implements ModelPort {

    private static final String REASON = "No model provider configured (hub.model.provider=none)";

    @Override
    public String getProviderId() {
        return "none";
    }

    @Override
    public CompletableFuture<ModelReply> complete(ContextSnapshot prompt) {
        log.debug("[LLM] Rejecting completion for session {}: no provider", prompt.getSessionId());
        return CompletableFuture.failedFuture(new ModelInvocationException(false, REASON, null));
    }

    @Override
    public CompletableFuture<String> completeText(String systemPrompt, String userPrompt) {
        return CompletableFuture.failedFuture(new ModelInvocationException(false, REASON, null));
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
