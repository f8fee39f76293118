package me.golemcore.hub.domain.loop;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.hub.domain.exception.HubException;
import me.golemcore.hub.domain.exception.ModelInvocationException;
import me.golemcore.hub.domain.model.ContextSnapshot;
import me.golemcore.hub.domain.model.ModelReply;
import me.golemcore.hub.infrastructure.config.HubProperties;
import me.golemcore.hub.port.outbound.ModelPort;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Calls the model collaborator with an explicit timeout and turns every
 * failure into a {@link ModelInvocationException}. Retrying is left to the
 * loop controller, which treats transient model failures like transient tool
 * failures.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ModelInvoker {

    private final ModelPort modelPort;
    private final HubProperties properties;

    public ModelReply complete(ContextSnapshot prompt) {
        log.debug("[Loop] Requesting model completion ({} tokens)", prompt.getTotalTokens());
        return await(modelPort.complete(prompt), "completion");
    }

    public String completeText(String systemPrompt, String userPrompt) {
        return await(modelPort.completeText(systemPrompt, userPrompt), "text completion");
    }

    private <T> T await(CompletableFuture<T> future, String what) {
        long timeoutMs = properties.getAutonomy().getModelTimeoutMs();
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ModelInvocationException(true, "Model " + what + " timed out after " + timeoutMs + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelInvocationException(false, "Interrupted while waiting for model " + what, e);
        } catch (ExecutionException | CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof HubException hubException) {
                throw hubException;
            }
            throw new ModelInvocationException(true, "Model " + what + " failed: " + cause.getMessage(), cause);
        }
    }
}
