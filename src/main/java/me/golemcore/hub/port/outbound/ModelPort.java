package me.golemcore.hub.port.outbound;

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

import me.golemcore.hub.domain.model.ContextSnapshot;
import me.golemcore.hub.domain.model.ModelReply;

import java.util.concurrent.CompletableFuture;

/**
 * Port to the external model-inference collaborator. The hub treats it as an
 * opaque call; timeout and retry are applied by the caller.
 */
public interface ModelPort {

    /**
     * Returns the provider identifier (e.g., "openai", "anthropic").
     */
    String getProviderId();

    /**
     * Completes a composed prompt with either a proposed action or a text
     * response.
     */
    CompletableFuture<ModelReply> complete(ContextSnapshot prompt);

    /**
     * Free-form completion used by reviewer agents and prompt actions.
     */
    CompletableFuture<String> completeText(String systemPrompt, String userPrompt);

    /**
     * Checks if the provider is configured and operational.
     */
    boolean isAvailable();
}
