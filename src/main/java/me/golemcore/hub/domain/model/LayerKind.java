package me.golemcore.hub.domain.model;

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

/**
 * Context layer kinds in their fixed composition order. The declaration order
 * is the order layers appear in every {@link ContextSnapshot} and the priority
 * in which the token budget is allocated.
 */
public enum LayerKind {
    SYSTEM, DEVELOPER, SESSION_METADATA, MEMORY, CONVERSATION_SUMMARY, ACTIVE_CONVERSATION
}
