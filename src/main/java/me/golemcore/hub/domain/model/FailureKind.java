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
 * Machine-readable failure kinds attached to every terminal task failure and
 * to every {@link me.golemcore.hub.domain.exception.HubException}.
 */
public enum FailureKind {

    CONNECTION_ERROR(true),

    CAPABILITY_MISMATCH(false),

    TOOL_INVOCATION_TRANSIENT(true),

    TOOL_INVOCATION_FATAL(false),

    CONTEXT_BUDGET_EXCEEDED(false),

    SNAPSHOT_NOT_FOUND(false),

    INVALID_SNAPSHOT(false),

    SNAPSHOT_CONFLICT(false),

    /**
     * Every council reviewer timed out; the proposal was rejected fail-closed.
     */
    COUNCIL_TIMEOUT(false),

    /**
     * At least one council reviewer explicitly rejected the proposal.
     */
    COUNCIL_REJECTED(false),

    AUTONOMY_ABORTED(false),

    MODEL_ERROR(true),

    MODEL_FATAL(false),

    VERIFICATION_FAILED(true),

    STEP_LIMIT_REACHED(false),

    /**
     * Unexpected error inside the hub itself.
     */
    INTERNAL_ERROR(false);

    private final boolean retryable;

    FailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
