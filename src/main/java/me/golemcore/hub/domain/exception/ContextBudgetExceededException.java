package me.golemcore.hub.domain.exception;

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

import me.golemcore.hub.domain.model.FailureKind;

/**
 * The SYSTEM layer alone does not fit the requested budget. Signals a
 * misconfiguration and is never retried.
 */
public class ContextBudgetExceededException extends HubException {

    private static final long serialVersionUID = 1L;

    public ContextBudgetExceededException(int systemTokens, int budgetTokens) {
        super(FailureKind.CONTEXT_BUDGET_EXCEEDED,
                "System layer needs " + systemTokens + " tokens but budget is " + budgetTokens);
    }
}
