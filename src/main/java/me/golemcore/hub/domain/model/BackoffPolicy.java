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

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Exponential backoff schedule shared by connection reconnects and task
 * retries: {@code initial * multiplier^(attempt-1)}, capped at {@code max}.
 */
@Value
@Builder
public class BackoffPolicy {

    @Builder.Default
    Duration initialDelay = Duration.ofSeconds(1);

    @Builder.Default
    Duration maxDelay = Duration.ofSeconds(30);

    @Builder.Default
    double multiplier = 2.0;

    @Builder.Default
    int maxAttempts = 5;

    /**
     * Delay before the given attempt (1-based).
     */
    public Duration delayFor(int attempt) {
        int exponent = Math.max(0, attempt - 1);
        double millis = initialDelay.toMillis() * Math.pow(multiplier, exponent);
        long capped = (long) Math.min(millis, maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }

    public boolean isExhausted(int attempt) {
        return attempt > maxAttempts;
    }
}
