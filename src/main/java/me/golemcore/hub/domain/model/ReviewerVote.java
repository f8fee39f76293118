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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReviewerVote {

    private String reviewerId;
    private VoteOutcome outcome;
    private String reason;

    @Builder.Default
    private double confidence = 1.0;

    private double weight;
    private long latencyMs;

    public static ReviewerVote approve(String reviewerId, String reason) {
        return ReviewerVote.builder().reviewerId(reviewerId).outcome(VoteOutcome.APPROVE).reason(reason).build();
    }

    public static ReviewerVote reject(String reviewerId, String reason) {
        return ReviewerVote.builder().reviewerId(reviewerId).outcome(VoteOutcome.REJECT).reason(reason).build();
    }

    public static ReviewerVote abstain(String reviewerId, String reason) {
        return ReviewerVote.builder()
                .reviewerId(reviewerId)
                .outcome(VoteOutcome.ABSTAIN)
                .reason(reason)
                .confidence(0.0)
                .build();
    }
}
