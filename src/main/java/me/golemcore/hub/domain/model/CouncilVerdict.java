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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CouncilVerdict {

    private String proposalId;

    @Builder.Default
    private List<ReviewerVote> votes = new ArrayList<>();

    private boolean approved;

    /**
     * Approvals divided by responding reviewers.
     */
    private double consensus;

    /**
     * Weight- and confidence-adjusted approval ratio among respondents.
     */
    private double weightedConsensus;

    @Builder.Default
    private List<String> dissent = new ArrayList<>();

    private String reasoning;

    /**
     * Set when every reviewer abstained; the verdict is then a fail-closed
     * rejection.
     */
    private boolean timedOut;

    private Instant decidedAt;
}
