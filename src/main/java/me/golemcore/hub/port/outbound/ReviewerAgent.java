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

import me.golemcore.hub.domain.model.CouncilProposal;
import me.golemcore.hub.domain.model.ReviewerVote;

import java.util.concurrent.CompletableFuture;

/**
 * A council reviewer reachable as an external collaborator. Implementations
 * never block the caller; the coordinator applies the timeout.
 */
public interface ReviewerAgent {

    String getId();

    /**
     * Relative weight of this reviewer in the weighted consensus statistic.
     */
    default double getWeight() {
        return 1.0;
    }

    CompletableFuture<ReviewerVote> review(CouncilProposal proposal);
}
