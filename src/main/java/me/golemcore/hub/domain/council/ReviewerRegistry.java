package me.golemcore.hub.domain.council;

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
import me.golemcore.hub.port.outbound.ReviewerAgent;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The configured set of council reviewers. Owned by the application context
 * and handed to the {@link CouncilCoordinator} by reference.
 */
@Slf4j
public class ReviewerRegistry {

    private final Map<String, ReviewerAgent> reviewers = new ConcurrentHashMap<>();

    public ReviewerRegistry(Collection<ReviewerAgent> initial) {
        initial.forEach(this::register);
    }

    public void register(ReviewerAgent reviewer) {
        ReviewerAgent previous = reviewers.put(reviewer.getId(), reviewer);
        if (previous != null) {
            log.warn("[Council] Reviewer '{}' replaced", reviewer.getId());
        }
    }

    /**
     * Reviewers sorted by id, so votes are reported in a stable order.
     */
    public List<ReviewerAgent> list() {
        List<ReviewerAgent> sorted = new ArrayList<>(reviewers.values());
        sorted.sort((a, b) -> a.getId().compareTo(b.getId()));
        return sorted;
    }
}
