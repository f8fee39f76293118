package me.golemcore.hub.adapter.outbound.council;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.hub.domain.model.ReviewerVote;
import me.golemcore.hub.domain.model.VoteOutcome;

import java.util.Locale;

/**
 * Reads a reviewer's answer. Accepts {@code {"vote":"approve|reject|abstain",
 * "reason":"...","confidence":0.9}} or free text starting with APPROVE, REJECT
 * or ABSTAIN. Anything else is an abstention.
 */
class ReviewerVoteParser {

    private final ObjectMapper objectMapper;

    ReviewerVoteParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    ReviewerVote parse(String reviewerId, String raw) {
        String text = raw != null ? raw.strip() : "";
        if (text.startsWith("{")) {
            try {
                JsonNode node = objectMapper.readTree(text);
                VoteOutcome outcome = outcome(node.path("vote").asText(""));
                if (outcome != null) {
                    return ReviewerVote.builder()
                            .reviewerId(reviewerId)
                            .outcome(outcome)
                            .reason(node.path("reason").asText(""))
                            .confidence(outcome == VoteOutcome.ABSTAIN ? 0.0 : node.path("confidence").asDouble(1.0))
                            .build();
                }
            } catch (JsonProcessingException e) {
                return ReviewerVote.abstain(reviewerId, "unreadable vote: " + e.getOriginalMessage());
            }
        }
        String firstWord = text.split("[\\s:.,]+", 2)[0];
        VoteOutcome outcome = outcome(firstWord);
        if (outcome == null) {
            return ReviewerVote.abstain(reviewerId, "no clear vote");
        }
        String reason = text.substring(firstWord.length()).replaceFirst("^[\\s:.,-]+", "");
        return ReviewerVote.builder().reviewerId(reviewerId).outcome(outcome).reason(reason)
                .confidence(outcome == VoteOutcome.ABSTAIN ? 0.0 : 1.0).build();
    }

    private static VoteOutcome outcome(String word) {
        switch (word.toLowerCase(Locale.ROOT)) {
        case "approve":
        case "approved":
            return VoteOutcome.APPROVE;
        case "reject":
        case "rejected":
            return VoteOutcome.REJECT;
        case "abstain":
            return VoteOutcome.ABSTAIN;
        default:
            return null;
        }
    }
}
