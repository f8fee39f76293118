package me.golemcore.hub.domain.context;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.hub.domain.broker.ToolServerBroker;
import me.golemcore.hub.domain.exception.ContextBudgetExceededException;
import me.golemcore.hub.domain.model.AgentSession;
import me.golemcore.hub.domain.model.AutonomyTask;
import me.golemcore.hub.domain.model.ContextLayer;
import me.golemcore.hub.domain.model.ContextSnapshot;
import me.golemcore.hub.domain.model.LayerKind;
import me.golemcore.hub.domain.model.MemoryItem;
import me.golemcore.hub.domain.model.ToolDescriptor;
import me.golemcore.hub.domain.model.Turn;
import me.golemcore.hub.domain.service.MemoryService;
import me.golemcore.hub.infrastructure.config.HubProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds one {@link ContextSnapshot} per turn within a token budget.
 *
 * <p>
 * Layers are filled greedily in {@link LayerKind} order. Each layer gets up to
 * its natural size, capped by what is left of the budget. An oversized layer
 * is cut from its least valuable end: oldest turns of the active conversation,
 * lowest-ranked memory items, earliest summary lines, the tail of static text.
 * The SYSTEM layer is never cut; if it alone exceeds the budget, composition
 * fails with {@link ContextBudgetExceededException}.
 *
 * <p>
 * Output depends only on session state, memory contents, connected tools and
 * the budget, so composing twice gives identical snapshots.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextComposer {

    private static final String SEPARATOR = "\n";

    private final HubProperties properties;
    private final MemoryService memoryService;
    private final ConversationSummarizer summarizer;
    private final ToolServerBroker broker;

    public ContextSnapshot compose(AgentSession session) {
        return compose(session, properties.getContext().getDefaultBudgetTokens());
    }

    public ContextSnapshot compose(AgentSession session, int budgetTokens) {
        if (budgetTokens <= 0) {
            throw new IllegalArgumentException("Budget must be positive: " + budgetTokens);
        }
        HubProperties.ContextProperties config = properties.getContext();

        String system = nullToEmpty(config.getSystemPrompt()).strip();
        int systemTokens = TokenEstimator.estimate(system);
        if (systemTokens > budgetTokens) {
            throw new ContextBudgetExceededException(systemTokens, budgetTokens);
        }

        List<ContextLayer> layers = new ArrayList<>();
        int remaining = budgetTokens - systemTokens;
        layers.add(layer(LayerKind.SYSTEM, "config:system-prompt", system, systemTokens, false));

        String developer = developerContent(config.getDeveloperPrompt());
        ContextLayer developerLayer = fitText(LayerKind.DEVELOPER, "config:developer-prompt+tools", developer,
                remaining, true);
        layers.add(developerLayer);
        remaining -= developerLayer.getTokens();

        ContextLayer metadataLayer = fitText(LayerKind.SESSION_METADATA, "session:" + session.getId(),
                metadataContent(session), remaining, true);
        layers.add(metadataLayer);
        remaining -= metadataLayer.getTokens();

        List<String> memoryIds = new ArrayList<>();
        ContextLayer memoryLayer = memoryLayer(session, remaining, memoryIds);
        layers.add(memoryLayer);
        remaining -= memoryLayer.getTokens();

        List<Turn> turns = session.copyTurns();
        int activeStart = Math.max(0, turns.size() - config.getActiveTurns());
        String summary = summarizer.summarize(turns.subList(0, activeStart), config.getSummaryMaxChars());
        ContextLayer summaryLayer = fitText(LayerKind.CONVERSATION_SUMMARY, "summarizer:turns[0.." + activeStart + ")",
                summary, remaining, false);
        layers.add(summaryLayer);
        remaining -= summaryLayer.getTokens();

        ContextLayer activeLayer = activeConversationLayer(turns.subList(activeStart, turns.size()), activeStart,
                remaining);
        layers.add(activeLayer);

        int total = layers.stream().mapToInt(ContextLayer::getTokens).sum();
        for (ContextLayer contextLayer : layers) {
            contextLayer.setPercentage(total > 0 ? contextLayer.getTokens() * 100.0 / total : 0.0);
        }
        log.debug("[Composer] Session {}: {} / {} tokens", session.getId(), total, budgetTokens);

        return ContextSnapshot.builder()
                .sessionId(session.getId())
                .layers(layers)
                .totalTokens(total)
                .budgetTokens(budgetTokens)
                .memoryItemIds(memoryIds)
                .build();
    }

    private String developerContent(String developerPrompt) {
        StringBuilder sb = new StringBuilder(nullToEmpty(developerPrompt).strip());
        List<ToolDescriptor> tools = broker.availableTools();
        if (!tools.isEmpty()) {
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            sb.append("Available tools:");
            for (ToolDescriptor tool : tools) {
                sb.append("\n- ").append(tool.getName()).append(" [").append(tool.getSideEffect()).append("]");
                if (tool.getDescription() != null && !tool.getDescription().isBlank()) {
                    sb.append(": ").append(tool.getDescription().strip());
                }
            }
        }
        return sb.toString();
    }

    private static String metadataContent(AgentSession session) {
        StringBuilder sb = new StringBuilder();
        sb.append("Session: ").append(session.getId());
        if (session.getTopic() != null && !session.getTopic().isBlank()) {
            sb.append("\nTopic: ").append(session.getTopic());
        }
        sb.append("\nAutonomy: ").append(session.getAutonomyLevel());
        AutonomyTask task = session.getCurrentTask();
        if (task != null) {
            sb.append("\nGoal: ").append(task.getGoal());
            if (task.getPlanSteps() != null && !task.getPlanSteps().isEmpty()) {
                sb.append("\nPlan:");
                for (int i = 0; i < task.getPlanSteps().size(); i++) {
                    sb.append("\n").append(i + 1).append(". ").append(task.getPlanSteps().get(i));
                }
            }
            sb.append("\nAttempt: ").append(task.getRetryCount() + 1)
                    .append(", step: ").append(task.getStepCount() + 1);
        }
        return sb.toString();
    }

    private ContextLayer memoryLayer(AgentSession session, int allowance, List<String> includedIds) {
        String query = memoryQuery(session);
        List<String> tags = session.getTopic() != null && !session.getTopic().isBlank()
                ? List.of(session.getTopic())
                : List.of();
        List<MemoryItem> ranked = query.isBlank() && tags.isEmpty()
                ? List.of()
                : memoryService.search(query, tags, properties.getContext().getMemoryLimit());

        List<String> lines = new ArrayList<>();
        for (MemoryItem item : ranked) {
            lines.add(memoryLine(item));
        }
        int natural = TokenEstimator.estimate(String.join(SEPARATOR, lines));
        // ranked best-first, so dropping from the end sheds the least relevant
        int kept = lines.size();
        while (kept > 0 && TokenEstimator.estimate(String.join(SEPARATOR, lines.subList(0, kept))) > allowance) {
            kept--;
        }
        for (int i = 0; i < kept; i++) {
            includedIds.add(ranked.get(i).getId());
        }
        String content = String.join(SEPARATOR, lines.subList(0, kept));
        if (kept == 0 && !lines.isEmpty() && allowance > 0) {
            // the best item alone overflows: keep its head rather than nothing
            String best = lines.get(0);
            content = best.substring(0, Math.min(best.length(), TokenEstimator.maxChars(allowance)));
            includedIds.add(ranked.get(0).getId());
        }
        if (kept < lines.size()) {
            log.debug("[Composer] Memory truncated: kept {} of {} item(s)", kept, lines.size());
        }
        return layer(LayerKind.MEMORY, "memory:search(" + query + ")", content, natural, kept < lines.size());
    }

    private static String memoryQuery(AgentSession session) {
        StringBuilder sb = new StringBuilder(nullToEmpty(session.getTopic()));
        if (session.getCurrentTask() != null && session.getCurrentTask().getGoal() != null) {
            sb.append(' ').append(session.getCurrentTask().getGoal());
        }
        return sb.toString().strip();
    }

    private static String memoryLine(MemoryItem item) {
        StringBuilder sb = new StringBuilder("- [").append(item.getId()).append("] ").append(item.getContent());
        if (item.getTags() != null && !item.getTags().isEmpty()) {
            sb.append(" #").append(String.join(" #", item.getTags()));
        }
        return sb.toString();
    }

    private static ContextLayer activeConversationLayer(List<Turn> turns, int offset, int allowance) {
        List<String> lines = new ArrayList<>();
        for (Turn turn : turns) {
            lines.add(turn.getRole() + ": " + nullToEmpty(turn.getContent()));
        }
        int natural = TokenEstimator.estimate(String.join(SEPARATOR, lines));
        int first = 0;
        while (first < lines.size()
                && TokenEstimator.estimate(String.join(SEPARATOR, lines.subList(first, lines.size()))) > allowance) {
            first++;
        }
        String content = String.join(SEPARATOR, lines.subList(first, lines.size()));
        boolean truncated = first > 0;
        if (first == lines.size() && !lines.isEmpty() && allowance > 0) {
            // not even the newest turn fits: keep its tail
            content = tail(lines.get(lines.size() - 1), TokenEstimator.maxChars(allowance));
            first = lines.size() - 1;
        }
        String source = "session:turns[" + (offset + first) + ".." + (offset + turns.size()) + ")";
        return layer(LayerKind.ACTIVE_CONVERSATION, source, content, natural, truncated);
    }

    /**
     * Cuts plain text to the allowance, keeping the head (static text) or the
     * tail (summaries, where the newest lines matter most).
     */
    private static ContextLayer fitText(LayerKind kind, String source, String text, int allowance, boolean keepHead) {
        int natural = TokenEstimator.estimate(text);
        if (natural <= allowance) {
            return layer(kind, source, text, natural, false);
        }
        int maxChars = TokenEstimator.maxChars(allowance);
        String cut = keepHead ? text.substring(0, Math.min(text.length(), maxChars)) : tail(text, maxChars);
        log.debug("[Composer] {} truncated from {} to {} tokens", kind, natural, TokenEstimator.estimate(cut));
        return layer(kind, source, cut, natural, true);
    }

    private static String tail(String text, int maxChars) {
        return text.length() <= maxChars ? text : text.substring(text.length() - maxChars);
    }

    private static ContextLayer layer(LayerKind kind, String source, String content, int naturalTokens,
            boolean truncated) {
        return ContextLayer.builder()
                .kind(kind)
                .source(source)
                .content(content)
                .tokens(TokenEstimator.estimate(content))
                .naturalTokens(naturalTokens)
                .truncated(truncated)
                .build();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
