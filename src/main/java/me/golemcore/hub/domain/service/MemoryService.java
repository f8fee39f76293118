package me.golemcore.hub.domain.service;

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
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.hub.domain.exception.SnapshotConflictException;
import me.golemcore.hub.domain.model.MemoryItem;
import me.golemcore.hub.domain.model.MemoryScoredItem;
import me.golemcore.hub.infrastructure.config.HubProperties;
import me.golemcore.hub.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Durable store of immutable memory items.
 *
 * <p>
 * Items are appended to {@code memory/items.jsonl} and never rewritten;
 * {@link #forget(String)} appends a tombstone to
 * {@code memory/tombstones.jsonl} instead of deleting, so ids referenced by
 * snapshot records always remain resolvable.
 *
 * <p>
 * Ranking for {@link #search(String, List, int)}: items with more exact tag
 * matches always rank first; then the combined score of partial tag matches
 * (0.5 each) and lexical overlap with the query (weight 0.4); ties go to the
 * newer item, then the higher sequence. No wall-clock input, so the order is
 * stable between writes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryService {

    static final String DIRECTORY = "memory";
    static final String ITEMS_FILE = "items.jsonl";
    static final String TOMBSTONES_FILE = "tombstones.jsonl";

    private static final double EXACT_TAG_WEIGHT = 1.0;
    private static final double PARTIAL_TAG_WEIGHT = 0.5;
    private static final double LEXICAL_WEIGHT = 0.4;

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final MemoryReferenceTracker referenceTracker;
    private final HubProperties properties;
    private final Clock clock;

    private final Map<String, MemoryItem> items = new ConcurrentHashMap<>();
    private final Set<String> tombstones = ConcurrentHashMap.newKeySet();
    private final AtomicLong sequence = new AtomicLong();

    @PostConstruct
    public void load() {
        for (String line : readLines(ITEMS_FILE)) {
            try {
                MemoryItem item = objectMapper.readValue(line, MemoryItem.class);
                items.put(item.getId(), item);
                sequence.accumulateAndGet(item.getSequence(), Math::max);
            } catch (JsonProcessingException e) {
                log.warn("[Memory] Skipping unreadable item line: {}", e.getOriginalMessage());
            }
        }
        for (String line : readLines(TOMBSTONES_FILE)) {
            tombstones.add(line.trim());
        }
        log.info("[Memory] Loaded {} item(s), {} forgotten", items.size(), tombstones.size());
    }

    /**
     * Stores a new item and returns its id. Blank content is rejected.
     */
    public String remember(String content, List<String> tags) {
        return remember(content, tags, null);
    }

    public String remember(String content, List<String> tags, String source) {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Memory content must not be blank");
        }
        long seq = sequence.incrementAndGet();
        MemoryItem item = MemoryItem.builder()
                .id(String.format(Locale.ROOT, "mem-%06d", seq))
                .content(content.trim())
                .tags(normalizeTags(tags))
                .source(source)
                .createdAt(clock.instant())
                .sequence(seq)
                .build();
        try {
            String line = objectMapper.writeValueAsString(item) + "\n";
            storagePort.appendText(DIRECTORY, ITEMS_FILE, line).join();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize memory item " + item.getId(), e);
        }
        items.put(item.getId(), item);
        log.debug("[Memory] Remembered {} tags={}", item.getId(), item.getTags());
        return item.getId();
    }

    /**
     * Returns the item, including forgotten ones, which stay resolvable for
     * the snapshots that reference them.
     */
    public Optional<MemoryItem> get(String id) {
        return Optional.ofNullable(items.get(id));
    }

    public boolean exists(String id) {
        return items.containsKey(id);
    }

    public boolean isForgotten(String id) {
        return tombstones.contains(id);
    }

    public List<MemoryItem> search(String query, List<String> tags, int limit) {
        return scoredSearch(query, tags, limit).stream().map(MemoryScoredItem::getItem).toList();
    }

    /**
     * Ranked search over live (not forgotten) items. With neither query nor
     * tags, returns the most recent items.
     */
    public List<MemoryScoredItem> scoredSearch(String query, List<String> tags, int limit) {
        int effectiveLimit = limit > 0 ? limit : properties.getMemory().getDefaultSearchLimit();
        List<String> requestedTags = normalizeTags(tags);
        Set<String> queryTokens = tokenize(query);
        boolean unfiltered = requestedTags.isEmpty() && queryTokens.isEmpty();

        List<MemoryScoredItem> scored = new ArrayList<>();
        for (MemoryItem item : items.values()) {
            if (tombstones.contains(item.getId())) {
                continue;
            }
            int exact = 0;
            int partial = 0;
            for (String tag : requestedTags) {
                if (item.getTags().contains(tag)) {
                    exact++;
                } else if (hasPartialTag(item.getTags(), tag)) {
                    partial++;
                }
            }
            double score = exact * EXACT_TAG_WEIGHT + partial * PARTIAL_TAG_WEIGHT
                    + lexicalRelevance(queryTokens, item) * LEXICAL_WEIGHT;
            if (score > 0 || unfiltered) {
                scored.add(MemoryScoredItem.builder().item(item).score(score).exactTagMatches(exact).build());
            }
        }

        scored.sort(Comparator.comparingInt(MemoryScoredItem::getExactTagMatches).reversed()
                .thenComparing(Comparator.comparingDouble(MemoryScoredItem::getScore).reversed())
                .thenComparing((MemoryScoredItem s) -> s.getItem().getCreatedAt(),
                        Comparator.nullsLast(Comparator.reverseOrder()))
                .thenComparing(Comparator.comparingLong((MemoryScoredItem s) -> s.getItem().getSequence())
                        .reversed()));
        return scored.size() > effectiveLimit ? List.copyOf(scored.subList(0, effectiveLimit)) : scored;
    }

    /**
     * Tombstones an item. Fails with {@link SnapshotConflictException} while a
     * live snapshot of a non-archived session references it.
     */
    public void forget(String id) {
        if (!items.containsKey(id)) {
            throw new NoSuchElementException("Unknown memory item: " + id);
        }
        Set<String> sessions = referenceTracker.referencingSessions(id);
        if (!sessions.isEmpty()) {
            throw new SnapshotConflictException(
                    "Memory item " + id + " is referenced by snapshots of session(s) " + sessions);
        }
        if (tombstones.contains(id)) {
            return;
        }
        storagePort.appendText(DIRECTORY, TOMBSTONES_FILE, id + "\n").join();
        tombstones.add(id);
        log.info("[Memory] Forgot {}", id);
    }

    private List<String> readLines(String file) {
        String content = storagePort.getText(DIRECTORY, file).join();
        List<String> lines = new ArrayList<>();
        if (content == null || content.isBlank()) {
            return lines;
        }
        for (String line : content.split("\\R")) {
            if (!line.isBlank()) {
                lines.add(line);
            }
        }
        return lines;
    }

    private static boolean hasPartialTag(List<String> itemTags, String requested) {
        for (String tag : itemTags) {
            if (tag.contains(requested) || requested.startsWith(tag)) {
                return true;
            }
        }
        return false;
    }

    private static double lexicalRelevance(Set<String> queryTokens, MemoryItem item) {
        if (queryTokens.isEmpty()) {
            return 0.0;
        }
        Set<String> contentTokens = tokenize(item.getContent() + " " + String.join(" ", item.getTags()));
        int matches = 0;
        for (String token : queryTokens) {
            if (contentTokens.contains(token)) {
                matches++;
            }
        }
        return (double) matches / queryTokens.size();
    }

    static Set<String> tokenize(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z0-9_./#-]+")) {
            if (token.length() >= 3) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private static List<String> normalizeTags(List<String> tags) {
        if (tags == null) {
            return new ArrayList<>();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String tag : tags) {
            if (tag != null && !tag.isBlank()) {
                normalized.add(tag.trim().toLowerCase(Locale.ROOT));
            }
        }
        return new ArrayList<>(normalized);
    }
}
