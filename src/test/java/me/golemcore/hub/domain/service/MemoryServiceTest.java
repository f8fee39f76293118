package me.golemcore.hub.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.hub.domain.exception.SnapshotConflictException;
import me.golemcore.hub.domain.model.MemoryItem;
import me.golemcore.hub.domain.model.MemoryScoredItem;
import me.golemcore.hub.infrastructure.config.AutoConfiguration;
import me.golemcore.hub.infrastructure.config.HubProperties;
import me.golemcore.hub.testsupport.InMemoryStoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MemoryServiceTest {

    private final ObjectMapper objectMapper = AutoConfiguration.objectMapper();
    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    private InMemoryStoragePort storage;
    private MemoryReferenceTracker tracker;
    private MemoryService memoryService;

    @BeforeEach
    void setUp() {
        storage = new InMemoryStoragePort();
        tracker = new MemoryReferenceTracker();
        memoryService = newService();
    }

    @Test
    void shouldRankExactTagMatchAboveStrongLexicalMatch() {
        String lexical = memoryService.remember("kubernetes deploy pipeline uses blue green rollout", List.of());
        String tagged = memoryService.remember("ask ops before friday", List.of("Deploy"));

        List<MemoryItem> result = memoryService.search("kubernetes deploy pipeline rollout", List.of("deploy"), 10);

        assertEquals(List.of(tagged, lexical), result.stream().map(MemoryItem::getId).toList());
    }

    @Test
    void shouldScorePartialTagBelowExactTag() {
        String partial = memoryService.remember("prod cluster is eu-west", List.of("deploy-prod"));
        String exact = memoryService.remember("staging cluster is us-east", List.of("deploy"));

        List<MemoryScoredItem> result = memoryService.scoredSearch(null, List.of("deploy"), 10);

        assertEquals(exact, result.get(0).getItem().getId());
        assertEquals(1.0, result.get(0).getScore(), 1e-9);
        assertEquals(partial, result.get(1).getItem().getId());
        assertEquals(0.5, result.get(1).getScore(), 1e-9);
    }

    @Test
    void shouldBreakTiesByRecencyDeterministically() {
        String older = memoryService.remember("release checklist", List.of("release"));
        String newer = memoryService.remember("release rollback steps", List.of("release"));

        List<MemoryItem> first = memoryService.search(null, List.of("release"), 10);
        List<MemoryItem> second = memoryService.search(null, List.of("release"), 10);

        assertEquals(List.of(newer, older), first.stream().map(MemoryItem::getId).toList());
        assertEquals(first, second);
    }

    @Test
    void shouldNormalizeTagsAndRejectBlankContent() {
        String id = memoryService.remember("fact", List.of(" Infra ", "infra", "DB"));

        assertEquals(List.of("infra", "db"), memoryService.get(id).orElseThrow().getTags());
        assertThrows(IllegalArgumentException.class, () -> memoryService.remember("  ", List.of()));
    }

    @Test
    void shouldExcludeForgottenItemsAndPersistTombstones() {
        String kept = memoryService.remember("keep me", List.of("x"));
        String forgotten = memoryService.remember("forget me", List.of("x"));

        memoryService.forget(forgotten);

        assertEquals(List.of(kept), memoryService.search(null, List.of("x"), 10).stream()
                .map(MemoryItem::getId).toList());
        MemoryService reloaded = newService();
        assertTrue(reloaded.isForgotten(forgotten));
        assertTrue(reloaded.exists(forgotten));
        String next = reloaded.remember("after restart", List.of());
        assertEquals("mem-000003", next);
    }

    @Test
    void shouldRefuseToForgetItemPinnedByLiveSnapshotUntilArchived() {
        String id = memoryService.remember("pinned fact", List.of("ops"));
        tracker.pin("s1", 1, List.of(id));

        assertThrows(SnapshotConflictException.class, () -> memoryService.forget(id));

        tracker.releaseSession("s1");
        memoryService.forget(id);
        assertTrue(memoryService.isForgotten(id));
    }

    @Test
    void shouldFailToForgetUnknownItem() {
        assertThrows(NoSuchElementException.class, () -> memoryService.forget("mem-999999"));
    }

    @Test
    void shouldReturnRecentItemsWhenNoQueryOrTags() {
        memoryService.remember("one", List.of());
        memoryService.remember("two", List.of());
        String three = memoryService.remember("three", List.of());

        List<MemoryItem> result = memoryService.search(null, null, 2);

        assertEquals(2, result.size());
        assertEquals(three, result.get(0).getId());
    }

    private MemoryService newService() {
        MemoryService service = new MemoryService(storage, objectMapper, tracker, new HubProperties(), clock);
        service.load();
        return service;
    }
}
