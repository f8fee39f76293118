package me.golemcore.hub.domain.context;

import me.golemcore.hub.domain.broker.ToolServerBroker;
import me.golemcore.hub.domain.exception.ContextBudgetExceededException;
import me.golemcore.hub.domain.model.AgentSession;
import me.golemcore.hub.domain.model.AutonomyLevel;
import me.golemcore.hub.domain.model.ContextLayer;
import me.golemcore.hub.domain.model.ContextSnapshot;
import me.golemcore.hub.domain.model.LayerKind;
import me.golemcore.hub.domain.model.MemoryItem;
import me.golemcore.hub.domain.model.RiskClass;
import me.golemcore.hub.domain.model.ToolDescriptor;
import me.golemcore.hub.domain.model.Turn;
import me.golemcore.hub.domain.service.MemoryService;
import me.golemcore.hub.infrastructure.config.HubProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ContextComposerTest {

    private static final String SYSTEM_PROMPT = "s".repeat(400);
    private static final String TOPIC = "deploy";

    private HubProperties properties;
    private MemoryService memoryService;
    private ToolServerBroker broker;
    private ContextComposer composer;

    @BeforeEach
    void setUp() {
        properties = new HubProperties();
        properties.getContext().setSystemPrompt(SYSTEM_PROMPT);
        properties.getContext().setDeveloperPrompt("");
        memoryService = mock(MemoryService.class);
        broker = mock(ToolServerBroker.class);
        when(broker.availableTools()).thenReturn(List.of());
        when(memoryService.search(anyString(), anyList(), anyInt())).thenReturn(List.of());
        composer = new ContextComposer(properties, memoryService, new RollingConversationSummarizer(), broker);
    }

    @Test
    void shouldTruncateMemoryToFitBudgetAndLeaveSystemUntouched() {
        List<MemoryItem> memories = memories(10, 360);
        when(memoryService.search(anyString(), anyList(), anyInt())).thenReturn(memories);
        AgentSession session = session(turns(2, 400));

        ContextSnapshot snapshot = composer.compose(session, 1000);

        ContextLayer system = snapshot.getLayer(LayerKind.SYSTEM).orElseThrow();
        ContextLayer memory = snapshot.getLayer(LayerKind.MEMORY).orElseThrow();
        assertEquals(100, system.getTokens());
        assertEquals(SYSTEM_PROMPT, system.getContent());
        assertFalse(system.isTruncated());
        assertTrue(memory.getNaturalTokens() >= 950);
        assertTrue(memory.isTruncated());
        assertTrue(memory.getTokens() < memory.getNaturalTokens());
        assertTrue(snapshot.getTotalTokens() <= 1000);
        assertEquals(100.0, snapshot.percentageSum(), 0.5);
        assertEquals(snapshot.getMemoryItemIds().size(), memory.getContent().split("\n").length);
    }

    @Test
    void shouldKeepHeadOfSingleMemoryItemThatOverflowsAllowance() {
        when(memoryService.search(anyString(), anyList(), anyInt())).thenReturn(memories(1, 3800));
        AgentSession session = session(List.of());

        ContextSnapshot snapshot = composer.compose(session, 1000);

        ContextLayer memory = snapshot.getLayer(LayerKind.MEMORY).orElseThrow();
        assertFalse(memory.getContent().isEmpty());
        assertTrue(memory.getContent().startsWith("- [mem-000001] mmm"));
        assertTrue(memory.isTruncated());
        assertTrue(memory.getTokens() < memory.getNaturalTokens());
        assertEquals(List.of("mem-000001"), snapshot.getMemoryItemIds());
        assertTrue(snapshot.getTotalTokens() <= 1000);
    }

    @Test
    void shouldKeepLayerOrderAndPercentagesForFittingContext() {
        properties.getContext().setDeveloperPrompt("Prefer small, reversible steps.");
        when(broker.availableTools()).thenReturn(List.of(ToolDescriptor.builder()
                .name("read_file").description("Read a file").sideEffect(RiskClass.SAFE).build()));
        AgentSession session = session(turns(3, 40));

        ContextSnapshot snapshot = composer.compose(session, 4000);

        List<LayerKind> kinds = snapshot.getLayers().stream().map(ContextLayer::getKind).toList();
        assertEquals(List.of(LayerKind.values()), kinds);
        assertTrue(snapshot.getLayer(LayerKind.DEVELOPER).orElseThrow().getContent().contains("read_file [SAFE]"));
        assertTrue(snapshot.getLayers().stream().noneMatch(ContextLayer::isTruncated));
        assertEquals(100.0, snapshot.percentageSum(), 0.5);
        int layerSum = snapshot.getLayers().stream().mapToInt(ContextLayer::getTokens).sum();
        assertEquals(snapshot.getTotalTokens(), layerSum);
    }

    @Test
    void shouldComposeIdenticalSnapshotsForIdenticalState() {
        when(memoryService.search(anyString(), anyList(), anyInt())).thenReturn(memories(4, 100));
        AgentSession session = session(turns(20, 120));

        ContextSnapshot first = composer.compose(session, 800);
        ContextSnapshot second = composer.compose(session, 800);

        assertEquals(first, second);
    }

    @Test
    void shouldSummarizeTurnsOutsideActiveWindow() {
        properties.getContext().setActiveTurns(2);
        AgentSession session = session(turns(5, 30));

        ContextSnapshot snapshot = composer.compose(session, 4000);

        String summary = snapshot.getLayer(LayerKind.CONVERSATION_SUMMARY).orElseThrow().getContent();
        String active = snapshot.getLayer(LayerKind.ACTIVE_CONVERSATION).orElseThrow().getContent();
        assertEquals(3, summary.split("\n").length);
        assertEquals(2, active.split("\n").length);
        assertTrue(active.startsWith("assistant: turn-3"));
    }

    @Test
    void shouldDropOldestActiveTurnsFirst() {
        AgentSession session = session(turns(6, 200));

        ContextSnapshot snapshot = composer.compose(session, 300);

        ContextLayer active = snapshot.getLayer(LayerKind.ACTIVE_CONVERSATION).orElseThrow();
        assertTrue(active.isTruncated());
        assertTrue(active.getContent().endsWith("turn-5 " + "x".repeat(200 - "turn-5 ".length())));
        assertTrue(snapshot.getTotalTokens() <= 300);
    }

    @Test
    void shouldFailWhenSystemLayerExceedsBudget() {
        AgentSession session = session(turns(1, 10));

        assertThrows(ContextBudgetExceededException.class, () -> composer.compose(session, 50));
    }

    @Test
    void shouldRejectNonPositiveBudget() {
        AgentSession session = session(List.of());

        assertThrows(IllegalArgumentException.class, () -> composer.compose(session, 0));
    }

    private static AgentSession session(List<Turn> turns) {
        return AgentSession.builder()
                .id("s1")
                .topic(TOPIC)
                .autonomyLevel(AutonomyLevel.MEDIUM)
                .turns(new ArrayList<>(turns))
                .build();
    }

    private static List<Turn> turns(int count, int chars) {
        List<Turn> turns = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            String prefix = "turn-" + i + " ";
            String role = i % 2 == 0 ? Turn.ROLE_USER : Turn.ROLE_ASSISTANT;
            turns.add(Turn.of(role, prefix + "x".repeat(Math.max(0, chars - prefix.length())),
                    Instant.EPOCH.plusSeconds(i)));
        }
        return turns;
    }

    private static List<MemoryItem> memories(int count, int chars) {
        List<MemoryItem> items = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            items.add(MemoryItem.builder()
                    .id(String.format("mem-%06d", i))
                    .content("m".repeat(chars))
                    .tags(List.of(TOPIC))
                    .createdAt(Instant.EPOCH.plusSeconds(i))
                    .sequence(i)
                    .build());
        }
        return items;
    }
}
