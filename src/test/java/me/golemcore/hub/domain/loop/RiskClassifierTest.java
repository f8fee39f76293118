package me.golemcore.hub.domain.loop;

import me.golemcore.hub.domain.broker.ToolServerBroker;
import me.golemcore.hub.domain.model.ProposedAction;
import me.golemcore.hub.domain.model.RiskClass;
import me.golemcore.hub.domain.model.ToolDescriptor;
import me.golemcore.hub.infrastructure.config.HubProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RiskClassifierTest {

    private ToolServerBroker broker;
    private RiskClassifier classifier;

    @BeforeEach
    void setUp() {
        broker = mock(ToolServerBroker.class);
        when(broker.findTool(anyString())).thenReturn(Optional.empty());
        when(broker.findTool("describe_table"))
                .thenReturn(Optional.of(ToolDescriptor.simple("describe_table", "", RiskClass.SAFE)));
        when(broker.findTool("truncate_table"))
                .thenReturn(Optional.of(ToolDescriptor.simple("truncate_table", "", RiskClass.RISKY)));
        HubProperties properties = new HubProperties();
        properties.getAutonomy().setSafePatterns(List.of("read_*", "list_?"));
        properties.getAutonomy().setCostThreshold(1.0);
        classifier = new RiskClassifier(broker, properties);
    }

    @Test
    void shouldTreatPromptsAsSafeAndScriptsAsRisky() {
        assertEquals(RiskClass.SAFE, classifier.classify(ProposedAction.prompt("summarize", null)));
        assertEquals(RiskClass.RISKY, classifier.classify(ProposedAction.script("sh", "ls", null)));
    }

    @Test
    void shouldUseAdvertisedSideEffectForTools() {
        assertEquals(RiskClass.SAFE, classifier.classify(ProposedAction.toolCall("describe_table", Map.of(), null)));
        assertEquals(RiskClass.RISKY, classifier.classify(ProposedAction.toolCall("truncate_table", Map.of(), null)));
        assertEquals(RiskClass.RISKY, classifier.classify(ProposedAction.toolCall("never_heard_of", Map.of(), null)));
    }

    @Test
    void shouldTreatApprovedPatternsAsSafe() {
        assertEquals(RiskClass.SAFE, classifier.classify(ProposedAction.toolCall("read_file", Map.of(), null)));
        assertEquals(RiskClass.SAFE, classifier.classify(ProposedAction.toolCall("list_x", Map.of(), null)));
        assertEquals(RiskClass.RISKY, classifier.classify(ProposedAction.toolCall("list_xy", Map.of(), null)));
    }

    @Test
    void shouldTreatExpensiveActionsAsRisky() {
        ProposedAction prompt = ProposedAction.prompt("translate the archive", null);
        prompt.setEstimatedCost(2.5);
        ProposedAction read = ProposedAction.toolCall("read_file", Map.of(), null);
        read.setEstimatedCost(1.0);

        assertEquals(RiskClass.RISKY, classifier.classify(prompt));
        assertEquals(RiskClass.SAFE, classifier.classify(read));
    }

    @Test
    void shouldQuoteRegexCharactersInGlobs() {
        assertTrue(RiskClassifier.globToPattern("db.read*").matcher("db.read_rows").matches());
        assertFalse(RiskClassifier.globToPattern("db.read*").matcher("dbxread_rows").matches());
    }
}
