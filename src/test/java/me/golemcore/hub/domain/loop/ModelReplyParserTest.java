package me.golemcore.hub.domain.loop;

import me.golemcore.hub.domain.model.ActionKind;
import me.golemcore.hub.domain.model.ModelReply;
import me.golemcore.hub.domain.model.ProposedAction;
import me.golemcore.hub.infrastructure.config.AutoConfiguration;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModelReplyParserTest {

    private final ModelReplyParser parser = new ModelReplyParser(AutoConfiguration.objectMapper());

    @Test
    void shouldParseToolCallWithPlanAndVerification() {
        ModelReply reply = parser.parse("""
                {"type":"tool_call","tool":"write_file","arguments":{"path":"a.txt","lines":2},
                 "reasoning":"create it","plan":["write","check"],"estimatedCost":0.2,
                 "verify":{"tool":"read_file","arguments":{"path":"a.txt"}}}
                """);

        assertTrue(reply.hasAction());
        ProposedAction action = reply.getAction();
        assertEquals(ActionKind.TOOL_CALL, action.getKind());
        assertEquals("write_file", action.getToolName());
        assertEquals(Map.of("path", "a.txt", "lines", 2), action.getArguments());
        assertEquals(List.of("write", "check"), action.getPlanSteps());
        assertEquals(0.2, action.getEstimatedCost());
        assertNotNull(action.getVerification());
        assertEquals("read_file", action.getVerification().getToolName());
    }

    @Test
    void shouldParseFencedScript() {
        ModelReply reply = parser.parse("```json\n{\"type\":\"script\",\"script\":\"ls -la\"}\n```");

        assertEquals(ActionKind.SCRIPT, reply.getAction().getKind());
        assertEquals("bash", reply.getAction().getLanguage());
        assertEquals("ls -la", reply.getAction().getScript());
    }

    @Test
    void shouldReturnTextForAnswersAndProse() {
        assertEquals("All done.", parser.parse("{\"type\":\"answer\",\"text\":\"All done.\"}").getText());
        assertEquals("Just prose", parser.parse("  Just prose \n").getText());
        assertFalse(parser.parse("{not json}").hasAction());
        assertFalse(parser.parse("{\"type\":\"dance\"}").hasAction());
        assertEquals("", parser.parse(null).getText());
    }
}
