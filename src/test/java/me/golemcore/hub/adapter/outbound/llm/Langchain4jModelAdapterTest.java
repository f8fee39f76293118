package me.golemcore.hub.adapter.outbound.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import me.golemcore.hub.domain.exception.ModelInvocationException;
import me.golemcore.hub.domain.loop.ModelReplyParser;
import me.golemcore.hub.domain.model.ActionKind;
import me.golemcore.hub.domain.model.ContextLayer;
import me.golemcore.hub.domain.model.ContextSnapshot;
import me.golemcore.hub.domain.model.LayerKind;
import me.golemcore.hub.domain.model.ModelReply;
import me.golemcore.hub.infrastructure.config.AutoConfiguration;
import me.golemcore.hub.infrastructure.config.HubProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Langchain4jModelAdapterTest {

    private static final String CHAT_MODEL = "chatModel";

    private HubProperties properties;
    private ChatModel chatModel;
    private Langchain4jModelAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new HubProperties();
        properties.getModel().setProvider("openai");
        properties.getModel().setApiKey("key");
        chatModel = mock(ChatModel.class);
        adapter = new Langchain4jModelAdapter(properties, AutoConfiguration.objectMapper());
        ReflectionTestUtils.setField(adapter, CHAT_MODEL, chatModel);
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldSendStaticLayersAsSystemMessage() throws Exception {
        when(chatModel.chat(anyList())).thenReturn(response(
                "{\"type\":\"tool_call\",\"tool\":\"read_file\",\"arguments\":{\"path\":\"a\"}}"));
        ContextSnapshot prompt = ContextSnapshot.builder()
                .sessionId("s1")
                .layers(List.of(
                        layer(LayerKind.SYSTEM, "You are careful."),
                        layer(LayerKind.DEVELOPER, ""),
                        layer(LayerKind.MEMORY, "- canary first"),
                        layer(LayerKind.ACTIVE_CONVERSATION, "user: deploy")))
                .build();

        ModelReply reply = adapter.complete(prompt).get();

        assertEquals(ActionKind.TOOL_CALL, reply.getAction().getKind());
        ArgumentCaptor<List<ChatMessage>> captor = ArgumentCaptor.forClass(List.class);
        verify(chatModel).chat(captor.capture());
        SystemMessage system = (SystemMessage) captor.getValue().get(0);
        UserMessage user = (UserMessage) captor.getValue().get(1);
        assertTrue(system.text().contains("You are careful."));
        assertTrue(system.text().contains(ModelReplyParser.INSTRUCTIONS));
        assertFalse(system.text().contains("DEVELOPER"));
        assertTrue(user.singleText().startsWith("## MEMORY"));
        assertTrue(user.singleText().contains("user: deploy"));
    }

    @Test
    void shouldReturnPlainTextCompletion() throws Exception {
        when(chatModel.chat(anyList())).thenReturn(response("APPROVE: fine"));

        assertEquals("APPROVE: fine", adapter.completeText("review", "proposal").get());
    }

    @Test
    void shouldClassifyProviderErrors() {
        when(chatModel.chat(anyList())).thenThrow(new RuntimeException("HTTP 401: invalid api key"));

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> adapter.completeText("review", "proposal").get());

        ModelInvocationException cause = assertInstanceOf(ModelInvocationException.class, error.getCause());
        assertFalse(cause.isTransient());
    }

    @Test
    void shouldTreatRateLimitsAndTimeoutsAsTransient() {
        assertTrue(Langchain4jModelAdapter.isTransient(new RuntimeException("429 rate_limit_exceeded")));
        assertTrue(Langchain4jModelAdapter.isTransient(new RuntimeException("call failed",
                new IOException("Read timed out"))));
        assertFalse(Langchain4jModelAdapter.isTransient(new RuntimeException("403 Forbidden")));
    }

    @Test
    void shouldFailFatallyWithoutApiKey() {
        properties.getModel().setApiKey(" ");
        ReflectionTestUtils.setField(adapter, CHAT_MODEL, null);

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> adapter.completeText("review", "proposal").get());

        assertFalse(adapter.isAvailable());
        assertFalse(((ModelInvocationException) error.getCause()).isTransient());
    }

    private static ContextLayer layer(LayerKind kind, String content) {
        return ContextLayer.builder().kind(kind).content(content).build();
    }

    private static ChatResponse response(String text) {
        return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
    }
}
