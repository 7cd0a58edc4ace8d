package com.plansmith.core.llm;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link LlmService}.
 * <p>
 * Mocks the entire {@link ChatClient} chain so no real LLM calls are made.
 */
class LlmServiceTest {

    private ChatClientRequestSpec mockRequestSpec;
    private CallResponseSpec mockCallResponse;
    private LlmService llmService;

    @BeforeEach
    void setUp() {
        ChatClient mockChatClient = mock(ChatClient.class);
        mockRequestSpec = mock(ChatClientRequestSpec.class);
        mockCallResponse = mock(CallResponseSpec.class);

        when(mockChatClient.prompt()).thenReturn(mockRequestSpec);
        when(mockRequestSpec.system(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.user(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.call()).thenReturn(mockCallResponse);

        ChatClient.Builder mockBuilder = mock(ChatClient.Builder.class);
        when(mockBuilder.build()).thenReturn(mockChatClient);

        llmService = new LlmService(mockBuilder, "http://test:1234");
    }

    @Test
    @DisplayName("invoke sends system and user instructions unchanged")
    void sendsInstructions() {
        when(mockCallResponse.content()).thenReturn("{\"ok\": true}");

        llmService.invoke("System prompt", "User prompt");

        verify(mockRequestSpec).system("System prompt");
        verify(mockRequestSpec).user("User prompt");
    }

    @Test
    @DisplayName("invoke returns the stripped reply text")
    void returnsText() {
        when(mockCallResponse.content()).thenReturn("\n  {\"ok\": true}  \n");
        assertEquals("{\"ok\": true}", llmService.invoke("s", "u"));
    }

    @Test
    @DisplayName("Null or blank content becomes an empty string")
    void emptyContent() {
        when(mockCallResponse.content()).thenReturn(null);
        assertEquals("", llmService.invoke("s", "u"));

        when(mockCallResponse.content()).thenReturn("   ");
        assertEquals("", llmService.invoke("s", "u"));
    }

    @Test
    @DisplayName("Transport failures propagate")
    void transportFailure() {
        when(mockRequestSpec.call()).thenThrow(new RuntimeException("connection refused"));
        var ex = assertThrows(RuntimeException.class, () -> llmService.invoke("s", "u"));
        assertEquals("connection refused", ex.getMessage());
    }
}
