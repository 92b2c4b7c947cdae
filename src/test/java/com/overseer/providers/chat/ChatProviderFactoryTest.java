package com.overseer.providers.chat;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class ChatProviderFactoryTest {

    @Test
    void picksProviderByName() {
        ChatProviderFactory factory = new ChatProviderFactory(new ObjectMapper());

        assertTrue(factory.getProvider("anthropic") instanceof AnthropicChatProvider);
        assertTrue(factory.getProvider("ollama") instanceof OllamaChatProvider);
        assertTrue(factory.getProvider("openai") instanceof OpenAiCompatibleChatProvider);
        assertEquals("custom", factory.getProvider(null).getProviderName());
        assertSame(factory.getProvider("openai"), factory.getProvider("openai"));
    }

    @Test
    void retryableFailures() {
        assertTrue(AbstractChatProvider.isRetryableChatFailure(new IOException("Chat request failed (429): slow down")));
        assertTrue(AbstractChatProvider.isRetryableChatFailure(new IOException("Chat request failed (503)")));
        assertTrue(AbstractChatProvider.isRetryableChatFailure(new IOException("Connection reset by peer")));
        assertTrue(AbstractChatProvider.isRetryableChatFailure(new IOException("request timed out")));
        assertFalse(AbstractChatProvider.isRetryableChatFailure(new IOException("Chat request failed (401)")));
        assertFalse(AbstractChatProvider.isRetryableChatFailure(new IOException((String) null)));
        assertFalse(AbstractChatProvider.isRetryableChatFailure(null));
    }
}
