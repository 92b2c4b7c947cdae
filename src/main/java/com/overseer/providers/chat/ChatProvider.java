package com.overseer.providers.chat;

import com.overseer.models.JudgeEndpointConfig;

import java.io.IOException;

/**
 * Interface for chat model providers.
 * Each provider implementation handles the specific API format for that service.
 */
public interface ChatProvider {

    /**
     * Get the provider name this implementation handles.
     */
    String getProviderName();

    /**
     * Send a single-turn chat and get the assistant text back.
     *
     * @param apiKey The API key (may be null for local providers)
     * @param endpoint The endpoint configuration with model, baseUrl, etc.
     * @param systemPrompt Instructions for the model; may be null
     * @param message The user message to send
     * @return The assistant's response text
     */
    String chat(String apiKey, JudgeEndpointConfig endpoint, String systemPrompt, String message)
        throws IOException, InterruptedException;
}
