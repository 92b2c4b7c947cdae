package com.overseer.providers.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.overseer.models.JudgeEndpointConfig;

import java.io.IOException;
import java.net.http.HttpClient;

/**
 * OpenAI-compatible chat provider.
 * Handles: openai, lmstudio, custom
 */
public class OpenAiCompatibleChatProvider extends AbstractChatProvider {

    private final String providerName;

    public OpenAiCompatibleChatProvider(ObjectMapper mapper, HttpClient httpClient, String providerName) {
        super(mapper, httpClient);
        this.providerName = providerName;
    }

    @Override
    public String getProviderName() {
        return providerName;
    }

    @Override
    public String chat(String apiKey, JudgeEndpointConfig endpoint, String systemPrompt, String message)
        throws IOException, InterruptedException {
        String url = normalizeOpenAiBaseUrl(endpoint.getBaseUrl(), defaultOpenAiBase(providerName)) + "/v1/chat/completions";

        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", endpoint.getModel());

        ArrayNode messages = payload.putArray("messages");
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            ObjectNode system = messages.addObject();
            system.put("role", "system");
            system.put("content", systemPrompt);
        }
        ObjectNode msg = messages.addObject();
        msg.put("role", "user");
        msg.put("content", message);

        if (endpoint.getTemperature() != null) {
            payload.put("temperature", endpoint.getTemperature());
        }
        if (endpoint.getMaxOutputTokens() != null) {
            payload.put("max_tokens", endpoint.getMaxOutputTokens());
        }

        JsonNode response = sendJsonPostWithRetries(
            url,
            payload,
            apiKey == null ? null : "Bearer " + apiKey,
            null,
            endpoint.getTimeoutMs(),
            endpoint.getMaxRetries()
        );

        JsonNode choices = response.path("choices");
        if (choices.isArray() && choices.size() > 0) {
            JsonNode choice = choices.get(0);
            JsonNode content = choice.path("message").path("content");
            if (!content.isMissingNode() && !content.asText().isBlank()) {
                return content.asText();
            }
            JsonNode text = choice.path("text");
            if (!text.isMissingNode()) {
                return text.asText();
            }
        }
        // no text in the reply
        return "";
    }

    private String defaultOpenAiBase(String provider) {
        if ("openai".equals(provider)) {
            return "https://api.openai.com";
        }
        return "http://localhost:1234";
    }

    private String normalizeOpenAiBaseUrl(String baseUrl, String fallback) {
        String url = normalizeBaseUrl(baseUrl, fallback);
        if (url.endsWith("/v1")) {
            url = url.substring(0, url.length() - 3);
        }
        return url;
    }
}
