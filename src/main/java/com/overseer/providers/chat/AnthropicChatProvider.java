package com.overseer.providers.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.overseer.models.JudgeEndpointConfig;

import java.io.IOException;
import java.net.http.HttpClient;

public class AnthropicChatProvider extends AbstractChatProvider {

    public AnthropicChatProvider(ObjectMapper mapper, HttpClient httpClient) {
        super(mapper, httpClient);
    }

    @Override
    public String getProviderName() {
        return "anthropic";
    }

    @Override
    public String chat(String apiKey, JudgeEndpointConfig endpoint, String systemPrompt, String message)
        throws IOException, InterruptedException {
        String url = normalizeBaseUrl(endpoint.getBaseUrl(), "https://api.anthropic.com") + "/v1/messages";

        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", endpoint.getModel());
        payload.put("max_tokens", endpoint.getMaxOutputTokens() != null ? endpoint.getMaxOutputTokens() : 150);
        if (endpoint.getTemperature() != null) {
            payload.put("temperature", endpoint.getTemperature());
        }
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            payload.put("system", systemPrompt);
        }

        ArrayNode messages = payload.putArray("messages");
        ObjectNode msg = messages.addObject();
        msg.put("role", "user");
        msg.put("content", message);

        JsonNode response = sendJsonPostWithRetries(url, payload, null, apiKey,
            endpoint.getTimeoutMs(), endpoint.getMaxRetries());

        JsonNode content = response.path("content");
        if (content.isArray() && content.size() > 0) {
            JsonNode text = content.get(0).path("text");
            if (!text.isMissingNode()) {
                return text.asText();
            }
        }
        // no text in the reply
        return "";
    }
}
