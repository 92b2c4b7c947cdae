package com.overseer.providers.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.overseer.models.JudgeEndpointConfig;

import java.io.IOException;
import java.net.http.HttpClient;

public class OllamaChatProvider extends AbstractChatProvider {

    public OllamaChatProvider(ObjectMapper mapper, HttpClient httpClient) {
        super(mapper, httpClient);
    }

    @Override
    public String getProviderName() {
        return "ollama";
    }

    @Override
    public String chat(String apiKey, JudgeEndpointConfig endpoint, String systemPrompt, String message)
        throws IOException, InterruptedException {
        String url = normalizeBaseUrl(endpoint.getBaseUrl(), "http://localhost:11434") + "/api/chat";

        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", endpoint.getModel());
        payload.put("stream", false);
        payload.put("format", "json");

        ArrayNode messages = payload.putArray("messages");
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            ObjectNode system = messages.addObject();
            system.put("role", "system");
            system.put("content", systemPrompt);
        }
        ObjectNode msg = messages.addObject();
        msg.put("role", "user");
        msg.put("content", message);

        ObjectNode options = payload.putObject("options");
        if (endpoint.getTemperature() != null) {
            options.put("temperature", endpoint.getTemperature());
        }
        if (endpoint.getMaxOutputTokens() != null) {
            options.put("num_predict", endpoint.getMaxOutputTokens());
        }

        JsonNode response = sendJsonPost(url, payload, null, null, endpoint.getTimeoutMs());

        JsonNode content = response.path("message").path("content");
        if (!content.isMissingNode()) {
            return content.asText();
        }
        // no text in the reply
        return "";
    }
}
