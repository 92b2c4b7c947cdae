package com.overseer.providers.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Abstract base class for chat providers with shared HTTP logic.
 */
public abstract class AbstractChatProvider implements ChatProvider {

    private static final Pattern STATUS_CODE = Pattern.compile("\\((\\d{3})\\)");

    protected final ObjectMapper mapper;
    protected final HttpClient httpClient;
    protected static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 30;

    protected AbstractChatProvider(ObjectMapper mapper, HttpClient httpClient) {
        this.mapper = mapper;
        this.httpClient = httpClient;
    }

    /**
     * Send a JSON POST request and return the parsed response.
     */
    protected JsonNode sendJsonPost(String url, JsonNode payload, String bearerAuth, String anthropicKey, Integer timeoutMs)
        throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(resolveTimeout(timeoutMs))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(payload)));

        if (bearerAuth != null && !bearerAuth.isBlank()) {
            builder.header("Authorization", bearerAuth);
        }
        if (anthropicKey != null && !anthropicKey.isBlank()) {
            builder.header("x-api-key", anthropicKey);
            builder.header("anthropic-version", "2023-06-01");
        }

        HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new IOException("Chat request failed (" + status + "): " + response.body());
        }
        return mapper.readTree(response.body());
    }

    /**
     * Retry wrapper for transient network/provider failures. Judge calls sit on the
     * analysis deadline, so the default retry budget is small.
     */
    protected JsonNode sendJsonPostWithRetries(String url, JsonNode payload,
                                               String bearerAuth, String anthropicKey,
                                               Integer timeoutMs, Integer maxRetries)
        throws IOException, InterruptedException {
        int retries = maxRetries != null ? Math.max(0, maxRetries) : 1;
        IOException lastIo = null;
        for (int attempt = 0; attempt <= retries; attempt++) {
            try {
                return sendJsonPost(url, payload, bearerAuth, anthropicKey, timeoutMs);
            } catch (IOException e) {
                lastIo = e;
                if (attempt >= retries || !isRetryableChatFailure(e)) {
                    throw e;
                }
                sleepBackoff(attempt);
            }
        }
        throw lastIo != null ? lastIo : new IOException("Chat request failed");
    }

    static boolean isRetryableChatFailure(IOException e) {
        if (e == null) return false;
        String msg = e.getMessage() != null ? e.getMessage() : "";
        if (msg.contains("Connection reset")) return true;
        if (msg.contains("timed out") || msg.contains("Timeout")) return true;
        Matcher m = STATUS_CODE.matcher(msg);
        if (m.find()) {
            int code = Integer.parseInt(m.group(1));
            return code == 429 || (code >= 500 && code <= 599);
        }
        return false;
    }

    private void sleepBackoff(int attempt) throws InterruptedException {
        long base = attempt <= 0 ? 250 : 600L * attempt;
        long jitter = ThreadLocalRandom.current().nextLong(0, 120);
        Thread.sleep(Math.min(2_000, base + jitter));
    }

    protected Duration resolveTimeout(Integer timeoutMs) {
        if (timeoutMs != null && timeoutMs > 0) {
            return Duration.ofMillis(timeoutMs);
        }
        return Duration.ofSeconds(DEFAULT_REQUEST_TIMEOUT_SECONDS);
    }

    /**
     * Normalize a base URL by removing trailing slashes.
     */
    protected String normalizeBaseUrl(String baseUrl, String fallback) {
        String url = (baseUrl == null || baseUrl.isBlank()) ? fallback : baseUrl.trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }
}
