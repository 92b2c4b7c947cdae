package com.overseer.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.overseer.AlertHistory;
import com.overseer.HookServer;
import com.overseer.analysis.AnalysisScheduler;
import com.overseer.models.RuleVerdict;
import com.overseer.scope.CompletionDetector;
import com.overseer.scope.TaskScope;
import com.overseer.supervisors.NodeAnalyzer;
import com.overseer.supervisors.SupervisorTree;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class SessionControllerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
    private final ExecutorService judgeExecutor = Executors.newCachedThreadPool();
    private AnalysisScheduler scheduler;
    private TaskScope scope;
    private HookServer server;
    private int port;

    @BeforeEach
    void setUp() {
        NodeAnalyzer analyzer = new NodeAnalyzer((text, check, ctx) -> RuleVerdict.passed(), judgeExecutor, mapper);
        scheduler = new AnalysisScheduler(new SupervisorTree(), analyzer, null, AlertHistory.inMemory(), 5_000);
        scope = new TaskScope();
        CompletionDetector detector = new CompletionDetector();
        detector.addListener(scope::applyCompletion);
        server = new HookServer(mapper, List.of(new SessionController(scheduler, scope, detector, mapper)));
        port = server.start(0);
    }

    @AfterEach
    void tearDown() {
        server.stop();
        scheduler.shutdown();
        judgeExecutor.shutdownNow();
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + path))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void thinkingChunkIsAccepted() throws Exception {
        HttpResponse<String> response = post("/api/thinking", "{\"id\":\"chunk-1\",\"content\":\"Planning the login form\"}");

        assertEquals(202, response.statusCode());
        JsonNode json = mapper.readTree(response.body());
        assertEquals("chunk-1", json.get("chunkId").asText());
        assertFalse(json.get("queued").asBoolean());
    }

    @Test
    void thinkingWithoutContentIsRejected() throws Exception {
        assertEquals(400, post("/api/thinking", "{\"id\":\"x\"}").statusCode());
        assertEquals(400, post("/api/thinking", "not json").statusCode());
    }

    @Test
    void scopeThenOutputCompletesItems() throws Exception {
        HttpResponse<String> started = post("/api/scope", "{\"task\":\"Auth\",\"items\":[\"Login\",\"Logout\"]}");
        assertEquals(201, started.statusCode());
        assertEquals(2, mapper.readTree(started.body()).get("items").size());

        HttpResponse<String> output = post("/api/output", "{\"text\":\"Item Login - ✅\"}");

        assertEquals(200, output.statusCode());
        JsonNode json = mapper.readTree(output.body());
        assertEquals(1, json.get("matches").size());
        assertEquals("checkbox", json.get("matches").get(0).get("matchType").asText());
        assertEquals(50, json.get("progress").get("percentage").asInt());
        assertEquals(1, scope.getPendingItems().size());
    }

    @Test
    void currentItemMustExist() throws Exception {
        post("/api/scope", "{\"task\":\"Auth\",\"items\":[\"Login\"]}");

        assertEquals(200, post("/api/scope/current", "{\"id\":\"item-1\"}").statusCode());
        assertEquals(404, post("/api/scope/current", "{\"id\":\"item-9\"}").statusCode());
        assertEquals("Login", scope.getProgress().getCurrentItem());
    }

    @Test
    void scopeCanBeRead() throws Exception {
        post("/api/scope", "{\"task\":\"Auth\",\"items\":[\"Login\"]}");

        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + "/api/scope")).GET().build();
        JsonNode json = mapper.readTree(client.send(request, HttpResponse.BodyHandlers.ofString()).body());

        assertEquals("Auth", json.get("task").asText());
        assertEquals("pending", json.get("items").get(0).get("status").asText());
    }
}
