package com.overseer.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.overseer.AlertHistory;
import com.overseer.HookServer;
import com.overseer.models.Severity;
import com.overseer.models.SupervisorResult;
import com.overseer.supervisors.DefaultHierarchy;
import com.overseer.supervisors.SupervisorTree;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SupervisorControllerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
    private AlertHistory history;
    private HookServer server;
    private int port;

    @BeforeEach
    void setUp() {
        SupervisorTree tree = new SupervisorTree();
        DefaultHierarchy.install(tree);
        history = AlertHistory.inMemory();
        server = new HookServer(mapper, List.of(new SupervisorController(tree, history)));
        port = server.start(0);
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private HttpResponse<String> send(String method, String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + path))
            .method(method, HttpRequest.BodyPublishers.noBody())
            .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private void record(String supervisor, String message) {
        history.record(SupervisorResult.alert("id", supervisor, Severity.HIGH, message, "", 0), "chunk");
    }

    @Test
    void listsAlertsFilteredBySupervisor() throws Exception {
        record("Security", "sql");
        record("Architecture", "layering");

        JsonNode all = mapper.readTree(send("GET", "/api/alerts").body());
        JsonNode security = mapper.readTree(send("GET", "/api/alerts?supervisor=Security&sinceMinutes=5").body());

        assertEquals(2, all.size());
        assertEquals(1, security.size());
        assertEquals("sql", security.get(0).get("message").asText());
        assertEquals("alert", security.get(0).get("status").asText());
    }

    @Test
    void supervisorFilterAloneListsNewestFirst() throws Exception {
        record("Security", "sql");
        record("Architecture", "layering");
        record("Security", "xss");

        JsonNode security = mapper.readTree(send("GET", "/api/alerts?supervisor=Security").body());

        assertEquals(2, security.size());
        assertEquals("xss", security.get(0).get("message").asText());
        assertEquals("sql", security.get(1).get("message").asText());
    }

    @Test
    void badWindowIsRejected() throws Exception {
        assertEquals(400, send("GET", "/api/alerts?sinceMinutes=soon").statusCode());
        assertEquals(400, send("GET", "/api/alerts?sinceMinutes=-1").statusCode());
    }

    @Test
    void clearEmptiesHistory() throws Exception {
        record("Security", "sql");

        HttpResponse<String> response = send("POST", "/api/alerts/clear");

        assertEquals(200, response.statusCode());
        assertTrue(mapper.readTree(response.body()).get("success").asBoolean());
        assertEquals(0, history.size());
    }

    @Test
    void describesTreeWithStats() throws Exception {
        JsonNode json = mapper.readTree(send("GET", "/api/supervisors").body());

        assertEquals("router", json.get("tree").get("kind").asText());
        assertEquals(7, json.get("stats").get("totalNodes").asInt());
    }
}
