package com.overseer.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.overseer.AppLogger;
import com.overseer.analysis.AnalysisScheduler;
import com.overseer.models.AnalysisContext;
import com.overseer.models.AnalysisResult;
import com.overseer.models.CompletionMatch;
import com.overseer.models.ThinkingChunk;
import com.overseer.scope.CompletionDetector;
import com.overseer.scope.TaskScope;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Inputs from the capture side: thinking chunks for the supervisors, output text for the
 * completion detector, and the task scope itself.
 */
public class SessionController implements Controller {

    private static final String COMPONENT = "SessionController";

    private final AnalysisScheduler scheduler;
    private final TaskScope scope;
    private final CompletionDetector detector;
    private final ObjectMapper objectMapper;

    public SessionController(AnalysisScheduler scheduler, TaskScope scope, CompletionDetector detector,
                             ObjectMapper objectMapper) {
        this.scheduler = scheduler;
        this.scope = scope;
        this.detector = detector;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/api/thinking", this::submitThinking);
        app.post("/api/output", this::submitOutput);
        app.get("/api/scope", this::getScope);
        app.post("/api/scope", this::startScope);
        app.post("/api/scope/current", this::setCurrentItem);
    }

    private void submitThinking(Context ctx) {
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            String content = text(json, "content");
            if (content == null || content.isBlank()) {
                ctx.status(400).json(Map.of("error", "content is required"));
                return;
            }
            String id = text(json, "id");
            ThinkingChunk chunk = new ThinkingChunk(id != null ? id : UUID.randomUUID().toString(), content,
                System.currentTimeMillis(), text(json, "messageId"));
            AnalysisContext context = null;
            if (json.hasNonNull("originalRequest") || json.hasNonNull("progress")) {
                context = new AnalysisContext(text(json, "originalRequest"), text(json, "progress"));
            }

            CompletableFuture<AnalysisResult> future = scheduler.analyzeThinking(chunk, context);
            boolean queued = future.isDone() && !future.isCompletedExceptionally() && future.join().isQueued();

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("chunkId", chunk.getId());
            response.put("queued", queued);
            response.put("queueSize", scheduler.getQueueSize());
            ctx.status(202).json(response);
        } catch (Exception e) {
            AppLogger.warn(COMPONENT, "Invalid thinking chunk: " + e.getMessage());
            ctx.status(400).json(Controller.errorBody(e));
        }
    }

    private void submitOutput(Context ctx) {
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            String output = text(json, "text");
            if (output == null) {
                ctx.status(400).json(Map.of("error", "text is required"));
                return;
            }
            List<CompletionMatch> matches = detector.processOutput(output, scope.getItems());
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("matches", matches);
            response.put("progress", scope.getProgress());
            ctx.json(response);
        } catch (Exception e) {
            AppLogger.warn(COMPONENT, "Invalid output body: " + e.getMessage());
            ctx.status(400).json(Controller.errorBody(e));
        }
    }

    private void getScope(Context ctx) {
        ctx.json(scopeView());
    }

    private void startScope(Context ctx) {
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            List<String> names = new ArrayList<>();
            JsonNode items = json.get("items");
            if (items != null && items.isArray()) {
                for (JsonNode item : items) {
                    names.add(item.asText());
                }
            }
            scope.start(text(json, "task"), names);
            detector.reset();
            ctx.status(201).json(scopeView());
        } catch (Exception e) {
            AppLogger.warn(COMPONENT, "Invalid scope body: " + e.getMessage());
            ctx.status(400).json(Controller.errorBody(e));
        }
    }

    private void setCurrentItem(Context ctx) {
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            String id = text(json, "id");
            if (!scope.setCurrentItem(id)) {
                ctx.status(404).json(Map.of("error", "Item not found: " + id));
                return;
            }
            ctx.json(scopeView());
        } catch (Exception e) {
            AppLogger.warn(COMPONENT, "Invalid current item body: " + e.getMessage());
            ctx.status(400).json(Controller.errorBody(e));
        }
    }

    private Map<String, Object> scopeView() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("task", scope.getTaskName());
        view.put("items", scope.getItems());
        view.put("progress", scope.getProgress());
        return view;
    }

    private static String text(JsonNode json, String field) {
        JsonNode node = json != null ? json.get(field) : null;
        return node != null && !node.isNull() ? node.asText() : null;
    }
}
