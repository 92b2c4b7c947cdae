package com.overseer.controllers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.overseer.AppLogger;
import com.overseer.StopGate;
import com.overseer.models.StopDecision;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Endpoints called by the agent's stop hook. Every failure answers allow=true so a broken
 * request can never keep the agent from stopping.
 */
public class HookController implements Controller {

    private static final String COMPONENT = "HookController";

    private final StopGate stopGate;
    private final ObjectMapper objectMapper;

    public HookController(StopGate stopGate, ObjectMapper objectMapper) {
        this.stopGate = stopGate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/api/check-stop", this::checkStop);
        app.get("/api/status", this::getStatus);
        app.post("/api/bypass", this::bypass);
    }

    private void checkStop(Context ctx) {
        String body = ctx.body();
        try {
            if (!body.isBlank()) {
                JsonNode request = objectMapper.readTree(body);
                if (request == null || !request.isObject()) {
                    throw new IllegalArgumentException("Request body must be a JSON object");
                }
                String preview = request.toString();
                AppLogger.info(COMPONENT, "check-stop request: "
                    + (preview.length() > 200 ? preview.substring(0, 200) : preview));
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            AppLogger.warn(COMPONENT, "Invalid check-stop body: " + e.getMessage());
            ctx.status(400).json(failOpen("Invalid request"));
            return;
        }

        try {
            StopDecision decision = stopGate.checkStop();
            AppLogger.info(COMPONENT, "check-stop response: allow=" + decision.isAllow());
            ctx.json(decision);
        } catch (Exception e) {
            AppLogger.error(COMPONENT, "Stop check failed", e);
            Map<String, Object> response = failOpen(Controller.errorBody(e).get("error").toString());
            ctx.status(500).json(response);
        }
    }

    private void getStatus(Context ctx) {
        try {
            ctx.json(stopGate.getStatus());
        } catch (Exception e) {
            AppLogger.error(COMPONENT, "Failed to read status", e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void bypass(Context ctx) {
        stopGate.allowNextStop();
        ctx.json(Map.of(
            "success", true,
            "message", "Bypass granted. Next stop will be allowed."
        ));
    }

    private static Map<String, Object> failOpen(String error) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("error", error);
        response.put("allow", true);
        return response;
    }
}
