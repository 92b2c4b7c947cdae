package com.overseer.controllers;

import io.javalin.Javalin;

import java.util.Map;

/**
 * A group of HTTP routes registered on the hook server.
 */
public interface Controller {

    void registerRoutes(Javalin app);

    /**
     * Error body that never carries a null message.
     */
    static Map<String, Object> errorBody(Exception e) {
        String m = e.getMessage();
        if (m == null || m.isBlank()) {
            m = e.getClass().getSimpleName();
        }
        return Map.of("error", m);
    }
}
