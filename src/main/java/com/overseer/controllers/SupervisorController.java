package com.overseer.controllers;

import com.overseer.AlertHistory;
import com.overseer.AppLogger;
import com.overseer.models.AlertHistoryEntry;
import com.overseer.supervisors.SupervisorTree;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of the supervisor hierarchy and the alert history, plus the operator clear.
 */
public class SupervisorController implements Controller {

    private static final String COMPONENT = "SupervisorController";

    private final SupervisorTree tree;
    private final AlertHistory alertHistory;

    public SupervisorController(SupervisorTree tree, AlertHistory alertHistory) {
        this.tree = tree;
        this.alertHistory = alertHistory;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/alerts", this::getAlerts);
        app.post("/api/alerts/clear", this::clearAlerts);
        app.get("/api/supervisors", this::getSupervisors);
    }

    private void getAlerts(Context ctx) {
        try {
            String supervisor = ctx.queryParam("supervisor");
            String sinceMinutes = ctx.queryParam("sinceMinutes");

            Duration window = null;
            if (sinceMinutes != null && !sinceMinutes.isBlank()) {
                long minutes = Long.parseLong(sinceMinutes.trim());
                if (minutes < 0) {
                    ctx.status(400).json(Map.of("error", "sinceMinutes must not be negative"));
                    return;
                }
                window = Duration.ofMinutes(minutes);
            }

            List<AlertHistoryEntry> alerts;
            if (supervisor != null && !supervisor.isBlank()) {
                alerts = alertHistory.getBySupervisor(supervisor);
                if (window != null) {
                    alerts.retainAll(alertHistory.getRecentAlerts(window));
                }
            } else if (window != null) {
                alerts = alertHistory.getRecentAlerts(window);
            } else {
                alerts = alertHistory.getAll();
            }
            ctx.json(alerts);
        } catch (NumberFormatException e) {
            ctx.status(400).json(Map.of("error", "sinceMinutes must be a number"));
        } catch (Exception e) {
            AppLogger.error(COMPONENT, "Failed to list alerts", e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void clearAlerts(Context ctx) {
        try {
            alertHistory.clear();
            ctx.json(Map.of("success", true));
        } catch (Exception e) {
            AppLogger.error(COMPONENT, "Failed to clear alerts", e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void getSupervisors(Context ctx) {
        try {
            ctx.json(Map.of(
                "tree", tree.describe(),
                "stats", tree.getStats()
            ));
        } catch (Exception e) {
            AppLogger.error(COMPONENT, "Failed to describe supervisors", e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }
}
