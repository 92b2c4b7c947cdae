package com.overseer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.overseer.controllers.Controller;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.util.List;
import java.util.Map;

/**
 * Loopback HTTP server for the agent hooks. If the preferred port is taken, the next ones
 * are tried in turn.
 */
public class HookServer {

    public static final String HOST = "127.0.0.1";
    private static final int MAX_BIND_ATTEMPTS = 10;
    private static final String COMPONENT = "HookServer";

    private final ObjectMapper objectMapper;
    private final List<Controller> controllers;
    private Javalin app;
    private int port = -1;

    public HookServer(ObjectMapper objectMapper, List<Controller> controllers) {
        this.objectMapper = objectMapper;
        this.controllers = controllers;
    }

    /**
     * Start listening. A preferred port of 0 binds an ephemeral port.
     *
     * @return the bound port
     */
    public synchronized int start(int preferredPort) {
        if (app != null) {
            return port;
        }
        int candidate = preferredPort;
        RuntimeException lastFailure = null;
        for (int attempt = 0; attempt < MAX_BIND_ATTEMPTS; attempt++) {
            int target = candidate == 0 ? 0 : AppConfig.findAvailablePort(candidate);
            Javalin created = createApp();
            try {
                created.start(HOST, target);
                app = created;
                port = created.port();
                AppLogger.info(COMPONENT, "Hook server running on http://" + HOST + ":" + port);
                return port;
            } catch (RuntimeException e) {
                lastFailure = e;
                AppLogger.warn(COMPONENT, "Port " + target + " unavailable, trying next...");
                created.stop();
                candidate = target + 1;
            }
        }
        throw new IllegalStateException("Could not bind hook server near port " + preferredPort, lastFailure);
    }

    Javalin createApp() {
        Javalin created = Javalin.create(cfg -> {
            cfg.jsonMapper(new JavalinJackson(objectMapper));
            cfg.http.defaultContentType = "application/json";
            cfg.showJavalinBanner = false;
        });

        created.before(ctx -> {
            ctx.header("Access-Control-Allow-Origin", "*");
            ctx.header("Access-Control-Allow-Methods", "GET, POST, OPTIONS");
            ctx.header("Access-Control-Allow-Headers", "Content-Type");
        });
        created.options("/*", ctx -> ctx.status(200));

        for (Controller controller : controllers) {
            controller.registerRoutes(created);
        }

        created.error(404, ctx -> ctx.json(Map.of("error", "Not found")));

        created.exception(Exception.class, (e, ctx) -> {
            AppLogger.error(COMPONENT, "Unhandled exception: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        });
        return created;
    }

    public synchronized void stop() {
        if (app != null) {
            app.stop();
            app = null;
            AppLogger.info(COMPONENT, "Server stopped");
        }
    }

    public synchronized int getPort() {
        return port;
    }

    public synchronized boolean isRunning() {
        return app != null;
    }
}
