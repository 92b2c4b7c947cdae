package com.overseer;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Application configuration from command-line arguments and environment.
 */
public class AppConfig {

    public static final int DEFAULT_PORT = 18899;
    public static final int DEFAULT_JUDGE_TIMEOUT_MS = 5000;
    private static final int MAX_PORT_ATTEMPTS = 50;

    private final Path dataDir;
    private final Path logPath;
    private final Path supervisorsFile;
    private final int port;
    private final boolean devMode;
    private final String judgeProvider;
    private final String judgeModel;
    private final String judgeBaseUrl;
    private final String judgeApiKey;
    private final int judgeTimeoutMs;

    private AppConfig(Builder b, Path dataDir, int port) {
        this.dataDir = dataDir;
        this.logPath = dataDir.resolve("overseer.log");
        this.supervisorsFile = b.supervisorsFile;
        this.port = port;
        this.devMode = b.devMode;
        this.judgeProvider = b.judgeProvider;
        this.judgeModel = b.judgeModel;
        this.judgeBaseUrl = b.judgeBaseUrl;
        this.judgeApiKey = b.judgeApiKey;
        this.judgeTimeoutMs = b.judgeTimeoutMs;
    }

    public Path getDataDir() {
        return dataDir;
    }

    public Path getLogPath() {
        return logPath;
    }

    public Path getAlertHistoryPath() {
        return dataDir.resolve("alert-history.json");
    }

    /**
     * Optional supervisor definition file; null when the default hierarchy should be used.
     */
    public Path getSupervisorsFile() {
        return supervisorsFile;
    }

    public int getPort() {
        return port;
    }

    public boolean isDevMode() {
        return devMode;
    }

    public String getJudgeProvider() {
        return judgeProvider;
    }

    public String getJudgeModel() {
        return judgeModel;
    }

    public String getJudgeBaseUrl() {
        return judgeBaseUrl;
    }

    public String getJudgeApiKey() {
        return judgeApiKey;
    }

    public int getJudgeTimeoutMs() {
        return judgeTimeoutMs;
    }

    /**
     * A whole tree traversal may take two judge round-trips before it is abandoned.
     */
    public long getAnalysisTimeoutMs() {
        return judgeTimeoutMs * 2L;
    }

    /**
     * Default data directory: ~/.overseer
     */
    public static Path getDefaultDataDir() {
        return Paths.get(System.getProperty("user.home"), ".overseer");
    }

    /**
     * Find the first free loopback port starting at the preferred one, counting upwards.
     */
    public static int findAvailablePort(int preferredPort) {
        for (int port = preferredPort; port < preferredPort + MAX_PORT_ATTEMPTS; port++) {
            if (isPortAvailable(port)) {
                return port;
            }
        }
        // Let the bind fail later with a clear error
        return preferredPort;
    }

    /**
     * Check if a loopback port is available.
     */
    public static boolean isPortAvailable(int port) {
        if (port <= 0 || port > 65535) {
            return false;
        }
        try (ServerSocket socket = new ServerSocket(port, 1, InetAddress.getLoopbackAddress())) {
            socket.setReuseAddress(true);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    /**
     * Builder for AppConfig.
     */
    public static class Builder {
        private Path dataDir = null;
        private Path supervisorsFile = null;
        private int preferredPort = DEFAULT_PORT;
        private boolean devMode = false;
        private String judgeProvider = "anthropic";
        private String judgeModel = "claude-3-5-haiku-20241022";
        private String judgeBaseUrl = null;
        private String judgeApiKey = null;
        private int judgeTimeoutMs = DEFAULT_JUDGE_TIMEOUT_MS;

        public Builder dataDir(String path) {
            if (path != null && !path.isEmpty()) {
                this.dataDir = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder supervisorsFile(String path) {
            if (path != null && !path.isEmpty()) {
                this.supervisorsFile = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder port(int port) {
            this.preferredPort = port;
            return this;
        }

        public Builder devMode(boolean devMode) {
            this.devMode = devMode;
            return this;
        }

        public Builder judgeProvider(String provider) {
            if (provider != null && !provider.isBlank()) {
                this.judgeProvider = provider.trim().toLowerCase();
            }
            return this;
        }

        public Builder judgeModel(String model) {
            if (model != null && !model.isBlank()) {
                this.judgeModel = model.trim();
            }
            return this;
        }

        public Builder judgeBaseUrl(String baseUrl) {
            if (baseUrl != null && !baseUrl.isBlank()) {
                this.judgeBaseUrl = baseUrl.trim();
            }
            return this;
        }

        public Builder judgeApiKey(String apiKey) {
            if (apiKey != null && !apiKey.isBlank()) {
                this.judgeApiKey = apiKey.trim();
            }
            return this;
        }

        public Builder judgeTimeoutMs(int timeoutMs) {
            if (timeoutMs > 0) {
                this.judgeTimeoutMs = timeoutMs;
            }
            return this;
        }

        /**
         * Environment defaults; explicit arguments parsed afterwards win.
         */
        public Builder fromEnvironment() {
            String envPort = System.getenv("OVERSEER_PORT");
            if (envPort != null && !envPort.isBlank()) {
                try {
                    this.preferredPort = Integer.parseInt(envPort.trim());
                } catch (NumberFormatException ignored) {}
            }
            judgeApiKey(System.getenv("OVERSEER_JUDGE_API_KEY"));
            return this;
        }

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                String name;
                String value = null;

                if (!arg.startsWith("--")) {
                    continue;
                }
                int eq = arg.indexOf('=');
                if (eq > 0) {
                    name = arg.substring(2, eq);
                    value = arg.substring(eq + 1);
                } else {
                    name = arg.substring(2);
                    if (!"dev".equals(name) && i + 1 < args.length) {
                        value = args[++i];
                    }
                }

                switch (name) {
                    case "dev":
                        this.devMode = true;
                        break;
                    case "port":
                        try {
                            this.preferredPort = Integer.parseInt(value);
                        } catch (NumberFormatException ignored) {}
                        break;
                    case "data-dir":
                        dataDir(value);
                        break;
                    case "supervisors":
                        supervisorsFile(value);
                        break;
                    case "judge-provider":
                        judgeProvider(value);
                        break;
                    case "judge-model":
                        judgeModel(value);
                        break;
                    case "judge-base-url":
                        judgeBaseUrl(value);
                        break;
                    case "judge-timeout-ms":
                        try {
                            judgeTimeoutMs(Integer.parseInt(value));
                        } catch (NumberFormatException ignored) {}
                        break;
                    default:
                        break;
                }
            }
            return this;
        }

        public AppConfig build() throws IOException {
            Path data = dataDir != null ? dataDir : getDefaultDataDir();
            Files.createDirectories(data);
            int port = preferredPort == 0 ? 0 : findAvailablePort(preferredPort);
            return new AppConfig(this, data, port);
        }
    }
}
