package com.overseer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.overseer.analysis.AnalysisScheduler;
import com.overseer.controllers.HookController;
import com.overseer.controllers.SessionController;
import com.overseer.controllers.SupervisorController;
import com.overseer.judge.ChatRuleJudge;
import com.overseer.judge.RuleJudge;
import com.overseer.models.JudgeEndpointConfig;
import com.overseer.providers.chat.ChatProviderFactory;
import com.overseer.scope.CompletionDetector;
import com.overseer.scope.TaskScope;
import com.overseer.supervisors.BehaviorSupervisor;
import com.overseer.supervisors.DefaultHierarchy;
import com.overseer.supervisors.NodeAnalyzer;
import com.overseer.supervisors.SupervisorConfigLoader;
import com.overseer.supervisors.SupervisorTree;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

public class Main {

    private static final String VERSION = "1.0.0";
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static AppLogger logger;

    public static void main(String[] args) {
        try {
            // Parse configuration from args and environment
            AppConfig config = new AppConfig.Builder()
                    .fromEnvironment()
                    .parseArgs(args)
                    .build();

            // Initialize logging
            AppLogger.initialize(config.getLogPath(), config.isDevMode());
            logger = AppLogger.get();

            printBanner(config);

            // Supervisor hierarchy
            SupervisorTree tree = new SupervisorTree();
            List<String> configErrors = new ArrayList<>();
            if (config.getSupervisorsFile() != null) {
                SupervisorConfigLoader.ConfigLoadResult loaded = new SupervisorConfigLoader().load(config.getSupervisorsFile());
                configErrors.addAll(loaded.getErrors());
                configErrors.addAll(tree.addAll(loaded.getConfigs()));
            } else {
                configErrors.addAll(DefaultHierarchy.install(tree));
            }
            for (String error : configErrors) {
                logger.warn("Supervisor config: " + error);
            }
            logger.info("Supervisor tree ready: " + (tree.size() - 1) + " supervisor(s)");

            // Rule judge
            JudgeEndpointConfig endpoint = new JudgeEndpointConfig();
            endpoint.setProvider(config.getJudgeProvider());
            endpoint.setModel(config.getJudgeModel());
            endpoint.setBaseUrl(config.getJudgeBaseUrl());
            endpoint.setTimeoutMs(config.getJudgeTimeoutMs());
            ChatProviderFactory providers = new ChatProviderFactory(objectMapper);
            RuleJudge judge = new ChatRuleJudge(providers.getProvider(config.getJudgeProvider()), endpoint,
                config.getJudgeApiKey(), objectMapper);
            if (config.getJudgeApiKey() == null && !"ollama".equals(config.getJudgeProvider())) {
                logger.warn("No judge API key set (OVERSEER_JUDGE_API_KEY); rule checks will be inconclusive");
            }

            ExecutorService judgeExecutor = Executors.newCachedThreadPool(judgeThreadFactory());
            NodeAnalyzer analyzer = new NodeAnalyzer(judge, judgeExecutor, objectMapper);
            BehaviorSupervisor behavior = new BehaviorSupervisor(judge, judgeExecutor, objectMapper);

            // Session state
            AlertHistory alertHistory = new AlertHistory(config.getAlertHistoryPath());
            AnalysisScheduler scheduler = new AnalysisScheduler(tree, analyzer, behavior, alertHistory,
                config.getAnalysisTimeoutMs());
            TaskScope scope = new TaskScope();
            CompletionDetector detector = new CompletionDetector();
            detector.addListener(scope::applyCompletion);
            StopGate stopGate = new StopGate(scope, alertHistory);

            HookServer server = new HookServer(objectMapper, List.of(
                new HookController(stopGate, objectMapper),
                new SupervisorController(tree, alertHistory),
                new SessionController(scheduler, scope, detector, objectMapper)
            ));
            int port = server.start(config.getPort());

            logger.console("");
            logger.console("  Listening on http://" + HookServer.HOST + ":" + port + "/");
            logger.console("  Data dir: " + config.getDataDir());
            logger.console("  Log file: " + config.getLogPath());
            logger.console("  Judge: " + config.getJudgeProvider() + " / " + config.getJudgeModel());
            logger.console("");
            logger.console("========================================");
            logger.console("  Press Ctrl+C to stop");
            logger.console("========================================");

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                server.stop();
                scheduler.shutdown();
                judgeExecutor.shutdownNow();
                logger.close();
            }));

        } catch (Exception e) {
            System.err.println("Failed to start Overseer: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  Overseer v" + VERSION);
        logger.console("========================================");
        logger.console("  Starting hook server...");
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
    }

    private static ThreadFactory judgeThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "overseer-judge-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
