package com.overseer.supervisors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.overseer.AppLogger;
import com.overseer.judge.RuleJudge;
import com.overseer.models.AnalysisContext;
import com.overseer.models.Rule;
import com.overseer.models.RuleVerdict;
import com.overseer.models.SupervisorKind;
import com.overseer.models.SupervisorResult;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Runs the analysis of a node according to its kind.
 * <p>
 * Specialists send every enabled rule to the judge at once and wait for all verdicts
 * before ranking. Routers and coordinators evaluate their own rules, then descend into
 * enabled children whose keywords appear in the text, and report the most severe alert.
 * Coordinators prefix the winning child's name with their own; the root router passes the
 * delegate's result on unchanged.
 * A judge failure on one rule is logged and counted as inconclusive; the other verdicts
 * for the chunk still count.
 */
public class NodeAnalyzer {

    public static final int SNIPPET_LENGTH = 100;
    private static final String COMPONENT = "NodeAnalyzer";

    private final RuleJudge judge;
    private final Executor judgeExecutor;
    private final ObjectMapper mapper;

    public NodeAnalyzer(RuleJudge judge, Executor judgeExecutor, ObjectMapper mapper) {
        this.judge = judge;
        this.judgeExecutor = judgeExecutor;
        this.mapper = mapper;
    }

    public SupervisorResult analyze(SupervisorNode node, String text, AnalysisContext context)
        throws InterruptedException {
        long startedAt = System.currentTimeMillis();
        SupervisorResult result;
        if (node.getKind() == SupervisorKind.SPECIALIST) {
            result = analyzeSpecialist(node, text, context, startedAt);
        } else {
            result = analyzeComposite(node, text, context, startedAt);
        }
        node.recordResult(result);
        return result;
    }

    private SupervisorResult analyzeSpecialist(SupervisorNode node, String text, AnalysisContext context,
                                               long startedAt) throws InterruptedException {
        if (!node.isEnabled()) {
            return SupervisorResult.ok(node.getId(), node.getName(), startedAt);
        }
        SupervisorResult own = evaluateOwnRules(node, text, context, startedAt);
        return own != null ? own : SupervisorResult.ok(node.getId(), node.getName(), startedAt);
    }

    private SupervisorResult analyzeComposite(SupervisorNode node, String text, AnalysisContext context,
                                              long startedAt) throws InterruptedException {
        if (!node.isEnabled()) {
            return SupervisorResult.ok(node.getId(), node.getName(), startedAt);
        }

        SupervisorResult winner = evaluateOwnRules(node, text, context, startedAt);
        String winnerPath = node.getName();
        boolean fromChild = false;

        for (SupervisorNode child : node.getChildren()) {
            if (!child.isEnabled() || !TextMatching.containsAny(text, child.getKeywords())) {
                continue;
            }
            SupervisorResult childResult = analyze(child, text, context);
            if (childResult.isAlert()
                && (winner == null || childResult.getSeverity().outranks(winner.getSeverity()))) {
                winner = childResult;
                winnerPath = node.getName() + " > " + childResult.getSupervisorName();
                fromChild = true;
            }
        }

        if (winner == null) {
            return SupervisorResult.ok(node.getId(), node.getName(), startedAt);
        }
        if (fromChild && node.getKind() == SupervisorKind.ROUTER) {
            // the root hands the delegate's result on as is
            return winner;
        }
        return SupervisorResult.alert(node.getId(), winnerPath, winner.getSeverity(),
            winner.getMessage(), winner.getEvidenceSnippet(), startedAt);
    }

    /**
     * Most severe violation among the node's enabled rules, or null when none fired.
     */
    private SupervisorResult evaluateOwnRules(SupervisorNode node, String text, AnalysisContext context,
                                              long startedAt) throws InterruptedException {
        List<Rule> rules = node.getEnabledRules();
        if (rules.isEmpty()) {
            return null;
        }

        String contextJson = toJson(context);
        List<CompletableFuture<RuleOutcome>> checks = new ArrayList<>();
        for (Rule rule : rules) {
            checks.add(CompletableFuture.supplyAsync(() -> judgeRule(node, rule, text, contextJson), judgeExecutor));
        }

        try {
            CompletableFuture.allOf(checks.toArray(new CompletableFuture[0])).get();
        } catch (ExecutionException e) {
            // judgeRule never completes exceptionally; kept for the checked signature
            AppLogger.error(COMPONENT, "Rule batch failed for " + node.getId(), e);
        }

        RuleOutcome mostSevere = null;
        int inconclusive = 0;
        for (CompletableFuture<RuleOutcome> check : checks) {
            RuleOutcome outcome = check.getNow(RuleOutcome.INCONCLUSIVE);
            if (outcome.inconclusive) {
                inconclusive++;
                continue;
            }
            if (!outcome.violated) {
                continue;
            }
            // strict comparison keeps the first rule on ties
            if (mostSevere == null || outcome.rule.getSeverity().outranks(mostSevere.rule.getSeverity())) {
                mostSevere = outcome;
            }
        }
        if (inconclusive > 0) {
            AppLogger.warn(COMPONENT, node.getName() + ": " + inconclusive + " of " + rules.size()
                + " rule check(s) inconclusive");
        }

        if (mostSevere == null) {
            return null;
        }
        return SupervisorResult.alert(
            node.getId(),
            node.getName(),
            mostSevere.rule.getSeverity(),
            mostSevere.rule.getDescription() + ": " + mostSevere.explanation,
            TextMatching.extractSnippet(text, SNIPPET_LENGTH),
            startedAt
        );
    }

    private RuleOutcome judgeRule(SupervisorNode node, Rule rule, String text, String contextJson) {
        try {
            RuleVerdict verdict = judge.checkRule(text, rule.getCheck(), contextJson);
            if (verdict == null || !verdict.isViolated()) {
                return new RuleOutcome(rule, false, null, false);
            }
            String explanation = verdict.getExplanation();
            if (explanation == null || explanation.isBlank()) {
                explanation = "Rule violated";
            }
            return new RuleOutcome(rule, true, explanation, false);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return RuleOutcome.INCONCLUSIVE;
        } catch (IOException | RuntimeException e) {
            AppLogger.warn(COMPONENT, "Judge failed on rule " + rule.getId() + " of " + node.getId()
                + ": " + e.getMessage());
            return RuleOutcome.INCONCLUSIVE;
        }
    }

    private String toJson(AnalysisContext context) {
        if (context == null) {
            return null;
        }
        try {
            return mapper.writeValueAsString(context);
        } catch (JsonProcessingException e) {
            AppLogger.warn(COMPONENT, "Could not serialize analysis context: " + e.getMessage());
            return null;
        }
    }

    private static final class RuleOutcome {
        static final RuleOutcome INCONCLUSIVE = new RuleOutcome(null, false, null, true);

        final Rule rule;
        final boolean violated;
        final String explanation;
        final boolean inconclusive;

        RuleOutcome(Rule rule, boolean violated, String explanation, boolean inconclusive) {
            this.rule = rule;
            this.violated = violated;
            this.explanation = explanation;
            this.inconclusive = inconclusive;
        }
    }
}
