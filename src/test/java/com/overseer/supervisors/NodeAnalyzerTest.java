package com.overseer.supervisors;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.overseer.judge.RuleJudge;
import com.overseer.models.AnalysisContext;
import com.overseer.models.ResultStatus;
import com.overseer.models.Rule;
import com.overseer.models.RuleVerdict;
import com.overseer.models.Severity;
import com.overseer.models.SupervisorConfig;
import com.overseer.models.SupervisorKind;
import com.overseer.models.SupervisorResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class NodeAnalyzerTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private NodeAnalyzer analyzer(RuleJudge judge) {
        return new NodeAnalyzer(judge, executor, new ObjectMapper());
    }

    private static SupervisorNode specialist(String name, Rule... rules) {
        return new SupervisorNode("s-" + name.toLowerCase(), name, SupervisorKind.SPECIALIST,
            Set.of(name.toLowerCase()), List.of(rules), true);
    }

    @Test
    void specialistWithNoViolationsReturnsOk() throws Exception {
        SupervisorNode node = specialist("Security",
            new Rule("r1", "One", Severity.CRITICAL, "check one"),
            new Rule("r2", "Two", Severity.LOW, "check two"),
            new Rule("r3", "Three", Severity.HIGH, "check three"));

        SupervisorResult result = analyzer((text, check, ctx) -> RuleVerdict.passed())
            .analyze(node, "SELECT * FROM users", null);

        assertEquals(ResultStatus.OK, result.getStatus());
        assertNull(result.getSeverity());
        assertEquals(1, node.getCallCount());
        assertEquals(0, node.getAlertCount());
    }

    @Test
    void mostSevereViolationWins() throws Exception {
        SupervisorNode node = specialist("Security",
            new Rule("medium", "Medium rule", Severity.MEDIUM, "check medium"),
            new Rule("critical", "Critical rule", Severity.CRITICAL, "check critical"));

        SupervisorResult result = analyzer((text, check, ctx) -> RuleVerdict.violated("found " + check))
            .analyze(node, "some text", null);

        assertTrue(result.isAlert());
        assertEquals(Severity.CRITICAL, result.getSeverity());
        assertEquals("Critical rule: found check critical", result.getMessage());
        assertEquals(1, node.getAlertCount());
        assertSame(result, node.getLastResult());
    }

    @Test
    void severityTieKeepsFirstRule() throws Exception {
        SupervisorNode node = specialist("Security",
            new Rule("first", "First rule", Severity.HIGH, "a"),
            new Rule("second", "Second rule", Severity.HIGH, "b"));

        SupervisorResult result = analyzer((text, check, ctx) -> RuleVerdict.violated("x"))
            .analyze(node, "text", null);

        assertEquals("First rule: x", result.getMessage());
    }

    @Test
    void failingJudgeCallIsInconclusiveAndSiblingsStillCount() throws Exception {
        SupervisorNode node = specialist("Security",
            new Rule("broken", "Broken rule", Severity.CRITICAL, "boom"),
            new Rule("fine", "Fine rule", Severity.LOW, "ok"));

        RuleJudge judge = (text, check, ctx) -> {
            if ("boom".equals(check)) {
                throw new IOException("connection reset");
            }
            return RuleVerdict.violated("low problem");
        };
        SupervisorResult result = analyzer(judge).analyze(node, "text", null);

        assertTrue(result.isAlert());
        assertEquals(Severity.LOW, result.getSeverity());
        assertEquals("Fine rule: low problem", result.getMessage());
    }

    @Test
    void blankExplanationIsReplaced() throws Exception {
        SupervisorNode node = specialist("Security", new Rule("r", "Rule", Severity.HIGH, "c"));

        SupervisorResult result = analyzer((text, check, ctx) -> RuleVerdict.violated(" "))
            .analyze(node, "text", null);

        assertEquals("Rule: Rule violated", result.getMessage());
    }

    @Test
    void disabledSpecialistSkipsJudge() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        SupervisorNode node = new SupervisorNode("s", "Security", SupervisorKind.SPECIALIST, Set.of("sql"),
            List.of(new Rule("r", "Rule", Severity.HIGH, "c")), false);

        SupervisorResult result = analyzer((text, check, ctx) -> {
            calls.incrementAndGet();
            return RuleVerdict.violated("x");
        }).analyze(node, "sql", null);

        assertEquals(ResultStatus.OK, result.getStatus());
        assertEquals(0, calls.get());
        assertEquals(1, node.getCallCount());
    }

    @Test
    void disabledRulesAreNotSentToJudge() throws Exception {
        Rule off = new Rule("off", "Off", Severity.CRITICAL, "off");
        off.setEnabled(false);
        List<String> checks = new CopyOnWriteArrayList<>();
        SupervisorNode node = specialist("Security", off, new Rule("on", "On", Severity.LOW, "on"));

        analyzer((text, check, ctx) -> {
            checks.add(check);
            return RuleVerdict.passed();
        }).analyze(node, "text", null);

        assertEquals(List.of("on"), checks);
    }

    @Test
    void ruleChecksRunConcurrently() throws Exception {
        CountDownLatch bothStarted = new CountDownLatch(2);
        RuleJudge judge = (text, check, ctx) -> {
            bothStarted.countDown();
            // only true when the sibling call is in flight at the same time
            boolean together = bothStarted.await(2, TimeUnit.SECONDS);
            return together ? RuleVerdict.violated("ok") : RuleVerdict.passed();
        };
        SupervisorNode node = specialist("Security",
            new Rule("a", "A", Severity.HIGH, "a"),
            new Rule("b", "B", Severity.HIGH, "b"));

        SupervisorResult result = analyzer(judge).analyze(node, "text", null);

        assertTrue(result.isAlert());
    }

    @Test
    void contextIsPassedAsJson() throws Exception {
        List<String> contexts = new CopyOnWriteArrayList<>();
        SupervisorNode node = specialist("Security", new Rule("r", "Rule", Severity.HIGH, "c"));

        analyzer((text, check, ctx) -> {
            contexts.add(ctx);
            return RuleVerdict.passed();
        }).analyze(node, "text", new AnalysisContext("build login", null));

        assertEquals(1, contexts.size());
        assertEquals("{\"originalRequest\":\"build login\"}", contexts.get(0));
    }

    @Test
    void evidenceSnippetIsBounded() throws Exception {
        SupervisorNode node = specialist("Security", new Rule("r", "Rule", Severity.HIGH, "c"));
        String text = "x".repeat(300);

        SupervisorResult result = analyzer((t, check, ctx) -> RuleVerdict.violated("y")).analyze(node, text, null);

        assertEquals(NodeAnalyzer.SNIPPET_LENGTH + 3, result.getEvidenceSnippet().length());
        assertTrue(result.getEvidenceSnippet().endsWith("..."));
    }

    @Test
    void routerDelegatesOnlyToMatchingChildren() throws Exception {
        SupervisorTree tree = new SupervisorTree();
        tree.addNode(new SupervisorConfig("tech", "Technical", SupervisorKind.COORDINATOR).keywords("code", "query"));
        tree.addNode(new SupervisorConfig("sec", "Security", SupervisorKind.SPECIALIST).parent("tech")
            .keywords("sql").rule(new Rule("sqli", "SQL injection", Severity.CRITICAL, "sqli")));
        tree.addNode(new SupervisorConfig("ui", "Interface", SupervisorKind.SPECIALIST)
            .keywords("button").rule(new Rule("a11y", "Accessibility", Severity.LOW, "a11y")));

        List<String> checks = new CopyOnWriteArrayList<>();
        RuleJudge judge = (text, check, ctx) -> {
            checks.add(check);
            return RuleVerdict.violated("concatenated");
        };

        SupervisorResult result = analyzer(judge).analyze(tree.getRoot(), "Building the SQL query for the report", null);

        assertTrue(result.isAlert());
        assertEquals(Severity.CRITICAL, result.getSeverity());
        assertEquals("Technical > Security", result.getSupervisorName());
        assertEquals("tech", result.getSupervisorId());
        assertEquals(List.of("sqli"), checks);
        assertEquals(0, tree.findNode("ui").orElseThrow().getCallCount());
        assertEquals(1, tree.findNode("sec").orElseThrow().getAlertCount());
    }

    @Test
    void rootPassesSpecialistResultThroughUnchanged() throws Exception {
        SupervisorTree tree = new SupervisorTree();
        tree.addNode(new SupervisorConfig("sec", "Security", SupervisorKind.SPECIALIST)
            .keywords("sql").rule(new Rule("sqli", "SQL injection", Severity.CRITICAL, "sqli")));

        SupervisorResult result = analyzer((text, check, ctx) -> RuleVerdict.violated("concatenated"))
            .analyze(tree.getRoot(), "Building the SQL query", null);

        assertTrue(result.isAlert());
        assertEquals("Security", result.getSupervisorName());
        assertEquals("sec", result.getSupervisorId());
        assertEquals("SQL injection: concatenated", result.getMessage());
    }

    @Test
    void routerWithoutMatchingChildrenReturnsOk() throws Exception {
        SupervisorTree tree = new SupervisorTree();
        tree.addNode(new SupervisorConfig("sec", "Security", SupervisorKind.SPECIALIST)
            .keywords("sql").rule(new Rule("sqli", "SQL injection", Severity.CRITICAL, "sqli")));

        SupervisorResult result = analyzer((text, check, ctx) -> RuleVerdict.violated("x"))
            .analyze(tree.getRoot(), "Refactoring the navbar", null);

        assertEquals(ResultStatus.OK, result.getStatus());
        assertEquals(1, tree.getRoot().getCallCount());
    }

    @Test
    void keywordMatchIgnoresAccentsAndCase() throws Exception {
        SupervisorTree tree = new SupervisorTree();
        tree.addNode(new SupervisorConfig("val", "Validation", SupervisorKind.SPECIALIST)
            .keywords("validação").rule(new Rule("v", "Validation", Severity.MEDIUM, "v")));

        SupervisorResult result = analyzer((text, check, ctx) -> RuleVerdict.violated("missing"))
            .analyze(tree.getRoot(), "Agora a VALIDACAO do formulario", null);

        assertTrue(result.isAlert());
    }
}
