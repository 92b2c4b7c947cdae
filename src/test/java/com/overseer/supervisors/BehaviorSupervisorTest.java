package com.overseer.supervisors;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.overseer.judge.RuleJudge;
import com.overseer.models.AnalysisContext;
import com.overseer.models.ResultStatus;
import com.overseer.models.RuleVerdict;
import com.overseer.models.Severity;
import com.overseer.models.SupervisorResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class BehaviorSupervisorTest {

    private static final AnalysisContext CONTEXT = new AnalysisContext("Implement login, signup and logout", "1/3");

    private final ExecutorService executor = Executors.newFixedThreadPool(3);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private BehaviorSupervisor supervisor(RuleJudge judge) {
        return new BehaviorSupervisor(judge, executor, new ObjectMapper());
    }

    @Test
    void neutralTextIsOkWithoutJudgeCalls() throws Exception {
        List<String> checks = new CopyOnWriteArrayList<>();
        BehaviorSupervisor behavior = supervisor((text, check, ctx) -> {
            checks.add(check);
            return RuleVerdict.violated("x");
        });

        SupervisorResult result = behavior.analyze("Reading the auth module to understand sessions", CONTEXT);

        assertEquals(ResultStatus.OK, result.getStatus());
        assertTrue(checks.isEmpty());
        assertEquals(1, behavior.getCallCount());
    }

    @Test
    void confirmedScopeReductionIsHigh() throws Exception {
        BehaviorSupervisor behavior = supervisor((text, check, ctx) ->
            BehaviorSupervisor.SCOPE_CHECK.equals(check) ? RuleVerdict.violated("only login") : RuleVerdict.passed());

        SupervisorResult result = behavior.analyze("Vou fazer só o login agora", CONTEXT);

        assertTrue(result.isAlert());
        assertEquals(Severity.HIGH, result.getSeverity());
        assertEquals("Scope reduction detected: only login", result.getMessage());
        assertTrue(result.getEvidenceSnippet().contains("fazer só"));
    }

    @Test
    void scopeReductionNeedsJudgeConfirmation() throws Exception {
        BehaviorSupervisor behavior = supervisor((text, check, ctx) -> RuleVerdict.passed());

        SupervisorResult result = behavior.analyze("Vou fazer só o login agora", CONTEXT);

        assertEquals(ResultStatus.OK, result.getStatus());
    }

    @Test
    void procrastinationIsMediumWithoutJudge() throws Exception {
        List<String> checks = new CopyOnWriteArrayList<>();
        BehaviorSupervisor behavior = supervisor((text, check, ctx) -> {
            checks.add(check);
            return RuleVerdict.passed();
        });

        SupervisorResult result = behavior.analyze("O logout eu deixo pra depois", CONTEXT);

        assertTrue(result.isAlert());
        assertEquals(Severity.MEDIUM, result.getSeverity());
        assertTrue(checks.isEmpty());
    }

    @Test
    void highBeatsMedium() throws Exception {
        BehaviorSupervisor behavior = supervisor((text, check, ctx) -> RuleVerdict.violated("signup missing"));

        SupervisorResult result = behavior.analyze("Pronto, o resto fica para mais tarde", CONTEXT);

        assertEquals(Severity.HIGH, result.getSeverity());
        assertTrue(result.getMessage().startsWith("Task declared complete but may be incomplete"));
        assertEquals(1, behavior.getAlertCount());
    }

    @Test
    void disabledChecksDoNotRun() throws Exception {
        BehaviorSupervisor behavior = supervisor((text, check, ctx) -> RuleVerdict.violated("x"));
        behavior.setDetectProcrastination(false);
        behavior.setVerifyCompleteness(false);
        behavior.setDetectScopeReduction(false);

        SupervisorResult result = behavior.analyze("Pronto, deixo pra depois o resto por enquanto", CONTEXT);

        assertEquals(ResultStatus.OK, result.getStatus());
    }

    @Test
    void judgeFailureMakesCheckInconclusive() throws Exception {
        BehaviorSupervisor behavior = supervisor((text, check, ctx) -> {
            throw new IOException("offline");
        });

        SupervisorResult result = behavior.analyze("Terminei tudo", CONTEXT);

        assertEquals(ResultStatus.OK, result.getStatus());
    }

    @Test
    void judgeReceivesOriginalRequest() throws Exception {
        List<String> contexts = new CopyOnWriteArrayList<>();
        BehaviorSupervisor behavior = supervisor((text, check, ctx) -> {
            contexts.add(ctx);
            return RuleVerdict.passed();
        });

        behavior.analyze("Terminei", CONTEXT);

        assertEquals(1, contexts.size());
        assertTrue(contexts.get(0).contains("Implement login, signup and logout"));
    }
}
