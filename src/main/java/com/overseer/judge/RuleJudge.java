package com.overseer.judge;

import com.overseer.models.RuleVerdict;

import java.io.IOException;

/**
 * Decides whether a piece of text violates a natural-language check.
 * Implementations must tolerate repeated and concurrent calls.
 */
@FunctionalInterface
public interface RuleJudge {

    /**
     * @param text the reasoning text under review
     * @param checkInstruction what to look for
     * @param contextJson optional JSON with extra context; may be null
     */
    RuleVerdict checkRule(String text, String checkInstruction, String contextJson)
        throws IOException, InterruptedException;
}
