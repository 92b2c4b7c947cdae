package com.overseer.judge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.overseer.models.JudgeEndpointConfig;
import com.overseer.models.RuleVerdict;
import com.overseer.providers.chat.ChatProvider;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChatRuleJudgeTest {

    private static class ScriptedProvider implements ChatProvider {
        private final String reply;
        private final List<String> systemPrompts = new ArrayList<>();
        private final List<String> messages = new ArrayList<>();

        ScriptedProvider(String reply) {
            this.reply = reply;
        }

        @Override
        public String getProviderName() {
            return "scripted";
        }

        @Override
        public String chat(String apiKey, JudgeEndpointConfig endpoint, String systemPrompt, String message)
            throws IOException {
            if (reply == null) {
                throw new IOException("Chat request failed (503)");
            }
            systemPrompts.add(systemPrompt);
            messages.add(message);
            return reply;
        }
    }

    private static ChatRuleJudge judge(ScriptedProvider provider) {
        return new ChatRuleJudge(provider, new JudgeEndpointConfig(), "key", new ObjectMapper());
    }

    @Test
    void violatedVerdictInsideProse() throws Exception {
        ScriptedProvider provider = new ScriptedProvider(
            "Sure.\n```json\n{\"violated\": true, \"explanation\": \"query built with {id} concatenation\"}\n```");

        RuleVerdict verdict = judge(provider).checkRule("SELECT ...", "Detect SQL injection", "{\"originalRequest\":\"x\"}");

        assertTrue(verdict.isViolated());
        assertEquals("query built with {id} concatenation", verdict.getExplanation());
        assertTrue(provider.systemPrompts.get(0).contains("Rule: Detect SQL injection"));
        assertTrue(provider.systemPrompts.get(0).contains("Additional context: {\"originalRequest\":\"x\"}"));
    }

    @Test
    void passedVerdict() throws Exception {
        RuleVerdict verdict = judge(new ScriptedProvider("{\"violated\": false}")).checkRule("t", "c", null);

        assertFalse(verdict.isViolated());
    }

    @Test
    void unparseableReplyCountsAsPassed() throws Exception {
        assertFalse(judge(new ScriptedProvider("I think it is fine")).checkRule("t", "c", null).isViolated());
        assertFalse(judge(new ScriptedProvider("{\"violated\": tru")).checkRule("t", "c", null).isViolated());
        assertFalse(judge(new ScriptedProvider("{violated: yes}")).checkRule("t", "c", null).isViolated());
    }

    @Test
    void missingExplanationIsFilledIn() throws Exception {
        RuleVerdict verdict = judge(new ScriptedProvider("{\"violated\": true}")).checkRule("t", "c", null);

        assertEquals("Rule violated", verdict.getExplanation());
    }

    @Test
    void providerFailurePropagates() {
        assertThrows(IOException.class, () -> judge(new ScriptedProvider(null)).checkRule("t", "c", null));
    }

    @Test
    void longTextIsTruncated() throws Exception {
        ScriptedProvider provider = new ScriptedProvider("{\"violated\": false}");

        judge(provider).checkRule("y".repeat(ChatRuleJudge.MAX_TEXT_LENGTH + 500), "c", null);

        assertEquals(ChatRuleJudge.MAX_TEXT_LENGTH, provider.messages.get(0).length());
    }

    @Test
    void extractJsonObjectHandlesNestingAndStrings() {
        assertEquals("{\"a\":{\"b\":\"}\"}}", ChatRuleJudge.extractJsonObject("x {\"a\":{\"b\":\"}\"}} y"));
        assertNull(ChatRuleJudge.extractJsonObject("no braces"));
        assertNull(ChatRuleJudge.extractJsonObject("{\"open\": true"));
        assertNull(ChatRuleJudge.extractJsonObject(null));
    }

    @Test
    void systemPromptOmitsBlankContext() {
        String prompt = ChatRuleJudge.buildSystemPrompt("Detect XSS", " ");

        assertTrue(prompt.contains("Rule: Detect XSS"));
        assertFalse(prompt.contains("Additional context"));
    }
}
