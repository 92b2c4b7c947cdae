package com.overseer.supervisors;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TextMatchingTest {

    @Test
    void normalizeStripsAccentsAndCase() {
        assertEquals("validacao concluida", TextMatching.normalize("Validação CONCLUÍDA"));
        assertEquals("", TextMatching.normalize(null));
    }

    @Test
    void findKeywordReturnsFirstMatchingKeyword() {
        assertEquals("função", TextMatching.findKeyword("Vou criar a FUNCAO de login", List.of("classe", "função")));
        assertNull(TextMatching.findKeyword("nothing here", List.of("sql", " ")));
        assertFalse(TextMatching.containsAny("text", List.of()));
    }

    @Test
    void shortTextIsReturnedWhole() {
        assertEquals("short text.", TextMatching.extractSnippet("short text.", 100));
    }

    @Test
    void snippetPrefersSentenceBoundaryPastMidpoint() {
        String text = "a".repeat(60) + ". " + "b".repeat(80);
        assertEquals("a".repeat(60) + ".", TextMatching.extractSnippet(text, 100));
    }

    @Test
    void snippetFallsBackToCommaThenHardCut() {
        String withComma = "a".repeat(70) + ", " + "b".repeat(80);
        assertEquals("a".repeat(70) + "...", TextMatching.extractSnippet(withComma, 100));

        String early = "a".repeat(10) + ". " + "b".repeat(200);
        String cut = TextMatching.extractSnippet(early, 100);
        assertEquals(103, cut.length());
        assertTrue(cut.endsWith("..."));
    }

    @Test
    void snippetAroundCentersOnPhrase() {
        String text = "x".repeat(100) + " vou fazer só essa parte " + "y".repeat(100);
        String snippet = TextMatching.snippetAround(text, "vou fazer so", 10);

        assertTrue(snippet.startsWith("..."));
        assertTrue(snippet.endsWith("..."));
        assertTrue(snippet.contains("vou fazer só"));
    }
}
