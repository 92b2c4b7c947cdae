package com.overseer.supervisors;

import java.text.Normalizer;
import java.util.Collection;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Accent- and case-insensitive text helpers shared by the supervisors.
 */
public final class TextMatching {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    private TextMatching() {
    }

    /**
     * Lowercase and strip diacritics.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("").toLowerCase(Locale.ROOT);
    }

    /**
     * First keyword found in the text, or null.
     */
    public static String findKeyword(String text, Collection<String> keywords) {
        if (keywords == null || keywords.isEmpty()) {
            return null;
        }
        String haystack = normalize(text);
        for (String keyword : keywords) {
            if (keyword == null || keyword.isBlank()) {
                continue;
            }
            if (haystack.contains(normalize(keyword))) {
                return keyword;
            }
        }
        return null;
    }

    public static boolean containsAny(String text, Collection<String> keywords) {
        return findKeyword(text, keywords) != null;
    }

    /**
     * Leading extract of at most maxLength characters. Cuts after the last period past the
     * midpoint, else at the last comma past the midpoint (with an ellipsis), else hard.
     */
    public static String extractSnippet(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        String truncated = text.substring(0, maxLength);
        int lastPeriod = truncated.lastIndexOf('.');
        int lastComma = truncated.lastIndexOf(',');

        if (lastPeriod > maxLength / 2) {
            return truncated.substring(0, lastPeriod + 1);
        } else if (lastComma > maxLength / 2) {
            return truncated.substring(0, lastComma) + "...";
        }
        return truncated + "...";
    }

    /**
     * Window of text around the first occurrence of a phrase.
     */
    public static String snippetAround(String text, String phrase, int contextSize) {
        if (text == null) {
            return "";
        }
        int index = phrase == null ? -1 : normalize(text).indexOf(normalize(phrase));
        if (index < 0 || index >= text.length()) {
            return extractSnippet(text, 100);
        }
        int start = Math.max(0, index - contextSize);
        int end = Math.min(text.length(), index + phrase.length() + contextSize);
        String snippet = text.substring(start, end);
        if (start > 0) {
            snippet = "..." + snippet;
        }
        if (end < text.length()) {
            snippet = snippet + "...";
        }
        return snippet;
    }
}
