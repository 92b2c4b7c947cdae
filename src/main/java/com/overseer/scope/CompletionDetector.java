package com.overseer.scope;

import com.overseer.AppLogger;
import com.overseer.models.CompletionMatch;
import com.overseer.models.MatchType;
import com.overseer.models.TaskItem;
import com.overseer.supervisors.TextMatching;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Infers finished task items from the agent's output text.
 * <p>
 * Heuristics run in a fixed order: a global completion phrase, checkbox markers, explicit
 * declarations, list lines and code artifacts. A global phrase matches every open item and
 * stops the other heuristics for that fragment. Each item is reported once per session;
 * later detections of the same item are dropped. Call {@link #reset()} between tasks.
 */
public class CompletionDetector {

    private static final String COMPONENT = "CompletionDetector";
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
    private static final int EVIDENCE_LENGTH = 100;
    private static final int MAX_BUFFER = 100_000;

    static final double GLOBAL_CONFIDENCE = 0.75;
    static final double CHECKBOX_CONFIDENCE = 0.9;
    static final double DECLARATION_CONFIDENCE = 0.85;
    static final double SEQUENCE_CONFIDENCE = 0.8;
    static final double CODE_CONFIDENCE = 0.7;

    private static final List<Pattern> GLOBAL_PATTERNS = List.of(
        Pattern.compile("\\b(?:pronto|terminei|feito|finalizado|conclu[ií]do)[!.]?\\s*$", FLAGS),
        Pattern.compile("\\btudo\\s+(?:pronto|feito|certo|completo)[!.]?\\s*$", FLAGS),
        Pattern.compile("\\b(?:all\\s+done|finished|completed?|that'?s?\\s+(?:it|all|everything))[!.]?\\s*$", FLAGS),
        Pattern.compile("\\btarefas?\\s+(?:conclu[ií]das?|completas?|finalizadas?)[!.]?\\s*$", FLAGS),
        // exclamations count anywhere in the fragment
        Pattern.compile("(?:^|[\\s\"'(])(?:pronto|terminei|tudo\\s+pronto|all\\s+done|finished)!", FLAGS)
    );

    private static final Pattern CHECKBOX_MARKER =
        Pattern.compile("\\[x]|☑|✓|✔|✅|\\bdone\\b|\\bcompleted?\\b", FLAGS);

    private static final List<Pattern> DECLARATION_PATTERNS = List.of(
        Pattern.compile("\\b(?:item|tarefa|task|passo|step)(?:\\s*#?(\\d+)|\\s+([a-z])\\b)\\s*"
            + "(?:conclu[ií]d[oa]|complet[oa]|feit[oa]|done|finished)", FLAGS),
        Pattern.compile("\\b(?:conclu[ií]|completei|fiz|finalizei|terminei)\\s+(?:o\\s+)?(?:item|tarefa|passo)"
            + "(?:\\s*#?(\\d+)|\\s+([a-z])\\b)", FLAGS),
        Pattern.compile("\\b(?:pronto|done|feito|ok)[!:]\\s*(?:(?:item|tarefa)\\s*)?(?:#?(\\d+)|([a-z])\\b)", FLAGS)
    );

    private static final String LINE_DONE = "(?:\\s*[-–—]\\s*(?:done|feito|✓|✔|✅|conclu[ií]do))?\\s*$";

    private static final Pattern NUMBERED_LINE = Pattern.compile("^\\s*(\\d+)\\.\\s+(.+?)" + LINE_DONE,
        FLAGS | Pattern.MULTILINE);
    private static final Pattern LETTERED_LINE = Pattern.compile("^\\s*((?-i:[A-Z]))\\.\\s+(.+?)" + LINE_DONE,
        FLAGS | Pattern.MULTILINE);
    private static final Pattern BULLET_LINE = Pattern.compile("^\\s*[-*•]\\s+(.+?)" + LINE_DONE,
        FLAGS | Pattern.MULTILINE);

    private static final Pattern LINE_DONE_MARKER = Pattern.compile("done|feito|✓|✔|✅|conclu[ií]do", FLAGS);
    private static final Pattern COMPLETION_ANYWHERE = Pattern.compile(
        "pronto|terminei|feito|conclu[ií]|finaliz|tudo certo|all done|finished|completed?|that's it|done with", FLAGS);

    private static final List<Pattern> CODE_PATTERNS = List.of(
        Pattern.compile("\\b(?:criei|created?|adicionei|added)\\s+(?:(?:o|a|the)\\s+)?"
            + "(?:arquivo|file|função|funcao|function|classe|class)\\s+['\"`]?(\\w+)", FLAGS),
        Pattern.compile("\\b(?:implementei|implemented)\\s+(?:(?:o|a|the)\\s+)?"
            + "(?:função|funcao|function|método|metodo|method|classe|class)\\s+['\"`]?(\\w+)", FLAGS),
        Pattern.compile("\\b(?:export\\s+(?:default\\s+)?(?:function|class|const|interface)"
            + "|(?:public|protected|private)\\s+(?:static\\s+)?(?:final\\s+)?(?:class|interface|enum|record)"
            + "|def|fn|func)\\s+(\\w+)")
    );

    private static final Map<String, List<Pattern>> RESOLUTION_PATTERNS = Map.of(
        "claim-without-evidence", List.of(
            Pattern.compile("(?:npm run|mvn|gradle)\\s+(?:compile|build|test|verify)", FLAGS),
            Pattern.compile("tests? pass(?:ed|ing)?", FLAGS),
            Pattern.compile("✓|✔|passed", FLAGS),
            Pattern.compile("output:", FLAGS),
            Pattern.compile("resultado:", FLAGS)),
        "magic-number-display", List.of(
            Pattern.compile("\\.length"),
            Pattern.compile("\\.count"),
            Pattern.compile("\\.size"),
            Pattern.compile("array\\."),
            Pattern.compile("Object\\.keys"),
            Pattern.compile("\\.filter\\("),
            Pattern.compile("\\.reduce\\(")),
        "scope-reduction", List.of(
            Pattern.compile("implement(?:ed|ing)?\\s+all", FLAGS),
            Pattern.compile("todos?\\s+os\\s+itens", FLAGS),
            Pattern.compile("complete(?:d)?\\s+all", FLAGS)),
        "code-without-test", List.of(
            Pattern.compile("(?:npm run|mvn|gradle)\\s+(?:compile|build|test|verify)", FLAGS),
            Pattern.compile("jest|mocha|junit|test", FLAGS),
            Pattern.compile("passed|success", FLAGS)),
        "empty-placeholder", List.of(
            Pattern.compile("return\\s+[^'\"`\\s;]+"),
            Pattern.compile("throw\\s+new"))
    );

    private final StringBuilder responseBuffer = new StringBuilder();
    private final Map<String, CompletionMatch> detected = new LinkedHashMap<>();
    private final List<Consumer<CompletionMatch>> listeners = new CopyOnWriteArrayList<>();

    /**
     * Scan one output fragment against the current items.
     *
     * @return matches for items not reported before in this session, in detection order
     */
    public List<CompletionMatch> processOutput(String output, List<TaskItem> items) {
        if (output == null || output.isEmpty() || items == null || items.isEmpty()) {
            return List.of();
        }
        List<CompletionMatch> fresh = new ArrayList<>();
        synchronized (this) {
            appendToBuffer(output);
            for (CompletionMatch match : detect(output, items)) {
                if (detected.putIfAbsent(match.dedupKey(), match) == null) {
                    fresh.add(match);
                }
            }
        }
        for (CompletionMatch match : fresh) {
            AppLogger.info(COMPONENT, "Completion detected: " + match.getItemName() + " (" + match.getMatchType().value() + ")");
            for (Consumer<CompletionMatch> listener : listeners) {
                deliverSafely(listener, match);
            }
        }
        return fresh;
    }

    List<CompletionMatch> detect(String output, List<TaskItem> items) {
        List<CompletionMatch> global = detectGlobalCompletion(output, items);
        if (!global.isEmpty()) {
            return global;
        }
        List<CompletionMatch> matches = new ArrayList<>();
        matches.addAll(detectCheckboxCompletions(output, items));
        matches.addAll(detectDeclarationCompletions(output, items));
        matches.addAll(detectSequenceCompletions(output, items));
        matches.addAll(detectCodeCompletions(output, items));
        return matches;
    }

    private List<CompletionMatch> detectGlobalCompletion(String output, List<TaskItem> items) {
        String trimmed = output.trim();
        boolean global = false;
        for (Pattern pattern : GLOBAL_PATTERNS) {
            if (pattern.matcher(trimmed).find()) {
                global = true;
                break;
            }
        }
        if (!global) {
            return List.of();
        }
        String evidence = trimmed.length() > EVIDENCE_LENGTH
            ? trimmed.substring(trimmed.length() - EVIDENCE_LENGTH)
            : trimmed;
        List<CompletionMatch> matches = new ArrayList<>();
        for (TaskItem item : items) {
            if (!item.isCompleted()) {
                matches.add(CompletionMatch.forItem(item, evidence, GLOBAL_CONFIDENCE, MatchType.GLOBAL));
            }
        }
        return matches;
    }

    private List<CompletionMatch> detectCheckboxCompletions(String output, List<TaskItem> items) {
        List<CompletionMatch> matches = new ArrayList<>();
        for (String line : output.split("\n")) {
            if (!CHECKBOX_MARKER.matcher(line).find()) {
                continue;
            }
            String normalizedLine = normalizeForMatch(line);
            for (TaskItem item : items) {
                if (item.isCompleted()) {
                    continue;
                }
                String itemName = normalizeForMatch(item.getName());
                if (itemName.isEmpty()) {
                    continue;
                }
                if (normalizedLine.contains(itemName) || similarity(normalizedLine, itemName) > 0.7) {
                    matches.add(CompletionMatch.forItem(item, line.trim(), CHECKBOX_CONFIDENCE, MatchType.CHECKBOX));
                }
            }
        }
        return matches;
    }

    private List<CompletionMatch> detectDeclarationCompletions(String output, List<TaskItem> items) {
        List<CompletionMatch> matches = new ArrayList<>();
        for (Pattern pattern : DECLARATION_PATTERNS) {
            Matcher m = pattern.matcher(output);
            while (m.find()) {
                TaskItem item = resolveByIndex(m.group(1) != null ? m.group(1) : m.group(2), items);
                if (item != null && !item.isCompleted()) {
                    matches.add(CompletionMatch.forItem(item, m.group(), DECLARATION_CONFIDENCE, MatchType.DECLARATION));
                }
            }
        }
        return matches;
    }

    private List<CompletionMatch> detectSequenceCompletions(String output, List<TaskItem> items) {
        boolean globalPhrase = COMPLETION_ANYWHERE.matcher(output).find();
        List<CompletionMatch> matches = new ArrayList<>();
        collectSequence(NUMBERED_LINE, true, output, items, globalPhrase, matches);
        collectSequence(LETTERED_LINE, true, output, items, globalPhrase, matches);
        collectSequence(BULLET_LINE, false, output, items, globalPhrase, matches);
        return matches;
    }

    private void collectSequence(Pattern pattern, boolean indexed, String output, List<TaskItem> items,
                                 boolean globalPhrase, List<CompletionMatch> matches) {
        Matcher m = pattern.matcher(output);
        while (m.find()) {
            String line = m.group();
            if (!globalPhrase && !LINE_DONE_MARKER.matcher(line).find()) {
                continue;
            }
            String content = indexed ? m.group(2) : m.group(1);
            TaskItem item = indexed ? resolveByIndex(m.group(1), items) : null;
            if (item == null) {
                item = bestFuzzyMatch(content, items, 0.6);
            }
            if (item != null && !item.isCompleted()) {
                matches.add(CompletionMatch.forItem(item, line.trim(), SEQUENCE_CONFIDENCE, MatchType.SEQUENCE));
            }
        }
    }

    private List<CompletionMatch> detectCodeCompletions(String output, List<TaskItem> items) {
        List<CompletionMatch> matches = new ArrayList<>();
        for (Pattern pattern : CODE_PATTERNS) {
            Matcher m = pattern.matcher(output);
            while (m.find()) {
                String codeName = normalizeForMatch(m.group(1));
                if (codeName.length() <= 2) {
                    continue;
                }
                for (TaskItem item : items) {
                    if (item.isCompleted()) {
                        continue;
                    }
                    String itemName = normalizeForMatch(item.getName());
                    if (itemName.isEmpty()) {
                        continue;
                    }
                    if (itemName.contains(codeName) || codeName.contains(itemName)
                        || similarity(itemName, codeName) > 0.5) {
                        matches.add(CompletionMatch.forItem(item, m.group(), CODE_CONFIDENCE, MatchType.CODE));
                    }
                }
            }
        }
        return matches;
    }

    /**
     * Numbers are 1-based positions; a single letter maps A to the first item.
     */
    private static TaskItem resolveByIndex(String identifier, List<TaskItem> items) {
        if (identifier == null || identifier.isEmpty()) {
            return null;
        }
        int index;
        if (Character.isDigit(identifier.charAt(0))) {
            try {
                index = Integer.parseInt(identifier) - 1;
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            index = Character.toUpperCase(identifier.charAt(0)) - 'A';
        }
        return index >= 0 && index < items.size() ? items.get(index) : null;
    }

    private static TaskItem bestFuzzyMatch(String content, List<TaskItem> items, double threshold) {
        String normalizedContent = normalizeForMatch(content);
        for (TaskItem item : items) {
            if (!item.isCompleted() && similarity(normalizedContent, normalizeForMatch(item.getName())) > threshold) {
                return item;
            }
        }
        return null;
    }

    static String normalizeForMatch(String text) {
        return TextMatching.normalize(text).replaceAll("[^a-z0-9\\s]", "").trim();
    }

    /**
     * Jaccard similarity of the word sets, ignoring words of two characters or less.
     */
    static double similarity(String a, String b) {
        Set<String> wordsA = significantWords(a);
        Set<String> wordsB = significantWords(b);
        if (wordsA.isEmpty() || wordsB.isEmpty()) {
            return 0;
        }
        Set<String> intersection = new HashSet<>(wordsA);
        intersection.retainAll(wordsB);
        Set<String> union = new HashSet<>(wordsA);
        union.addAll(wordsB);
        return (double) intersection.size() / union.size();
    }

    private static Set<String> significantWords(String text) {
        Set<String> words = new HashSet<>();
        for (String word : text.split("\\s+")) {
            if (word.length() > 2) {
                words.add(word);
            }
        }
        return words;
    }

    /**
     * Whether the output shows the problem behind an alert type was addressed.
     * Unknown alert types never resolve.
     */
    public boolean checkAlertResolution(String output, String alertType) {
        if (output == null || alertType == null) {
            return false;
        }
        for (Pattern pattern : RESOLUTION_PATTERNS.getOrDefault(alertType, List.of())) {
            if (pattern.matcher(output).find()) {
                return true;
            }
        }
        return false;
    }

    private void appendToBuffer(String output) {
        responseBuffer.append(output);
        if (responseBuffer.length() > MAX_BUFFER) {
            responseBuffer.delete(0, responseBuffer.length() - MAX_BUFFER);
        }
    }

    public synchronized String getResponseBuffer() {
        return responseBuffer.toString();
    }

    public synchronized List<CompletionMatch> getDetectedCompletions() {
        return new ArrayList<>(detected.values());
    }

    public synchronized void reset() {
        responseBuffer.setLength(0);
        detected.clear();
    }

    public Runnable addListener(Consumer<CompletionMatch> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    private void deliverSafely(Consumer<CompletionMatch> listener, CompletionMatch match) {
        try {
            listener.accept(match);
        } catch (Exception e) {
            AppLogger.warn(COMPONENT, "Listener threw while handling " + match.getItemName() + ": " + e.getMessage());
        }
    }
}
