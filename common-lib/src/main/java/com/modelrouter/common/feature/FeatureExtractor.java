package com.modelrouter.common.feature;

import com.modelrouter.common.model.ConversationTurn;
import com.modelrouter.common.model.QueryFeatures;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Pure stateless transform from a prompt (plus its most recent turns) to {@link QueryFeatures}.
 *
 * <p>Feature rules:
 * <ol>
 *   <li>estimatedTokens : characters of prompt + bounded context / {@value #CHARS_PER_TOKEN}, rounded up</li>
 *   <li>hasCode / codeLineCount: lines inside ``` fences, plus unfenced lines that look like code</li>
 *   <li>domainKeywords  : vocabulary hits from {@link #DOMAIN_VOCABULARY}, sorted</li>
 *   <li>toolUseNeeded   : any phrase from {@link #TOOL_PHRASES} in the prompt</li>
 *   <li>conversationDepth: number of prior turns supplied (not only the bounded window)</li>
 *   <li>complexity      : weighted blend of length, reasoning markers, code, multi-part asks, breadth</li>
 *   <li>ambiguity       : short prompts and vague referents score high; concrete asks score low</li>
 * </ol>
 *
 * <p>No network I/O, no logging, no clock. Identical input always yields identical output.
 */
public final class FeatureExtractor {

    /** Only the last N context turns contribute text; older turns only count towards depth. */
    public static final int MAX_CONTEXT_TURNS = 8;

    static final int CHARS_PER_TOKEN = 4;

    private static final Pattern WORD_SPLIT = Pattern.compile("[^a-z0-9+#_-]+");
    private static final Pattern CODE_LINE = Pattern.compile(
        "^\\s*(def |class |import |from \\S+ import|public |private |function |const |let |var |#include|package |return\\b|if \\(|for \\(|while \\().*"
            + "|.*[;{}]\\s*$");

    static final Map<String, Set<String>> DOMAIN_VOCABULARY = Map.of(
        "programming", Set.of("code", "function", "bug", "compile", "java", "python", "javascript",
                              "typescript", "rust", "sql", "api", "refactor", "debug", "stacktrace",
                              "class", "method", "regex", "unit", "test"),
        "math",        Set.of("equation", "integral", "derivative", "prove", "proof", "theorem",
                              "matrix", "probability", "calculate", "algebra"),
        "writing",     Set.of("essay", "story", "poem", "rewrite", "tone", "blog", "article",
                              "summarize", "summary", "email", "draft"),
        "analysis",    Set.of("analyze", "analyse", "compare", "evaluate", "tradeoff", "trade-off",
                              "pros", "cons", "data", "trend", "report"),
        "translation", Set.of("translate", "translation", "french", "spanish", "german",
                              "japanese", "chinese")
    );

    private static final List<String> TOOL_PHRASES = List.of(
        "search the web", "look up", "browse", "fetch ", "download", "run this", "execute",
        "call the api", "latest news", "current price", "today's", "weather", "open the file",
        "read the file", "use the tool");

    private static final List<String> REASONING_MARKERS = List.of(
        "why", "explain", "step by step", "prove", "derive", "design", "architecture",
        "optimize", "trade-off", "tradeoff", "compare", "reason");

    private static final Set<String> VAGUE_WORDS = Set.of(
        "it", "this", "that", "thing", "things", "stuff", "something", "somehow", "whatever",
        "etc", "maybe", "some");

    private FeatureExtractor() {}

    /**
     * Extract features from a prompt and its conversation context.
     *
     * @param prompt  the current user prompt; null is treated as empty
     * @param context prior turns, oldest first; null is treated as empty
     * @return populated {@link QueryFeatures}, never null
     */
    public static QueryFeatures extract(String prompt, List<ConversationTurn> context) {
        String text = prompt == null ? "" : prompt;
        List<ConversationTurn> turns = context == null ? List.of() : context;
        List<ConversationTurn> window = turns.size() > MAX_CONTEXT_TURNS
            ? turns.subList(turns.size() - MAX_CONTEXT_TURNS, turns.size())
            : turns;

        int contextChars = 0;
        for (ConversationTurn turn : window) {
            if (turn != null && turn.content() != null) contextChars += turn.content().length();
        }
        int estimatedTokens = (text.length() + contextChars + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;

        String lower = text.toLowerCase(Locale.ROOT);
        List<String> words = words(lower);

        int codeLines = countCodeLines(text);
        boolean hasCode = codeLines > 0 || text.contains("```");
        List<String> keywords = domainKeywords(words);
        boolean toolUse = TOOL_PHRASES.stream().anyMatch(lower::contains);

        double complexity = complexity(estimatedTokens, lower, codeLines, keywords.size());
        double ambiguity = ambiguity(words, lower, hasCode, keywords.size());

        return new QueryFeatures(estimatedTokens, complexity, hasCode, codeLines, keywords,
                                 toolUse, turns.size(), ambiguity);
    }

    // ── helpers ────────────────────────────────────────────────────────────

    static int countCodeLines(String text) {
        if (text.isEmpty()) return 0;
        int count = 0;
        boolean inFence = false;
        for (String line : text.split("\n", -1)) {
            if (line.trim().startsWith("```")) {
                inFence = !inFence;
                continue;
            }
            if (inFence) {
                if (!line.isBlank()) count++;
            } else if (CODE_LINE.matcher(line).matches()) {
                count++;
            }
        }
        return count;
    }

    private static List<String> words(String lower) {
        return List.of(WORD_SPLIT.split(lower)).stream().filter(w -> !w.isEmpty()).toList();
    }

    private static List<String> domainKeywords(List<String> words) {
        TreeSet<String> hits = new TreeSet<>();
        for (String word : words) {
            for (Set<String> vocabulary : DOMAIN_VOCABULARY.values()) {
                if (vocabulary.contains(word)) hits.add(word);
            }
        }
        return List.copyOf(hits);
    }

    private static double complexity(int tokens, String lower, int codeLines, int keywordCount) {
        double length = Math.min(1.0, Math.log1p(tokens) / Math.log1p(4000));
        long markers = REASONING_MARKERS.stream().filter(lower::contains).count();
        double reasoning = Math.min(1.0, markers / 3.0);
        double code = Math.min(1.0, codeLines / 40.0);
        long asks = lower.chars().filter(c -> c == '?').count() + countNumberedSteps(lower);
        double multiPart = Math.min(1.0, asks / 4.0);
        double breadth = Math.min(1.0, keywordCount / 6.0);
        return clamp(0.30 * length + 0.25 * reasoning + 0.20 * code + 0.15 * multiPart + 0.10 * breadth);
    }

    private static long countNumberedSteps(String lower) {
        long count = 0;
        for (String line : lower.split("\n")) {
            String t = line.trim();
            if (t.length() > 1 && Character.isDigit(t.charAt(0)) && (t.charAt(1) == '.' || t.charAt(1) == ')')) {
                count++;
            }
        }
        return count;
    }

    private static double ambiguity(List<String> words, String lower, boolean hasCode, int keywordCount) {
        if (words.isEmpty()) return 1.0;
        double shortness = words.size() < 4 ? 0.5 : words.size() < 10 ? 0.25 : 0.0;
        long vague = words.stream().filter(VAGUE_WORDS::contains).count();
        double vagueness = Math.min(0.5, (double) vague / words.size() * 2.0);
        double concreteness = (hasCode ? 0.2 : 0.0) + Math.min(0.2, keywordCount * 0.05)
            + (lower.contains("?") ? 0.05 : 0.0);
        return clamp(0.15 + shortness + vagueness - concreteness);
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
