package com.openforge.gateway.routing;

import com.openforge.gateway.llm.model.CompletionRequest;
import com.openforge.gateway.llm.model.Message;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Heuristic 0..1 estimate of how demanding a request is.
 *
 * Additive signals, each band counted once:
 *   total message chars   > 8000 +0.30 | > 4000 +0.20 | > 2000 +0.10
 *   message count         > 10   +0.20 | > 5    +0.10
 *   first system message  reasoning keyword +0.20, code keyword +0.15
 *   requested max tokens  > 4000 +0.15 | > 2000 +0.10
 * The sum is clamped to [0, 1].
 */
public final class ComplexityScorer {

    static final List<String> REASONING_KEYWORDS =
            List.of("analyze", "synthesize", "evaluate", "compare", "reasoning", "step by step");
    static final List<String> CODE_KEYWORDS =
            List.of("code", "implement", "function", "algorithm");

    private ComplexityScorer() {}

    public static double score(CompletionRequest request) {
        double score = 0.0;

        long chars = 0;
        for (Message m : request.messages()) {
            chars += m.content() == null ? 0 : m.content().length();
        }
        if (chars > 8000)      score += 0.3;
        else if (chars > 4000) score += 0.2;
        else if (chars > 2000) score += 0.1;

        int count = request.messages().size();
        if (count > 10)     score += 0.2;
        else if (count > 5) score += 0.1;

        String system = request.messages().stream()
                .filter(Message::isSystem)
                .map(Message::content)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(null);
        if (system != null) {
            String text = system.toLowerCase(Locale.ROOT);
            if (containsAny(text, REASONING_KEYWORDS)) score += 0.2;
            if (containsAny(text, CODE_KEYWORDS))      score += 0.15;
        }

        Integer maxTokens = request.maxTokens();
        if (maxTokens != null) {
            if (maxTokens > 4000)      score += 0.15;
            else if (maxTokens > 2000) score += 0.1;
        }

        return Math.max(0.0, Math.min(1.0, score));
    }

    private static boolean containsAny(String text, List<String> keywords) {
        return keywords.stream().anyMatch(text::contains);
    }
}
