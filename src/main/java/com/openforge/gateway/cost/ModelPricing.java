package com.openforge.gateway.cost;

import java.util.Map;

/**
 * Per-model prices in USD per 1,000,000 tokens.
 *
 * Lookup is exact on the model name; a namespaced aggregator name such as
 * "openai/gpt-4o" is retried without its namespace.  Anything still unknown
 * is billed at {@link #DEFAULT}.
 */
public final class ModelPricing {

    public record Rate(double inputPerMillion, double outputPerMillion) {}

    public static final Rate DEFAULT = new Rate(1.00, 3.00);

    private static final Rate FREE = new Rate(0.0, 0.0);

    private static final Map<String, Rate> RATES = Map.ofEntries(
            // OpenAI
            Map.entry("gpt-4o",              new Rate(2.50, 10.00)),
            Map.entry("gpt-4o-mini",         new Rate(0.15, 0.60)),
            Map.entry("gpt-4-turbo",         new Rate(10.00, 30.00)),
            Map.entry("gpt-4",               new Rate(30.00, 60.00)),
            Map.entry("gpt-3.5-turbo",       new Rate(0.50, 1.50)),
            Map.entry("o1",                  new Rate(15.00, 60.00)),
            Map.entry("o1-mini",             new Rate(3.00, 12.00)),
            // Anthropic
            Map.entry("claude-3-5-sonnet",   new Rate(3.00, 15.00)),
            Map.entry("claude-3-5-haiku",    new Rate(0.80, 4.00)),
            Map.entry("claude-3-opus",       new Rate(15.00, 75.00)),
            Map.entry("claude-3-sonnet",     new Rate(3.00, 15.00)),
            Map.entry("claude-3-haiku",      new Rate(0.25, 1.25)),
            // Local models served by Ollama cost nothing per token
            Map.entry("llama3",              FREE),
            Map.entry("llama3.1",            FREE),
            Map.entry("llama3.2",            FREE),
            Map.entry("mistral",             FREE),
            Map.entry("qwen2.5-coder",       FREE),
            Map.entry("phi3",                FREE),
            Map.entry("gemma2",              FREE)
    );

    private ModelPricing() {}

    public static Rate rateFor(String model) {
        if (model == null || model.isBlank()) {
            return DEFAULT;
        }
        String key = model.toLowerCase();
        Rate rate = RATES.get(key);
        if (rate == null) {
            int slash = key.lastIndexOf('/');
            if (slash >= 0 && slash < key.length() - 1) {
                rate = RATES.get(key.substring(slash + 1));
            }
        }
        return rate != null ? rate : DEFAULT;
    }

    public static boolean isKnown(String model) {
        return rateFor(model) != DEFAULT;
    }

    /** cost = prompt/1e6 × input rate + completion/1e6 × output rate. */
    public static double calculateCost(String model, long promptTokens, long completionTokens) {
        Rate rate = rateFor(model);
        return (promptTokens / 1_000_000.0) * rate.inputPerMillion()
                + (completionTokens / 1_000_000.0) * rate.outputPerMillion();
    }
}
