package com.openforge.gateway.routing;

import java.util.List;
import java.util.Locale;

/**
 * Well-known backend ids and the model families the routing tables key on.
 */
public final class BackendIds {

    public static final String OLLAMA      = "ollama";
    public static final String OPENAI      = "openai";
    public static final String ANTHROPIC   = "anthropic";
    public static final String OPENROUTER  = "openrouter";
    public static final String HUGGINGFACE = "huggingface";

    /** Model families served locally through Ollama. */
    public static final List<String> LOCAL_MODEL_PREFIXES =
            List.of("llama", "mistral", "qwen", "phi", "gemma", "codellama", "deepseek-coder");

    public static final String[] OPENAI_MODEL_PREFIXES    = {"gpt-", "o1-"};
    public static final String[] ANTHROPIC_MODEL_PREFIXES = {"claude-"};

    public static final String NAMESPACE_SEPARATOR = "/";
    public static final String HF_PREFIX           = "hf:";

    private BackendIds() {}

    public static boolean isLocalModel(String model) {
        if (model == null || model.isBlank()) {
            return false;
        }
        String m = model.toLowerCase(Locale.ROOT);
        return LOCAL_MODEL_PREFIXES.stream().anyMatch(m::startsWith);
    }

    /** "anthropic/claude-3-haiku" → "claude-3-haiku"; names without a namespace are returned as-is. */
    public static String stripNamespace(String model) {
        if (model == null) return null;
        int slash = model.indexOf(NAMESPACE_SEPARATOR);
        return slash >= 0 ? model.substring(slash + 1) : model;
    }

    /** "hf:org/model" → "org/model". */
    public static String stripHfPrefix(String model) {
        if (model == null) return null;
        return model.regionMatches(true, 0, HF_PREFIX, 0, HF_PREFIX.length())
                ? model.substring(HF_PREFIX.length()) : model;
    }

    /** Prefixes {@code namespace/} unless the name is already namespaced. */
    public static String withNamespace(String namespace, String model) {
        if (model == null || model.contains(NAMESPACE_SEPARATOR)) return model;
        return namespace + NAMESPACE_SEPARATOR + model;
    }
}
