package com.openforge.gateway.routing;

import java.util.Locale;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * One row of a routing table: "models matching X go to backend Y".
 *
 * @param name        human-readable description, used in logs
 * @param matcher     tested against the lower-cased model name
 * @param target      backend id the rule sends matching models to
 * @param rewrite     adjusts the model name for the target (identity for most rules)
 * @param replacement when non-null the rule is deprecated in favour of this backend id;
 *                    it still routes to {@code target} but logs a warning
 */
public record RoutingRule(
        String name,
        Predicate<String> matcher,
        String target,
        UnaryOperator<String> rewrite,
        String replacement
) {

    public static RoutingRule prefix(String prefix, String target) {
        String p = prefix.toLowerCase(Locale.ROOT);
        return new RoutingRule("prefix '" + prefix + "'", m -> m.startsWith(p), target, UnaryOperator.identity(), null);
    }

    public static RoutingRule anyPrefix(String target, String... prefixes) {
        Predicate<String> matcher = m -> false;
        for (String prefix : prefixes) {
            String p = prefix.toLowerCase(Locale.ROOT);
            matcher = matcher.or(m -> m.startsWith(p));
        }
        return new RoutingRule("prefixes " + String.join(",", prefixes), matcher, target, UnaryOperator.identity(), null);
    }

    public static RoutingRule contains(String fragment, String target) {
        return new RoutingRule("contains '" + fragment + "'", m -> m.contains(fragment), target,
                UnaryOperator.identity(), null);
    }

    public RoutingRule deprecatedInFavourOf(String newTarget) {
        return new RoutingRule(name, matcher, target, rewrite, newTarget);
    }

    public RoutingRule rewritingModel(UnaryOperator<String> modelRewrite) {
        return new RoutingRule(name, matcher, target, modelRewrite, replacement);
    }

    public boolean matches(String model) {
        return model != null && !model.isBlank() && matcher.test(model.toLowerCase(Locale.ROOT));
    }

    public boolean deprecated() {
        return replacement != null;
    }

    public String rewriteModel(String model) {
        return model == null ? null : rewrite.apply(model);
    }

    @Override
    public String toString() {
        return name + " → " + target + (deprecated() ? " (deprecated, use " + replacement + ")" : "");
    }
}
