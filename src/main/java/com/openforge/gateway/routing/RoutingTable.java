package com.openforge.gateway.routing;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered rules evaluated top to bottom, then a fixed fallback priority.
 *
 * A rule only matches when its target is among the available backends, so
 * the same table works whichever subset of backends is configured.
 */
public final class RoutingTable {

    /**
     * @param rule the rule that matched, or null when the fallback list decided
     */
    public record Resolution(String target, String model, RoutingRule rule) {

        public boolean fromFallback() {
            return rule == null;
        }
    }

    private final List<RoutingRule> rules;
    private final List<String>      fallback;

    public RoutingTable(List<RoutingRule> rules, List<String> fallback) {
        this.rules    = List.copyOf(rules);
        this.fallback = List.copyOf(fallback);
    }

    public Optional<RoutingRule> match(String model, Set<String> available) {
        return rules.stream()
                .filter(r -> available.contains(r.target()))
                .filter(r -> r.matches(model))
                .findFirst();
    }

    public Optional<String> fallback(Set<String> available) {
        return fallback.stream().filter(available::contains).findFirst();
    }

    public Optional<Resolution> resolve(String model, Set<String> available) {
        Optional<RoutingRule> rule = match(model, available);
        if (rule.isPresent()) {
            RoutingRule r = rule.get();
            return Optional.of(new Resolution(r.target(), r.rewriteModel(model), r));
        }
        return fallback(available).map(target -> new Resolution(target, model, null));
    }

    public List<RoutingRule> rules() {
        return rules;
    }

    public List<String> fallbackOrder() {
        return fallback;
    }
}
