package com.jeevo.validation.orchestrator;

import java.util.List;

/**
 * Ordered rules, first match wins. The last rule must match everything.
 */
public final class RuleLadder {

    public record Decision(String ruleName, Verdict verdict) {}

    private final List<Rule> rules;

    public RuleLadder(List<Rule> rules) {
        if (rules == null || rules.isEmpty()) {
            throw new IllegalArgumentException("A rule ladder needs at least one rule");
        }
        this.rules = List.copyOf(rules);
    }

    public Decision evaluate(HeuristicSignals signals) {
        for (Rule rule : rules) {
            if (rule.when().test(signals)) {
                return new Decision(rule.name(), rule.outcome().apply(signals));
            }
        }
        throw new IllegalStateException("No rule matched; the ladder has no catch-all rule");
    }

    public List<String> ruleNames() {
        return rules.stream().map(Rule::name).toList();
    }
}
