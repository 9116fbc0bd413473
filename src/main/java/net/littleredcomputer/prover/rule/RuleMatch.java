package net.littleredcomputer.prover.rule;

import com.google.common.collect.ImmutableList;

/** A rule selected for a goal, together with where it matched. */
public final class RuleMatch {
    private final Rule rule;
    private final ImmutableList<String> locations;

    public RuleMatch(Rule rule, ImmutableList<String> locations) {
        this.rule = rule;
        this.locations = locations;
    }

    public static RuleMatch of(Rule rule) { return new RuleMatch(rule, ImmutableList.of()); }

    public Rule rule() { return rule; }
    public ImmutableList<String> locations() { return locations; }

    @Override public String toString() { return locations.isEmpty() ? rule.toString() : rule + "@" + locations; }
}
