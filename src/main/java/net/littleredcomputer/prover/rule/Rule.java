package net.littleredcomputer.prover.rule;

import java.util.Objects;

/**
 * A named rule: its phase, its static ordering (penalty for normalization and safe rules,
 * success probability for unsafe ones), the tactic that runs it, the matcher consulted by
 * {@link SimpleRuleIndex} and the initial value of its branch state.
 */
public final class Rule {
    private final String name;
    private final Phase phase;
    private final int penalty;
    private final double successProbability;
    private final RuleTactic tactic;
    private final RuleMatcher matcher;
    private final Object initialBranchState;

    private Rule(String name, Phase phase, int penalty, double successProbability,
                 RuleTactic tactic, RuleMatcher matcher, Object initialBranchState) {
        if (name.isEmpty()) throw new IllegalArgumentException("rule must be named");
        if (successProbability <= 0 || successProbability > 1) {
            throw new IllegalArgumentException("success probability of " + name + " must be in (0, 1]: " + successProbability);
        }
        this.name = name;
        this.phase = phase;
        this.penalty = penalty;
        this.successProbability = successProbability;
        this.tactic = tactic;
        this.matcher = matcher;
        this.initialBranchState = initialBranchState;
    }

    public static Rule norm(String name, int penalty, RuleTactic tactic) {
        return new Rule(name, Phase.NORM, penalty, 1.0, tactic, RuleMatcher.ALWAYS, null);
    }

    public static Rule safe(String name, int penalty, RuleTactic tactic) {
        return new Rule(name, Phase.SAFE, penalty, 1.0, tactic, RuleMatcher.ALWAYS, null);
    }

    public static Rule unsafe(String name, double successProbability, RuleTactic tactic) {
        return new Rule(name, Phase.UNSAFE, 0, successProbability, tactic, RuleMatcher.ALWAYS, null);
    }

    public Rule withMatcher(RuleMatcher m) {
        return new Rule(name, phase, penalty, successProbability, tactic, m, initialBranchState);
    }

    public Rule withTactic(RuleTactic t) {
        return new Rule(name, phase, penalty, successProbability, t, matcher, initialBranchState);
    }

    public Rule withBranchState(Object initial) {
        return new Rule(name, phase, penalty, successProbability, tactic, matcher, initial);
    }

    public String name() { return name; }
    public Phase phase() { return phase; }
    public int penalty() { return penalty; }
    public double successProbability() { return successProbability; }
    public RuleTactic tactic() { return tactic; }
    public RuleMatcher matcher() { return matcher; }
    public Object initialBranchState() { return initialBranchState; }

    /** Normalization rules with negative penalty run before the simplifier. */
    public boolean isPreNorm() { return phase == Phase.NORM && penalty < 0; }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Rule)) return false;
        Rule r = (Rule) o;
        return name.equals(r.name) && phase == r.phase;
    }

    @Override public int hashCode() { return Objects.hash(name, phase); }

    @Override
    public String toString() {
        switch (phase) {
            case UNSAFE: return String.format("%s[unsafe %.0f%%]", name, 100 * successProbability);
            case SAFE: return name + "[safe " + penalty + "]";
            default: return name + "[norm " + penalty + "]";
        }
    }
}
