package net.littleredcomputer.prover.search;

import com.google.common.base.MoreObjects;

import java.time.Duration;

/**
 * Knobs for one search. Limits of 0 mean unlimited. Setters return {@code this} so options
 * can be built up in a chain.
 */
public class SearchOptions {
    public enum Strategy {
        BEST_FIRST,     // highest success probability first
        DEPTH_FIRST,    // most recently created goal first, its parent's next alternative after its subgoals
        BREADTH_FIRST,  // oldest goal first
    }

    private Strategy strategy = Strategy.BEST_FIRST;
    private int maxGoals = 0;
    private int maxRuleApplications = 200;
    private int maxRuleApplicationDepth = 30;
    private int maxNormIterations = 100;
    private int maxSafePrefixRuleApplications = 50;
    private int maxRecursionDepth = 512;
    private double postponedSafeRuleSuccessProbability = 0.9;
    private boolean terminal = false;
    private boolean warnOnNonterminal = true;
    private boolean check = true;
    private boolean traceTree = false;
    private Duration logInterval = Duration.ofMillis(1000);

    public Strategy strategy() { return strategy; }
    public int maxGoals() { return maxGoals; }
    public int maxRuleApplications() { return maxRuleApplications; }
    public int maxRuleApplicationDepth() { return maxRuleApplicationDepth; }
    public int maxNormIterations() { return maxNormIterations; }
    public int maxSafePrefixRuleApplications() { return maxSafePrefixRuleApplications; }
    public int maxRecursionDepth() { return maxRecursionDepth; }
    public double postponedSafeRuleSuccessProbability() { return postponedSafeRuleSuccessProbability; }
    public boolean terminal() { return terminal; }
    public boolean warnOnNonterminal() { return warnOnNonterminal; }
    public boolean check() { return check; }
    public boolean traceTree() { return traceTree; }
    public Duration logInterval() { return logInterval; }

    public SearchOptions setStrategy(Strategy s) { strategy = s; return this; }
    public SearchOptions setMaxGoals(int n) { maxGoals = n; return this; }
    public SearchOptions setMaxRuleApplications(int n) { maxRuleApplications = n; return this; }
    public SearchOptions setMaxRuleApplicationDepth(int n) { maxRuleApplicationDepth = n; return this; }
    public SearchOptions setMaxNormIterations(int n) { maxNormIterations = n; return this; }
    public SearchOptions setMaxSafePrefixRuleApplications(int n) { maxSafePrefixRuleApplications = n; return this; }
    public SearchOptions setMaxRecursionDepth(int n) { maxRecursionDepth = n; return this; }
    public SearchOptions setPostponedSafeRuleSuccessProbability(double p) { postponedSafeRuleSuccessProbability = p; return this; }
    public SearchOptions setTerminal(boolean b) { terminal = b; return this; }
    public SearchOptions setWarnOnNonterminal(boolean b) { warnOnNonterminal = b; return this; }
    public SearchOptions setCheck(boolean b) { check = b; return this; }
    public SearchOptions setTraceTree(boolean b) { traceTree = b; return this; }
    public SearchOptions setLogInterval(Duration d) { logInterval = d; return this; }

    public SearchOptions validate() {
        if (maxGoals < 0) throw new IllegalArgumentException("maxGoals must be nonnegative");
        if (maxRuleApplications < 0) throw new IllegalArgumentException("maxRuleApplications must be nonnegative");
        if (maxRuleApplicationDepth < 0) throw new IllegalArgumentException("maxRuleApplicationDepth must be nonnegative");
        if (maxSafePrefixRuleApplications < 0) throw new IllegalArgumentException("maxSafePrefixRuleApplications must be nonnegative");
        if (maxNormIterations < 1) throw new IllegalArgumentException("maxNormIterations must be positive");
        if (maxRecursionDepth < 1) throw new IllegalArgumentException("maxRecursionDepth must be positive");
        if (postponedSafeRuleSuccessProbability <= 0 || postponedSafeRuleSuccessProbability > 1) {
            throw new IllegalArgumentException("postponedSafeRuleSuccessProbability must be in (0, 1]");
        }
        if (logInterval.isNegative()) throw new IllegalArgumentException("logInterval must not be negative");
        return this;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("strategy", strategy)
                .add("maxGoals", maxGoals)
                .add("maxRuleApplications", maxRuleApplications)
                .add("maxRuleApplicationDepth", maxRuleApplicationDepth)
                .add("maxNormIterations", maxNormIterations)
                .add("terminal", terminal)
                .toString();
    }
}
