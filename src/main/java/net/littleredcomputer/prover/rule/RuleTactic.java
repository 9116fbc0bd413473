package net.littleredcomputer.prover.rule;

/**
 * The procedure behind a rule. Runs against the goal in {@link RuleInput#context()}, which it may
 * freely mutate and restore between alternatives, and reports either a failure or one or more
 * applications, each carrying the snapshot taken after it.
 */
@FunctionalInterface
public interface RuleTactic {
    RuleResult run(RuleInput input);
}
