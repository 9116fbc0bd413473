package net.littleredcomputer.prover.rule;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.prover.meta.MVarDecl;

/**
 * The query side of a rule set. Each method returns the candidates for a goal already in the
 * order they are to be tried.
 */
public interface RuleIndex {
    /** Normalization rules, by ascending penalty. */
    ImmutableList<RuleMatch> normRules(MVarDecl goal);

    /** Safe rules, by ascending penalty. */
    ImmutableList<RuleMatch> safeRules(MVarDecl goal);

    /** Unsafe rules, by descending success probability. */
    ImmutableList<RuleMatch> unsafeRules(MVarDecl goal);
}
