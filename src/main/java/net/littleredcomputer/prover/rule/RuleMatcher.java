package net.littleredcomputer.prover.rule;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.prover.meta.MVarDecl;

import java.util.Optional;

/**
 * Decides whether a rule is worth running on a goal. A match carries the locations (hypothesis
 * names) the rule matched, possibly none.
 */
@FunctionalInterface
public interface RuleMatcher {
    RuleMatcher ALWAYS = d -> Optional.of(ImmutableList.of());

    Optional<ImmutableList<String>> match(MVarDecl goal);
}
