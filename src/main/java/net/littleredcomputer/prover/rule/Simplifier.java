package net.littleredcomputer.prover.rule;

import net.littleredcomputer.prover.meta.MVarId;
import net.littleredcomputer.prover.meta.MetaContext;

/**
 * The simplification pass run between the pre- and post-normalization rules. When it solves
 * or simplifies a goal it must assign the goal in {@code ctx}; when it leaves the goal
 * unchanged it must leave {@code ctx} alone.
 */
@FunctionalInterface
public interface Simplifier {
    Simplifier NONE = (goal, ctx) -> SimpResult.unchanged();

    SimpResult simplify(MVarId goal, MetaContext ctx);
}
