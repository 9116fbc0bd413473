package net.littleredcomputer.prover.logic;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.prover.meta.Expr;
import net.littleredcomputer.prover.meta.MVarDecl;
import net.littleredcomputer.prover.meta.MVarId;
import net.littleredcomputer.prover.meta.MetaContext;
import net.littleredcomputer.prover.rule.SimpResult;
import net.littleredcomputer.prover.rule.Simplifier;

/**
 * Rewrites the target with the unit laws of {@code True}: {@code (and A True)} and
 * {@code (and True A)} become {@code A}; {@code True} and {@code (imp A True)} are solved.
 * One rewrite per call.
 */
public class LogicSimplifier implements Simplifier {
    @Override
    public SimpResult simplify(MVarId goal, MetaContext ctx) {
        MVarDecl d = ctx.instantiate(ctx.decl(goal));
        Expr t = d.target();
        if (t.equals(LogicRules.TRUE)) {
            ctx.assign(goal, LogicRules.TRIVIAL);
            return SimpResult.solved();
        }
        if (t.isApp("imp") && t.args().size() == 2 && t.arg(1).equals(LogicRules.TRUE)) {
            ctx.assign(goal, Expr.lambda(ImmutableList.of(d.freshHypothesisName("h")), LogicRules.TRIVIAL));
            return SimpResult.solved();
        }
        if (t.isApp("and") && t.args().size() == 2) {
            if (t.arg(1).equals(LogicRules.TRUE)) {
                MVarId g = ctx.declare(d.withTarget(t.arg(0)));
                ctx.assign(goal, Expr.app("and_intro", Expr.mvar(g), LogicRules.TRIVIAL));
                return SimpResult.simplified(g);
            }
            if (t.arg(0).equals(LogicRules.TRUE)) {
                MVarId g = ctx.declare(d.withTarget(t.arg(1)));
                ctx.assign(goal, Expr.app("and_intro", LogicRules.TRIVIAL, Expr.mvar(g)));
                return SimpResult.simplified(g);
            }
        }
        return SimpResult.unchanged();
    }
}
