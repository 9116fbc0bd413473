package net.littleredcomputer.prover.logic;

import net.littleredcomputer.prover.meta.Expr;
import net.littleredcomputer.prover.meta.MVarId;
import net.littleredcomputer.prover.meta.MetaContext;
import net.littleredcomputer.prover.meta.Snapshot;

/**
 * First-order unification of expressions, assigning metavariables in a {@link MetaContext}.
 * Lambdas unify only with lambdas over the same binders.
 */
public final class Unifier {
    private Unifier() {}

    /**
     * Unify {@code a} with {@code b}. On failure the context is left as it was.
     * @return true if the expressions were made equal
     */
    public static boolean unify(MetaContext ctx, Expr a, Expr b) {
        Snapshot s = ctx.snapshot();
        if (unify1(ctx, a, b)) return true;
        ctx.restore(s);
        return false;
    }

    private static boolean unify1(MetaContext ctx, Expr a, Expr b) {
        a = ctx.instantiate(a);
        b = ctx.instantiate(b);
        if (a.equals(b)) return true;
        if (a.isMVar()) return bind(ctx, a.mvarId(), b);
        if (b.isMVar()) return bind(ctx, b.mvarId(), a);
        if (a.kind() != b.kind()) return false;
        switch (a.kind()) {
            case LAMBDA:
                return a.binders().equals(b.binders()) && unify1(ctx, a.body(), b.body());
            case APP:
                if (!a.head().equals(b.head()) || a.args().size() != b.args().size()) return false;
                for (int i = 0; i < a.args().size(); ++i) {
                    if (!unify1(ctx, a.arg(i), b.arg(i))) return false;
                }
                return true;
            default:
                return false;
        }
    }

    private static boolean bind(MetaContext ctx, MVarId m, Expr e) {
        // a delayed-assigned metavariable survives instantiation but cannot be bound
        if (ctx.isAssigned(m) || e.occurs(m)) return false;
        ctx.assign(m, e);
        return true;
    }
}
