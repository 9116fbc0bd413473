package net.littleredcomputer.prover.logic;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.prover.meta.Expr;
import net.littleredcomputer.prover.meta.MVarDecl;
import net.littleredcomputer.prover.meta.MVarId;
import net.littleredcomputer.prover.meta.MetaContext;
import org.junit.Before;
import org.junit.Test;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class UnifierTest {
    private MetaContext ctx;
    private MVarId x, y;

    @Before
    public void setUp() {
        ctx = new MetaContext();
        x = ctx.declare(MVarDecl.of(LogicRules.TERM));
        y = ctx.declare(MVarDecl.of(LogicRules.TERM));
    }

    private boolean unify(String a, String b) { return Unifier.unify(ctx, Expr.parse(a), Expr.parse(b)); }

    @Test
    public void bindsVariables() {
        assertThat(unify("(f ?0 b)", "(f a ?1)"), is(true));
        assertThat(ctx.instantiate(Expr.mvar(x)), is(Expr.constant("a")));
        assertThat(ctx.instantiate(Expr.mvar(y)), is(Expr.constant("b")));
    }

    @Test
    public void usesExistingAssignments() {
        ctx.assign(x, Expr.constant("a"));
        assertThat(unify("(f ?0)", "(f a)"), is(true));
        assertThat(unify("(f ?0)", "(f b)"), is(false));
    }

    @Test
    public void failureLeavesContextAlone() {
        assertThat(unify("(g ?0 b)", "(g a c)"), is(false));
        assertThat(ctx.isAssigned(x), is(false));
        assertThat(unify("(g ?0)", "(h ?0)"), is(false));
        assertThat(unify("(g ?0)", "(g ?0 ?1)"), is(false));
    }

    @Test
    public void sameVariableTwice() {
        assertThat(unify("(f ?0 ?0)", "(f a b)"), is(false));
        assertThat(unify("(f ?0 ?0)", "(f ?1 c)"), is(true));
        assertThat(ctx.instantiate(Expr.mvar(y)), is(Expr.constant("c")));
    }

    @Test
    public void occursCheck() {
        assertThat(unify("?0", "(f ?0)"), is(false));
        assertThat(unify("?0", "?0"), is(true));
        assertThat(ctx.isAssigned(x), is(false));
    }

    @Test
    public void lambdasNeedTheSameBinders() {
        assertThat(unify("(fun (h) ?0)", "(fun (k) a)"), is(false));
        assertThat(unify("(fun (h) ?0)", "(fun (h) a)"), is(true));
        assertThat(unify("(fun (h) a)", "(f a)"), is(false));
    }

    @Test
    public void delayedAssignmentIsNotRebound() {
        MVarId g = ctx.declare(MVarDecl.of(Expr.parse("(imp P P)")));
        MVarId body = ctx.declare(MVarDecl.of(Expr.constant("P")));
        ctx.assignDelayed(g, ImmutableList.of("h"), body);
        assertThat(Unifier.unify(ctx, Expr.mvar(g), Expr.parse("(fun (h) h)")), is(false));
        assertThat(ctx.isAssigned(body), is(false));
    }
}
