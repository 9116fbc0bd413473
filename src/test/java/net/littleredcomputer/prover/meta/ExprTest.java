package net.littleredcomputer.prover.meta;

import com.google.common.collect.ImmutableList;
import org.junit.Test;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class ExprTest {
    @Test
    public void parseAndPrint() {
        Expr e = Expr.parse("(and P (or ?3 (imp Q True)))");
        assertThat(e.head(), is("and"));
        assertThat(e.args(), hasSize(2));
        assertThat(e.arg(0).isConstant(), is(true));
        assertThat(e.arg(1).arg(0).isMVar(), is(true));
        assertThat(e.arg(1).arg(0).mvarId(), is(MVarId.of(3)));
        assertThat(e.toString(), is("(and P (or ?3 (imp Q True)))"));
        assertThat(Expr.parse(e.toString()), is(e));
    }

    @Test
    public void lambdas() {
        Expr e = Expr.parse("(fun (h k) (mp h ?1))");
        assertThat(e.kind(), is(Expr.Kind.LAMBDA));
        assertThat(e.binders(), contains("h", "k"));
        assertThat(e.body(), is(Expr.parse("(mp h ?1)")));
        assertThat(e.toString(), is("(fun (h k) (mp h ?1))"));
        assertThat(Expr.lambda(ImmutableList.of(), Expr.constant("x")), is(Expr.constant("x")));
    }

    @Test
    public void mvarsInOrder() {
        Expr e = Expr.parse("(f ?2 (g ?0 ?2) (fun (x) ?5))");
        assertThat(e.mvars(), contains(MVarId.of(2), MVarId.of(0), MVarId.of(5)));
        assertThat(e.hasMVars(), is(true));
        assertThat(e.occurs(MVarId.of(5)), is(true));
        assertThat(e.occurs(MVarId.of(1)), is(false));
        assertThat(Expr.parse("(f a b)").hasMVars(), is(false));
    }

    @Test
    public void replaceMVars() {
        Expr e = Expr.parse("(f ?1 ?2)");
        Expr r = e.replaceMVars(m -> m.id() == 1 ? Expr.constant("a") : null);
        assertThat(r, is(Expr.parse("(f a ?2)")));
        assertThat(Expr.parse("(f a)").replaceMVars(m -> Expr.constant("b")), is(Expr.parse("(f a)")));
    }

    @Test
    public void substitute() {
        Expr body = Expr.parse("(and (p x) (fun (x) (q x)))");
        assertThat(body.substitute("x", Expr.parse("?4")), is(Expr.parse("(and (p ?4) (fun (x) (q x)))")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void unbalanced() {
        Expr.parse("(and P Q");
    }

    @Test(expected = IllegalArgumentException.class)
    public void trailingInput() {
        Expr.parse("(and P Q) R");
    }

    @Test(expected = IllegalArgumentException.class)
    public void malformedMVar() {
        Expr.parse("(f ?x)");
    }
}
