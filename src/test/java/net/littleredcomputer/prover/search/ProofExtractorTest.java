package net.littleredcomputer.prover.search;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.prover.meta.Expr;
import net.littleredcomputer.prover.meta.MVarDecl;
import net.littleredcomputer.prover.meta.MVarId;
import net.littleredcomputer.prover.meta.MetaContext;
import net.littleredcomputer.prover.meta.Snapshot;
import net.littleredcomputer.prover.tree.SearchTree;
import org.junit.Test;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class ProofExtractorTest {
    private static MVarDecl decl(String target) { return MVarDecl.of(Expr.parse(target)); }

    @Test
    public void assignmentsAreBackfilled() {
        MetaContext src = new MetaContext();
        MVarId a = src.declare(decl("P"));
        MVarId b = src.declare(decl("Q"));
        src.assign(a, Expr.parse("(f ?1)"));
        src.assign(b, Expr.constant("q"));
        MetaContext ctx = new MetaContext();
        ProofExtractor.copyAssignment(ctx, src.snapshot(), a, new RecursionGuard(10));
        assertThat(ctx.isDeclared(b), is(true));
        assertThat(ctx.instantiate(Expr.mvar(a)), is(Expr.parse("(f q)")));
    }

    @Test
    public void delayedAssignmentsAreCopied() {
        MetaContext src = new MetaContext();
        MVarId g = src.declare(decl("(imp P P)"));
        MVarId body = src.declare(decl("P"));
        src.assignDelayed(g, ImmutableList.of("h"), body);
        src.assign(body, Expr.constant("h"));
        MetaContext ctx = new MetaContext();
        ProofExtractor.copyAssignment(ctx, src.snapshot(), g, new RecursionGuard(10));
        assertThat(ctx.isDelayedAssigned(g), is(true));
        assertThat(ctx.instantiate(Expr.mvar(g)), is(Expr.parse("(fun (h) h)")));
    }

    @Test
    public void declarationsAreCopiedWithTheirVariables() {
        MetaContext src = new MetaContext();
        MVarId w = src.declare(decl("term"));
        MVarId p = src.declare(decl("(p ?0)"));
        MVarId r = src.declare(decl("R"));
        src.assign(r, Expr.parse("(r ?1)"));
        MetaContext ctx = new MetaContext();
        ProofExtractor.copyAssignment(ctx, src.snapshot(), r, new RecursionGuard(10));
        assertThat(ctx.isDeclared(p), is(true));
        assertThat(ctx.isDeclared(w), is(true));
        assertThat(ctx.isAssigned(p), is(false));
    }

    @Test
    public void transplantCopiesOnlyTheStepsOwnAssignments() {
        MetaContext src = new MetaContext();
        MVarId g = src.declare(decl("P"));
        MVarId done = src.declare(decl("Q"));
        src.assign(done, Expr.constant("q"));
        Snapshot before = src.snapshot();
        MVarId c = src.declare(decl("C"));
        MVarId unused = src.declare(decl("U"));
        src.assign(c, Expr.constant("c"));
        src.assign(unused, Expr.constant("u"));
        src.assign(g, Expr.parse("(g ?2)"));
        src.addEnvironmentDeclaration("lemma", Expr.parse("(imp C P)"));

        MetaContext ctx = new MetaContext(before);
        ProofExtractor.transplant(ctx, src.snapshot(), before, new RecursionGuard(10));
        assertThat(ctx.instantiate(Expr.mvar(g)), is(Expr.parse("(g c)")));
        assertThat(ctx.isDeclared(unused), is(false));
        assertThat(ctx.environment(), hasEntry("lemma", Expr.parse("(imp C P)")));
    }

    @Test
    public void conflictingDeclarationsAreAnInternalError() {
        MetaContext ctx = new MetaContext();
        ctx.declare(MVarId.of(3), decl("P"));
        MetaContext src = new MetaContext();
        src.declare(MVarId.of(3), decl("Q"));
        src.assign(MVarId.of(3), Expr.constant("q"));
        try {
            ProofExtractor.copyAssignment(ctx, src.snapshot(), MVarId.of(3), new RecursionGuard(10));
            fail("expected an internal error");
        } catch (SearchException e) {
            assertThat(e.reason(), is(SearchException.Reason.INTERNAL));
            assertThat(e.getMessage(), containsString("declared as both"));
        }
    }

    @Test
    public void deepChainsHitTheRecursionLimit() {
        MetaContext src = new MetaContext();
        for (int i = 0; i < 5; ++i) src.declare(decl("P"));
        for (int i = 0; i < 4; ++i) src.assign(MVarId.of(i), Expr.parse("(f ?" + (i + 1) + ")"));
        src.assign(MVarId.of(4), Expr.constant("c"));
        try {
            ProofExtractor.copyAssignment(new MetaContext(), src.snapshot(), MVarId.of(0), new RecursionGuard(3));
            fail("expected the recursion limit");
        } catch (SearchException e) {
            assertThat(e.reason(), is(SearchException.Reason.RECURSION_DEPTH));
        }
    }

    @Test
    public void unprovenRootIsAnInternalError() {
        MetaContext ctx = new MetaContext();
        MVarId g = ctx.declare(decl("P"));
        try {
            new ProofExtractor(new SearchTree(g, ctx.snapshot()), new RecursionGuard(10)).extract();
            fail("expected an internal error");
        } catch (SearchException e) {
            assertThat(e.reason(), is(SearchException.Reason.INTERNAL));
            assertThat(e.isFatal(), is(true));
        }
    }
}
