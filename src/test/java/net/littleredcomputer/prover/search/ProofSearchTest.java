package net.littleredcomputer.prover.search;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import net.littleredcomputer.prover.logic.LogicRules;
import net.littleredcomputer.prover.logic.LogicSimplifier;
import net.littleredcomputer.prover.meta.Expr;
import net.littleredcomputer.prover.meta.Hypothesis;
import net.littleredcomputer.prover.meta.MVarDecl;
import net.littleredcomputer.prover.meta.MVarId;
import net.littleredcomputer.prover.meta.MetaContext;
import net.littleredcomputer.prover.rule.Rule;
import net.littleredcomputer.prover.rule.RuleMatcher;
import net.littleredcomputer.prover.rule.RuleOutput;
import net.littleredcomputer.prover.rule.RuleResult;
import net.littleredcomputer.prover.rule.SimpleRuleIndex;
import net.littleredcomputer.prover.rule.Simplifier;
import org.junit.Test;

import java.util.Optional;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresent;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresentAndIs;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class ProofSearchTest {
    private static ProofSearch logic(SearchOptions options) {
        return new ProofSearch(new SimpleRuleIndex(LogicRules.defaultRules()), new LogicSimplifier(), options);
    }

    private static MVarDecl goal(String target, String... hyps) {
        Hypothesis[] hs = new Hypothesis[hyps.length];
        for (int i = 0; i < hyps.length; ++i) {
            String[] parts = hyps[i].split(":", 2);
            hs[i] = Hypothesis.parse(parts[0], parts[1]);
        }
        return MVarDecl.of(Expr.parse(target), hs);
    }

    private static RuleMatcher head(String h) {
        return d -> d.target().isApp(h) ? Optional.of(ImmutableList.of()) : Optional.empty();
    }

    @Test
    public void conjunction() {
        SearchResult r = logic(new SearchOptions()).search(goal("(and P Q)", "p:P", "q:Q"));
        assertThat(r.isProven(), is(true));
        assertThat(r.proof(), isPresentAndIs(Expr.parse("(and_intro p q)")));
        assertThat(r.failureReason(), isEmpty());
        assertThat(r.statistics().iterations(), is(3));
        assertThat(r.statistics().goals(), is(3));
        assertThat(r.remainingGoals(), is(empty()));
    }

    @Test
    public void implication() {
        SearchResult r = logic(new SearchOptions()).search(goal("(imp P P)"));
        assertThat(r.proof(), isPresentAndIs(Expr.parse("(fun (h) h)")));
    }

    @Test
    public void conjunctionHypothesisIsSplit() {
        SearchResult r = logic(new SearchOptions()).search(goal("Q", "pq:(and P Q)"));
        assertThat(r.proof(), isPresentAndIs(Expr.parse("(and_elim pq (fun (pq_l pq_r) pq_r))")));
    }

    @Test
    public void simplifierClosesTrivialGoals() {
        SearchResult r = logic(new SearchOptions()).search(goal("(and P True)", "p:P"));
        assertThat(r.proof(), isPresentAndIs(Expr.parse("(and_intro p trivial)")));
    }

    @Test
    public void disjunctionTriesBothSides() {
        SearchResult r = logic(new SearchOptions()).search(goal("(or Q P)", "p:P"));
        assertThat(r.proof(), isPresentAndIs(Expr.parse("(or_inr p)")));
        // the root is expanded twice, once per unsafe rule, before either subgoal
        assertThat(r.statistics().iterations(), is(4));
    }

    @Test
    public void depthFirstFinishesTheFirstAlternative() {
        SearchResult d = logic(new SearchOptions().setStrategy(SearchOptions.Strategy.DEPTH_FIRST))
                .search(goal("(or P Q)", "p:P", "q:Q"));
        assertThat(d.proof(), isPresentAndIs(Expr.parse("(or_inl p)")));
        assertThat(d.statistics().iterations(), is(2));
    }

    @Test
    public void strategiesChangeTheOrder() {
        // the left disjunct takes one more rule than the right
        MVarDecl g = goal("(or (and P P) P)", "p:P");
        SearchResult best = logic(new SearchOptions()).search(g);
        assertThat(best.proof(), isPresentAndIs(Expr.parse("(or_inr p)")));
        assertThat(best.statistics().iterations(), is(4));
        SearchResult d = logic(new SearchOptions().setStrategy(SearchOptions.Strategy.DEPTH_FIRST)).search(g);
        assertThat(d.proof(), isPresentAndIs(Expr.parse("(or_inl (and_intro p p))")));
        assertThat(d.statistics().iterations(), is(4));
        SearchResult b = logic(new SearchOptions().setStrategy(SearchOptions.Strategy.BREADTH_FIRST)).search(g);
        assertThat(b.proof(), isPresentAndIs(Expr.parse("(or_inl (and_intro p p))")));
        assertThat(b.statistics().iterations(), is(5));
    }

    @Test
    public void siblingBranchesKeepTheirOwnVariables() {
        SearchResult r = logic(new SearchOptions()).search(goal("(and (imp P P) (imp Q (and Q Q)))"));
        assertThat(r.proof(), isPresentAndIs(Expr.parse("(and_intro (fun (h) h) (fun (h) (and_intro h h)))")));
        r = logic(new SearchOptions()).search(goal("(and (imp Q (and Q Q)) (imp P P))"));
        assertThat(r.proof(), isPresentAndIs(Expr.parse("(and_intro (fun (h) (and_intro h h)) (fun (h) h))")));
    }

    @Test
    public void siblingWitnessesAreFoundSeparately() {
        SearchResult r = logic(new SearchOptions()).search(goal("(and (ex x (p x)) (ex y (q y)))", "pa:(p a)", "qb:(q b)"));
        assertThat(r.proof(), isPresentAndIs(Expr.parse("(and_intro (ex_intro a pa) (ex_intro b qb))")));
    }

    @Test
    public void modusPonens() {
        SearchResult r = logic(new SearchOptions()).search(goal("Q", "f:(imp P Q)", "p:P"));
        assertThat(r.proof(), isPresentAndIs(Expr.parse("(mp f p)")));
    }

    @Test
    public void existentialWitnessIsFoundByUnification() {
        SearchResult r = logic(new SearchOptions()).search(goal("(ex x (p x))", "h:(p a)"));
        assertThat(r.proof(), isPresentAndIs(Expr.parse("(ex_intro a h)")));
    }

    @Test
    public void unprovable() {
        SearchResult r = logic(new SearchOptions().setWarnOnNonterminal(false)).search(goal("Q", "p:P"));
        assertThat(r.isProven(), is(false));
        assertThat(r.proof(), isEmpty());
        assertThat(r.failureReason(), isPresentAndIs(SearchException.Reason.UNPROVABLE));
        assertThat(r.remainingGoals(), contains(MVarId.of(0)));
        assertThat(r.message(), containsString("exhaustive"));
    }

    @Test
    public void depthLimitLeavesSafePrefix() {
        SearchResult r = logic(new SearchOptions().setMaxRuleApplicationDepth(1)).search(goal("(imp P P)"));
        assertThat(r.failureReason(), isPresentAndIs(SearchException.Reason.MAX_DEPTH));
        assertThat(r.remainingGoals(), hasSize(1));
        MVarDecl open = r.remainingGoalDecls().get(0);
        assertThat(open.target(), is(Expr.constant("P")));
        assertThat(open.hypotheses(), contains(Hypothesis.parse("h", "P")));
    }

    @Test
    public void terminalSearchThrows() {
        try {
            logic(new SearchOptions().setMaxRuleApplicationDepth(1).setTerminal(true)).search(goal("(imp P P)"));
            fail("expected the search to fail");
        } catch (SearchException e) {
            assertThat(e.reason(), is(SearchException.Reason.MAX_DEPTH));
            assertThat(e.isFatal(), is(false));
            assertThat(e.tree(), isPresent());
            assertThat(e.safePrefixGoals(), isPresentAndIs(ImmutableList.of(MVarId.of(1))));
            assertThat(e.renderedTree(), containsString("forced"));
        }
    }

    @Test
    public void ruleApplicationLimit() {
        SearchResult r = logic(new SearchOptions().setMaxRuleApplications(1).setWarnOnNonterminal(false))
                .search(goal("(or Q P)", "p:P"));
        assertThat(r.failureReason(), isPresentAndIs(SearchException.Reason.MAX_RULE_APPLICATIONS));
        assertThat(r.remainingGoals(), contains(MVarId.of(0)));
        assertThat(r.partialProof(), is(Expr.mvar(MVarId.of(0))));
    }

    @Test
    public void goalLimit() {
        SearchResult r = logic(new SearchOptions().setMaxGoals(2).setWarnOnNonterminal(false))
                .search(goal("(or Q P)", "p:P"));
        assertThat(r.failureReason(), isPresentAndIs(SearchException.Reason.MAX_GOALS));
    }

    /**
     * A safe rule introduces a shared variable; an unsafe rule on one subgoal instantiates it,
     * which forces the sibling to be copied under the instantiation before it can be proven.
     */
    @Test
    public void siblingIsCopiedAfterAssignment() {
        MVarId x = MVarId.of(1);
        Rule split = Rule.safe("split", 0, in -> {
            MetaContext c = in.context();
            c.declare(MVarDecl.of(Expr.constant("nat")));
            MVarId a = c.declare(MVarDecl.of(Expr.app("p", Expr.mvar(x))));
            MVarId b = c.declare(MVarDecl.of(Expr.app("q", Expr.mvar(x))));
            c.assign(in.goal(), Expr.app("pair", Expr.mvar(a), Expr.mvar(b)));
            return RuleResult.success(RuleOutput.of(c, ImmutableList.of(a, b), ImmutableSet.of(x, a, b), ImmutableSet.of()));
        }).withMatcher(head("goal"));
        Rule pick = Rule.unsafe("pick", 0.8, in -> {
            MetaContext c = in.context();
            c.assign(x, Expr.constant("zero"));
            c.assign(in.goal(), Expr.constant("pz"));
            return RuleResult.success(RuleOutput.of(c, ImmutableList.of(), ImmutableSet.of(), ImmutableSet.of(x)));
        }).withMatcher(head("p"));
        Rule qzero = Rule.safe("qzero", 0, in -> {
            if (!in.decl().target().equals(Expr.parse("(q zero)"))) return RuleResult.failure("not (q zero)");
            MetaContext c = in.context();
            c.assign(in.goal(), Expr.constant("qz"));
            return RuleResult.success(RuleOutput.of(c, ImmutableList.of()));
        }).withMatcher(head("q"));
        SearchResult r = new ProofSearch(SimpleRuleIndex.of(split, pick, qzero), Simplifier.NONE, new SearchOptions())
                .search(MVarDecl.of(Expr.constant("goal")));
        assertThat(r.proof(), isPresentAndIs(Expr.parse("(pair pz qz)")));
        assertThat(r.statistics().goals(), is(4));
    }

    private static SearchResult choose(double bProbability, boolean bFails) {
        MetaContext ctx = new MetaContext();
        MVarId w = ctx.declare(MVarDecl.of(Expr.constant("term")));
        MVarId g = ctx.declare(MVarDecl.of(Expr.app("p", Expr.mvar(w))));
        Rule a = Rule.safe("choose_a", 0, in -> {
            MetaContext c = in.context();
            c.assign(w, Expr.constant("a"));
            c.assign(in.goal(), Expr.constant("pa"));
            return RuleResult.success(RuleOutput.of(c, ImmutableList.of(), ImmutableSet.of(), ImmutableSet.of(w)));
        });
        Rule b = Rule.unsafe("choose_b", bProbability, in -> {
            if (bFails) return RuleResult.failure("no b");
            MetaContext c = in.context();
            c.assign(w, Expr.constant("b"));
            c.assign(in.goal(), Expr.constant("pb"));
            return RuleResult.success(RuleOutput.of(c, ImmutableList.of(), ImmutableSet.of(), ImmutableSet.of(w)));
        });
        return new ProofSearch(SimpleRuleIndex.of(a, b), Simplifier.NONE, new SearchOptions()).search(ctx.snapshot(), g);
    }

    @Test
    public void safeRuleAssigningSharedVariableIsPostponed() {
        SearchResult r = choose(0.95, false);
        assertThat(r.proof(), isPresentAndIs(Expr.constant("pb")));
        assertThat(r.finalState().assignment(MVarId.of(0)), isPresentAndIs(Expr.constant("b")));
        assertThat(choose(0.5, false).proof(), isPresentAndIs(Expr.constant("pa")));
        assertThat(choose(0.95, true).proof(), isPresentAndIs(Expr.constant("pa")));
    }

    private static final Rule loop = Rule.safe("loop", 0, in -> {
        MetaContext c = in.context();
        MVarId n = c.declare(in.decl());
        c.assign(in.goal(), Expr.app("s", Expr.mvar(n)));
        return RuleResult.success(RuleOutput.of(c, ImmutableList.of(n)));
    });

    /** Without a depth limit nothing stops the safe rule but the recursion limit. */
    @Test
    public void endlessSafeRuleHitsRecursionLimit() {
        SearchOptions options = new SearchOptions().setMaxRuleApplications(0).setMaxRuleApplicationDepth(0).setMaxRecursionDepth(20);
        try {
            new ProofSearch(SimpleRuleIndex.of(loop), Simplifier.NONE, options).search(MVarDecl.of(Expr.constant("N")));
            fail("expected the recursion limit");
        } catch (SearchException e) {
            assertThat(e.reason(), is(SearchException.Reason.RECURSION_DEPTH));
            assertThat(e.isFatal(), is(true));
            assertThat(e.tree(), isPresent());
        }
    }

    @Test
    public void endlessSafeRuleStopsAtTheDefaultDepth() {
        SearchResult r = new ProofSearch(SimpleRuleIndex.of(loop)).search(MVarDecl.of(Expr.constant("N")));
        assertThat(r.failureReason(), isPresentAndIs(SearchException.Reason.MAX_DEPTH));
        assertThat(r.statistics().iterations(), is(31));
        assertThat(r.remainingGoals(), contains(MVarId.of(30)));
    }

    @Test
    public void misbehavingRuleIsFatalEvenWhenNotTerminal() {
        Rule liar = Rule.safe("liar", 0, in -> {
            MetaContext c = in.context();
            c.declare(MVarDecl.of(Expr.constant("term")));
            c.assign(in.goal(), Expr.constant("p"));
            return RuleResult.success(RuleOutput.of(c, ImmutableList.of()));
        });
        try {
            new ProofSearch(SimpleRuleIndex.of(liar)).search(MVarDecl.of(Expr.constant("P")));
            fail("expected a rule check failure");
        } catch (SearchException e) {
            assertThat(e.reason(), is(SearchException.Reason.RULE_CHECK));
            assertThat(e.tree(), isPresent());
            assertThat(e.safePrefixGoals(), isPresentAndIs(ImmutableList.of(MVarId.of(0))));
        }
    }

    @Test
    public void throwingRuleIsJustAFailure() {
        Rule bad = Rule.safe("bad", 0, in -> { throw new UnsupportedOperationException("bad rule"); });
        SearchResult r = new ProofSearch(SimpleRuleIndex.of(bad, LogicRules.assumption()))
                .search(goal("P", "p:P"));
        assertThat(r.proof(), isPresentAndIs(Expr.constant("p")));
        assertThat(r.statistics().ruleFailures(), is(1));
    }

    @Test
    public void progressIsCountedPerSearch() {
        ProofSearch search = logic(new SearchOptions());
        search.search(goal("(and P Q)", "p:P", "q:Q"));
        SearchResult r = search.search(goal("(and P Q)", "p:P", "q:Q"));
        assertThat(search.stepCount, is(3L));
        assertThat(search.elapsed(), lessThanOrEqualTo(r.statistics().elapsed()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rootMustBeOpen() {
        MetaContext ctx = new MetaContext();
        MVarId g = ctx.declare(MVarDecl.of(Expr.constant("P")));
        ctx.assign(g, Expr.constant("p"));
        new ProofSearch(SimpleRuleIndex.of()).search(ctx.snapshot(), g);
    }

    @Test(expected = IllegalArgumentException.class)
    public void optionsAreValidated() {
        new ProofSearch(SimpleRuleIndex.of(), Simplifier.NONE, new SearchOptions().setMaxGoals(-1));
    }
}
