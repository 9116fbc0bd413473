package net.littleredcomputer.prover.search;

import net.littleredcomputer.prover.logic.LogicRules;
import net.littleredcomputer.prover.meta.Expr;
import net.littleredcomputer.prover.meta.MVarDecl;
import net.littleredcomputer.prover.meta.MVarId;
import net.littleredcomputer.prover.meta.MetaContext;
import net.littleredcomputer.prover.rule.SimpleRuleIndex;
import net.littleredcomputer.prover.rule.Simplifier;
import net.littleredcomputer.prover.tree.SearchTree;
import org.junit.Test;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class SafePrefixTest {
    private final SearchOptions options = new SearchOptions();
    private SearchTree tree;
    private GoalExpander expander;
    private SafePrefix prefix;

    private void start(String target) {
        MetaContext ctx = new MetaContext();
        MVarId g = ctx.declare(MVarDecl.of(Expr.parse(target)));
        tree = new SearchTree(g, ctx.snapshot());
        Statistics stats = new Statistics();
        RecursionGuard guard = new RecursionGuard(options.maxRecursionDepth());
        SimpleRuleIndex rules = new SimpleRuleIndex(LogicRules.defaultRules());
        RuleDriver driver = new RuleDriver(tree, options, stats);
        expander = new GoalExpander(tree, rules, options, driver,
                new Normalizer(rules, Simplifier.NONE, options, driver, stats), guard);
        prefix = new SafePrefix(tree, expander, options, guard);
    }

    @Test
    public void expandsAndReplaysSafeRules() {
        start("(and P (imp Q Q))");
        prefix.expand();
        SafePrefix.Extraction x = prefix.extract();
        // P has no hypothesis to close it; the implication is closed by intro and assumption
        assertThat(x.goals(), contains(MVarId.of(1)));
        assertThat(x.state().instantiate(Expr.mvar(MVarId.of(0))), is(Expr.parse("(and_intro ?1 (fun (h) h))")));
        assertThat(tree.root().isProven(), is(false));
    }

    @Test
    public void stopsAtUnsafeApplications() {
        start("(or P Q)");
        expander.expand(tree.root(), 1);
        assertThat(tree.rappCount(), is(1));
        prefix.expand();
        assertThat(tree.rappCount(), is(1));
        assertThat(prefix.extract().goals(), contains(MVarId.of(0)));
    }

    @Test
    public void respectsItsBudget() {
        options.setMaxSafePrefixRuleApplications(1);
        start("(and (and P P) P)");
        prefix.expand();
        assertThat(tree.rappCount(), is(1));
        assertThat(prefix.extract().goals(), contains(MVarId.of(1), MVarId.of(2)));
    }

    @Test
    public void respectsTheDepthLimit() {
        options.setMaxRuleApplicationDepth(1);
        start("(and P P)");
        prefix.expand();
        assertThat(expander.maxDepthReached(), is(true));
        assertThat(tree.goal(1).isForcedUnprovable(), is(true));
        assertThat(prefix.extract().goals(), contains(MVarId.of(1), MVarId.of(2)));
    }
}
