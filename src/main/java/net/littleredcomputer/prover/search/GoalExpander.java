package net.littleredcomputer.prover.search;

import com.google.common.collect.ImmutableSet;
import net.littleredcomputer.prover.meta.MVarDecl;
import net.littleredcomputer.prover.meta.MVarId;
import net.littleredcomputer.prover.meta.MetaContext;
import net.littleredcomputer.prover.meta.Snapshot;
import net.littleredcomputer.prover.rule.Rule;
import net.littleredcomputer.prover.rule.RuleIndex;
import net.littleredcomputer.prover.rule.RuleMatch;
import net.littleredcomputer.prover.rule.RuleOutput;
import net.littleredcomputer.prover.tree.Goal;
import net.littleredcomputer.prover.tree.NormalizationState;
import net.littleredcomputer.prover.tree.SearchTree;
import net.littleredcomputer.prover.tree.UnsafeQueue;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** The steps of expanding one goal: normalization, safe rules, then one unsafe alternative. */
final class GoalExpander {
    private static final Logger log = LogManager.getFormatterLogger(GoalExpander.class);

    private final SearchTree tree;
    private final RuleIndex rules;
    private final SearchOptions options;
    private final RuleDriver driver;
    private final Normalizer normalizer;
    private final RecursionGuard guard;
    private boolean maxDepthReached = false;

    GoalExpander(SearchTree tree, RuleIndex rules, SearchOptions options, RuleDriver driver,
                 Normalizer normalizer, RecursionGuard guard) {
        this.tree = tree;
        this.rules = rules;
        this.options = options;
        this.driver = driver;
        this.normalizer = normalizer;
        this.guard = guard;
    }

    /** True once some goal was given up because of {@link SearchOptions#maxRuleApplicationDepth()}. */
    boolean maxDepthReached() { return maxDepthReached; }

    /** Run one expansion step on an active goal. */
    void expand(Goal g, int iteration) {
        guard.check(g.depth());
        g.setLastExpandedInIteration(iteration);
        log.debug("expanding %s at depth %d (p = %.4f)", g, g.depth(), g.successProbability());
        if (depthLimited(g)) return;
        if (normalize(g)) return;
        if (!g.safeRulesTried() && runSafeRules(g)) return;
        runFirstUnsafeRule(g);
    }

    /** Force {@code g} unprovable if applying a rule to it would exceed the depth limit. */
    boolean depthLimited(Goal g) {
        int max = options.maxRuleApplicationDepth();
        if (max == 0 || g.depth() < max) return false;
        log.debug("%s at depth %d reached the rule application depth limit", g, g.depth());
        maxDepthReached = true;
        tree.markForcedUnprovable(g);
        return true;
    }

    /**
     * Normalize {@code g} unless it already is.
     * @return true if the goal was proven by normalization
     */
    boolean normalize(Goal g) {
        if (!g.normalization().isNormalized()) {
            Normalizer.Result r = normalizer.normalize(g.preNormGoal(), g.preState(), g.branchState());
            g.setNormalization(r.state());
            g.setBranchState(r.branchState());
        }
        if (g.normalization().kind() == NormalizationState.Kind.PROVEN_BY_NORMALIZATION) {
            tree.markProven(g);
            return true;
        }
        return false;
    }

    private MVarDecl normalDecl(Goal g) {
        MetaContext ctx = new MetaContext(g.postNormState());
        return ctx.instantiate(ctx.decl(g.postNormGoal()));
    }

    private ImmutableSet<MVarId> accessible(Goal g) {
        return new MetaContext(g.postNormState()).goalDependencies(g.postNormGoal());
    }

    /**
     * Try the safe rules on a normalized goal in penalty order. The first one that applies
     * without making a choice wins and closes the goal to further rules; the others are
     * postponed until unsafe rules are selected.
     * @return true if a safe rule was applied
     */
    boolean runSafeRules(Goal g) {
        MVarId goal = g.postNormGoal();
        Snapshot pre = g.postNormState();
        ImmutableSet<MVarId> accessible = accessible(g);
        boolean applied = false;
        for (RuleMatch m : rules.safeRules(normalDecl(g))) {
            RuleDriver.Attempt a = driver.run(m, goal, pre, accessible, g.branchState());
            if (a.failed()) {
                g.addFailedRule(m.rule().name());
                continue;
            }
            if (a.needsPostponement()) {
                log.debug("postponing safe rule %s on %s", m.rule().name(), g);
                g.addPostponedSafeRule(UnsafeQueue.Entry.postponed(m, a.outputs(), a.branchState(),
                        options.postponedSafeRuleSuccessProbability()));
                continue;
            }
            RuleOutput o = a.outputs().get(0);
            driver.apply(g, m.rule(), true, o, o.successProbability(), a.branchState());
            applied = true;
            break;
        }
        g.setSafeRulesTried();
        if (applied && !g.unsafeRulesSelected()) g.setUnsafeQueue(UnsafeQueue.empty());
        return applied;
    }

    /** Apply the most promising remaining unsafe alternative of {@code g}, or give up on it. */
    void runFirstUnsafeRule(Goal g) {
        if (!g.unsafeRulesSelected()) {
            List<UnsafeQueue.Entry> es = new ArrayList<>(g.postponedSafeRules());
            for (RuleMatch m : rules.unsafeRules(normalDecl(g))) es.add(UnsafeQueue.Entry.unsafe(m));
            g.setUnsafeQueue(UnsafeQueue.of(es));
            log.debug("selected unsafe rules for %s: %s", g, g.unsafeQueue());
        }
        UnsafeQueue q = g.unsafeQueue();
        while (!q.isEmpty()) {
            UnsafeQueue.Entry e = q.pop();
            Rule rule = e.match().rule();
            List<RuleOutput> outputs;
            Optional<Object> branchUpdate;
            if (e.isPostponed()) {
                outputs = e.postponedOutputs();
                branchUpdate = e.postponedBranchState();
            } else {
                RuleDriver.Attempt a = driver.run(e.match(), g.postNormGoal(), g.postNormState(), accessible(g), g.branchState());
                if (a.failed()) {
                    g.addFailedRule(rule.name());
                    continue;
                }
                outputs = a.outputs();
                branchUpdate = a.branchState();
            }
            for (RuleOutput o : outputs) {
                driver.apply(g, rule, false, o, o.successProbability() * e.successProbability(), branchUpdate);
                if (g.state().isTerminal()) break;
            }
            return;
        }
        log.debug("no unsafe rules left for %s", g);
        tree.updateUnprovable(g);
    }
}
