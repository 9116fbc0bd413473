package net.littleredcomputer.prover.search;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.prover.meta.MVarId;
import net.littleredcomputer.prover.meta.MetaContext;
import net.littleredcomputer.prover.meta.Snapshot;
import net.littleredcomputer.prover.tree.Goal;
import net.littleredcomputer.prover.tree.NormalizationState;
import net.littleredcomputer.prover.tree.RuleApplication;
import net.littleredcomputer.prover.tree.SearchTree;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;

/**
 * The part of the tree reachable from the root through safe rule applications only. When a
 * search fails, the safe prefix is first completed (its goals normalized and safe rules tried on
 * them) and then replayed, leaving the goals it could not close.
 */
final class SafePrefix {
    private static final Logger log = LogManager.getFormatterLogger(SafePrefix.class);

    private final SearchTree tree;
    private final GoalExpander expander;
    private final SearchOptions options;
    private final RecursionGuard guard;
    private int rappsLeft;
    private boolean limitWarned = false;

    SafePrefix(SearchTree tree, GoalExpander expander, SearchOptions options, RecursionGuard guard) {
        this.tree = tree;
        this.expander = expander;
        this.options = options;
        this.guard = guard;
    }

    /** Goals left open by the safe prefix, and the state the prefix leads to. */
    static final class Extraction {
        private final Snapshot state;
        private final ImmutableList<MVarId> goals;

        Extraction(Snapshot state, ImmutableList<MVarId> goals) {
            this.state = state;
            this.goals = goals;
        }

        Snapshot state() { return state; }
        ImmutableList<MVarId> goals() { return goals; }
    }

    static Optional<RuleApplication> safeRapp(SearchTree tree, Goal g) {
        for (int rid : g.children()) {
            RuleApplication r = tree.rapp(rid);
            if (r.isSafe()) return Optional.of(r);
        }
        return Optional.empty();
    }

    /** Normalize and safe-expand the prefix goals the search never got to. */
    void expand() {
        rappsLeft = options.maxSafePrefixRuleApplications();
        int before = tree.rappCount();
        expand(tree.root());
        log.debug("safe prefix expansion added %d rule applications", tree.rappCount() - before);
    }

    private void expand(Goal g) {
        guard.enter();
        try {
            if (!g.state().isTerminal() && !g.isIrrelevant()) expandGoal(g);
            if (!g.normalization().isNormalized()) return;
            Optional<RuleApplication> r = safeRapp(tree, g);
            if (!r.isPresent()) return;
            for (Goal s : tree.subgoals(r.get())) expand(s);
        } finally {
            guard.exit();
        }
    }

    private void expandGoal(Goal g) {
        if (g.normalization().isNormalized() && g.safeRulesTried()) return;
        if (expander.depthLimited(g)) return;
        if (expander.normalize(g) || g.safeRulesTried()) return;
        if (rappsLeft <= 0) {
            if (!limitWarned) {
                log.warn("safe prefix expansion stopped after %d rule applications", options.maxSafePrefixRuleApplications());
                limitWarned = true;
            }
            return;
        }
        if (expander.runSafeRules(g)) --rappsLeft;
    }

    /** Replay the safe prefix from the root's initial state. */
    Extraction extract() {
        Goal root = tree.root();
        MetaContext ctx = new MetaContext(root.preState());
        ImmutableList.Builder<MVarId> open = ImmutableList.builder();
        visit(ctx, root, open);
        return new Extraction(ctx.snapshot(), open.build());
    }

    private void visit(MetaContext ctx, Goal g, ImmutableList.Builder<MVarId> open) {
        guard.enter();
        try {
            if (!g.normalization().isNormalized()) {
                open.add(g.preNormGoal());
                return;
            }
            ProofExtractor.transplant(ctx, g.postNormState(), g.preState(), guard);
            if (g.normalization().kind() != NormalizationState.Kind.NORMAL) return;
            Optional<RuleApplication> r = safeRapp(tree, g);
            if (!r.isPresent()) {
                open.add(g.postNormGoal());
                return;
            }
            ProofExtractor.transplant(ctx, r.get().postState(), g.postNormState(), guard);
            for (Goal s : tree.subgoals(r.get())) visit(ctx, s, open);
        } finally {
            guard.exit();
        }
    }
}
