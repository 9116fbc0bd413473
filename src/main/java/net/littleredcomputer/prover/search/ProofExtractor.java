package net.littleredcomputer.prover.search;

import net.littleredcomputer.prover.meta.DelayedAssignment;
import net.littleredcomputer.prover.meta.Expr;
import net.littleredcomputer.prover.meta.MVarDecl;
import net.littleredcomputer.prover.meta.MVarId;
import net.littleredcomputer.prover.meta.MetaContext;
import net.littleredcomputer.prover.meta.Snapshot;
import net.littleredcomputer.prover.tree.Goal;
import net.littleredcomputer.prover.tree.MVarCluster;
import net.littleredcomputer.prover.tree.NormalizationState;
import net.littleredcomputer.prover.tree.RuleApplication;
import net.littleredcomputer.prover.tree.SearchTree;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Optional;

/**
 * Replays a proven tree into a single running {@link MetaContext}. Each step copies into the
 * running context the assignments a later snapshot made on top of the snapshot taken before
 * the step, declaring and back-filling whatever metavariables those assignments mention.
 */
final class ProofExtractor {
    private static final Logger log = LogManager.getFormatterLogger(ProofExtractor.class);

    private final SearchTree tree;
    private final RecursionGuard guard;

    ProofExtractor(SearchTree tree, RecursionGuard guard) {
        this.tree = tree;
        this.guard = guard;
    }

    /** The extracted proof with the state it was extracted into. */
    static final class Extraction {
        private final Snapshot state;
        private final Expr proof;

        Extraction(Snapshot state, Expr proof) {
            this.state = state;
            this.proof = proof;
        }

        Snapshot state() { return state; }
        Expr proof() { return proof; }
    }

    Extraction extract() {
        Goal root = tree.root();
        if (!root.isProven()) throw internal("root goal is not proven");
        MetaContext ctx = new MetaContext(root.preState());
        visit(ctx, root);
        Expr proof = ctx.instantiate(Expr.mvar(root.preNormGoal()));
        if (proof.hasMVars()) throw internal("extracted proof still mentions metavariables " + proof.mvars() + ": " + proof);
        log.debug("extracted %s", proof);
        return new Extraction(ctx.snapshot(), proof);
    }

    private void visit(MetaContext ctx, Goal g) {
        guard.enter();
        try {
            if (!g.normalization().isNormalized()) throw internal(g + " is proven but was never normalized");
            transplant(ctx, g.postNormState(), g.preState(), guard);
            if (g.normalization().kind() == NormalizationState.Kind.PROVEN_BY_NORMALIZATION) return;
            RuleApplication r = provenChild(g).orElseThrow(() -> internal(g + " is proven but has no proven rule application"));
            transplant(ctx, r.postState(), g.postNormState(), guard);
            for (int cid : r.clusters()) {
                MVarCluster c = tree.cluster(cid);
                visit(ctx, provenMember(c).orElseThrow(() -> internal(c + " is proven but has no proven goal")));
            }
        } finally {
            guard.exit();
        }
    }

    private Optional<RuleApplication> provenChild(Goal g) {
        for (int rid : g.children()) {
            RuleApplication r = tree.rapp(rid);
            if (r.isProven()) return Optional.of(r);
        }
        return Optional.empty();
    }

    /** The first proven member in creation order is the cluster's witness. */
    private Optional<Goal> provenMember(MVarCluster c) {
        for (int gid : c.goals()) {
            Goal g = tree.goal(gid);
            if (g.isProven()) return Optional.of(g);
        }
        return Optional.empty();
    }

    private static SearchException internal(String message) {
        return new SearchException(SearchException.Reason.INTERNAL, message);
    }

    /**
     * Copy into {@code ctx} the assignments {@code source} made to metavariables declared in
     * {@code before} and left unassigned there, then merge {@code source}'s environment.
     */
    static void transplant(MetaContext ctx, Snapshot source, Snapshot before, RecursionGuard guard) {
        for (MVarId m : source.assignedMVars()) {
            if (before.isDeclared(m) && !before.isAssigned(m)) copyAssignment(ctx, source, m, guard);
        }
        for (Map.Entry<String, Expr> e : source.environment().entrySet()) {
            if (!before.environment().containsKey(e.getKey())) ctx.addEnvironmentDeclaration(e.getKey(), e.getValue());
        }
    }

    /** Copy {@code m}'s assignment from {@code source}, first copying those of the metavariables it mentions. */
    static void copyAssignment(MetaContext ctx, Snapshot source, MVarId m, RecursionGuard guard) {
        if (ctx.isAssigned(m)) return;
        guard.enter();
        try {
            ensureDeclared(ctx, source, m);
            Optional<Expr> v = source.assignment(m);
            if (v.isPresent()) {
                for (MVarId n : v.get().mvars()) copyAssignment(ctx, source, n, guard);
                if (!ctx.isAssigned(m)) ctx.assign(m, v.get());
                return;
            }
            Optional<DelayedAssignment> d = source.delayedAssignment(m);
            if (d.isPresent()) {
                copyAssignment(ctx, source, d.get().pending(), guard);
                if (!ctx.isAssigned(m)) ctx.assignDelayed(m, d.get().binders(), d.get().pending());
            }
        } finally {
            guard.exit();
        }
    }

    private static void ensureDeclared(MetaContext ctx, Snapshot source, MVarId m) {
        if (ctx.isDeclared(m)) {
            Optional<MVarDecl> other = source.decl(m);
            if (other.isPresent() && !other.get().equals(ctx.decl(m))) {
                throw internal(m + " is declared as both " + ctx.decl(m) + " and " + other.get());
            }
            return;
        }
        MVarDecl d = source.decl(m).orElseThrow(() -> internal(m + " is not declared in the snapshot being replayed"));
        ctx.declare(m, d);
        for (MVarId n : d.mvars()) ensureDeclared(ctx, source, n);
    }
}
