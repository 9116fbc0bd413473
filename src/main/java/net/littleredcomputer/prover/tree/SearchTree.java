package net.littleredcomputer.prover.tree;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import net.littleredcomputer.prover.meta.MVarId;
import net.littleredcomputer.prover.meta.MetaContext;
import net.littleredcomputer.prover.meta.Snapshot;
import net.littleredcomputer.prover.rule.BranchState;
import net.littleredcomputer.prover.rule.Rule;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The AND/OR search tree. Nodes live in three arenas and refer to each other by index:
 * goals own rule applications (OR), rule applications own metavariable clusters (AND) and
 * clusters own goals (OR). Goal 0 is the root; it sits in cluster 0, which has no parent.
 */
public final class SearchTree {
    private static final Logger log = LogManager.getFormatterLogger(SearchTree.class);
    private static final Joiner commaJoiner = Joiner.on(", ");

    private final List<Goal> goals = new ArrayList<>();
    private final List<RuleApplication> rapps = new ArrayList<>();
    private final List<MVarCluster> clusters = new ArrayList<>();
    private int maxDepth = 0;

    /** A goal to be created under a new rule application. */
    public static final class GoalSpec {
        private final MVarId goal;
        private final ImmutableSet<MVarId> mvars;
        private final Goal.Origin origin;

        public GoalSpec(MVarId goal, ImmutableSet<MVarId> mvars, Goal.Origin origin) {
            this.goal = goal;
            this.mvars = mvars;
            this.origin = origin;
        }

        public MVarId goal() { return goal; }
        public ImmutableSet<MVarId> mvars() { return mvars; }
        public Goal.Origin origin() { return origin; }

        @Override public String toString() { return goal + (mvars.isEmpty() ? "" : " " + mvars); }
    }

    public SearchTree(MVarId root, Snapshot initial) {
        MetaContext ctx = new MetaContext(initial);
        if (!ctx.isDeclared(root)) throw new IllegalArgumentException("root goal " + root + " is not declared");
        if (ctx.isAssigned(root)) throw new IllegalArgumentException("root goal " + root + " is already assigned");
        MVarCluster c = new MVarCluster(0, -1, ImmutableSet.of());
        clusters.add(c);
        Goal g = new Goal(0, 0, root, initial, ctx.goalDependencies(root), 0, Goal.Origin.INITIAL, 1.0, BranchState.EMPTY);
        goals.add(g);
        c.goals.add(0);
    }

    public Goal root() { return goals.get(0); }
    public Goal goal(int id) { return goals.get(id); }
    public RuleApplication rapp(int id) { return rapps.get(id); }
    public MVarCluster cluster(int id) { return clusters.get(id); }
    public int goalCount() { return goals.size(); }
    public int rappCount() { return rapps.size(); }
    public int clusterCount() { return clusters.size(); }
    public int maxDepth() { return maxDepth; }

    public MVarCluster parentCluster(Goal g) { return clusters.get(g.parentCluster); }
    public Goal parentGoal(RuleApplication r) { return goals.get(r.parentGoal); }

    /** The goals created by {@code r}, cluster by cluster. */
    public List<Goal> subgoals(RuleApplication r) {
        List<Goal> gs = new ArrayList<>();
        for (int c : r.clusters) for (int g : clusters.get(c).goals) gs.add(goals.get(g));
        return gs;
    }

    /**
     * Record an application of {@code rule} to {@code parent}. Each inner list of
     * {@code clusterSpecs} becomes one cluster. An application without subgoals is proven
     * immediately.
     */
    public RuleApplication addRuleApplication(Goal parent, Rule rule, boolean safe, Snapshot postState,
                                              ImmutableSet<MVarId> introduced, ImmutableSet<MVarId> assigned,
                                              double successProbability, List<List<GoalSpec>> clusterSpecs,
                                              BranchState branchState) {
        if (parent.state.isTerminal() || parent.irrelevant) {
            throw new IllegalStateException("cannot add a rule application to " + parent + " in state " + parent.state
                    + (parent.irrelevant ? " (irrelevant)" : ""));
        }
        RuleApplication r = new RuleApplication(rapps.size(), parent.id, rule, safe, postState, introduced, assigned,
                parent.successProbability() * successProbability);
        rapps.add(r);
        parent.children.add(r.id);
        for (List<GoalSpec> spec : clusterSpecs) {
            if (spec.isEmpty()) throw new IllegalArgumentException("empty cluster in application of " + rule.name());
            Set<MVarId> shared = new LinkedHashSet<>();
            for (GoalSpec s : spec) shared.addAll(s.mvars());
            MVarCluster c = new MVarCluster(clusters.size(), r.id, ImmutableSet.copyOf(shared));
            clusters.add(c);
            r.clusters.add(c.id);
            for (GoalSpec s : spec) {
                Goal g = new Goal(goals.size(), c.id, s.goal(), postState, s.mvars(), parent.depth() + 1, s.origin(),
                        r.successProbability(), branchState);
                goals.add(g);
                c.goals.add(g.id);
            }
        }
        maxDepth = Math.max(maxDepth, parent.depth() + 1);
        log.debug("added %s to %s with clusters %s", r, parent, clusterSpecs);
        if (r.clusters.isEmpty()) markProven(r);
        return r;
    }

    /**
     * Goals that must be re-created under a rule application on {@code start} that assigned
     * {@code assigned}: the unproven goals in {@code start}'s cluster and in its ancestors'
     * clusters that depend on an assigned metavariable. The walk stops at the application
     * that introduced all of the assigned metavariables.
     */
    public List<Goal> goalsToCopy(Goal start, Set<MVarId> assigned) {
        List<Goal> result = new ArrayList<>();
        if (assigned.isEmpty()) return result;
        Set<MVarId> introducedBelow = new HashSet<>();
        Goal cur = start;
        while (true) {
            MVarCluster c = clusters.get(cur.parentCluster);
            for (int gid : c.goals) {
                if (gid == cur.id) continue;
                Goal s = goals.get(gid);
                if (s.state == NodeState.PROVEN || s.irrelevant) continue;
                if (!Collections.disjoint(s.mvars(), assigned)) result.add(s);
            }
            if (c.isRoot()) break;
            RuleApplication r = rapps.get(c.parentRapp);
            introducedBelow.addAll(r.introducedMVars());
            if (introducedBelow.containsAll(assigned)) break;
            cur = goals.get(r.parentGoal);
        }
        return result;
    }

    public boolean isActive(Goal g) {
        return g.state == NodeState.UNKNOWN && !g.irrelevant && !g.isExhausted();
    }

    public void markProven(Goal g) {
        if (g.state == NodeState.PROVEN) return;
        if (g.state == NodeState.UNPROVABLE) throw new IllegalStateException(g + " is unprovable and cannot be proven");
        g.state = NodeState.PROVEN;
        log.debug("%s proven", g);
        for (int rid : g.children) {
            RuleApplication r = rapps.get(rid);
            if (r.state != NodeState.PROVEN) markIrrelevant(r);
        }
        markProven(clusters.get(g.parentCluster));
    }

    private void markProven(MVarCluster c) {
        if (c.state == NodeState.PROVEN) return;
        if (c.state == NodeState.UNPROVABLE) throw new IllegalStateException(c + " is unprovable and cannot be proven");
        c.state = NodeState.PROVEN;
        for (int gid : c.goals) {
            Goal g = goals.get(gid);
            if (g.state != NodeState.PROVEN) markIrrelevant(g);
        }
        if (c.isRoot()) return;
        RuleApplication r = rapps.get(c.parentRapp);
        for (int cid : r.clusters) if (clusters.get(cid).state != NodeState.PROVEN) return;
        markProven(r);
    }

    public void markProven(RuleApplication r) {
        if (r.state == NodeState.PROVEN) return;
        if (r.state == NodeState.UNPROVABLE) throw new IllegalStateException(r + " is unprovable and cannot be proven");
        r.state = NodeState.PROVEN;
        markProven(goals.get(r.parentGoal));
    }

    public void markUnprovable(Goal g) {
        if (g.state == NodeState.UNPROVABLE) return;
        if (g.state == NodeState.PROVEN) throw new IllegalStateException(g + " is proven and cannot be unprovable");
        g.state = NodeState.UNPROVABLE;
        log.debug("%s unprovable", g);
        MVarCluster c = clusters.get(g.parentCluster);
        for (int gid : c.goals) if (goals.get(gid).state != NodeState.UNPROVABLE) return;
        markUnprovable(c);
    }

    private void markUnprovable(MVarCluster c) {
        if (c.state.isTerminal()) return;
        c.state = NodeState.UNPROVABLE;
        if (!c.isRoot()) markUnprovable(rapps.get(c.parentRapp));
    }

    public void markUnprovable(RuleApplication r) {
        if (r.state == NodeState.UNPROVABLE) return;
        if (r.state == NodeState.PROVEN) throw new IllegalStateException(r + " is proven and cannot be unprovable");
        r.state = NodeState.UNPROVABLE;
        for (int cid : r.clusters) {
            MVarCluster c = clusters.get(cid);
            if (!c.state.isTerminal()) markIrrelevant(c);
        }
        updateUnprovable(goals.get(r.parentGoal));
    }

    /** Give up on a goal without trying any further rule, as when it lies too deep. */
    public void markForcedUnprovable(Goal g) {
        g.forcedUnprovable = true;
        markUnprovable(g);
    }

    /**
     * Mark {@code g} unprovable if nothing remains to be tried on it and every rule application
     * tried so far is unprovable.
     * @return true if {@code g} is now unprovable
     */
    public boolean updateUnprovable(Goal g) {
        if (g.state.isTerminal()) return g.state == NodeState.UNPROVABLE;
        if (!g.isExhausted()) return false;
        for (int rid : g.children) if (rapps.get(rid).state != NodeState.UNPROVABLE) return false;
        markUnprovable(g);
        return true;
    }

    private void markIrrelevant(Goal g) {
        if (g.irrelevant) return;
        g.irrelevant = true;
        for (int rid : g.children) markIrrelevant(rapps.get(rid));
    }

    private void markIrrelevant(RuleApplication r) {
        if (r.irrelevant) return;
        r.irrelevant = true;
        for (int cid : r.clusters) markIrrelevant(clusters.get(cid));
    }

    private void markIrrelevant(MVarCluster c) {
        if (c.irrelevant) return;
        c.irrelevant = true;
        for (int gid : c.goals) markIrrelevant(goals.get(gid));
    }

    /** Indented rendering of the whole tree, for logs and diagnostics. */
    public String render() {
        StringBuilder sb = new StringBuilder();
        render(root(), 0, sb);
        return sb.toString();
    }

    private void render(Goal g, int indent, StringBuilder sb) {
        List<String> flags = new ArrayList<>();
        flags.add(g.state.toString().toLowerCase());
        if (g.irrelevant) flags.add("irrelevant");
        if (g.forcedUnprovable) flags.add("forced");
        if (g.origin() == Goal.Origin.COPY) flags.add("copy");
        if (!g.failedRules().isEmpty()) flags.add("failed: " + commaJoiner.join(g.failedRules()));
        sb.append(Strings.repeat("  ", indent)).append("G").append(g.id).append(" [").append(commaJoiner.join(flags)).append("] ")
                .append(g.preNormGoal()).append(" : ").append(g.decl()).append(" (").append(g.normalization()).append(")\n");
        for (int rid : g.children) {
            RuleApplication r = rapps.get(rid);
            sb.append(Strings.repeat("  ", indent + 1)).append("R").append(r.id).append(" ").append(r.rule().name())
                    .append(r.isSafe() ? " safe" : "").append(" [").append(r.state.toString().toLowerCase())
                    .append(r.irrelevant ? ", irrelevant" : "").append("]\n");
            for (int cid : r.clusters) {
                MVarCluster c = clusters.get(cid);
                sb.append(Strings.repeat("  ", indent + 2)).append("C").append(c.id).append(" ").append(c.sharedMVars())
                        .append(" [").append(c.state.toString().toLowerCase()).append("]\n");
                for (int gid : c.goals) render(goals.get(gid), indent + 3, sb);
            }
        }
    }

    public ImmutableList<Goal> goals() { return ImmutableList.copyOf(goals); }
}
