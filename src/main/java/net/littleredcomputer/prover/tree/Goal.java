package net.littleredcomputer.prover.tree;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import net.littleredcomputer.prover.meta.MVarDecl;
import net.littleredcomputer.prover.meta.MVarId;
import net.littleredcomputer.prover.meta.Snapshot;
import net.littleredcomputer.prover.rule.BranchState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A proof obligation under search. Identified by its index in the {@link SearchTree}; links to
 * its parent cluster and child rule applications are indices as well.
 */
public final class Goal {
    public enum Origin {
        INITIAL,
        SUBGOAL,
        COPY,  // re-created under a rule application that assigned a variable this goal depends on
    }

    final int id;
    final int parentCluster;
    private final MVarId preNormGoal;
    private final Snapshot preState;
    private final ImmutableSet<MVarId> mvars;
    private final int depth;
    private final Origin origin;
    private final double successProbability;
    final List<Integer> children = new ArrayList<>();
    private final Set<String> failedRules = new LinkedHashSet<>();
    private final List<UnsafeQueue.Entry> postponed = new ArrayList<>();
    private BranchState branchState;
    private NormalizationState normalization = NormalizationState.NOT_NORMAL;
    private UnsafeQueue unsafeQueue;  // null until unsafe rules have been selected
    private boolean safeRulesTried = false;
    private int lastExpandedInIteration = -1;
    NodeState state = NodeState.UNKNOWN;
    boolean irrelevant = false;
    boolean forcedUnprovable = false;

    Goal(int id, int parentCluster, MVarId preNormGoal, Snapshot preState, ImmutableSet<MVarId> mvars,
         int depth, Origin origin, double successProbability, BranchState branchState) {
        this.id = id;
        this.parentCluster = parentCluster;
        this.preNormGoal = preNormGoal;
        this.preState = preState;
        this.mvars = mvars;
        this.depth = depth;
        this.origin = origin;
        this.successProbability = successProbability;
        this.branchState = branchState;
    }

    public int id() { return id; }
    public int parentCluster() { return parentCluster; }

    /** The goal's metavariable before normalization. */
    public MVarId preNormGoal() { return preNormGoal; }

    /** The state the goal was created in. */
    public Snapshot preState() { return preState; }

    public MVarDecl decl() {
        return preState.decl(preNormGoal).orElseThrow(() -> new IllegalStateException(preNormGoal + " undeclared in its own state"));
    }

    /** Unassigned metavariables the goal's obligation mentions. */
    public ImmutableSet<MVarId> mvars() { return mvars; }

    /** Number of rule applications between the root and this goal. */
    public int depth() { return depth; }
    public Origin origin() { return origin; }
    public double successProbability() { return successProbability; }
    public List<Integer> children() { return Collections.unmodifiableList(children); }
    public NodeState state() { return state; }
    public boolean isProven() { return state == NodeState.PROVEN; }
    public boolean isUnprovable() { return state == NodeState.UNPROVABLE; }
    public boolean isIrrelevant() { return irrelevant; }
    public boolean isForcedUnprovable() { return forcedUnprovable; }

    public BranchState branchState() { return branchState; }
    public void setBranchState(BranchState b) { branchState = b; }

    public NormalizationState normalization() { return normalization; }

    public void setNormalization(NormalizationState n) {
        if (normalization.isNormalized()) throw new IllegalStateException("goal " + id + " is already normalized");
        if (!n.isNormalized()) throw new IllegalArgumentException("cannot reset normalization of goal " + id);
        normalization = n;
    }

    /** The goal's metavariable after normalization. */
    public MVarId postNormGoal() { return normalization.postGoal(); }

    /** The state after normalization, against which rules run. */
    public Snapshot postNormState() { return normalization.snapshot(); }

    public boolean safeRulesTried() { return safeRulesTried; }
    public void setSafeRulesTried() { safeRulesTried = true; }

    public boolean unsafeRulesSelected() { return unsafeQueue != null; }

    public UnsafeQueue unsafeQueue() {
        if (unsafeQueue == null) throw new IllegalStateException("unsafe rules of goal " + id + " not selected yet");
        return unsafeQueue;
    }

    public void setUnsafeQueue(UnsafeQueue q) {
        if (unsafeQueue != null) throw new IllegalStateException("unsafe rules of goal " + id + " already selected");
        unsafeQueue = q;
    }

    public Set<String> failedRules() { return Collections.unmodifiableSet(failedRules); }
    public void addFailedRule(String rule) { failedRules.add(rule); }

    public ImmutableList<UnsafeQueue.Entry> postponedSafeRules() { return ImmutableList.copyOf(postponed); }
    public void addPostponedSafeRule(UnsafeQueue.Entry e) { postponed.add(e); }

    public int lastExpandedInIteration() { return lastExpandedInIteration; }
    public void setLastExpandedInIteration(int i) { lastExpandedInIteration = i; }

    /** True when no rule remains to be tried on this goal. */
    public boolean isExhausted() {
        return forcedUnprovable
                || (normalization.isNormalized() && safeRulesTried && unsafeQueue != null && unsafeQueue.isEmpty());
    }

    @Override public String toString() { return "G" + id + " " + preNormGoal; }
}
