package net.littleredcomputer.prover.tree;

import com.google.common.collect.ImmutableSet;
import net.littleredcomputer.prover.meta.MVarId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Subgoals of one rule application that share unassigned metavariables. Proven as soon as any
 * member is proven; the first proven member in order is the cluster's witness.
 */
public final class MVarCluster {
    final int id;
    final int parentRapp;  // -1 for the root cluster
    private final ImmutableSet<MVarId> sharedMVars;
    final List<Integer> goals = new ArrayList<>();
    NodeState state = NodeState.UNKNOWN;
    boolean irrelevant = false;

    MVarCluster(int id, int parentRapp, ImmutableSet<MVarId> sharedMVars) {
        this.id = id;
        this.parentRapp = parentRapp;
        this.sharedMVars = sharedMVars;
    }

    public int id() { return id; }
    public int parentRapp() { return parentRapp; }
    public boolean isRoot() { return parentRapp < 0; }
    public ImmutableSet<MVarId> sharedMVars() { return sharedMVars; }
    public List<Integer> goals() { return Collections.unmodifiableList(goals); }
    public NodeState state() { return state; }
    public boolean isProven() { return state == NodeState.PROVEN; }
    public boolean isUnprovable() { return state == NodeState.UNPROVABLE; }
    public boolean isIrrelevant() { return irrelevant; }

    @Override public String toString() { return "C" + id + " " + sharedMVars; }
}
