package net.littleredcomputer.prover.meta;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.Optional;

/**
 * An immutable capture of the solver state: metavariable declarations, assignments, delayed
 * assignments and the environment of auxiliary declarations. Snapshots are never modified;
 * {@link MetaContext#restore(Snapshot)} may be applied to the same snapshot any number of times.
 */
public final class Snapshot {

    private final ImmutableMap<MVarId, MVarDecl> decls;
    private final ImmutableMap<MVarId, Expr> assignments;
    private final ImmutableMap<MVarId, DelayedAssignment> delayed;
    private final ImmutableMap<String, Expr> environment;
    private final MVarIdSupply ids;

    Snapshot(ImmutableMap<MVarId, MVarDecl> decls,
             ImmutableMap<MVarId, Expr> assignments,
             ImmutableMap<MVarId, DelayedAssignment> delayed,
             ImmutableMap<String, Expr> environment,
             MVarIdSupply ids) {
        this.decls = decls;
        this.assignments = assignments;
        this.delayed = delayed;
        this.environment = environment;
        this.ids = ids;
    }

    ImmutableMap<MVarId, MVarDecl> decls() { return decls; }
    ImmutableMap<MVarId, Expr> assignments() { return assignments; }
    ImmutableMap<MVarId, DelayedAssignment> delayedAssignments() { return delayed; }
    MVarIdSupply ids() { return ids; }

    /** A state with nothing declared and a fresh numbering of its own. */
    public static Snapshot empty() {
        return new Snapshot(ImmutableMap.of(), ImmutableMap.of(), ImmutableMap.of(), ImmutableMap.of(), new MVarIdSupply());
    }

    public boolean isDeclared(MVarId m) { return decls.containsKey(m); }

    public Optional<MVarDecl> decl(MVarId m) { return Optional.ofNullable(decls.get(m)); }

    public Optional<Expr> assignment(MVarId m) { return Optional.ofNullable(assignments.get(m)); }

    public Optional<DelayedAssignment> delayedAssignment(MVarId m) { return Optional.ofNullable(delayed.get(m)); }

    /** @return true if {@code m} carries a direct or a delayed assignment */
    public boolean isAssigned(MVarId m) { return assignments.containsKey(m) || delayed.containsKey(m); }

    public ImmutableSet<MVarId> declaredMVars() { return decls.keySet(); }

    /** @return every metavariable with a direct or delayed assignment */
    public ImmutableSet<MVarId> assignedMVars() {
        return ImmutableSet.<MVarId>builder().addAll(assignments.keySet()).addAll(delayed.keySet()).build();
    }

    public ImmutableMap<String, Expr> environment() { return environment; }

    /** Instantiate {@code e} against this snapshot without disturbing it. */
    public Expr instantiate(Expr e) { return new MetaContext(this).instantiate(e); }

    @Override
    public String toString() {
        return "Snapshot{" + decls.size() + " declared, " + assignments.size() + " assigned, "
                + delayed.size() + " delayed, " + environment.size() + " in environment}";
    }
}
