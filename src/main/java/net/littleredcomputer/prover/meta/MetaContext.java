package net.littleredcomputer.prover.meta;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import javax.annotation.CheckReturnValue;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The mutable solver state rules operate on. Tracks which metavariables are declared, which
 * are assigned (directly or with a delay) and the environment of auxiliary declarations.
 * A context starts from a {@link Snapshot} and can capture a new one at any point.
 */
public final class MetaContext {
    private final Map<MVarId, MVarDecl> decls = new LinkedHashMap<>();
    private final Map<MVarId, Expr> assignments = new LinkedHashMap<>();
    private final Map<MVarId, DelayedAssignment> delayed = new LinkedHashMap<>();
    private final Map<String, Expr> environment = new LinkedHashMap<>();
    private MVarIdSupply ids;

    public MetaContext() { this(Snapshot.empty()); }

    public MetaContext(Snapshot s) { restore(s); }

    public void restore(Snapshot s) {
        decls.clear();
        decls.putAll(s.decls());
        assignments.clear();
        assignments.putAll(s.assignments());
        delayed.clear();
        delayed.putAll(s.delayedAssignments());
        environment.clear();
        environment.putAll(s.environment());
        ids = s.ids();
    }

    @CheckReturnValue
    public Snapshot snapshot() {
        return new Snapshot(ImmutableMap.copyOf(decls), ImmutableMap.copyOf(assignments),
                ImmutableMap.copyOf(delayed), ImmutableMap.copyOf(environment), ids);
    }

    /** Declare a fresh metavariable, numbered apart from everything declared from the same root context. */
    public MVarId declare(MVarDecl decl) {
        MVarId m = MVarId.of(ids.next());
        decls.put(m, decl);
        return m;
    }

    /** Declare a metavariable under a known identity, as when copying it from another snapshot. */
    public void declare(MVarId m, MVarDecl decl) {
        if (decls.containsKey(m)) throw new IllegalStateException(m + " is already declared");
        decls.put(m, decl);
        ids.reserve(m.id());
    }

    public boolean isDeclared(MVarId m) { return decls.containsKey(m); }

    public MVarDecl decl(MVarId m) {
        MVarDecl d = decls.get(m);
        if (d == null) throw new IllegalArgumentException("undeclared metavariable " + m);
        return d;
    }

    public boolean isAssigned(MVarId m) { return assignments.containsKey(m) || delayed.containsKey(m); }
    public boolean isDelayedAssigned(MVarId m) { return delayed.containsKey(m); }

    public Optional<Expr> assignment(MVarId m) { return Optional.ofNullable(assignments.get(m)); }
    public Optional<DelayedAssignment> delayedAssignment(MVarId m) { return Optional.ofNullable(delayed.get(m)); }

    public void assign(MVarId m, Expr value) {
        checkAssignable(m);
        if (instantiate(value).occurs(m)) throw new IllegalArgumentException("occurs check: " + m + " in " + value);
        assignments.put(m, value);
    }

    public void assignDelayed(MVarId m, List<String> binders, MVarId pending) {
        checkAssignable(m);
        if (!isDeclared(pending)) throw new IllegalArgumentException("undeclared metavariable " + pending);
        if (unassignedMVars(Expr.mvar(pending)).contains(m)) throw new IllegalArgumentException("occurs check: " + m + " in " + pending);
        delayed.put(m, new DelayedAssignment(binders, pending));
    }

    private void checkAssignable(MVarId m) {
        if (!isDeclared(m)) throw new IllegalArgumentException("undeclared metavariable " + m);
        if (isAssigned(m)) throw new IllegalStateException(m + " is already assigned");
    }

    /**
     * Replace assigned metavariables by their values, transitively. A delayed assignment is
     * only used once its pending metavariable instantiates to a closed term.
     */
    public Expr instantiate(Expr e) {
        if (!e.hasMVars()) return e;
        return e.replaceMVars(m -> {
            Expr v = assignments.get(m);
            if (v != null) return instantiate(v);
            DelayedAssignment d = delayed.get(m);
            if (d != null) {
                Expr p = instantiate(Expr.mvar(d.pending()));
                if (!p.hasMVars()) return Expr.lambda(d.binders(), p);
            }
            return null;
        });
    }

    public MVarDecl instantiate(MVarDecl d) { return d.map(this::instantiate); }

    /**
     * @return the unassigned metavariables {@code e} still depends on. A delayed-assigned
     * metavariable stands for whatever its pending metavariable depends on.
     */
    public ImmutableSet<MVarId> unassignedMVars(Expr e) {
        Set<MVarId> s = new LinkedHashSet<>();
        collectUnassigned(instantiate(e), s, new HashSet<>());
        return ImmutableSet.copyOf(s);
    }

    private void collectUnassigned(Expr e, Set<MVarId> s, Set<MVarId> visited) {
        for (MVarId m : e.mvars()) {
            if (!visited.add(m)) continue;
            DelayedAssignment d = delayed.get(m);
            if (d != null) collectUnassigned(instantiate(Expr.mvar(d.pending())), s, visited);
            else s.add(m);
        }
    }

    /** @return the unassigned metavariables the solution of {@code m} depends on ({@code m} itself if unassigned) */
    public ImmutableSet<MVarId> dependencies(MVarId m) { return unassignedMVars(Expr.mvar(m)); }

    /** @return the unassigned metavariables occurring in the obligation of goal {@code g}, other than {@code g} */
    public ImmutableSet<MVarId> goalDependencies(MVarId g) {
        MVarDecl d = decl(g);
        Set<MVarId> s = new LinkedHashSet<>(unassignedMVars(d.target()));
        for (Hypothesis h : d.hypotheses()) s.addAll(unassignedMVars(h.type()));
        s.remove(g);
        return ImmutableSet.copyOf(s);
    }

    public ImmutableSet<MVarId> declaredMVars() { return ImmutableSet.copyOf(decls.keySet()); }

    public ImmutableSet<MVarId> assignedMVars() {
        return ImmutableSet.<MVarId>builder().addAll(assignments.keySet()).addAll(delayed.keySet()).build();
    }

    public void addEnvironmentDeclaration(String name, Expr statement) {
        Expr old = environment.putIfAbsent(name, statement);
        if (old != null && !old.equals(statement)) {
            throw new IllegalStateException("environment already declares " + name + " as " + old);
        }
    }

    public ImmutableMap<String, Expr> environment() { return ImmutableMap.copyOf(environment); }
}
