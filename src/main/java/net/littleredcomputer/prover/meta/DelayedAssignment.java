package net.littleredcomputer.prover.meta;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * {@code ?m := fun binders => ?pending}, usable only once {@code ?pending} has been
 * assigned a term with no remaining metavariables.
 */
public final class DelayedAssignment {
    private final ImmutableList<String> binders;
    private final MVarId pending;

    public DelayedAssignment(List<String> binders, MVarId pending) {
        this.binders = ImmutableList.copyOf(binders);
        this.pending = pending;
    }

    public ImmutableList<String> binders() { return binders; }
    public MVarId pending() { return pending; }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof DelayedAssignment)) return false;
        DelayedAssignment d = (DelayedAssignment) o;
        return binders.equals(d.binders) && pending.equals(d.pending);
    }

    @Override public int hashCode() { return Objects.hash(binders, pending); }
    @Override public String toString() { return "(fun " + binders + " => " + pending + ")"; }
}
