package net.littleredcomputer.prover.meta;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * The obligation attached to a metavariable: a target to be inhabited under a list of
 * hypotheses. Later hypotheses shadow earlier ones of the same name.
 */
public final class MVarDecl {
    private static final Joiner commaJoiner = Joiner.on(", ");
    private final Expr target;
    private final ImmutableList<Hypothesis> hypotheses;
    private final String userName;

    public MVarDecl(Expr target, List<Hypothesis> hypotheses, String userName) {
        this.target = target;
        this.hypotheses = ImmutableList.copyOf(hypotheses);
        this.userName = userName;
    }

    public static MVarDecl of(Expr target, Hypothesis... hypotheses) {
        return new MVarDecl(target, ImmutableList.copyOf(hypotheses), "");
    }

    public Expr target() { return target; }
    public ImmutableList<Hypothesis> hypotheses() { return hypotheses; }
    public String userName() { return userName; }

    public Optional<Hypothesis> hypothesis(String name) {
        for (int i = hypotheses.size() - 1; i >= 0; --i) {
            if (hypotheses.get(i).name().equals(name)) return Optional.of(hypotheses.get(i));
        }
        return Optional.empty();
    }

    public MVarDecl withTarget(Expr t) { return new MVarDecl(t, hypotheses, userName); }

    public MVarDecl withHypotheses(List<Hypothesis> hs) { return new MVarDecl(target, hs, userName); }

    public MVarDecl withHypothesis(Hypothesis h) {
        return withHypotheses(ImmutableList.<Hypothesis>builder().addAll(hypotheses).add(h).build());
    }

    public MVarDecl withUserName(String name) { return new MVarDecl(target, hypotheses, name); }

    /** A hypothesis name not yet used in this context, built from {@code base}. */
    public String freshHypothesisName(String base) {
        if (!hypothesis(base).isPresent()) return base;
        for (int i = 1; ; ++i) {
            String n = base + "_" + i;
            if (!hypothesis(n).isPresent()) return n;
        }
    }

    MVarDecl map(UnaryOperator<Expr> f) {
        ImmutableList.Builder<Hypothesis> hs = ImmutableList.builder();
        for (Hypothesis h : hypotheses) hs.add(h.withType(f.apply(h.type())));
        return new MVarDecl(f.apply(target), hs.build(), userName);
    }

    /** @return the metavariables occurring in the target or in any hypothesis */
    public ImmutableSet<MVarId> mvars() {
        Set<MVarId> s = new LinkedHashSet<>(target.mvars());
        for (Hypothesis h : hypotheses) s.addAll(h.type().mvars());
        return ImmutableSet.copyOf(s);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof MVarDecl)) return false;
        MVarDecl d = (MVarDecl) o;
        return target.equals(d.target) && hypotheses.equals(d.hypotheses) && userName.equals(d.userName);
    }

    @Override public int hashCode() { return Objects.hash(target, hypotheses, userName); }

    @Override
    public String toString() {
        return (hypotheses.isEmpty() ? "" : commaJoiner.join(hypotheses) + " ") + "⊢ " + target;
    }
}
