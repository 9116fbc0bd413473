package net.littleredcomputer.prover.meta;

import java.util.Objects;

/** A named local assumption of a goal. */
public final class Hypothesis {
    private final String name;
    private final Expr type;

    public Hypothesis(String name, Expr type) {
        if (name.isEmpty()) throw new IllegalArgumentException("hypothesis must be named");
        this.name = name;
        this.type = type;
    }

    public static Hypothesis parse(String name, String type) { return new Hypothesis(name, Expr.parse(type)); }

    public String name() { return name; }
    public Expr type() { return type; }

    public Hypothesis withType(Expr t) { return t.equals(type) ? this : new Hypothesis(name, t); }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Hypothesis)) return false;
        Hypothesis h = (Hypothesis) o;
        return name.equals(h.name) && type.equals(h.type);
    }

    @Override public int hashCode() { return Objects.hash(name, type); }
    @Override public String toString() { return name + " : " + type; }
}
