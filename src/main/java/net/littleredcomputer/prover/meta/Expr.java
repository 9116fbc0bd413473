package net.littleredcomputer.prover.meta;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable first-order terms with metavariables and named binders. Terms are written as
 * s-expressions: {@code P}, {@code (and P Q)}, {@code ?3} for metavariable 3 and
 * {@code (fun (h) body)} for a lambda binding the name {@code h}. Bound names are plain
 * constants inside the body; nothing here tracks capture.
 */
public final class Expr {
    private static final Pattern tokenRe = Pattern.compile("\\s*(\\(|\\)|[^\\s()]+)");
    private static final Pattern mvarRe = Pattern.compile("\\?(\\d+)");
    private static final Joiner spaceJoiner = Joiner.on(' ');
    private static final String LAMBDA = "fun";

    public enum Kind {
        APP,
        MVAR,
        LAMBDA,
    }

    private final Kind kind;
    private final String head;  // APP only
    private final ImmutableList<Expr> args;  // APP arguments, or the single LAMBDA body
    private final ImmutableList<String> binders;  // LAMBDA only
    private final MVarId mvar;  // MVAR only
    private final int hash;

    private Expr(Kind kind, String head, ImmutableList<Expr> args, ImmutableList<String> binders, MVarId mvar) {
        this.kind = kind;
        this.head = head;
        this.args = args;
        this.binders = binders;
        this.mvar = mvar;
        this.hash = Objects.hash(kind, head, args, binders, mvar);
    }

    public static Expr constant(String name) { return app(name, ImmutableList.of()); }

    public static Expr app(String head, Expr... args) { return app(head, ImmutableList.copyOf(args)); }

    public static Expr app(String head, List<Expr> args) {
        if (head.isEmpty() || head.startsWith("?") || head.equals(LAMBDA)) {
            throw new IllegalArgumentException("invalid head symbol: " + head);
        }
        return new Expr(Kind.APP, head, ImmutableList.copyOf(args), ImmutableList.of(), null);
    }

    public static Expr mvar(MVarId m) { return new Expr(Kind.MVAR, null, ImmutableList.of(), ImmutableList.of(), m); }

    public static Expr lambda(List<String> binders, Expr body) {
        if (binders.isEmpty()) return body;
        return new Expr(Kind.LAMBDA, null, ImmutableList.of(body), ImmutableList.copyOf(binders), null);
    }

    public Kind kind() { return kind; }
    public boolean isMVar() { return kind == Kind.MVAR; }
    public boolean isApp(String h) { return kind == Kind.APP && head.equals(h); }
    public boolean isConstant() { return kind == Kind.APP && args.isEmpty(); }

    public String head() {
        if (kind != Kind.APP) throw new IllegalStateException("not an application: " + this);
        return head;
    }

    public ImmutableList<Expr> args() {
        if (kind != Kind.APP) throw new IllegalStateException("not an application: " + this);
        return args;
    }

    public Expr arg(int i) { return args().get(i); }

    public MVarId mvarId() {
        if (kind != Kind.MVAR) throw new IllegalStateException("not a metavariable: " + this);
        return mvar;
    }

    public ImmutableList<String> binders() {
        if (kind != Kind.LAMBDA) throw new IllegalStateException("not a lambda: " + this);
        return binders;
    }

    public Expr body() {
        if (kind != Kind.LAMBDA) throw new IllegalStateException("not a lambda: " + this);
        return args.get(0);
    }

    /** @return the metavariables occurring in this term, in order of first occurrence */
    public ImmutableSet<MVarId> mvars() {
        Set<MVarId> s = new LinkedHashSet<>();
        collectMVars(s);
        return ImmutableSet.copyOf(s);
    }

    private void collectMVars(Set<MVarId> s) {
        if (kind == Kind.MVAR) s.add(mvar);
        else for (Expr a : args) a.collectMVars(s);
    }

    public boolean hasMVars() {
        if (kind == Kind.MVAR) return true;
        for (Expr a : args) if (a.hasMVars()) return true;
        return false;
    }

    public boolean occurs(MVarId m) {
        if (kind == Kind.MVAR) return mvar.equals(m);
        for (Expr a : args) if (a.occurs(m)) return true;
        return false;
    }

    /**
     * Replace metavariables. The replacement function returns null for metavariables that
     * should be kept as they are.
     */
    public Expr replaceMVars(Function<MVarId, Expr> f) {
        switch (kind) {
            case MVAR: {
                Expr r = f.apply(mvar);
                return r == null ? this : r;
            }
            case LAMBDA: {
                Expr b = body().replaceMVars(f);
                return b == body() ? this : lambda(binders, b);
            }
            default: {
                if (args.isEmpty()) return this;
                List<Expr> as = new ArrayList<>(args.size());
                boolean changed = false;
                for (Expr a : args) {
                    Expr b = a.replaceMVars(f);
                    changed |= b != a;
                    as.add(b);
                }
                return changed ? app(head, as) : this;
            }
        }
    }

    /** Replace every occurrence of the constant {@code name} by {@code value}. */
    public Expr substitute(String name, Expr value) {
        switch (kind) {
            case MVAR: return this;
            case LAMBDA:
                if (binders.contains(name)) return this;
                return lambda(binders, body().substitute(name, value));
            default:
                if (args.isEmpty()) return head.equals(name) ? value : this;
                List<Expr> as = new ArrayList<>(args.size());
                for (Expr a : args) as.add(a.substitute(name, value));
                return app(head, as);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Expr)) return false;
        Expr e = (Expr) o;
        return hash == e.hash && kind == e.kind && Objects.equals(head, e.head) && args.equals(e.args)
                && binders.equals(e.binders) && Objects.equals(mvar, e.mvar);
    }

    @Override public int hashCode() { return hash; }

    @Override
    public String toString() {
        switch (kind) {
            case MVAR: return mvar.toString();
            case LAMBDA: return "(" + LAMBDA + " (" + spaceJoiner.join(binders) + ") " + body() + ")";
            default:
                if (args.isEmpty()) return head;
                return "(" + head + " " + spaceJoiner.join(args) + ")";
        }
    }

    public static Expr parse(String s) {
        List<String> tokens = new ArrayList<>();
        Matcher m = tokenRe.matcher(s);
        int end = 0;
        while (m.lookingAt()) {
            tokens.add(m.group(1));
            end = m.end();
            m.region(end, s.length());
        }
        if (!s.substring(end).trim().isEmpty()) throw new IllegalArgumentException("unparseable input: " + s);
        if (tokens.isEmpty()) throw new IllegalArgumentException("empty expression");
        int[] pos = new int[]{0};
        Expr e = parse(tokens, pos);
        if (pos[0] != tokens.size()) throw new IllegalArgumentException("trailing input after " + e + " in: " + s);
        return e;
    }

    private static Expr parse(List<String> tokens, int[] pos) {
        if (pos[0] >= tokens.size()) throw new IllegalArgumentException("unexpected end of input");
        String t = tokens.get(pos[0]++);
        if (t.equals(")")) throw new IllegalArgumentException("unexpected )");
        if (!t.equals("(")) return atom(t);
        if (pos[0] >= tokens.size()) throw new IllegalArgumentException("unexpected end of input");
        String head = tokens.get(pos[0]++);
        if (head.equals("(") || head.equals(")")) throw new IllegalArgumentException("expected head symbol, found " + head);
        if (head.equals(LAMBDA)) {
            expect(tokens, pos, "(");
            List<String> binders = new ArrayList<>();
            while (!peek(tokens, pos).equals(")")) binders.add(tokens.get(pos[0]++));
            ++pos[0];
            Expr body = parse(tokens, pos);
            expect(tokens, pos, ")");
            return lambda(binders, body);
        }
        List<Expr> args = new ArrayList<>();
        while (!peek(tokens, pos).equals(")")) args.add(parse(tokens, pos));
        ++pos[0];
        if (head.startsWith("?")) throw new IllegalArgumentException("metavariable in head position: " + head);
        return app(head, args);
    }

    private static Expr atom(String t) {
        Matcher m = mvarRe.matcher(t);
        if (m.matches()) return mvar(MVarId.of(Integer.parseInt(m.group(1))));
        if (t.startsWith("?")) throw new IllegalArgumentException("malformed metavariable: " + t);
        return constant(t);
    }

    private static String peek(List<String> tokens, int[] pos) {
        if (pos[0] >= tokens.size()) throw new IllegalArgumentException("unbalanced parentheses");
        return tokens.get(pos[0]);
    }

    private static void expect(List<String> tokens, int[] pos, String t) {
        if (!peek(tokens, pos).equals(t)) throw new IllegalArgumentException("expected " + t + ", found " + tokens.get(pos[0]));
        ++pos[0];
    }
}
