package net.littleredcomputer.prover.search;

/**
 * Bounds the depth of the recursive walks of a search: goal expansion along a derivation and
 * the traversals done by extraction. Exceeding the bound is fatal.
 */
final class RecursionGuard {
    private final int max;
    private int depth = 0;

    RecursionGuard(int max) { this.max = max; }

    void enter() {
        if (++depth > max) {
            --depth;
            throw exceeded();
        }
    }

    void exit() {
        if (depth == 0) throw new IllegalStateException("unbalanced exit from recursion guard");
        --depth;
    }

    /** Checks a derivation depth reached without Java recursion. */
    void check(int d) {
        if (d > max) throw exceeded();
    }

    int depth() { return depth; }

    private SearchException exceeded() {
        return new SearchException(SearchException.Reason.RECURSION_DEPTH,
                "maximum recursion depth " + max + " reached; a rule may be applicable indefinitely");
    }
}
