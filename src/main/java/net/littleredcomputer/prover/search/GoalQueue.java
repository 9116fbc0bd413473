package net.littleredcomputer.prover.search;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.stack.array.TIntArrayStack;
import net.littleredcomputer.prover.tree.Goal;
import net.littleredcomputer.prover.tree.SearchTree;

import java.util.List;

/**
 * Goals waiting to be expanded. Goals that became inactive while queued are not removed; the
 * search skips them when they are popped.
 */
abstract class GoalQueue {
    final SearchTree tree;

    GoalQueue(SearchTree tree) { this.tree = tree; }

    abstract void push(Goal g);
    abstract Goal pop();
    abstract boolean isEmpty();
    abstract int size();

    /**
     * Queue the active goals among {@code g}, which was just expanded, and the goals created by
     * that expansion, in the order the strategy should reach them.
     */
    void pushExpanded(Goal g, List<Goal> created) {
        for (Goal s : created) if (tree.isActive(s)) push(s);
        if (tree.isActive(g)) push(g);
    }

    static GoalQueue create(SearchOptions.Strategy strategy, SearchTree tree) {
        switch (strategy) {
            case BEST_FIRST: return new BestFirst(tree);
            case DEPTH_FIRST: return new DepthFirst(tree);
            case BREADTH_FIRST: return new BreadthFirst(tree);
            default: throw new IllegalArgumentException("unknown strategy " + strategy);
        }
    }

    /**
     * Highest success probability first. Ties go to the goal expanded least recently, then the
     * shallower goal, then the older one.
     */
    static class BestFirst extends GoalQueue {
        private final GoalHeap heap;

        BestFirst(SearchTree tree) {
            super(tree);
            heap = new GoalHeap(this::compare);
        }

        private int compare(int i, int j) {
            Goal a = tree.goal(i), b = tree.goal(j);
            int c = Double.compare(a.successProbability(), b.successProbability());
            if (c != 0) return c;
            c = Integer.compare(b.lastExpandedInIteration(), a.lastExpandedInIteration());
            if (c != 0) return c;
            c = Integer.compare(b.depth(), a.depth());
            if (c != 0) return c;
            return Integer.compare(j, i);
        }

        @Override void push(Goal g) { heap.push(g.id()); }
        @Override Goal pop() { return tree.goal(heap.pop()); }
        @Override boolean isEmpty() { return heap.isEmpty(); }
        @Override int size() { return heap.size(); }
    }

    static class DepthFirst extends GoalQueue {
        private final TIntArrayStack stack = new TIntArrayStack();

        DepthFirst(SearchTree tree) { super(tree); }

        /** The expanded goal goes underneath its subgoals, so its next alternative waits until they are done. */
        @Override
        void pushExpanded(Goal g, List<Goal> created) {
            if (tree.isActive(g)) push(g);
            for (Goal s : created) if (tree.isActive(s)) push(s);
        }

        @Override void push(Goal g) { stack.push(g.id()); }
        @Override Goal pop() { return tree.goal(stack.pop()); }
        @Override boolean isEmpty() { return stack.size() == 0; }
        @Override int size() { return stack.size(); }
    }

    static class BreadthFirst extends GoalQueue {
        private final TIntArrayList ids = new TIntArrayList();
        private int head = 0;

        BreadthFirst(SearchTree tree) { super(tree); }

        @Override void push(Goal g) { ids.add(g.id()); }

        @Override
        Goal pop() {
            if (isEmpty()) throw new IllegalStateException("pop from empty queue");
            Goal g = tree.goal(ids.get(head++));
            if (head == ids.size()) {
                ids.resetQuick();
                head = 0;
            }
            return g;
        }

        @Override boolean isEmpty() { return head == ids.size(); }
        @Override int size() { return ids.size() - head; }
    }
}
