package net.littleredcomputer.prover.search;

import gnu.trove.list.array.TIntArrayList;

import java.util.function.IntBinaryOperator;

/** Binary max-heap of goal ids under a caller-supplied comparison. */
class GoalHeap {
    private final TIntArrayList a = new TIntArrayList();
    private final IntBinaryOperator compare;

    GoalHeap(IntBinaryOperator compare) {
        this.compare = compare;
    }

    int size() { return a.size(); }
    boolean isEmpty() { return a.isEmpty(); }

    void push(int id) {
        a.add(id);
        siftUp(a.size() - 1);
    }

    private void siftUp(int child) {
        while (child > 0) {
            int parent = (child - 1) / 2;
            if (compare.applyAsInt(a.get(parent), a.get(child)) >= 0) return;
            swap(parent, child);
            child = parent;
        }
    }

    private void siftDown(int start, int end) {
        int root = start, child;
        while ((child = 2*root+1) <= end) {
            int swap = root;
            if (compare.applyAsInt(a.get(swap), a.get(child)) < 0) swap = child;
            if (child+1 <= end && compare.applyAsInt(a.get(swap), a.get(child+1)) < 0) swap = child+1;
            if (swap == root) return;
            swap(root, swap);
            root = swap;
        }
    }

    private void swap(int i, int j) {
        int tmp = a.get(i);
        a.set(i, a.get(j));
        a.set(j, tmp);
    }

    int pop() {
        if (a.isEmpty()) throw new IllegalStateException("pop from empty heap");
        int top = a.get(0);
        if (a.size() > 1) {
            a.set(0, a.removeAt(a.size() - 1));
            siftDown(0, a.size() - 1);
        }
        else a.resetQuick();
        return top;
    }
}
