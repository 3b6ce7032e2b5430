package com.mainframe.transpiler.flow;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Tarjan's strongly connected components over nodes 0..n-1. Components come out in reverse
 * topological order; members of each component are sorted ascending.
 */
class SccFinder {
    private final List<List<Integer>> successors;
    private final int[] index;
    private final int[] lowLink;
    private final boolean[] onStack;
    private final Deque<Integer> stack = new ArrayDeque<>();
    private final List<List<Integer>> components = new ArrayList<>();
    private int counter;

    SccFinder(List<List<Integer>> successors) {
        this.successors = successors;
        int n = successors.size();
        this.index = new int[n];
        this.lowLink = new int[n];
        this.onStack = new boolean[n];
        Arrays.fill(index, -1);
    }

    List<List<Integer>> find() {
        for (int v = 0; v < successors.size(); v++) {
            if (index[v] < 0) {
                strongConnect(v);
            }
        }
        return components;
    }

    // Iterative to keep deep paragraph chains off the call stack
    private void strongConnect(int root) {
        Deque<int[]> work = new ArrayDeque<>();
        Map<Integer, Integer> nextChild = new HashMap<>();
        visit(root);
        work.push(new int[] {root});
        nextChild.put(root, 0);

        while (!work.isEmpty()) {
            int v = work.peek()[0];
            int childPos = nextChild.get(v);
            List<Integer> next = successors.get(v);
            if (childPos < next.size()) {
                nextChild.put(v, childPos + 1);
                int w = next.get(childPos);
                if (index[w] < 0) {
                    visit(w);
                    nextChild.put(w, 0);
                    work.push(new int[] {w});
                } else if (onStack[w]) {
                    lowLink[v] = Math.min(lowLink[v], index[w]);
                }
                continue;
            }

            work.pop();
            if (!work.isEmpty()) {
                int parent = work.peek()[0];
                lowLink[parent] = Math.min(lowLink[parent], lowLink[v]);
            }
            if (lowLink[v] == index[v]) {
                List<Integer> component = new ArrayList<>();
                int w;
                do {
                    w = stack.pop();
                    onStack[w] = false;
                    component.add(w);
                } while (w != v);
                component.sort(Integer::compare);
                components.add(component);
            }
        }
    }

    private void visit(int v) {
        index[v] = counter;
        lowLink[v] = counter;
        counter++;
        stack.push(v);
        onStack[v] = true;
    }
}
