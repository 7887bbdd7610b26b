package dev.depgraph.analysis;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * Tarjan's algorithm over an int-indexed adjacency list, driven by an explicit call stack so
 * deep chains cannot overflow the thread stack.
 * <p>
 * Components are emitted in reverse topological order of the condensation: a component comes
 * after every component it can reach.
 */
public final class StronglyConnectedComponents {

    private final List<List<Integer>> components;
    private final int[] componentOf;

    private StronglyConnectedComponents(List<List<Integer>> components, int[] componentOf) {
        this.components = components;
        this.componentOf = componentOf;
    }

    public static StronglyConnectedComponents compute(int[][] adjacency) {
        final int n = adjacency.length;
        final int[] index = new int[n];
        final int[] low = new int[n];
        final boolean[] onStack = new boolean[n];
        final int[] componentOf = new int[n];
        Arrays.fill(index, -1);

        final Deque<Integer> stack = new ArrayDeque<>();
        final List<List<Integer>> components = new ArrayList<>();
        int counter = 0;

        for (int start = 0; start < n; start++) {
            if (index[start] != -1) {
                continue;
            }
            // frame = {vertex, next neighbour position}
            final Deque<int[]> calls = new ArrayDeque<>();
            index[start] = low[start] = counter++;
            stack.push(start);
            onStack[start] = true;
            calls.push(new int[]{start, 0});

            while (!calls.isEmpty()) {
                final int[] frame = calls.peek();
                final int v = frame[0];
                if (frame[1] < adjacency[v].length) {
                    final int w = adjacency[v][frame[1]++];
                    if (index[w] == -1) {
                        index[w] = low[w] = counter++;
                        stack.push(w);
                        onStack[w] = true;
                        calls.push(new int[]{w, 0});
                    } else if (onStack[w]) {
                        low[v] = Math.min(low[v], index[w]);
                    }
                    continue;
                }

                calls.pop();
                if (!calls.isEmpty()) {
                    final int parent = calls.peek()[0];
                    low[parent] = Math.min(low[parent], low[v]);
                }
                if (low[v] == index[v]) {
                    final List<Integer> component = new ArrayList<>();
                    int w;
                    do {
                        w = stack.pop();
                        onStack[w] = false;
                        componentOf[w] = components.size();
                        component.add(w);
                    } while (w != v);
                    components.add(component);
                }
            }
        }
        return new StronglyConnectedComponents(components, componentOf);
    }

    public int count() {
        return components.size();
    }

    public List<Integer> members(int component) {
        return components.get(component);
    }

    public int componentOf(int vertex) {
        return componentOf[vertex];
    }

    public int sizeOf(int component) {
        return components.get(component).size();
    }
}
