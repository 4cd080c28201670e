package com.spreadsheet.calc.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.IntFunction;

/**
 * Tarjan's algorithm with an explicit stack, so long reference chains can't
 * overflow the call stack. Components come out in reverse topological order
 * of the edges: a component is emitted after everything it points to.
 */
final class StronglyConnectedComponents {

    private StronglyConnectedComponents() {
    }

    static List<List<Integer>> find(Set<Integer> nodes, IntFunction<Iterable<Integer>> successors) {
        Map<Integer, Integer> index = new HashMap<>();
        Map<Integer, Integer> lowLink = new HashMap<>();
        Deque<Integer> stack = new ArrayDeque<>();
        Set<Integer> onStack = new HashSet<>();
        List<List<Integer>> components = new ArrayList<>();
        int counter = 0;

        Deque<Frame> callStack = new ArrayDeque<>();
        for (int root : nodes) {
            if (index.containsKey(root)) {
                continue;
            }
            callStack.push(new Frame(root, successors.apply(root).iterator()));
            index.put(root, counter);
            lowLink.put(root, counter);
            counter++;
            stack.push(root);
            onStack.add(root);

            while (!callStack.isEmpty()) {
                Frame frame = callStack.peek();
                if (frame.edges.hasNext()) {
                    int next = frame.edges.next();
                    if (!nodes.contains(next)) {
                        continue;
                    }
                    if (!index.containsKey(next)) {
                        index.put(next, counter);
                        lowLink.put(next, counter);
                        counter++;
                        stack.push(next);
                        onStack.add(next);
                        callStack.push(new Frame(next, successors.apply(next).iterator()));
                    } else if (onStack.contains(next)) {
                        lowLink.put(frame.node, Math.min(lowLink.get(frame.node), index.get(next)));
                    }
                    continue;
                }
                callStack.pop();
                if (lowLink.get(frame.node).equals(index.get(frame.node))) {
                    List<Integer> component = new ArrayList<>();
                    int member;
                    do {
                        member = stack.pop();
                        onStack.remove(member);
                        component.add(member);
                    } while (member != frame.node);
                    components.add(component);
                }
                if (!callStack.isEmpty()) {
                    Frame parent = callStack.peek();
                    lowLink.put(parent.node, Math.min(lowLink.get(parent.node), lowLink.get(frame.node)));
                }
            }
        }
        return components;
    }

    private static final class Frame {
        private final int node;
        private final Iterator<Integer> edges;

        private Frame(int node, Iterator<Integer> edges) {
            this.node = node;
            this.edges = edges;
        }
    }
}
