package com.spreadsheet.calc.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Condenses the cycles of a subgraph and layers the result with Kahn's algorithm.
 */
final class CalculationPlanner {

    private CalculationPlanner() {
    }

    static CalculationPlan plan(Set<Integer> scope, DependencyGraph graph) {
        List<List<Integer>> components = StronglyConnectedComponents.find(scope, graph::getPrecedents);

        Map<Integer, Integer> componentOf = new HashMap<>();
        for (int c = 0; c < components.size(); c++) {
            // creation order inside a cycle keeps iteration deterministic
            Collections.sort(components.get(c));
            for (int cell : components.get(c)) {
                componentOf.put(cell, c);
            }
        }

        // edges between components, precedent component -> reading components
        List<Set<Integer>> readers = new ArrayList<>(components.size());
        int[] pending = new int[components.size()];
        boolean[] cyclic = new boolean[components.size()];
        for (int c = 0; c < components.size(); c++) {
            readers.add(new HashSet<>());
        }
        for (int c = 0; c < components.size(); c++) {
            List<Integer> members = components.get(c);
            cyclic[c] = members.size() > 1;
            Set<Integer> reads = new HashSet<>();
            for (int cell : members) {
                for (int precedent : graph.getPrecedents(cell)) {
                    Integer target = componentOf.get(precedent);
                    if (target == null) {
                        continue;
                    }
                    if (target == c) {
                        // covers the one-cell self reference
                        cyclic[c] = true;
                    } else {
                        reads.add(target);
                    }
                }
            }
            pending[c] = reads.size();
            for (int target : reads) {
                readers.get(target).add(c);
            }
        }

        List<List<CalculationGroup>> layers = new ArrayList<>();
        List<Integer> ready = new ArrayList<>();
        for (int c = 0; c < components.size(); c++) {
            if (pending[c] == 0) {
                ready.add(c);
            }
        }
        while (!ready.isEmpty()) {
            List<CalculationGroup> layer = new ArrayList<>(ready.size());
            List<Integer> next = new ArrayList<>();
            for (int c : ready) {
                layer.add(new CalculationGroup(components.get(c), cyclic[c]));
                for (int reader : readers.get(c)) {
                    if (--pending[reader] == 0) {
                        next.add(reader);
                    }
                }
            }
            layers.add(layer);
            ready = next;
        }
        return new CalculationPlan(layers);
    }
}
