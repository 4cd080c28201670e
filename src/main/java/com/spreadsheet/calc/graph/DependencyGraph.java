package com.spreadsheet.calc.graph;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

/**
 * Directed graph over cell ids. An edge runs from a formula cell to each cell
 * it reads (its precedents); the reverse map answers "who reads me".
 * Not thread-safe: callers hold the workbook lock.
 */
public class DependencyGraph {

    // cell -> cells it reads
    private final Map<Integer, Set<Integer>> precedents = new HashMap<>();
    // cell -> cells that read it
    private final Map<Integer, Set<Integer>> dependents = new HashMap<>();

    /**
     * Replaces the outgoing edges of a cell.
     */
    public void setPrecedents(int cell, Collection<Integer> reads) {
        removePrecedents(cell);
        if (reads.isEmpty()) {
            return;
        }
        Set<Integer> targets = new LinkedHashSet<>(reads);
        precedents.put(cell, targets);
        for (int target : targets) {
            dependents.computeIfAbsent(target, k -> new LinkedHashSet<>()).add(cell);
        }
    }

    public void removePrecedents(int cell) {
        Set<Integer> old = precedents.remove(cell);
        if (old == null) {
            return;
        }
        for (int target : old) {
            Set<Integer> readers = dependents.get(target);
            if (readers != null) {
                readers.remove(cell);
                if (readers.isEmpty()) {
                    dependents.remove(target);
                }
            }
        }
    }

    public Set<Integer> getPrecedents(int cell) {
        return precedents.getOrDefault(cell, Collections.emptySet());
    }

    public Set<Integer> getDependents(int cell) {
        return dependents.getOrDefault(cell, Collections.emptySet());
    }

    public boolean hasPrecedents(int cell) {
        return precedents.containsKey(cell);
    }

    /**
     * The seeds and every cell that reads them directly or indirectly (BFS over the reverse edges).
     */
    public Set<Integer> withTransitiveDependents(Collection<Integer> seeds) {
        Set<Integer> visited = new LinkedHashSet<>(seeds);
        Queue<Integer> queue = new ArrayDeque<>(seeds);
        while (!queue.isEmpty()) {
            int current = queue.poll();
            for (int reader : getDependents(current)) {
                if (visited.add(reader)) {
                    queue.add(reader);
                }
            }
        }
        return visited;
    }

    public int edgeCount() {
        int count = 0;
        for (Set<Integer> targets : precedents.values()) {
            count += targets.size();
        }
        return count;
    }

    public Set<Integer> nodes() {
        Set<Integer> nodes = new HashSet<>(precedents.keySet());
        nodes.addAll(dependents.keySet());
        return nodes;
    }

    public void clear() {
        precedents.clear();
        dependents.clear();
    }

    /**
     * Orders the given cells for evaluation: strongly connected components of
     * the subgraph, layered so that every component comes after the components
     * it reads. Cells outside the set are treated as already calculated.
     */
    public CalculationPlan plan(Collection<Integer> cells) {
        Set<Integer> scope = cells instanceof Set ? (Set<Integer>) cells : new LinkedHashSet<>(cells);
        return CalculationPlanner.plan(scope, this);
    }
}
