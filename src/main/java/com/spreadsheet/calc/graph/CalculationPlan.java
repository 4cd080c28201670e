package com.spreadsheet.calc.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Evaluation order for a set of cells. Groups within a layer don't read each
 * other, so a layer may be evaluated in parallel once the layers before it are done.
 */
public final class CalculationPlan {

    private final List<List<CalculationGroup>> layers;

    CalculationPlan(List<List<CalculationGroup>> layers) {
        List<List<CalculationGroup>> copy = new ArrayList<>(layers.size());
        for (List<CalculationGroup> layer : layers) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(layer)));
        }
        this.layers = Collections.unmodifiableList(copy);
    }

    public List<List<CalculationGroup>> getLayers() {
        return layers;
    }

    /**
     * All groups flattened in a valid sequential order.
     */
    public List<CalculationGroup> getGroups() {
        List<CalculationGroup> groups = new ArrayList<>();
        for (List<CalculationGroup> layer : layers) {
            groups.addAll(layer);
        }
        return groups;
    }

    /**
     * All cells in a valid sequential order.
     */
    public List<Integer> getOrder() {
        List<Integer> order = new ArrayList<>();
        for (CalculationGroup group : getGroups()) {
            order.addAll(group.getCells());
        }
        return order;
    }

    public List<CalculationGroup> getCycles() {
        List<CalculationGroup> cycles = new ArrayList<>();
        for (CalculationGroup group : getGroups()) {
            if (group.isCyclic()) {
                cycles.add(group);
            }
        }
        return cycles;
    }

    public int cellCount() {
        int count = 0;
        for (List<CalculationGroup> layer : layers) {
            for (CalculationGroup group : layer) {
                count += group.size();
            }
        }
        return count;
    }

    public boolean isEmpty() {
        return layers.isEmpty();
    }
}
