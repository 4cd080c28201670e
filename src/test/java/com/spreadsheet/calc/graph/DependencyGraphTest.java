package com.spreadsheet.calc.graph;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphTest {

    private DependencyGraph graph;

    @BeforeEach
    void setUp() {
        graph = new DependencyGraph();
    }

    @Test
    void testEdgesAreMirrored() {
        graph.setPrecedents(3, Arrays.asList(1, 2));

        assertEquals(Set.of(1, 2), graph.getPrecedents(3));
        assertEquals(Set.of(3), graph.getDependents(1));
        assertEquals(Set.of(3), graph.getDependents(2));
        assertEquals(2, graph.edgeCount());
    }

    @Test
    void testReplacingPrecedentsDropsOldEdges() {
        graph.setPrecedents(3, Arrays.asList(1, 2));
        graph.setPrecedents(3, Collections.singletonList(4));

        assertTrue(graph.getDependents(1).isEmpty());
        assertTrue(graph.getDependents(2).isEmpty());
        assertEquals(Set.of(3), graph.getDependents(4));
        assertEquals(1, graph.edgeCount());
    }

    @Test
    void testRemovePrecedents() {
        graph.setPrecedents(2, Collections.singletonList(1));
        graph.removePrecedents(2);

        assertFalse(graph.hasPrecedents(2));
        assertTrue(graph.nodes().isEmpty());
    }

    @Test
    void testTransitiveDependents() {
        // 1 <- 2 <- 3, 1 <- 4, 5 unrelated
        graph.setPrecedents(2, Collections.singletonList(1));
        graph.setPrecedents(3, Collections.singletonList(2));
        graph.setPrecedents(4, Collections.singletonList(1));
        graph.setPrecedents(6, Collections.singletonList(5));

        assertEquals(Set.of(1, 2, 3, 4), graph.withTransitiveDependents(List.of(1)));
        assertEquals(Set.of(2, 3), graph.withTransitiveDependents(List.of(2)));
    }

    @Test
    void testPlanOrdersPrecedentsFirst() {
        graph.setPrecedents(3, Arrays.asList(1, 2));
        graph.setPrecedents(4, Collections.singletonList(3));

        CalculationPlan plan = graph.plan(Set.of(1, 2, 3, 4));

        assertEquals(3, plan.getLayers().size());
        assertEquals(2, plan.getLayers().get(0).size());
        assertEquals(List.of(3), plan.getLayers().get(1).get(0).getCells());
        assertEquals(List.of(4), plan.getLayers().get(2).get(0).getCells());
        assertEquals(4, plan.cellCount());
        assertTrue(plan.getCycles().isEmpty());
    }

    @Test
    void testCellsOutsideScopeCountAsCalculated() {
        graph.setPrecedents(3, Arrays.asList(1, 2));

        CalculationPlan plan = graph.plan(Set.of(3));

        assertEquals(1, plan.getLayers().size());
        assertEquals(List.of(3), plan.getOrder());
    }

    @Test
    void testCycleBecomesOneGroup() {
        // 1 <-> 2, 3 reads 2
        graph.setPrecedents(1, Collections.singletonList(2));
        graph.setPrecedents(2, Collections.singletonList(1));
        graph.setPrecedents(3, Collections.singletonList(2));

        CalculationPlan plan = graph.plan(Set.of(1, 2, 3));

        assertEquals(1, plan.getCycles().size());
        CalculationGroup cycle = plan.getCycles().get(0);
        assertEquals(List.of(1, 2), cycle.getCells());
        assertEquals(List.of(1, 2, 3), plan.getOrder());
    }

    @Test
    void testSelfReferenceIsCyclic() {
        graph.setPrecedents(1, Collections.singletonList(1));

        CalculationPlan plan = graph.plan(Set.of(1));

        assertEquals(1, plan.getCycles().size());
        assertTrue(plan.getGroups().get(0).isCyclic());
    }

    @Test
    void testEmptyPlan() {
        assertTrue(graph.plan(Collections.emptySet()).isEmpty());
    }
}
