package com.geico.poc.streamcatalog.manager;

import com.geico.poc.streamcatalog.catalog.ObjectKind;
import com.geico.poc.streamcatalog.catalog.ViewMetadata;
import com.geico.poc.streamcatalog.notification.CatalogDelta;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;

import static org.junit.jupiter.api.Assertions.*;

public class DependencyGraphTest {

    private static ViewMetadata view(long id, Long... reads) {
        return new ViewMetadata(id, 1, 1, "v" + id, 1, null, "SELECT 1", Arrays.asList(reads), null);
    }

    @Test
    public void testCanDropOnlyWithoutDependents() {
        DependencyGraph graph = new DependencyGraph();
        graph.addEdges(10, Arrays.asList(1L, 2L));

        assertFalse(graph.canDrop(1));
        assertFalse(graph.canDrop(2));
        assertTrue(graph.canDrop(10));
        assertEquals(Collections.singleton(10L), graph.dependentsOf(1));
        assertEquals(new HashSet<>(Arrays.asList(1L, 2L)), graph.referencesOf(10));
    }

    @Test
    public void testRemoveDiscardsOutgoingEdges() {
        DependencyGraph graph = new DependencyGraph();
        graph.addEdges(10, Collections.singletonList(1L));
        graph.addEdges(11, Collections.singletonList(1L));

        graph.remove(10);
        assertFalse(graph.canDrop(1));
        graph.remove(11);
        assertTrue(graph.canDrop(1));
        assertEquals(0, graph.edgeCount());
    }

    @Test
    public void testOnlyDirectDependentsBlockADrop() {
        DependencyGraph graph = new DependencyGraph();
        graph.addEdges(2, Collections.singletonList(1L));
        graph.addEdges(3, Collections.singletonList(2L));

        assertEquals(Collections.singleton(2L), graph.dependentsOf(1));
        assertTrue(graph.canDrop(3));
    }

    @Test
    public void testApplyFollowsCommittedDeltas() {
        DependencyGraph graph = new DependencyGraph();
        graph.apply(Arrays.asList(CatalogDelta.created(view(10, 1L)), CatalogDelta.created(view(11, 1L, 2L))));
        assertEquals(3, graph.edgeCount());

        graph.apply(Collections.singletonList(CatalogDelta.altered(view(11, 2L))));
        assertEquals(Collections.singleton(10L), graph.dependentsOf(1));

        graph.apply(Collections.singletonList(CatalogDelta.dropped(ObjectKind.VIEW, 10)));
        assertTrue(graph.canDrop(1));
        assertFalse(graph.canDrop(2));
    }

    @Test
    public void testBuildFromSnapshot() {
        CatalogSnapshot snapshot = CatalogSnapshot.of(5, Arrays.asList(view(10, 1L), view(11, 10L)));
        DependencyGraph graph = DependencyGraph.build(snapshot);

        assertEquals(Collections.singleton(11L), graph.dependentsOf(10));
        assertEquals(2, graph.edgeCount());
    }
}
