package com.geico.poc.streamcatalog.manager;

import com.geico.poc.streamcatalog.catalog.CatalogObject;
import com.geico.poc.streamcatalog.catalog.SchemaScopedObject;
import com.geico.poc.streamcatalog.notification.CatalogDelta;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * In-memory index of "relation A reads relation B" edges.
 *
 * Derived from the {@code dependentRelations} of stored objects: rebuilt on startup and
 * kept in step with each committed transaction. Only direct dependents are tracked.
 *
 * Not thread-safe; mutated under the catalog writer lock only.
 */
public class DependencyGraph {

    // referenced relation id -> ids of the objects that read it
    private final Map<Long, Set<Long>> dependents = new HashMap<>();
    // referrer id -> relation ids it reads
    private final Map<Long, Set<Long>> references = new HashMap<>();

    public static DependencyGraph build(CatalogSnapshot snapshot) {
        DependencyGraph graph = new DependencyGraph();
        for (CatalogObject object : snapshot.allObjects()) {
            if (object instanceof SchemaScopedObject) {
                SchemaScopedObject scoped = (SchemaScopedObject) object;
                graph.addEdges(scoped.getId(), scoped.getDependentRelations());
            }
        }
        return graph;
    }

    /**
     * Record that {@code relationId} reads each of {@code referencedIds}.
     */
    public void addEdges(long relationId, Collection<Long> referencedIds) {
        if (referencedIds.isEmpty()) {
            return;
        }
        Set<Long> refs = references.computeIfAbsent(relationId, k -> new TreeSet<>());
        for (Long referenced : referencedIds) {
            refs.add(referenced);
            dependents.computeIfAbsent(referenced, k -> new TreeSet<>()).add(relationId);
        }
    }

    /**
     * Discard every edge originating from {@code relationId}.
     */
    public void remove(long relationId) {
        Set<Long> refs = references.remove(relationId);
        if (refs == null) {
            return;
        }
        for (Long referenced : refs) {
            Set<Long> readers = dependents.get(referenced);
            if (readers != null) {
                readers.remove(relationId);
                if (readers.isEmpty()) {
                    dependents.remove(referenced);
                }
            }
        }
    }

    /**
     * False iff some live object reads {@code relationId}.
     */
    public boolean canDrop(long relationId) {
        return !dependents.containsKey(relationId);
    }

    public Set<Long> dependentsOf(long relationId) {
        Set<Long> readers = dependents.get(relationId);
        return readers != null ? Collections.unmodifiableSet(new TreeSet<>(readers)) : Collections.emptySet();
    }

    public Set<Long> referencesOf(long relationId) {
        Set<Long> refs = references.get(relationId);
        return refs != null ? Collections.unmodifiableSet(new TreeSet<>(refs)) : Collections.emptySet();
    }

    /**
     * Bring the graph in line with one committed transaction.
     */
    public void apply(Collection<CatalogDelta> deltas) {
        for (CatalogDelta delta : deltas) {
            if (!delta.getKind().isRelation()) {
                continue;
            }
            remove(delta.getObjectId());
            if (delta.getType() != CatalogDelta.Type.DROPPED) {
                SchemaScopedObject object = (SchemaScopedObject) delta.getObject();
                addEdges(object.getId(), object.getDependentRelations());
            }
        }
    }

    public int edgeCount() {
        int count = 0;
        for (Set<Long> refs : references.values()) {
            count += refs.size();
        }
        return count;
    }
}
