package com.geico.poc.streamcatalog.manager;

import com.geico.poc.streamcatalog.catalog.CatalogObject;
import com.geico.poc.streamcatalog.catalog.DatabaseMetadata;
import com.geico.poc.streamcatalog.catalog.FunctionMetadata;
import com.geico.poc.streamcatalog.catalog.IndexMetadata;
import com.geico.poc.streamcatalog.catalog.ObjectKind;
import com.geico.poc.streamcatalog.catalog.SchemaMetadata;
import com.geico.poc.streamcatalog.catalog.SchemaScopedObject;
import com.geico.poc.streamcatalog.catalog.SinkMetadata;
import com.geico.poc.streamcatalog.catalog.SourceMetadata;
import com.geico.poc.streamcatalog.catalog.TableMetadata;
import com.geico.poc.streamcatalog.catalog.ViewMetadata;
import com.geico.poc.streamcatalog.notification.CatalogDelta;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable view of the whole catalog as of one catalog version.
 *
 * The manager publishes a new snapshot after every commit; readers hold on to whichever
 * snapshot they fetched and never see a partially applied transaction.
 */
public final class CatalogSnapshot {

    private static final Comparator<CatalogObject> BY_NAME =
            Comparator.comparing(CatalogObject::getName).thenComparingLong(CatalogObject::getId);

    private static final ObjectKind[] RELATION_KINDS = {
            ObjectKind.TABLE, ObjectKind.SOURCE, ObjectKind.SINK, ObjectKind.INDEX, ObjectKind.VIEW
    };

    private final long version;
    private final Map<ObjectKind, Map<Long, CatalogObject>> objects;

    private CatalogSnapshot(long version, Map<ObjectKind, Map<Long, CatalogObject>> objects) {
        this.version = version;
        this.objects = objects;
    }

    public static CatalogSnapshot empty() {
        return of(0, Collections.emptyList());
    }

    public static CatalogSnapshot of(long version, Collection<? extends CatalogObject> objects) {
        Map<ObjectKind, Map<Long, CatalogObject>> byKind = mutableMaps();
        for (CatalogObject object : objects) {
            byKind.get(object.kind()).put(object.getId(), object);
        }
        return new CatalogSnapshot(version, freeze(byKind));
    }

    /**
     * New snapshot with the deltas of one transaction applied on top of this one.
     */
    public CatalogSnapshot apply(long newVersion, List<CatalogDelta> deltas) {
        Map<ObjectKind, Map<Long, CatalogObject>> byKind = mutableMaps();
        for (Map.Entry<ObjectKind, Map<Long, CatalogObject>> e : objects.entrySet()) {
            byKind.get(e.getKey()).putAll(e.getValue());
        }
        for (CatalogDelta delta : deltas) {
            Map<Long, CatalogObject> target = byKind.get(delta.getKind());
            switch (delta.getType()) {
                case CREATED:
                case ALTERED:
                    target.put(delta.getObjectId(), delta.getObject());
                    break;
                case DROPPED:
                    target.remove(delta.getObjectId());
                    break;
                default:
                    throw new IllegalStateException("Unknown delta type: " + delta.getType());
            }
        }
        return new CatalogSnapshot(newVersion, freeze(byKind));
    }

    private static Map<ObjectKind, Map<Long, CatalogObject>> mutableMaps() {
        Map<ObjectKind, Map<Long, CatalogObject>> byKind = new EnumMap<>(ObjectKind.class);
        for (ObjectKind kind : ObjectKind.values()) {
            byKind.put(kind, new TreeMap<>());
        }
        return byKind;
    }

    private static Map<ObjectKind, Map<Long, CatalogObject>> freeze(Map<ObjectKind, Map<Long, CatalogObject>> byKind) {
        Map<ObjectKind, Map<Long, CatalogObject>> frozen = new EnumMap<>(ObjectKind.class);
        for (Map.Entry<ObjectKind, Map<Long, CatalogObject>> e : byKind.entrySet()) {
            frozen.put(e.getKey(), Collections.unmodifiableMap(e.getValue()));
        }
        return Collections.unmodifiableMap(frozen);
    }

    public long getVersion() {
        return version;
    }

    public int size() {
        int size = 0;
        for (Map<Long, CatalogObject> map : objects.values()) {
            size += map.size();
        }
        return size;
    }

    // Lookup by id

    public Optional<CatalogObject> find(ObjectKind kind, long id) {
        return Optional.ofNullable(objects.get(kind).get(id));
    }

    public Optional<DatabaseMetadata> getDatabase(long id) {
        return typed(ObjectKind.DATABASE, id, DatabaseMetadata.class);
    }

    public Optional<SchemaMetadata> getSchema(long id) {
        return typed(ObjectKind.SCHEMA, id, SchemaMetadata.class);
    }

    public Optional<TableMetadata> getTable(long id) {
        return typed(ObjectKind.TABLE, id, TableMetadata.class);
    }

    public Optional<SourceMetadata> getSource(long id) {
        return typed(ObjectKind.SOURCE, id, SourceMetadata.class);
    }

    public Optional<SinkMetadata> getSink(long id) {
        return typed(ObjectKind.SINK, id, SinkMetadata.class);
    }

    public Optional<IndexMetadata> getIndex(long id) {
        return typed(ObjectKind.INDEX, id, IndexMetadata.class);
    }

    public Optional<ViewMetadata> getView(long id) {
        return typed(ObjectKind.VIEW, id, ViewMetadata.class);
    }

    public Optional<FunctionMetadata> getFunction(long id) {
        return typed(ObjectKind.FUNCTION, id, FunctionMetadata.class);
    }

    /**
     * Relation of any kind with the given id. Relation ids are unique across kinds.
     */
    public Optional<SchemaScopedObject> getRelation(long id) {
        for (ObjectKind kind : RELATION_KINDS) {
            CatalogObject object = objects.get(kind).get(id);
            if (object != null) {
                return Optional.of((SchemaScopedObject) object);
            }
        }
        return Optional.empty();
    }

    private <T> Optional<T> typed(ObjectKind kind, long id, Class<T> type) {
        return Optional.ofNullable(objects.get(kind).get(id)).map(type::cast);
    }

    // Lookup by name

    public Optional<DatabaseMetadata> findDatabase(String name) {
        for (CatalogObject object : objects.get(ObjectKind.DATABASE).values()) {
            if (sameName(object.getName(), name)) {
                return Optional.of((DatabaseMetadata) object);
            }
        }
        return Optional.empty();
    }

    public Optional<SchemaMetadata> findSchema(long databaseId, String name) {
        for (CatalogObject object : objects.get(ObjectKind.SCHEMA).values()) {
            SchemaMetadata schema = (SchemaMetadata) object;
            if (schema.getDatabaseId() == databaseId && sameName(schema.getName(), name)) {
                return Optional.of(schema);
            }
        }
        return Optional.empty();
    }

    /**
     * The relation that owns {@code name} in the schema's relation name space.
     *
     * A coupled source and an index's backing table share their owner's name and are not
     * returned here; resolve them through their owner.
     */
    public Optional<SchemaScopedObject> findRelation(long schemaId, String name) {
        for (ObjectKind kind : RELATION_KINDS) {
            for (CatalogObject object : objects.get(kind).values()) {
                SchemaScopedObject relation = (SchemaScopedObject) object;
                if (relation.getSchemaId() == schemaId && sameName(relation.getName(), name)
                        && !isCompanion(relation)) {
                    return Optional.of(relation);
                }
            }
        }
        return Optional.empty();
    }

    public Optional<FunctionMetadata> findFunction(long schemaId, String name, List<String> argTypes) {
        for (CatalogObject object : objects.get(ObjectKind.FUNCTION).values()) {
            FunctionMetadata function = (FunctionMetadata) object;
            if (function.getSchemaId() == schemaId && sameName(function.getName(), name)
                    && function.getArgTypes().equals(argTypes)) {
                return Optional.of(function);
            }
        }
        return Optional.empty();
    }

    // Names are matched case-insensitively
    private static boolean sameName(String stored, String requested) {
        return requested != null && stored.toLowerCase(Locale.ROOT).equals(requested.toLowerCase(Locale.ROOT));
    }

    /**
     * Ids of the objects that directly read {@code relationId}.
     */
    public Set<Long> dependentsOf(long relationId) {
        Set<Long> dependents = new TreeSet<>();
        for (CatalogObject object : allObjects()) {
            if (object instanceof SchemaScopedObject
                    && ((SchemaScopedObject) object).getDependentRelations().contains(relationId)) {
                dependents.add(object.getId());
            }
        }
        return Collections.unmodifiableSet(dependents);
    }

    /**
     * The table whose associated source is {@code sourceId}, if the source is coupled.
     */
    public Optional<TableMetadata> findOwningTable(long sourceId) {
        for (CatalogObject object : objects.get(ObjectKind.TABLE).values()) {
            TableMetadata table = (TableMetadata) object;
            if (table.getAssociatedSourceId().isPresent()
                    && table.getAssociatedSourceId().getAsLong() == sourceId) {
                return Optional.of(table);
            }
        }
        return Optional.empty();
    }

    /**
     * The index whose backing table is {@code tableId}.
     */
    public Optional<IndexMetadata> findIndexByTable(long tableId) {
        for (CatalogObject object : objects.get(ObjectKind.INDEX).values()) {
            IndexMetadata index = (IndexMetadata) object;
            if (index.getIndexTableId() == tableId) {
                return Optional.of(index);
            }
        }
        return Optional.empty();
    }

    /**
     * Objects that exist only as part of another relation: coupled sources and index
     * backing tables.
     */
    public boolean isCompanion(SchemaScopedObject relation) {
        if (relation instanceof SourceMetadata) {
            return findOwningTable(relation.getId()).isPresent();
        }
        if (relation instanceof TableMetadata) {
            return ((TableMetadata) relation).getTableType() == TableMetadata.TableType.INDEX;
        }
        return false;
    }

    // Listings, sorted by name

    public List<DatabaseMetadata> databases() {
        return sorted(ObjectKind.DATABASE, DatabaseMetadata.class);
    }

    public List<SchemaMetadata> schemas(long databaseId) {
        List<SchemaMetadata> result = new ArrayList<>();
        for (SchemaMetadata schema : sorted(ObjectKind.SCHEMA, SchemaMetadata.class)) {
            if (schema.getDatabaseId() == databaseId) {
                result.add(schema);
            }
        }
        return result;
    }

    public List<TableMetadata> tables() {
        return sorted(ObjectKind.TABLE, TableMetadata.class);
    }

    public List<SourceMetadata> sources() {
        return sorted(ObjectKind.SOURCE, SourceMetadata.class);
    }

    public List<SinkMetadata> sinks() {
        return sorted(ObjectKind.SINK, SinkMetadata.class);
    }

    public List<IndexMetadata> indexes() {
        return sorted(ObjectKind.INDEX, IndexMetadata.class);
    }

    public List<ViewMetadata> views() {
        return sorted(ObjectKind.VIEW, ViewMetadata.class);
    }

    public List<FunctionMetadata> functions() {
        return sorted(ObjectKind.FUNCTION, FunctionMetadata.class);
    }

    public List<IndexMetadata> indexesOf(long primaryTableId) {
        List<IndexMetadata> result = new ArrayList<>();
        for (IndexMetadata index : indexes()) {
            if (index.getPrimaryTableId() == primaryTableId) {
                result.add(index);
            }
        }
        return result;
    }

    /**
     * Relations and functions of one schema, companions included, ordered by id.
     */
    public List<SchemaScopedObject> objectsInSchema(long schemaId) {
        List<SchemaScopedObject> result = new ArrayList<>();
        for (ObjectKind kind : ObjectKind.values()) {
            if (kind == ObjectKind.DATABASE || kind == ObjectKind.SCHEMA) {
                continue;
            }
            for (CatalogObject object : objects.get(kind).values()) {
                SchemaScopedObject scoped = (SchemaScopedObject) object;
                if (scoped.getSchemaId() == schemaId) {
                    result.add(scoped);
                }
            }
        }
        result.sort(Comparator.comparingLong(CatalogObject::getId));
        return result;
    }

    /**
     * Every object, grouped by kind in declaration order and ordered by id within a kind.
     */
    public List<CatalogObject> allObjects() {
        List<CatalogObject> result = new ArrayList<>(size());
        for (ObjectKind kind : ObjectKind.values()) {
            result.addAll(objects.get(kind).values());
        }
        return result;
    }

    private <T extends CatalogObject> List<T> sorted(ObjectKind kind, Class<T> type) {
        List<T> result = new ArrayList<>();
        for (CatalogObject object : objects.get(kind).values()) {
            result.add(type.cast(object));
        }
        result.sort(BY_NAME);
        return result;
    }

    @Override
    public String toString() {
        return "CatalogSnapshot{version=" + version + ", objects=" + size() + '}';
    }
}
