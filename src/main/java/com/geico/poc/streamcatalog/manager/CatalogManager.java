package com.geico.poc.streamcatalog.manager;

import com.geico.poc.streamcatalog.catalog.CatalogObject;
import com.geico.poc.streamcatalog.catalog.ColumnMetadata;
import com.geico.poc.streamcatalog.catalog.ColumnOrder;
import com.geico.poc.streamcatalog.catalog.DatabaseMetadata;
import com.geico.poc.streamcatalog.catalog.FunctionMetadata;
import com.geico.poc.streamcatalog.catalog.IdCategory;
import com.geico.poc.streamcatalog.catalog.IndexMetadata;
import com.geico.poc.streamcatalog.catalog.ObjectKind;
import com.geico.poc.streamcatalog.catalog.SchemaMetadata;
import com.geico.poc.streamcatalog.catalog.SchemaScopedObject;
import com.geico.poc.streamcatalog.catalog.SinkMetadata;
import com.geico.poc.streamcatalog.catalog.SourceMetadata;
import com.geico.poc.streamcatalog.catalog.TableMetadata;
import com.geico.poc.streamcatalog.catalog.ViewMetadata;
import com.geico.poc.streamcatalog.catalog.WatermarkDesc;
import com.geico.poc.streamcatalog.config.StreamCatalogConfig;
import com.geico.poc.streamcatalog.error.CatalogException;
import com.geico.poc.streamcatalog.error.CatalogInconsistentException;
import com.geico.poc.streamcatalog.error.DependencyViolationException;
import com.geico.poc.streamcatalog.error.InvalidDefinitionException;
import com.geico.poc.streamcatalog.error.NameConflictException;
import com.geico.poc.streamcatalog.error.ObjectNotFoundException;
import com.geico.poc.streamcatalog.error.StoreUnavailableException;
import com.geico.poc.streamcatalog.notification.CatalogNotification;
import com.geico.poc.streamcatalog.notification.NotificationBroadcaster;
import com.geico.poc.streamcatalog.sql.RelationResolver;
import com.geico.poc.streamcatalog.sql.ViewAnalysis;
import com.geico.poc.streamcatalog.sql.ViewQueryAnalyzer;
import com.geico.poc.streamcatalog.store.CatalogCodec;
import com.geico.poc.streamcatalog.store.CatalogKeys;
import com.geico.poc.streamcatalog.store.CatalogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * The single writer of the catalog.
 *
 * Every create, alter and drop runs under one writer lock through the same pipeline:
 * validate against the last committed snapshot, allocate ids, commit all writes to the
 * {@link CatalogStore} atomically, swap in the next snapshot and publish one notification.
 * A request rejected during validation touches nothing; a failed commit leaves the catalog,
 * the id counters and the dependency graph exactly as they were.
 *
 * Reads go through {@link #snapshot()} and never take the writer lock.
 */
@Component
public class CatalogManager {

    private static final Logger log = LoggerFactory.getLogger(CatalogManager.class);

    private final CatalogStore store;
    private final NotificationBroadcaster broadcaster;
    private final ViewQueryAnalyzer viewQueryAnalyzer;
    private final StreamCatalogConfig config;

    private final ReentrantLock writerLock = new ReentrantLock(true);
    private final AtomicReference<CatalogSnapshot> snapshot = new AtomicReference<>(CatalogSnapshot.empty());
    private final IdAllocator idAllocator = new IdAllocator();
    private DependencyGraph dependencyGraph = new DependencyGraph();

    @Autowired
    public CatalogManager(CatalogStore store, NotificationBroadcaster broadcaster,
                          ViewQueryAnalyzer viewQueryAnalyzer, StreamCatalogConfig config) {
        this.store = store;
        this.broadcaster = broadcaster;
        this.viewQueryAnalyzer = viewQueryAnalyzer;
        this.config = config;
    }

    @PostConstruct
    public void initialize() {
        log.info("Initializing catalog manager...");
        recover();
        StreamCatalogConfig.BootstrapConfig bootstrap = config.getBootstrap();
        if (bootstrap.isEnabled() && snapshot.get().databases().isEmpty()) {
            log.info("Empty catalog, creating default database '{}'", bootstrap.getDefaultDatabase());
            createDatabase(bootstrap.getDefaultDatabase(), bootstrap.getDefaultOwner());
        }
        log.info("Catalog manager initialized at catalog version {}", snapshot.get().getVersion());
    }

    // ========================================
    // Reads
    // ========================================

    /**
     * The last committed catalog. Never blocks on DDL.
     */
    public CatalogSnapshot snapshot() {
        return snapshot.get();
    }

    public long currentVersion() {
        return snapshot.get().getVersion();
    }

    /**
     * Ids of the objects that directly read {@code relationId}, as of the current snapshot.
     * Does not wait for a DDL in progress.
     */
    public Set<Long> dependentsOf(long relationId) {
        return snapshot.get().dependentsOf(relationId);
    }

    // ========================================
    // Databases and schemas
    // ========================================

    /**
     * Create a database together with its default schemas.
     */
    public DatabaseMetadata createDatabase(String name, int owner) {
        return execute("CREATE DATABASE " + name, txn -> {
            requireName(name, "Database");
            if (txn.base().findDatabase(name).isPresent()) {
                throw new NameConflictException(ObjectKind.DATABASE, name, "the cluster");
            }
            DatabaseMetadata database = new DatabaseMetadata(txn.nextId(ObjectKind.DATABASE), name, owner);
            txn.create(database);
            for (String schemaName : config.getBootstrap().getDefaultSchemas()) {
                txn.create(new SchemaMetadata(txn.nextId(ObjectKind.SCHEMA), database.getId(), schemaName, owner));
            }
            return database;
        });
    }

    /**
     * Drop a database and everything in it.
     */
    public void dropDatabase(long databaseId) {
        execute("DROP DATABASE " + databaseId, txn -> {
            CatalogSnapshot base = txn.base();
            DatabaseMetadata database = base.getDatabase(databaseId)
                    .orElseThrow(() -> new ObjectNotFoundException(ObjectKind.DATABASE, databaseId));

            List<SchemaScopedObject> contents = new ArrayList<>();
            for (SchemaMetadata schema : base.schemas(databaseId)) {
                contents.addAll(base.objectsInSchema(schema.getId()));
            }
            Set<Long> dropped = new HashSet<>();
            for (SchemaScopedObject object : contents) {
                if (object.kind().isRelation()) {
                    dropped.add(object.getId());
                }
            }
            // Objects in other databases may still read from this one
            for (SchemaScopedObject object : contents) {
                if (object.kind().isRelation()) {
                    checkNoDependents(base, object, dropped);
                }
            }

            contents.sort(Comparator.comparingLong(CatalogObject::getId).reversed());
            for (SchemaScopedObject object : contents) {
                txn.drop(object);
            }
            for (SchemaMetadata schema : base.schemas(databaseId)) {
                txn.drop(schema);
            }
            txn.drop(database);
            return null;
        });
    }

    public SchemaMetadata createSchema(long databaseId, String name, int owner) {
        return execute("CREATE SCHEMA " + name, txn -> {
            requireName(name, "Schema");
            DatabaseMetadata database = txn.base().getDatabase(databaseId)
                    .orElseThrow(() -> new ObjectNotFoundException(ObjectKind.DATABASE, databaseId));
            if (txn.base().findSchema(databaseId, name).isPresent()) {
                throw new NameConflictException(ObjectKind.SCHEMA, name, "database \"" + database.getName() + "\"");
            }
            SchemaMetadata schema = new SchemaMetadata(txn.nextId(ObjectKind.SCHEMA), databaseId, name, owner);
            txn.create(schema);
            return schema;
        });
    }

    /**
     * Drop an empty schema.
     */
    public void dropSchema(long schemaId) {
        execute("DROP SCHEMA " + schemaId, txn -> {
            SchemaMetadata schema = txn.base().getSchema(schemaId)
                    .orElseThrow(() -> new ObjectNotFoundException(ObjectKind.SCHEMA, schemaId));
            List<SchemaScopedObject> contents = txn.base().objectsInSchema(schemaId);
            if (!contents.isEmpty()) {
                List<Long> ids = new ArrayList<>();
                for (SchemaScopedObject object : contents) {
                    ids.add(object.getId());
                }
                throw new DependencyViolationException(schemaId, ids,
                        "Cannot drop schema \"" + schema.getName() + "\": it still contains " + contents.size() + " objects");
            }
            txn.drop(schema);
            return null;
        });
    }

    // ========================================
    // Tables
    // ========================================

    /**
     * Create a table. A table whose properties name a connector is created together with
     * its associated source.
     */
    public TableMetadata createTable(TableMetadata request) {
        return createTable(request, null);
    }

    /**
     * Create a table coupled with the given source description, or a plain table when
     * {@code sourceSpec} is null and the table has no connector.
     */
    public TableMetadata createTable(TableMetadata request, SourceMetadata sourceSpec) {
        return execute("CREATE TABLE " + request.getName(), txn -> {
            CatalogSnapshot base = txn.base();
            TableMetadata.TableType type = request.getTableType();
            if (type != TableMetadata.TableType.TABLE && type != TableMetadata.TableType.INTERNAL) {
                throw new InvalidDefinitionException("Cannot create a " + type + " through CREATE TABLE");
            }
            validateNewRelation(base, request.getDatabaseId(), request.getSchemaId(), request.getName());
            requireColumns(request.getName(), request.getColumns());
            requireLive(base, request.getDependentRelations());

            TableMetadata table = SchemaEvolution.initializeTable(request, true);
            boolean coupled = sourceSpec != null || SourceTableCoupling.requiresSource(request);
            if (coupled) {
                if (type == TableMetadata.TableType.INTERNAL) {
                    throw new InvalidDefinitionException("Internal table \"" + request.getName() + "\" cannot have a source");
                }
                return SourceTableCoupling.createTableWithSource(txn, table, sourceSpec);
            }
            TableMetadata created = table.toBuilder()
                    .id(txn.nextId(ObjectKind.TABLE))
                    .noAssociatedSource()
                    .build();
            txn.create(created);
            return created;
        });
    }

    public TableMetadata createMaterializedView(TableMetadata request) {
        return execute("CREATE MATERIALIZED VIEW " + request.getName(), txn -> {
            CatalogSnapshot base = txn.base();
            validateNewRelation(base, request.getDatabaseId(), request.getSchemaId(), request.getName());
            requireColumns(request.getName(), request.getColumns());
            requireLive(base, request.getDependentRelations());

            TableMetadata mv = SchemaEvolution.initializeTable(
                    request.toBuilder().tableType(TableMetadata.TableType.MATERIALIZED_VIEW).build(), false);
            TableMetadata created = mv.toBuilder()
                    .id(txn.nextId(ObjectKind.TABLE))
                    .noAssociatedSource()
                    .version(null)
                    .build();
            txn.create(created);
            return created;
        });
    }

    /**
     * Apply column changes to a table, provided the caller saw the table at
     * {@code expectedVersion}.
     *
     * Drops, renames and type changes are refused while objects other than the table's own
     * indexes read it, and likewise while anything reads the table's coupled source. A
     * coupled source is rewritten in the same transaction.
     */
    public TableMetadata alterTableColumns(long tableId, long expectedVersion, List<ColumnChange> changes) {
        return execute("ALTER TABLE " + tableId, txn -> {
            CatalogSnapshot base = txn.base();
            TableMetadata table = base.getTable(tableId)
                    .orElseThrow(() -> new ObjectNotFoundException(ObjectKind.TABLE, tableId));
            if (table.getTableType() != TableMetadata.TableType.TABLE) {
                throw new InvalidDefinitionException("\"" + table.getName() + "\" is a "
                        + describe(table) + ", not a table");
            }
            if (changes.isEmpty()) {
                throw new InvalidDefinitionException("ALTER TABLE \"" + table.getName() + "\" has no changes");
            }

            SchemaEvolution.AlterSession session = SchemaEvolution.beginAlter(table, expectedVersion);

            List<IndexMetadata> indexes = base.indexesOf(tableId);
            boolean destructive = false;
            for (ColumnChange change : changes) {
                destructive |= change.isDestructive();
            }
            if (destructive) {
                checkNoDependents(base, table, indexTableIds(indexes));
                if (table.hasAssociatedSource()) {
                    checkNoDependents(base, SourceTableCoupling.requireAssociatedSource(base, table),
                            Collections.<Long>emptySet());
                }
            }

            for (ColumnChange change : changes) {
                session.apply(change);
            }
            TableMetadata altered = session.finish();
            txn.alter(altered);
            SourceTableCoupling.syncSource(txn, altered);
            for (IndexMetadata index : indexes) {
                IndexMetadata remapped = remapIndex(index, table, altered);
                if (!remapped.equals(index)) {
                    txn.alter(remapped);
                }
            }
            return altered;
        });
    }

    public void dropTable(long tableId) {
        execute("DROP TABLE " + tableId, txn -> {
            TableMetadata table = txn.base().getTable(tableId)
                    .orElseThrow(() -> new ObjectNotFoundException(ObjectKind.TABLE, tableId));
            TableMetadata.TableType type = table.getTableType();
            if (type != TableMetadata.TableType.TABLE && type != TableMetadata.TableType.INTERNAL) {
                throw new InvalidDefinitionException("\"" + table.getName() + "\" is a " + describe(table)
                        + ", not a table");
            }
            dropTableLike(txn, table);
            return null;
        });
    }

    public void dropMaterializedView(long tableId) {
        execute("DROP MATERIALIZED VIEW " + tableId, txn -> {
            TableMetadata mv = txn.base().getTable(tableId)
                    .orElseThrow(() -> new ObjectNotFoundException(ObjectKind.TABLE, tableId));
            if (mv.getTableType() != TableMetadata.TableType.MATERIALIZED_VIEW) {
                throw new InvalidDefinitionException("\"" + mv.getName() + "\" is a " + describe(mv)
                        + ", not a materialized view");
            }
            dropTableLike(txn, mv);
            return null;
        });
    }

    // Drops a table or MV with its own indexes and, for a coupled table, its source
    private void dropTableLike(CatalogTransaction txn, TableMetadata table) {
        CatalogSnapshot base = txn.base();
        List<IndexMetadata> indexes = base.indexesOf(table.getId());
        checkNoDependents(base, table, indexTableIds(indexes));
        if (table.hasAssociatedSource()) {
            checkNoDependents(base, SourceTableCoupling.requireAssociatedSource(base, table), Collections.<Long>emptySet());
        }
        for (IndexMetadata index : indexes) {
            dropIndexWithTable(txn, index);
        }
        SourceTableCoupling.dropTableWithSource(txn, table);
    }

    // ========================================
    // Sources and sinks
    // ========================================

    /**
     * Create a standalone source. Never coupled to a table.
     */
    public SourceMetadata createSource(SourceMetadata request) {
        return execute("CREATE SOURCE " + request.getName(), txn -> {
            validateNewRelation(txn.base(), request.getDatabaseId(), request.getSchemaId(), request.getName());
            requireColumns(request.getName(), request.getColumns());
            if (request.connector() == null) {
                throw new InvalidDefinitionException("Source \"" + request.getName() + "\" requires a "
                        + SourceMetadata.CONNECTOR_PROPERTY + " property");
            }
            for (Integer pk : request.getPkColumnIds()) {
                if (pk < 0 || pk >= request.getColumns().size()) {
                    throw new InvalidDefinitionException("Invalid primary key column " + pk
                            + " for source \"" + request.getName() + "\"");
                }
            }

            List<ColumnMetadata> columns = new ArrayList<>();
            List<Integer> pkColumnIds = new ArrayList<>(request.getPkColumnIds());
            List<WatermarkDesc> watermarks = new ArrayList<>(request.getWatermarkDescs());
            OptionalInt rowIdIndex = OptionalInt.empty();
            if (pkColumnIds.isEmpty()) {
                columns.add(ColumnMetadata.rowId(0));
                rowIdIndex = OptionalInt.of(0);
                pkColumnIds.add(0);
                watermarks.clear();
                for (WatermarkDesc watermark : request.getWatermarkDescs()) {
                    watermarks.add(new WatermarkDesc(watermark.getWatermarkIdx() + 1, watermark.getExpr()));
                }
            }
            for (ColumnMetadata column : SchemaEvolution.assignColumnIds(request.getName(), request.getColumns())) {
                columns.add(column.withColumnId(columns.size()));
            }

            SourceMetadata source = new SourceMetadata(
                    txn.nextId(ObjectKind.SOURCE),
                    request.getSchemaId(),
                    request.getDatabaseId(),
                    request.getName(),
                    rowIdIndex,
                    columns,
                    pkColumnIds,
                    request.getProperties(),
                    request.getOwner(),
                    request.getInfo(),
                    watermarks);
            txn.create(source);
            return source;
        });
    }

    /**
     * Drop a standalone source. The source of a connector-backed table goes away with its
     * table and cannot be dropped on its own.
     */
    public void dropSource(long sourceId) {
        execute("DROP SOURCE " + sourceId, txn -> {
            CatalogSnapshot base = txn.base();
            SourceMetadata source = base.getSource(sourceId)
                    .orElseThrow(() -> new ObjectNotFoundException(ObjectKind.SOURCE, sourceId));
            base.findOwningTable(sourceId).ifPresent(owner -> {
                throw new DependencyViolationException(sourceId, Collections.singletonList(owner.getId()),
                        "Cannot drop source \"" + source.getName() + "\": it belongs to table \""
                                + owner.getName() + "\" (id " + owner.getId() + "); drop the table instead");
            });
            checkNoDependents(base, source, Collections.<Long>emptySet());
            txn.drop(source);
            return null;
        });
    }

    public SinkMetadata createSink(SinkMetadata request) {
        return execute("CREATE SINK " + request.getName(), txn -> {
            CatalogSnapshot base = txn.base();
            validateNewRelation(base, request.getDatabaseId(), request.getSchemaId(), request.getName());
            if (request.getDependentRelations().isEmpty()) {
                throw new InvalidDefinitionException("Sink \"" + request.getName() + "\" must read from at least one relation");
            }
            requireLive(base, request.getDependentRelations());
            List<ColumnMetadata> columns = SchemaEvolution.assignColumnIds(request.getName(), request.getColumns());

            SinkMetadata sink = new SinkMetadata(
                    txn.nextId(ObjectKind.SINK),
                    request.getSchemaId(),
                    request.getDatabaseId(),
                    request.getName(),
                    columns,
                    request.getPk(),
                    request.getDependentRelations(),
                    request.getDistributionKey(),
                    request.getStreamKey(),
                    request.isAppendOnly(),
                    request.getOwner(),
                    request.getProperties(),
                    request.getDefinition());
            txn.create(sink);
            return sink;
        });
    }

    public void dropSink(long sinkId) {
        execute("DROP SINK " + sinkId, txn -> {
            SinkMetadata sink = txn.base().getSink(sinkId)
                    .orElseThrow(() -> new ObjectNotFoundException(ObjectKind.SINK, sinkId));
            checkNoDependents(txn.base(), sink, Collections.<Long>emptySet());
            txn.drop(sink);
            return null;
        });
    }

    // ========================================
    // Indexes
    // ========================================

    /**
     * Create an index and its backing table in one transaction.
     *
     * @param indexTable backing table description, or null to derive one covering the
     *                   indexed columns plus the primary key
     */
    public IndexMetadata createIndex(IndexMetadata index, TableMetadata indexTable) {
        return execute("CREATE INDEX " + index.getName(), txn -> {
            CatalogSnapshot base = txn.base();
            long primaryId = index.getPrimaryTableId();
            TableMetadata primary = base.getTable(primaryId)
                    .orElseThrow(() -> new ObjectNotFoundException(ObjectKind.TABLE, primaryId));
            if (primary.getTableType() != TableMetadata.TableType.TABLE
                    && primary.getTableType() != TableMetadata.TableType.MATERIALIZED_VIEW) {
                throw new InvalidDefinitionException("Cannot create an index on " + describe(primary)
                        + " \"" + primary.getName() + "\"");
            }
            if (index.getSchemaId() != primary.getSchemaId() || index.getDatabaseId() != primary.getDatabaseId()) {
                throw new InvalidDefinitionException("Index \"" + index.getName()
                        + "\" must be created in the schema of table \"" + primary.getName() + "\"");
            }
            validateNewRelation(base, index.getDatabaseId(), index.getSchemaId(), index.getName());
            if (index.getIndexItems().isEmpty()) {
                throw new InvalidDefinitionException("Index \"" + index.getName() + "\" has no columns");
            }
            List<Integer> originalColumns = new ArrayList<>();
            for (IndexMetadata.IndexItem item : index.getIndexItems()) {
                if (item.getInputRef() < 0 || item.getInputRef() >= primary.getColumns().size()) {
                    throw new InvalidDefinitionException("Index \"" + index.getName() + "\" references column "
                            + item.getInputRef() + " but \"" + primary.getName() + "\" has "
                            + primary.getColumns().size() + " columns");
                }
                originalColumns.add(item.getInputRef());
            }

            TableMetadata backingRequest = indexTable != null ? indexTable : deriveIndexTable(index, primary);
            TableMetadata backing = SchemaEvolution.initializeTable(backingRequest.toBuilder()
                    .name(index.getName())
                    .schemaId(primary.getSchemaId())
                    .databaseId(primary.getDatabaseId())
                    .tableType(TableMetadata.TableType.INDEX)
                    .dependentRelations(Collections.singletonList(primaryId))
                    .noAssociatedSource()
                    .owner(index.getOwner())
                    .build(), false)
                    .toBuilder()
                    .id(txn.nextId(ObjectKind.TABLE))
                    .version(null)
                    .build();

            IndexMetadata created = new IndexMetadata(
                    txn.nextId(ObjectKind.INDEX),
                    index.getSchemaId(),
                    index.getDatabaseId(),
                    index.getName(),
                    index.getOwner(),
                    backing.getId(),
                    primaryId,
                    index.getIndexItems(),
                    index.getOriginalColumns().isEmpty() ? originalColumns : index.getOriginalColumns());
            txn.create(backing);
            txn.create(created);
            return created;
        });
    }

    public void dropIndex(long indexId) {
        execute("DROP INDEX " + indexId, txn -> {
            IndexMetadata index = txn.base().getIndex(indexId)
                    .orElseThrow(() -> new ObjectNotFoundException(ObjectKind.INDEX, indexId));
            dropIndexWithTable(txn, index);
            return null;
        });
    }

    private void dropIndexWithTable(CatalogTransaction txn, IndexMetadata index) {
        CatalogSnapshot base = txn.base();
        TableMetadata backing = base.getTable(index.getIndexTableId())
                .orElseThrow(() -> new CatalogInconsistentException("Index " + index.getId() + " (\"" + index.getName()
                        + "\") references backing table " + index.getIndexTableId() + " which does not exist"));
        checkNoDependents(base, index, Collections.<Long>emptySet());
        checkNoDependents(base, backing, Collections.<Long>emptySet());
        txn.drop(index);
        txn.drop(backing);
    }

    private static TableMetadata deriveIndexTable(IndexMetadata index, TableMetadata primary) {
        TableMetadata.Builder builder = TableMetadata.builder();
        List<Integer> included = new ArrayList<>();
        List<ColumnOrder> pk = new ArrayList<>();
        for (IndexMetadata.IndexItem item : index.getIndexItems()) {
            if (!included.contains(item.getInputRef())) {
                included.add(item.getInputRef());
            }
        }
        for (ColumnOrder order : primary.getPk()) {
            if (!included.contains(order.getColumnIndex())) {
                included.add(order.getColumnIndex());
            }
        }
        for (int i = 0; i < included.size(); i++) {
            ColumnMetadata column = primary.getColumns().get(included.get(i));
            builder.addColumn(new ColumnMetadata(ColumnMetadata.PLACEHOLDER_ID, column.getName(),
                    column.getDataType(), column.isHidden()));
            pk.add(ColumnOrder.asc(i));
        }
        return builder.pk(pk)
                .distributionKey(Collections.singletonList(0))
                .definition("CREATE INDEX " + index.getName() + " ON " + primary.getName())
                .build();
    }

    // Rewrites index column positions after an alter of the primary table
    private static IndexMetadata remapIndex(IndexMetadata index, TableMetadata before, TableMetadata after) {
        Map<Integer, Integer> newPositionById = new HashMap<>();
        for (int i = 0; i < after.getColumns().size(); i++) {
            newPositionById.put(after.getColumns().get(i).getColumnId(), i);
        }
        List<IndexMetadata.IndexItem> items = new ArrayList<>();
        for (IndexMetadata.IndexItem item : index.getIndexItems()) {
            ColumnMetadata column = before.getColumns().get(item.getInputRef());
            Integer position = newPositionById.get(column.getColumnId());
            if (position == null) {
                throw new DependencyViolationException(before.getId(), Collections.singletonList(index.getId()),
                        "Cannot drop column \"" + column.getName() + "\": index \"" + index.getName() + "\" uses it");
            }
            if (!after.getColumns().get(position).getDataType().equals(column.getDataType())) {
                throw new DependencyViolationException(before.getId(), Collections.singletonList(index.getId()),
                        "Cannot change the type of column \"" + column.getName() + "\": index \""
                                + index.getName() + "\" uses it");
            }
            items.add(new IndexMetadata.IndexItem(position, item.getReturnType()));
        }
        List<Integer> originalColumns = new ArrayList<>();
        for (Integer original : index.getOriginalColumns()) {
            Integer position = newPositionById.get(before.getColumns().get(original).getColumnId());
            originalColumns.add(position != null ? position : original);
        }
        return new IndexMetadata(index.getId(), index.getSchemaId(), index.getDatabaseId(), index.getName(),
                index.getOwner(), index.getIndexTableId(), index.getPrimaryTableId(), items, originalColumns);
    }

    private static Set<Long> indexTableIds(List<IndexMetadata> indexes) {
        Set<Long> ids = new HashSet<>();
        for (IndexMetadata index : indexes) {
            ids.add(index.getIndexTableId());
        }
        return ids;
    }

    // ========================================
    // Views
    // ========================================

    /**
     * Create a view. The query is analyzed to find the relations it reads and its output
     * columns; user-supplied column names must match the query's output arity.
     */
    public ViewMetadata createView(ViewMetadata request) {
        return execute("CREATE VIEW " + request.getName(), txn -> {
            CatalogSnapshot base = txn.base();
            validateNewRelation(base, request.getDatabaseId(), request.getSchemaId(), request.getName());
            if (request.getSql() == null || request.getSql().trim().isEmpty()) {
                throw new InvalidDefinitionException("View \"" + request.getName() + "\" has no query");
            }

            ViewAnalysis analysis = viewQueryAnalyzer.analyze(request.getSql(),
                    resolverFor(base, request.getDatabaseId(), request.getSchemaId()));
            List<ViewMetadata.Field> columns = viewColumns(request, analysis);

            Set<Long> dependents = new LinkedHashSet<>(request.getDependentRelations());
            dependents.addAll(analysis.getDependentRelations());
            requireLive(base, dependents);

            ViewMetadata view = new ViewMetadata(
                    txn.nextId(ObjectKind.VIEW),
                    request.getSchemaId(),
                    request.getDatabaseId(),
                    request.getName(),
                    request.getOwner(),
                    request.getProperties(),
                    request.getSql(),
                    new ArrayList<>(dependents),
                    columns);
            txn.create(view);
            return view;
        });
    }

    /**
     * {@code CREATE VIEW name [(columnNames)] AS sql}.
     *
     * @param columnNames user-specified output names, or an empty list to take the query's
     */
    public ViewMetadata createView(long databaseId, long schemaId, String name, List<String> columnNames,
                                   String sql, int owner) {
        List<ViewMetadata.Field> fields = new ArrayList<>();
        for (String columnName : columnNames) {
            fields.add(new ViewMetadata.Field(columnName, ViewQueryAnalyzer.UNKNOWN_TYPE));
        }
        return createView(new ViewMetadata(0, schemaId, databaseId, name, owner, null, sql, null, fields));
    }

    private static List<ViewMetadata.Field> viewColumns(ViewMetadata request, ViewAnalysis analysis) {
        List<ViewMetadata.Field> columns;
        if (request.getColumns().isEmpty()) {
            columns = analysis.getColumns();
        } else {
            if (request.getColumns().size() != analysis.arity()) {
                throw new InvalidDefinitionException(String.format(
                        "View \"%s\" specifies %d column names but its query returns %d columns",
                        request.getName(), request.getColumns().size(), analysis.arity()));
            }
            columns = new ArrayList<>();
            for (int i = 0; i < request.getColumns().size(); i++) {
                ViewMetadata.Field named = request.getColumns().get(i);
                String type = named.getDataType() == null || ViewQueryAnalyzer.UNKNOWN_TYPE.equals(named.getDataType())
                        ? analysis.getColumns().get(i).getDataType()
                        : named.getDataType();
                columns.add(new ViewMetadata.Field(named.getName(), type));
            }
        }
        Set<String> seen = new HashSet<>();
        for (ViewMetadata.Field field : columns) {
            if (!seen.add(field.getName().toLowerCase(Locale.ROOT))) {
                throw new InvalidDefinitionException("Column \"" + field.getName()
                        + "\" specified more than once in view \"" + request.getName() + "\"");
            }
        }
        return columns;
    }

    public void dropView(long viewId) {
        execute("DROP VIEW " + viewId, txn -> {
            ViewMetadata view = txn.base().getView(viewId)
                    .orElseThrow(() -> new ObjectNotFoundException(ObjectKind.VIEW, viewId));
            checkNoDependents(txn.base(), view, Collections.<Long>emptySet());
            txn.drop(view);
            return null;
        });
    }

    private RelationResolver resolverFor(CatalogSnapshot base, long databaseId, long schemaId) {
        return names -> {
            if (names.size() > 3) {
                throw new InvalidDefinitionException("Improper qualified name: " + String.join(".", names));
            }
            long targetSchema = schemaId;
            if (names.size() > 1) {
                long targetDatabase = databaseId;
                if (names.size() == 3) {
                    targetDatabase = base.findDatabase(names.get(0))
                            .orElseThrow(() -> new ObjectNotFoundException(ObjectKind.DATABASE, names.get(0)))
                            .getId();
                }
                String schemaName = names.get(names.size() - 2);
                targetSchema = base.findSchema(targetDatabase, schemaName)
                        .orElseThrow(() -> new ObjectNotFoundException(ObjectKind.SCHEMA, schemaName))
                        .getId();
            }
            String relationName = names.get(names.size() - 1);
            return base.findRelation(targetSchema, relationName)
                    .orElseThrow(() -> new ObjectNotFoundException(ObjectKind.TABLE, String.join(".", names)));
        };
    }

    // ========================================
    // Functions
    // ========================================

    /**
     * Create a function. Overloads with different argument types may share a name.
     */
    public FunctionMetadata createFunction(FunctionMetadata request) {
        return execute("CREATE FUNCTION " + request.signature(), txn -> {
            CatalogSnapshot base = txn.base();
            requireName(request.getName(), "Function");
            SchemaMetadata schema = requireSchema(base, request.getDatabaseId(), request.getSchemaId());
            if (base.findFunction(request.getSchemaId(), request.getName(), request.getArgTypes()).isPresent()) {
                throw new NameConflictException(ObjectKind.FUNCTION, request.signature(),
                        "schema \"" + schema.getName() + "\"");
            }
            FunctionMetadata function = request.withId(txn.nextId(ObjectKind.FUNCTION));
            txn.create(function);
            return function;
        });
    }

    public void dropFunction(long functionId) {
        execute("DROP FUNCTION " + functionId, txn -> {
            FunctionMetadata function = txn.base().getFunction(functionId)
                    .orElseThrow(() -> new ObjectNotFoundException(ObjectKind.FUNCTION, functionId));
            txn.drop(function);
            return null;
        });
    }

    // ========================================
    // Renames
    // ========================================

    /**
     * Rename a relation. A coupled table renames its source and an index renames its backing
     * table in the same transaction; a table rename moves the table to its next version.
     */
    public SchemaScopedObject renameRelation(ObjectKind kind, long id, String newName) {
        return execute("RENAME " + kind + " " + id + " TO " + newName, txn -> {
            CatalogSnapshot base = txn.base();
            if (!kind.isRelation()) {
                throw new InvalidDefinitionException("Cannot rename a " + kind.name().toLowerCase(Locale.ROOT) + " as a relation");
            }
            SchemaScopedObject relation = (SchemaScopedObject) base.find(kind, id)
                    .orElseThrow(() -> new ObjectNotFoundException(kind, id));
            if (base.isCompanion(relation)) {
                throw new InvalidDefinitionException("\"" + relation.getName()
                        + "\" is managed by another relation and cannot be renamed on its own");
            }
            validateNewRelation(base, relation.getDatabaseId(), relation.getSchemaId(), newName);

            SchemaScopedObject renamed;
            switch (kind) {
                case TABLE:
                    TableMetadata table = SchemaEvolution.bumpVersion(
                            ((TableMetadata) relation).toBuilder().name(newName).build());
                    txn.alter(table);
                    SourceTableCoupling.syncSource(txn, table);
                    renamed = table;
                    break;
                case SOURCE:
                    renamed = ((SourceMetadata) relation).withName(newName);
                    txn.alter(renamed);
                    break;
                case SINK:
                    renamed = ((SinkMetadata) relation).withName(newName);
                    txn.alter(renamed);
                    break;
                case INDEX:
                    IndexMetadata index = ((IndexMetadata) relation).withName(newName);
                    TableMetadata backing = base.getTable(index.getIndexTableId())
                            .orElseThrow(() -> new CatalogInconsistentException("Index " + index.getId()
                                    + " references backing table " + index.getIndexTableId() + " which does not exist"));
                    txn.alter(index);
                    txn.alter(backing.toBuilder().name(newName).build());
                    renamed = index;
                    break;
                case VIEW:
                    renamed = ((ViewMetadata) relation).withName(newName);
                    txn.alter(renamed);
                    break;
                default:
                    throw new InvalidDefinitionException("Cannot rename " + kind);
            }
            return renamed;
        });
    }

    // ========================================
    // Transaction pipeline
    // ========================================

    private <T> T execute(String operation, Function<CatalogTransaction, T> body) {
        writerLock.lock();
        try {
            CatalogSnapshot base = snapshot.get();
            CatalogTransaction txn = new CatalogTransaction(operation, base, idAllocator.reserve());
            log.debug("{}: {}", operation, txn.getState());

            T result;
            try {
                result = body.apply(txn);
            } catch (CatalogInconsistentException e) {
                txn.setState(CatalogTransaction.State.REJECTED);
                log.error("Catalog inconsistency detected during {}: {}", operation, e.getMessage());
                throw e;
            } catch (CatalogException e) {
                txn.setState(CatalogTransaction.State.REJECTED);
                log.warn("Rejected {}: {}", operation, e.getMessage());
                throw e;
            }
            if (txn.isEmpty()) {
                txn.setState(CatalogTransaction.State.DONE);
                return result;
            }

            long version = base.getVersion() + 1;
            txn.setState(CatalogTransaction.State.COMMITTING);
            try {
                store.commit(txn.toWrites(version));
            } catch (CatalogException e) {
                txn.setState(CatalogTransaction.State.REJECTED);
                log.warn("Commit of {} failed, nothing applied: {}", operation, e.getMessage());
                throw e;
            } catch (RuntimeException e) {
                txn.setState(CatalogTransaction.State.REJECTED);
                log.warn("Commit of {} failed, nothing applied: {}", operation, e.getMessage());
                throw new StoreUnavailableException("Commit of " + operation + " failed: " + e.getMessage(), e);
            }

            idAllocator.advance(txn.reservation());
            dependencyGraph.apply(txn.getDeltas());
            snapshot.set(base.apply(version, txn.getDeltas()));

            txn.setState(CatalogTransaction.State.BROADCASTING);
            CatalogNotification notification = broadcaster.publish(txn.getDeltas());
            if (notification.getVersion() != version) {
                log.error("Catalog version {} was published as {}; subscribers must resync",
                        version, notification.getVersion());
            }
            txn.setState(CatalogTransaction.State.DONE);
            log.info("{} committed at catalog version {} ({} changes)", operation, version, txn.getDeltas().size());
            return result;
        } finally {
            writerLock.unlock();
        }
    }

    // ========================================
    // Recovery
    // ========================================

    private void recover() {
        writerLock.lock();
        try {
            List<CatalogObject> objects = new ArrayList<>();
            Map<IdCategory, Long> watermarks = new EnumMap<>(IdCategory.class);
            Map<IdCategory, Long> maxLiveIds = new EnumMap<>(IdCategory.class);
            long version = 0;

            for (CatalogStore.Entry entry : store.loadAll()) {
                byte[] key = entry.getKey();
                if (CatalogKeys.isObjectKey(key)) {
                    CatalogObject object = CatalogCodec.decodeObject(entry.getValue());
                    if (object.kind() != CatalogKeys.decodeKind(key) || object.getId() != CatalogKeys.decodeId(key)) {
                        throw inconsistent("Stored " + object.kind() + " " + object.getId()
                                + " does not match its key " + CatalogKeys.decodeKind(key) + " " + CatalogKeys.decodeId(key));
                    }
                    objects.add(object);
                    maxLiveIds.merge(IdCategory.of(object.kind()), object.getId(), Long::max);
                } else if (CatalogKeys.isIdWatermarkKey(key)) {
                    watermarks.put(CatalogKeys.decodeCategory(key), CatalogCodec.decodeLong(entry.getValue()));
                } else if (CatalogKeys.isCatalogVersionKey(key)) {
                    version = CatalogCodec.decodeLong(entry.getValue());
                } else {
                    log.warn("Ignoring unrecognized catalog store key of length {}", key.length);
                }
            }

            CatalogSnapshot recovered = CatalogSnapshot.of(version, objects);
            verifyConsistency(recovered);
            idAllocator.recover(watermarks, maxLiveIds);
            dependencyGraph = DependencyGraph.build(recovered);
            snapshot.set(recovered);
            broadcaster.reset(version);
            log.info("Recovered {} catalog objects at catalog version {} ({} dependency edges)",
                    recovered.size(), version, dependencyGraph.edgeCount());
        } finally {
            writerLock.unlock();
        }
    }

    private void verifyConsistency(CatalogSnapshot recovered) {
        for (CatalogObject object : recovered.allObjects()) {
            if (object instanceof SchemaMetadata) {
                SchemaMetadata schema = (SchemaMetadata) object;
                if (!recovered.getDatabase(schema.getDatabaseId()).isPresent()) {
                    throw inconsistent("Schema " + schema.getId() + " belongs to missing database " + schema.getDatabaseId());
                }
            } else if (object instanceof SchemaScopedObject) {
                SchemaScopedObject scoped = (SchemaScopedObject) object;
                if (!recovered.getSchema(scoped.getSchemaId()).isPresent()) {
                    throw inconsistent(scoped.kind() + " " + scoped.getId() + " belongs to missing schema " + scoped.getSchemaId());
                }
                for (Long dependency : scoped.getDependentRelations()) {
                    if (!recovered.getRelation(dependency).isPresent()) {
                        throw inconsistent(scoped.kind() + " " + scoped.getId() + " depends on missing relation " + dependency);
                    }
                }
            }
            if (object instanceof TableMetadata && ((TableMetadata) object).hasAssociatedSource()) {
                SourceTableCoupling.requireAssociatedSource(recovered, (TableMetadata) object);
            }
        }
    }

    private static CatalogInconsistentException inconsistent(String message) {
        log.error("Catalog inconsistency: {}", message);
        return new CatalogInconsistentException(message);
    }

    // ========================================
    // Validation helpers
    // ========================================

    private static void requireName(String name, String what) {
        if (name == null || name.trim().isEmpty()) {
            throw new InvalidDefinitionException(what + " name must not be empty");
        }
    }

    private static SchemaMetadata requireSchema(CatalogSnapshot base, long databaseId, long schemaId) {
        SchemaMetadata schema = base.getSchema(schemaId)
                .orElseThrow(() -> new ObjectNotFoundException(ObjectKind.SCHEMA, schemaId));
        if (schema.getDatabaseId() != databaseId) {
            throw new InvalidDefinitionException("Schema \"" + schema.getName() + "\" does not belong to database " + databaseId);
        }
        return schema;
    }

    private static void validateNewRelation(CatalogSnapshot base, long databaseId, long schemaId, String name) {
        requireName(name, "Relation");
        SchemaMetadata schema = requireSchema(base, databaseId, schemaId);
        base.findRelation(schemaId, name).ifPresent(existing -> {
            throw new NameConflictException(existing.kind(), name, "schema \"" + schema.getName() + "\"");
        });
    }

    private static void requireColumns(String relationName, List<ColumnMetadata> columns) {
        if (columns.isEmpty()) {
            throw new InvalidDefinitionException("\"" + relationName + "\" must have at least one column");
        }
    }

    private static void requireLive(CatalogSnapshot base, Iterable<Long> relationIds) {
        for (Long relationId : relationIds) {
            if (!base.getRelation(relationId).isPresent()) {
                throw new ObjectNotFoundException(ObjectKind.TABLE, relationId);
            }
        }
    }

    /**
     * @param allowed dependents that are dropped or kept consistent by the same transaction
     */
    private void checkNoDependents(CatalogSnapshot base, SchemaScopedObject relation, Set<Long> allowed) {
        if (dependencyGraph.canDrop(relation.getId())) {
            return;
        }
        List<Long> blocking = new ArrayList<>();
        StringBuilder names = new StringBuilder();
        for (Long dependent : dependencyGraph.dependentsOf(relation.getId())) {
            if (allowed.contains(dependent)) {
                continue;
            }
            blocking.add(dependent);
            if (names.length() > 0) {
                names.append(", ");
            }
            SchemaScopedObject object = base.getRelation(dependent).orElse(null);
            names.append(object != null ? describe(object) + " \"" + object.getName() + "\"" : "relation")
                    .append(" (id ").append(dependent).append(')');
        }
        if (!blocking.isEmpty()) {
            throw new DependencyViolationException(relation.getId(), blocking,
                    "Cannot change " + describe(relation) + " \"" + relation.getName() + "\": " + names + " depends on it");
        }
    }

    private static String describe(SchemaScopedObject relation) {
        if (relation instanceof TableMetadata) {
            switch (((TableMetadata) relation).getTableType()) {
                case MATERIALIZED_VIEW:
                    return "materialized view";
                case INDEX:
                    return "index table";
                case INTERNAL:
                    return "internal table";
                default:
                    return "table";
            }
        }
        return relation.kind().name().toLowerCase(Locale.ROOT);
    }
}
