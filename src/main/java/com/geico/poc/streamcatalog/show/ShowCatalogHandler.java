package com.geico.poc.streamcatalog.show;

import com.geico.poc.streamcatalog.catalog.ColumnMetadata;
import com.geico.poc.streamcatalog.catalog.ColumnOrder;
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
import com.geico.poc.streamcatalog.config.StreamCatalogConfig;
import com.geico.poc.streamcatalog.dto.CatalogResponse;
import com.geico.poc.streamcatalog.error.InvalidDefinitionException;
import com.geico.poc.streamcatalog.error.ObjectNotFoundException;
import com.geico.poc.streamcatalog.manager.CatalogManager;
import com.geico.poc.streamcatalog.manager.CatalogSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * SHOW and SHOW CREATE over the read snapshot.
 *
 * Listings are scoped to one database (the configured default when none is given) and,
 * optionally, one schema, and can be narrowed by a name pattern using {@code *} and
 * {@code ?} wildcards. Rows come back sorted by name.
 */
@Component
public class ShowCatalogHandler {

    private static final Logger log = LoggerFactory.getLogger(ShowCatalogHandler.class);

    @Autowired
    private CatalogManager catalogManager;

    @Autowired
    private StreamCatalogConfig config;

    public CatalogResponse show(ShowObject what, String database, String schema, String pattern) {
        CatalogSnapshot snapshot = catalogManager.snapshot();
        log.debug("SHOW {} (database={}, schema={}, pattern={}) at catalog version {}",
                what, database, schema, pattern, snapshot.getVersion());

        switch (what) {
            case DATABASES:
                return showDatabases(snapshot, pattern);
            case SCHEMAS:
                return showSchemas(snapshot, resolveDatabase(snapshot, database), pattern);
            case COLUMNS:
                throw new InvalidDefinitionException("SHOW COLUMNS needs a relation name");
            case FUNCTIONS:
                return showFunctions(snapshot, schemaIds(snapshot, database, schema), pattern);
            default:
                return showRelations(snapshot, what, schemaIds(snapshot, database, schema), pattern);
        }
    }

    /**
     * {@code SHOW COLUMNS FROM relation}. Hidden columns are listed and flagged.
     */
    public CatalogResponse showColumns(String database, String schema, String relationName) {
        CatalogSnapshot snapshot = catalogManager.snapshot();
        SchemaScopedObject relation = resolveRelation(snapshot, database, schema, relationName);

        List<Map<String, Object>> rows = new ArrayList<>();
        if (relation instanceof ViewMetadata) {
            for (ViewMetadata.Field field : ((ViewMetadata) relation).getColumns()) {
                rows.add(columnRow(field.getName(), field.getDataType(), false));
            }
        } else {
            for (ColumnMetadata column : columnsOf(snapshot, relation)) {
                rows.add(columnRow(column.getName(), column.getDataType(), column.isHidden()));
            }
        }
        return new CatalogResponse(rows, Arrays.asList("Name", "Type", "Is Hidden"), snapshot.getVersion());
    }

    /**
     * {@code SHOW CREATE <kind> name}: the stored definition, or one rendered from the
     * stored metadata when the object carries none.
     */
    public CatalogResponse showCreate(ObjectKind kind, String database, String schema, String name) {
        if (!kind.isRelation()) {
            throw new InvalidDefinitionException("SHOW CREATE is not supported for " + kind);
        }
        CatalogSnapshot snapshot = catalogManager.snapshot();
        SchemaScopedObject relation = resolveRelation(snapshot, database, schema, name);
        if (relation.kind() != kind) {
            throw new ObjectNotFoundException(kind, name);
        }

        Map<String, Object> row = new LinkedHashMap<>();
        row.put("Name", qualifiedName(snapshot, relation));
        row.put("Create Sql", createStatement(snapshot, relation));
        List<Map<String, Object>> rows = new ArrayList<>();
        rows.add(row);
        return new CatalogResponse(rows, Arrays.asList("Name", "Create Sql"), snapshot.getVersion());
    }

    private CatalogResponse showDatabases(CatalogSnapshot snapshot, String pattern) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (DatabaseMetadata database : snapshot.databases()) {
            if (matchesPattern(database.getName(), pattern)) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("Name", database.getName());
                row.put("Owner", database.getOwner());
                rows.add(row);
            }
        }
        return new CatalogResponse(rows, Arrays.asList("Name", "Owner"), snapshot.getVersion());
    }

    private CatalogResponse showSchemas(CatalogSnapshot snapshot, DatabaseMetadata database, String pattern) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (SchemaMetadata schema : snapshot.schemas(database.getId())) {
            if (matchesPattern(schema.getName(), pattern)) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("Name", schema.getName());
                row.put("Owner", schema.getOwner());
                rows.add(row);
            }
        }
        return new CatalogResponse(rows, Arrays.asList("Name", "Owner"), snapshot.getVersion());
    }

    private CatalogResponse showFunctions(CatalogSnapshot snapshot, Set<Long> schemaIds, String pattern) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (FunctionMetadata function : snapshot.functions()) {
            if (schemaIds.contains(function.getSchemaId()) && matchesPattern(function.getName(), pattern)) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("Schema", schemaName(snapshot, function));
                row.put("Name", function.getName());
                row.put("Arguments", String.join(", ", function.getArgTypes()));
                row.put("Return Type", function.getReturnType());
                row.put("Language", function.getLanguage());
                row.put("Link", function.getPath());
                rows.add(row);
            }
        }
        return new CatalogResponse(rows,
                Arrays.asList("Schema", "Name", "Arguments", "Return Type", "Language", "Link"),
                snapshot.getVersion());
    }

    private CatalogResponse showRelations(CatalogSnapshot snapshot, ShowObject what, Set<Long> schemaIds,
                                          String pattern) {
        List<SchemaScopedObject> relations = new ArrayList<>();
        switch (what) {
            case TABLES:
                relations.addAll(tablesOfType(snapshot, TableMetadata.TableType.TABLE));
                break;
            case INTERNAL_TABLES:
                relations.addAll(tablesOfType(snapshot, TableMetadata.TableType.INTERNAL));
                break;
            case MATERIALIZED_VIEWS:
                relations.addAll(tablesOfType(snapshot, TableMetadata.TableType.MATERIALIZED_VIEW));
                break;
            case SOURCES:
                relations.addAll(snapshot.sources());
                break;
            case SINKS:
                relations.addAll(snapshot.sinks());
                break;
            case VIEWS:
                relations.addAll(snapshot.views());
                break;
            case INDEXES:
                relations.addAll(snapshot.indexes());
                break;
            default:
                throw new InvalidDefinitionException("Unsupported SHOW " + what);
        }

        List<String> columns = new ArrayList<>(Arrays.asList("Schema", "Name", "Owner", "Id"));
        if (what == ShowObject.INDEXES) {
            columns.add("On");
            columns.add("Key");
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        for (SchemaScopedObject relation : relations) {
            if (!schemaIds.contains(relation.getSchemaId()) || !matchesPattern(relation.getName(), pattern)) {
                continue;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("Schema", schemaName(snapshot, relation));
            row.put("Name", relation.getName());
            row.put("Owner", relation.getOwner());
            row.put("Id", relation.getId());
            if (relation instanceof IndexMetadata) {
                IndexMetadata index = (IndexMetadata) relation;
                TableMetadata primary = snapshot.getTable(index.getPrimaryTableId()).orElse(null);
                row.put("On", primary != null ? primary.getName() : null);
                row.put("Key", primary != null ? indexKey(index, primary) : null);
            }
            rows.add(row);
        }
        return new CatalogResponse(rows, columns, snapshot.getVersion());
    }

    private static List<TableMetadata> tablesOfType(CatalogSnapshot snapshot, TableMetadata.TableType type) {
        List<TableMetadata> result = new ArrayList<>();
        for (TableMetadata table : snapshot.tables()) {
            if (table.getTableType() == type) {
                result.add(table);
            }
        }
        return result;
    }

    // ========================================
    // SHOW CREATE rendering
    // ========================================

    private static String createStatement(CatalogSnapshot snapshot, SchemaScopedObject relation) {
        switch (relation.kind()) {
            case TABLE:
                TableMetadata table = (TableMetadata) relation;
                if (!table.getDefinition().isEmpty()) {
                    return table.getDefinition();
                }
                return renderTable(table);
            case SOURCE:
                return renderSource((SourceMetadata) relation);
            case SINK:
                SinkMetadata sink = (SinkMetadata) relation;
                if (!sink.getDefinition().isEmpty()) {
                    return sink.getDefinition();
                }
                return "CREATE SINK " + sink.getName() + " FROM " + dependencyNames(snapshot, sink.getDependentRelations())
                        + renderWith(sink.getProperties());
            case INDEX:
                IndexMetadata index = (IndexMetadata) relation;
                TableMetadata primary = snapshot.getTable(index.getPrimaryTableId())
                        .orElseThrow(() -> new ObjectNotFoundException(ObjectKind.TABLE, index.getPrimaryTableId()));
                return "CREATE INDEX " + index.getName() + " ON " + primary.getName() + "(" + indexKey(index, primary) + ")";
            case VIEW:
                return ((ViewMetadata) relation).createStatement();
            default:
                throw new InvalidDefinitionException("SHOW CREATE is not supported for " + relation.kind());
        }
    }

    private static String renderTable(TableMetadata table) {
        String keyword = table.getTableType() == TableMetadata.TableType.MATERIALIZED_VIEW
                ? "CREATE MATERIALIZED VIEW "
                : "CREATE TABLE ";
        StringBuilder sb = new StringBuilder(keyword).append(table.getName()).append(" (");
        sb.append(renderColumns(table.getColumns()));
        List<String> pk = new ArrayList<>();
        for (ColumnOrder order : table.getPk()) {
            ColumnMetadata column = table.getColumns().get(order.getColumnIndex());
            if (!column.isHidden()) {
                pk.add(column.getName());
            }
        }
        if (!pk.isEmpty()) {
            sb.append(", PRIMARY KEY (").append(String.join(", ", pk)).append(")");
        }
        return sb.append(")").append(renderWith(table.getProperties())).toString();
    }

    private static String renderSource(SourceMetadata source) {
        return "CREATE SOURCE " + source.getName() + " (" + renderColumns(source.getColumns()) + ")"
                + renderWith(source.getProperties())
                + " ROW FORMAT " + source.getInfo().getRowFormat();
    }

    private static String renderColumns(List<ColumnMetadata> columns) {
        List<String> parts = new ArrayList<>();
        for (ColumnMetadata column : columns) {
            if (!column.isHidden()) {
                parts.add(column.getName() + " " + column.getDataType());
            }
        }
        return String.join(", ", parts);
    }

    private static String renderWith(Map<String, String> properties) {
        if (properties.isEmpty()) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        for (Map.Entry<String, String> entry : properties.entrySet()) {
            parts.add(entry.getKey() + " = '" + entry.getValue() + "'");
        }
        return " WITH (" + String.join(", ", parts) + ")";
    }

    private static String indexKey(IndexMetadata index, TableMetadata primary) {
        List<String> names = new ArrayList<>();
        for (IndexMetadata.IndexItem item : index.getIndexItems()) {
            if (item.getInputRef() < primary.getColumns().size()) {
                names.add(primary.getColumns().get(item.getInputRef()).getName());
            }
        }
        return String.join(", ", names);
    }

    private static String dependencyNames(CatalogSnapshot snapshot, List<Long> ids) {
        List<String> names = new ArrayList<>();
        for (Long id : ids) {
            names.add(snapshot.getRelation(id).map(SchemaScopedObject::getName).orElse(String.valueOf(id)));
        }
        return String.join(", ", names);
    }

    // ========================================
    // Name resolution
    // ========================================

    private DatabaseMetadata resolveDatabase(CatalogSnapshot snapshot, String database) {
        String name = database != null ? database : config.getBootstrap().getDefaultDatabase();
        return snapshot.findDatabase(name).orElseThrow(() -> new ObjectNotFoundException(ObjectKind.DATABASE, name));
    }

    private Set<Long> schemaIds(CatalogSnapshot snapshot, String database, String schema) {
        DatabaseMetadata db = resolveDatabase(snapshot, database);
        Set<Long> ids = new HashSet<>();
        if (schema != null) {
            ids.add(snapshot.findSchema(db.getId(), schema)
                    .orElseThrow(() -> new ObjectNotFoundException(ObjectKind.SCHEMA, schema))
                    .getId());
        } else {
            for (SchemaMetadata s : snapshot.schemas(db.getId())) {
                ids.add(s.getId());
            }
        }
        return ids;
    }

    private SchemaScopedObject resolveRelation(CatalogSnapshot snapshot, String database, String schema, String name) {
        DatabaseMetadata db = resolveDatabase(snapshot, database);
        String schemaName = schema != null ? schema : defaultSchema();
        SchemaMetadata s = snapshot.findSchema(db.getId(), schemaName)
                .orElseThrow(() -> new ObjectNotFoundException(ObjectKind.SCHEMA, schemaName));
        return snapshot.findRelation(s.getId(), name)
                .orElseThrow(() -> new ObjectNotFoundException(ObjectKind.TABLE, schemaName + "." + name));
    }

    private String defaultSchema() {
        List<String> schemas = config.getBootstrap().getDefaultSchemas();
        return schemas.isEmpty() ? "public" : schemas.get(0);
    }

    private static String schemaName(CatalogSnapshot snapshot, SchemaScopedObject object) {
        return snapshot.getSchema(object.getSchemaId()).map(SchemaMetadata::getName).orElse(null);
    }

    private static String qualifiedName(CatalogSnapshot snapshot, SchemaScopedObject object) {
        String schema = schemaName(snapshot, object);
        return schema != null ? schema + "." + object.getName() : object.getName();
    }

    private static List<ColumnMetadata> columnsOf(CatalogSnapshot snapshot, SchemaScopedObject relation) {
        if (relation instanceof IndexMetadata) {
            long indexTableId = ((IndexMetadata) relation).getIndexTableId();
            return snapshot.getTable(indexTableId)
                    .orElseThrow(() -> new ObjectNotFoundException(ObjectKind.TABLE, indexTableId))
                    .getColumns();
        }
        if (relation instanceof TableMetadata) {
            return ((TableMetadata) relation).getColumns();
        }
        if (relation instanceof SourceMetadata) {
            return ((SourceMetadata) relation).getColumns();
        }
        if (relation instanceof SinkMetadata) {
            return ((SinkMetadata) relation).getColumns();
        }
        throw new InvalidDefinitionException("\"" + relation.getName() + "\" has no columns to show");
    }

    private static Map<String, Object> columnRow(String name, String type, boolean hidden) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("Name", name);
        row.put("Type", type);
        row.put("Is Hidden", hidden);
        return row;
    }

    /**
     * Wildcards: {@code *} any characters, {@code ?} a single character. A null pattern
     * matches everything.
     */
    static boolean matchesPattern(String name, String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            return true;
        }
        StringBuilder regex = new StringBuilder();
        for (char c : pattern.toCharArray()) {
            if (c == '*') {
                regex.append(".*");
            } else if (c == '?') {
                regex.append('.');
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return name.matches(regex.toString());
    }
}
