package com.geico.poc.streamcatalog.manager;

import com.geico.poc.streamcatalog.catalog.ColumnMetadata;
import com.geico.poc.streamcatalog.catalog.ColumnOrder;
import com.geico.poc.streamcatalog.catalog.ObjectKind;
import com.geico.poc.streamcatalog.catalog.SourceMetadata;
import com.geico.poc.streamcatalog.catalog.StreamSourceInfo;
import com.geico.poc.streamcatalog.catalog.TableMetadata;
import com.geico.poc.streamcatalog.error.CatalogInconsistentException;
import com.geico.poc.streamcatalog.error.InvalidDefinitionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Lifecycle of a connector-backed table and its associated source.
 *
 * The pair is always staged into one transaction: both are created together, both are
 * dropped together, and a column change to the table rewrites the source's columns.
 * The source takes the table's name, schema and columns.
 */
public final class SourceTableCoupling {

    public static final String FORMAT_PROPERTY = "format";

    private SourceTableCoupling() {
    }

    /**
     * Whether a table request carries connector properties and therefore needs a source.
     */
    public static boolean requiresSource(TableMetadata request) {
        return request.getProperties().containsKey(SourceMetadata.CONNECTOR_PROPERTY);
    }

    /**
     * Source description mirroring a table with assigned column ids.
     */
    public static SourceMetadata deriveSource(TableMetadata table) {
        return new SourceMetadata(
                0,
                table.getSchemaId(),
                table.getDatabaseId(),
                table.getName(),
                table.getRowIdIndex(),
                table.getColumns(),
                pkColumnIds(table),
                table.getProperties(),
                table.getOwner(),
                StreamSourceInfo.of(rowFormat(table.getProperties())),
                Collections.emptyList());
    }

    /**
     * Allocate ids for both halves and stage them. The table must already have its column
     * ids assigned.
     *
     * @param sourceSpec explicit source description, or null to derive one from the table
     * @return the table as it will be committed
     */
    public static TableMetadata createTableWithSource(CatalogTransaction txn, TableMetadata table,
                                                      SourceMetadata sourceSpec) {
        SourceMetadata source = sourceSpec != null ? adaptSpec(sourceSpec, table) : deriveSource(table);
        if (source.connector() == null) {
            throw new InvalidDefinitionException("Table \"" + table.getName()
                    + "\" with a source requires a " + SourceMetadata.CONNECTOR_PROPERTY + " property");
        }
        long tableId = txn.nextId(ObjectKind.TABLE);
        long sourceId = txn.nextId(ObjectKind.SOURCE);

        TableMetadata coupled = table.toBuilder()
                .id(tableId)
                .associatedSourceId(sourceId)
                .build();
        txn.create(source.withId(sourceId));
        txn.create(coupled);
        return coupled;
    }

    /**
     * Stage the drop of a table and, if coupled, its source.
     *
     * @throws CatalogInconsistentException if the table points at a source that does not exist
     */
    public static void dropTableWithSource(CatalogTransaction txn, TableMetadata table) {
        txn.drop(table);
        if (table.hasAssociatedSource()) {
            txn.drop(requireAssociatedSource(txn.base(), table));
        }
    }

    /**
     * Stage the source rewrite that keeps a coupled source in step with its altered table.
     */
    public static void syncSource(CatalogTransaction txn, TableMetadata altered) {
        if (!altered.hasAssociatedSource()) {
            return;
        }
        SourceMetadata source = requireAssociatedSource(txn.base(), altered);
        SourceMetadata synced = new SourceMetadata(
                source.getId(),
                source.getSchemaId(),
                source.getDatabaseId(),
                altered.getName(),
                altered.getRowIdIndex(),
                altered.getColumns(),
                pkColumnIds(altered),
                source.getProperties(),
                source.getOwner(),
                source.getInfo(),
                source.getWatermarkDescs());
        txn.alter(synced);
    }

    public static SourceMetadata requireAssociatedSource(CatalogSnapshot snapshot, TableMetadata table) {
        long sourceId = table.getAssociatedSourceId().getAsLong();
        return snapshot.getSource(sourceId).orElseThrow(() -> new CatalogInconsistentException(
                "Table " + table.getId() + " (\"" + table.getName() + "\") references associated source "
                        + sourceId + " which does not exist"));
    }

    // Explicit source specs keep their format and watermarks but take the table's shape
    private static SourceMetadata adaptSpec(SourceMetadata spec, TableMetadata table) {
        Map<String, String> properties = new LinkedHashMap<>(table.getProperties());
        properties.putAll(spec.getProperties());
        return new SourceMetadata(
                0,
                table.getSchemaId(),
                table.getDatabaseId(),
                table.getName(),
                table.getRowIdIndex(),
                table.getColumns(),
                pkColumnIds(table),
                properties,
                table.getOwner(),
                spec.getInfo(),
                spec.getWatermarkDescs());
    }

    private static List<Integer> pkColumnIds(TableMetadata table) {
        List<Integer> ids = new ArrayList<>();
        for (ColumnOrder order : table.getPk()) {
            ColumnMetadata column = table.getColumns().get(order.getColumnIndex());
            ids.add(column.getColumnId());
        }
        return ids;
    }

    private static StreamSourceInfo.RowFormatType rowFormat(Map<String, String> properties) {
        String format = properties.get(FORMAT_PROPERTY);
        if (format == null) {
            return StreamSourceInfo.RowFormatType.ROW_UNSPECIFIED;
        }
        try {
            return StreamSourceInfo.RowFormatType.valueOf(format.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidDefinitionException("Unknown row format \"" + format + "\"", e);
        }
    }
}
