package com.geico.poc.streamcatalog.manager;

import com.geico.poc.streamcatalog.catalog.ColumnMetadata;
import com.geico.poc.streamcatalog.catalog.ColumnOrder;
import com.geico.poc.streamcatalog.catalog.TableMetadata;
import com.geico.poc.streamcatalog.catalog.TableVersion;
import com.geico.poc.streamcatalog.error.InvalidDefinitionException;
import com.geico.poc.streamcatalog.error.VersionConflictException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Column identity and table versioning.
 *
 * A column id is assigned once and stays with the column through renames and type changes.
 * {@link TableVersion#getNextColumnId()} only grows, so the id of a dropped column is never
 * reassigned within the table.
 */
public final class SchemaEvolution {

    private SchemaEvolution() {
    }

    /**
     * Assign column ids {@code 0..n-1} to a new table and stamp its initial version.
     *
     * When {@code addRowIdWhenNoPk} is set and the request has no primary key, a hidden
     * {@code _row_id} column is prepended and becomes the primary key.
     */
    public static TableMetadata initializeTable(TableMetadata request, boolean addRowIdWhenNoPk) {
        validateColumnNames(request.getName(), request.getColumns());
        TableMetadata.Builder builder = request.toBuilder();

        List<ColumnMetadata> columns = new ArrayList<>();
        int shift = 0;
        if (addRowIdWhenNoPk && request.getPk().isEmpty()) {
            columns.add(ColumnMetadata.rowId(0));
            shift = 1;
            builder.rowIdIndex(OptionalInt.of(0));
            builder.pk(List.of(ColumnOrder.asc(0)));
            builder.distributionKey(shift(request.getDistributionKey(), shift));
            builder.streamKey(shift(request.getStreamKey(), shift));
            builder.valueIndices(shift(request.getValueIndices(), shift));
            builder.watermarkIndices(shift(request.getWatermarkIndices(), shift));
            if (request.getVnodeColIndex().isPresent()) {
                builder.vnodeColIndex(OptionalInt.of(request.getVnodeColIndex().getAsInt() + shift));
            }
        } else {
            for (ColumnOrder order : request.getPk()) {
                checkIndex(request, order.getColumnIndex(), "primary key");
            }
        }
        for (ColumnMetadata column : request.getColumns()) {
            columns.add(column.withColumnId(columns.size()));
        }
        builder.columns(columns);

        TableMetadata table = builder.build();
        List<Integer> pkIndices = new ArrayList<>();
        for (ColumnOrder order : table.getPk()) {
            pkIndices.add(order.getColumnIndex());
        }
        builder = table.toBuilder();
        if (table.getStreamKey().isEmpty()) {
            builder.streamKey(pkIndices);
        }
        if (table.getDistributionKey().isEmpty()) {
            builder.distributionKey(pkIndices);
        }
        if (table.getValueIndices().isEmpty()) {
            List<Integer> all = new ArrayList<>();
            for (int i = 0; i < columns.size(); i++) {
                all.add(i);
            }
            builder.valueIndices(all);
        }
        return builder.version(TableVersion.initial(columns.size())).build();
    }

    /**
     * Columns of a new non-table relation, with ids {@code 0..n-1}.
     */
    public static List<ColumnMetadata> assignColumnIds(String relationName, List<ColumnMetadata> columns) {
        validateColumnNames(relationName, columns);
        List<ColumnMetadata> result = new ArrayList<>(columns.size());
        for (ColumnMetadata column : columns) {
            result.add(column.withColumnId(result.size()));
        }
        return result;
    }

    /**
     * Start an ALTER computed against {@code expectedVersion}.
     *
     * @throws VersionConflictException if the table has moved past that version
     */
    public static AlterSession beginAlter(TableMetadata table, long expectedVersion) {
        TableVersion current = table.getVersion().orElseThrow(() ->
                new InvalidDefinitionException("Relation \"" + table.getName() + "\" is not versioned and cannot be altered"));
        if (current.getVersion() != expectedVersion) {
            throw new VersionConflictException(table.getId(), expectedVersion, current.getVersion());
        }
        return new AlterSession(table, current);
    }

    /**
     * Same table at the next version with no column change, used by renames.
     */
    public static TableMetadata bumpVersion(TableMetadata table) {
        if (!table.getVersion().isPresent()) {
            return table;
        }
        TableVersion current = table.getVersion().get();
        return table.toBuilder()
                .version(new TableVersion(current.getVersion() + 1, current.getNextColumnId()))
                .build();
    }

    private static void validateColumnNames(String relationName, List<ColumnMetadata> columns) {
        Set<String> seen = new HashSet<>();
        for (ColumnMetadata column : columns) {
            if (column.getName() == null || column.getName().isEmpty()) {
                throw new InvalidDefinitionException("Column name must not be empty in \"" + relationName + "\"");
            }
            if (ColumnMetadata.ROW_ID_COLUMN_NAME.equalsIgnoreCase(column.getName()) && !column.isHidden()) {
                throw new InvalidDefinitionException("Column name " + ColumnMetadata.ROW_ID_COLUMN_NAME + " is reserved");
            }
            if (!seen.add(column.getName().toLowerCase(Locale.ROOT))) {
                throw new InvalidDefinitionException("Column \"" + column.getName() + "\" specified more than once in \""
                        + relationName + "\"");
            }
        }
    }

    private static void checkIndex(TableMetadata table, int index, String what) {
        if (index < 0 || index >= table.getColumns().size()) {
            throw new InvalidDefinitionException("Invalid " + what + " column index " + index
                    + " for \"" + table.getName() + "\" with " + table.getColumns().size() + " columns");
        }
    }

    private static List<Integer> shift(List<Integer> indices, int by) {
        List<Integer> result = new ArrayList<>(indices.size());
        for (Integer i : indices) {
            result.add(i + by);
        }
        return result;
    }

    /**
     * Working copy of one table during an ALTER. The target version is always the current
     * version plus one, however many changes the session applies.
     */
    public static class AlterSession {
        private final TableMetadata original;
        private final TableVersion targetVersion;
        private final List<ColumnMetadata> columns;
        private List<ColumnOrder> pk;
        private List<Integer> distributionKey;
        private List<Integer> streamKey;
        private List<Integer> valueIndices;
        private List<Integer> watermarkIndices;
        private OptionalInt rowIdIndex;
        private OptionalInt vnodeColIndex;
        private int nextColumnId;

        private AlterSession(TableMetadata table, TableVersion current) {
            this.original = table;
            this.targetVersion = new TableVersion(current.getVersion() + 1, current.getNextColumnId());
            this.columns = new ArrayList<>(table.getColumns());
            this.pk = new ArrayList<>(table.getPk());
            this.distributionKey = new ArrayList<>(table.getDistributionKey());
            this.streamKey = new ArrayList<>(table.getStreamKey());
            this.valueIndices = new ArrayList<>(table.getValueIndices());
            this.watermarkIndices = new ArrayList<>(table.getWatermarkIndices());
            this.rowIdIndex = table.getRowIdIndex();
            this.vnodeColIndex = table.getVnodeColIndex();
            this.nextColumnId = current.getNextColumnId();
        }

        public TableVersion getTargetVersion() {
            return targetVersion;
        }

        /**
         * Hand out the next column id of this table.
         */
        public int allocateColumn() {
            return nextColumnId++;
        }

        public AlterSession apply(ColumnChange change) {
            switch (change.getType()) {
                case ADD:
                    return addColumn(change.getColumnName(), change.getDataType());
                case DROP:
                    return dropColumn(change.getColumnName());
                case RENAME:
                    return renameColumn(change.getColumnName(), change.getNewName());
                case ALTER_TYPE:
                    return alterColumnType(change.getColumnName(), change.getDataType());
                default:
                    throw new InvalidDefinitionException("Unsupported column change: " + change.getType());
            }
        }

        public AlterSession addColumn(String name, String dataType) {
            if (name == null || name.isEmpty()) {
                throw new InvalidDefinitionException("Column name must not be empty");
            }
            if (ColumnMetadata.ROW_ID_COLUMN_NAME.equalsIgnoreCase(name)) {
                throw new InvalidDefinitionException("Column name " + ColumnMetadata.ROW_ID_COLUMN_NAME + " is reserved");
            }
            if (indexOf(name) >= 0) {
                throw new InvalidDefinitionException("Column \"" + name + "\" of relation \""
                        + original.getName() + "\" already exists");
            }
            columns.add(new ColumnMetadata(allocateColumn(), name, dataType, false));
            if (!valueIndices.isEmpty()) {
                valueIndices.add(columns.size() - 1);
            }
            return this;
        }

        public AlterSession dropColumn(String name) {
            int index = requireVisibleColumn(name);
            for (ColumnOrder order : pk) {
                if (order.getColumnIndex() == index) {
                    throw new InvalidDefinitionException("Cannot drop primary key column \"" + name + "\"");
                }
            }
            if (distributionKey.contains(index)) {
                throw new InvalidDefinitionException("Cannot drop distribution key column \"" + name + "\"");
            }
            if (vnodeColIndex.isPresent() && vnodeColIndex.getAsInt() == index) {
                throw new InvalidDefinitionException("Cannot drop vnode column \"" + name + "\"");
            }
            columns.remove(index);

            List<ColumnOrder> newPk = new ArrayList<>();
            for (ColumnOrder order : pk) {
                int i = order.getColumnIndex();
                newPk.add(new ColumnOrder(i > index ? i - 1 : i, order.getDirection()));
            }
            pk = newPk;
            distributionKey = removeAndShift(distributionKey, index);
            streamKey = removeAndShift(streamKey, index);
            valueIndices = removeAndShift(valueIndices, index);
            watermarkIndices = removeAndShift(watermarkIndices, index);
            rowIdIndex = shiftOptional(rowIdIndex, index);
            vnodeColIndex = shiftOptional(vnodeColIndex, index);
            return this;
        }

        public AlterSession renameColumn(String name, String newName) {
            int index = requireVisibleColumn(name);
            if (newName == null || newName.isEmpty()) {
                throw new InvalidDefinitionException("Column name must not be empty");
            }
            int existing = indexOf(newName);
            if (existing >= 0 && existing != index) {
                throw new InvalidDefinitionException("Column \"" + newName + "\" of relation \""
                        + original.getName() + "\" already exists");
            }
            columns.set(index, columns.get(index).withName(newName));
            return this;
        }

        public AlterSession alterColumnType(String name, String dataType) {
            int index = requireVisibleColumn(name);
            if (dataType == null || dataType.isEmpty()) {
                throw new InvalidDefinitionException("Data type must not be empty");
            }
            columns.set(index, columns.get(index).withDataType(dataType));
            return this;
        }

        /**
         * The altered table at the target version.
         */
        public TableMetadata finish() {
            return original.toBuilder()
                    .columns(columns)
                    .pk(pk)
                    .distributionKey(distributionKey)
                    .streamKey(streamKey)
                    .valueIndices(valueIndices)
                    .watermarkIndices(watermarkIndices)
                    .rowIdIndex(rowIdIndex)
                    .vnodeColIndex(vnodeColIndex)
                    .version(new TableVersion(targetVersion.getVersion(), nextColumnId))
                    .build();
        }

        private int indexOf(String name) {
            for (int i = 0; i < columns.size(); i++) {
                if (columns.get(i).getName().equalsIgnoreCase(name)) {
                    return i;
                }
            }
            return -1;
        }

        private int requireVisibleColumn(String name) {
            int index = indexOf(name);
            if (index < 0) {
                throw new InvalidDefinitionException("Column \"" + name + "\" of relation \""
                        + original.getName() + "\" does not exist");
            }
            if (columns.get(index).isHidden()) {
                throw new InvalidDefinitionException("Cannot alter hidden column \"" + name + "\"");
            }
            return index;
        }

        private static List<Integer> removeAndShift(List<Integer> indices, int removed) {
            List<Integer> result = new ArrayList<>(indices.size());
            for (Integer i : indices) {
                if (i == removed) {
                    continue;
                }
                result.add(i > removed ? i - 1 : i);
            }
            return result;
        }

        private static OptionalInt shiftOptional(OptionalInt index, int removed) {
            if (index.isPresent() && index.getAsInt() > removed) {
                return OptionalInt.of(index.getAsInt() - 1);
            }
            return index;
        }
    }
}
