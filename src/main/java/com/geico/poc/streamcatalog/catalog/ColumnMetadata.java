package com.geico.poc.streamcatalog.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Column descriptor. The column id is stable for the lifetime of the owning table:
 * renames and type changes keep it, and a dropped column's id is never handed out again.
 */
public class ColumnMetadata {

    /** Id carried by request descriptions before the catalog assigns a real one. */
    public static final int PLACEHOLDER_ID = -1;

    public static final String ROW_ID_COLUMN_NAME = "_row_id";
    public static final String ROW_ID_DATA_TYPE = "serial";

    private final int columnId;
    private final String name;
    private final String dataType;
    private final boolean hidden;

    @JsonCreator
    public ColumnMetadata(
            @JsonProperty("columnId") int columnId,
            @JsonProperty("name") String name,
            @JsonProperty("dataType") String dataType,
            @JsonProperty("hidden") boolean hidden) {
        this.columnId = columnId;
        this.name = name;
        this.dataType = dataType;
        this.hidden = hidden;
    }

    /**
     * Visible column without an assigned id.
     */
    public static ColumnMetadata of(String name, String dataType) {
        return new ColumnMetadata(PLACEHOLDER_ID, name, dataType, false);
    }

    public static ColumnMetadata rowId(int columnId) {
        return new ColumnMetadata(columnId, ROW_ID_COLUMN_NAME, ROW_ID_DATA_TYPE, true);
    }

    public int getColumnId() {
        return columnId;
    }

    public String getName() {
        return name;
    }

    public String getDataType() {
        return dataType;
    }

    public boolean isHidden() {
        return hidden;
    }

    public ColumnMetadata withColumnId(int newColumnId) {
        return new ColumnMetadata(newColumnId, name, dataType, hidden);
    }

    public ColumnMetadata withName(String newName) {
        return new ColumnMetadata(columnId, newName, dataType, hidden);
    }

    public ColumnMetadata withDataType(String newDataType) {
        return new ColumnMetadata(columnId, name, newDataType, hidden);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ColumnMetadata that = (ColumnMetadata) o;
        return columnId == that.columnId && hidden == that.hidden
                && Objects.equals(name, that.name) && Objects.equals(dataType, that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columnId, name, dataType, hidden);
    }

    @Override
    public String toString() {
        return name + " " + dataType + "#" + columnId + (hidden ? " (hidden)" : "");
    }
}
