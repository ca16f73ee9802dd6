package com.geico.poc.streamcatalog.manager;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One step of an ALTER TABLE. Changes of a single request are applied in order.
 */
public class ColumnChange {

    public enum Type {
        ADD,
        DROP,
        RENAME,
        ALTER_TYPE
    }

    private final Type type;
    private final String columnName;
    private final String newName;
    private final String dataType;

    @JsonCreator
    public ColumnChange(
            @JsonProperty("type") Type type,
            @JsonProperty("columnName") String columnName,
            @JsonProperty("newName") String newName,
            @JsonProperty("dataType") String dataType) {
        this.type = type;
        this.columnName = columnName;
        this.newName = newName;
        this.dataType = dataType;
    }

    public static ColumnChange add(String columnName, String dataType) {
        return new ColumnChange(Type.ADD, columnName, null, dataType);
    }

    public static ColumnChange drop(String columnName) {
        return new ColumnChange(Type.DROP, columnName, null, null);
    }

    public static ColumnChange rename(String columnName, String newName) {
        return new ColumnChange(Type.RENAME, columnName, newName, null);
    }

    public static ColumnChange alterType(String columnName, String dataType) {
        return new ColumnChange(Type.ALTER_TYPE, columnName, null, dataType);
    }

    public Type getType() {
        return type;
    }

    public String getColumnName() {
        return columnName;
    }

    public String getNewName() {
        return newName;
    }

    public String getDataType() {
        return dataType;
    }

    /**
     * Whether the change can break objects that read the table.
     */
    public boolean isDestructive() {
        return type != Type.ADD;
    }

    @Override
    public String toString() {
        switch (type) {
            case ADD:
                return "ADD COLUMN " + columnName + " " + dataType;
            case DROP:
                return "DROP COLUMN " + columnName;
            case RENAME:
                return "RENAME COLUMN " + columnName + " TO " + newName;
            default:
                return "ALTER COLUMN " + columnName + " TYPE " + dataType;
        }
    }
}
