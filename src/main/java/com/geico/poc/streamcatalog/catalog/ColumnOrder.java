package com.geico.poc.streamcatalog.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One entry of a primary key: a column position plus its sort direction.
 */
public class ColumnOrder {

    public enum Direction { ASC, DESC }

    private final int columnIndex;
    private final Direction direction;

    @JsonCreator
    public ColumnOrder(
            @JsonProperty("columnIndex") int columnIndex,
            @JsonProperty("direction") Direction direction) {
        this.columnIndex = columnIndex;
        this.direction = direction != null ? direction : Direction.ASC;
    }

    public static ColumnOrder asc(int columnIndex) {
        return new ColumnOrder(columnIndex, Direction.ASC);
    }

    public int getColumnIndex() {
        return columnIndex;
    }

    public Direction getDirection() {
        return direction;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ColumnOrder that = (ColumnOrder) o;
        return columnIndex == that.columnIndex && direction == that.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(columnIndex, direction);
    }

    @Override
    public String toString() {
        return "$" + columnIndex + " " + direction;
    }
}
