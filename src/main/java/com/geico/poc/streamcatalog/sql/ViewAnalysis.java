package com.geico.poc.streamcatalog.sql;

import com.geico.poc.streamcatalog.catalog.ViewMetadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What the catalog needs to know about a view query: the relations it reads and the columns
 * it produces.
 */
public class ViewAnalysis {

    private final List<Long> dependentRelations;
    private final List<ViewMetadata.Field> columns;

    public ViewAnalysis(List<Long> dependentRelations, List<ViewMetadata.Field> columns) {
        this.dependentRelations = Collections.unmodifiableList(new ArrayList<>(dependentRelations));
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    }

    /**
     * Ids of the relations the query reads, in order of first appearance.
     */
    public List<Long> getDependentRelations() {
        return dependentRelations;
    }

    public List<ViewMetadata.Field> getColumns() {
        return columns;
    }

    public int arity() {
        return columns.size();
    }

    @Override
    public String toString() {
        return "ViewAnalysis{dependentRelations=" + dependentRelations + ", columns=" + columns + '}';
    }
}
