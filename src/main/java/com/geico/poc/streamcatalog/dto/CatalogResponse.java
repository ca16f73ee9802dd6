package com.geico.poc.streamcatalog.dto;

import java.util.List;
import java.util.Map;

public class CatalogResponse {
    private List<Map<String, Object>> rows;
    private int rowCount;
    private String error;
    private String errorKind;
    private List<String> columns;
    private long catalogVersion;

    public CatalogResponse() {
    }

    public CatalogResponse(List<Map<String, Object>> rows, List<String> columns, long catalogVersion) {
        this.rows = rows;
        this.columns = columns;
        this.rowCount = rows != null ? rows.size() : 0;
        this.catalogVersion = catalogVersion;
    }

    public static CatalogResponse error(String message) {
        return error(null, message);
    }

    public static CatalogResponse error(String errorKind, String message) {
        CatalogResponse response = new CatalogResponse();
        response.error = message;
        response.errorKind = errorKind;
        response.rowCount = 0;
        return response;
    }

    // Getters and setters
    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public void setRows(List<Map<String, Object>> rows) {
        this.rows = rows;
        this.rowCount = rows != null ? rows.size() : 0;
    }

    public int getRowCount() {
        return rowCount;
    }

    public void setRowCount(int rowCount) {
        this.rowCount = rowCount;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public String getErrorKind() {
        return errorKind;
    }

    public void setErrorKind(String errorKind) {
        this.errorKind = errorKind;
    }

    public List<String> getColumns() {
        return columns;
    }

    public void setColumns(List<String> columns) {
        this.columns = columns;
    }

    public long getCatalogVersion() {
        return catalogVersion;
    }

    public void setCatalogVersion(long catalogVersion) {
        this.catalogVersion = catalogVersion;
    }
}
