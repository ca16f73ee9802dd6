package com.geico.poc.streamcatalog.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Row format descriptor of an ingestion source.
 */
public class StreamSourceInfo {

    public enum RowFormatType {
        ROW_UNSPECIFIED,
        JSON,
        PROTOBUF,
        DEBEZIUM_JSON,
        AVRO,
        MAXWELL,
        CANAL_JSON,
        CSV,
        NATIVE,
        DEBEZIUM_AVRO,
        UPSERT_JSON,
        UPSERT_AVRO
    }

    public static final int DEFAULT_CSV_DELIMITER = ',';

    private final RowFormatType rowFormat;
    private final String rowSchemaLocation;
    private final boolean useSchemaRegistry;
    private final String protoMessageName;
    private final int csvDelimiter;
    private final boolean csvHasHeader;

    @JsonCreator
    public StreamSourceInfo(
            @JsonProperty("rowFormat") RowFormatType rowFormat,
            @JsonProperty("rowSchemaLocation") String rowSchemaLocation,
            @JsonProperty("useSchemaRegistry") boolean useSchemaRegistry,
            @JsonProperty("protoMessageName") String protoMessageName,
            @JsonProperty("csvDelimiter") int csvDelimiter,
            @JsonProperty("csvHasHeader") boolean csvHasHeader) {
        this.rowFormat = rowFormat != null ? rowFormat : RowFormatType.ROW_UNSPECIFIED;
        this.rowSchemaLocation = rowSchemaLocation != null ? rowSchemaLocation : "";
        this.useSchemaRegistry = useSchemaRegistry;
        this.protoMessageName = protoMessageName != null ? protoMessageName : "";
        this.csvDelimiter = csvDelimiter;
        this.csvHasHeader = csvHasHeader;
    }

    public static StreamSourceInfo of(RowFormatType rowFormat) {
        return new StreamSourceInfo(rowFormat, "", false, "", DEFAULT_CSV_DELIMITER, false);
    }

    public RowFormatType getRowFormat() {
        return rowFormat;
    }

    public String getRowSchemaLocation() {
        return rowSchemaLocation;
    }

    public boolean isUseSchemaRegistry() {
        return useSchemaRegistry;
    }

    public String getProtoMessageName() {
        return protoMessageName;
    }

    public int getCsvDelimiter() {
        return csvDelimiter;
    }

    public boolean isCsvHasHeader() {
        return csvHasHeader;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StreamSourceInfo that = (StreamSourceInfo) o;
        return useSchemaRegistry == that.useSchemaRegistry
                && csvDelimiter == that.csvDelimiter
                && csvHasHeader == that.csvHasHeader
                && rowFormat == that.rowFormat
                && Objects.equals(rowSchemaLocation, that.rowSchemaLocation)
                && Objects.equals(protoMessageName, that.protoMessageName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rowFormat, rowSchemaLocation, useSchemaRegistry, protoMessageName,
                csvDelimiter, csvHasHeader);
    }
}
