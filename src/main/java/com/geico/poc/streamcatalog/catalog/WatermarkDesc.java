package com.geico.poc.streamcatalog.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Watermark declared on a source column. The expression is kept as SQL text; evaluating it
 * belongs to the stream engine.
 */
public class WatermarkDesc {

    private final int watermarkIdx;
    private final String expr;

    @JsonCreator
    public WatermarkDesc(
            @JsonProperty("watermarkIdx") int watermarkIdx,
            @JsonProperty("expr") String expr) {
        this.watermarkIdx = watermarkIdx;
        this.expr = expr;
    }

    public int getWatermarkIdx() {
        return watermarkIdx;
    }

    public String getExpr() {
        return expr;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WatermarkDesc that = (WatermarkDesc) o;
        return watermarkIdx == that.watermarkIdx && Objects.equals(expr, that.expr);
    }

    @Override
    public int hashCode() {
        return Objects.hash(watermarkIdx, expr);
    }
}
