package com.geico.poc.streamcatalog.store;

import com.geico.poc.streamcatalog.catalog.CatalogObject;
import com.geico.poc.streamcatalog.catalog.ColumnMetadata;
import com.geico.poc.streamcatalog.catalog.ColumnOrder;
import com.geico.poc.streamcatalog.catalog.ObjectKind;
import com.geico.poc.streamcatalog.catalog.TableMetadata;
import com.geico.poc.streamcatalog.catalog.TableVersion;
import com.geico.poc.streamcatalog.error.CatalogInconsistentException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

public class CatalogCodecTest {

    private static TableMetadata connectorTable() {
        return TableMetadata.builder()
                .id(42)
                .schemaId(2)
                .databaseId(1)
                .name("clicks")
                .columns(Arrays.asList(
                        new ColumnMetadata(0, "user_id", "bigint", false),
                        new ColumnMetadata(1, "url", "varchar", false),
                        ColumnMetadata.rowId(2)))
                .pk(Collections.singletonList(ColumnOrder.asc(2)))
                .associatedSourceId(43)
                .rowIdIndex(OptionalInt.of(2))
                .property("connector", "kafka")
                .owner(1)
                .definition("CREATE TABLE clicks (user_id bigint, url varchar) WITH (connector = 'kafka')")
                .version(TableVersion.initial(3))
                .build();
    }

    @Test
    public void testTableDecodesThroughKindDiscriminator() {
        TableMetadata table = connectorTable();
        byte[] encoded = CatalogCodec.encodeObject(table);

        assertTrue(new String(encoded, StandardCharsets.UTF_8).contains("\"kind\":\"TABLE\""));

        CatalogObject decoded = CatalogCodec.decodeObject(encoded);
        assertEquals(ObjectKind.TABLE, decoded.kind());
        assertEquals(table, decoded);

        TableMetadata decodedTable = (TableMetadata) decoded;
        assertEquals(43L, decodedTable.getAssociatedSourceId().getAsLong());
        assertEquals(2, decodedTable.getRowIdIndex().getAsInt());
        assertEquals(3, decodedTable.getVersion().get().getNextColumnId());
        assertTrue(decodedTable.getColumns().get(2).isHidden());
    }

    @Test
    public void testEmptyOptionalsStayEmpty() {
        TableMetadata table = connectorTable().toBuilder()
                .noAssociatedSource()
                .rowIdIndex(OptionalInt.empty())
                .build();

        TableMetadata decoded = (TableMetadata) CatalogCodec.decodeObject(CatalogCodec.encodeObject(table));

        assertFalse(decoded.getAssociatedSourceId().isPresent());
        assertFalse(decoded.getRowIdIndex().isPresent());
    }

    @Test
    public void testUnknownPropertiesAreTolerated() {
        String json = "{\"kind\":\"DATABASE\",\"id\":7,\"name\":\"dev\",\"owner\":1,\"comment\":\"added later\"}";

        CatalogObject decoded = CatalogCodec.decodeObject(json.getBytes(StandardCharsets.UTF_8));

        assertEquals(ObjectKind.DATABASE, decoded.kind());
        assertEquals("dev", decoded.getName());
    }

    @Test
    public void testCorruptValuesAreInconsistencies() {
        assertThrows(CatalogInconsistentException.class,
                () -> CatalogCodec.decodeObject("{not json".getBytes(StandardCharsets.UTF_8)));
        assertThrows(CatalogInconsistentException.class,
                () -> CatalogCodec.decodeObject("{\"kind\":\"UNKNOWN\",\"id\":1}".getBytes(StandardCharsets.UTF_8)));
        assertThrows(CatalogInconsistentException.class, () -> CatalogCodec.decodeLong(new byte[3]));
        assertEquals(Long.MAX_VALUE, CatalogCodec.decodeLong(CatalogCodec.encodeLong(Long.MAX_VALUE)));
    }
}
