package com.geico.poc.streamcatalog.store;

import com.geico.poc.streamcatalog.catalog.IdCategory;
import com.geico.poc.streamcatalog.catalog.ObjectKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CatalogKeysTest {

    // ==================== Object keys ====================

    @Test
    public void testObjectKeyLayout() {
        byte[] key = CatalogKeys.encodeObjectKey(ObjectKind.SOURCE, 0x0102L);

        assertEquals(10, key.length);
        assertEquals(CatalogKeys.NAMESPACE_OBJECT, key[0]);
        assertEquals(ObjectKind.SOURCE.getCode(), key[1]);
        assertEquals(0x01, key[8]);
        assertEquals(0x02, key[9]);

        assertTrue(CatalogKeys.isObjectKey(key));
        assertEquals(ObjectKind.SOURCE, CatalogKeys.decodeKind(key));
        assertEquals(0x0102L, CatalogKeys.decodeId(key));
    }

    @Test
    public void testObjectKeysOfOneKindSortById() {
        List<byte[]> keys = new ArrayList<>();
        for (long id : new long[] {300, 2, 70000, 1}) {
            keys.add(CatalogKeys.encodeObjectKey(ObjectKind.TABLE, id));
        }
        keys.sort(Arrays::compareUnsigned);

        List<Long> ids = new ArrayList<>();
        for (byte[] key : keys) {
            ids.add(CatalogKeys.decodeId(key));
        }
        assertEquals(Arrays.asList(1L, 2L, 300L, 70000L), ids);
    }

    // ==================== Namespaces ====================

    @Test
    public void testNamespacesDoNotOverlap() {
        byte[] object = CatalogKeys.encodeObjectKey(ObjectKind.DATABASE, 1);
        byte[] watermark = CatalogKeys.encodeIdWatermarkKey(IdCategory.RELATION);
        byte[] version = CatalogKeys.encodeCatalogVersionKey();

        assertTrue(CatalogKeys.isObjectKey(object));
        assertFalse(CatalogKeys.isIdWatermarkKey(object));
        assertFalse(CatalogKeys.isCatalogVersionKey(object));

        assertTrue(CatalogKeys.isIdWatermarkKey(watermark));
        assertFalse(CatalogKeys.isObjectKey(watermark));
        assertEquals(IdCategory.RELATION, CatalogKeys.decodeCategory(watermark));

        assertTrue(CatalogKeys.isCatalogVersionKey(version));
        assertFalse(CatalogKeys.isIdWatermarkKey(version));
    }

    @Test
    public void testDecodeRejectsForeignKeys() {
        byte[] watermark = CatalogKeys.encodeIdWatermarkKey(IdCategory.SCHEMA);

        assertThrows(IllegalArgumentException.class, () -> CatalogKeys.decodeId(watermark));
        assertThrows(IllegalArgumentException.class,
                () -> CatalogKeys.decodeCategory(CatalogKeys.encodeCatalogVersionKey()));
        assertThrows(IllegalArgumentException.class,
                () -> CatalogKeys.decodeKind(new byte[] {CatalogKeys.NAMESPACE_OBJECT, 0x7f, 0, 0, 0, 0, 0, 0, 0, 1}));
    }
}
