package com.geico.poc.streamcatalog.store;

import com.geico.poc.streamcatalog.catalog.IdCategory;
import com.geico.poc.streamcatalog.catalog.ObjectKind;

import java.nio.ByteBuffer;

/**
 * Encodes and decodes catalog store keys.
 *
 * Object key:       [Namespace:1 = 0x03][Kind:1][Id:8]
 * Id watermark key: [Namespace:1 = 0x05][Category:1]
 * Catalog version:  [Namespace:1 = 0x06]
 *
 * Ids are big-endian so keys of one kind sort by id.
 */
public final class CatalogKeys {

    public static final byte NAMESPACE_OBJECT = 0x03;
    public static final byte NAMESPACE_ID_WATERMARK = 0x05;
    public static final byte NAMESPACE_CATALOG_VERSION = 0x06;

    private static final int OBJECT_KEY_LENGTH = 1 + 1 + 8;
    private static final int WATERMARK_KEY_LENGTH = 1 + 1;

    private CatalogKeys() {
    }

    public static byte[] encodeObjectKey(ObjectKind kind, long id) {
        return ByteBuffer.allocate(OBJECT_KEY_LENGTH)
                .put(NAMESPACE_OBJECT)
                .put(kind.getCode())
                .putLong(id)
                .array();
    }

    public static byte[] encodeIdWatermarkKey(IdCategory category) {
        return new byte[] {NAMESPACE_ID_WATERMARK, category.getCode()};
    }

    public static byte[] encodeCatalogVersionKey() {
        return new byte[] {NAMESPACE_CATALOG_VERSION};
    }

    public static boolean isCatalogVersionKey(byte[] key) {
        return key.length == 1 && key[0] == NAMESPACE_CATALOG_VERSION;
    }

    public static boolean isObjectKey(byte[] key) {
        return key.length == OBJECT_KEY_LENGTH && key[0] == NAMESPACE_OBJECT;
    }

    public static boolean isIdWatermarkKey(byte[] key) {
        return key.length == WATERMARK_KEY_LENGTH && key[0] == NAMESPACE_ID_WATERMARK;
    }

    public static ObjectKind decodeKind(byte[] objectKey) {
        requireObjectKey(objectKey);
        return ObjectKind.fromCode(objectKey[1]);
    }

    public static long decodeId(byte[] objectKey) {
        requireObjectKey(objectKey);
        return ByteBuffer.wrap(objectKey, 2, 8).getLong();
    }

    public static IdCategory decodeCategory(byte[] watermarkKey) {
        if (!isIdWatermarkKey(watermarkKey)) {
            throw new IllegalArgumentException("Not an id watermark key");
        }
        return IdCategory.fromCode(watermarkKey[1]);
    }

    private static void requireObjectKey(byte[] key) {
        if (!isObjectKey(key)) {
            throw new IllegalArgumentException("Not a catalog object key");
        }
    }
}
