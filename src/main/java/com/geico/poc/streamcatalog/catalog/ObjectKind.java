package com.geico.poc.streamcatalog.catalog;

/**
 * Kinds of catalog objects.
 *
 * The code is persisted as part of every catalog key, so existing codes must never change.
 */
public enum ObjectKind {
    DATABASE((byte) 0x01, false),
    SCHEMA((byte) 0x02, false),
    TABLE((byte) 0x03, true),
    SOURCE((byte) 0x04, true),
    SINK((byte) 0x05, true),
    INDEX((byte) 0x06, true),
    VIEW((byte) 0x07, true),
    FUNCTION((byte) 0x08, false);

    private final byte code;
    private final boolean relation;

    ObjectKind(byte code, boolean relation) {
        this.code = code;
        this.relation = relation;
    }

    public byte getCode() {
        return code;
    }

    /**
     * Relations share one id space and one name space per schema.
     */
    public boolean isRelation() {
        return relation;
    }

    public static ObjectKind fromCode(byte code) {
        for (ObjectKind kind : values()) {
            if (kind.code == code) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown object kind code: " + code);
    }
}
