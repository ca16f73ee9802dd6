package com.geico.poc.streamcatalog.catalog;

/**
 * Id spaces. All relation kinds draw from {@link #RELATION} so a dependent-relation id
 * identifies exactly one relation whatever its kind.
 */
public enum IdCategory {
    DATABASE((byte) 0x01),
    SCHEMA((byte) 0x02),
    RELATION((byte) 0x03),
    FUNCTION((byte) 0x04);

    private final byte code;

    IdCategory(byte code) {
        this.code = code;
    }

    public byte getCode() {
        return code;
    }

    public static IdCategory of(ObjectKind kind) {
        switch (kind) {
            case DATABASE:
                return DATABASE;
            case SCHEMA:
                return SCHEMA;
            case FUNCTION:
                return FUNCTION;
            default:
                return RELATION;
        }
    }

    public static IdCategory fromCode(byte code) {
        for (IdCategory category : values()) {
            if (category.code == code) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown id category code: " + code);
    }
}
