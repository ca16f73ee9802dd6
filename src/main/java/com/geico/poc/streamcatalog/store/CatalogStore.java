package com.geico.poc.streamcatalog.store;

import java.util.Arrays;
import java.util.List;

/**
 * Durable key-value backing for catalog objects.
 *
 * Implementations must apply all writes of one {@link #commit(List)} call atomically: either
 * every key is updated or none is. Retries and timeouts are the implementation's business;
 * a commit that ultimately fails throws
 * {@link com.geico.poc.streamcatalog.error.StoreUnavailableException}.
 */
public interface CatalogStore {

    void commit(List<Write> writes);

    /**
     * Every live key and its value, for recovery at startup.
     */
    List<Entry> loadAll();

    /**
     * A put, or a delete when the value is null.
     */
    class Write {
        private final byte[] key;
        private final byte[] value;

        private Write(byte[] key, byte[] value) {
            this.key = key;
            this.value = value;
        }

        public static Write put(byte[] key, byte[] value) {
            if (value == null) {
                throw new IllegalArgumentException("put requires a value");
            }
            return new Write(key, value);
        }

        public static Write delete(byte[] key) {
            return new Write(key, null);
        }

        public byte[] getKey() {
            return key;
        }

        public byte[] getValue() {
            return value;
        }

        public boolean isDelete() {
            return value == null;
        }

        @Override
        public String toString() {
            return (isDelete() ? "DELETE " : "PUT ") + Arrays.toString(key);
        }
    }

    /**
     * Stored key-value pair.
     */
    class Entry {
        private final byte[] key;
        private final byte[] value;

        public Entry(byte[] key, byte[] value) {
            this.key = key;
            this.value = value;
        }

        public byte[] getKey() {
            return key;
        }

        public byte[] getValue() {
            return value;
        }
    }
}
