package com.geico.poc.streamcatalog.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Catalog store held in process memory. Default store for single-node deployments and tests.
 *
 * Commits take the store monitor, so a concurrent {@link #loadAll()} never sees half of a
 * commit.
 */
@Component
@ConditionalOnProperty(name = "stream-catalog.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryCatalogStore implements CatalogStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCatalogStore.class);

    private final TreeMap<byte[], byte[]> data = new TreeMap<>(Arrays::compareUnsigned);

    @Override
    public synchronized void commit(List<Write> writes) {
        for (Write write : writes) {
            if (write.isDelete()) {
                data.remove(write.getKey());
            } else {
                data.put(write.getKey().clone(), write.getValue().clone());
            }
        }
        log.debug("Committed {} catalog writes ({} keys stored)", writes.size(), data.size());
    }

    @Override
    public synchronized List<Entry> loadAll() {
        List<Entry> entries = new ArrayList<>(data.size());
        for (Map.Entry<byte[], byte[]> e : data.entrySet()) {
            entries.add(new Entry(e.getKey().clone(), e.getValue().clone()));
        }
        return entries;
    }

    public synchronized int size() {
        return data.size();
    }
}
