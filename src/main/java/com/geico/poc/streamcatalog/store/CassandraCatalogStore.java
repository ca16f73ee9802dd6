package com.geico.poc.streamcatalog.store;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.DriverException;
import com.datastax.oss.driver.api.core.cql.BatchStatement;
import com.datastax.oss.driver.api.core.cql.BatchStatementBuilder;
import com.datastax.oss.driver.api.core.cql.DefaultBatchType;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.datastax.oss.driver.api.core.cql.ResultSet;
import com.datastax.oss.driver.api.core.cql.Row;
import com.geico.poc.streamcatalog.config.StreamCatalogConfig;
import com.geico.poc.streamcatalog.error.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Catalog store on top of Cassandra.
 *
 * Every catalog transaction is written as one LOGGED batch, which Cassandra applies
 * atomically: either all keys of the batch become visible or none do.
 */
@Component
@ConditionalOnProperty(name = "stream-catalog.store.type", havingValue = "cassandra")
public class CassandraCatalogStore implements CatalogStore {

    private static final Logger log = LoggerFactory.getLogger(CassandraCatalogStore.class);

    @Autowired
    private CqlSession session;

    @Autowired
    private StreamCatalogConfig config;

    private PreparedStatement putStatement;
    private PreparedStatement deleteStatement;
    private PreparedStatement loadAllStatement;

    @PostConstruct
    public void initialize() {
        String keyspace = config.getStore().getKeyspace();
        String table = config.getStore().getTable();
        log.info("Initializing Cassandra catalog store {}.{}", keyspace, table);

        session.execute(String.format(
            "CREATE KEYSPACE IF NOT EXISTS %s WITH replication = " +
            "{'class': 'SimpleStrategy', 'replication_factor': 1}", keyspace));
        session.execute(String.format(
            "CREATE TABLE IF NOT EXISTS %s.%s (" +
            "  key BLOB PRIMARY KEY," +
            "  value BLOB" +
            ")", keyspace, table));

        putStatement = session.prepare(String.format(
            "INSERT INTO %s.%s (key, value) VALUES (?, ?)", keyspace, table));
        deleteStatement = session.prepare(String.format(
            "DELETE FROM %s.%s WHERE key = ?", keyspace, table));
        loadAllStatement = session.prepare(String.format(
            "SELECT key, value FROM %s.%s", keyspace, table));
        log.info("Cassandra catalog store ready");
    }

    @Override
    public void commit(List<Write> writes) {
        if (writes.isEmpty()) {
            return;
        }
        BatchStatementBuilder batch = BatchStatement.builder(DefaultBatchType.LOGGED);
        for (Write write : writes) {
            if (write.isDelete()) {
                batch.addStatement(deleteStatement.bind(ByteBuffer.wrap(write.getKey())));
            } else {
                batch.addStatement(putStatement.bind(
                    ByteBuffer.wrap(write.getKey()),
                    ByteBuffer.wrap(write.getValue())));
            }
        }
        try {
            session.execute(batch.build());
            log.debug("Committed batch of {} catalog writes", writes.size());
        } catch (DriverException e) {
            throw new StoreUnavailableException("Catalog commit failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<Entry> loadAll() {
        List<Entry> entries = new ArrayList<>();
        try {
            ResultSet rs = session.execute(loadAllStatement.bind());
            for (Row row : rs) {
                entries.add(new Entry(toArray(row.getByteBuffer("key")), toArray(row.getByteBuffer("value"))));
            }
        } catch (DriverException e) {
            throw new StoreUnavailableException("Catalog load failed: " + e.getMessage(), e);
        }
        log.info("Loaded {} catalog entries from Cassandra", entries.size());
        return entries;
    }

    private static byte[] toArray(ByteBuffer buffer) {
        if (buffer == null) {
            return null;
        }
        byte[] bytes = new byte[buffer.remaining()];
        buffer.duplicate().get(bytes);
        return bytes;
    }
}
