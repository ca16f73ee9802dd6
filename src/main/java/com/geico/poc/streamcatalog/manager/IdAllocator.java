package com.geico.poc.streamcatalog.manager;

import com.geico.poc.streamcatalog.catalog.IdCategory;
import com.geico.poc.streamcatalog.catalog.ObjectKind;
import com.geico.poc.streamcatalog.store.CatalogCodec;
import com.geico.poc.streamcatalog.store.CatalogKeys;
import com.geico.poc.streamcatalog.store.CatalogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Issues catalog object ids.
 *
 * Ids come from the committed counters through a {@link Reservation} owned by one
 * transaction. The counters only move when the transaction's commit succeeds, so a failed
 * commit leaves no visible trace. Each reservation also emits the high-water mark of every
 * category it touched, written in the same commit, which keeps ids of dropped objects from
 * being handed out again after a restart.
 *
 * Not thread-safe; the catalog manager calls it under its writer lock.
 */
public class IdAllocator {

    private static final Logger log = LoggerFactory.getLogger(IdAllocator.class);

    public static final long FIRST_ID = 1L;

    private final Map<IdCategory, Long> nextIds = new EnumMap<>(IdCategory.class);

    public IdAllocator() {
        for (IdCategory category : IdCategory.values()) {
            nextIds.put(category, FIRST_ID);
        }
    }

    /**
     * Restore the counters from stored state.
     *
     * @param watermarks highest id ever issued per category, as persisted
     * @param maxLiveIds highest id among live objects per category
     */
    public void recover(Map<IdCategory, Long> watermarks, Map<IdCategory, Long> maxLiveIds) {
        for (IdCategory category : IdCategory.values()) {
            long highest = Math.max(watermarks.getOrDefault(category, 0L), maxLiveIds.getOrDefault(category, 0L));
            nextIds.put(category, Math.max(FIRST_ID, highest + 1));
        }
        log.info("Id counters recovered: {}", nextIds);
    }

    public long peekNextId(IdCategory category) {
        return nextIds.get(category);
    }

    public Reservation reserve() {
        return new Reservation();
    }

    /**
     * Make the ids of a committed reservation permanent.
     */
    public void advance(Reservation reservation) {
        for (Map.Entry<IdCategory, Long> e : reservation.pending.entrySet()) {
            if (e.getValue() > nextIds.get(e.getKey())) {
                nextIds.put(e.getKey(), e.getValue());
            }
        }
    }

    /**
     * Ids handed out to one transaction. Discarded without effect if the transaction does not
     * commit.
     */
    public class Reservation {
        private final Map<IdCategory, Long> pending = new EnumMap<>(IdCategory.class);

        private Reservation() {
        }

        public long nextId(ObjectKind kind) {
            IdCategory category = IdCategory.of(kind);
            long id = pending.getOrDefault(category, nextIds.get(category));
            pending.put(category, id + 1);
            return id;
        }

        public boolean isEmpty() {
            return pending.isEmpty();
        }

        /**
         * Store writes recording the last id issued in each touched category.
         */
        public List<CatalogStore.Write> watermarkWrites() {
            List<CatalogStore.Write> writes = new ArrayList<>();
            for (Map.Entry<IdCategory, Long> e : pending.entrySet()) {
                writes.add(CatalogStore.Write.put(
                        CatalogKeys.encodeIdWatermarkKey(e.getKey()),
                        CatalogCodec.encodeLong(e.getValue() - 1)));
            }
            return writes;
        }
    }
}
