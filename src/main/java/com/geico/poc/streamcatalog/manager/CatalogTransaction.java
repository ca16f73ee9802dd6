package com.geico.poc.streamcatalog.manager;

import com.geico.poc.streamcatalog.catalog.CatalogObject;
import com.geico.poc.streamcatalog.catalog.ObjectKind;
import com.geico.poc.streamcatalog.notification.CatalogDelta;
import com.geico.poc.streamcatalog.store.CatalogCodec;
import com.geico.poc.streamcatalog.store.CatalogKeys;
import com.geico.poc.streamcatalog.store.CatalogStore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Changes staged by one catalog manager request.
 *
 * Validation reads {@link #base()}; nothing staged here is visible to anyone until the
 * manager commits the writes and swaps in the next snapshot.
 */
public class CatalogTransaction {

    /**
     * Request lifecycle. Every state before {@link #COMMITTING} may end in {@link #REJECTED}.
     */
    public enum State {
        VALIDATING,
        ALLOCATING,
        COMMITTING,
        BROADCASTING,
        DONE,
        REJECTED
    }

    private final String operation;
    private final CatalogSnapshot base;
    private final IdAllocator.Reservation ids;
    private final List<CatalogDelta> deltas = new ArrayList<>();
    private State state = State.VALIDATING;

    CatalogTransaction(String operation, CatalogSnapshot base, IdAllocator.Reservation ids) {
        this.operation = operation;
        this.base = base;
        this.ids = ids;
    }

    public String getOperation() {
        return operation;
    }

    /**
     * The committed catalog this transaction was started against.
     */
    public CatalogSnapshot base() {
        return base;
    }

    public State getState() {
        return state;
    }

    void setState(State state) {
        this.state = state;
    }

    public long nextId(ObjectKind kind) {
        state = State.ALLOCATING;
        return ids.nextId(kind);
    }

    IdAllocator.Reservation reservation() {
        return ids;
    }

    public void create(CatalogObject object) {
        deltas.add(CatalogDelta.created(object));
    }

    public void alter(CatalogObject object) {
        deltas.add(CatalogDelta.altered(object));
    }

    public void drop(CatalogObject object) {
        deltas.add(CatalogDelta.dropped(object.kind(), object.getId()));
    }

    public boolean isEmpty() {
        return deltas.isEmpty();
    }

    public List<CatalogDelta> getDeltas() {
        return Collections.unmodifiableList(deltas);
    }

    /**
     * Store writes for the staged changes, the id watermarks and the catalog version this
     * transaction will produce. Applied as one atomic commit.
     */
    List<CatalogStore.Write> toWrites(long catalogVersion) {
        List<CatalogStore.Write> writes = new ArrayList<>(deltas.size() + 4);
        for (CatalogDelta delta : deltas) {
            byte[] key = CatalogKeys.encodeObjectKey(delta.getKind(), delta.getObjectId());
            if (delta.getType() == CatalogDelta.Type.DROPPED) {
                writes.add(CatalogStore.Write.delete(key));
            } else {
                writes.add(CatalogStore.Write.put(key, CatalogCodec.encodeObject(delta.getObject())));
            }
        }
        writes.addAll(ids.watermarkWrites());
        writes.add(CatalogStore.Write.put(CatalogKeys.encodeCatalogVersionKey(), CatalogCodec.encodeLong(catalogVersion)));
        return writes;
    }
}
