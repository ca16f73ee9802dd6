package com.geico.poc.streamcatalog.manager;

import com.geico.poc.streamcatalog.error.StoreUnavailableException;
import com.geico.poc.streamcatalog.store.CatalogStore;
import com.geico.poc.streamcatalog.store.InMemoryCatalogStore;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory store that can be told to reject its next commits, or to hold them until released.
 */
public class FailingCatalogStore implements CatalogStore {

    private final CatalogStore delegate = new InMemoryCatalogStore();
    private final AtomicInteger failuresLeft = new AtomicInteger();
    private final AtomicInteger commits = new AtomicInteger();
    private volatile CountDownLatch held;
    private volatile CountDownLatch release;

    public void failNextCommits(int count) {
        failuresLeft.set(count);
    }

    /**
     * Make commits wait on {@code release}; {@code held} is counted down as each one starts waiting.
     */
    public void holdCommits(CountDownLatch held, CountDownLatch release) {
        this.held = held;
        this.release = release;
    }

    public int successfulCommits() {
        return commits.get();
    }

    @Override
    public void commit(List<Write> writes) {
        if (failuresLeft.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new StoreUnavailableException("injected commit failure");
        }
        CountDownLatch gate = release;
        if (gate != null) {
            held.countDown();
            try {
                gate.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StoreUnavailableException("interrupted while commit was held");
            }
        }
        delegate.commit(writes);
        commits.incrementAndGet();
    }

    @Override
    public List<Entry> loadAll() {
        return delegate.loadAll();
    }
}
