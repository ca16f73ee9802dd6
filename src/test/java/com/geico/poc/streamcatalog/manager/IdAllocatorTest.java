package com.geico.poc.streamcatalog.manager;

import com.geico.poc.streamcatalog.catalog.IdCategory;
import com.geico.poc.streamcatalog.catalog.ObjectKind;
import com.geico.poc.streamcatalog.store.CatalogCodec;
import com.geico.poc.streamcatalog.store.CatalogKeys;
import com.geico.poc.streamcatalog.store.CatalogStore;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class IdAllocatorTest {

    @Test
    public void testRelationKindsShareOneIdSpace() {
        IdAllocator allocator = new IdAllocator();
        IdAllocator.Reservation reservation = allocator.reserve();

        assertEquals(1, reservation.nextId(ObjectKind.TABLE));
        assertEquals(2, reservation.nextId(ObjectKind.SOURCE));
        assertEquals(3, reservation.nextId(ObjectKind.VIEW));
        assertEquals(1, reservation.nextId(ObjectKind.DATABASE), "Databases have their own id space");
    }

    @Test
    public void testAbandonedReservationDoesNotAdvance() {
        IdAllocator allocator = new IdAllocator();
        IdAllocator.Reservation abandoned = allocator.reserve();
        abandoned.nextId(ObjectKind.TABLE);
        abandoned.nextId(ObjectKind.TABLE);

        assertEquals(IdAllocator.FIRST_ID, allocator.peekNextId(IdCategory.RELATION));

        IdAllocator.Reservation committed = allocator.reserve();
        assertEquals(1, committed.nextId(ObjectKind.TABLE));
        allocator.advance(committed);
        assertEquals(2, allocator.peekNextId(IdCategory.RELATION));
    }

    @Test
    public void testWatermarkRecordsLastIssuedId() {
        IdAllocator allocator = new IdAllocator();
        IdAllocator.Reservation reservation = allocator.reserve();
        reservation.nextId(ObjectKind.FUNCTION);
        reservation.nextId(ObjectKind.FUNCTION);

        List<CatalogStore.Write> writes = reservation.watermarkWrites();

        assertEquals(1, writes.size());
        assertArrayEquals(CatalogKeys.encodeIdWatermarkKey(IdCategory.FUNCTION), writes.get(0).getKey());
        assertEquals(2L, CatalogCodec.decodeLong(writes.get(0).getValue()));
    }

    @Test
    public void testRecoverResumesAfterHighestOfWatermarkAndLiveIds() {
        IdAllocator allocator = new IdAllocator();
        Map<IdCategory, Long> watermarks = new EnumMap<>(IdCategory.class);
        watermarks.put(IdCategory.RELATION, 40L);
        watermarks.put(IdCategory.SCHEMA, 2L);
        Map<IdCategory, Long> live = new EnumMap<>(IdCategory.class);
        live.put(IdCategory.RELATION, 12L);
        live.put(IdCategory.SCHEMA, 7L);

        allocator.recover(watermarks, live);

        assertEquals(41, allocator.peekNextId(IdCategory.RELATION));
        assertEquals(8, allocator.peekNextId(IdCategory.SCHEMA));
        assertEquals(IdAllocator.FIRST_ID, allocator.peekNextId(IdCategory.DATABASE));
    }
}
