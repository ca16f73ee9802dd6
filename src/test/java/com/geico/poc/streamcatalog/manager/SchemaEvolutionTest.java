package com.geico.poc.streamcatalog.manager;

import com.geico.poc.streamcatalog.catalog.ColumnMetadata;
import com.geico.poc.streamcatalog.catalog.ColumnOrder;
import com.geico.poc.streamcatalog.catalog.TableMetadata;
import com.geico.poc.streamcatalog.catalog.TableVersion;
import com.geico.poc.streamcatalog.error.InvalidDefinitionException;
import com.geico.poc.streamcatalog.error.VersionConflictException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class SchemaEvolutionTest {

    private static TableMetadata newTable(String... names) {
        TableMetadata.Builder builder = TableMetadata.builder().id(10).name("t");
        for (String name : names) {
            builder.addColumn(ColumnMetadata.of(name, "int"));
        }
        return SchemaEvolution.initializeTable(builder.pk(Collections.singletonList(ColumnOrder.asc(0))).build(), true);
    }

    @Test
    public void testInitialVersion() {
        TableMetadata t = newTable("id", "a");

        assertEquals(new TableVersion(0, 2), t.getVersion().get());
        assertEquals(Arrays.asList(0, 1), t.getValueIndices());
    }

    @Test
    public void testTargetVersionIsCurrentPlusOne() {
        TableMetadata t = newTable("id", "a");
        SchemaEvolution.AlterSession session = SchemaEvolution.beginAlter(t, 0);

        assertEquals(new TableVersion(1, 2), session.getTargetVersion());
        assertEquals(2, session.allocateColumn());
        assertEquals(3, session.allocateColumn());
    }

    @Test
    public void testStaleVersionRejected() {
        TableMetadata t = newTable("id");
        TableMetadata v1 = SchemaEvolution.beginAlter(t, 0).addColumn("a", "int").finish();

        assertThrows(VersionConflictException.class, () -> SchemaEvolution.beginAlter(v1, 0));
        assertThrows(VersionConflictException.class, () -> SchemaEvolution.beginAlter(v1, 2));
    }

    @Test
    public void testNoColumnIdIsEverReassigned() {
        TableMetadata t = newTable("id", "a");
        Set<Integer> assigned = new HashSet<>(Arrays.asList(0, 1));
        int lastNext = t.getVersion().get().getNextColumnId();

        String[][] rounds = {{"drop", "a"}, {"add", "a"}, {"add", "b"}, {"drop", "b"}, {"add", "b"}, {"drop", "a"}};
        for (String[] round : rounds) {
            SchemaEvolution.AlterSession session = SchemaEvolution.beginAlter(t, t.getVersion().get().getVersion());
            if ("add".equals(round[0])) {
                session.addColumn(round[1], "int");
            } else {
                session.dropColumn(round[1]);
            }
            t = session.finish();

            int next = t.getVersion().get().getNextColumnId();
            assertTrue(next >= lastNext, "next_column_id went backwards");
            lastNext = next;
            if ("add".equals(round[0])) {
                int id = t.getColumns().get(t.findColumnIndex(round[1])).getColumnId();
                assertTrue(assigned.add(id), "Column id " + id + " reassigned");
            }
        }
        assertEquals(6, t.getVersion().get().getVersion());
        assertEquals(5, lastNext);
    }

    @Test
    public void testDropShiftsIndices() {
        TableMetadata t = newTable("id", "a", "b");
        TableMetadata altered = SchemaEvolution.beginAlter(t, 0).dropColumn("a").finish();

        assertEquals(Arrays.asList("id", "b"), Arrays.asList(
                altered.getColumns().get(0).getName(), altered.getColumns().get(1).getName()));
        assertEquals(2, altered.getColumns().get(1).getColumnId());
        assertEquals(Arrays.asList(0, 1), altered.getValueIndices());
    }

    @Test
    public void testRenameAndRetypeKeepColumnId() {
        TableMetadata t = newTable("id", "a");
        TableMetadata altered = SchemaEvolution.beginAlter(t, 0)
                .apply(ColumnChange.rename("a", "renamed"))
                .apply(ColumnChange.alterType("renamed", "bigint"))
                .finish();

        ColumnMetadata column = altered.getColumns().get(1);
        assertEquals("renamed", column.getName());
        assertEquals("bigint", column.getDataType());
        assertEquals(1, column.getColumnId());
        assertEquals(1, altered.getVersion().get().getVersion(), "One ALTER is one version however many changes");
    }

    @Test
    public void testInvalidChangesRejected() {
        TableMetadata t = newTable("id", "a");

        assertThrows(InvalidDefinitionException.class, () -> SchemaEvolution.beginAlter(t, 0).dropColumn("id"));
        assertThrows(InvalidDefinitionException.class, () -> SchemaEvolution.beginAlter(t, 0).dropColumn("missing"));
        assertThrows(InvalidDefinitionException.class, () -> SchemaEvolution.beginAlter(t, 0).addColumn("a", "int"));
        assertThrows(InvalidDefinitionException.class,
                () -> SchemaEvolution.beginAlter(t, 0).addColumn(ColumnMetadata.ROW_ID_COLUMN_NAME, "int"));
    }

    @Test
    public void testUnversionedTableCannotBeAltered() {
        TableMetadata mv = newTable("id").toBuilder().version(null).build();
        assertThrows(InvalidDefinitionException.class, () -> SchemaEvolution.beginAlter(mv, 0));
    }

    @Test
    public void testBumpVersionKeepsColumns() {
        TableMetadata t = newTable("id", "a");
        TableMetadata bumped = SchemaEvolution.bumpVersion(t);

        assertEquals(new TableVersion(1, 2), bumped.getVersion().get());
        assertEquals(t.getColumns(), bumped.getColumns());
    }
}
