package com.tmdledit.mutation;

import com.tmdledit.models.EntityKind;
import com.tmdledit.models.TmdlEntity;
import com.tmdledit.parser.TmdlParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InsertionPolicyTest {

    private final TmdlParser parser = new TmdlParser();

    private TmdlEntity table(String text) throws Exception {
        return parser.parse(text).getTables().get(0);
    }

    @Test
    void conventionGroupsByKind() throws Exception {
        TmdlEntity table = table("table T\n\tlineageTag: x\n\tmeasure A = 1\n\tcolumn C\n\thierarchy H\n"
            + "\tpartition T = m\n\tannotation N = 1\n");
        AuthoredConventionPolicy policy = new AuthoredConventionPolicy();

        assertEquals(2, policy.insertionIndex(table, EntityKind.MEASURE));
        assertEquals(3, policy.insertionIndex(table, EntityKind.COLUMN));
        assertEquals(4, policy.insertionIndex(table, EntityKind.HIERARCHY));
        assertEquals(6, policy.insertionIndex(table, EntityKind.ANNOTATION));
    }

    @Test
    void conventionFallsBackToEarlierGroupThenEnd() throws Exception {
        AuthoredConventionPolicy policy = new AuthoredConventionPolicy();

        assertEquals(2, policy.insertionIndex(table("table T\n\tlineageTag: x\n\tmeasure A = 1\n"), EntityKind.COLUMN));
        assertEquals(1, policy.insertionIndex(table("table T\n\tlineageTag: x\n"), EntityKind.MEASURE));
    }

    @Test
    void appendAlwaysUsesTheEnd() throws Exception {
        TmdlEntity table = table("table T\n\tcolumn C\n\tpartition T = m\n");
        assertEquals(2, new AppendInsertionPolicy().insertionIndex(table, EntityKind.MEASURE));
    }

    @Test
    void policiesByName() {
        assertTrue(InsertionPolicy.fromName(null) instanceof AuthoredConventionPolicy);
        assertTrue(InsertionPolicy.fromName("Append") instanceof AppendInsertionPolicy);
        assertThrows(IllegalArgumentException.class, () -> InsertionPolicy.fromName("sorted"));
    }

    @Test
    void canonicalOrderPlacesNewPropertyAmongExistingOnes() throws Exception {
        TmdlEntity column = table("table T\n\tcolumn C\n\t\tdataType: string\n\t\tlineageTag: x\n"
            + "\t\tsourceColumn: C\n\n\t\tannotation A = 1\n").findChild(EntityKind.COLUMN, "C");

        assertEquals(1, CanonicalPropertyOrder.insertionIndex(column, "isHidden"));
        assertEquals(2, CanonicalPropertyOrder.insertionIndex(column, "summarizeBy"));
        assertEquals(3, CanonicalPropertyOrder.insertionIndex(column, "sortByColumn"));
        assertEquals(3, CanonicalPropertyOrder.insertionIndex(column, "customKey"));
        assertEquals(-1, CanonicalPropertyOrder.rank(EntityKind.PARTITION, "mode"));
    }
}
