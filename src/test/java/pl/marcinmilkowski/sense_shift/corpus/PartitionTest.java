package pl.marcinmilkowski.sense_shift.corpus;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Partition and the sense mapping on Document.
 */
class PartitionTest {

    private static Partition twoClusters() {
        Partition p = new Partition();
        int first = p.openCluster(0);
        p.add(first, 1);
        p.openCluster(2);
        return p;
    }

    @Test
    @DisplayName("Clusters keep creation and insertion order")
    void ordering() {
        Partition p = twoClusters();

        assertEquals(2, p.clusterCount());
        assertArrayEquals(new int[] {0, 1}, p.cluster(0));
        assertArrayEquals(new int[] {2}, p.cluster(1));
        assertEquals(0, p.clusterOf(1));
        assertEquals(1, p.clusterOf(2));
        assertEquals(-1, p.clusterOf(7));
        p.validate(3);
    }

    @Test
    @DisplayName("Moving the last member out removes the cluster")
    void moveRemovesEmptyCluster() {
        Partition p = twoClusters();

        int target = p.move(2, 0);

        assertEquals(0, target);
        assertEquals(1, p.clusterCount());
        assertArrayEquals(new int[] {0, 1, 2}, p.cluster(0));
        p.validate(3);
    }

    @Test
    @DisplayName("Moving to clusterCount() opens a new cluster")
    void moveToNewCluster() {
        Partition p = twoClusters();

        int target = p.move(0, p.clusterCount());

        assertEquals(2, target);
        assertArrayEquals(new int[] {1}, p.cluster(0));
        assertArrayEquals(new int[] {0}, p.cluster(2));
        p.validate(3);
    }

    @Test
    @DisplayName("Index of the target shifts when an earlier cluster disappears")
    void moveShiftsIndex() {
        Partition p = new Partition();
        p.openCluster(0);
        p.openCluster(1);
        p.openCluster(2);

        int target = p.move(0, 2);

        assertEquals(1, target);
        assertEquals(2, p.clusterCount());
        assertArrayEquals(new int[] {2, 0}, p.cluster(1));
    }

    @Test
    @DisplayName("validate rejects missing, duplicated and out-of-range positions")
    void validateFailures() {
        Partition missing = twoClusters();
        assertThrows(IllegalStateException.class, () -> missing.validate(4));

        Partition duplicated = twoClusters();
        duplicated.add(1, 0);
        assertThrows(IllegalStateException.class, () -> duplicated.validate(3));

        Partition outOfRange = twoClusters();
        assertThrows(IllegalStateException.class, () -> outOfRange.validate(2));
    }

    @Test
    @DisplayName("Sense mapping cannot be read before the sampler assigns it")
    void senseMappingUnset() {
        Document doc = new Document(4, new int[] {0, 1}, CorpusSide.FOCUS);

        assertFalse(doc.hasSenses());
        assertThrows(IllegalStateException.class, () -> doc.senseOf(0));
        assertThrows(IllegalStateException.class, doc::senseMapping);

        doc.assignSenses(new int[] {3});
        assertEquals(3, doc.senseOf(0));
        assertThrows(IllegalStateException.class, () -> doc.senseOf(1));
    }

    @Test
    @DisplayName("Documents without tokens are rejected")
    void emptyDocument() {
        assertThrows(IllegalArgumentException.class, () -> new Document(0, new int[0], CorpusSide.REFERENCE));
    }
}
