package ch.ethz.systems.clusterbench.xpt.clustering.gcc.routing;

import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

class DedupSetTest {

    @Test
    @DisplayName("A pair is contained only after it was added")
    void add_thenContains() {
        DedupSet set = new DedupSet();
        assertFalse(set.contains(7, 5));
        assertTrue(set.add(7, 5));
        assertTrue(set.contains(7, 5));
        assertFalse(set.add(7, 5));
        assertEquals(1, set.size());
    }

    @Test
    @DisplayName("Source and sequence number are not interchangeable")
    void key_distinguishesSourceAndSequence() {
        DedupSet set = new DedupSet();
        set.add(7, 5);
        assertFalse(set.contains(5, 7));
        assertFalse(set.contains(7, 6));
        assertFalse(set.contains(8, 5));
    }

    @Test
    @DisplayName("Unbounded set keeps every pair")
    void unbounded_keepsAll() {
        DedupSet set = new DedupSet(0);
        for (int seq = 0; seq < 10_000; seq++) {
            set.add(1, seq);
        }
        assertEquals(10_000, set.size());
        assertTrue(set.contains(1, 0));
    }

    @Test
    @DisplayName("Bounded set forgets the oldest pair first")
    void bounded_evictsOldest() {
        DedupSet set = new DedupSet(3);
        set.add(1, 0);
        set.add(1, 1);
        set.add(1, 2);
        set.add(1, 3);

        assertEquals(3, set.size());
        assertFalse(set.contains(1, 0));
        assertTrue(set.contains(1, 1));
        assertTrue(set.contains(1, 3));
    }

    @Test
    @DisplayName("Negative capacity is refused")
    void negativeCapacity_throws() {
        assertThrows(IllegalArgumentException.class, () -> new DedupSet(-1));
    }

}
