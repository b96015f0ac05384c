package ch.ethz.systems.clusterbench.core.run.traffic;

import ch.ethz.systems.clusterbench.xpt.clustering.gcc.interfaces.IDestinationSelector;

import org.junit.jupiter.api.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class UniformDestinationPlannerTest {

    @Test
    @DisplayName("Random destinations cover all other nodes and never the source")
    void random_neverSource() {
        UniformDestinationPlanner planner = new UniformDestinationPlanner(Arrays.asList(0, 1, 2, 3),
                UniformDestinationPlanner.RANDOM_DESTINATION, new Random(5));

        Set<Integer> seen = new HashSet<>();
        for (int i = 0; i < 500; i++) {
            int destination = planner.selectDestination(2);
            assertNotEquals(2, destination);
            seen.add(destination);
        }
        assertEquals(new HashSet<>(Arrays.asList(0, 1, 3)), seen);
    }

    @Test
    @DisplayName("A fixed destination is always chosen, except by itself")
    void fixedDestination() {
        UniformDestinationPlanner planner = new UniformDestinationPlanner(Arrays.asList(0, 1, 2), 1, new Random(5));

        assertEquals(1, planner.selectDestination(0));
        assertEquals(1, planner.selectDestination(2));
        assertEquals(IDestinationSelector.NO_DESTINATION, planner.selectDestination(1));
    }

    @Test
    @DisplayName("A single node has nobody to send to")
    void singleNode_noDestination() {
        UniformDestinationPlanner planner = new UniformDestinationPlanner(Collections.singletonList(0),
                UniformDestinationPlanner.RANDOM_DESTINATION, new Random(5));

        assertEquals(IDestinationSelector.NO_DESTINATION, planner.selectDestination(0));
    }

    @Test
    @DisplayName("A fixed destination must be a node")
    void unknownFixedDestination_throws() {
        assertThrows(IllegalArgumentException.class,
                () -> new UniformDestinationPlanner(Arrays.asList(0, 1), 7, new Random(5)));
    }

}
