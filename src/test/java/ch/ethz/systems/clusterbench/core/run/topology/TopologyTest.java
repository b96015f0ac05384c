package ch.ethz.systems.clusterbench.core.run.topology;

import org.junit.jupiter.api.*;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.net.URISyntaxException;
import java.nio.file.Paths;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class TopologyTest {

    private static Topology parse(String text) throws IOException {
        return Topology.parse(new BufferedReader(new StringReader(text)), "test");
    }

    @Test
    @DisplayName("A topology file lists nodes and undirected edges")
    void fromFile_resource() throws URISyntaxException {
        String file = Paths.get(getClass().getResource("/line_3.topology").toURI()).toString();

        Topology topology = Topology.fromFile(file);

        assertEquals(3, topology.getNumNodes());
        assertEquals(2, topology.getNumEdges());
        assertTrue(topology.hasEdge(0, 1));
        assertTrue(topology.hasEdge(2, 1));
        assertFalse(topology.hasEdge(0, 2));
    }

    @Test
    @DisplayName("Comments and blank lines are ignored")
    void parse_ignoresComments() throws IOException {
        Topology topology = parse("# header\n\n|V|=2\n|E|=1\n# edge follows\n0 1\n");
        assertEquals(1, topology.getNumEdges());
    }

    @Test
    @DisplayName("Malformed files are refused")
    void parse_malformed() {
        assertThrows(IllegalArgumentException.class, () -> parse("|E|=0\n"));
        assertThrows(IllegalArgumentException.class, () -> parse("|V|=2\n|E|=2\n0 1\n"));
        assertThrows(IllegalArgumentException.class, () -> parse("|V|=2\n0 1 2\n"));
        assertThrows(IllegalArgumentException.class, () -> parse("|V|=2\n0 5\n"));
        assertThrows(IllegalArgumentException.class, () -> parse("|V|=2\n1 1\n"));
        assertThrows(IllegalArgumentException.class, () -> parse("|V|=x\n"));
    }

    @Test
    @DisplayName("A name that is no file is resolved on the classpath")
    void fromFile_classpathFallback() {
        Topology topology = Topology.fromFile("line_3.topology");
        assertEquals(3, topology.getNumNodes());
        assertEquals(2, topology.getNumEdges());
    }

    @Test
    @DisplayName("The bundled example topologies load from any working directory")
    void fromFile_bundledExamples() {
        Topology grid = Topology.fromFile("example/topologies/grid_3x3.topology");
        assertEquals(9, grid.getNumNodes());
        assertEquals(12, grid.getNumEdges());
        assertTrue(grid.hasEdge(4, 7));

        Topology line = Topology.fromFile("example/topologies/line_5.topology");
        assertEquals(5, line.getNumNodes());
        assertEquals(4, line.getNumEdges());
    }

    @Test
    @DisplayName("A missing file is reported")
    void fromFile_missing() {
        assertThrows(RuntimeException.class, () -> Topology.fromFile("does/not/exist.topology"));
    }

    @Test
    @DisplayName("Edges are listed once, ascending")
    void getEdges_listsEachEdgeOnce() {
        Topology topology = new Topology(4);
        topology.addEdge(2, 1);
        topology.addEdge(0, 3);
        assertFalse(topology.addEdge(1, 2));

        assertEquals(2, topology.getEdges().size());
        assertArrayEquals(new int[]{0, 3}, topology.getEdges().get(0));
        assertArrayEquals(new int[]{1, 2}, topology.getEdges().get(1));
    }

    @Test
    @DisplayName("Random geometric graphs are reproducible and respect the range")
    void randomGeometric() {
        Topology a = Topology.randomGeometric(30, 500, 150, new Random(3));
        Topology b = Topology.randomGeometric(30, 500, 150, new Random(3));

        assertEquals(a.getNumEdges(), b.getNumEdges());
        for (int[] edge : a.getEdges()) {
            assertTrue(b.hasEdge(edge[0], edge[1]));
        }

        Topology complete = Topology.randomGeometric(5, 10, 100, new Random(1));
        assertEquals(10, complete.getNumEdges());
    }

}
