package ch.ethz.systems.clusterbench.core.run.topology;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Undirected reachability graph of a wireless scenario. Nodes are
 * numbered 0 .. |V| - 1.
 *
 * Topology file format (NetBench style):
 * <pre>
 * # comment
 * |V|=4
 * |E|=3
 * 0 1
 * 1 2
 * 2 3
 * </pre>
 * Edge lines are undirected; listing both directions is allowed.
 * Other "key=value" header lines are ignored.
 */
public class Topology {

    private final int numNodes;
    private final TreeMap<Integer, TreeSet<Integer>> adjacency;
    private int numEdges;

    /**
     * Create a topology of isolated nodes.
     *
     * @param numNodes  Number of nodes (> 0)
     */
    public Topology(int numNodes) {
        if (numNodes <= 0) {
            throw new IllegalArgumentException("Topology must have at least one node: " + numNodes);
        }
        this.numNodes = numNodes;
        this.adjacency = new TreeMap<>();
        for (int i = 0; i < numNodes; i++) {
            adjacency.put(i, new TreeSet<>());
        }
        this.numEdges = 0;
    }

    /**
     * Add an undirected edge.
     *
     * @return True iff the edge was not yet present
     */
    public boolean addEdge(int a, int b) {
        checkNode(a);
        checkNode(b);
        if (a == b) {
            throw new IllegalArgumentException("Self-loop on node " + a + " is not allowed");
        }
        boolean added = adjacency.get(a).add(b);
        adjacency.get(b).add(a);
        if (added) {
            numEdges++;
        }
        return added;
    }

    private void checkNode(int id) {
        if (id < 0 || id >= numNodes) {
            throw new IllegalArgumentException("Node " + id + " is out of range [0, " + (numNodes - 1) + "]");
        }
    }

    public boolean hasEdge(int a, int b) {
        Set<Integer> neighbors = adjacency.get(a);
        return neighbors != null && neighbors.contains(b);
    }

    /**
     * @return Unmodifiable ascending neighbor set
     */
    public Set<Integer> getNeighbors(int id) {
        checkNode(id);
        return Collections.unmodifiableSet(adjacency.get(id));
    }

    /**
     * @return Every undirected edge once, as {low, high}, ascending
     */
    public List<int[]> getEdges() {
        List<int[]> edges = new ArrayList<>();
        for (int a : adjacency.keySet()) {
            for (int b : adjacency.get(a)) {
                if (a < b) {
                    edges.add(new int[]{a, b});
                }
            }
        }
        return edges;
    }

    public int getNumNodes() {
        return numNodes;
    }

    public int getNumEdges() {
        return numEdges;
    }

    // =========================================================================
    // CONSTRUCTION
    // =========================================================================

    /**
     * Read a topology from file. A name which is not an existing file is
     * looked up on the classpath, so the bundled example topologies
     * (e.g. "example/topologies/grid_3x3.topology") resolve from any
     * working directory.
     *
     * @param fileName  Topology file name or classpath resource
     *
     * @return Topology
     *
     * @throws IllegalArgumentException if the file is malformed
     * @throws RuntimeException wrapping the I/O error if the file cannot be read
     */
    public static Topology fromFile(String fileName) {
        if (!new File(fileName).isFile()) {
            InputStream resource = Topology.class.getClassLoader().getResourceAsStream(fileName);
            if (resource != null) {
                try (BufferedReader reader = new BufferedReader(new InputStreamReader(resource, StandardCharsets.UTF_8))) {
                    return parse(reader, "classpath:" + fileName);
                } catch (IOException e) {
                    throw new RuntimeException("Unable to read topology resource " + fileName, e);
                }
            }
        }
        try (BufferedReader reader = new BufferedReader(new FileReader(fileName))) {
            return parse(reader, fileName);
        } catch (IOException e) {
            throw new RuntimeException("Unable to read topology file " + fileName, e);
        }
    }

    static Topology parse(BufferedReader reader, String sourceName) throws IOException {
        int declaredNodes = -1;
        int declaredEdgeLines = -1;
        List<int[]> edgeLines = new ArrayList<>();

        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            if (line.startsWith("|V|=")) {
                declaredNodes = parseNumber(line.substring(4), sourceName, lineNumber);
            } else if (line.startsWith("|E|=")) {
                declaredEdgeLines = parseNumber(line.substring(4), sourceName, lineNumber);
            } else if (line.contains("=")) {
                // Other header properties (e.g. server or switch lists) carry no meaning here
                continue;
            } else {
                String[] parts = line.split("\\s+");
                if (parts.length != 2) {
                    throw new IllegalArgumentException(sourceName + ":" + lineNumber + ": edge line must be \"a b\": " + line);
                }
                edgeLines.add(new int[]{
                        parseNumber(parts[0], sourceName, lineNumber),
                        parseNumber(parts[1], sourceName, lineNumber)
                });
            }
        }

        if (declaredNodes < 0) {
            throw new IllegalArgumentException(sourceName + ": missing |V|= header");
        }
        if (declaredEdgeLines >= 0 && declaredEdgeLines != edgeLines.size()) {
            throw new IllegalArgumentException(sourceName + ": |E|=" + declaredEdgeLines
                    + " but " + edgeLines.size() + " edge lines found");
        }

        Topology topology = new Topology(declaredNodes);
        for (int[] edge : edgeLines) {
            topology.addEdge(edge[0], edge[1]);
        }
        return topology;
    }

    private static int parseNumber(String text, String sourceName, int lineNumber) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(sourceName + ":" + lineNumber + ": not a number: " + text, e);
        }
    }

    /**
     * Random geometric (unit-disk) graph: nodes are placed uniformly in a
     * square and two nodes are adjacent iff their distance is at most the radio range.
     *
     * @param numNodes  Number of nodes
     * @param areaM     Side of the square area in meters
     * @param rangeM    Radio range in meters
     * @param random    Placement randomness
     *
     * @return Topology
     */
    public static Topology randomGeometric(int numNodes, double areaM, double rangeM, Random random) {
        if (areaM <= 0 || rangeM <= 0) {
            throw new IllegalArgumentException("Area and range must be positive: area=" + areaM + ", range=" + rangeM);
        }
        Topology topology = new Topology(numNodes);
        double[] x = new double[numNodes];
        double[] y = new double[numNodes];
        for (int i = 0; i < numNodes; i++) {
            x[i] = random.nextDouble() * areaM;
            y[i] = random.nextDouble() * areaM;
        }
        double rangeSquared = rangeM * rangeM;
        for (int i = 0; i < numNodes; i++) {
            for (int j = i + 1; j < numNodes; j++) {
                double dx = x[i] - x[j];
                double dy = y[i] - y[j];
                if (dx * dx + dy * dy <= rangeSquared) {
                    topology.addEdge(i, j);
                }
            }
        }
        return topology;
    }

    @Override
    public String toString() {
        return "Topology{|V|=" + numNodes + ", |E|=" + numEdges + "}";
    }

}
