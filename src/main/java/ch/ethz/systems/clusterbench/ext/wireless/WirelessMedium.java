package ch.ethz.systems.clusterbench.ext.wireless;

import ch.ethz.systems.clusterbench.core.Simulator;
import ch.ethz.systems.clusterbench.core.log.SimulationLogger;
import ch.ethz.systems.clusterbench.core.network.NetworkAddress;
import ch.ethz.systems.clusterbench.core.network.Packet;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Shared broadcast medium connecting the transport layers of all nodes.
 *
 * Reachability is an undirected graph: a transmission reaches exactly
 * the attached nodes adjacent to the sender, after a fixed propagation
 * delay. A group transmission is received by every adjacent node; a
 * unicast transmission only by its addressee, and only if it is adjacent.
 * There is no loss, no collision and no capacity limit.
 */
public class WirelessMedium {

    private final Simulator simulator;
    private final long propagationDelayNs;

    // Attached transport layers by node identifier
    private final Map<Integer, WirelessTransportLayer> attached;
    private final Map<NetworkAddress, Integer> addressToIdentifier;

    // Symmetric adjacency
    private final Map<Integer, Set<Integer>> adjacency;

    private long transmissions;
    private long deliveries;

    /**
     * @param simulator             Simulator on which arrivals are scheduled
     * @param propagationDelayNs    Delay between transmission and arrival (>= 0)
     */
    public WirelessMedium(Simulator simulator, long propagationDelayNs) {
        if (propagationDelayNs < 0) {
            throw new IllegalArgumentException("Propagation delay cannot be negative: " + propagationDelayNs);
        }
        this.simulator = simulator;
        this.propagationDelayNs = propagationDelayNs;
        this.attached = new TreeMap<>();
        this.addressToIdentifier = new HashMap<>();
        this.adjacency = new TreeMap<>();
        this.transmissions = 0;
        this.deliveries = 0;
    }

    /**
     * Attach a node and create its transport layer.
     *
     * @param identifier    Node identifier
     * @param localPort     Port the node listens on
     *
     * @return Transport layer of the node
     */
    public WirelessTransportLayer attach(int identifier, int localPort) {
        if (attached.containsKey(identifier)) {
            throw new IllegalArgumentException("Node " + identifier + " is already attached to the medium");
        }
        WirelessTransportLayer layer = new WirelessTransportLayer(this, identifier, localPort);
        attached.put(identifier, layer);
        addressToIdentifier.put(layer.getLocalAddress(), identifier);
        adjacency.computeIfAbsent(identifier, k -> new TreeSet<>());
        return layer;
    }

    /**
     * Detach a node: it neither sends nor receives anymore. Its links are kept,
     * so packets already in flight towards it are lost on arrival.
     *
     * @param identifier    Node identifier
     */
    public void detach(int identifier) {
        WirelessTransportLayer layer = attached.remove(identifier);
        if (layer != null) {
            addressToIdentifier.remove(layer.getLocalAddress());
            SimulationLogger.logInfo("MEDIUM_NODE_DETACHED", "Node=" + identifier + ",Time=" + simulator.getCurrentTime());
        }
    }

    /**
     * Make two nodes mutually reachable.
     */
    public void connect(int a, int b) {
        if (a == b) {
            throw new IllegalArgumentException("Cannot connect node " + a + " to itself");
        }
        adjacency.computeIfAbsent(a, k -> new TreeSet<>()).add(b);
        adjacency.computeIfAbsent(b, k -> new TreeSet<>()).add(a);
    }

    /**
     * Remove the link between two nodes (no-op if absent).
     */
    public void disconnect(int a, int b) {
        Set<Integer> fromA = adjacency.get(a);
        if (fromA != null) {
            fromA.remove(b);
        }
        Set<Integer> fromB = adjacency.get(b);
        if (fromB != null) {
            fromB.remove(a);
        }
    }

    public boolean areConnected(int a, int b) {
        Set<Integer> fromA = adjacency.get(a);
        return fromA != null && fromA.contains(b);
    }

    /**
     * @return Unmodifiable ascending set of nodes adjacent to the given one
     */
    public Set<Integer> getNeighbors(int identifier) {
        Set<Integer> neighbors = adjacency.get(identifier);
        return neighbors == null ? Collections.emptySet() : Collections.unmodifiableSet(neighbors);
    }

    /**
     * Put a packet on the medium.
     *
     * @param sender        Transmitting transport layer
     * @param packet        Packet
     * @param destination   Unicast address or group address
     * @param port          Destination port
     */
    void transmit(WirelessTransportLayer sender, Packet packet, NetworkAddress destination, int port) {
        if (!attached.containsKey(sender.getIdentifier())) {
            return;
        }
        transmissions++;
        long arrivalTime = simulator.getCurrentTime() + propagationDelayNs;

        if (destination.isMulticast()) {
            for (int neighborId : getNeighbors(sender.getIdentifier())) {
                scheduleArrival(arrivalTime, neighborId, packet, sender.getLocalAddress(), port);
            }
        } else {
            Integer destinationId = addressToIdentifier.get(destination);
            if (destinationId != null && areConnected(sender.getIdentifier(), destinationId)) {
                scheduleArrival(arrivalTime, destinationId, packet, sender.getLocalAddress(), port);
            }
        }
    }

    private void scheduleArrival(long arrivalTime, int receiverId, Packet packet, NetworkAddress senderAddress, int port) {
        WirelessTransportLayer receiver = attached.get(receiverId);
        if (receiver == null) {
            return;
        }
        deliveries++;
        simulator.registerEvent(new PacketArrivalEvent(arrivalTime, receiver, packet, senderAddress, port));
    }

    public boolean isAttached(int identifier) {
        return attached.containsKey(identifier);
    }

    public long getPropagationDelayNs() {
        return propagationDelayNs;
    }

    /**
     * @return Number of packets put on the medium
     */
    public long getTransmissionCount() {
        return transmissions;
    }

    /**
     * @return Number of scheduled packet arrivals (one per reached receiver)
     */
    public long getDeliveryCount() {
        return deliveries;
    }

}
