package ch.ethz.systems.clusterbench.ext.wireless;

import ch.ethz.systems.clusterbench.core.log.SimulationLogger;
import ch.ethz.systems.clusterbench.core.network.NetworkAddress;
import ch.ethz.systems.clusterbench.core.network.Packet;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.interfaces.IPacketReceiver;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.interfaces.ITransport;

/**
 * The transport layer of a single node on the {@link WirelessMedium}.
 * It owns one unicast address and a local port; arriving packets for
 * another port are discarded. Datagram semantics: no connection state,
 * no retransmission.
 *
 * @see WirelessMedium
 */
public class WirelessTransportLayer implements ITransport {

    private final WirelessMedium medium;
    private final int identifier;
    private final NetworkAddress localAddress;
    private final int localPort;

    private IPacketReceiver receiver;
    private boolean closed;
    private long packetsSent;
    private long packetsReceived;

    WirelessTransportLayer(WirelessMedium medium, int identifier, int localPort) {
        this.medium = medium;
        this.identifier = identifier;
        this.localAddress = NetworkAddress.forNode(identifier);
        this.localPort = localPort;
        this.receiver = null;
        this.closed = false;
        this.packetsSent = 0;
        this.packetsReceived = 0;
    }

    @Override
    public void sendUnicast(Packet packet, NetworkAddress destinationAddress, int port) {
        if (closed) {
            return;
        }
        if (destinationAddress.isMulticast()) {
            throw new IllegalArgumentException("Unicast send to group address " + destinationAddress);
        }
        packetsSent++;
        medium.transmit(this, packet, destinationAddress, port);
    }

    @Override
    public void sendMulticast(Packet packet, NetworkAddress groupAddress, int port) {
        if (closed) {
            return;
        }
        if (!groupAddress.isMulticast()) {
            throw new IllegalArgumentException("Multicast send to unicast address " + groupAddress);
        }
        packetsSent++;
        medium.transmit(this, packet, groupAddress, port);
    }

    /**
     * Reception of a packet from the medium.
     *
     * @param packet            Packet instance
     * @param senderAddress     Address of the transmitting node
     * @param port              Destination port the packet was sent to
     */
    void receive(Packet packet, NetworkAddress senderAddress, int port) {
        if (closed || port != localPort) {
            return;
        }
        packetsReceived++;
        if (receiver == null) {
            SimulationLogger.logWarning("TRANSPORT_NO_RECEIVER",
                    "Node=" + identifier + ",Sender=" + senderAddress);
            return;
        }
        receiver.onDataArrived(packet, senderAddress);
    }

    @Override
    public void setReceiver(IPacketReceiver receiver) {
        this.receiver = receiver;
    }

    @Override
    public NetworkAddress getLocalAddress() {
        return localAddress;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            medium.detach(identifier);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    public int getIdentifier() {
        return identifier;
    }

    public int getLocalPort() {
        return localPort;
    }

    public long getPacketsSent() {
        return packetsSent;
    }

    public long getPacketsReceived() {
        return packetsReceived;
    }

}
