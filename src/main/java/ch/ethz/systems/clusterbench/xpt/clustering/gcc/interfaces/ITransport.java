package ch.ethz.systems.clusterbench.xpt.clustering.gcc.interfaces;

import ch.ethz.systems.clusterbench.core.network.NetworkAddress;
import ch.ethz.systems.clusterbench.core.network.Packet;

/**
 * Packet delivery service of a node. Best effort: a packet to an address
 * that is out of reach is silently lost.
 */
public interface ITransport {

    /**
     * Send a packet to a single node.
     *
     * @param packet                Packet
     * @param destinationAddress    Unicast address of the receiver
     * @param port                  Destination port
     */
    void sendUnicast(Packet packet, NetworkAddress destinationAddress, int port);

    /**
     * Send a packet to every member of a group within reach.
     *
     * @param packet        Packet
     * @param groupAddress  Multicast group address
     * @param port          Destination port
     */
    void sendMulticast(Packet packet, NetworkAddress groupAddress, int port);

    /**
     * Set the handler of inbound packets.
     *
     * @param receiver  Receiver
     */
    void setReceiver(IPacketReceiver receiver);

    /**
     * @return Own unicast address
     */
    NetworkAddress getLocalAddress();

    /**
     * Stop sending and receiving.
     */
    void close();

}
