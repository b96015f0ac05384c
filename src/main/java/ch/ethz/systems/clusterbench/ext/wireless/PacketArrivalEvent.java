package ch.ethz.systems.clusterbench.ext.wireless;

import ch.ethz.systems.clusterbench.core.network.Event;
import ch.ethz.systems.clusterbench.core.network.NetworkAddress;
import ch.ethz.systems.clusterbench.core.network.Packet;

/**
 * Event for the arrival of a packet at a transport layer after it
 * crossed the wireless medium.
 */
public class PacketArrivalEvent extends Event {

    private final WirelessTransportLayer receiver;
    private final Packet packet;
    private final NetworkAddress senderAddress;
    private final int port;

    /**
     * @param timeNs            Absolute arrival time
     * @param receiver          Receiving transport layer
     * @param packet            Packet
     * @param senderAddress     Address of the transmitting node
     * @param port              Destination port
     */
    PacketArrivalEvent(long timeNs, WirelessTransportLayer receiver, Packet packet,
                       NetworkAddress senderAddress, int port) {
        super(timeNs);
        this.receiver = receiver;
        this.packet = packet;
        this.senderAddress = senderAddress;
        this.port = port;
    }

    @Override
    public void trigger() {
        receiver.receive(packet, senderAddress, port);
    }

    @Override
    public String toString() {
        return "PacketArrivalEvent<" + senderAddress + " -> " + receiver.getLocalAddress() + ":" + port
                + ", " + packet.getClass().getSimpleName() + ", t=" + getTime() + ">";
    }

}
