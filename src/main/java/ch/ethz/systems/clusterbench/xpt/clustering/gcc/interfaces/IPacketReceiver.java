package ch.ethz.systems.clusterbench.xpt.clustering.gcc.interfaces;

import ch.ethz.systems.clusterbench.core.network.NetworkAddress;
import ch.ethz.systems.clusterbench.core.network.Packet;

/**
 * Inbound side of a transport: called for every packet that reaches the local port.
 */
public interface IPacketReceiver {

    /**
     * @param packet            Received packet
     * @param senderAddress     Transport address of the transmitting node
     */
    void onDataArrived(Packet packet, NetworkAddress senderAddress);

}
