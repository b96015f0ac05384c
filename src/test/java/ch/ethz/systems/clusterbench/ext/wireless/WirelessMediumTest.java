package ch.ethz.systems.clusterbench.ext.wireless;

import ch.ethz.systems.clusterbench.core.Simulator;
import ch.ethz.systems.clusterbench.core.network.NetworkAddress;
import ch.ethz.systems.clusterbench.core.network.Packet;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.interfaces.IPacketReceiver;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for WirelessMedium and WirelessTransportLayer.
 *
 * Layout: 0 --- 1 --- 2, node 3 isolated.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class WirelessMediumTest {

    private static final int PORT = 5000;
    private static final long DELAY = 1_000;

    @Mock private IPacketReceiver receiver0;
    @Mock private IPacketReceiver receiver1;
    @Mock private IPacketReceiver receiver2;
    @Mock private IPacketReceiver receiver3;
    @Mock private Packet mockPacket;

    private Simulator simulator;
    private WirelessMedium medium;
    private WirelessTransportLayer layer0;
    private WirelessTransportLayer layer1;
    private WirelessTransportLayer layer2;
    private WirelessTransportLayer layer3;

    @BeforeEach
    void setUp() {
        simulator = new Simulator(0, null);
        medium = new WirelessMedium(simulator, DELAY);
        layer0 = medium.attach(0, PORT);
        layer1 = medium.attach(1, PORT);
        layer2 = medium.attach(2, PORT);
        layer3 = medium.attach(3, PORT);
        layer0.setReceiver(receiver0);
        layer1.setReceiver(receiver1);
        layer2.setReceiver(receiver2);
        layer3.setReceiver(receiver3);
        medium.connect(0, 1);
        medium.connect(1, 2);
    }

    // =========================================================================
    // TOPOLOGY
    // =========================================================================

    @Test
    @DisplayName("Links are symmetric")
    void links_areSymmetric() {
        assertTrue(medium.areConnected(0, 1));
        assertTrue(medium.areConnected(1, 0));
        assertFalse(medium.areConnected(0, 2));
        assertEquals(2, medium.getNeighbors(1).size());
    }

    @Test
    @DisplayName("A node cannot be attached twice or linked to itself")
    void invalidTopologyChanges_throw() {
        assertThrows(IllegalArgumentException.class, () -> medium.attach(1, PORT));
        assertThrows(IllegalArgumentException.class, () -> medium.connect(2, 2));
    }

    // =========================================================================
    // DELIVERY
    // =========================================================================

    @Test
    @DisplayName("A group transmission reaches every adjacent node after the propagation delay")
    void multicast_reachesNeighbors() {
        layer1.sendMulticast(mockPacket, NetworkAddress.ALL_NODES, PORT);

        simulator.runNs(DELAY - 1);
        verify(receiver0, never()).onDataArrived(any(), any());

        simulator.runNs(1);
        verify(receiver0).onDataArrived(mockPacket, NetworkAddress.forNode(1));
        verify(receiver2).onDataArrived(mockPacket, NetworkAddress.forNode(1));
        verify(receiver1, never()).onDataArrived(any(), any());
        verify(receiver3, never()).onDataArrived(any(), any());
        assertEquals(1, medium.getTransmissionCount());
        assertEquals(2, medium.getDeliveryCount());
    }

    @Test
    @DisplayName("A unicast transmission reaches only its adjacent addressee")
    void unicast_reachesOnlyAddressee() {
        layer1.sendUnicast(mockPacket, NetworkAddress.forNode(2), PORT);
        simulator.runNs(DELAY);

        verify(receiver2).onDataArrived(mockPacket, NetworkAddress.forNode(1));
        verify(receiver0, never()).onDataArrived(any(), any());
    }

    @Test
    @DisplayName("A unicast to a node out of range is lost")
    void unicast_outOfRange_isLost() {
        layer0.sendUnicast(mockPacket, NetworkAddress.forNode(2), PORT);
        simulator.runNs(DELAY);

        verify(receiver2, never()).onDataArrived(any(), any());
        assertEquals(0, medium.getDeliveryCount());
    }

    @Test
    @DisplayName("Packets for another port are discarded by the transport")
    void wrongPort_isDiscarded() {
        layer1.sendMulticast(mockPacket, NetworkAddress.ALL_NODES, PORT + 1);
        simulator.runNs(DELAY);

        verify(receiver0, never()).onDataArrived(any(), any());
        verify(receiver2, never()).onDataArrived(any(), any());
    }

    @Test
    @DisplayName("Removing a link stops delivery over it")
    void disconnect_stopsDelivery() {
        medium.disconnect(1, 2);
        layer1.sendMulticast(mockPacket, NetworkAddress.ALL_NODES, PORT);
        simulator.runNs(DELAY);

        verify(receiver0).onDataArrived(any(), any());
        verify(receiver2, never()).onDataArrived(any(), any());
    }

    @Test
    @DisplayName("A closed transport neither sends nor receives, including packets in flight")
    void closedTransport_isSilent() {
        layer1.sendMulticast(mockPacket, NetworkAddress.ALL_NODES, PORT);
        layer2.close();
        simulator.runNs(DELAY);

        verify(receiver2, never()).onDataArrived(any(), any());
        assertTrue(layer2.isClosed());
        assertFalse(medium.isAttached(2));

        layer2.sendMulticast(mockPacket, NetworkAddress.ALL_NODES, PORT);
        simulator.runNs(DELAY);
        verify(receiver1, never()).onDataArrived(any(), any());
    }

    @Test
    @DisplayName("Group and unicast sends check the address kind")
    void addressKind_isChecked() {
        assertThrows(IllegalArgumentException.class,
                () -> layer0.sendUnicast(mockPacket, NetworkAddress.ALL_NODES, PORT));
        assertThrows(IllegalArgumentException.class,
                () -> layer0.sendMulticast(mockPacket, NetworkAddress.forNode(1), PORT));
    }

}
