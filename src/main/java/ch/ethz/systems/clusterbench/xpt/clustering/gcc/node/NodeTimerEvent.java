package ch.ethz.systems.clusterbench.xpt.clustering.gcc.node;

class NodeTimerEvent extends NodeEvent {

    private final TimerKind kind;

    NodeTimerEvent(long timeNs, GraphColoringNode node, TimerKind kind) {
        super(timeNs, node);
        this.kind = kind;
    }

    @Override
    protected void fire() {
        node.onTimer(kind);
    }

    TimerKind getKind() {
        return kind;
    }

}
