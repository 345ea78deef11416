package io.liparakis.craftis.server.net;

import io.liparakis.craftis.protocol.ServerMessage;
import io.liparakis.craftis.world.BlockChange;
import io.liparakis.craftis.world.WorldListener;

/**
 * Publishes every applied block edit to all clients, the editor included.
 * Runs under the chunk lock, so clients see edits to a chunk in the order the
 * world applied them.
 */
public final class BlockFanout implements WorldListener {
    private final Broadcaster broadcaster;

    public BlockFanout(Broadcaster broadcaster) {
        this.broadcaster = broadcaster;
    }

    @Override
    public void blockChanged(BlockChange change) {
        broadcaster.publish(new ServerMessage.BlockUpdate(change.chunk().p(), change.chunk().q(),
                change.x(), change.y(), change.z(), change.material()), Broadcaster.NO_ORIGIN, true);
    }
}
