package io.liparakis.craftis.protocol;

import io.liparakis.craftis.player.Pose;

/**
 * Records the server sends to clients.
 */
public interface ServerMessage extends Message {

    /**
     * Whether a broadcast of this record skips the connection it originated
     * from. Clients predict their own movement, so echoing it back is noise.
     */
    default boolean suppressEcho() {
        return false;
    }

    /**
     * {@code U,id,x,y,z,rx,ry}: identity assignment and own pose.
     */
    record You(int playerId, Pose pose) implements ServerMessage {
        @Override
        public Opcode opcode() {
            return Opcode.YOU;
        }

        @Override
        public void writeFields(RecordWriter out) {
            out.add(playerId);
            writePose(out, pose);
        }
    }

    /**
     * {@code P,id,x,y,z,rx,ry}: another player's pose.
     */
    record PlayerPosition(int playerId, Pose pose) implements ServerMessage {
        @Override
        public Opcode opcode() {
            return Opcode.POSITION;
        }

        @Override
        public void writeFields(RecordWriter out) {
            out.add(playerId);
            writePose(out, pose);
        }

        @Override
        public boolean suppressEcho() {
            return true;
        }
    }

    /**
     * {@code B,p,q,x,y,z,w}: one block of chunk data or a live edit.
     */
    record BlockUpdate(int p, int q, int x, int y, int z, int material) implements ServerMessage {
        @Override
        public Opcode opcode() {
            return Opcode.BLOCK;
        }

        @Override
        public void writeFields(RecordWriter out) {
            out.add(p).add(q).add(x).add(y).add(z).add(material);
        }
    }

    /**
     * {@code K,p,q,key}: the revision a chunk transfer brought the client to.
     */
    record ChunkKey(int p, int q, int key) implements ServerMessage {
        @Override
        public Opcode opcode() {
            return Opcode.KEY;
        }

        @Override
        public void writeFields(RecordWriter out) {
            out.add(p).add(q).add(key);
        }
    }

    /**
     * {@code R,p,q}: end of a chunk transfer, the client may rebuild it.
     */
    record Redraw(int p, int q) implements ServerMessage {
        @Override
        public Opcode opcode() {
            return Opcode.REDRAW;
        }

        @Override
        public void writeFields(RecordWriter out) {
            out.add(p).add(q);
        }
    }

    /**
     * {@code T,text}: chat line or server notice.
     */
    record Talk(String text) implements ServerMessage {
        @Override
        public Opcode opcode() {
            return Opcode.TALK;
        }

        @Override
        public void writeFields(RecordWriter out) {
            out.add(text);
        }
    }

    /**
     * {@code N,id,name}: a player's display name.
     */
    record PlayerName(int playerId, String name) implements ServerMessage {
        @Override
        public Opcode opcode() {
            return Opcode.NICK;
        }

        @Override
        public void writeFields(RecordWriter out) {
            out.add(playerId).add(name);
        }
    }

    /**
     * {@code D,id}: a player left.
     */
    record PlayerLeft(int playerId) implements ServerMessage {
        @Override
        public Opcode opcode() {
            return Opcode.DISCONNECT;
        }

        @Override
        public void writeFields(RecordWriter out) {
            out.add(playerId);
        }
    }

    /**
     * {@code E,time,dayLength}: clock synchronisation, in seconds.
     */
    record Time(long time, int dayLength) implements ServerMessage {
        @Override
        public Opcode opcode() {
            return Opcode.TIME;
        }

        @Override
        public void writeFields(RecordWriter out) {
            out.add(time).add(dayLength);
        }
    }

    private static void writePose(RecordWriter out, Pose pose) {
        out.add(pose.x()).add(pose.y()).add(pose.z()).add(pose.rx()).add(pose.ry());
    }
}
