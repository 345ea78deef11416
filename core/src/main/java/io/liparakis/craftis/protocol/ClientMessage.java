package io.liparakis.craftis.protocol;

import io.liparakis.craftis.player.Pose;

/**
 * Records a client sends to the server.
 */
public interface ClientMessage extends Message {

    void accept(Visitor visitor) throws ProtocolException;

    /**
     * Dispatch target for decoded client records.
     */
    interface Visitor {
        void visitVersion(Version message) throws ProtocolException;

        void visitAuthenticate(Authenticate message) throws ProtocolException;

        void visitNick(Nick message) throws ProtocolException;

        void visitChunkRequest(ChunkRequest message) throws ProtocolException;

        void visitBlockEdit(BlockEdit message) throws ProtocolException;

        void visitPosition(Position message) throws ProtocolException;

        void visitTalk(Talk message) throws ProtocolException;

        void visitDisconnect(Disconnect message) throws ProtocolException;
    }

    /**
     * {@code V,version}
     */
    record Version(int version) implements ClientMessage {
        @Override
        public Opcode opcode() {
            return Opcode.VERSION;
        }

        @Override
        public void writeFields(RecordWriter out) {
            out.add(version);
        }

        @Override
        public void accept(Visitor visitor) throws ProtocolException {
            visitor.visitVersion(this);
        }
    }

    /**
     * {@code A,username,token}. The token is carried but not verified.
     */
    record Authenticate(String username, String token) implements ClientMessage {
        @Override
        public Opcode opcode() {
            return Opcode.AUTHENTICATE;
        }

        @Override
        public void writeFields(RecordWriter out) {
            out.add(username).add(token);
        }

        @Override
        public void accept(Visitor visitor) throws ProtocolException {
            visitor.visitAuthenticate(this);
        }
    }

    /**
     * {@code N,name}
     */
    record Nick(String name) implements ClientMessage {
        @Override
        public Opcode opcode() {
            return Opcode.NICK;
        }

        @Override
        public void writeFields(RecordWriter out) {
            out.add(name);
        }

        @Override
        public void accept(Visitor visitor) throws ProtocolException {
            visitor.visitNick(this);
        }
    }

    /**
     * {@code C,p,q,key}; {@code key} is the chunk revision the client already
     * holds, 0 for none.
     */
    record ChunkRequest(int p, int q, int key) implements ClientMessage {
        @Override
        public Opcode opcode() {
            return Opcode.CHUNK;
        }

        @Override
        public void writeFields(RecordWriter out) {
            out.add(p).add(q).add(key);
        }

        @Override
        public void accept(Visitor visitor) throws ProtocolException {
            visitor.visitChunkRequest(this);
        }
    }

    /**
     * {@code B,x,y,z,w}. The long form {@code B,p,q,x,y,z,w} decodes to the
     * same record; the server derives the chunk itself.
     */
    record BlockEdit(int x, int y, int z, int material) implements ClientMessage {
        @Override
        public Opcode opcode() {
            return Opcode.BLOCK;
        }

        @Override
        public void writeFields(RecordWriter out) {
            out.add(x).add(y).add(z).add(material);
        }

        @Override
        public void accept(Visitor visitor) throws ProtocolException {
            visitor.visitBlockEdit(this);
        }
    }

    /**
     * {@code P,x,y,z,rx,ry}
     */
    record Position(Pose pose) implements ClientMessage {
        @Override
        public Opcode opcode() {
            return Opcode.POSITION;
        }

        @Override
        public void writeFields(RecordWriter out) {
            out.add(pose.x()).add(pose.y()).add(pose.z()).add(pose.rx()).add(pose.ry());
        }

        @Override
        public void accept(Visitor visitor) throws ProtocolException {
            visitor.visitPosition(this);
        }
    }

    /**
     * {@code T,text}; the text may itself contain commas.
     */
    record Talk(String text) implements ClientMessage {
        @Override
        public Opcode opcode() {
            return Opcode.TALK;
        }

        @Override
        public void writeFields(RecordWriter out) {
            out.add(text);
        }

        @Override
        public void accept(Visitor visitor) throws ProtocolException {
            visitor.visitTalk(this);
        }
    }

    /**
     * {@code D}: the client is leaving.
     */
    record Disconnect() implements ClientMessage {
        @Override
        public Opcode opcode() {
            return Opcode.DISCONNECT;
        }

        @Override
        public void writeFields(RecordWriter out) {
        }

        @Override
        public void accept(Visitor visitor) throws ProtocolException {
            visitor.visitDisconnect(this);
        }
    }
}
