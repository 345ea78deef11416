package io.liparakis.craftis.protocol;

import io.liparakis.craftis.player.Pose;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageCodecTest {

    private final MessageCodec codec = new MessageCodec();

    // ========== Encoding ==========

    @Test
    void encodesServerRecordsInWireOrder() {
        assertThat(codec.encode(new ServerMessage.You(1, new Pose(0, 0, 0, 0, 0))))
                .isEqualTo("U,1,0.0,0.0,0.0,0.0,0.0");
        assertThat(codec.encode(new ServerMessage.PlayerPosition(2, new Pose(1.5f, 2, -3, 0.25f, 0))))
                .isEqualTo("P,2,1.5,2.0,-3.0,0.25,0.0");
        assertThat(codec.encode(new ServerMessage.BlockUpdate(0, -1, 5, 10, -3, 4)))
                .isEqualTo("B,0,-1,5,10,-3,4");
        assertThat(codec.encode(new ServerMessage.ChunkKey(3, 4, 17))).isEqualTo("K,3,4,17");
        assertThat(codec.encode(new ServerMessage.Redraw(3, 4))).isEqualTo("R,3,4");
        assertThat(codec.encode(new ServerMessage.PlayerName(7, "guest7"))).isEqualTo("N,7,guest7");
        assertThat(codec.encode(new ServerMessage.PlayerLeft(7))).isEqualTo("D,7");
        assertThat(codec.encode(new ServerMessage.Time(1700000000L, 600))).isEqualTo("E,1700000000,600");
    }

    @Test
    void talkKeepsCommasAndStripsLineBreaks() {
        assertThat(codec.encode(new ServerMessage.Talk("a> hi, there\nsecond")))
                .isEqualTo("T,a> hi, there second");
    }

    @Test
    void toWireAppendsTerminator() {
        byte[] wire = codec.toWire(new ServerMessage.Redraw(0, 0));

        assertThat(new String(wire, StandardCharsets.UTF_8)).isEqualTo("R,0,0\n");
    }

    @Test
    void onlyPositionSuppressesEcho() {
        assertThat(new ServerMessage.PlayerPosition(1, Pose.ORIGIN).suppressEcho()).isTrue();
        assertThat(new ServerMessage.Talk("x").suppressEcho()).isFalse();
        assertThat(new ServerMessage.BlockUpdate(0, 0, 0, 0, 0, 1).suppressEcho()).isFalse();
    }

    // ========== Client Decoding ==========

    @Test
    void decodesShortAndLongBlockForms() throws ProtocolException {
        assertThat(codec.decodeClient("B,5,10,-3,4"))
                .isEqualTo(new ClientMessage.BlockEdit(5, 10, -3, 4));
        assertThat(codec.decodeClient("B,99,99,5,10,-3,4"))
                .isEqualTo(new ClientMessage.BlockEdit(5, 10, -3, 4));
    }

    @Test
    void decodesChunkRequestWithAndWithoutKey() throws ProtocolException {
        assertThat(codec.decodeClient("C,1,-2")).isEqualTo(new ClientMessage.ChunkRequest(1, -2, 0));
        assertThat(codec.decodeClient("C,1,-2,12")).isEqualTo(new ClientMessage.ChunkRequest(1, -2, 12));
    }

    @Test
    void decodesPositionTalkNickAndControlRecords() throws ProtocolException {
        assertThat(codec.decodeClient("P,1.5,2,3,0.1,-0.2"))
                .isEqualTo(new ClientMessage.Position(new Pose(1.5f, 2, 3, 0.1f, -0.2f)));
        assertThat(codec.decodeClient("T,hello, world")).isEqualTo(new ClientMessage.Talk("hello, world"));
        assertThat(codec.decodeClient("T,")).isEqualTo(new ClientMessage.Talk(""));
        assertThat(codec.decodeClient("N, alice ")).isEqualTo(new ClientMessage.Nick("alice"));
        assertThat(codec.decodeClient("A,bob,secret")).isEqualTo(new ClientMessage.Authenticate("bob", "secret"));
        assertThat(codec.decodeClient("V,1")).isEqualTo(new ClientMessage.Version(1));
        assertThat(codec.decodeClient("D")).isEqualTo(new ClientMessage.Disconnect());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "Z,1,2",
            "BB,1,2,3,4",
            "B,1,2,3",
            "B,1,2,3,x",
            "B,1,2,3,4,5",
            "C,1",
            "C,1,2,3,4",
            "P,1,2,3,4",
            "P,1,2,3,4,NaN",
            "P,1,2,3,4,Infinity",
            "N,",
            "N,   ",
            "N,a,b",
            "T",
            "D,1",
            "B,99999999999,0,0,1",
            "U,1,0,0,0,0,0",
            "K,0,0,1"
    })
    void rejectsMalformedOrServerOnlyRecords(String record) {
        assertThatThrownBy(() -> codec.decodeClient(record))
                .isInstanceOf(ProtocolException.class);
    }

    @Test
    void rejectsOverlongName() {
        String name = "n".repeat(MessageCodec.MAX_NAME_LENGTH + 1);

        assertThatThrownBy(() -> codec.decodeClient("N," + name))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("Name longer");
    }

    @Test
    void protocolExceptionNamesTheRecord() {
        assertThatThrownBy(() -> codec.decodeClient("Q,garbage"))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("Q,garbage")
                .satisfies(e -> assertThat(((ProtocolException) e).record()).isEqualTo("Q,garbage"));
    }

    // ========== Server Decoding ==========

    @Test
    void decodesWhatItEncodes() throws ProtocolException {
        ServerMessage[] messages = {
                new ServerMessage.You(3, new Pose(1, 2, 3, 0.5f, 0.25f)),
                new ServerMessage.PlayerPosition(4, new Pose(-1, 0, 9, 0, 0)),
                new ServerMessage.BlockUpdate(0, 0, 1, 2, 3, 4),
                new ServerMessage.ChunkKey(1, 1, 99),
                new ServerMessage.Redraw(1, 1),
                new ServerMessage.Talk("x> y, z"),
                new ServerMessage.PlayerName(4, "carol"),
                new ServerMessage.PlayerLeft(4),
                new ServerMessage.Time(12345L, 600)
        };
        for (ServerMessage message : messages) {
            assertThat(codec.decodeServer(codec.encode(message))).isEqualTo(message);
        }
    }

    @Test
    void serverDecodingRejectsClientOnlyRecords() {
        assertThatThrownBy(() -> codec.decodeServer("C,0,0")).isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> codec.decodeServer("V,1")).isInstanceOf(ProtocolException.class);
    }
}
