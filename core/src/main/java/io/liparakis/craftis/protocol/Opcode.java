package io.liparakis.craftis.protocol;

import org.jetbrains.annotations.Nullable;

/**
 * First field of every Craft protocol record.
 */
public enum Opcode {
    AUTHENTICATE('A'),
    BLOCK('B'),
    CHUNK('C'),
    DISCONNECT('D'),
    TIME('E'),
    KEY('K'),
    NICK('N'),
    POSITION('P'),
    REDRAW('R'),
    TALK('T'),
    YOU('U'),
    VERSION('V');

    private static final Opcode[] BY_CODE = new Opcode[128];

    static {
        for (Opcode opcode : values()) {
            BY_CODE[opcode.code] = opcode;
        }
    }

    private final char code;

    Opcode(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }

    /**
     * @return the opcode for a wire token, or {@code null} if unknown
     */
    public static @Nullable Opcode fromToken(String token) {
        if (token.length() != 1) {
            return null;
        }
        char c = token.charAt(0);
        return c < BY_CODE.length ? BY_CODE[c] : null;
    }
}
