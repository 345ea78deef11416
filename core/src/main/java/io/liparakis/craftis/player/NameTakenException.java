package io.liparakis.craftis.player;

/**
 * Thrown when a player asks for a display name another live player already
 * holds. Names compare ignoring case.
 */
public class NameTakenException extends IllegalArgumentException {
    private final String name;

    public NameTakenException(String name) {
        super("Name " + name + " is already taken");
        this.name = name;
    }

    public String name() {
        return name;
    }
}
