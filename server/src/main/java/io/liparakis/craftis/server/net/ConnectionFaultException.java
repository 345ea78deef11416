package io.liparakis.craftis.server.net;

import java.io.IOException;

/**
 * A connection can no longer be served: its peer went away, stopped reading,
 * or stayed silent past the idle timeout. Handled by closing that connection.
 */
public class ConnectionFaultException extends IOException {

    public ConnectionFaultException(String message) {
        super(message);
    }

    public ConnectionFaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
