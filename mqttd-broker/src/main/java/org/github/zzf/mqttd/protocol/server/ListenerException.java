package org.github.zzf.mqttd.protocol.server;

/**
 * A listener or hook could not be initialised or bound.
 */
public class ListenerException extends RuntimeException {

    public ListenerException(String message) {
        super(message);
    }

    public ListenerException(String message, Throwable cause) {
        super(message, cause);
    }

}
