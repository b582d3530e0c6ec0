package org.github.zzf.mqttd.server.http;

/**
 * CREATED -> INITIALIZED -> SERVING -> CLOSED. CLOSED is terminal and may be entered from any state.
 */
public enum ListenerState {
    CREATED,
    INITIALIZED,
    SERVING,
    CLOSED,
}
