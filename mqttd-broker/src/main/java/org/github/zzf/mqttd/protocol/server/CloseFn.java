package org.github.zzf.mqttd.protocol.server;

/**
 * Disconnects the clients connected through the given listener.
 */
@FunctionalInterface
public interface CloseFn {

    void closeClients(String listenerId);

}
