package org.github.zzf.mqttd.protocol.server;

/**
 * Consulted by the broker on every CONNECT, SUBSCRIBE and PUBLISH. Implementations are called concurrently from the
 * connection threads.
 */
public interface AuthHook {

    String id();

    boolean onConnectAuthenticate(Client client, byte[] password);

    /**
     * @param topic the topic name of a PUBLISH, or the topic filter of a SUBSCRIBE
     * @param write true for PUBLISH
     */
    boolean onAclCheck(Client client, String topic, boolean write);

}
