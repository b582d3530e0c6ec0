package org.github.zzf.mqttd.protocol.server;

/**
 * Receives the messages routed to a subscription of the inline client.
 */
@FunctionalInterface
public interface InlineSubFn {

    void onMessage(Client client, Subscription subscription, String topic, byte[] payload);

}
