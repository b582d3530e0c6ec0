package org.github.zzf.mqttd.protocol.server;

/**
 * @param identifier subscription identifier, 0 if none
 * @param handler    only set for subscriptions of the inline client
 */
public record Subscription(String topicFilter, int qos, int identifier, InlineSubFn handler) {

    public Subscription(String topicFilter, int qos) {
        this(topicFilter, qos, 0, null);
    }

}
