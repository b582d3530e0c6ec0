package org.github.zzf.mqttd.protocol.server;

import io.netty.channel.Channel;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.Builder;
import lombok.Data;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * A connected client as seen by the broker.
 */
@Getter
public class Client {

    public static final String INLINE_ID = "inline";
    public static final String LOCAL_LISTENER = "local";

    private final String id;
    private final String listener;
    private final String remote;
    private final String username;
    private final int protocolVersion;
    private final boolean cleanSession;
    private final int keepAlive;
    private final long connectedAt;
    /* null for the inline client */
    private final Channel channel;
    private final ConcurrentMap<String, Subscription> subscriptions = new ConcurrentHashMap<>();

    @Builder
    public Client(String id, String listener, String remote, String username,
        int protocolVersion, boolean cleanSession, int keepAlive, Channel channel) {
        this.id = id;
        this.listener = listener;
        this.remote = remote;
        this.username = username == null ? "" : username;
        this.protocolVersion = protocolVersion;
        this.cleanSession = cleanSession;
        this.keepAlive = keepAlive;
        this.channel = channel;
        this.connectedAt = System.currentTimeMillis();
    }

    public static Client inline() {
        return Client.builder()
            .id(INLINE_ID)
            .listener(LOCAL_LISTENER)
            .remote(LOCAL_LISTENER)
            .protocolVersion(5)
            .cleanSession(true)
            .build();
    }

    public boolean isInline() {
        return INLINE_ID.equals(id) || LOCAL_LISTENER.equals(listener);
    }

    public Subscription subscribe(Subscription subscription) {
        return subscriptions.put(subscription.topicFilter(), subscription);
    }

    public Subscription unsubscribe(String topicFilter) {
        return subscriptions.remove(topicFilter);
    }

    public Snapshot snapshot() {
        Map<String, Integer> subs = new LinkedHashMap<>();
        subscriptions.values().forEach(s -> subs.put(s.topicFilter(), s.qos()));
        return new Snapshot()
            .setId(id)
            .setListener(listener)
            .setRemote(remote)
            .setUsername(username)
            .setProtocolVersion(protocolVersion)
            .setCleanSession(cleanSession)
            .setKeepAlive(keepAlive)
            .setConnectedAt(connectedAt)
            .setSubscriptions(subs);
    }

    @Override
    public String toString() {
        return "Client{id='" + id + "', listener='" + listener + "', remote='" + remote + "', username='" + username + "'}";
    }

    /**
     * JSON view of a client, without the channel
     */
    @Data
    @Accessors(chain = true)
    public static class Snapshot {

        private String id;
        private String listener;
        private String remote;
        private String username;
        private int protocolVersion;
        private boolean cleanSession;
        private int keepAlive;
        private long connectedAt;
        private Map<String, Integer> subscriptions;

    }

}
