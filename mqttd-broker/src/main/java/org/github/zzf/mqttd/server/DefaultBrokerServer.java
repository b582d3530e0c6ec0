package org.github.zzf.mqttd.server;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.handler.codec.mqtt.MqttDecoder;
import io.netty.handler.codec.mqtt.MqttEncoder;
import io.netty.handler.codec.mqtt.MqttMessageBuilders;
import io.netty.handler.codec.mqtt.MqttQoS;
import io.netty.util.concurrent.DefaultThreadFactory;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.mqttd.auth.TopicFilter;
import org.github.zzf.mqttd.protocol.server.AuthHook;
import org.github.zzf.mqttd.protocol.server.BrokerServer;
import org.github.zzf.mqttd.protocol.server.Client;
import org.github.zzf.mqttd.protocol.server.Clients;
import org.github.zzf.mqttd.protocol.server.InlineSubFn;
import org.github.zzf.mqttd.protocol.server.Listener;
import org.github.zzf.mqttd.protocol.server.ListenerException;
import org.github.zzf.mqttd.protocol.server.Subscription;
import org.github.zzf.mqttd.protocol.server.SystemInfo;

/**
 * Hosts the listeners, the auth hook and the client registry.
 *
 * <p>Messages are delivered at most once: every subscription is granted QoS 0, there are no retained messages and
 * no persistent sessions.</p>
 */
@Slf4j
public class DefaultBrokerServer implements BrokerServer {

    static final long LISTENER_SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final Map<String, Listener> listeners = new LinkedHashMap<>(8);
    private final Clients clients = new Clients();
    private final SystemInfo info;
    @Getter
    private final Options options;
    private final ExecutorService executor = Executors.newCachedThreadPool(new DefaultThreadFactory("listener"));
    private final AtomicBoolean closed = new AtomicBoolean();
    private final Client inlineClient;
    private volatile AuthHook authHook;

    public DefaultBrokerServer(Options options) {
        this.options = options;
        this.info = new SystemInfo(options.version);
        if (options.inlineClient) {
            this.inlineClient = Client.inline();
            clients.add(inlineClient);
        }
        else {
            this.inlineClient = null;
        }
    }

    @Override
    public synchronized void addHook(AuthHook hook) {
        if (hook == null) {
            throw new ListenerException("auth hook is null");
        }
        if (authHook != null) {
            throw new ListenerException("auth hook already installed: " + authHook.id());
        }
        authHook = hook;
        log.info("auth hook installed: {}", hook.id());
    }

    @Override
    public synchronized void addListener(Listener listener) {
        if (closed.get()) {
            throw new ListenerException("server is closed");
        }
        if (listeners.containsKey(listener.id())) {
            throw new ListenerException("listener id already exists: " + listener.id());
        }
        listener.init(log);
        listeners.put(listener.id(), listener);
        log.info("listener added: {} {}://{}", listener.id(), listener.protocol(), listener.address());
    }

    @Override
    public synchronized void serve() {
        if (authHook == null) {
            throw new ListenerException("no auth hook installed, refuse to serve");
        }
        for (Listener l : listeners.values()) {
            executor.execute(() -> l.serve(this::establish));
        }
        log.info("broker serving on {} listener(s): {}", listeners.size(), listeners.keySet());
    }

    /**
     * installs the MQTT handlers on a connection accepted by a listener
     */
    void establish(String listenerId, Channel channel) {
        channel.pipeline()
            .addLast(new MqttDecoder(options.maxPacketSize))
            .addLast(MqttEncoder.INSTANCE)
            .addLast(MqttSessionHandler.HANDLER_NAME, new MqttSessionHandler(this, listenerId));
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        List<Listener> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(listeners.values());
        }
        for (Listener l : snapshot) {
            log.info("close listener: {}", l.id());
            l.close(this::closeClients);
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(LISTENER_SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.error("listeners did not stop in {}s, abandon them", LISTENER_SHUTDOWN_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("broker closed");
    }

    void closeClients(String listenerId) {
        for (Client c : clients.getByListener(listenerId)) {
            if (c.getChannel() != null) {
                c.getChannel().close();
            }
        }
    }

    @Override
    public Clients clients() {
        return clients;
    }

    @Override
    public SystemInfo info() {
        return info;
    }

    AuthHook authHook() {
        return authHook;
    }

    @Override
    public void publish(String topic, byte[] payload, boolean retain, int qos) {
        requireInlineClient();
        if (!TopicFilter.isTopicName(topic)) {
            throw new IllegalArgumentException("not a topic name: " + topic);
        }
        info.messageReceived();
        route(inlineClient, topic, payload);
    }

    @Override
    public void subscribe(String topicFilter, int subscriptionId, InlineSubFn handler) {
        requireInlineClient();
        TopicFilter.validate(topicFilter);
        if (inlineClient.subscribe(new Subscription(topicFilter, 0, subscriptionId, handler)) == null) {
            info.subscriptionAdded();
        }
    }

    @Override
    public void unsubscribe(String topicFilter, int subscriptionId) {
        requireInlineClient();
        if (inlineClient.unsubscribe(topicFilter) != null) {
            info.subscriptionRemoved(1);
        }
    }

    private void requireInlineClient() {
        if (inlineClient == null) {
            throw new IllegalStateException("inline client is disabled");
        }
    }

    /**
     * delivers a message once to every client holding a matching subscription
     */
    void route(Client from, String topic, byte[] payload) {
        for (Client c : clients.getAll()) {
            for (Subscription s : c.getSubscriptions().values()) {
                if (!TopicFilter.matches(s.topicFilter(), topic)) {
                    continue;
                }
                deliver(c, s, topic, payload);
                break;
            }
        }
    }

    private void deliver(Client to, Subscription s, String topic, byte[] payload) {
        if (s.handler() != null) {
            try {
                s.handler().onMessage(to, s, topic, payload);
                info.messageSent();
            } catch (RuntimeException e) {
                log.error("inline subscription({}) handler failed on topic {}", s.topicFilter(), topic, e);
            }
            return;
        }
        Channel ch = to.getChannel();
        if (ch == null || !ch.isActive()) {
            info.messageDropped();
            return;
        }
        ch.writeAndFlush(MqttMessageBuilders.publish()
                .topicName(topic)
                .qos(MqttQoS.AT_MOST_ONCE)
                .retained(false)
                .payload(Unpooled.wrappedBuffer(payload))
                .build())
            .addListener(f -> {
                if (f.isSuccess()) {
                    info.messageSent();
                    info.packetSent();
                }
                else {
                    info.messageDropped();
                    log.debug("Client({}) publish {} failed", to.getId(), topic, f.cause());
                }
            });
    }

    @Builder
    public static class Options {

        @Builder.Default
        final String version = "1.0.0";
        @Builder.Default
        final int maxPacketSize = 256 * 1024;
        /* seconds a connection may stay without sending CONNECT */
        @Builder.Default
        final int connectTimeoutSecond = 5;
        final boolean inlineClient;

    }

}
