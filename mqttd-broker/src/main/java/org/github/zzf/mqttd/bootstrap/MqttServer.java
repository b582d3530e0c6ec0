package org.github.zzf.mqttd.bootstrap;

import io.netty.handler.ssl.SslContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.mqttd.auth.AllowAllAuthHook;
import org.github.zzf.mqttd.auth.LedgerAuthHook;
import org.github.zzf.mqttd.protocol.server.AuthHook;
import org.github.zzf.mqttd.protocol.server.BrokerServer;
import org.github.zzf.mqttd.protocol.server.InlineSubFn;
import org.github.zzf.mqttd.protocol.server.Listener;
import org.github.zzf.mqttd.server.DefaultBrokerServer;
import org.github.zzf.mqttd.server.ListenerConfig;
import org.github.zzf.mqttd.server.TcpListener;
import org.github.zzf.mqttd.server.WebsocketListener;
import org.github.zzf.mqttd.server.http.HttpStatsListener;
import org.github.zzf.mqttd.server.http.StatsOptions;

/**
 * Assembles the broker: the auth hook first (a failure there aborts the start), then the mqtt+tls, mqtt, ws and web
 * listeners. A listener that fails to come up is logged and left out, the others keep serving.
 */
@Slf4j
public class MqttServer {

    public static final String LISTENER_TLS = "mqtt+tls";
    public static final String LISTENER_MQTT = "mqtt";
    public static final String LISTENER_WS = "ws";
    public static final String LISTENER_WEB = "web";

    private final ServerOptions opt;
    private final BrokerServer svr;
    private final AtomicBoolean running = new AtomicBoolean();
    private final CountDownLatch stopped = new CountDownLatch(1);
    /* listener id -> address, in registration order */
    private final Map<String, String> listened = Collections.synchronizedMap(new LinkedHashMap<>(8));

    public MqttServer(ServerOptions opt) {
        this(opt, null);
    }

    MqttServer(ServerOptions opt, BrokerServer svr) {
        opt.ensureDefaults();
        this.opt = opt;
        this.svr = svr != null ? svr : new DefaultBrokerServer(DefaultBrokerServer.Options.builder()
            .version(opt.getVersion())
            .inlineClient(opt.isInlineClient())
            .build());
    }

    /**
     * @throws RuntimeException if the auth hook can not be installed or the broker refuses to serve
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("server already started");
        }
        AuthHook hook = opt.isDisableAuth() ? new AllowAllAuthHook() : new LedgerAuthHook(opt.getAuthConfig());
        try {
            svr.addHook(hook);
        } catch (RuntimeException e) {
            log.error("config auth failed, server will not start", e);
            running.set(false);
            throw e;
        }
        if (opt.isDisableAuth()) {
            log.warn("authentication disabled, any client may connect");
        }
        SslContext tls = loadTls();
        if (tls != null) {
            addListener(LISTENER_TLS, opt.getTlsAddr(), () -> new TcpListener(config(LISTENER_TLS, opt.getTlsAddr(), tls),
                opt.getWorkerThreadNum()));
        }
        else if (!opt.getTlsAddr().isEmpty()) {
            log.warn("no tls material, {} listener disabled", LISTENER_TLS);
        }
        addListener(LISTENER_MQTT, opt.getMqttAddr(), () -> new TcpListener(config(LISTENER_MQTT, opt.getMqttAddr(), null),
            opt.getWorkerThreadNum()));
        addListener(LISTENER_WS, opt.getWsAddr(), () -> new WebsocketListener(config(LISTENER_WS, opt.getWsAddr(), tls),
            opt.getWorkerThreadNum(), opt.getWsPath()));
        StatsOptions stats = StatsOptions.builder()
            .listeners(listenersText())
            .authRequired(!opt.isDisableAuth())
            .credentials(opt.isDisableAuth() ? Map.of() : opt.getAuthConfig().credentials())
            .appName(opt.getAppName())
            .build();
        SslContext webTls = opt.isWebTls() ? tls : null;
        addListener(LISTENER_WEB, opt.getWebAddr(), () -> new HttpStatsListener(config(LISTENER_WEB, opt.getWebAddr(), webTls),
            svr.info(), svr.clients(), stats));
        try {
            svr.serve();
        } catch (RuntimeException e) {
            log.error("broker failed to serve", e);
            running.set(false);
            throw e;
        }
        log.info("mqttd {} started -> {}", opt.getVersion(), listened);
    }

    private SslContext loadTls() {
        if (opt.getTlsConfig() != null) {
            return opt.getTlsConfig();
        }
        if (opt.getTlsAddr().isEmpty() && opt.getWsAddr().isEmpty() && !opt.isWebTls()) {
            return null;
        }
        try {
            return TlsContexts.fromFiles(opt.getCert(), opt.getKey(), opt.getRootCa());
        } catch (Exception e) {
            log.error("load tls material failed: {}", e.getMessage());
            log.debug("load tls material failed", e);
            return null;
        }
    }

    private ListenerConfig config(String id, String address, SslContext tls) {
        return ListenerConfig.builder()
            .id(id)
            .address(address)
            .sslContext(tls)
            .bufferSize(opt.getClientsBufferSize())
            .build();
    }

    private boolean addListener(String id, String address, Supplier<Listener> factory) {
        if (address.isEmpty()) {
            log.info("{} listener disabled", id);
            return false;
        }
        try {
            svr.addListener(factory.get());
            listened.put(id, address);
            return true;
        } catch (RuntimeException e) {
            log.error("{} service error, listener skipped: {}", id, e.getMessage());
            log.debug("{} service error", id, e);
            return false;
        }
    }

    String listenersText() {
        synchronized (listened) {
            return listened.entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining("; "));
        }
    }

    /**
     * the ids of the listeners that came up, in registration order
     */
    public List<String> listeners() {
        synchronized (listened) {
            return new ArrayList<>(listened.keySet());
        }
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            stopped.countDown();
            return;
        }
        log.info("mqttd stopping");
        try {
            svr.close();
        } finally {
            stopped.countDown();
        }
        log.info("mqttd stopped");
    }

    /**
     * starts the server and blocks until {@link #stop()}
     */
    public void run() throws InterruptedException {
        start();
        stopped.await();
    }

    public boolean isRunning() {
        return running.get();
    }

    public BrokerServer broker() {
        return svr;
    }

    public void publish(String topic, byte[] payload, int qos) {
        svr.publish(topic, payload, false, qos);
    }

    public void subscribe(String topicFilter, int subscriptionId, InlineSubFn handler) {
        svr.subscribe(topicFilter, subscriptionId, handler);
    }

    public void unsubscribe(String topicFilter, int subscriptionId) {
        svr.unsubscribe(topicFilter, subscriptionId);
    }

}
