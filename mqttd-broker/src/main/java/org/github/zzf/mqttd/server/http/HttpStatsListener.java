package org.github.zzf.mqttd.server.http;

import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.serializer.SerializerFeature;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.Future;
import java.net.SocketAddress;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.github.zzf.mqttd.protocol.server.Client;
import org.github.zzf.mqttd.protocol.server.Clients;
import org.github.zzf.mqttd.protocol.server.CloseFn;
import org.github.zzf.mqttd.protocol.server.EstablishFn;
import org.github.zzf.mqttd.protocol.server.Listener;
import org.github.zzf.mqttd.protocol.server.ListenerException;
import org.github.zzf.mqttd.protocol.server.SystemInfo;
import org.github.zzf.mqttd.server.ListenerConfig;
import org.github.zzf.mqttd.server.metric.ProcessRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The control plane: a listener serving read-only broker diagnostics over HTTP(S), every page behind Basic-Auth.
 *
 * <ul>
 *     <li>/information     broker counters as JSON</li>
 *     <li>/connections     HTML table of the connected clients</li>
 *     <li>/clientsrawdata  one JSON document per client and line</li>
 *     <li>/processrecords  JVM / process samples as JSON</li>
 * </ul>
 * <p>
 * {@link #close(CloseFn)} may be called any number of times from any thread, only the first call shuts the server
 * down and closes the clients.
 */
public class HttpStatsListener implements Listener {

    public static final String PATH_INFORMATION = "/information";
    public static final String PATH_CONNECTIONS = "/connections";
    public static final String PATH_CLIENTS_RAW_DATA = "/clientsrawdata";
    public static final String PATH_PROCESS_RECORDS = "/processrecords";

    static final int TIMEOUT_SECONDS = 5;
    static final int MAX_CONTENT_LENGTH = 64 * 1024;

    private final ListenerConfig config;
    private final SystemInfo sysInfo;
    private final Clients clientsInfo;
    private final StatsOptions options;
    private final AtomicReference<ListenerState> state = new AtomicReference<>(ListenerState.CREATED);

    private Logger log = LoggerFactory.getLogger(HttpStatsListener.class);
    private ProcessRecorder recorder;
    private NioEventLoopGroup bossGroup;
    private NioEventLoopGroup workerGroup;
    private ServerBootstrap bootstrap;
    private volatile Channel serverChannel;

    public HttpStatsListener(ListenerConfig config, SystemInfo sysInfo, Clients clientsInfo, StatsOptions options) {
        this.config = config;
        this.sysInfo = sysInfo;
        this.clientsInfo = clientsInfo;
        this.options = options;
    }

    @Override
    public String id() {
        return config.getId();
    }

    @Override
    public String address() {
        return config.getAddress();
    }

    @Override
    public String protocol() {
        return config.isSecure() ? "https" : "http";
    }

    public ListenerState state() {
        return state.get();
    }

    @Override
    public void init(Logger log) {
        if (log != null) {
            this.log = log;
        }
        if (!state.compareAndSet(ListenerState.CREATED, ListenerState.INITIALIZED)) {
            throw new ListenerException("listener(" + id() + ") can not be initialised in state " + state.get());
        }
        try {
            recorder = ProcessRecorder.builder().appName(options.getAppName()).build().start();
            ControlPlaneHandler handler = new ControlPlaneHandler(routes());
            bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory(id() + "-boss"));
            workerGroup = new NioEventLoopGroup(1, new DefaultThreadFactory(id() + "-worker"));
            bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .handler(new LoggingHandler(LogLevel.DEBUG))
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        if (config.isSecure()) {
                            ch.pipeline().addLast(config.getSslContext().newHandler(ch.alloc()));
                        }
                        ch.pipeline()
                            .addLast(new ReadTimeoutHandler(TIMEOUT_SECONDS))
                            .addLast(new WriteTimeoutHandler(TIMEOUT_SECONDS))
                            .addLast(new HttpServerCodec())
                            .addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH))
                            .addLast(handler);
                    }
                });
        } catch (RuntimeException e) {
            state.set(ListenerState.CLOSED);
            releaseResources();
            throw new ListenerException("listener(" + id() + ") init failed", e);
        }
    }

    Map<String, Endpoint> routes() {
        boolean required = options.isAuthRequired();
        Map<String, String> credentials = options.getCredentials();
        if (required && credentials.isEmpty()) {
            log.warn("listener({}) has no credentials, every request will be refused", id());
        }
        Map<String, Endpoint> routes = new LinkedHashMap<>(8);
        routes.put(PATH_INFORMATION, new BasicAuth(required, credentials, this::infoHandler));
        routes.put(PATH_CONNECTIONS, new BasicAuth(required, credentials, this::clientHandler));
        routes.put(PATH_CLIENTS_RAW_DATA, new BasicAuth(required, credentials, this::debugHandler));
        routes.put(PATH_PROCESS_RECORDS, new BasicAuth(required, credentials, this::processHandler));
        return routes;
    }

    /**
     * binds and blocks until the listener is closed
     */
    @Override
    public void serve(EstablishFn establish) {
        if (!state.compareAndSet(ListenerState.INITIALIZED, ListenerState.SERVING)) {
            if (state.get() != ListenerState.CLOSED) {
                log.error("listener({}) can not serve in state {}", id(), state.get());
            }
            return;
        }
        try {
            Channel ch = bootstrap.bind(config.socketAddress()).sync().channel();
            serverChannel = ch;
            // closed while binding
            if (state.get() == ListenerState.CLOSED) {
                ch.close();
            }
            else {
                log.info("{} listener({}) serving at {}", protocol(), id(), ch.localAddress());
            }
            ch.closeFuture().sync();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failed(e);
        } catch (Exception e) {
            failed(e);
        }
    }

    /**
     * after the listener has been shut down, a serve error is the expected result of the shutdown
     */
    private void failed(Exception e) {
        if (state.get() != ListenerState.CLOSED) {
            log.error("failed to serve. listener: {}", id(), e);
        }
    }

    @Override
    public void close(CloseFn closeClients) {
        ListenerState cur;
        do {
            cur = state.get();
            if (cur == ListenerState.CLOSED) {
                return;
            }
        } while (!state.compareAndSet(cur, ListenerState.CLOSED));
        Channel ch = serverChannel;
        if (ch != null && !ch.close().awaitUninterruptibly(TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
            log.error("listener({}) server channel did not close in {}s", id(), TIMEOUT_SECONDS);
        }
        releaseResources();
        closeClients.closeClients(id());
    }

    private void releaseResources() {
        if (recorder != null) {
            recorder.close();
        }
        shutdown(bossGroup);
        shutdown(workerGroup);
    }

    private void shutdown(NioEventLoopGroup group) {
        if (group == null) {
            return;
        }
        Future<?> f = group.shutdownGracefully(0, TIMEOUT_SECONDS, TimeUnit.SECONDS);
        if (!f.awaitUninterruptibly(TIMEOUT_SECONDS + 1, TimeUnit.SECONDS)) {
            log.error("listener({}) event loop did not terminate in {}s, abandon it", id(), TIMEOUT_SECONDS);
        }
    }

    /**
     * the bound address, null until serving
     */
    public SocketAddress localAddress() {
        Channel ch = serverChannel;
        return ch == null ? null : ch.localAddress();
    }

    FullHttpResponse infoHandler(FullHttpRequest req) {
        String json = JSON.toJSONString(sysInfo.snapshot(), SerializerFeature.PrettyFormat);
        return Responses.ok(Responses.APPLICATION_JSON, json);
    }

    FullHttpResponse clientHandler(FullHttpRequest req) {
        ConnectionTable table = ConnectionTable.of(clientsInfo.getAll());
        String html = ConnectionsPage.render(table, sysInfo.uptime(), options.getListeners());
        return Responses.ok(Responses.TEXT_HTML, html);
    }

    FullHttpResponse debugHandler(FullHttpRequest req) {
        StringBuilder sb = new StringBuilder();
        for (Client c : clientsInfo.getAll()) {
            sb.append(JSON.toJSONString(c.snapshot())).append('\n');
        }
        return Responses.ok(Responses.APPLICATION_NDJSON, sb.toString());
    }

    FullHttpResponse processHandler(FullHttpRequest req) {
        String json = JSON.toJSONString(recorder.records(), SerializerFeature.PrettyFormat);
        return Responses.ok(Responses.APPLICATION_JSON, json);
    }

}
