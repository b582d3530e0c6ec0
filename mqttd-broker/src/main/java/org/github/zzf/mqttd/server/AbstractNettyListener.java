package org.github.zzf.mqttd.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.util.concurrent.DefaultThreadFactory;
import java.net.SocketAddress;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.github.zzf.mqttd.protocol.server.CloseFn;
import org.github.zzf.mqttd.protocol.server.EstablishFn;
import org.github.zzf.mqttd.protocol.server.Listener;
import org.github.zzf.mqttd.protocol.server.ListenerException;
import org.slf4j.Logger;

/**
 * An MQTT listener on a Netty server channel. The port is bound in {@link #init(Logger)}, so a port already in use
 * is reported when the listener is added to the server; connections accepted before {@link #serve(EstablishFn)} are
 * dropped.
 */
public abstract class AbstractNettyListener implements Listener {

    static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    protected final ListenerConfig config;
    private final int workerThreadNum;
    private final AtomicBoolean end = new AtomicBoolean();

    private Logger log;
    private NioEventLoopGroup bossGroup;
    private NioEventLoopGroup workerGroup;
    private Channel serverChannel;
    private volatile EstablishFn establish;

    protected AbstractNettyListener(ListenerConfig config, int workerThreadNum) {
        this.config = config;
        this.workerThreadNum = workerThreadNum;
    }

    /**
     * handlers in front of the MQTT codec: TLS, websocket
     */
    protected abstract void initTransport(SocketChannel ch);

    @Override
    public String id() {
        return config.getId();
    }

    @Override
    public String address() {
        return config.getAddress();
    }

    @Override
    public void init(Logger log) {
        this.log = log;
        bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory(id() + "-boss"));
        workerGroup = new NioEventLoopGroup(workerThreadNum, new DefaultThreadFactory(id() + "-worker"));
        ServerBootstrap bootstrap = new ServerBootstrap()
            .group(bossGroup, workerGroup)
            .channel(NioServerSocketChannel.class)
            .handler(new LoggingHandler(LogLevel.DEBUG))
            .childHandler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch) {
                    EstablishFn fn = establish;
                    if (fn == null || end.get()) {
                        ch.close();
                        return;
                    }
                    initTransport(ch);
                    fn.establish(id(), ch);
                }
            });
        if (config.getBufferSize() > 0) {
            bootstrap.childOption(ChannelOption.SO_RCVBUF, config.getBufferSize())
                .childOption(ChannelOption.SO_SNDBUF, config.getBufferSize());
        }
        try {
            serverChannel = bootstrap.bind(config.socketAddress()).sync().channel();
            log.info("{} listener({}) bound at {}", protocol(), id(), serverChannel.localAddress());
        } catch (Exception e) {
            bossGroup.shutdownGracefully();
            workerGroup.shutdownGracefully();
            throw new ListenerException(protocol() + " listener(" + id() + ") bind " + address() + " failed", e);
        }
    }

    @Override
    public void serve(EstablishFn establish) {
        this.establish = establish;
        serverChannel.closeFuture().syncUninterruptibly();
        log.info("{} listener({}) stopped serving", protocol(), id());
    }

    @Override
    public void close(CloseFn closeClients) {
        if (!end.compareAndSet(false, true)) {
            return;
        }
        if (serverChannel == null) {
            closeClients.closeClients(id());
            return;
        }
        // stop accepting before the live clients are dropped
        if (!serverChannel.close().awaitUninterruptibly(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
            log.error("{} listener({}) did not close in {}s", protocol(), id(), SHUTDOWN_TIMEOUT_SECONDS);
        }
        closeClients.closeClients(id());
        bossGroup.shutdownGracefully(0, SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        workerGroup.shutdownGracefully(0, SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    /**
     * the bound address, useful when the configured port is 0
     */
    public SocketAddress localAddress() {
        return serverChannel == null ? null : serverChannel.localAddress();
    }

}
