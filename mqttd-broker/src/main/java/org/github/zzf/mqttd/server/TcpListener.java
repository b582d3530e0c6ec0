package org.github.zzf.mqttd.server;

import io.netty.channel.socket.SocketChannel;

/**
 * MQTT over TCP, or over TLS when the config carries an SslContext.
 */
public class TcpListener extends AbstractNettyListener {

    public TcpListener(ListenerConfig config, int workerThreadNum) {
        super(config, workerThreadNum);
    }

    @Override
    public String protocol() {
        return "tcp";
    }

    @Override
    protected void initTransport(SocketChannel ch) {
        if (config.isSecure()) {
            ch.pipeline().addLast(config.getSslContext().newHandler(ch.alloc()));
        }
    }

}
