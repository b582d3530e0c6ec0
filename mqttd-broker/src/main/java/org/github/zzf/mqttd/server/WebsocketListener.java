package org.github.zzf.mqttd.server;

import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketServerCompressionHandler;

/**
 * MQTT over WebSocket (wss when the config carries an SslContext).
 */
public class WebsocketListener extends AbstractNettyListener {

    static final String SUB_PROTOCOLS = "mqtt,mqttv3.1";
    static final int MAX_FRAME_SIZE = 65536;

    private final String websocketPath;

    public WebsocketListener(ListenerConfig config, int workerThreadNum, String websocketPath) {
        super(config, workerThreadNum);
        this.websocketPath = websocketPath;
    }

    @Override
    public String protocol() {
        return config.isSecure() ? "wss" : "ws";
    }

    @Override
    protected void initTransport(SocketChannel ch) {
        if (config.isSecure()) {
            ch.pipeline().addLast(config.getSslContext().newHandler(ch.alloc()));
        }
        ch.pipeline()
            // http handler
            .addLast(new HttpServerCodec())
            .addLast(new HttpObjectAggregator(MAX_FRAME_SIZE))
            // websocket handler, any path below websocketPath
            .addLast(new WebSocketServerCompressionHandler())
            .addLast(new WebSocketServerProtocolHandler(websocketPath, SUB_PROTOCOLS, true, MAX_FRAME_SIZE, false, true))
            // inbound:     BinaryWebSocketFrame -> ByteBuf
            // outbound:    ByteBuf -> BinaryWebSocketFrame
            .addLast(new WebSocketFrameCodec())
        ;
    }

}
