package org.github.zzf.mqttd.server;

import static io.netty.handler.codec.mqtt.MqttConnectReturnCode.CONNECTION_ACCEPTED;
import static io.netty.handler.codec.mqtt.MqttConnectReturnCode.CONNECTION_REFUSED_BAD_USERNAME_OR_PASSWORD;
import static io.netty.handler.codec.mqtt.MqttConnectReturnCode.CONNECTION_REFUSED_BAD_USER_NAME_OR_PASSWORD;
import static io.netty.handler.codec.mqtt.MqttConnectReturnCode.CONNECTION_REFUSED_CLIENT_IDENTIFIER_NOT_VALID;
import static io.netty.handler.codec.mqtt.MqttConnectReturnCode.CONNECTION_REFUSED_IDENTIFIER_REJECTED;
import static io.netty.handler.codec.mqtt.MqttMessageType.PINGRESP;
import static io.netty.handler.codec.mqtt.MqttMessageType.PUBACK;
import static io.netty.handler.codec.mqtt.MqttMessageType.PUBCOMP;
import static io.netty.handler.codec.mqtt.MqttMessageType.PUBREC;
import static io.netty.handler.codec.mqtt.MqttMessageType.SUBACK;
import static io.netty.handler.codec.mqtt.MqttMessageType.UNSUBACK;
import static io.netty.handler.codec.mqtt.MqttQoS.AT_MOST_ONCE;

import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.mqtt.MqttConnectMessage;
import io.netty.handler.codec.mqtt.MqttConnectReturnCode;
import io.netty.handler.codec.mqtt.MqttFixedHeader;
import io.netty.handler.codec.mqtt.MqttMessage;
import io.netty.handler.codec.mqtt.MqttMessageBuilders;
import io.netty.handler.codec.mqtt.MqttMessageIdVariableHeader;
import io.netty.handler.codec.mqtt.MqttMessageType;
import io.netty.handler.codec.mqtt.MqttPubAckMessage;
import io.netty.handler.codec.mqtt.MqttPublishMessage;
import io.netty.handler.codec.mqtt.MqttQoS;
import io.netty.handler.codec.mqtt.MqttSubAckMessage;
import io.netty.handler.codec.mqtt.MqttSubAckPayload;
import io.netty.handler.codec.mqtt.MqttSubscribeMessage;
import io.netty.handler.codec.mqtt.MqttTopicSubscription;
import io.netty.handler.codec.mqtt.MqttUnsubAckMessage;
import io.netty.handler.codec.mqtt.MqttUnsubscribeMessage;
import io.netty.handler.codec.mqtt.MqttVersion;
import io.netty.handler.timeout.ReadTimeoutHandler;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.List;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.mqttd.auth.TopicFilter;
import org.github.zzf.mqttd.protocol.server.AuthHook;
import org.github.zzf.mqttd.protocol.server.Client;
import org.github.zzf.mqttd.protocol.server.Subscription;

/**
 * One per connection: authenticates the CONNECT through the {@link AuthHook}, checks every SUBSCRIBE and PUBLISH
 * against it and routes accepted messages.
 */
@Slf4j
public class MqttSessionHandler extends SimpleChannelInboundHandler<MqttMessage> {

    public static final ChannelFutureListener LOG_ON_FAILURE = future -> {
        if (!future.isSuccess()) {
            log.error("Channel(" + future.channel() + ").writeAndFlush failed.", future.cause());
        }
    };

    public static final String HANDLER_NAME = MqttSessionHandler.class.getSimpleName();
    public static final String ACTIVE_IDLE_TIMEOUT_HANDLER = "activeIdleTimeoutHandler";
    public static final int SUBACK_FAILURE = MqttQoS.FAILURE.value();

    private final DefaultBrokerServer server;
    private final String listenerId;
    private Client client;
    private ReadTimeoutHandler activeIdleTimeoutHandler;

    public MqttSessionHandler(DefaultBrokerServer server, String listenerId) {
        this.server = server;
        this.listenerId = listenerId;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        // If the Server does not receive a CONNECT Packet
        // within a reasonable amount of time after the Network Connection is established,
        // the Server SHOULD close the connection
        addActiveIdleTimeoutHandler(ctx);
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, MqttMessage msg) {
        removeActiveIdleTimeoutHandler(ctx);
        if (msg.decoderResult().isFailure()) {
            log.info("Client({}) sent a malformed packet, now close channel -> {}", cid(), msg.decoderResult().cause().getMessage());
            ctx.channel().close();
            return;
        }
        server.info().packetReceived();
        MqttMessageType type = msg.fixedHeader().messageType();
        // After a Network Connection is established by a Client to a Server,
        // the first Packet sent from the Client to the Server MUST be a CONNECT Packet
        if (client == null && type != MqttMessageType.CONNECT) {
            log.error("channelRead the first Packet is not Connect, now close channel");
            ctx.channel().close();
            return;
        }
        switch (type) {
            case CONNECT -> onConnect(ctx, (MqttConnectMessage) msg);
            case PUBLISH -> onPublish(ctx, (MqttPublishMessage) msg);
            case PUBREL -> reply(ctx, PUBCOMP, messageId(msg));
            case SUBSCRIBE -> onSubscribe(ctx, (MqttSubscribeMessage) msg);
            case UNSUBSCRIBE -> onUnsubscribe(ctx, (MqttUnsubscribeMessage) msg);
            case PINGREQ -> write(ctx, new MqttMessage(new MqttFixedHeader(PINGRESP, false, AT_MOST_ONCE, false, 0)));
            case DISCONNECT -> ctx.channel().close();
            // deliveries are QoS 0, nothing is waiting for PUBACK / PUBREC / PUBCOMP
            case PUBACK, PUBREC, PUBCOMP -> log.debug("Client({}) {} ignored", cid(), type);
            default -> {
                log.error("Client({}) sent unexpected packet {}, now close channel", cid(), type);
                ctx.channel().close();
            }
        }
    }

    private void onConnect(ChannelHandlerContext ctx, MqttConnectMessage connect) {
        // A Client can only send the CONNECT Packet once over a Network Connection.
        // The Server MUST process a second CONNECT Packet sent from a Client as a protocol violation
        // and disconnect the Client
        if (client != null) {
            log.error("Client({}) send Connect packet more than once, now close session.", cid());
            ctx.channel().close();
            return;
        }
        int version = connect.variableHeader().version();
        boolean v5 = version == MqttVersion.MQTT_5.protocolLevel();
        String clientId = connect.payload().clientIdentifier();
        if (clientId == null || clientId.isEmpty()) {
            if (!connect.variableHeader().isCleanSession()) {
                refuse(ctx, null, v5 ? CONNECTION_REFUSED_CLIENT_IDENTIFIER_NOT_VALID : CONNECTION_REFUSED_IDENTIFIER_REJECTED);
                return;
            }
            clientId = "auto-" + UUID.randomUUID();
        }
        if (Client.INLINE_ID.equals(clientId)) {
            refuse(ctx, clientId, v5 ? CONNECTION_REFUSED_CLIENT_IDENTIFIER_NOT_VALID : CONNECTION_REFUSED_IDENTIFIER_REJECTED);
            return;
        }
        Client c = Client.builder()
            .id(clientId)
            .listener(listenerId)
            .remote(remote(ctx.channel().remoteAddress()))
            .username(connect.payload().userName())
            .protocolVersion(version)
            .cleanSession(connect.variableHeader().isCleanSession())
            .keepAlive(connect.variableHeader().keepAliveTimeSeconds())
            .channel(ctx.channel())
            .build();
        AuthHook hook = server.authHook();
        if (hook == null || !hook.onConnectAuthenticate(c, connect.payload().passwordInBytes())) {
            refuse(ctx, clientId, v5 ? CONNECTION_REFUSED_BAD_USERNAME_OR_PASSWORD : CONNECTION_REFUSED_BAD_USER_NAME_OR_PASSWORD);
            return;
        }
        client = c;
        Client previous = server.clients().add(c);
        if (previous != null && previous.getChannel() != null) {
            log.info("Client({}) session taken over by {}, close the previous one", clientId, c.getRemote());
            previous.getChannel().close();
        }
        server.info().clientConnected();
        write(ctx, MqttMessageBuilders.connAck().returnCode(CONNECTION_ACCEPTED).sessionPresent(false).build())
            .addListener(f -> log.debug("Client({}) Connect accepted: {}", c.getId(), c));
        // keep alive
        if (c.getKeepAlive() > 0) {
            addClientKeepAliveHandler(ctx, c.getKeepAlive());
        }
    }

    private void refuse(ChannelHandlerContext ctx, String clientId, MqttConnectReturnCode code) {
        log.info("Server refused Connect from client({}), now send ConnAck and close channel -> {}", clientId, code);
        write(ctx, MqttMessageBuilders.connAck().returnCode(code).sessionPresent(false).build())
            .addListener(ChannelFutureListener.CLOSE);
    }

    private void onPublish(ChannelHandlerContext ctx, MqttPublishMessage publish) {
        String topic = publish.variableHeader().topicName();
        if (!TopicFilter.isTopicName(topic)) {
            log.error("Client({}) publish to illegal topic name '{}', now close channel", cid(), topic);
            ctx.channel().close();
            return;
        }
        server.info().messageReceived();
        if (server.authHook().onAclCheck(client, topic, true)) {
            server.route(client, topic, ByteBufUtil.getBytes(publish.payload()));
        }
        else {
            log.info("Client({}) user({}) not allowed to publish to {}, message dropped", cid(), client.getUsername(), topic);
            server.info().messageDropped();
        }
        switch (publish.fixedHeader().qosLevel()) {
            case AT_LEAST_ONCE -> write(ctx, new MqttPubAckMessage(fixedHeader(PUBACK, AT_MOST_ONCE),
                MqttMessageIdVariableHeader.from(publish.variableHeader().packetId())));
            case EXACTLY_ONCE -> reply(ctx, PUBREC, publish.variableHeader().packetId());
            default -> {
            }
        }
    }

    private void onSubscribe(ChannelHandlerContext ctx, MqttSubscribeMessage subscribe) {
        List<MqttTopicSubscription> subscriptions = subscribe.payload().topicSubscriptions();
        int[] granted = new int[subscriptions.size()];
        for (int i = 0; i < granted.length; i++) {
            String tf = subscriptions.get(i).topicName();
            if (!TopicFilter.isValid(tf) || !server.authHook().onAclCheck(client, tf, false)) {
                log.info("Client({}) user({}) not allowed to subscribe {}", cid(), client.getUsername(), tf);
                granted[i] = SUBACK_FAILURE;
                continue;
            }
            if (client.subscribe(new Subscription(tf, AT_MOST_ONCE.value())) == null) {
                server.info().subscriptionAdded();
            }
            granted[i] = AT_MOST_ONCE.value();
        }
        write(ctx, new MqttSubAckMessage(fixedHeader(SUBACK, AT_MOST_ONCE),
            MqttMessageIdVariableHeader.from(subscribe.variableHeader().messageId()),
            new MqttSubAckPayload(granted)));
    }

    private void onUnsubscribe(ChannelHandlerContext ctx, MqttUnsubscribeMessage unsubscribe) {
        int removed = 0;
        for (String tf : unsubscribe.payload().topics()) {
            if (client.unsubscribe(tf) != null) {
                removed++;
            }
        }
        server.info().subscriptionRemoved(removed);
        write(ctx, new MqttUnsubAckMessage(fixedHeader(UNSUBACK, AT_MOST_ONCE),
            MqttMessageIdVariableHeader.from(unsubscribe.variableHeader().messageId())));
    }

    private void reply(ChannelHandlerContext ctx, MqttMessageType type, int packetId) {
        write(ctx, new MqttMessage(fixedHeader(type, AT_MOST_ONCE), MqttMessageIdVariableHeader.from(packetId)));
    }

    private ChannelFuture write(ChannelHandlerContext ctx, MqttMessage msg) {
        server.info().packetSent();
        return ctx.writeAndFlush(msg).addListener(LOG_ON_FAILURE);
    }

    private static MqttFixedHeader fixedHeader(MqttMessageType type, MqttQoS qos) {
        return new MqttFixedHeader(type, false, qos, false, 0);
    }

    private static int messageId(MqttMessage msg) {
        return ((MqttMessageIdVariableHeader) msg.variableHeader()).messageId();
    }

    static String remote(SocketAddress address) {
        if (address instanceof InetSocketAddress isa) {
            return isa.getHostString() + ":" + isa.getPort();
        }
        return String.valueOf(address);
    }

    private void addClientKeepAliveHandler(ChannelHandlerContext ctx, int keepAlive) {
        // If the Keep Alive value is non-zero and the Server does not receive a Control Packet from the Client
        // within one and a half times the Keep Alive time period, it MUST disconnect the Network Connection to the
        // Client as if the network had failed
        ReadTimeoutHandler handler = new ReadTimeoutHandler(Math.max(1, keepAlive * 3 / 2));
        ctx.pipeline().addBefore(ctx.name(), "clientKeepAliveHandler", handler);
    }

    private void addActiveIdleTimeoutHandler(ChannelHandlerContext ctx) {
        ReadTimeoutHandler handler = new ReadTimeoutHandler(server.getOptions().connectTimeoutSecond);
        ctx.pipeline().addBefore(ctx.name(), ACTIVE_IDLE_TIMEOUT_HANDLER, handler);
        this.activeIdleTimeoutHandler = handler;
    }

    private void removeActiveIdleTimeoutHandler(ChannelHandlerContext ctx) {
        if (this.activeIdleTimeoutHandler == null) {
            return;
        }
        ctx.pipeline().remove(ACTIVE_IDLE_TIMEOUT_HANDLER);
        this.activeIdleTimeoutHandler = null;
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Client({}) exceptionCaught. now close the Channel -> channel: {}", cid(), ctx.channel(), cause);
        ctx.channel().close();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        log.debug("Client({}) channelInactive", cid());
        if (client != null) {
            server.info().subscriptionRemoved(client.getSubscriptions().size());
            if (server.clients().remove(client)) {
                log.debug("Client({}) removed from registry", cid());
            }
            server.info().clientDisconnected();
        }
        super.channelInactive(ctx);
    }

    private String cid() {
        return client == null ? null : client.getId();
    }

}
