package org.github.zzf.mqttd.server.http;

import static io.netty.handler.codec.http.HttpHeaderNames.ALLOW;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.QueryStringDecoder;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Dispatches a request to the {@link Endpoint} registered for its path. Only GET is served; failures answer with a
 * bare status code.
 */
@Slf4j
@Sharable
@RequiredArgsConstructor
public class ControlPlaneHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private final Map<String, Endpoint> routes;

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        FullHttpResponse resp = dispatch(req);
        boolean keepAlive = HttpUtil.isKeepAlive(req) && resp.status().code() < 500;
        HttpUtil.setKeepAlive(resp, keepAlive);
        if (keepAlive) {
            ctx.writeAndFlush(resp);
        }
        else {
            ctx.writeAndFlush(resp).addListener(ChannelFutureListener.CLOSE);
        }
    }

    FullHttpResponse dispatch(FullHttpRequest req) {
        if (!req.decoderResult().isSuccess()) {
            return Responses.status(HttpResponseStatus.BAD_REQUEST);
        }
        Endpoint endpoint = routes.get(new QueryStringDecoder(req.uri()).path());
        if (endpoint == null) {
            return Responses.status(HttpResponseStatus.NOT_FOUND);
        }
        if (!HttpMethod.GET.equals(req.method())) {
            FullHttpResponse resp = Responses.status(HttpResponseStatus.METHOD_NOT_ALLOWED);
            resp.headers().set(ALLOW, HttpMethod.GET.name());
            return resp;
        }
        try {
            return endpoint.handle(req);
        } catch (RuntimeException e) {
            log.error("control plane request {} failed", req.uri(), e);
            return Responses.status(HttpResponseStatus.INTERNAL_SERVER_ERROR);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.debug("control plane channel {} exceptionCaught, now close it", ctx.channel(), cause);
        ctx.close();
    }

}
