package org.github.zzf.mqttd.server.http;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_LENGTH;
import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;
import static java.nio.charset.StandardCharsets.UTF_8;

import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;

final class Responses {

    static final String TEXT_PLAIN = "text/plain; charset=utf-8";
    static final String TEXT_HTML = "text/html; charset=utf-8";
    static final String APPLICATION_JSON = "application/json; charset=utf-8";
    static final String APPLICATION_NDJSON = "application/x-ndjson; charset=utf-8";

    private Responses() {
    }

    static FullHttpResponse of(HttpResponseStatus status, String contentType, String body) {
        FullHttpResponse resp = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.copiedBuffer(body, UTF_8));
        resp.headers()
            .set(CONTENT_TYPE, contentType)
            .setInt(CONTENT_LENGTH, resp.content().readableBytes());
        return resp;
    }

    static FullHttpResponse ok(String contentType, String body) {
        return of(HttpResponseStatus.OK, contentType, body);
    }

    /**
     * a status page carrying nothing but the reason phrase
     */
    static FullHttpResponse status(HttpResponseStatus status) {
        return of(status, TEXT_PLAIN, status.reasonPhrase());
    }

}
