package org.github.zzf.mqttd.server.http;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;

/**
 * A read-only control plane page.
 */
@FunctionalInterface
public interface Endpoint {

    FullHttpResponse handle(FullHttpRequest request);

}
