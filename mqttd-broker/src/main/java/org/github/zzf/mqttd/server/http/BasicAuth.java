package org.github.zzf.mqttd.server.http;

import static io.netty.handler.codec.http.HttpHeaderNames.AUTHORIZATION;
import static io.netty.handler.codec.http.HttpHeaderNames.WWW_AUTHENTICATE;
import static java.nio.charset.StandardCharsets.UTF_8;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP Basic-Auth in front of an {@link Endpoint}. The credentials are a snapshot. When authentication is required
 * and the snapshot is empty nobody gets in; only an instance built with {@code required == false} is open.
 */
@Slf4j
public class BasicAuth implements Endpoint {

    static final String REALM = "mqttd";
    private static final String BASIC = "Basic ";

    private final boolean required;
    private final Map<String, String> credentials;
    private final Endpoint delegate;

    public BasicAuth(Map<String, String> credentials, Endpoint delegate) {
        this(true, credentials, delegate);
    }

    public BasicAuth(boolean required, Map<String, String> credentials, Endpoint delegate) {
        this.required = required;
        this.credentials = Map.copyOf(credentials);
        this.delegate = delegate;
    }

    @Override
    public FullHttpResponse handle(FullHttpRequest request) {
        if (!required || authorized(request.headers().get(AUTHORIZATION))) {
            return delegate.handle(request);
        }
        log.debug("unauthorized request: {}", request.uri());
        FullHttpResponse resp = Responses.status(HttpResponseStatus.UNAUTHORIZED);
        resp.headers().set(WWW_AUTHENTICATE, "Basic realm=\"" + REALM + "\", charset=\"UTF-8\"");
        return resp;
    }

    boolean authorized(String header) {
        if (header == null || !header.regionMatches(true, 0, BASIC, 0, BASIC.length())) {
            return false;
        }
        String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(header.substring(BASIC.length()).trim()), UTF_8);
        } catch (IllegalArgumentException e) {
            return false;
        }
        int idx = decoded.indexOf(':');
        if (idx <= 0) {
            return false;
        }
        String expected = credentials.get(decoded.substring(0, idx));
        return expected != null
            && MessageDigest.isEqual(expected.getBytes(UTF_8), decoded.substring(idx + 1).getBytes(UTF_8));
    }

}
