package org.github.zzf.mqttd.server;

import io.netty.handler.ssl.SslContext;
import java.net.InetSocketAddress;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString(exclude = "sslContext")
public class ListenerConfig {

    private final String id;
    /* host:port, an empty host binds every interface */
    private final String address;
    /* null for plain text */
    private final SslContext sslContext;
    /* SO_RCVBUF / SO_SNDBUF of accepted connections, 0 keeps the OS default */
    private final int bufferSize;

    public boolean isSecure() {
        return sslContext != null;
    }

    public InetSocketAddress socketAddress() {
        return socketAddress(address);
    }

    public static InetSocketAddress socketAddress(String address) {
        int idx = address.lastIndexOf(':');
        if (idx < 0) {
            throw new IllegalArgumentException("address must be host:port -> " + address);
        }
        String host = address.substring(0, idx);
        int port = Integer.parseInt(address.substring(idx + 1));
        return host.isEmpty() ? new InetSocketAddress(port) : new InetSocketAddress(host, port);
    }

}
