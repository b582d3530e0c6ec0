package org.github.zzf.mqttd.bootstrap;

import lombok.extern.slf4j.Slf4j;

/**
 * Listener address normalisation: "1883" and ":1883" bind every interface ("0.0.0.0:1883"), "host:port" is kept,
 * an empty value disables the listener.
 */
@Slf4j
public final class ListenAddress {

    static final String ANY_HOST = "0.0.0.0";

    private ListenAddress() {
    }

    /**
     * @return host:port, or "" when the listener is disabled or the address is unusable
     */
    public static String normalize(String address) {
        if (address == null || address.isBlank()) {
            return "";
        }
        String a = address.trim();
        int idx = a.lastIndexOf(':');
        String host = idx < 0 ? "" : a.substring(0, idx);
        String port = idx < 0 ? a : a.substring(idx + 1);
        int p;
        try {
            p = Integer.parseInt(port);
        } catch (NumberFormatException e) {
            log.warn("illegal listen address '{}', listener disabled", address);
            return "";
        }
        if (p < 0 || p >= 65535) {
            log.warn("port out of range in listen address '{}', listener disabled", address);
            return "";
        }
        return (host.isEmpty() ? ANY_HOST : host) + ":" + p;
    }

}
