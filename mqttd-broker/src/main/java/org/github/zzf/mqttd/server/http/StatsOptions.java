package org.github.zzf.mqttd.server.http;

import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * What the control plane shows about the rest of the deployment, captured when the listener is assembled.
 */
@Getter
@Builder
public class StatsOptions {

    /* "mqtt: 0.0.0.0:1883; mqtt+tls: 0.0.0.0:1881" */
    private final String listeners;
    /* false only when authentication is disabled, the pages are then served to anyone */
    @Builder.Default
    private final boolean authRequired = true;
    /* username -> password for Basic-Auth */
    @Builder.Default
    private final Map<String, String> credentials = Map.of();
    @Builder.Default
    private final String appName = "mqttd";

}
