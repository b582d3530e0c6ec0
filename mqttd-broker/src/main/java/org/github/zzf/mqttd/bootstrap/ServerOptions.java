package org.github.zzf.mqttd.bootstrap;

import io.netty.handler.ssl.SslContext;
import lombok.Builder;
import lombok.Getter;
import org.github.zzf.mqttd.auth.BootstrapCredential;
import org.github.zzf.mqttd.auth.Ledger;

@Getter
@Builder(toBuilder = true)
public class ServerOptions {

    static final int MIN_CLIENTS_BUFFER_SIZE = 8192;

    /* when set, cert / key / rootCa are ignored */
    private SslContext tlsConfig;
    /* null disables authentication */
    private Ledger authConfig;
    @Builder.Default
    private BootstrapCredential bootstrapCredential = BootstrapCredential.DEFAULT;
    @Builder.Default
    private String cert = "cert.ec.pem";
    @Builder.Default
    private String key = "cert-key.ec.pem";
    private String rootCa;
    /* listen addresses, "" disables the listener */
    @Builder.Default
    private String mqttAddr = "1883";
    @Builder.Default
    private String tlsAddr = "1881";
    @Builder.Default
    private String webAddr = "1880";
    @Builder.Default
    private String wsAddr = "";
    @Builder.Default
    private String wsPath = "/";
    /* serve the control plane over https with the mqtt+tls material */
    private boolean webTls;
    private int clientsBufferSize;
    @Builder.Default
    private int workerThreadNum = Runtime.getRuntime().availableProcessors() * 2;
    /* clients need no username and password */
    private boolean disableAuth;
    /* enable the inline client (MqttServer#publish / #subscribe) */
    private boolean inlineClient;
    @Builder.Default
    private String appName = "mqttd";
    @Builder.Default
    private String version = "dev";

    void ensureDefaults() {
        if (clientsBufferSize < MIN_CLIENTS_BUFFER_SIZE) {
            clientsBufferSize = MIN_CLIENTS_BUFFER_SIZE;
        }
        if (workerThreadNum <= 0) {
            workerThreadNum = Runtime.getRuntime().availableProcessors() * 2;
        }
        mqttAddr = ListenAddress.normalize(mqttAddr);
        tlsAddr = ListenAddress.normalize(tlsAddr);
        webAddr = ListenAddress.normalize(webAddr);
        wsAddr = ListenAddress.normalize(wsAddr);
        if (authConfig == null) {
            disableAuth = true;
            authConfig = Ledger.empty();
        }
        if (!disableAuth) {
            authConfig = authConfig.withBootstrap(bootstrapCredential);
        }
    }

}
