package org.github.zzf.mqttd.bootstrap;

import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.BDDAssertions.then;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import io.netty.handler.ssl.SslContext;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.github.zzf.mqttd.auth.AccessRule;
import org.github.zzf.mqttd.auth.AllowAllAuthHook;
import org.github.zzf.mqttd.auth.BootstrapCredential;
import org.github.zzf.mqttd.auth.Ledger;
import org.github.zzf.mqttd.auth.LedgerAuthHook;
import org.github.zzf.mqttd.auth.PermissionLevel;
import org.github.zzf.mqttd.auth.UserRecord;
import org.github.zzf.mqttd.protocol.server.AuthHook;
import org.github.zzf.mqttd.protocol.server.BrokerServer;
import org.github.zzf.mqttd.protocol.server.Listener;
import org.github.zzf.mqttd.protocol.server.ListenerException;
import org.github.zzf.mqttd.server.http.HttpStatsListener;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.slf4j.LoggerFactory;

class MqttServerTest {

    final BrokerServer svr = mock(BrokerServer.class);

    static ServerOptions.ServerOptionsBuilder options() {
        return ServerOptions.builder()
            .authConfig(Ledger.of(new UserRecord("control", "daysgone", List.of(new AccessRule("#", PermissionLevel.READ_WRITE)))))
            .tlsConfig(mock(SslContext.class))
            .mqttAddr("127.0.0.1:0")
            .tlsAddr("127.0.0.1:0")
            .wsAddr("127.0.0.1:0")
            .webAddr("127.0.0.1:0");
    }

    @Test
    void givenAllListeners_whenStart_thenRegisteredInOrderThenServed() {
        MqttServer server = new MqttServer(options().build(), svr);
        server.start();

        InOrder order = inOrder(svr);
        order.verify(svr).addHook(any(LedgerAuthHook.class));
        order.verify(svr).addListener(argThat(l -> "mqtt+tls".equals(l.id())));
        order.verify(svr).addListener(argThat(l -> "mqtt".equals(l.id())));
        order.verify(svr).addListener(argThat(l -> "ws".equals(l.id()) && "wss".equals(l.protocol())));
        order.verify(svr).addListener(argThat(l -> "web".equals(l.id()) && "http".equals(l.protocol())));
        order.verify(svr).serve();
        then(server.listeners()).containsExactly("mqtt+tls", "mqtt", "ws", "web");
        then(server.isRunning()).isTrue();
    }

    @Test
    void givenAuthHookFailure_whenStart_thenNothingElseStarts() {
        willThrow(new ListenerException("hook")).given(svr).addHook(any(AuthHook.class));
        MqttServer server = new MqttServer(options().build(), svr);

        then(catchThrowable(server::start)).isInstanceOf(ListenerException.class);
        verify(svr, never()).addListener(any(Listener.class));
        verify(svr, never()).serve();
        then(server.isRunning()).isFalse();
    }

    @Test
    void givenListenerFailure_whenStart_thenOthersStillServe() {
        willThrow(new ListenerException("port in use")).given(svr).addListener(argThat(l -> l != null && "mqtt".equals(l.id())));
        MqttServer server = new MqttServer(options().build(), svr);
        server.start();

        verify(svr).serve();
        then(server.listeners()).containsExactly("mqtt+tls", "ws", "web");
        then(server.listenersText()).doesNotContain("mqtt: ");
    }

    @Test
    void givenNoTlsMaterial_whenStart_thenTlsListenerSkipped() {
        ServerOptions opt = options().tlsConfig(null).cert("missing.pem").key("missing-key.pem").build();
        MqttServer server = new MqttServer(opt, svr);
        server.start();

        verify(svr, never()).addListener(argThat(l -> l != null && "mqtt+tls".equals(l.id())));
        verify(svr).addListener(argThat(l -> l != null && "ws".equals(l.id()) && "ws".equals(l.protocol())));
        then(server.listeners()).containsExactly("mqtt", "ws", "web");
    }

    @Test
    void givenDisabledAddresses_whenStart_thenOnlyEnabledListeners() {
        MqttServer server = new MqttServer(options().tlsAddr("").wsAddr("").webAddr("").build(), svr);
        server.start();
        then(server.listeners()).containsExactly("mqtt");
    }

    @Test
    void givenNoLedger_whenStart_thenAuthDisabled() {
        MqttServer server = new MqttServer(options().authConfig(null).build(), svr);
        server.start();
        verify(svr).addHook(any(AllowAllAuthHook.class));
    }

    @Test
    void givenLedger_whenStart_thenBootstrapCredentialApplied() {
        new MqttServer(options().build(), svr).start();
        ArgumentCaptor<AuthHook> hook = ArgumentCaptor.forClass(AuthHook.class);
        verify(svr).addHook(hook.capture());
        then(((LedgerAuthHook) hook.getValue()).ledger().credentials())
            .containsEntry("YoRHa", "no2typeB")
            .containsEntry("control", "daysgone");
    }

    @Test
    void givenBootstrapDisabled_whenStart_thenOnlyDeclaredUsers() {
        new MqttServer(options().bootstrapCredential(BootstrapCredential.NONE).build(), svr).start();
        ArgumentCaptor<AuthHook> hook = ArgumentCaptor.forClass(AuthHook.class);
        verify(svr).addHook(hook.capture());
        then(((LedgerAuthHook) hook.getValue()).ledger().users()).containsOnlyKeys("control");
    }

    /**
     * authentication is on but nobody can log in: the control plane refuses instead of opening up
     */
    @Test
    void givenAuthEnabledWithoutCredentials_whenRequestControlPlane_then401() throws Exception {
        ServerOptions opt = ServerOptions.builder()
            .authConfig(Ledger.of(new UserRecord("sensor", "", List.of(new AccessRule("#", PermissionLevel.READ)))))
            .bootstrapCredential(BootstrapCredential.NONE)
            .mqttAddr("")
            .tlsAddr("")
            .webAddr("127.0.0.1:0")
            .build();
        new MqttServer(opt, svr).start();
        ArgumentCaptor<Listener> listener = ArgumentCaptor.forClass(Listener.class);
        verify(svr).addListener(listener.capture());
        HttpStatsListener web = (HttpStatsListener) listener.getValue();

        web.init(LoggerFactory.getLogger(MqttServerTest.class));
        CompletableFuture<Void> serving = CompletableFuture.runAsync(() -> web.serve((id, ch) -> {
        }));
        try {
            long deadline = System.currentTimeMillis() + 10_000;
            while (!(web.localAddress() instanceof InetSocketAddress) && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
            int port = ((InetSocketAddress) web.localAddress()).getPort();
            HttpResponse<String> anonymous = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build()
                .send(HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + "/information")).GET().build(),
                    HttpResponse.BodyHandlers.ofString());
            then(anonymous.statusCode()).isEqualTo(401);
        } finally {
            web.close(id -> {
            });
        }
        serving.get(10, TimeUnit.SECONDS);
    }

    @Test
    void givenRunningServer_whenStop_thenRunReturnsAndBrokerClosed() throws Exception {
        MqttServer server = new MqttServer(options().build(), svr);
        CompletableFuture<Void> running = CompletableFuture.runAsync(() -> {
            try {
                server.run();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        long deadline = System.currentTimeMillis() + 5000;
        while (!server.isRunning() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        server.stop();
        running.get(5, TimeUnit.SECONDS);
        verify(svr).close();
        then(server.isRunning()).isFalse();
        // idempotent
        server.stop();
        verify(svr).close();
    }

    /**
     * a real broker: the mqtt port is taken, the control plane still comes up
     */
    @Test
    void givenPortInUse_whenStartRealBroker_thenListenerSkippedAndOthersServe() throws Exception {
        try (ServerSocket taken = new ServerSocket(0, 50, InetAddress.getByName("127.0.0.1"))) {
            MqttServer server = new MqttServer(ServerOptions.builder()
                .mqttAddr("127.0.0.1:" + taken.getLocalPort())
                .tlsAddr("")
                .webAddr("127.0.0.1:0")
                .inlineClient(true)
                .build());
            try {
                server.start();
                then(server.listeners()).containsExactly("web");
                then(server.isRunning()).isTrue();
            } finally {
                server.stop();
            }
            then(server.isRunning()).isFalse();
        }
    }

}
