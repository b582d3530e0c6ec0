package org.github.zzf.mqttd.protocol.server;

import org.slf4j.Logger;

/**
 * A network listener hosted by a {@link BrokerServer}.
 *
 * <p>Lifecycle: {@code init} once when registered, {@code serve} on a thread of its own (it blocks until the
 * listener is closed), {@code close} any number of times from any thread.</p>
 */
public interface Listener {

    /**
     * unique among the listeners of a server
     */
    String id();

    /**
     * host:port the listener binds to
     */
    String address();

    /**
     * e.g. tcp, ws, http, https
     */
    String protocol();

    /**
     * @throws ListenerException if the listener can not be prepared (or bound)
     */
    void init(Logger log);

    void serve(EstablishFn establish);

    void close(CloseFn closeClients);

}
