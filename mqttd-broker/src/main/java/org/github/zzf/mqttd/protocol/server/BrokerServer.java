package org.github.zzf.mqttd.protocol.server;

/**
 * The broker side of the listener plugin contract.
 */
public interface BrokerServer extends AutoCloseable {

    /**
     * @throws ListenerException if the hook can not be installed
     */
    void addHook(AuthHook hook);

    /**
     * initialises the listener and registers it; it starts serving on {@link #serve()}
     *
     * @throws ListenerException if the id is taken or the listener fails to initialise
     */
    void addListener(Listener listener);

    /**
     * starts every registered listener on its own thread and returns
     */
    void serve();

    /**
     * closes every listener and disconnects their clients
     */
    @Override
    void close();

    Clients clients();

    SystemInfo info();

    /**
     * publish as the inline client
     */
    void publish(String topic, byte[] payload, boolean retain, int qos);

    /**
     * subscribe as the inline client
     */
    void subscribe(String topicFilter, int subscriptionId, InlineSubFn handler);

    void unsubscribe(String topicFilter, int subscriptionId);

}
