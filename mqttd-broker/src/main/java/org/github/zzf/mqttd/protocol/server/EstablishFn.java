package org.github.zzf.mqttd.protocol.server;

import io.netty.channel.Channel;

/**
 * Hands a freshly accepted connection to the broker, which installs the MQTT handlers on its pipeline.
 */
@FunctionalInterface
public interface EstablishFn {

    void establish(String listenerId, Channel channel);

}
