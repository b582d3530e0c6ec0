package org.github.zzf.mqttd.auth;

import org.github.zzf.mqttd.protocol.server.AuthHook;
import org.github.zzf.mqttd.protocol.server.Client;

/**
 * Installed when authentication is disabled: every client connects, publishes and subscribes.
 */
public class AllowAllAuthHook implements AuthHook {

    @Override
    public String id() {
        return "allow-all";
    }

    @Override
    public boolean onConnectAuthenticate(Client client, byte[] password) {
        return true;
    }

    @Override
    public boolean onAclCheck(Client client, String topic, boolean write) {
        return true;
    }

}
