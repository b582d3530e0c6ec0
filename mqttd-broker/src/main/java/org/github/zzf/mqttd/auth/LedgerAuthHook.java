package org.github.zzf.mqttd.auth;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.mqttd.auth.PermissionLevel.Operation;
import org.github.zzf.mqttd.protocol.server.AuthHook;
import org.github.zzf.mqttd.protocol.server.Client;

/**
 * Authenticates and authorises clients against a {@link Ledger}. The Ledger reference can be swapped at runtime,
 * every check reads whichever Ledger is current.
 */
@Slf4j
public class LedgerAuthHook implements AuthHook {

    private final AtomicReference<Ledger> ledger;

    public LedgerAuthHook(Ledger ledger) {
        if (ledger == null) {
            throw new IllegalArgumentException("ledger is null");
        }
        this.ledger = new AtomicReference<>(ledger);
    }

    @Override
    public String id() {
        return "auth-ledger";
    }

    public Ledger ledger() {
        return ledger.get();
    }

    /**
     * @return the previous ledger
     */
    public Ledger swap(Ledger newLedger) {
        if (newLedger == null) {
            throw new IllegalArgumentException("ledger is null");
        }
        Ledger old = ledger.getAndSet(newLedger);
        log.info("ledger swapped: {} -> {}", old, newLedger);
        return old;
    }

    @Override
    public boolean onConnectAuthenticate(Client client, byte[] password) {
        String pwd = password == null ? null : new String(password, UTF_8);
        boolean ok = ledger.get().authenticate(client.getUsername(), pwd, client.getId(), client.getRemote());
        if (!ok) {
            log.info("Client({}) from {} authenticate failed, user: '{}'", client.getId(), client.getRemote(), client.getUsername());
        }
        return ok;
    }

    @Override
    public boolean onAclCheck(Client client, String topic, boolean write) {
        return ledger.get()
            .decide(client.getUsername(), client.getId(), client.getRemote(), topic, Operation.of(write))
            .isAllowed();
    }

}
