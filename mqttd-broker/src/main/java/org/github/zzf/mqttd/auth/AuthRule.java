package org.github.zzf.mqttd.auth;

/**
 * A global authentication entry, consulted when the connecting username is not a ledger user (or the password did
 * not match it). Empty fields match any value, see {@link Patterns}.
 */
public record AuthRule(String username, String password, String client, String remote, boolean allow) {

    boolean appliesTo(String username, String password, String clientId, String remoteAddr) {
        return Patterns.matches(this.username, username)
            && Patterns.matches(this.client, clientId)
            && Patterns.matches(this.remote, remoteAddr)
            && (this.password == null || this.password.isEmpty() || this.password.equals(password));
    }

}
