package org.github.zzf.mqttd.auth;

import java.util.List;

/**
 * A global ACL entry. It is consulted after the user's own rules, and only when none of them matched the topic.
 */
public record AclRule(String username, String client, String remote, List<AccessRule> rules) {

    public AclRule {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    boolean appliesTo(String username, String clientId, String remoteAddr) {
        return Patterns.matches(this.username, username)
            && Patterns.matches(this.client, clientId)
            && Patterns.matches(this.remote, remoteAddr);
    }

}
