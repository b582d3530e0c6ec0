package org.github.zzf.mqttd.auth;

import java.util.List;

/**
 * A user of the access file. {@code rules} keep the order they were declared in.
 */
public record UserRecord(String username, String password, List<AccessRule> rules, boolean disallowed) {

    public UserRecord {
        if (username == null || username.isEmpty()) {
            throw new ConfigException("username is empty");
        }
        password = password == null ? "" : password;
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public UserRecord(String username, String password, List<AccessRule> rules) {
        this(username, password, rules, false);
    }

    /**
     * a user without password never authenticates
     */
    public boolean canAuthenticate() {
        return !password.isEmpty();
    }

}
