package org.github.zzf.mqttd.auth;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.security.MessageDigest;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.mqttd.auth.PermissionLevel.Operation;

/**
 * Users, their credentials and their ordered ACLs, plus the global auth/ACL rules.
 *
 * <p>A Ledger never changes after construction and is read without locks from every connection. Reloading means
 * building a new Ledger and swapping the reference.</p>
 */
@Slf4j
public final class Ledger {

    private final Map<String, UserRecord> users;
    private final List<AuthRule> authRules;
    private final List<AclRule> aclRules;

    public Ledger(Collection<UserRecord> users, List<AuthRule> authRules, List<AclRule> aclRules) {
        Map<String, UserRecord> map = new LinkedHashMap<>();
        for (UserRecord u : users) {
            // a disallowed user is absent, not a deny-all user
            if (u.disallowed()) {
                continue;
            }
            if (map.putIfAbsent(u.username(), u) != null) {
                throw new ConfigException("duplicate username: " + u.username());
            }
        }
        this.users = Collections.unmodifiableMap(map);
        this.authRules = authRules == null ? List.of() : List.copyOf(authRules);
        this.aclRules = aclRules == null ? List.of() : List.copyOf(aclRules);
    }

    public static Ledger empty() {
        return new Ledger(List.of(), List.of(), List.of());
    }

    public static Ledger of(UserRecord... users) {
        return new Ledger(List.of(users), List.of(), List.of());
    }

    public Map<String, UserRecord> users() {
        return users;
    }

    public List<AuthRule> authRules() {
        return authRules;
    }

    public List<AclRule> aclRules() {
        return aclRules;
    }

    public UserRecord user(String username) {
        return username == null ? null : users.get(username);
    }

    /**
     * @return a Ledger with the bootstrap user added, or this Ledger if the credential is disabled or the username
     * is already declared
     */
    public Ledger withBootstrap(BootstrapCredential credential) {
        if (credential == null || !credential.isEnabled() || users.containsKey(credential.username())) {
            return this;
        }
        log.warn("bootstrap user '{}' added to the ledger with the default password, declare it in the access file to override",
            credential.username());
        Map<String, UserRecord> copy = new LinkedHashMap<>(users);
        copy.put(credential.username(), new UserRecord(credential.username(), credential.password(), List.of()));
        return new Ledger(copy.values(), authRules, aclRules);
    }

    public boolean authenticate(String username, String password, String clientId, String remote) {
        UserRecord u = user(username);
        if (u != null && u.canAuthenticate() && constantTimeEquals(u.password(), password)) {
            return true;
        }
        for (AuthRule rule : authRules) {
            if (rule.appliesTo(username, password, clientId, remote)) {
                return rule.allow();
            }
        }
        return false;
    }

    public Decision decide(String username, String topic, Operation operation) {
        return decide(username, null, null, topic, operation);
    }

    /**
     * First match wins: the first rule (in declaration order) whose filter matches the topic decides, a later rule
     * never overrides it. Without a matching rule the answer is {@link Decision#DENY}.
     */
    public Decision decide(String username, String clientId, String remote, String topic, Operation operation) {
        UserRecord u = user(username);
        if (u != null) {
            for (AccessRule rule : u.rules()) {
                if (rule.matches(topic)) {
                    return Decision.of(rule.level().permits(operation));
                }
            }
        }
        for (AclRule acl : aclRules) {
            if (!acl.appliesTo(username, clientId, remote)) {
                continue;
            }
            for (AccessRule rule : acl.rules()) {
                if (rule.matches(topic)) {
                    return Decision.of(rule.level().permits(operation));
                }
            }
        }
        return Decision.DENY;
    }

    /**
     * username -> password of every principal able to authenticate with a fixed password. Used by the control
     * plane's Basic-Auth.
     */
    public Map<String, String> credentials() {
        Map<String, String> ret = new LinkedHashMap<>();
        users.forEach((name, u) -> {
            if (u.canAuthenticate()) {
                ret.put(name, u.password());
            }
        });
        for (AuthRule rule : authRules) {
            if (rule.allow() && Patterns.isLiteral(rule.username())
                && rule.password() != null && !rule.password().isEmpty()) {
                ret.putIfAbsent(rule.username(), rule.password());
            }
        }
        return ret;
    }

    static boolean constantTimeEquals(String expected, String actual) {
        if (actual == null) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(UTF_8), actual.getBytes(UTF_8));
    }

    @Override
    public String toString() {
        return "Ledger{users=" + users.keySet() + ", authRules=" + authRules.size() + ", aclRules=" + aclRules.size() + "}";
    }

}
