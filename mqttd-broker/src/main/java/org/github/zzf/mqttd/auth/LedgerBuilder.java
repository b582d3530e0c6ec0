package org.github.zzf.mqttd.auth;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Builds a {@link Ledger} from an access file.
 *
 * <pre>
 * control:
 *     password: daysgone
 *     acl:
 *         down/#: 3
 *         up/#: 3
 *     disallow: false
 * </pre>
 * <p>
 * ACL levels: 0 deny, 1 read (subscribe), 2 write (publish), 3 read and write. Rules keep the file order.
 */
@Slf4j
public final class LedgerBuilder {

    static final String PASSWORD = "password";
    static final String ACL = "acl";
    static final String DISALLOW = "disallow";

    private LedgerBuilder() {
    }

    public static Ledger fromFile(Path accessFile, boolean passwordsObfuscated) throws IOException {
        if (accessFile == null || accessFile.toString().isEmpty()) {
            throw new IllegalArgumentException("access file name is empty");
        }
        log.info("load access file: {}, passwordsObfuscated: {}", accessFile, passwordsObfuscated);
        return build(Files.readAllBytes(accessFile), passwordsObfuscated);
    }

    /**
     * @throws ParseException  if source is not well-formed YAML
     * @throws ConfigException if a record is malformed or an ACL uses an illegal topic filter
     */
    public static Ledger build(byte[] source, boolean passwordsObfuscated) {
        Object root = load(source);
        if (root == null) {
            return Ledger.empty();
        }
        if (!(root instanceof Map<?, ?> records)) {
            throw new ConfigException("access file must be a mapping of username -> record");
        }
        List<UserRecord> users = new ArrayList<>(records.size());
        for (Map.Entry<?, ?> e : records.entrySet()) {
            String username = String.valueOf(e.getKey());
            if (!(e.getValue() instanceof Map<?, ?> record)) {
                throw new ConfigException("record of user '" + username + "' must be a mapping");
            }
            // validated even when the user is dropped below
            List<AccessRule> rules = rules(username, record.get(ACL));
            if (Boolean.TRUE.equals(record.get(DISALLOW))) {
                log.debug("user '{}' is disallowed, skipped", username);
                continue;
            }
            String password = record.get(PASSWORD) == null ? "" : String.valueOf(record.get(PASSWORD));
            if (passwordsObfuscated) {
                password = PasswordObfuscator.tryDecode(password);
            }
            if (password.isEmpty()) {
                log.warn("user '{}' has no password and will never authenticate", username);
            }
            users.add(new UserRecord(username, password, rules));
        }
        Ledger ledger = new Ledger(users, List.of(), List.of());
        AclLinter.lint(ledger);
        log.info("ledger built: {}", ledger);
        return ledger;
    }

    private static Object load(byte[] source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        try {
            return new Yaml(new SafeConstructor(options)).load(new String(source, UTF_8));
        } catch (YAMLException e) {
            throw new ParseException("access file is not well-formed YAML: " + e.getMessage(), e);
        }
    }

    private static List<AccessRule> rules(String username, Object acl) {
        if (acl == null) {
            return List.of();
        }
        if (!(acl instanceof Map<?, ?> filters)) {
            throw new ConfigException("acl of user '" + username + "' must be a mapping of topic filter -> level");
        }
        List<AccessRule> rules = new ArrayList<>(filters.size());
        for (Map.Entry<?, ?> f : filters.entrySet()) {
            String filter = String.valueOf(f.getKey());
            if (!(f.getValue() instanceof Integer level)) {
                throw new ConfigException("acl level of '" + filter + "' of user '" + username + "' must be an integer 0..3");
            }
            try {
                rules.add(new AccessRule(filter, PermissionLevel.of(level)));
            } catch (ConfigException e) {
                throw new ConfigException("user '" + username + "': " + e.getMessage(), e);
            }
        }
        return rules;
    }

}
