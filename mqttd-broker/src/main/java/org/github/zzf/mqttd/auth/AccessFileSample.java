package org.github.zzf.mqttd.auth;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * The sample written by the {@code initauth} command.
 */
public final class AccessFileSample {

    public static final String SAMPLE = """
        # username:
        #     password: plain text, or obfuscated with `code-password` when started with -coded-pwd
        #     acl:                   first matching filter wins, list specific filters first
        #         topic/filter: 0    0 deny, 1 read (subscribe), 2 write (publish), 3 read and write
        #     disallow: true         the user is removed from the ledger
        thisisanACLsample:
            password: lostjudgment
            acl:
                deny/#: 0
                read/#: 1
                write/#: 2
                rw/#: 3
            disallow: true
        control:
            password: daysgone
            acl:
                down/#: 3
                up/#: 3
        user01:
            password: concord
            acl:
                down/+/user01/#: 1
                up/+/user01/#: 2
        """;

    private AccessFileSample() {
    }

    public static Path write(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return Files.writeString(file, SAMPLE, UTF_8);
    }

}
