package org.github.zzf.mqttd.bootstrap;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.BDDAssertions.then;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.cli.CommandLine;
import org.github.zzf.mqttd.auth.AccessFileSample;
import org.github.zzf.mqttd.auth.PasswordObfuscator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ApplicationTest {

    @TempDir
    Path dir;

    final ByteArrayOutputStream out = new ByteArrayOutputStream();

    Application app(String stdin) {
        return new Application(new PrintStream(out, true, UTF_8), new ByteArrayInputStream(stdin.getBytes(UTF_8)));
    }

    @Test
    void givenInitAuth_whenExecute_thenSampleWritten() throws IOException {
        Path file = dir.resolve("auth.yaml");
        Application app = app("");
        int code = app.execute(app.parse(new String[]{"initauth", file.toString()}));
        then(code).isEqualTo(Application.EXIT_OK);
        then(Files.readString(file)).isEqualTo(AccessFileSample.SAMPLE);
    }

    @Test
    void givenCodePasswordArgument_whenExecute_thenObfuscatedPrinted() {
        Application app = app("");
        int code = app.execute(app.parse(new String[]{"code-password", "daysgone"}));
        then(code).isEqualTo(Application.EXIT_OK);
        then(PasswordObfuscator.decode(out.toString(UTF_8).trim())).isEqualTo("daysgone");
    }

    @Test
    void givenCodePasswordFromStdin_whenExecute_thenObfuscatedPrinted() {
        Application app = app("concord\n");
        int code = app.execute(app.parse(new String[]{"code-password"}));
        then(code).isEqualTo(Application.EXIT_OK);
        String printed = out.toString(UTF_8);
        String coded = printed.substring(printed.indexOf("password: ") + "password: ".length()).trim();
        then(PasswordObfuscator.decode(coded)).isEqualTo("concord");
    }

    @Test
    void givenUnknownCommandOrOption_whenParse_thenUsage() {
        Application app = app("");
        then(app.execute(app.parse(new String[]{"reboot"}))).isEqualTo(Application.EXIT_USAGE);
        then(app.parse(new String[]{"-nope"})).isNull();
        then(out.toString(UTF_8)).contains("usage:");
    }

    @Test
    void givenFlags_whenServerOptions_thenMapped() throws IOException {
        Path file = AccessFileSample.write(dir.resolve("auth.yaml"));
        Application app = app("");
        CommandLine cmd = app.parse(new String[]{"-auth", file.toString(), "-mqtt", ":1884", "-web", "", "-ws", "1882",
            "-cert", "c.pem", "-key", "k.pem"});
        ServerOptions opt = app.serverOptions(cmd);
        then(opt.getAuthConfig().users()).containsOnlyKeys("control", "user01");
        then(opt.isDisableAuth()).isFalse();
        then(opt.getMqttAddr()).isEqualTo(":1884");
        then(opt.getWebAddr()).isEmpty();
        then(opt.getWsAddr()).isEqualTo("1882");
        then(opt.getCert()).isEqualTo("c.pem");
        then(opt.getKey()).isEqualTo("k.pem");

        opt.ensureDefaults();
        then(opt.getMqttAddr()).isEqualTo("0.0.0.0:1884");
        then(opt.getWsAddr()).isEqualTo("0.0.0.0:1882");
        then(opt.getClientsBufferSize()).isEqualTo(ServerOptions.MIN_CLIENTS_BUFFER_SIZE);
        then(opt.getAuthConfig().users()).containsKey("YoRHa");
    }

    @Test
    void givenNoAccessFile_whenServerOptions_thenAuthStaysOnWithBootstrapCredential() throws IOException {
        Application app = app("");
        ServerOptions opt = app.serverOptions(app.parse(new String[0]));
        then(opt.isDisableAuth()).isFalse();
        then(opt.getAuthConfig()).isNotNull();

        opt.ensureDefaults();
        then(opt.isDisableAuth()).isFalse();
        then(opt.getAuthConfig().users()).containsOnlyKeys("YoRHa");
        then(opt.getAuthConfig().credentials()).containsEntry("YoRHa", "no2typeB");
    }

    @Test
    void givenDisableAuth_whenServerOptions_thenNoLedger() throws IOException {
        Application app = app("");
        ServerOptions opt = app.serverOptions(app.parse(new String[]{"-disable-auth", "-auth", "ignored.yaml"}));
        then(opt.isDisableAuth()).isTrue();
        then(opt.getAuthConfig()).isNull();
        opt.ensureDefaults();
        then(opt.getAuthConfig().users()).isEmpty();
    }

}
