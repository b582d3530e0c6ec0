package org.github.zzf.mqttd.bootstrap;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.lang3.StringUtils;
import org.github.zzf.mqttd.auth.AccessFileSample;
import org.github.zzf.mqttd.auth.ConfigException;
import org.github.zzf.mqttd.auth.Ledger;
import org.github.zzf.mqttd.auth.LedgerBuilder;
import org.github.zzf.mqttd.auth.PasswordObfuscator;

/**
 * mqttd command line.
 *
 * <pre>
 *   mqttd [options]                start the broker
 *   mqttd initauth [file]          write a sample access file (default auth.yaml)
 *   mqttd code-password [plain]    print the obfuscated form of a password (read from stdin when absent)
 * </pre>
 * Option defaults can be changed with system properties, e.g. -Dmqttd.port.mqtt=1883
 */
@Slf4j
public class Application {

    static final String CMD_INIT_AUTH = "initauth";
    static final String CMD_CODE_PASSWORD = "code-password";
    static final String DEFAULT_ACCESS_FILE = "auth.yaml";

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;
    static final int EXIT_ERROR = 1;

    private final PrintStream out;
    private final InputStream in;

    Application(PrintStream out, InputStream in) {
        this.out = out;
        this.in = in;
    }

    @SneakyThrows
    public static void main(String[] args) {
        Application app = new Application(System.out, System.in);
        CommandLine cmd = app.parse(args);
        if (cmd == null) {
            System.exit(EXIT_USAGE);
        }
        List<String> rest = cmd.getArgList();
        if (cmd.hasOption("h") || !rest.isEmpty()) {
            System.exit(app.execute(cmd));
        }
        MqttServer server = new MqttServer(app.serverOptions(cmd));
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "mqttd-shutdown"));
        server.run();
    }

    static Options options() {
        Options options = new Options();
        options.addOption(Option.builder("auth").hasArg().argName("file")
            .desc("access file, absent disables authentication").build());
        options.addOption(Option.builder().longOpt("coded-pwd")
            .desc("passwords in the access file are obfuscated with code-password").build());
        options.addOption(Option.builder().longOpt("disable-auth")
            .desc("accept every client and every topic").build());
        options.addOption(Option.builder("mqtt").hasArg().argName("addr")
            .desc("mqtt listen address, '' disables it (default 1883)").build());
        options.addOption(Option.builder("tls").hasArg().argName("addr")
            .desc("mqtt+tls listen address, '' disables it (default 1881)").build());
        options.addOption(Option.builder("web").hasArg().argName("addr")
            .desc("control plane listen address, '' disables it (default 1880)").build());
        options.addOption(Option.builder("ws").hasArg().argName("addr")
            .desc("mqtt over websocket listen address (default disabled)").build());
        options.addOption(Option.builder("wspath").hasArg().argName("path")
            .desc("websocket path (default /)").build());
        options.addOption(Option.builder("webtls")
            .desc("serve the control plane over https").build());
        options.addOption(Option.builder("cert").hasArg().argName("file")
            .desc("tls certificate chain, PEM (default cert.ec.pem)").build());
        options.addOption(Option.builder("key").hasArg().argName("file")
            .desc("tls private key, PKCS#8 PEM (default cert-key.ec.pem)").build());
        options.addOption(Option.builder("rootca").hasArg().argName("file")
            .desc("root CA for optional client certificates").build());
        options.addOption(Option.builder("inline")
            .desc("enable the inline client").build());
        options.addOption(Option.builder("h").longOpt("help").desc("print this message").build());
        return options;
    }

    CommandLine parse(String[] args) {
        try {
            return new DefaultParser().parse(options(), args);
        } catch (ParseException e) {
            out.println(e.getMessage());
            usage();
            return null;
        }
    }

    /**
     * runs a sub command or prints the usage
     *
     * @return the exit code
     */
    int execute(CommandLine cmd) {
        List<String> rest = cmd.getArgList();
        if (cmd.hasOption("h") || rest.isEmpty()) {
            usage();
            return EXIT_OK;
        }
        String sub = rest.get(0);
        try {
            switch (sub) {
                case CMD_INIT_AUTH:
                    Path file = AccessFileSample.write(Paths.get(rest.size() > 1 ? rest.get(1) : DEFAULT_ACCESS_FILE));
                    out.println("sample access file written to " + file.toAbsolutePath());
                    return EXIT_OK;
                case CMD_CODE_PASSWORD:
                    String plain = rest.size() > 1 ? rest.get(1) : readLine();
                    if (StringUtils.isEmpty(plain)) {
                        out.println("empty password");
                        return EXIT_USAGE;
                    }
                    out.println(PasswordObfuscator.encode(plain));
                    return EXIT_OK;
                default:
                    out.println("unknown command: " + sub);
                    usage();
                    return EXIT_USAGE;
            }
        } catch (IOException e) {
            log.error("{} failed", sub, e);
            return EXIT_ERROR;
        }
    }

    private String readLine() throws IOException {
        out.print("password: ");
        out.flush();
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String line = reader.readLine();
        return line == null ? null : line.trim();
    }

    /**
     * @throws IOException     if the access file can not be read
     * @throws ConfigException if the access file is invalid
     */
    ServerOptions serverOptions(CommandLine cmd) throws IOException {
        Ledger ledger = null;
        boolean disableAuth = cmd.hasOption("disable-auth");
        String accessFile = cmd.getOptionValue("auth", System.getProperty("mqttd.auth.file", ""));
        if (!disableAuth && !accessFile.isEmpty()) {
            ledger = LedgerBuilder.fromFile(Paths.get(accessFile), cmd.hasOption("coded-pwd"));
            log.info("access file loaded: {} -> {}", accessFile, ledger);
        }
        else if (!disableAuth) {
            // authentication stays on, only the bootstrap credential gets in
            ledger = Ledger.empty();
            log.warn("no access file given, only the bootstrap credential is accepted");
        }
        return ServerOptions.builder()
            .authConfig(ledger)
            .disableAuth(disableAuth)
            .mqttAddr(cmd.getOptionValue("mqtt", System.getProperty("mqttd.port.mqtt", "1883")))
            .tlsAddr(cmd.getOptionValue("tls", System.getProperty("mqttd.port.tls", "1881")))
            .webAddr(cmd.getOptionValue("web", System.getProperty("mqttd.port.web", "1880")))
            .wsAddr(cmd.getOptionValue("ws", System.getProperty("mqttd.port.ws", "")))
            .wsPath(cmd.getOptionValue("wspath", System.getProperty("mqttd.ws.path", "/")))
            .webTls(cmd.hasOption("webtls"))
            .cert(cmd.getOptionValue("cert", System.getProperty("mqttd.tls.cert", "cert.ec.pem")))
            .key(cmd.getOptionValue("key", System.getProperty("mqttd.tls.key", "cert-key.ec.pem")))
            .rootCa(cmd.getOptionValue("rootca", System.getProperty("mqttd.tls.rootca")))
            .inlineClient(cmd.hasOption("inline"))
            .clientsBufferSize(Integer.getInteger("mqttd.clients.buffer.size", 0))
            .workerThreadNum(Integer.getInteger("mqttd.worker.thread.num", Runtime.getRuntime().availableProcessors() * 2))
            .version(version())
            .build();
    }

    static String version() {
        String v = Application.class.getPackage().getImplementationVersion();
        return v == null ? "dev" : v;
    }

    private void usage() {
        PrintWriter pw = new PrintWriter(out, true, StandardCharsets.UTF_8);
        new HelpFormatter().printHelp(pw, HelpFormatter.DEFAULT_WIDTH,
            "mqttd [options] | mqttd " + CMD_INIT_AUTH + " [file] | mqttd " + CMD_CODE_PASSWORD + " [plain]",
            null, options(), HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
        pw.flush();
    }

}
