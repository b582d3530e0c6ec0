package org.github.zzf.mqttd.bootstrap;

import io.netty.handler.ssl.ClientAuth;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;

/**
 * Server SslContext from PEM files. The key must be PKCS#8.
 */
public final class TlsContexts {

    private TlsContexts() {
    }

    /**
     * @param rootCa optional; when set, client certificates signed by it are requested (not required)
     */
    public static SslContext fromFiles(String cert, String key, String rootCa) throws IOException {
        File certFile = existing("tls cert", cert);
        File keyFile = existing("tls key", key);
        SslContextBuilder builder = SslContextBuilder.forServer(certFile, keyFile);
        if (rootCa != null && !rootCa.isEmpty()) {
            builder.trustManager(existing("tls root ca", rootCa)).clientAuth(ClientAuth.OPTIONAL);
        }
        return builder.build();
    }

    private static File existing(String what, String path) throws FileNotFoundException {
        if (path == null || path.isEmpty()) {
            throw new FileNotFoundException(what + " file is not configured");
        }
        File f = new File(path);
        if (!f.isFile()) {
            throw new FileNotFoundException(what + " file not found: " + f.getAbsolutePath());
        }
        return f;
    }

}
