package io.holdings.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509ExtendedTrustManager;
import java.io.IOException;
import java.io.InputStream;
import java.net.Socket;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Collection;

/**
 * Builds {@link HttpClient}s whose TLS trust follows a {@link TlsPolicy}.
 */
public final class HttpClients {
    private static final Logger log = LoggerFactory.getLogger(HttpClients.class);

    private HttpClients() {}

    public static HttpClient create(TlsPolicy policy, Duration connectTimeout) throws IOException {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(connectTimeout == null ? Duration.ofSeconds(20) : connectTimeout);
        TlsPolicy p = policy == null ? TlsPolicy.verify() : policy;
        switch (p.mode()) {
            case VERIFY -> { }
            case CUSTOM_CA -> builder.sslContext(trusting(p.caBundle()));
            case DISABLED -> {
                log.warn("TLS certificate and hostname verification is DISABLED for this client; use only against test endpoints");
                builder.sslContext(trustingEverything());
            }
        }
        return builder.build();
    }

    /** SSL context that trusts exactly the certificates in the given PEM or DER bundle. */
    static SSLContext trusting(Path caBundle) throws IOException {
        if (!Files.isRegularFile(caBundle)) {
            throw new IOException("CA bundle not found: " + caBundle);
        }
        try (InputStream in = Files.newInputStream(caBundle)) {
            Collection<? extends Certificate> certs = CertificateFactory.getInstance("X.509").generateCertificates(in);
            if (certs.isEmpty()) throw new IOException("CA bundle holds no certificates: " + caBundle);
            KeyStore store = KeyStore.getInstance(KeyStore.getDefaultType());
            store.load(null, null);
            int i = 0;
            for (Certificate c : certs) {
                store.setCertificateEntry("ca-" + (i++), c);
            }
            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(store);
            SSLContext ctx = SSLContext.getInstance("TLS");
            ctx.init(null, tmf.getTrustManagers(), new SecureRandom());
            log.info("Trusting {} certificate(s) from {}", certs.size(), caBundle);
            return ctx;
        } catch (GeneralSecurityException e) {
            throw new IOException("Invalid CA bundle " + caBundle + ": " + e.getMessage(), e);
        }
    }

    private static SSLContext trustingEverything() throws IOException {
        try {
            SSLContext ctx = SSLContext.getInstance("TLS");
            ctx.init(null, new TrustManager[]{new AcceptAllTrustManager()}, new SecureRandom());
            return ctx;
        } catch (GeneralSecurityException e) {
            throw new IOException("Cannot initialise TLS context", e);
        }
    }

    // Extended variant so JSSE delegates endpoint identification to us and skips it.
    private static final class AcceptAllTrustManager extends X509ExtendedTrustManager {
        @Override public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {}
        @Override public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {}
        @Override public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {}
        @Override public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {}
        @Override public void checkClientTrusted(X509Certificate[] chain, String authType) {}
        @Override public void checkServerTrusted(X509Certificate[] chain, String authType) {}
        @Override public X509Certificate[] getAcceptedIssuers() { return new X509Certificate[0]; }
    }
}
