package com.regwatch.service.http;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the shared outbound client used for page fetches and webhook delivery.
 * Redirects are followed; a custom truststore can be supplied through
 * {@code TRUSTSTORE_PATH} and {@code TRUSTSTORE_PASSWORD} for hosts behind
 * inspecting proxies.
 */
public final class HttpClientFactory {
    private HttpClientFactory() {
    }

    public static HttpClient create(Duration connectTimeout) {
        return create(connectTimeout, System.getenv());
    }

    static HttpClient create(Duration connectTimeout, Map<String, String> environment) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL);
        String truststorePath = environment.get("TRUSTSTORE_PATH");
        if (truststorePath != null && !truststorePath.isBlank()) {
            builder.sslContext(sslContext(Path.of(truststorePath), environment.get("TRUSTSTORE_PASSWORD")));
        }
        return builder.build();
    }

    private static SSLContext sslContext(Path path, String password) {
        if (password == null) {
            throw new IllegalStateException("TRUSTSTORE_PASSWORD must be set when TRUSTSTORE_PATH is configured");
        }
        if (!Files.exists(path)) {
            throw new IllegalStateException("Truststore file does not exist: " + path);
        }
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        String type = name.endsWith(".p12") || name.endsWith(".pfx") ? "PKCS12" : "JKS";
        try (InputStream in = Files.newInputStream(path)) {
            KeyStore trustStore = KeyStore.getInstance(type);
            trustStore.load(in, password.toCharArray());
            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(trustStore);
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, tmf.getTrustManagers(), null);
            return context;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to build SSL context from truststore " + path, e);
        }
    }
}
