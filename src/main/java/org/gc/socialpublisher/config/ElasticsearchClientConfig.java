package org.gc.socialpublisher.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.elasticsearch.client.ClientConfiguration;
import org.springframework.data.elasticsearch.client.elc.ElasticsearchClients;
import org.springframework.data.elasticsearch.client.elc.ElasticsearchConfiguration;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.time.Duration;

/**
 * Elasticsearch connection. TLS is enabled when a CA certificate path is configured, basic auth
 * when both credentials are present.
 */
@Slf4j
@Configuration
public class ElasticsearchClientConfig extends ElasticsearchConfiguration {

    @Value("${es.trust-store:}")
    private String trustStore;

    @Value("${es.username:}")
    private String username;

    @Value("${es.password:}")
    private String password;

    @Value("${es.cluster-nodes:localhost:9200}")
    private String cluster;

    @Override
    public ClientConfiguration clientConfiguration() {
        var builder = ClientConfiguration.builder()
                .connectedTo(cluster.split(","));

        ClientConfiguration.TerminalClientConfigurationBuilder terminal = builder;
        if (hasText(trustStore)) {
            terminal = builder.usingSsl(sslContext(Path.of(trustStore)));
        }
        if (hasText(username) && hasText(password)) {
            terminal = terminal.withBasicAuth(username, password);
        }
        log.info("Elasticsearch nodes: {} (tls={}, auth={})", cluster, hasText(trustStore), hasText(username));

        return terminal.withClientConfigurer(ElasticsearchClients.ElasticsearchHttpClientConfigurationCallback.from(httpAsyncClientBuilder -> {
                    httpAsyncClientBuilder.setKeepAliveStrategy((response, context) -> Duration.ofMinutes(5).toMillis());
                    return httpAsyncClientBuilder;
                }))
                .build();
    }

    private static SSLContext sslContext(Path caCertificate) {
        try (InputStream certificateInputStream = Files.newInputStream(caCertificate)) {
            Certificate ca = CertificateFactory.getInstance("X.509").generateCertificate(certificateInputStream);

            KeyStore keyStore = KeyStore.getInstance(KeyStore.getDefaultType());
            keyStore.load(null, null);
            keyStore.setCertificateEntry("ca", ca);

            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(keyStore);

            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, tmf.getTrustManagers(), null);
            return context;
        } catch (IOException | GeneralSecurityException e) {
            throw new IllegalStateException("Cannot load Elasticsearch CA certificate " + caCertificate, e);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
