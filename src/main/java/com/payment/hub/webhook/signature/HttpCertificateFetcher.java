package com.payment.hub.webhook.signature;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.ByteArrayInputStream;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Downloads PEM/DER certificates over HTTPS and keeps them per URL for the life of the
 * process.
 */
@Slf4j
public class HttpCertificateFetcher implements CertificateFetcher {

    private final RestTemplate restTemplate;
    private final Map<String, X509Certificate> certificates = new ConcurrentHashMap<>();

    public HttpCertificateFetcher(Duration timeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) timeout.toMillis());
        factory.setReadTimeout((int) timeout.toMillis());
        this.restTemplate = new RestTemplate(factory);
    }

    @Override
    public X509Certificate fetch(String certificateUrl) {
        return certificates.computeIfAbsent(certificateUrl, this::download);
    }

    private X509Certificate download(String url) {
        try {
            byte[] body = restTemplate.getForObject(url, byte[].class);
            if (body == null || body.length == 0) {
                throw new IllegalArgumentException("Empty certificate response from " + url);
            }
            CertificateFactory factory = CertificateFactory.getInstance("X.509");
            X509Certificate certificate = (X509Certificate) factory.generateCertificate(new ByteArrayInputStream(body));
            log.info("Webhook signing certificate loaded: subject={}", certificate.getSubjectX500Principal().getName());
            return certificate;
        } catch (RestClientException e) {
            throw new IllegalArgumentException("Certificate download failed: " + e.getMessage(), e);
        } catch (CertificateException e) {
            throw new IllegalArgumentException("Certificate cannot be parsed: " + e.getMessage(), e);
        }
    }
}
