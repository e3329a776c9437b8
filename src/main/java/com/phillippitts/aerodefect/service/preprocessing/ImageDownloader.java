package com.phillippitts.aerodefect.service.preprocessing;

import com.phillippitts.aerodefect.config.properties.ImageSourceProperties;
import com.phillippitts.aerodefect.exception.PreprocessingException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Objects;

/**
 * Fetches an inspection image referenced by URL.
 *
 * <p>Only absolute {@code http}/{@code https} URLs are followed. Every failure (bad URL, transport
 * error, timeout, non-2xx status, empty or oversized body) surfaces as a
 * {@link PreprocessingException}, so the caller answers it like an undecodable upload.
 */
@Component
public class ImageDownloader {

    private static final Logger LOG = LogManager.getLogger(ImageDownloader.class);

    private final RestClient restClient;
    private final ImageSourceProperties properties;

    @Autowired
    public ImageDownloader(RestClient.Builder restClientBuilder, ImageSourceProperties properties) {
        this(restClientBuilder.requestFactory(requestFactory(properties)).build(), properties);
    }

    ImageDownloader(RestClient restClient, ImageSourceProperties properties) {
        this.restClient = Objects.requireNonNull(restClient);
        this.properties = Objects.requireNonNull(properties);
    }

    /**
     * @param imageUrl absolute http(s) URL of a JPEG, PNG or other decodable image
     * @return the raw response body
     * @throws PreprocessingException if the image cannot be fetched
     */
    public byte[] download(String imageUrl) {
        URI uri = toHttpUri(imageUrl);
        long start = System.nanoTime();
        byte[] body;
        try {
            body = restClient.get().uri(uri).exchange((request, response) -> readBody(response));
        } catch (RestClientException e) {
            throw new PreprocessingException("image download failed: " + e.getMostSpecificCause().getMessage(), e);
        }
        LOG.info("Downloaded image: {} bytes from host {} in {} ms", body.length, uri.getHost(),
                (System.nanoTime() - start) / 1_000_000L);
        return body;
    }

    private byte[] readBody(ClientHttpResponse response) throws IOException {
        HttpStatusCode status = response.getStatusCode();
        if (!status.is2xxSuccessful()) {
            throw new PreprocessingException("image download failed: HTTP " + status.value());
        }
        int max = properties.maxBytes();
        if (response.getHeaders().getContentLength() > max) {
            throw new PreprocessingException("image at URL exceeds " + max + " bytes");
        }
        byte[] body = response.getBody().readNBytes(max + 1);
        if (body.length > max) {
            throw new PreprocessingException("image at URL exceeds " + max + " bytes");
        }
        if (body.length == 0) {
            throw new PreprocessingException("downloaded image is empty");
        }
        return body;
    }

    static URI toHttpUri(String imageUrl) {
        if (imageUrl == null || imageUrl.isBlank()) {
            throw new PreprocessingException("imageUrl is required");
        }
        URI uri;
        try {
            uri = new URI(imageUrl.trim());
        } catch (URISyntaxException e) {
            throw new PreprocessingException("imageUrl is not a valid URL", e);
        }
        String scheme = uri.getScheme();
        boolean http = "http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
        if (!http || uri.getHost() == null) {
            throw new PreprocessingException("imageUrl must be an absolute http or https URL");
        }
        return uri;
    }

    static JdkClientHttpRequestFactory requestFactory(ImageSourceProperties properties) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(properties.connectTimeoutMs()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(Duration.ofMillis(properties.readTimeoutMs()));
        return factory;
    }
}
