package com.phillippitts.aerodefect.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Limits for images fetched by URL. Binds to {@code image-source.*}.
 *
 * @param connectTimeoutMs connection timeout for the image host
 * @param readTimeoutMs    hard limit for receiving the response
 * @param maxBytes         largest accepted image body; matches the multipart upload limit by default
 */
@Validated
@ConfigurationProperties(prefix = "image-source")
public record ImageSourceProperties(
        @Positive @DefaultValue("5000") int connectTimeoutMs,
        @Positive @DefaultValue("10000") int readTimeoutMs,
        @Positive @DefaultValue("26214400") int maxBytes
) {

    public static ImageSourceProperties defaults() {
        return new ImageSourceProperties(5000, 10000, 26_214_400);
    }
}
