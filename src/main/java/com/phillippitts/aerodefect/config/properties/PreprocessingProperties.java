package com.phillippitts.aerodefect.config.properties;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Image validation and normalization settings.
 *
 * @param minDimension smallest accepted width or height in pixels
 * @param maxDimension largest accepted width or height in pixels
 * @param qualityFloor quality scores below this add a warning (0-100)
 * @param clipLimit    histogram clip limit for contrast equalization, as a multiple of the mean bin
 */
@Validated
@ConfigurationProperties(prefix = "preprocessing")
public record PreprocessingProperties(
        @Positive @DefaultValue("640") int minDimension,
        @Positive @DefaultValue("4096") int maxDimension,
        @Min(0) @Max(100) @DefaultValue("60") double qualityFloor,
        @DecimalMin("1.0") @DefaultValue("2.0") double clipLimit
) {

    public PreprocessingProperties {
        if (minDimension > maxDimension) {
            throw new IllegalArgumentException("preprocessing.min-dimension (" + minDimension
                    + ") must not exceed preprocessing.max-dimension (" + maxDimension + ")");
        }
    }

    public static PreprocessingProperties defaults() {
        return new PreprocessingProperties(640, 4096, 60, 2.0);
    }
}
