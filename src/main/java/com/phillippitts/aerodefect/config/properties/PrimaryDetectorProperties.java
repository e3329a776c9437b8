package com.phillippitts.aerodefect.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Local object-detection model settings. Binds to {@code detector.primary.*}.
 *
 * @param modelPath           path to the exported ONNX weights
 * @param inputSize           square model input size; images are letterboxed to it
 * @param confidenceThreshold detections below this are discarded during post-processing
 * @param modelNmsThreshold   IoU threshold of the model-level per-class NMS
 * @param classNames          model output labels in index order; empty means defect class declaration order
 */
@Validated
@ConfigurationProperties(prefix = "detector.primary")
public record PrimaryDetectorProperties(
        @NotBlank @DefaultValue("models/defect-yolov8.onnx") String modelPath,
        @Positive @DefaultValue("640") int inputSize,
        @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("0.5") double confidenceThreshold,
        @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("0.45") double modelNmsThreshold,
        List<String> classNames
) {

    public PrimaryDetectorProperties {
        classNames = classNames == null ? List.of() : List.copyOf(classNames);
    }
}
