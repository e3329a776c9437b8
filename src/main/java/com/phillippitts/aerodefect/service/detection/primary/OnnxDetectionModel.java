package com.phillippitts.aerodefect.service.detection.primary;

import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OnnxValue;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import com.phillippitts.aerodefect.config.properties.PrimaryDetectorProperties;
import com.phillippitts.aerodefect.domain.Detection;
import com.phillippitts.aerodefect.exception.DetectorUnavailableException;
import com.phillippitts.aerodefect.exception.ModelNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.awt.image.BufferedImage;
import java.nio.FloatBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * YOLOv8 defect model served by ONNX Runtime.
 *
 * <p>{@link OrtSession#run} is safe for concurrent callers, so one instance serves every job.
 * Per-call tensors are created and closed inside {@link #predict(BufferedImage)}.
 */
public final class OnnxDetectionModel implements DetectionModel {

    private static final Logger LOG = LogManager.getLogger(OnnxDetectionModel.class);

    static final String DETECTOR_NAME = PrimaryDetectorAdapter.DETECTOR_NAME;

    private final OrtEnvironment env;
    private final OrtSession session;
    private final String inputName;
    private final int inputSize;
    private final YoloOutputDecoder decoder;
    private final String name;

    private OnnxDetectionModel(OrtEnvironment env, OrtSession session, int inputSize,
                               YoloOutputDecoder decoder, String name) {
        this.env = env;
        this.session = session;
        this.inputName = session.getInputNames().iterator().next();
        this.inputSize = inputSize;
        this.decoder = decoder;
        this.name = name;
    }

    /**
     * Loads weights from {@link PrimaryDetectorProperties#modelPath()}.
     *
     * @throws ModelNotFoundException       if the weights file is missing
     * @throws DetectorUnavailableException if ONNX Runtime rejects the model
     */
    public static OnnxDetectionModel load(PrimaryDetectorProperties props) {
        Path path = Path.of(props.modelPath());
        if (!Files.isRegularFile(path)) {
            throw new ModelNotFoundException(props.modelPath(), DETECTOR_NAME);
        }
        long start = System.nanoTime();
        try {
            OrtEnvironment env = OrtEnvironment.getEnvironment();
            OrtSession session = env.createSession(path.toString(), new OrtSession.SessionOptions());
            YoloOutputDecoder decoder = new YoloOutputDecoder(
                    YoloOutputDecoder.resolveClasses(props.classNames()),
                    props.confidenceThreshold(),
                    props.modelNmsThreshold());
            LOG.info("Loaded ONNX defect model from {} in {} ms", path.getFileName(),
                    (System.nanoTime() - start) / 1_000_000L);
            return new OnnxDetectionModel(env, session, props.inputSize(), decoder,
                    String.valueOf(path.getFileName()));
        } catch (OrtException e) {
            throw new DetectorUnavailableException("Failed to load ONNX model " + path.getFileName(),
                    DETECTOR_NAME, e);
        }
    }

    @Override
    public List<Detection> predict(BufferedImage image) {
        Letterbox letterbox = Letterbox.of(image.getWidth(), image.getHeight(), inputSize);
        float[] pixels = letterbox.toChw(letterbox.render(image));
        long[] shape = {1L, 3L, inputSize, inputSize};

        try (OnnxTensor tensor = OnnxTensor.createTensor(env, FloatBuffer.wrap(pixels), shape);
             OrtSession.Result result = session.run(Collections.singletonMap(inputName, tensor))) {
            OnnxValue first = result.get(0);
            Object value = first.getValue();
            if (!(value instanceof float[][][] batch) || batch.length == 0) {
                throw new DetectorUnavailableException("Unexpected model output type "
                        + (value == null ? "null" : value.getClass().getSimpleName()), DETECTOR_NAME);
            }
            return decoder.decode(batch[0], letterbox);
        } catch (OrtException e) {
            throw new DetectorUnavailableException("ONNX inference failed", DETECTOR_NAME, e);
        } catch (IllegalArgumentException e) {
            throw new DetectorUnavailableException("Malformed model output: " + e.getMessage(), DETECTOR_NAME, e);
        }
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void close() {
        try {
            session.close();
        } catch (OrtException e) {
            LOG.warn("Error closing ONNX session for {}: {}", name, e.getMessage());
        }
    }
}
