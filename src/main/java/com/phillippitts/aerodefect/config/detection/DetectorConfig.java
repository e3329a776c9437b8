package com.phillippitts.aerodefect.config.detection;

import com.phillippitts.aerodefect.config.properties.InspectionProperties;
import com.phillippitts.aerodefect.config.properties.PrimaryDetectorProperties;
import com.phillippitts.aerodefect.config.properties.SecondaryDetectorProperties;
import com.phillippitts.aerodefect.service.detection.primary.ModelHandle;
import com.phillippitts.aerodefect.service.detection.primary.OnnxDetectionModel;
import com.phillippitts.aerodefect.service.detection.secondary.OpenAiVisionClient;
import com.phillippitts.aerodefect.service.detection.secondary.Sleeper;
import com.phillippitts.aerodefect.service.detection.secondary.VisionClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Wires both detector backends.
 *
 * <p>The ONNX model is not loaded here: {@link ModelHandle} loads it on the first job, so the
 * service starts (and reports health) even while weights are missing.
 */
@Configuration
public class DetectorConfig {

    private static final Logger LOG = LogManager.getLogger(DetectorConfig.class);

    @Bean
    public ModelHandle primaryModelHandle(PrimaryDetectorProperties props) {
        LOG.info("Primary detector: model={}, inputSize={}, threshold={}",
                props.modelPath(), props.inputSize(), props.confidenceThreshold());
        return new ModelHandle(() -> OnnxDetectionModel.load(props));
    }

    /**
     * HTTP client for the remote vision endpoint with connect and read timeouts from
     * {@code detector.secondary.*}. The read timeout is the hard per-call limit.
     *
     * <p>Backed by the JDK {@link HttpClient}, so interrupting the calling thread aborts a call in
     * flight. The orchestrator relies on that to release a remote branch abandoned at the job deadline.
     */
    @Bean
    public VisionClient visionClient(RestClient.Builder restClientBuilder, SecondaryDetectorProperties props,
                                     InspectionProperties inspection) {
        RestClient restClient = restClientBuilder.requestFactory(visionRequestFactory(props)).build();

        if (props.requestTimeoutMs() >= inspection.jobDeadlineMs()) {
            LOG.warn("detector.secondary.request-timeout-ms ({}) is not below inspection.job-deadline-ms ({}); "
                    + "a timed-out vision call can never be retried", props.requestTimeoutMs(),
                    inspection.jobDeadlineMs());
        }
        if (!props.hasApiKey()) {
            LOG.warn("detector.secondary.api-key is empty; remote vision detection is disabled");
        }
        LOG.info("Secondary detector: endpoint={}, model={}, maxAttempts={}",
                props.endpoint(), props.model(), props.maxAttempts());
        return new OpenAiVisionClient(restClient, props);
    }

    static JdkClientHttpRequestFactory visionRequestFactory(SecondaryDetectorProperties props) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(props.connectTimeoutMs()))
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(Duration.ofMillis(props.requestTimeoutMs()));
        return factory;
    }

    @Bean
    public Sleeper backoffSleeper() {
        return Sleeper.THREAD;
    }
}
