package com.phillippitts.aerodefect.service.detection.secondary;

/**
 * Transport to a remote vision-language model.
 *
 * <p>Implementations perform exactly one call per invocation (no internal retries), enforce their
 * own per-call timeout and report every failure through {@link VisionCallResult}; they do not throw
 * for network or HTTP errors.
 */
public interface VisionClient {

    VisionCallResult call(VisionRequest request);

    /**
     * @return false when the client can never succeed (e.g. no credentials)
     */
    boolean isConfigured();
}
