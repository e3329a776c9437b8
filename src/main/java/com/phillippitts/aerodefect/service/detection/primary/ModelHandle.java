package com.phillippitts.aerodefect.service.detection.primary;

import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Lazily loaded, shared {@link DetectionModel}.
 *
 * <p>The loader runs at most once successfully: the first caller of {@link #get()} loads the model
 * while concurrent callers wait on the init lock; every later call is a single volatile read. A failed
 * load is not cached, so the next job tries again (e.g. after the weights file is deployed).
 */
public class ModelHandle {

    private static final Logger LOG = LogManager.getLogger(ModelHandle.class);

    private final Supplier<? extends DetectionModel> loader;
    private final Object initLock = new Object();
    private volatile DetectionModel model;
    private volatile boolean closed;

    public ModelHandle(Supplier<? extends DetectionModel> loader) {
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    /**
     * @return the loaded model
     * @throws com.phillippitts.aerodefect.exception.DetectorUnavailableException if loading fails
     * @throws IllegalStateException if the handle was closed
     */
    public DetectionModel get() {
        DetectionModel current = model;
        if (current != null) {
            return current;
        }
        synchronized (initLock) {
            if (closed) {
                throw new IllegalStateException("Model handle closed");
            }
            if (model == null) {
                model = Objects.requireNonNull(loader.get(), "loader returned null");
                LOG.info("Primary detection model ready: {}", model.name());
            }
            return model;
        }
    }

    public boolean isLoaded() {
        return model != null;
    }

    @PreDestroy
    public void close() {
        synchronized (initLock) {
            closed = true;
            if (model != null) {
                model.close();
                model = null;
            }
        }
    }
}
