package com.phillippitts.aerodefect.testutil;

import com.phillippitts.aerodefect.domain.BoundingBox;
import com.phillippitts.aerodefect.domain.DefectClass;
import com.phillippitts.aerodefect.domain.Detection;
import com.phillippitts.aerodefect.domain.DetectionSource;

/**
 * Short-hand factories for detections in tests.
 */
public final class Detections {

    private Detections() {
    }

    public static Detection primary(DefectClass c, double conf, double x, double y, double w, double h) {
        return new Detection(c, conf, new BoundingBox(x, y, w, h), DetectionSource.PRIMARY);
    }

    public static Detection secondary(DefectClass c, double conf, double x, double y, double w, double h) {
        return new Detection(c, conf, new BoundingBox(x, y, w, h), DetectionSource.SECONDARY);
    }
}
