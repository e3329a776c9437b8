/**
 * Remote vision-model branch.
 *
 * <p>{@link com.phillippitts.aerodefect.service.detection.secondary.SecondaryDetectorAdapter} owns the
 * retry loop; {@link com.phillippitts.aerodefect.service.detection.secondary.VisionClient} owns one
 * HTTP call; the parser turns model text into detections.
 */
package com.phillippitts.aerodefect.service.detection.secondary;
