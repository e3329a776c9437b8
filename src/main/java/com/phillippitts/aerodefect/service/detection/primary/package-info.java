/**
 * Local object-detection branch: ONNX model loading, letterboxing, YOLO output decoding and the
 * adapter that turns model output into a {@link com.phillippitts.aerodefect.domain.DetectionSet}.
 */
package com.phillippitts.aerodefect.service.detection.primary;
