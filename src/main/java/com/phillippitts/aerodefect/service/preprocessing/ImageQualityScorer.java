package com.phillippitts.aerodefect.service.preprocessing;

import org.bytedeco.javacpp.indexer.Indexer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;

/**
 * Scores image quality in [0,100] from two equally weighted halves:
 * <ul>
 *   <li>sharpness: variance of the Laplacian of the gray image, saturating at 1000</li>
 *   <li>brightness: closeness of mean gray level to mid-gray (128)</li>
 * </ul>
 */
final class ImageQualityScorer {

    static final double SHARPNESS_SATURATION = 1000.0;

    private ImageQualityScorer() {}

    static double score(Mat bgr) {
        Mat gray = toGray(bgr);
        return sharpnessScore(gray) + brightnessScore(mean(gray));
    }

    static double sharpnessScore(Mat gray) {
        Mat laplacian = new Mat();
        opencv_imgproc.Laplacian(gray, laplacian, opencv_core.CV_64F);
        double deviation = stdDev(laplacian);
        return Math.min(deviation * deviation / SHARPNESS_SATURATION, 1.0) * 50.0;
    }

    static double brightnessScore(double meanLuma) {
        double deviation = Math.abs(meanLuma - 128.0) / 128.0;
        return Math.max(0.0, 1.0 - deviation) * 50.0;
    }

    static double meanLuma(Mat bgr) {
        return mean(toGray(bgr));
    }

    static Mat toGray(Mat bgr) {
        if (bgr.channels() == 1) {
            return bgr;
        }
        Mat gray = new Mat();
        opencv_imgproc.cvtColor(bgr, gray, opencv_imgproc.COLOR_BGR2GRAY);
        return gray;
    }

    static double mean(Mat gray) {
        return opencv_core.mean(gray).get(0);
    }

    static double stdDev(Mat values) {
        Mat mean = new Mat();
        Mat stddev = new Mat();
        opencv_core.meanStdDev(values, mean, stddev);
        try (Indexer indexer = stddev.createIndexer()) {
            return indexer.getDouble(0);
        }
    }
}
