package com.phillippitts.aerodefect.service.preprocessing;

import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.opencv_core.Mat;

import java.awt.AlphaComposite;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;

/**
 * Copies pixels between {@link BufferedImage} and 8-bit BGR {@link Mat}.
 *
 * <p>{@code TYPE_3BYTE_BGR} rasters share OpenCV's byte order, so each direction is one bulk copy.
 * Images leaving this class are {@code TYPE_INT_RGB}, the type the detectors consume.
 */
final class OpenCvImages {

    private OpenCvImages() {}

    static Mat toMat(BufferedImage image) {
        BufferedImage bgr = redraw(image, BufferedImage.TYPE_3BYTE_BGR);
        byte[] pixels = ((DataBufferByte) bgr.getRaster().getDataBuffer()).getData();
        Mat mat = new Mat(bgr.getHeight(), bgr.getWidth(), opencv_core.CV_8UC3);
        mat.data().put(pixels);
        return mat;
    }

    static BufferedImage toBufferedImage(Mat bgr) {
        Mat source = bgr.isContinuous() ? bgr : bgr.clone();
        BufferedImage out = new BufferedImage(source.cols(), source.rows(), BufferedImage.TYPE_3BYTE_BGR);
        byte[] pixels = ((DataBufferByte) out.getRaster().getDataBuffer()).getData();
        source.data().get(pixels);
        return redraw(out, BufferedImage.TYPE_INT_RGB);
    }

    private static BufferedImage redraw(BufferedImage input, int type) {
        BufferedImage out = new BufferedImage(input.getWidth(), input.getHeight(), type);
        Graphics2D g = out.createGraphics();
        g.setComposite(AlphaComposite.Src);
        g.drawImage(input, 0, 0, null);
        g.dispose();
        return out;
    }
}
