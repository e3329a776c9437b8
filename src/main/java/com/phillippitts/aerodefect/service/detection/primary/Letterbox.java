package com.phillippitts.aerodefect.service.detection.primary;

import com.phillippitts.aerodefect.domain.BoundingBox;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Aspect-preserving resize into a square model input, padded with gray.
 *
 * @param scale   source-to-model scale factor
 * @param padX    horizontal padding on the left, in model pixels
 * @param padY    vertical padding on the top, in model pixels
 * @param size    model input side length
 * @param sourceW source image width
 * @param sourceH source image height
 */
record Letterbox(double scale, int padX, int padY, int size, int sourceW, int sourceH) {

    static final int PAD_VALUE = 114;

    static Letterbox of(int sourceW, int sourceH, int size) {
        double scale = Math.min((double) size / sourceW, (double) size / sourceH);
        int scaledW = (int) Math.round(sourceW * scale);
        int scaledH = (int) Math.round(sourceH * scale);
        return new Letterbox(scale, (size - scaledW) / 2, (size - scaledH) / 2, size, sourceW, sourceH);
    }

    BufferedImage render(BufferedImage source) {
        BufferedImage canvas = new BufferedImage(size, size, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = canvas.createGraphics();
        try {
            g.setColor(new Color(PAD_VALUE, PAD_VALUE, PAD_VALUE));
            g.fillRect(0, 0, size, size);
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(source, padX, padY,
                    (int) Math.round(sourceW * scale), (int) Math.round(sourceH * scale), null);
        } finally {
            g.dispose();
        }
        return canvas;
    }

    /**
     * Planar RGB floats in [0,1], laid out {@code [3][size][size]}.
     */
    float[] toChw(BufferedImage letterboxed) {
        int area = size * size;
        int[] rgb = letterboxed.getRGB(0, 0, size, size, null, 0, size);
        float[] chw = new float[3 * area];
        for (int i = 0; i < area; i++) {
            int p = rgb[i];
            chw[i] = ((p >> 16) & 0xFF) / 255f;
            chw[area + i] = ((p >> 8) & 0xFF) / 255f;
            chw[2 * area + i] = (p & 0xFF) / 255f;
        }
        return chw;
    }

    /**
     * Maps a center-format box in model space back to the source image, clipped to its bounds.
     */
    BoundingBox toSource(double cx, double cy, double w, double h) {
        double x1 = (cx - w / 2.0 - padX) / scale;
        double y1 = (cy - h / 2.0 - padY) / scale;
        double x2 = (cx + w / 2.0 - padX) / scale;
        double y2 = (cy + h / 2.0 - padY) / scale;
        return new BoundingBox(x1, y1, x2 - x1, y2 - y1).clampTo(sourceW, sourceH);
    }
}
