package com.phillippitts.aerodefect.service.detection.primary;

import com.phillippitts.aerodefect.domain.BoundingBox;
import com.phillippitts.aerodefect.testutil.TestImages;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LetterboxTest {

    @Test
    void wideImageIsPaddedVertically() {
        Letterbox lb = Letterbox.of(1280, 640, 640);

        assertThat(lb.scale()).isEqualTo(0.5);
        assertThat(lb.padX()).isZero();
        assertThat(lb.padY()).isEqualTo(160);
    }

    @Test
    void mapsModelBoxBackToSourcePixels() {
        Letterbox lb = Letterbox.of(1280, 640, 640);

        BoundingBox box = lb.toSource(320, 320, 100, 50);

        assertThat(box.x()).isCloseTo(540, within(1e-9));
        assertThat(box.y()).isCloseTo(270, within(1e-9));
        assertThat(box.width()).isCloseTo(200, within(1e-9));
        assertThat(box.height()).isCloseTo(100, within(1e-9));
    }

    @Test
    void boxInPaddingIsClippedToImage() {
        Letterbox lb = Letterbox.of(1280, 640, 640);

        BoundingBox box = lb.toSource(320, 100, 100, 40);

        assertThat(box.isWellFormed()).isFalse();
    }

    @Test
    void renderFillsPaddingWithGray() {
        Letterbox lb = Letterbox.of(1280, 640, 640);

        BufferedImage canvas = lb.render(TestImages.uniform(1280, 640, 255));

        assertThat(canvas.getWidth()).isEqualTo(640);
        assertThat(canvas.getRGB(10, 10) & 0xFF).isEqualTo(Letterbox.PAD_VALUE);
        assertThat(canvas.getRGB(320, 320) & 0xFF).isEqualTo(255);
    }

    @Test
    void chwLayoutIsPlanarAndNormalized() {
        Letterbox lb = Letterbox.of(4, 4, 4);
        BufferedImage img = new BufferedImage(4, 4, BufferedImage.TYPE_INT_RGB);
        img.setRGB(0, 0, 0xFF0000);

        float[] chw = lb.toChw(img);

        assertThat(chw).hasSize(48);
        assertThat(chw[0]).isEqualTo(1f);
        assertThat(chw[16]).isZero();
        assertThat(chw[32]).isZero();
    }
}
