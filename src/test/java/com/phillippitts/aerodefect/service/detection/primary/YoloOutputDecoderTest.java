package com.phillippitts.aerodefect.service.detection.primary;

import com.phillippitts.aerodefect.domain.DefectClass;
import com.phillippitts.aerodefect.domain.Detection;
import com.phillippitts.aerodefect.domain.DetectionSource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class YoloOutputDecoderTest {

    private static final int CHANNELS = 4 + 12;
    private static final int ANCHORS = 20;

    private final Letterbox identity = Letterbox.of(640, 640, 640);
    private final YoloOutputDecoder decoder =
            new YoloOutputDecoder(YoloOutputDecoder.resolveClasses(List.of()), 0.5, 0.45);

    @Test
    void decodesBestClassAndSuppressesDuplicates() {
        float[][] out = new float[CHANNELS][ANCHORS];
        anchor(out, 0, 320, 320, 100, 50, DefectClass.CRACK.ordinal(), 0.9f);
        anchor(out, 1, 322, 320, 100, 50, DefectClass.CRACK.ordinal(), 0.8f);
        anchor(out, 2, 100, 100, 30, 30, DefectClass.SCRATCH.ordinal(), 0.3f);

        List<Detection> detections = decoder.decode(out, identity);

        assertThat(detections).singleElement().satisfies(d -> {
            assertThat(d.defectClass()).isEqualTo(DefectClass.CRACK);
            assertThat(d.source()).isEqualTo(DetectionSource.PRIMARY);
            assertThat(d.confidence()).isCloseTo(0.9, within(1e-6));
            assertThat(d.bbox().x()).isCloseTo(270, within(1e-6));
            assertThat(d.bbox().y()).isCloseTo(295, within(1e-6));
        });
    }

    @Test
    void handlesTransposedExport() {
        float[][] out = new float[CHANNELS][ANCHORS];
        anchor(out, 5, 200, 200, 40, 40, DefectClass.BURN_MARK.ordinal(), 0.75f);
        float[][] transposed = new float[ANCHORS][CHANNELS];
        for (int r = 0; r < CHANNELS; r++) {
            for (int c = 0; c < ANCHORS; c++) {
                transposed[c][r] = out[r][c];
            }
        }

        List<Detection> detections = decoder.decode(transposed, identity);

        assertThat(detections).singleElement()
                .extracting(Detection::defectClass).isEqualTo(DefectClass.BURN_MARK);
    }

    @Test
    void differentClassesAreNotSuppressed() {
        float[][] out = new float[CHANNELS][ANCHORS];
        anchor(out, 0, 320, 320, 100, 50, DefectClass.CRACK.ordinal(), 0.9f);
        anchor(out, 1, 320, 320, 100, 50, DefectClass.SCRATCH.ordinal(), 0.8f);

        assertThat(decoder.decode(out, identity)).hasSize(2);
    }

    @Test
    void unknownConfiguredLabelIsIgnored() {
        YoloOutputDecoder partial = new YoloOutputDecoder(
                YoloOutputDecoder.resolveClasses(List.of("crack", "dent")), 0.5, 0.45);
        float[][] out = new float[4 + 2][ANCHORS];
        anchor(out, 0, 100, 100, 20, 20, 1, 0.9f);
        anchor(out, 1, 400, 400, 20, 20, 0, 0.8f);

        assertThat(partial.decode(out, identity)).singleElement()
                .extracting(Detection::defectClass).isEqualTo(DefectClass.CRACK);
    }

    @Test
    void resolvesConfiguredOrder() {
        assertThat(YoloOutputDecoder.resolveClasses(List.of("crack", "Burn Mark", "dent")))
                .containsExactly(DefectClass.CRACK, DefectClass.BURN_MARK, null);
        assertThat(YoloOutputDecoder.resolveClasses(List.of())).containsExactly(DefectClass.values());
    }

    @Test
    void rejectsOutputWithoutClassRows() {
        assertThatThrownBy(() -> decoder.decode(new float[4][10], identity))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("4 channels");
    }

    private static void anchor(float[][] out, int i, float cx, float cy, float w, float h, int cls, float score) {
        out[0][i] = cx;
        out[1][i] = cy;
        out[2][i] = w;
        out[3][i] = h;
        out[4 + cls][i] = score;
    }
}
