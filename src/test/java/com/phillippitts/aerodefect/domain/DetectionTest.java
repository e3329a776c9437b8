package com.phillippitts.aerodefect.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DetectionTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void rejectsConfidenceOutsideUnitInterval() {
        BoundingBox box = new BoundingBox(0, 0, 1, 1);

        assertThatThrownBy(() -> new Detection(DefectClass.CRACK, 1.01, box, DetectionSource.PRIMARY))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Detection(DefectClass.CRACK, -0.1, box, DetectionSource.PRIMARY))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNullFields() {
        assertThatThrownBy(() -> new Detection(null, 0.5, new BoundingBox(0, 0, 1, 1), DetectionSource.PRIMARY))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void serializesWithWireNames() throws Exception {
        Detection d = new Detection(DefectClass.BURN_MARK, 0.8, new BoundingBox(1, 2, 3, 4), DetectionSource.ENSEMBLE);

        JsonNode json = mapper.readTree(mapper.writeValueAsString(d));

        assertThat(json.get("class").asText()).isEqualTo("burn_mark");
        assertThat(json.get("source").asText()).isEqualTo("ensemble");
        assertThat(json.get("bbox").get("width").asDouble()).isEqualTo(3.0);
        assertThat(json.has("description")).isFalse();
    }

    @Test
    void ensembleResultSerializesDetectionsAsDefects() throws Exception {
        EnsembleResult result = new EnsembleResult(
                List.of(new Detection(DefectClass.CRACK, 0.9, new BoundingBox(1, 2, 3, 4), DetectionSource.PRIMARY)),
                42, true, List.of("Secondary detector unavailable"), 75.0,
                new InspectionMetadata("insp-1", "job-1", 1, 0, 1, new InspectionMetadata.Dimensions(640, 480)));

        JsonNode json = mapper.readTree(mapper.writeValueAsString(result));

        assertThat(json.get("defects")).hasSize(1);
        assertThat(json.get("degraded").asBoolean()).isTrue();
        assertThat(json.get("warnings").get(0).asText()).contains("Secondary");
        assertThat(json.get("metadata").get("originalDimensions").get("width").asInt()).isEqualTo(640);
    }

    @Test
    void failedDetectionSetIsEmpty() {
        DetectionSet set = DetectionSet.failure("boom", 12);

        assertThat(set.isFailed()).isTrue();
        assertThat(set.detections()).isEmpty();
        assertThat(DetectionSet.success(List.of(), 5).isFailed()).isFalse();
    }
}
