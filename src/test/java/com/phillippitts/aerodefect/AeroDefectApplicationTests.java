package com.phillippitts.aerodefect;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {
        "detector.primary.model-path=target/no-such-model.onnx",
        "detector.secondary.api-key="
})
class AeroDefectApplicationTests {

    @Test
    void contextLoads() {
    }

}
