package com.phillippitts.aerodefect;

import com.phillippitts.aerodefect.config.properties.EnsembleConfig;
import com.phillippitts.aerodefect.config.properties.ImageSourceProperties;
import com.phillippitts.aerodefect.config.properties.InspectionProperties;
import com.phillippitts.aerodefect.config.properties.PreprocessingProperties;
import com.phillippitts.aerodefect.config.properties.PrimaryDetectorProperties;
import com.phillippitts.aerodefect.config.properties.SecondaryDetectorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        EnsembleConfig.class,
        ImageSourceProperties.class,
        PreprocessingProperties.class,
        PrimaryDetectorProperties.class,
        SecondaryDetectorProperties.class,
        InspectionProperties.class
})
public class AeroDefectApplication {

    public static void main(String[] args) {
        SpringApplication.run(AeroDefectApplication.class, args);
    }

}
