package com.phillippitts.aerodefect.service.detection.secondary;

import com.phillippitts.aerodefect.domain.BoundingBox;
import com.phillippitts.aerodefect.domain.DefectClass;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds the inspection prompt sent with every image.
 */
final class VisionPromptBuilder {

    private static final String CLASS_LIST = Stream.of(DefectClass.values())
            .map(DefectClass::wireName)
            .collect(Collectors.joining(", "));

    private VisionPromptBuilder() {
    }

    static String build(int imageWidth, int imageHeight, List<BoundingBox> candidateRegions) {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("You are an expert aircraft maintenance inspector analyzing images for defects.\n\n")
                .append("Analyze this aircraft image (").append(imageWidth).append('x').append(imageHeight)
                .append(" pixels) and identify any defects from the following categories:\n")
                .append(CLASS_LIST).append("\n\n")
                .append("For each defect you detect:\n")
                .append("1. Identify the defect type (must be one of the categories above)\n")
                .append("2. Estimate the confidence level (0.0 to 1.0)\n")
                .append("3. Provide the bounding box in pixel coordinates of the image (x, y, width, height)\n\n");

        if (candidateRegions != null && !candidateRegions.isEmpty()) {
            sb.append("A local detector flagged these regions; examine them closely but report defects anywhere:\n");
            for (BoundingBox r : candidateRegions) {
                sb.append(String.format(Locale.ROOT, "- x=%.0f, y=%.0f, width=%.0f, height=%.0f%n",
                        r.x(), r.y(), r.width(), r.height()));
            }
            sb.append('\n');
        }

        sb.append("Return your response as a JSON array with this exact format:\n")
                .append("[\n")
                .append("  {\n")
                .append("    \"class\": \"defect_type\",\n")
                .append("    \"confidence\": 0.85,\n")
                .append("    \"bbox\": {\"x\": 100, \"y\": 150, \"width\": 50, \"height\": 60},\n")
                .append("    \"description\": \"Brief description of the defect\"\n")
                .append("  }\n")
                .append("]\n\n")
                .append("If no defects are found, return an empty array: []\n\n")
                .append("Important:\n")
                .append("- Only detect defects from the specified categories\n")
                .append("- Be conservative with confidence scores\n")
                .append("- Focus on visible structural defects, not normal aircraft features");
        return sb.toString();
    }
}
