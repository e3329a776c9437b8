package com.phillippitts.aerodefect.presentation.controller;

import com.phillippitts.aerodefect.domain.EnsembleResult;
import com.phillippitts.aerodefect.exception.PreprocessingException;
import com.phillippitts.aerodefect.service.orchestration.InspectionService;
import com.phillippitts.aerodefect.service.preprocessing.ImageDownloader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * Defect detection endpoint. Accepts one image either as multipart form data or as a JSON
 * {@link DetectionRequest} pointing at an image URL.
 */
@RestController
class InspectionController {

    private static final Logger LOG = LogManager.getLogger(InspectionController.class);

    private final InspectionService inspectionService;
    private final ImageDownloader imageDownloader;

    InspectionController(InspectionService inspectionService, ImageDownloader imageDownloader) {
        this.inspectionService = inspectionService;
        this.imageDownloader = imageDownloader;
    }

    @PostMapping(path = "/ml/detect", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<DetectionResponse> detect(@RequestPart("image") MultipartFile image,
                                             @RequestParam(name = "inspectionId", required = false)
                                             String inspectionId) throws IOException {
        if (image.isEmpty()) {
            throw new PreprocessingException("uploaded image is empty");
        }
        LOG.info("Detection request: file size={} bytes, contentType={}", image.getSize(), image.getContentType());
        EnsembleResult result = inspectionService.submit(image.getBytes(), inspectionId);
        return ResponseEntity.ok(DetectionResponse.of(result));
    }

    @PostMapping(path = "/ml/detect", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<DetectionResponse> detectFromUrl(@RequestBody DetectionRequest request) {
        if (!StringUtils.hasText(request.imageUrl())) {
            throw new PreprocessingException("imageUrl is required");
        }
        byte[] bytes = imageDownloader.download(request.imageUrl());
        LOG.info("Detection request: image by URL, size={} bytes", bytes.length);
        EnsembleResult result = inspectionService.submit(bytes, request.inspectionId());
        return ResponseEntity.ok(DetectionResponse.of(result));
    }
}
