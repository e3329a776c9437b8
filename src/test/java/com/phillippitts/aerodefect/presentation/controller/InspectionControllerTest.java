package com.phillippitts.aerodefect.presentation.controller;

import com.phillippitts.aerodefect.domain.BoundingBox;
import com.phillippitts.aerodefect.domain.DefectClass;
import com.phillippitts.aerodefect.domain.Detection;
import com.phillippitts.aerodefect.domain.DetectionSource;
import com.phillippitts.aerodefect.domain.EnsembleResult;
import com.phillippitts.aerodefect.domain.InspectionMetadata;
import com.phillippitts.aerodefect.exception.InferenceUnavailableException;
import com.phillippitts.aerodefect.exception.PreprocessingException;
import com.phillippitts.aerodefect.service.orchestration.InspectionService;
import com.phillippitts.aerodefect.service.preprocessing.ImageDownloader;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(InspectionController.class)
class InspectionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private InspectionService inspectionService;

    @MockBean
    private ImageDownloader imageDownloader;

    private final MockMultipartFile image =
            new MockMultipartFile("image", "wing.jpg", "image/jpeg", new byte[] {1, 2, 3});

    @Test
    void returnsRankedDefects() throws Exception {
        EnsembleResult result = new EnsembleResult(
                List.of(new Detection(DefectClass.CRACK, 0.85, new BoundingBox(101, 99, 49, 51), DetectionSource.ENSEMBLE)),
                1234, false, List.of(), 88.5,
                new InspectionMetadata("insp-9", "job-1", 1, 1, 1, new InspectionMetadata.Dimensions(1920, 1080)));
        when(inspectionService.submit(any(), eq("insp-9"))).thenReturn(result);

        mockMvc.perform(multipart("/ml/detect").file(image).param("inspectionId", "insp-9"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.defects[0].class").value("crack"))
                .andExpect(jsonPath("$.data.defects[0].source").value("ensemble"))
                .andExpect(jsonPath("$.data.defects[0].bbox.x").value(101.0))
                .andExpect(jsonPath("$.data.degraded").value(false))
                .andExpect(jsonPath("$.data.metadata.inspectionId").value("insp-9"));
    }

    @Test
    void echoesRequestIdHeader() throws Exception {
        when(inspectionService.submit(any(), any())).thenReturn(new EnsembleResult(List.of(), 5, false,
                List.of(), 90, null));

        mockMvc.perform(multipart("/ml/detect").file(image).header("X-Request-ID", "req-77"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-ID", "req-77"));
    }

    @Test
    void invalidImageIs400() throws Exception {
        when(inspectionService.submit(any(), any())).thenThrow(new PreprocessingException("unsupported or corrupt image data"));

        mockMvc.perform(multipart("/ml/detect").file(image))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_IMAGE"));
    }

    @Test
    void missingImagePartIs400() throws Exception {
        mockMvc.perform(multipart("/ml/detect").param("inspectionId", "x"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_IMAGE"));
    }

    @Test
    void emptyUploadIs400WithoutRunningInspection() throws Exception {
        MockMultipartFile empty = new MockMultipartFile("image", "empty.jpg", "image/jpeg", new byte[0]);

        mockMvc.perform(multipart("/ml/detect").file(empty))
                .andExpect(status().isBadRequest());
        verify(inspectionService, never()).submit(any(), any());
    }

    @Test
    void bothDetectorsDownIs503() throws Exception {
        when(inspectionService.submit(any(), any()))
                .thenThrow(new InferenceUnavailableException("model missing", "timeout"));

        mockMvc.perform(multipart("/ml/detect").file(image))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.errorCode").value("INFERENCE_UNAVAILABLE"));
    }

    @Test
    void imageUrlIsDownloadedAndInspected() throws Exception {
        byte[] downloaded = {9, 8, 7};
        when(imageDownloader.download("https://images.example.com/wing.jpg")).thenReturn(downloaded);
        when(inspectionService.submit(downloaded, "insp-3")).thenReturn(new EnsembleResult(List.of(), 5, false,
                List.of(), 90, null));

        mockMvc.perform(post("/ml/detect").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"imageUrl\":\"https://images.example.com/wing.jpg\",\"inspectionId\":\"insp-3\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));
        verify(inspectionService).submit(downloaded, "insp-3");
    }

    @Test
    void blankImageUrlIs400WithoutDownloading() throws Exception {
        mockMvc.perform(post("/ml/detect").contentType(MediaType.APPLICATION_JSON).content("{\"imageUrl\":\" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_IMAGE"));
        verify(imageDownloader, never()).download(any());
        verify(inspectionService, never()).submit(any(), any());
    }

    @Test
    void failedDownloadIs400() throws Exception {
        when(imageDownloader.download(any())).thenThrow(new PreprocessingException("image download failed: HTTP 404"));

        mockMvc.perform(post("/ml/detect").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"imageUrl\":\"https://images.example.com/missing.jpg\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_IMAGE"));
        verify(inspectionService, never()).submit(any(), any());
    }
}
