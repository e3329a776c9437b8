package com.phillippitts.aerodefect.presentation.controller;

/**
 * JSON body of {@code POST /ml/detect} when the image is referenced by URL.
 *
 * @param imageUrl     absolute http(s) URL of the image
 * @param inspectionId optional caller-supplied id
 */
public record DetectionRequest(String imageUrl, String inspectionId) {
}
