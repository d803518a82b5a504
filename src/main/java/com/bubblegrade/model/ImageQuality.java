package com.bubblegrade.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Image quality metrics of the enhanced sheet")
public record ImageQuality(
        @Schema(description = "Image width in pixels", example = "1240") int width,
        @Schema(description = "Image height in pixels", example = "1754") int height,
        @Schema(description = "Variance of the Laplacian; higher is sharper", example = "412.7") double clarity,
        @Schema(description = "Average angle of near-horizontal lines in degrees", example = "-0.8") double skew) {
}
