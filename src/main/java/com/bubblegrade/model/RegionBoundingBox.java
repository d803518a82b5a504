package com.bubblegrade.model;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Axis-aligned rectangle describing a region of interest inside the enhanced sheet image.
 * Coordinates follow the image pixel grid with the origin located in the top-left corner.
 */
@Schema(description = "Axis-aligned rectangle describing a region of interest")
public record RegionBoundingBox(
        @Schema(description = "X coordinate of the top-left corner", example = "42") int x,
        @Schema(description = "Y coordinate of the top-left corner", example = "128") int y,
        @Schema(description = "Region width in pixels", example = "900") int width,
        @Schema(description = "Region height in pixels", example = "120") int height) {

    public RegionBoundingBox {
        if (x < 0 || y < 0) {
            throw new IllegalArgumentException("Region origin must not be negative");
        }
        if (width <= 0) {
            throw new IllegalArgumentException("Region width must be positive");
        }
        if (height <= 0) {
            throw new IllegalArgumentException("Region height must be positive");
        }
    }

    public boolean fitsWithin(int imageWidth, int imageHeight) {
        return x + width <= imageWidth && y + height <= imageHeight;
    }
}
