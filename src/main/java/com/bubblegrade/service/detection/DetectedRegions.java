package com.bubblegrade.service.detection;

import com.bubblegrade.model.RegionBoundingBox;
import com.bubblegrade.model.RegionSet;
import java.util.Objects;

/**
 * Outcome of region detection. {@code fallback} is set when no four-cornered document boundary
 * was found and the whole frame was partitioned instead.
 */
public record DetectedRegions(RegionSet regions, RegionBoundingBox boundary, boolean fallback) {

    public DetectedRegions {
        Objects.requireNonNull(regions, "regions");
        Objects.requireNonNull(boundary, "boundary");
    }
}
