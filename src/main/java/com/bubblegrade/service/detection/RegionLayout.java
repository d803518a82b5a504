package com.bubblegrade.service.detection;

import com.bubblegrade.config.GradingProperties;
import com.bubblegrade.config.GradingProperties.LayoutProperties;
import com.bubblegrade.model.RegionBoundingBox;
import com.bubblegrade.model.RegionSet;
import org.springframework.stereotype.Component;

/**
 * Partitions a document boundary into the printed template regions. All offsets are truncated
 * toward zero and every box is clipped to the image, never smaller than one pixel.
 */
@Component
public class RegionLayout {

    private final LayoutProperties layout;

    public RegionLayout(GradingProperties properties) {
        this.layout = properties.layout();
    }

    public RegionSet partition(int x, int y, int width, int height, int imageWidth, int imageHeight) {
        int roiX = x + (int) (layout.marginRatio() * width);
        int roiWidth = (int) (layout.widthRatio() * width);

        int nombreY = y + (int) (layout.nombreTopRatio() * height);
        int nombreHeight = (int) (layout.nombreHeightRatio() * height);

        int curpY = y + (int) (layout.curpTopRatio() * height);
        int curpHeight = (int) (layout.curpHeightRatio() * height);

        int omrY = y + (int) (layout.omrTopRatio() * height);
        int omrHeight = height - (omrY - y);

        return new RegionSet(
                clip(roiX, omrY, roiWidth, omrHeight, imageWidth, imageHeight),
                clip(roiX, nombreY, roiWidth, nombreHeight, imageWidth, imageHeight),
                clip(roiX, curpY, roiWidth, curpHeight, imageWidth, imageHeight));
    }

    static RegionBoundingBox clip(int x, int y, int width, int height, int imageWidth, int imageHeight) {
        int clippedX = Math.min(Math.max(x, 0), Math.max(imageWidth - 1, 0));
        int clippedY = Math.min(Math.max(y, 0), Math.max(imageHeight - 1, 0));
        int clippedWidth = Math.max(1, Math.min(width, imageWidth - clippedX));
        int clippedHeight = Math.max(1, Math.min(height, imageHeight - clippedY));
        return new RegionBoundingBox(clippedX, clippedY, clippedWidth, clippedHeight);
    }
}
